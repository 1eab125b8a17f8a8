package com.servicedesk.automation.model;

public enum Category {
    ACCESS,
    NETWORK,
    INFRASTRUCTURE,
    EMAIL,
    SOFTWARE,
    HARDWARE,
    OTHER
}
