package com.servicedesk.automation.model;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isBelow(Priority other) {
        return ordinal() < other.ordinal();
    }
}
