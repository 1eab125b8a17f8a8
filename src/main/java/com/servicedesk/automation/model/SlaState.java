package com.servicedesk.automation.model;

/**
 * SLA standing of a ticket at a given instant.
 * MET applies to closed tickets that never breached.
 */
public enum SlaState {
    ON_TRACK,
    WARNING,
    BREACHED,
    MET
}
