package com.pulsenms.models;

/**
 * What the alert throttler did with an alert candidate.
 */
public enum AlertDecision
{

    SENT,                       // Individual notification sent

    AGGREGATED,                 // Storm onset: one aggregated notification sent

    SUPPRESSED_STORM,           // Storm mode active

    SUPPRESSED_MAINTENANCE,     // Maintenance mode active

    SUPPRESSED_COOLDOWN,        // Same metric notified too recently

    IGNORED                     // Not an alert candidate

}
