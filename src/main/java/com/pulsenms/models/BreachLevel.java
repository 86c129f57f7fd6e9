package com.pulsenms.models;

/**
 * Threshold breach level of a collected metric, ordered by severity.
 */
public enum BreachLevel
{

    NORMAL,

    WARNING,

    CRITICAL

}
