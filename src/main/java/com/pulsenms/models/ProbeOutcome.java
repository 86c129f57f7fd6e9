package com.pulsenms.models;

/**
 * Outcome of a single protocol probe.
 * Transient network failures are reported as values, never as exceptions.
 */
public enum ProbeOutcome
{

    SUCCESS,

    TIMEOUT,

    UNREACHABLE,

    NO_SUCH_OBJECT,

    AUTH_ERROR

}
