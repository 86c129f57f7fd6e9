package com.pulsenms.models;

/**
 * Result of a single SNMP GET.
 */
public class SnmpResult
{

    private final ProbeOutcome outcome;

    private final String value;

    private final Double latencyMs;

    private SnmpResult(ProbeOutcome outcome, String value, Double latencyMs)
    {
        this.outcome = outcome;

        this.value = value;

        this.latencyMs = latencyMs;
    }

    public static SnmpResult success(String value, double latencyMs)
    {
        return new SnmpResult(ProbeOutcome.SUCCESS, value, latencyMs);
    }

    public static SnmpResult failure(ProbeOutcome outcome)
    {
        return new SnmpResult(outcome, null, null);
    }

    public boolean isSuccess()
    {
        return outcome == ProbeOutcome.SUCCESS;
    }

    public ProbeOutcome getOutcome()
    {
        return outcome;
    }

    public String getValue()
    {
        return value;
    }

    public Double getLatencyMs()
    {
        return latencyMs;
    }

    /**
     * Numeric view of the returned value.
     *
     * @return Parsed value, or null for non-numeric payloads (strings, OIDs, failures)
     */
    public Double numericValue()
    {
        if (value == null)
        {
            return null;
        }

        try
        {
            return Double.parseDouble(value.trim());
        }
        catch (NumberFormatException exception)
        {
            return null;
        }
    }

    @Override
    public String toString()
    {
        return "SnmpResult{" + outcome + ", value=" + value + "}";
    }
}
