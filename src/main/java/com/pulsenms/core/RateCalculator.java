package com.pulsenms.core;

import com.pulsenms.models.MetricSample;

import java.time.Duration;

import java.time.Instant;

/**
 * Per-second rate derivation for counter metrics.

 * rate = (value - previous) / elapsedSeconds, multiplied by 8 for "bytes" counters (bits per second).
 * No rate is produced for the first sample, a counter decrease (wrap or device reset),
 * or a non-positive elapsed time.
 */
public class RateCalculator
{

    /**
     * @param previous Previous sample of the same binding, may be null
     * @param value New raw counter value
     * @param now Time of the new sample
     * @param unit Definition unit
     * @return Rate, or null when none can be derived
     */
    public static Double rate(MetricSample previous, double value, Instant now, String unit)
    {
        if (previous == null)
        {
            return null;
        }

        var delta = value - previous.getValue();

        if (delta < 0)
        {
            return null;
        }

        var elapsedSeconds = Duration.between(previous.getTimestamp(), now).toMillis() / 1000.0;

        if (elapsedSeconds <= 0)
        {
            return null;
        }

        var rate = delta / elapsedSeconds;

        return isBytes(unit) ? rate * 8 : rate;
    }

    /**
     * Unit reported for a rate derived from a counter with the given unit.
     *
     * @param unit Definition unit
     * @return "bps" for byte counters, "unit/s" otherwise
     */
    public static String rateUnit(String unit)
    {
        if (isBytes(unit))
        {
            return "bps";
        }

        return (unit == null || unit.isBlank() ? "" : unit) + "/s";
    }

    private static boolean isBytes(String unit)
    {
        return "bytes".equalsIgnoreCase(unit);
    }
}
