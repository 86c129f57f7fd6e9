package com.pulsenms.core;

import com.pulsenms.models.AlertCondition;

import com.pulsenms.models.BreachLevel;

/**
 * Threshold breach evaluation with hysteresis.

 * - gt: breached when value &gt;= threshold
 * - lt: breached when value &lt;= threshold
 * - critical takes precedence over warning
 * - a level is only left once the value moves 5% past its threshold, so a value
 *   oscillating around a threshold does not flap
 */
public class ThresholdEvaluator
{

    public static final double HYSTERESIS = 0.05;

    /**
     * @param value Rate for counters, raw value for gauges
     * @param condition Comparison direction, null disables evaluation
     * @param warning Warning threshold, may be null
     * @param critical Critical threshold, may be null
     * @param previous Level before this sample
     * @return New level
     */
    public static BreachLevel evaluate(double value, AlertCondition condition, Double warning, Double critical,
                                       BreachLevel previous)
    {
        if (condition == null)
        {
            return BreachLevel.NORMAL;
        }

        var prior = previous != null ? previous : BreachLevel.NORMAL;

        if (critical != null && holds(value, condition, critical, prior == BreachLevel.CRITICAL))
        {
            return BreachLevel.CRITICAL;
        }

        if (warning != null && holds(value, condition, warning, prior != BreachLevel.NORMAL))
        {
            return BreachLevel.WARNING;
        }

        return BreachLevel.NORMAL;
    }

    /**
     * The threshold the current level refers to, used in alert messages.
     *
     * @param level Breach level
     * @param warning Warning threshold
     * @param critical Critical threshold
     * @return Threshold or null
     */
    public static Double thresholdFor(BreachLevel level, Double warning, Double critical)
    {
        switch (level)
        {
            case CRITICAL:
                return critical;

            case WARNING:
                return warning;

            default:
                return warning != null ? warning : critical;
        }
    }

    private static boolean holds(double value, AlertCondition condition, double threshold, boolean alreadyBreached)
    {
        var margin = alreadyBreached ? Math.abs(threshold) * HYSTERESIS : 0.0;

        if (condition == AlertCondition.GREATER_THAN)
        {
            return value >= threshold - margin;
        }

        return value <= threshold + margin;
    }
}
