package com.pulsenms.core;

import com.pulsenms.models.AlertCondition;

import com.pulsenms.models.BreachLevel;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertNull;

class ThresholdEvaluatorTest
{

    @Test
    void greaterThanBreachesAtOrAboveThreshold()
    {
        assertEquals(BreachLevel.NORMAL, ThresholdEvaluator.evaluate(79.9, AlertCondition.GREATER_THAN, 80.0, 90.0, null));

        assertEquals(BreachLevel.WARNING, ThresholdEvaluator.evaluate(80, AlertCondition.GREATER_THAN, 80.0, 90.0, null));

        assertEquals(BreachLevel.CRITICAL, ThresholdEvaluator.evaluate(95, AlertCondition.GREATER_THAN, 80.0, 90.0, null));
    }

    @Test
    void lessThanBreachesAtOrBelowThreshold()
    {
        assertEquals(BreachLevel.NORMAL, ThresholdEvaluator.evaluate(25, AlertCondition.LESS_THAN, 20.0, 10.0, null));

        assertEquals(BreachLevel.WARNING, ThresholdEvaluator.evaluate(20, AlertCondition.LESS_THAN, 20.0, 10.0, null));

        assertEquals(BreachLevel.CRITICAL, ThresholdEvaluator.evaluate(5, AlertCondition.LESS_THAN, 20.0, 10.0, null));
    }

    @Test
    void breachedLevelIsKeptWithinHysteresisBand()
    {
        // 5% of 80 is 4: WARNING holds down to 76
        assertEquals(BreachLevel.WARNING,
            ThresholdEvaluator.evaluate(77, AlertCondition.GREATER_THAN, 80.0, 90.0, BreachLevel.WARNING));

        assertEquals(BreachLevel.NORMAL,
            ThresholdEvaluator.evaluate(75, AlertCondition.GREATER_THAN, 80.0, 90.0, BreachLevel.WARNING));

        // CRITICAL degrades to WARNING once below 85.5
        assertEquals(BreachLevel.CRITICAL,
            ThresholdEvaluator.evaluate(87, AlertCondition.GREATER_THAN, 80.0, 90.0, BreachLevel.CRITICAL));

        assertEquals(BreachLevel.WARNING,
            ThresholdEvaluator.evaluate(85, AlertCondition.GREATER_THAN, 80.0, 90.0, BreachLevel.CRITICAL));
    }

    @Test
    void missingConditionOrThresholdsNeverBreach()
    {
        assertEquals(BreachLevel.NORMAL, ThresholdEvaluator.evaluate(1e9, null, 80.0, 90.0, BreachLevel.CRITICAL));

        assertEquals(BreachLevel.NORMAL, ThresholdEvaluator.evaluate(1e9, AlertCondition.GREATER_THAN, null, null, null));

        assertEquals(BreachLevel.CRITICAL, ThresholdEvaluator.evaluate(95, AlertCondition.GREATER_THAN, null, 90.0, null));
    }

    @Test
    void thresholdForMatchesLevel()
    {
        assertEquals(90.0, ThresholdEvaluator.thresholdFor(BreachLevel.CRITICAL, 80.0, 90.0));

        assertEquals(80.0, ThresholdEvaluator.thresholdFor(BreachLevel.WARNING, 80.0, 90.0));

        assertEquals(90.0, ThresholdEvaluator.thresholdFor(BreachLevel.NORMAL, null, 90.0));

        assertNull(ThresholdEvaluator.thresholdFor(BreachLevel.NORMAL, null, null));
    }
}
