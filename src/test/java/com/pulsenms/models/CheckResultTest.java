package com.pulsenms.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckResultTest
{

    @Test
    void allProbesSucceedingAveragesLatency()
    {
        var result = CheckResult.aggregate(PingResult.success(2.0, 0), SnmpResult.success("123", 4.0));

        assertTrue(result.isSuccess());

        assertEquals(3.0, result.getLatencyMs());

        assertEquals(0.0, result.getPacketLossPercent());

        assertEquals("check succeeded", result.getReason());
    }

    @Test
    void anyFailingProbeFailsTheCheck()
    {
        var result = CheckResult.aggregate(PingResult.success(2.0, 0), SnmpResult.failure(ProbeOutcome.AUTH_ERROR));

        assertFalse(result.isSuccess());

        assertNull(result.getLatencyMs());

        assertEquals("snmp auth error", result.getReason());
    }

    @Test
    void reasonsOfAllFailuresAreJoined()
    {
        var result = CheckResult.aggregate(PingResult.failure(ProbeOutcome.TIMEOUT),
            SnmpResult.failure(ProbeOutcome.NO_SUCH_OBJECT));

        assertEquals("ping timeout, snmp no such object", result.getReason());

        assertEquals(100.0, result.getPacketLossPercent());
    }

    @Test
    void snmpOnlyCheckHasNoPacketLoss()
    {
        var result = CheckResult.aggregate(null, SnmpResult.success("42", 7.5));

        assertTrue(result.isSuccess());

        assertNull(result.getPacketLossPercent());

        assertEquals(7.5, result.getLatencyMs());
    }

    @Test
    void guardFailureCarriesReason()
    {
        var result = CheckResult.failure("probe timed out");

        assertFalse(result.isSuccess());

        assertEquals("probe timed out", result.getReason());
    }
}
