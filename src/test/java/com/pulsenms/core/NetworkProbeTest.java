package com.pulsenms.core;

import com.pulsenms.models.ProbeOutcome;

import org.junit.jupiter.api.Test;

import org.snmp4j.smi.Counter32;

import org.snmp4j.smi.Counter64;

import org.snmp4j.smi.OctetString;

import org.snmp4j.smi.TimeTicks;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertThrows;

import static org.junit.jupiter.api.Assertions.assertTrue;

class NetworkProbeTest
{

    @Test
    void parsesSuccessfulSummary()
    {
        var result = NetworkProbe.parseFpingSummary(
            "10.0.0.1 : xmt/rcv/%loss = 3/3/0%, min/avg/max = 0.41/0.52/0.70\n");

        assertTrue(result.isSuccess());

        assertEquals(0.52, result.getLatencyMs());

        assertEquals(0.0, result.getPacketLossPercent());
    }

    @Test
    void partialLossIsStillReachable()
    {
        var result = NetworkProbe.parseFpingSummary("10.0.0.1 : xmt/rcv/%loss = 4/3/25%, min/avg/max = 1.0/2.5/4.0");

        assertTrue(result.isSuccess());

        assertEquals(25.0, result.getPacketLossPercent());
    }

    @Test
    void noRepliesIsTimeout()
    {
        var result = NetworkProbe.parseFpingSummary("10.0.0.9 : xmt/rcv/%loss = 3/0/100%");

        assertFalse(result.isSuccess());

        assertEquals(ProbeOutcome.TIMEOUT, result.getOutcome());

        assertEquals(100.0, result.getPacketLossPercent());
    }

    @Test
    void missingSummaryIsUnreachable()
    {
        var result = NetworkProbe.parseFpingSummary("nosuchhost: Name or service not known\n");

        assertEquals(ProbeOutcome.UNREACHABLE, result.getOutcome());
    }

    @Test
    void missingExecutableIsReportedAsUnavailable()
    {
        var probe = new NetworkProbe("/nonexistent/bin/fping");

        try
        {
            assertThrows(ProbeUnavailableException.class, () -> probe.ping("127.0.0.1", 500, 1));

            // Reported every time, logged once
            assertThrows(ProbeUnavailableException.class, () -> probe.ping("127.0.0.1", 500, 1));
        }
        finally
        {
            probe.close();
        }
    }

    @Test
    void counter64AboveSignedRangeRendersUnsigned()
    {
        // 2^64 - 16, wrapped HC octet counter near its limit
        assertEquals("18446744073709551600", NetworkProbe.render(new Counter64(-16L)));

        assertEquals("42", NetworkProbe.render(new Counter64(42L)));
    }

    @Test
    void numericTypesRenderAsPlainNumbers()
    {
        assertEquals("4294967295", NetworkProbe.render(new Counter32(4294967295L)));

        assertEquals("123456", NetworkProbe.render(new TimeTicks(123456L)));

        assertEquals("eth0", NetworkProbe.render(new OctetString("eth0")));
    }
}
