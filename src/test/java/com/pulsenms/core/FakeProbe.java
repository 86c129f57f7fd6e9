package com.pulsenms.core;

import com.pulsenms.models.PingResult;

import com.pulsenms.models.ProbeOutcome;

import com.pulsenms.models.SnmpResult;

import java.util.Map;

import java.util.concurrent.ConcurrentHashMap;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted probe: answers from per-address tables, unknown addresses time out.
 */
public class FakeProbe implements ProtocolProbe
{

    private final Map<String, PingResult> pings = new ConcurrentHashMap<>();

    // ip|community|oid -> result
    private final Map<String, SnmpResult> snmp = new ConcurrentHashMap<>();

    private final Map<String, Long> delays = new ConcurrentHashMap<>();

    private final Map<String, AtomicInteger> pingCallsByIp = new ConcurrentHashMap<>();

    private final AtomicInteger pingCalls = new AtomicInteger();

    private final AtomicInteger snmpCalls = new AtomicInteger();

    private volatile long delayMs;

    private volatile boolean unavailable;

    public FakeProbe answerPing(String ip, PingResult result)
    {
        pings.put(ip, result);

        return this;
    }

    public FakeProbe answerSnmp(String ip, String community, String oid, SnmpResult result)
    {
        snmp.put(ip + "|" + community + "|" + oid, result);

        return this;
    }

    public FakeProbe delay(long delayMs)
    {
        this.delayMs = delayMs;

        return this;
    }

    /**
     * Make probes of one address block for the given time.
     */
    public FakeProbe delay(String ip, long delayMs)
    {
        delays.put(ip, delayMs);

        return this;
    }

    public FakeProbe unavailable(boolean unavailable)
    {
        this.unavailable = unavailable;

        return this;
    }

    @Override
    public PingResult ping(String ip, int timeoutMs, int count)
    {
        pingCalls.incrementAndGet();

        pingCallsByIp.computeIfAbsent(ip, key -> new AtomicInteger()).incrementAndGet();

        pause(ip);

        if (unavailable)
        {
            throw new ProbeUnavailableException("fping not installed", null);
        }

        return pings.getOrDefault(ip, PingResult.failure(ProbeOutcome.TIMEOUT));
    }

    @Override
    public SnmpResult snmpGet(String ip, int port, String community, String oid, int timeoutMs)
    {
        snmpCalls.incrementAndGet();

        pause(ip);

        return snmp.getOrDefault(ip + "|" + community + "|" + oid, SnmpResult.failure(ProbeOutcome.TIMEOUT));
    }

    private void pause(String ip)
    {
        var delayMs = delays.getOrDefault(ip, this.delayMs);

        if (delayMs <= 0)
        {
            return;
        }

        try
        {
            Thread.sleep(delayMs);
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
        }
    }

    public int pingCalls()
    {
        return pingCalls.get();
    }

    public int pingCalls(String ip)
    {
        var calls = pingCallsByIp.get(ip);

        return calls != null ? calls.get() : 0;
    }

    public int snmpCalls()
    {
        return snmpCalls.get();
    }
}
