package com.pulsenms.models;

import java.util.ArrayList;

import java.util.Locale;

/**
 * Aggregated result of one reachability check of a node.

 * A check succeeds only when every enabled protocol succeeded.
 * Latency is the mean of the successful probes' latencies.
 */
public class CheckResult
{

    private final boolean success;

    private final Double latencyMs;

    private final Double packetLossPercent;

    private final String reason;

    private CheckResult(boolean success, Double latencyMs, Double packetLossPercent, String reason)
    {
        this.success = success;

        this.latencyMs = latencyMs;

        this.packetLossPercent = packetLossPercent;

        this.reason = reason;
    }

    /**
     * Combine the probes that ran during one check.
     *
     * @param ping ICMP result, null when ping monitoring is off
     * @param snmp SNMP result, null when SNMP monitoring is off
     * @return Aggregated check result
     */
    public static CheckResult aggregate(PingResult ping, SnmpResult snmp)
    {
        var failures = new ArrayList<String>();

        var latencySum = 0.0;

        var latencyCount = 0;

        if (ping != null)
        {
            if (ping.isSuccess())
            {
                if (ping.getLatencyMs() != null)
                {
                    latencySum += ping.getLatencyMs();

                    latencyCount++;
                }
            }
            else
            {
                failures.add("ping " + describe(ping.getOutcome()));
            }
        }

        if (snmp != null)
        {
            if (snmp.isSuccess())
            {
                if (snmp.getLatencyMs() != null)
                {
                    latencySum += snmp.getLatencyMs();

                    latencyCount++;
                }
            }
            else
            {
                failures.add("snmp " + describe(snmp.getOutcome()));
            }
        }

        var packetLoss = ping != null ? ping.getPacketLossPercent() : null;

        if (failures.isEmpty())
        {
            var latency = latencyCount > 0 ? latencySum / latencyCount : null;

            return new CheckResult(true, latency, packetLoss, "check succeeded");
        }

        return new CheckResult(false, null, packetLoss, String.join(", ", failures));
    }

    /**
     * A failed check that produced no probe result, e.g. the hard timeout guard fired.
     *
     * @param reason Human readable reason
     * @return Failed check result
     */
    public static CheckResult failure(String reason)
    {
        return new CheckResult(false, null, null, reason);
    }

    private static String describe(ProbeOutcome outcome)
    {
        return outcome.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    public boolean isSuccess()
    {
        return success;
    }

    public Double getLatencyMs()
    {
        return latencyMs;
    }

    public Double getPacketLossPercent()
    {
        return packetLossPercent;
    }

    public String getReason()
    {
        return reason;
    }
}
