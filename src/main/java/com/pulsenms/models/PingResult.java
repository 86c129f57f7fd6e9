package com.pulsenms.models;

/**
 * Result of an ICMP probe.
 * Latency is the average round trip of the answered packets, null when nothing answered.
 */
public class PingResult
{

    private final ProbeOutcome outcome;

    private final Double latencyMs;

    private final double packetLossPercent;

    private PingResult(ProbeOutcome outcome, Double latencyMs, double packetLossPercent)
    {
        this.outcome = outcome;

        this.latencyMs = latencyMs;

        this.packetLossPercent = packetLossPercent;
    }

    public static PingResult success(double latencyMs, double packetLossPercent)
    {
        return new PingResult(ProbeOutcome.SUCCESS, latencyMs, packetLossPercent);
    }

    public static PingResult failure(ProbeOutcome outcome)
    {
        return new PingResult(outcome, null, 100.0);
    }

    public boolean isSuccess()
    {
        return outcome == ProbeOutcome.SUCCESS;
    }

    public ProbeOutcome getOutcome()
    {
        return outcome;
    }

    public Double getLatencyMs()
    {
        return latencyMs;
    }

    public double getPacketLossPercent()
    {
        return packetLossPercent;
    }

    @Override
    public String toString()
    {
        return "PingResult{" + outcome + ", latency=" + latencyMs + ", loss=" + packetLossPercent + "%}";
    }
}
