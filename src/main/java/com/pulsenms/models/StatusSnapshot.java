package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

import java.util.Collections;

import java.util.Map;

/**
 * Immutable copy of a StatusRecord taken under its lock.
 */
public class StatusSnapshot
{

    private final int nodeId;

    private final NodeStatus status;

    private final NodeStatus statusBeforePause;

    private final int consecutiveFailures;

    private final Double latencyMs;

    private final Double packetLossPercent;

    private final Instant lastCheckAt;

    private final Instant statusSince;

    private final Map<String, MetricSample> lastSamples;

    private final Map<String, BreachLevel> breachLevels;

    StatusSnapshot(int nodeId, NodeStatus status, NodeStatus statusBeforePause, int consecutiveFailures,
                   Double latencyMs, Double packetLossPercent, Instant lastCheckAt, Instant statusSince,
                   Map<String, MetricSample> lastSamples, Map<String, BreachLevel> breachLevels)
    {
        this.nodeId = nodeId;

        this.status = status;

        this.statusBeforePause = statusBeforePause;

        this.consecutiveFailures = consecutiveFailures;

        this.latencyMs = latencyMs;

        this.packetLossPercent = packetLossPercent;

        this.lastCheckAt = lastCheckAt;

        this.statusSince = statusSince;

        this.lastSamples = Collections.unmodifiableMap(lastSamples);

        this.breachLevels = Collections.unmodifiableMap(breachLevels);
    }

    public int getNodeId()
    {
        return nodeId;
    }

    public NodeStatus getStatus()
    {
        return status;
    }

    public NodeStatus getStatusBeforePause()
    {
        return statusBeforePause;
    }

    public int getConsecutiveFailures()
    {
        return consecutiveFailures;
    }

    public Double getLatencyMs()
    {
        return latencyMs;
    }

    public Double getPacketLossPercent()
    {
        return packetLossPercent;
    }

    public Instant getLastCheckAt()
    {
        return lastCheckAt;
    }

    public Instant getStatusSince()
    {
        return statusSince;
    }

    public Map<String, MetricSample> getLastSamples()
    {
        return lastSamples;
    }

    public Map<String, BreachLevel> getBreachLevels()
    {
        return breachLevels;
    }

    public JsonObject toJson()
    {
        var metrics = new JsonObject();

        lastSamples.forEach((key, sample) -> metrics.put(key, new JsonObject()
            .put("value", sample.getValue())
            .put("rate", sample.getRate())
            .put("timestamp", sample.getTimestamp().toString())
            .put("breach", breachLevels.getOrDefault(key, BreachLevel.NORMAL).name())));

        return new JsonObject()
            .put("node_id", nodeId)
            .put("status", status.name())
            .put("status_before_pause", statusBeforePause != null ? statusBeforePause.name() : null)
            .put("consecutive_failures", consecutiveFailures)
            .put("latency_ms", latencyMs)
            .put("packet_loss", packetLossPercent)
            .put("last_check", lastCheckAt != null ? lastCheckAt.toString() : null)
            .put("status_since", statusSince != null ? statusSince.toString() : null)
            .put("metrics", metrics);
    }
}
