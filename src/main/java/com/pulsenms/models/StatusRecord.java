package com.pulsenms.models;

import java.time.Instant;

import java.util.HashMap;

import java.util.HashSet;

import java.util.Map;

import java.util.Set;

/**
 * Live monitoring state of one node (in-memory only, lost on restart).

 * Writers: the node's own check and collection loops.
 * Readers: anyone, through snapshot().
 * All access goes through the record's monitor so readers never see a half-applied update.
 */
public class StatusRecord
{

    private final int nodeId;

    private NodeStatus status = NodeStatus.WAITING;

    private NodeStatus statusBeforePause;    // Displayed while PAUSED

    private int consecutiveFailures;

    private Double latencyMs;

    private Double packetLossPercent;

    private Instant lastCheckAt;

    private Instant statusSince;

    private final Map<String, MetricSample> lastSamples = new HashMap<>();

    private final Map<String, BreachLevel> breachLevels = new HashMap<>();

    public StatusRecord(int nodeId, Instant createdAt)
    {
        this.nodeId = nodeId;

        this.statusSince = createdAt;
    }

    public int getNodeId()
    {
        return nodeId;
    }

    public synchronized NodeStatus getStatus()
    {
        return status;
    }

    public synchronized NodeStatus getStatusBeforePause()
    {
        return statusBeforePause;
    }

    public synchronized int getConsecutiveFailures()
    {
        return consecutiveFailures;
    }

    public synchronized Instant getStatusSince()
    {
        return statusSince;
    }

    /**
     * Apply a status transition atomically.
     *
     * @param newStatus Status after the transition
     * @param failures Consecutive failure count after the transition
     * @param latency Last latency, null when the check failed
     * @param packetLoss Last packet loss, null when ping did not run
     * @param checkedAt Check completion time, null for transitions without a check (pause)
     * @param now Current time
     * @return Status before the transition
     */
    public synchronized NodeStatus transition(NodeStatus newStatus, int failures, Double latency, Double packetLoss,
                                              Instant checkedAt, Instant now)
    {
        var previous = status;

        if (newStatus == NodeStatus.PAUSED && previous != NodeStatus.PAUSED)
        {
            statusBeforePause = previous;
        }

        if (newStatus != previous)
        {
            statusSince = now;
        }

        status = newStatus;

        consecutiveFailures = failures;

        if (checkedAt != null)
        {
            latencyMs = latency;

            packetLossPercent = packetLoss;

            lastCheckAt = checkedAt;
        }

        return previous;
    }

    public synchronized MetricSample getLastSample(String metricKey)
    {
        return lastSamples.get(metricKey);
    }

    public synchronized void putSample(String metricKey, MetricSample sample)
    {
        lastSamples.put(metricKey, sample);
    }

    public synchronized BreachLevel getBreachLevel(String metricKey)
    {
        return breachLevels.getOrDefault(metricKey, BreachLevel.NORMAL);
    }

    public synchronized void putBreachLevel(String metricKey, BreachLevel level)
    {
        if (level == BreachLevel.NORMAL)
        {
            breachLevels.remove(metricKey);
        }
        else
        {
            breachLevels.put(metricKey, level);
        }
    }

    public synchronized void clearBreachLevels()
    {
        breachLevels.clear();
    }

    /**
     * Drop samples and breach state of bindings that no longer exist.
     *
     * @param activeKeys Keys of the node's current bindings
     * @return Number of bindings forgotten
     */
    public synchronized int retainMetrics(Set<String> activeKeys)
    {
        var forgotten = new HashSet<String>(lastSamples.keySet());

        forgotten.addAll(breachLevels.keySet());

        forgotten.removeAll(activeKeys);

        lastSamples.keySet().removeAll(forgotten);

        breachLevels.keySet().removeAll(forgotten);

        return forgotten.size();
    }

    public synchronized StatusSnapshot snapshot()
    {
        return new StatusSnapshot(nodeId, status, statusBeforePause, consecutiveFailures, latencyMs, packetLossPercent,
            lastCheckAt, statusSince, new HashMap<>(lastSamples), new HashMap<>(breachLevels));
    }
}
