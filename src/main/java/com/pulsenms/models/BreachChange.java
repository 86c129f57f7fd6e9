package com.pulsenms.models;

import java.time.Instant;

/**
 * A metric moved from one breach level to another.
 * Only level changes are reported, never a repeated level.
 */
public class BreachChange
{

    private final int nodeId;

    private final String nodeName;

    private final String nodeIp;

    private final String metricKey;

    private final String metricName;

    private final String unit;

    private final BreachLevel previous;

    private final BreachLevel current;

    private final double value;

    private final Double threshold;

    private final Instant timestamp;

    public BreachChange(int nodeId, String nodeName, String nodeIp, String metricKey, String metricName, String unit,
                        BreachLevel previous, BreachLevel current, double value, Double threshold, Instant timestamp)
    {
        this.nodeId = nodeId;

        this.nodeName = nodeName;

        this.nodeIp = nodeIp;

        this.metricKey = metricKey;

        this.metricName = metricName;

        this.unit = unit;

        this.previous = previous;

        this.current = current;

        this.value = value;

        this.threshold = threshold;

        this.timestamp = timestamp;
    }

    public boolean isResolved()
    {
        return current == BreachLevel.NORMAL;
    }

    public int getNodeId()
    {
        return nodeId;
    }

    public String getNodeName()
    {
        return nodeName;
    }

    public String getNodeIp()
    {
        return nodeIp;
    }

    public String getMetricKey()
    {
        return metricKey;
    }

    public String getMetricName()
    {
        return metricName;
    }

    public String getUnit()
    {
        return unit;
    }

    public BreachLevel getPrevious()
    {
        return previous;
    }

    public BreachLevel getCurrent()
    {
        return current;
    }

    public double getValue()
    {
        return value;
    }

    public Double getThreshold()
    {
        return threshold;
    }

    public Instant getTimestamp()
    {
        return timestamp;
    }
}
