package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * One collected metric value. Rate is set only for counters with a usable previous sample.
 */
public class MetricSample
{

    private final int nodeId;

    private final int nodeMetricId;

    private final int definitionId;

    private final Integer interfaceIndex;

    private final double value;

    private final Double rate;

    private final Instant timestamp;

    public MetricSample(int nodeId, int nodeMetricId, int definitionId, Integer interfaceIndex,
                        double value, Double rate, Instant timestamp)
    {
        this.nodeId = nodeId;

        this.nodeMetricId = nodeMetricId;

        this.definitionId = definitionId;

        this.interfaceIndex = interfaceIndex;

        this.value = value;

        this.rate = rate;

        this.timestamp = timestamp;
    }

    public int getNodeId()
    {
        return nodeId;
    }

    public int getNodeMetricId()
    {
        return nodeMetricId;
    }

    public int getDefinitionId()
    {
        return definitionId;
    }

    public Integer getInterfaceIndex()
    {
        return interfaceIndex;
    }

    public double getValue()
    {
        return value;
    }

    public Double getRate()
    {
        return rate;
    }

    public Instant getTimestamp()
    {
        return timestamp;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("node_id", nodeId)
            .put("node_metric_id", nodeMetricId)
            .put("metric_definition_id", definitionId)
            .put("interface_index", interfaceIndex)
            .put("value", value)
            .put("rate", rate)
            .put("timestamp", timestamp.toString());
    }
}
