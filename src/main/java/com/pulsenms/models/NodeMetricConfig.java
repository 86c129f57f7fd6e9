package com.pulsenms.models;

/**
 * Binding of a metric definition to a node, optionally for one interface.

 * Unique per (node, definition, interface index).

 * Data Source: node_metrics table
 */
public class NodeMetricConfig
{

    private int id;

    private int nodeId;

    private int definitionId;

    private Integer interfaceIndex;

    private String interfaceName;

    private Integer intervalSeconds;

    private boolean enabled = true;

    private AlertCondition alertCondition;

    private Double warningThreshold;

    private Double criticalThreshold;

    /**
     * Key under which samples and breach levels are tracked for this binding.
     *
     * @return "definitionId" or "definitionId:index"
     */
    public String key()
    {
        return interfaceIndex == null ? String.valueOf(definitionId) : definitionId + ":" + interfaceIndex;
    }

    public boolean hasThresholds()
    {
        return alertCondition != null && (warningThreshold != null || criticalThreshold != null);
    }

    /**
     * Collection interval, falling back to the node's effective interval.
     *
     * @param nodeInterval Node effective interval in seconds
     * @return Interval in seconds
     */
    public int effectiveInterval(int nodeInterval)
    {
        return intervalSeconds != null && intervalSeconds > 0 ? intervalSeconds : nodeInterval;
    }

    public int getId()
    {
        return id;
    }

    public NodeMetricConfig setId(int id)
    {
        this.id = id;

        return this;
    }

    public int getNodeId()
    {
        return nodeId;
    }

    public NodeMetricConfig setNodeId(int nodeId)
    {
        this.nodeId = nodeId;

        return this;
    }

    public int getDefinitionId()
    {
        return definitionId;
    }

    public NodeMetricConfig setDefinitionId(int definitionId)
    {
        this.definitionId = definitionId;

        return this;
    }

    public Integer getInterfaceIndex()
    {
        return interfaceIndex;
    }

    public NodeMetricConfig setInterfaceIndex(Integer interfaceIndex)
    {
        this.interfaceIndex = interfaceIndex;

        return this;
    }

    public String getInterfaceName()
    {
        return interfaceName;
    }

    public NodeMetricConfig setInterfaceName(String interfaceName)
    {
        this.interfaceName = interfaceName;

        return this;
    }

    public Integer getIntervalSeconds()
    {
        return intervalSeconds;
    }

    public NodeMetricConfig setIntervalSeconds(Integer intervalSeconds)
    {
        this.intervalSeconds = intervalSeconds;

        return this;
    }

    public boolean isEnabled()
    {
        return enabled;
    }

    public NodeMetricConfig setEnabled(boolean enabled)
    {
        this.enabled = enabled;

        return this;
    }

    public AlertCondition getAlertCondition()
    {
        return alertCondition;
    }

    public NodeMetricConfig setAlertCondition(AlertCondition alertCondition)
    {
        this.alertCondition = alertCondition;

        return this;
    }

    public Double getWarningThreshold()
    {
        return warningThreshold;
    }

    public NodeMetricConfig setWarningThreshold(Double warningThreshold)
    {
        this.warningThreshold = warningThreshold;

        return this;
    }

    public Double getCriticalThreshold()
    {
        return criticalThreshold;
    }

    public NodeMetricConfig setCriticalThreshold(Double criticalThreshold)
    {
        this.criticalThreshold = criticalThreshold;

        return this;
    }
}
