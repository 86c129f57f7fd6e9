package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

/**
 * Monitored device.

 * Optional fields override the owning group's values. Effective values are resolved
 * at read time through the effective*() methods and never copied into storage, so a
 * group change reaches every node that does not override it.

 * Data Source: nodes table
 */
public class Node
{

    private int id;

    private String name;

    private String ip;

    private int groupId;

    // Overrides (null = inherit from group)
    private Integer intervalSeconds;

    private Integer packetCount;

    private Integer maxRetries;

    private String snmpCommunity;

    private Integer snmpPort;

    private Boolean monitorPing;

    private Boolean monitorSnmp;

    private boolean enabled = true;

    private Integer notificationPriority;

    /**
     * Copy used when a node must be modified without touching the cached instance.
     *
     * @return Field-by-field copy
     */
    public Node copy()
    {
        return new Node()
            .setId(id)
            .setName(name)
            .setIp(ip)
            .setGroupId(groupId)
            .setIntervalSeconds(intervalSeconds)
            .setPacketCount(packetCount)
            .setMaxRetries(maxRetries)
            .setSnmpCommunity(snmpCommunity)
            .setSnmpPort(snmpPort)
            .setMonitorPing(monitorPing)
            .setMonitorSnmp(monitorSnmp)
            .setEnabled(enabled)
            .setNotificationPriority(notificationPriority);
    }

    // ===== EFFECTIVE SETTINGS =====

    public int effectiveInterval(Group group)
    {
        var interval = intervalSeconds != null ? intervalSeconds : group.getIntervalSeconds();

        return Math.max(1, interval);
    }

    public int effectivePacketCount(Group group)
    {
        var count = packetCount != null ? packetCount : group.getPacketCount();

        return Math.max(1, count);
    }

    public String effectiveCommunity(Group group)
    {
        return snmpCommunity != null && !snmpCommunity.isEmpty() ? snmpCommunity : group.getSnmpCommunity();
    }

    public int effectiveSnmpPort(Group group)
    {
        return snmpPort != null ? snmpPort : group.getSnmpPort();
    }

    public boolean effectiveMonitorPing(Group group)
    {
        return monitorPing != null ? monitorPing : group.isMonitorPing();
    }

    public boolean effectiveMonitorSnmp(Group group)
    {
        return monitorSnmp != null ? monitorSnmp : group.isMonitorSnmp();
    }

    /**
     * Max retries precedence: node override, then group override, then the deployment default.
     *
     * @param group Owning group
     * @param deploymentDefault Configured default
     * @return Failure count at which the node goes DOWN (at least 1)
     */
    public int effectiveMaxRetries(Group group, int deploymentDefault)
    {
        var retries = maxRetries != null ? maxRetries
            : group.getMaxRetries() != null ? group.getMaxRetries() : deploymentDefault;

        return Math.max(1, retries);
    }

    /**
     * A node is monitored only when both it and its group are enabled.
     *
     * @param group Owning group
     * @return true when checks should run
     */
    public boolean isActive(Group group)
    {
        return enabled && group.isEnabled();
    }

    // ===== ACCESSORS =====

    public int getId()
    {
        return id;
    }

    public Node setId(int id)
    {
        this.id = id;

        return this;
    }

    public String getName()
    {
        return name;
    }

    public Node setName(String name)
    {
        this.name = name;

        return this;
    }

    public String getIp()
    {
        return ip;
    }

    public Node setIp(String ip)
    {
        this.ip = ip;

        return this;
    }

    public int getGroupId()
    {
        return groupId;
    }

    public Node setGroupId(int groupId)
    {
        this.groupId = groupId;

        return this;
    }

    public Integer getIntervalSeconds()
    {
        return intervalSeconds;
    }

    public Node setIntervalSeconds(Integer intervalSeconds)
    {
        this.intervalSeconds = intervalSeconds;

        return this;
    }

    public Integer getPacketCount()
    {
        return packetCount;
    }

    public Node setPacketCount(Integer packetCount)
    {
        this.packetCount = packetCount;

        return this;
    }

    public Integer getMaxRetries()
    {
        return maxRetries;
    }

    public Node setMaxRetries(Integer maxRetries)
    {
        this.maxRetries = maxRetries;

        return this;
    }

    public String getSnmpCommunity()
    {
        return snmpCommunity;
    }

    public Node setSnmpCommunity(String snmpCommunity)
    {
        this.snmpCommunity = snmpCommunity;

        return this;
    }

    public Integer getSnmpPort()
    {
        return snmpPort;
    }

    public Node setSnmpPort(Integer snmpPort)
    {
        this.snmpPort = snmpPort;

        return this;
    }

    public Boolean getMonitorPing()
    {
        return monitorPing;
    }

    public Node setMonitorPing(Boolean monitorPing)
    {
        this.monitorPing = monitorPing;

        return this;
    }

    public Boolean getMonitorSnmp()
    {
        return monitorSnmp;
    }

    public Node setMonitorSnmp(Boolean monitorSnmp)
    {
        this.monitorSnmp = monitorSnmp;

        return this;
    }

    public boolean isEnabled()
    {
        return enabled;
    }

    public Node setEnabled(boolean enabled)
    {
        this.enabled = enabled;

        return this;
    }

    public Integer getNotificationPriority()
    {
        return notificationPriority;
    }

    public Node setNotificationPriority(Integer notificationPriority)
    {
        this.notificationPriority = notificationPriority;

        return this;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("name", name)
            .put("ip", ip)
            .put("group_id", groupId)
            .put("interval", intervalSeconds)
            .put("packet_count", packetCount)
            .put("max_retries", maxRetries)
            .put("snmp_community", snmpCommunity)
            .put("snmp_port", snmpPort)
            .put("monitor_ping", monitorPing)
            .put("monitor_snmp", monitorSnmp)
            .put("enabled", enabled)
            .put("notification_priority", notificationPriority);
    }
}
