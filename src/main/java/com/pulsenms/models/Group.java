package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

/**
 * Monitoring group. Supplies the defaults its nodes inherit.

 * Data Source: groups table
 */
public class Group
{

    public static final int DEFAULT_INTERVAL_SECONDS = 60;

    public static final int DEFAULT_PACKET_COUNT = 1;

    public static final String DEFAULT_COMMUNITY = "public";

    public static final int DEFAULT_SNMP_PORT = 161;

    private int id;

    private String name;

    private int intervalSeconds = DEFAULT_INTERVAL_SECONDS;

    private int packetCount = DEFAULT_PACKET_COUNT;

    private String snmpCommunity = DEFAULT_COMMUNITY;

    private int snmpPort = DEFAULT_SNMP_PORT;

    private boolean enabled = true;

    private boolean monitorPing = true;

    private boolean monitorSnmp = false;

    private Integer maxRetries;

    public int getId()
    {
        return id;
    }

    public Group setId(int id)
    {
        this.id = id;

        return this;
    }

    public String getName()
    {
        return name;
    }

    public Group setName(String name)
    {
        this.name = name;

        return this;
    }

    public int getIntervalSeconds()
    {
        return intervalSeconds;
    }

    public Group setIntervalSeconds(int intervalSeconds)
    {
        this.intervalSeconds = intervalSeconds;

        return this;
    }

    public int getPacketCount()
    {
        return packetCount;
    }

    public Group setPacketCount(int packetCount)
    {
        this.packetCount = packetCount;

        return this;
    }

    public String getSnmpCommunity()
    {
        return snmpCommunity;
    }

    public Group setSnmpCommunity(String snmpCommunity)
    {
        this.snmpCommunity = snmpCommunity;

        return this;
    }

    public int getSnmpPort()
    {
        return snmpPort;
    }

    public Group setSnmpPort(int snmpPort)
    {
        this.snmpPort = snmpPort;

        return this;
    }

    public boolean isEnabled()
    {
        return enabled;
    }

    public Group setEnabled(boolean enabled)
    {
        this.enabled = enabled;

        return this;
    }

    public boolean isMonitorPing()
    {
        return monitorPing;
    }

    public Group setMonitorPing(boolean monitorPing)
    {
        this.monitorPing = monitorPing;

        return this;
    }

    public boolean isMonitorSnmp()
    {
        return monitorSnmp;
    }

    public Group setMonitorSnmp(boolean monitorSnmp)
    {
        this.monitorSnmp = monitorSnmp;

        return this;
    }

    public Integer getMaxRetries()
    {
        return maxRetries;
    }

    public Group setMaxRetries(Integer maxRetries)
    {
        this.maxRetries = maxRetries;

        return this;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("name", name)
            .put("interval", intervalSeconds)
            .put("packet_count", packetCount)
            .put("snmp_community", snmpCommunity)
            .put("snmp_port", snmpPort)
            .put("enabled", enabled)
            .put("monitor_ping", monitorPing)
            .put("monitor_snmp", monitorSnmp)
            .put("max_retries", maxRetries);
    }
}
