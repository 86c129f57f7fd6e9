package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

/**
 * One responding host found by a discovery scan.
 */
public class DiscoveryResult
{

    private String ip;

    private String hostname;

    private Double latencyMs;         // null when ICMP was not used or did not answer

    private String vendor = "Unknown";

    private String deviceType = "Device";

    private boolean snmpEnabled;

    private String community;         // Community that answered, null when SNMP did not answer

    private String sysDescr;

    public String getIp()
    {
        return ip;
    }

    public DiscoveryResult setIp(String ip)
    {
        this.ip = ip;

        return this;
    }

    public String getHostname()
    {
        return hostname;
    }

    public DiscoveryResult setHostname(String hostname)
    {
        this.hostname = hostname;

        return this;
    }

    public Double getLatencyMs()
    {
        return latencyMs;
    }

    public DiscoveryResult setLatencyMs(Double latencyMs)
    {
        this.latencyMs = latencyMs;

        return this;
    }

    public boolean answeredIcmp()
    {
        return latencyMs != null;
    }

    public String getVendor()
    {
        return vendor;
    }

    public DiscoveryResult setVendor(String vendor)
    {
        this.vendor = vendor;

        return this;
    }

    public String getDeviceType()
    {
        return deviceType;
    }

    public DiscoveryResult setDeviceType(String deviceType)
    {
        this.deviceType = deviceType;

        return this;
    }

    public boolean isSnmpEnabled()
    {
        return snmpEnabled;
    }

    public DiscoveryResult setSnmpEnabled(boolean snmpEnabled)
    {
        this.snmpEnabled = snmpEnabled;

        return this;
    }

    public String getCommunity()
    {
        return community;
    }

    public DiscoveryResult setCommunity(String community)
    {
        this.community = community;

        return this;
    }

    public String getSysDescr()
    {
        return sysDescr;
    }

    public DiscoveryResult setSysDescr(String sysDescr)
    {
        this.sysDescr = sysDescr;

        return this;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("ip", ip)
            .put("hostname", hostname)
            .put("latency", latencyMs)
            .put("vendor", vendor)
            .put("device_type", deviceType)
            .put("snmp_enabled", snmpEnabled)
            .put("community", community)
            .put("sys_descr", sysDescr);
    }

    public static DiscoveryResult fromJson(JsonObject json)
    {
        return new DiscoveryResult()
            .setIp(json.getString("ip"))
            .setHostname(json.getString("hostname"))
            .setLatencyMs(json.getDouble("latency"))
            .setVendor(json.getString("vendor", "Unknown"))
            .setDeviceType(json.getString("device_type", "Device"))
            .setSnmpEnabled(json.getBoolean("snmp_enabled", false))
            .setCommunity(json.getString("community"))
            .setSysDescr(json.getString("sys_descr"));
    }
}
