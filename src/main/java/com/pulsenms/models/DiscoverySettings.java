package com.pulsenms.models;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;

import java.util.List;

/**
 * Discovery settings from the "discovery" block of application.conf.
 */
public class DiscoverySettings
{

    private final int concurrency;

    private final int icmpTimeoutMs;

    private final int snmpTimeoutMs;

    private final List<String> communities;

    public DiscoverySettings(int concurrency, int icmpTimeoutMs, int snmpTimeoutMs, List<String> communities)
    {
        this.concurrency = Math.max(1, concurrency);

        this.icmpTimeoutMs = icmpTimeoutMs;

        this.snmpTimeoutMs = snmpTimeoutMs;

        this.communities = communities == null || communities.isEmpty() ? List.of(Group.DEFAULT_COMMUNITY) : List.copyOf(communities);
    }

    public static DiscoverySettings fromConfig(JsonObject config)
    {
        var discovery = config.getJsonObject("discovery", new JsonObject());

        var concurrency = discovery.getInteger("concurrency", 16);

        var icmpTimeoutMs = discovery.getJsonObject("icmp", new JsonObject())
                .getJsonObject("timeout", new JsonObject())
                .getInteger("ms", 1000);

        var snmpTimeoutMs = discovery.getJsonObject("snmp", new JsonObject())
                .getJsonObject("timeout", new JsonObject())
                .getInteger("ms", 2000);

        return new DiscoverySettings(concurrency, icmpTimeoutMs, snmpTimeoutMs,
            toStringList(discovery.getJsonArray("communities", new JsonArray())));
    }

    /**
     * Non-blank entries of a JSON array as trimmed strings.
     *
     * @param array JSON array, may be null
     * @return String list
     */
    public static List<String> toStringList(JsonArray array)
    {
        var values = new ArrayList<String>();

        if (array != null)
        {
            for (var value : array)
            {
                if (value != null && !value.toString().isBlank())
                {
                    values.add(value.toString().trim());
                }
            }
        }

        return values;
    }

    public int getConcurrency()
    {
        return concurrency;
    }

    public int getIcmpTimeoutMs()
    {
        return icmpTimeoutMs;
    }

    public int getSnmpTimeoutMs()
    {
        return snmpTimeoutMs;
    }

    public List<String> getCommunities()
    {
        return communities;
    }
}
