package com.pulsenms.models;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

import java.util.Collections;

import java.util.List;

import java.util.Set;

/**
 * Point-in-time view of a discovery scan. Scanned only ever grows during a scan.
 */
public class DiscoveryProgress
{

    private final boolean running;

    private final String target;

    private final Set<DiscoveryProtocol> protocols;

    private final int scanned;

    private final int total;

    private final int icmpFound;

    private final int snmpFound;

    private final List<DiscoveryResult> results;

    private final Instant startedAt;

    private final Instant finishedAt;

    private final String error;

    public DiscoveryProgress(boolean running, String target, Set<DiscoveryProtocol> protocols, int scanned, int total,
                             int icmpFound, int snmpFound, List<DiscoveryResult> results, Instant startedAt,
                             Instant finishedAt, String error)
    {
        this.running = running;

        this.target = target;

        this.protocols = protocols != null ? Collections.unmodifiableSet(protocols) : Collections.emptySet();

        this.scanned = scanned;

        this.total = total;

        this.icmpFound = icmpFound;

        this.snmpFound = snmpFound;

        this.results = Collections.unmodifiableList(results);

        this.startedAt = startedAt;

        this.finishedAt = finishedAt;

        this.error = error;
    }

    public static DiscoveryProgress idle()
    {
        return new DiscoveryProgress(false, null, null, 0, 0, 0, 0, List.of(), null, null, null);
    }

    public boolean isRunning()
    {
        return running;
    }

    public String getTarget()
    {
        return target;
    }

    public Set<DiscoveryProtocol> getProtocols()
    {
        return protocols;
    }

    public int getScanned()
    {
        return scanned;
    }

    public int getTotal()
    {
        return total;
    }

    public int getIcmpFound()
    {
        return icmpFound;
    }

    public int getSnmpFound()
    {
        return snmpFound;
    }

    public List<DiscoveryResult> getResults()
    {
        return results;
    }

    public Instant getStartedAt()
    {
        return startedAt;
    }

    public Instant getFinishedAt()
    {
        return finishedAt;
    }

    public String getError()
    {
        return error;
    }

    /**
     * Completion percentage, 0 when no scan ran yet.
     *
     * @return 0 to 100
     */
    public int percent()
    {
        return total == 0 ? 0 : (int) Math.round(scanned * 100.0 / total);
    }

    public JsonObject toJson()
    {
        var protocolNames = new JsonArray();

        protocols.forEach(protocol -> protocolNames.add(protocol.name().toLowerCase()));

        var resultArray = new JsonArray();

        results.forEach(result -> resultArray.add(result.toJson()));

        return new JsonObject()
            .put("running", running)
            .put("target", target)
            .put("protocols", protocolNames)
            .put("progress", percent())
            .put("scanned", scanned)
            .put("total", total)
            .put("stats", new JsonObject()
                .put("scanned", scanned)
                .put("icmp_found", icmpFound)
                .put("snmp_found", snmpFound))
            .put("results", resultArray)
            .put("started_at", startedAt != null ? startedAt.toString() : null)
            .put("finished_at", finishedAt != null ? finishedAt.toString() : null)
            .put("error", error);
    }
}
