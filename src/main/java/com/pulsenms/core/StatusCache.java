package com.pulsenms.core;

import com.pulsenms.models.StatusRecord;

import com.pulsenms.models.StatusSnapshot;

import java.time.Clock;

import java.util.ArrayList;

import java.util.Comparator;

import java.util.List;

import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of one StatusRecord per node.

 * Key: node id, Value: live record (written by the node's loops only)
 */
public class StatusCache
{

    private final ConcurrentHashMap<Integer, StatusRecord> records = new ConcurrentHashMap<>();

    private final Clock clock;

    public StatusCache(Clock clock)
    {
        this.clock = clock;
    }

    /**
     * Record of a node, created in WAITING on first access.
     *
     * @param nodeId Node id
     * @return Live record
     */
    public StatusRecord record(int nodeId)
    {
        return records.computeIfAbsent(nodeId, id -> new StatusRecord(id, clock.instant()));
    }

    public StatusRecord find(int nodeId)
    {
        return records.get(nodeId);
    }

    public void remove(int nodeId)
    {
        records.remove(nodeId);
    }

    public StatusSnapshot snapshot(int nodeId)
    {
        var record = records.get(nodeId);

        return record != null ? record.snapshot() : null;
    }

    /**
     * Consistent per-node snapshots of every tracked node, ordered by node id.
     *
     * @return Snapshots
     */
    public List<StatusSnapshot> snapshots()
    {
        var snapshots = new ArrayList<StatusSnapshot>();

        records.values().forEach(record -> snapshots.add(record.snapshot()));

        snapshots.sort(Comparator.comparingInt(StatusSnapshot::getNodeId));

        return snapshots;
    }

    public int size()
    {
        return records.size();
    }
}
