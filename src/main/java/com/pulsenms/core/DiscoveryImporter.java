package com.pulsenms.core;

import com.pulsenms.models.DiscoveryProtocol;

import com.pulsenms.models.DiscoveryResult;

import com.pulsenms.models.Group;

import com.pulsenms.models.ImportReport;

import com.pulsenms.models.Inventory;

import com.pulsenms.models.Node;

import com.pulsenms.services.NodeStore;

import io.vertx.core.Future;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.HashSet;

import java.util.List;

import java.util.Set;

import java.util.concurrent.atomic.AtomicInteger;

import java.util.function.Supplier;

/**
 * DiscoveryImporter - Smart merge of discovery results into the inventory

 * Merge rules (matched by IP):
 * - New IP: node created in the target group (name = hostname or IP, SNMP monitoring
 *   when SNMP answered, community override only when it differs from the group's)
 * - Existing IP: protocol flags that were confirmed by the scan are switched on, the SNMP
 *   community is filled only when the node has none; name, thresholds and other
 *   overrides are never written, so edits made after the inventory was cached survive
 * - Unchanged nodes and duplicate results count as skipped

 * Results are written one at a time so counts are exact.
 */
public class DiscoveryImporter
{

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryImporter.class);

    private final NodeStore nodeStore;

    private final Supplier<Inventory> inventory;

    /**
     * @param nodeStore Node writes
     * @param inventory Current inventory view
     */
    public DiscoveryImporter(NodeStore nodeStore, Supplier<Inventory> inventory)
    {
        this.nodeStore = nodeStore;

        this.inventory = inventory;
    }

    /**
     * Merge results into the target group.
     *
     * @param groupId Target group for new nodes
     * @param results Discovery results
     * @param protocols Protocols the scan used
     * @return Future containing the import report, failed with IllegalArgumentException for an unknown group
     */
    public Future<ImportReport> importResults(int groupId, List<DiscoveryResult> results, Set<DiscoveryProtocol> protocols)
    {
        var snapshot = inventory.get();

        var targetGroup = snapshot.group(groupId);

        if (targetGroup == null)
        {
            return Future.failedFuture(new IllegalArgumentException("Target group not found: " + groupId));
        }

        var created = new AtomicInteger();

        var updated = new AtomicInteger();

        var seen = new HashSet<String>();

        Future<Void> chain = Future.succeededFuture();

        for (var result : results)
        {
            if (result == null || result.getIp() == null || !seen.add(result.getIp()))
            {
                continue;
            }

            chain = chain.compose(v -> mergeOne(snapshot, targetGroup, result, protocols, created, updated));
        }

        return chain.map(v ->
        {
            var skipped = results.size() - created.get() - updated.get();

            var report = new ImportReport(created.get(), updated.get(), skipped);

            logger.info("Discovery import into group {}: {}", targetGroup.getName(), report);

            return report;
        });
    }

    private Future<Void> mergeOne(Inventory snapshot, Group targetGroup, DiscoveryResult result,
                                  Set<DiscoveryProtocol> protocols, AtomicInteger created, AtomicInteger updated)
    {
        var existing = snapshot.nodeByIp(result.getIp());

        if (existing == null)
        {
            return nodeStore.nodeCreate(newNode(targetGroup, result))
                .map(node ->
                {
                    created.incrementAndGet();

                    logger.debug("Imported {} as node {}", result.getIp(), node.getName());

                    return (Void) null;
                })
                .recover(cause -> skip(result, cause));
        }

        var nodeGroup = snapshot.group(existing.getGroupId());

        var merged = mergeFlags(existing, nodeGroup, result, protocols);

        if (merged == null)
        {
            return Future.succeededFuture();
        }

        return nodeStore.nodeMergeDiscovery(merged)
            .map(node ->
            {
                updated.incrementAndGet();

                logger.debug("Updated monitoring flags of {} from discovery", existing.getName());

                return (Void) null;
            })
            .recover(cause -> skip(result, cause));
    }

    private static Node newNode(Group targetGroup, DiscoveryResult result)
    {
        var name = result.getHostname() != null && !result.getHostname().isBlank() ? result.getHostname() : result.getIp();

        var node = new Node()
            .setName(name)
            .setIp(result.getIp())
            .setGroupId(targetGroup.getId())
            .setMonitorSnmp(result.isSnmpEnabled())
            .setEnabled(true);

        if (result.getCommunity() != null && !result.getCommunity().equals(targetGroup.getSnmpCommunity()))
        {
            node.setSnmpCommunity(result.getCommunity());
        }

        return node;
    }

    /**
     * Switch on what the scan confirmed. The patch carries only the id, the identity used in
     * logs and the fields to merge, so stale cached columns are never written back.
     *
     * @return Patch for the node store, or null when nothing changes
     */
    static Node mergeFlags(Node existing, Group nodeGroup, DiscoveryResult result, Set<DiscoveryProtocol> protocols)
    {
        var merged = new Node().setId(existing.getId()).setName(existing.getName()).setIp(existing.getIp());

        var changed = false;

        var snmpOn = nodeGroup != null ? existing.effectiveMonitorSnmp(nodeGroup) : Boolean.TRUE.equals(existing.getMonitorSnmp());

        var pingOn = nodeGroup != null ? existing.effectiveMonitorPing(nodeGroup) : Boolean.TRUE.equals(existing.getMonitorPing());

        if (protocols.contains(DiscoveryProtocol.SNMP) && result.isSnmpEnabled() && !snmpOn)
        {
            merged.setMonitorSnmp(true);

            changed = true;
        }

        if (protocols.contains(DiscoveryProtocol.ICMP) && result.answeredIcmp() && !pingOn)
        {
            merged.setMonitorPing(true);

            changed = true;
        }

        var groupCommunity = nodeGroup != null ? nodeGroup.getSnmpCommunity() : null;

        if (result.getCommunity() != null && existing.getSnmpCommunity() == null
            && !result.getCommunity().equals(groupCommunity))
        {
            merged.setSnmpCommunity(result.getCommunity());

            changed = true;
        }

        return changed ? merged : null;
    }

    private static Future<Void> skip(DiscoveryResult result, Throwable cause)
    {
        logger.warn("Discovery import of {} skipped: {}", result.getIp(), cause.getMessage());

        return Future.succeededFuture();
    }
}
