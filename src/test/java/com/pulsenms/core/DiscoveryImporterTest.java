package com.pulsenms.core;

import com.pulsenms.models.DiscoveryProtocol;

import com.pulsenms.models.DiscoveryResult;

import com.pulsenms.models.Group;

import com.pulsenms.models.Inventory;

import com.pulsenms.models.Node;

import com.pulsenms.services.NodeStore;

import io.vertx.core.Future;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import java.util.Arrays;

import java.util.EnumSet;

import java.util.HashMap;

import java.util.List;

import java.util.Map;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertTrue;

class DiscoveryImporterTest
{

    private final Set<DiscoveryProtocol> bothProtocols = EnumSet.allOf(DiscoveryProtocol.class);

    private InMemoryNodeStore store;

    private Group office;

    private Node printer;

    private DiscoveryImporter importer;

    @BeforeEach
    void setUp()
    {
        office = new Group().setId(2).setName("office").setSnmpCommunity("public").setMonitorSnmp(false);

        printer = new Node().setId(40).setName("Front desk printer").setIp("192.168.1.40").setGroupId(2)
            .setMaxRetries(5);

        store = new InMemoryNodeStore();

        store.stored.put(printer.getId(), printer.copy());

        var inventory = new Inventory(List.of(office), List.of(printer), List.of(), List.of());

        importer = new DiscoveryImporter(store, () -> inventory);
    }

    private static DiscoveryResult icmpOnly(String ip, String hostname)
    {
        return new DiscoveryResult().setIp(ip).setHostname(hostname).setLatencyMs(1.2);
    }

    private static DiscoveryResult withSnmp(String ip, String community)
    {
        return new DiscoveryResult().setIp(ip).setLatencyMs(1.2).setSnmpEnabled(true).setCommunity(community);
    }

    @Test
    void newAddressesBecomeNodesInTargetGroup()
    {
        var report = importer.importResults(2, List.of(icmpOnly("192.168.1.10", "nas.lan"), withSnmp("192.168.1.11", "public")),
            bothProtocols).result();

        assertEquals(2, report.getCreated());

        assertEquals(0, report.getUpdated());

        assertEquals(0, report.getSkipped());

        var nas = store.created.get(0);

        assertEquals("nas.lan", nas.getName());

        assertEquals(2, nas.getGroupId());

        assertEquals(Boolean.FALSE, nas.getMonitorSnmp());

        var unnamed = store.created.get(1);

        assertEquals("192.168.1.11", unnamed.getName());

        assertEquals(Boolean.TRUE, unnamed.getMonitorSnmp());

        // Same community as the group: no override stored
        assertNull(unnamed.getSnmpCommunity());
    }

    @Test
    void differingCommunityIsStoredAsOverride()
    {
        importer.importResults(2, List.of(withSnmp("192.168.1.12", "lab-ro")), bothProtocols).result();

        assertEquals("lab-ro", store.created.get(0).getSnmpCommunity());
    }

    @Test
    void existingNodeOnlyGainsConfirmedProtocols()
    {
        var report = importer.importResults(2, List.of(withSnmp("192.168.1.40", "printers")), bothProtocols).result();

        assertEquals(0, report.getCreated());

        assertEquals(1, report.getUpdated());

        var patch = store.updated.get(0);

        assertEquals(40, patch.getId());

        assertNull(patch.getMonitorPing());

        assertNull(patch.getMaxRetries());

        var row = store.stored.get(40);

        assertEquals("Front desk printer", row.getName());

        assertEquals(Integer.valueOf(5), row.getMaxRetries());

        assertEquals(Boolean.TRUE, row.getMonitorSnmp());

        assertEquals("printers", row.getSnmpCommunity());

        // The cached node itself is untouched
        assertNull(printer.getMonitorSnmp());
    }

    @Test
    void mergeKeepsEditsMadeAfterInventoryWasCached()
    {
        // Row edited in the database after the inventory snapshot was taken
        store.stored.get(40).setName("Reception printer").setEnabled(false).setNotificationPriority(2)
            .setSnmpCommunity("frontdesk");

        var report = importer.importResults(2, List.of(withSnmp("192.168.1.40", "printers")), bothProtocols).result();

        assertEquals(1, report.getUpdated());

        var row = store.stored.get(40);

        assertEquals("Reception printer", row.getName());

        assertFalse(row.isEnabled());

        assertEquals(Integer.valueOf(2), row.getNotificationPriority());

        // Community set meanwhile is not replaced by the scan's
        assertEquals("frontdesk", row.getSnmpCommunity());

        assertEquals(Boolean.TRUE, row.getMonitorSnmp());
    }

    @Test
    void unchangedNodesAndDuplicatesAreSkipped()
    {
        var report = importer.importResults(2,
            Arrays.asList(icmpOnly("192.168.1.40", null), icmpOnly("192.168.1.50", null), icmpOnly("192.168.1.50", null), null),
            bothProtocols).result();

        assertEquals(1, report.getCreated());

        assertEquals(0, report.getUpdated());

        assertEquals(3, report.getSkipped());

        assertTrue(store.updated.isEmpty());
    }

    @Test
    void snmpAnswerIgnoredWhenScanDidNotRequestSnmp()
    {
        assertNull(DiscoveryImporter.mergeFlags(printer, office, withSnmp("192.168.1.40", "public"),
            EnumSet.of(DiscoveryProtocol.ICMP)));
    }

    @Test
    void pingIsSwitchedBackOnWhenConfirmed()
    {
        var quiet = printer.copy().setMonitorPing(false);

        var merged = DiscoveryImporter.mergeFlags(quiet, office, icmpOnly("192.168.1.40", null), bothProtocols);

        assertEquals(Boolean.TRUE, merged.getMonitorPing());
    }

    @Test
    void unknownGroupFails()
    {
        var result = importer.importResults(99, List.of(icmpOnly("192.168.1.10", null)), bothProtocols);

        assertTrue(result.failed());

        assertInstanceOf(IllegalArgumentException.class, result.cause());

        assertTrue(store.created.isEmpty());
    }

    @Test
    void storeFailureCountsAsSkippedAndImportContinues()
    {
        store.failFor = "192.168.1.60";

        var report = importer.importResults(2, List.of(icmpOnly("192.168.1.60", null), icmpOnly("192.168.1.61", null)),
            bothProtocols).result();

        assertEquals(1, report.getCreated());

        assertEquals(1, report.getSkipped());

        assertFalse(store.created.stream().anyMatch(node -> node.getIp().equals("192.168.1.60")));
    }

    private static class InMemoryNodeStore implements NodeStore
    {

        private final List<Node> created = new ArrayList<>();

        private final List<Node> updated = new ArrayList<>();

        private final Map<Integer, Node> stored = new HashMap<>();

        private String failFor;

        private int nextId = 100;

        @Override
        public Future<Node> nodeCreate(Node node)
        {
            if (node.getIp().equals(failFor))
            {
                return Future.failedFuture(new IllegalArgumentException("Node with IP already exists"));
            }

            node.setId(nextId++);

            created.add(node);

            return Future.succeededFuture(node);
        }

        @Override
        public Future<Node> nodeMergeDiscovery(Node patch)
        {
            var row = stored.get(patch.getId());

            if (row == null)
            {
                return Future.failedFuture(new IllegalStateException("Node not found: " + patch.getId()));
            }

            if (patch.getMonitorPing() != null)
            {
                row.setMonitorPing(patch.getMonitorPing());
            }

            if (patch.getMonitorSnmp() != null)
            {
                row.setMonitorSnmp(patch.getMonitorSnmp());
            }

            if (row.getSnmpCommunity() == null)
            {
                row.setSnmpCommunity(patch.getSnmpCommunity());
            }

            updated.add(patch);

            return Future.succeededFuture(patch);
        }
    }
}
