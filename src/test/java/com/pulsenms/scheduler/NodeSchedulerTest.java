package com.pulsenms.scheduler;

import com.pulsenms.core.FakeProbe;

import com.pulsenms.core.MetricCatalog;

import com.pulsenms.core.MetricCollector;

import com.pulsenms.core.StatusCache;

import com.pulsenms.core.StatusEngine;

import com.pulsenms.core.TraceBus;

import com.pulsenms.models.Group;

import com.pulsenms.models.Inventory;

import com.pulsenms.models.MetricDefinition;

import com.pulsenms.models.MetricSample;

import com.pulsenms.models.MetricType;

import com.pulsenms.models.MonitoringSettings;

import com.pulsenms.models.Node;

import com.pulsenms.models.NodeMetricConfig;

import com.pulsenms.models.NodeStatus;

import com.pulsenms.models.OidTemplate;

import com.pulsenms.models.PingResult;

import com.pulsenms.models.SnmpResult;

import com.pulsenms.models.TraceEvent;

import io.vertx.core.Context;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.core.WorkerExecutor;

import io.vertx.junit5.VertxExtension;

import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.AfterEach;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;

import java.util.ArrayList;

import java.util.List;

import java.util.concurrent.CopyOnWriteArrayList;

import java.util.concurrent.atomic.AtomicLong;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(VertxExtension.class)
class NodeSchedulerTest
{

    private final Group group = new Group().setId(1).setName("lab").setIntervalSeconds(1).setMaxRetries(3);

    private final AtomicReference<Inventory> inventory = new AtomicReference<>(Inventory.empty());

    private final List<MetricSample> stored = new CopyOnWriteArrayList<>();

    private FakeProbe probe;

    private TraceBus traceBus;

    private StatusEngine statusEngine;

    private WorkerExecutor executor;

    private WorkerExecutor metricExecutor;

    private Context context;

    private NodeScheduler scheduler;

    @BeforeEach
    void setUp(Vertx vertx)
    {
        var clock = Clock.systemUTC();

        probe = new FakeProbe();

        var statusCache = new StatusCache(clock);

        traceBus = new TraceBus(500, 100);

        statusEngine = new StatusEngine(statusCache, traceBus, clock, 3);

        var collector = new MetricCollector(probe, statusCache, clock, 500);

        executor = vertx.createSharedWorkerExecutor("check-test", 3);

        metricExecutor = vertx.createSharedWorkerExecutor("metric-test", 2);

        var settings = new MonitoringSettings(500, 3, 3, 300, "fping");

        context = vertx.getOrCreateContext();

        scheduler = new NodeScheduler(vertx, executor, metricExecutor, probe, statusEngine, collector,
            sample ->
            {
                stored.add(sample);

                return Future.succeededFuture();
            },
            settings, inventory::get, clock);
    }

    @AfterEach
    void tearDown()
    {
        context.runOnContext(v -> scheduler.stopAll());

        executor.close();

        metricExecutor.close();
    }

    private void apply(Node... nodes)
    {
        apply(List.of(), List.of(), nodes);
    }

    private void apply(List<MetricDefinition> definitions, List<NodeMetricConfig> bindings, Node... nodes)
    {
        var snapshot = new Inventory(List.of(group), List.of(nodes), definitions, bindings);

        inventory.set(snapshot);

        context.runOnContext(v -> scheduler.reconcile(snapshot));
    }

    @Test
    void unreachableNodeGoesPendingThenDown(VertxTestContext testContext)
    {
        var events = new ArrayList<TraceEvent>();

        traceBus.subscribe(context, event -> testContext.verify(() ->
        {
            events.add(event);

            if (event.getNewStatus() == NodeStatus.DOWN)
            {
                assertEquals(2, events.size());

                assertEquals(NodeStatus.WAITING, events.get(0).getOldStatus());

                assertEquals(NodeStatus.PENDING, events.get(0).getNewStatus());

                assertEquals("3 consecutive failures (ping timeout)", event.getReason());

                assertEquals(3, probe.pingCalls());

                testContext.completeNow();
            }
        }), false);

        apply(new Node().setId(1).setName("dead").setIp("10.99.0.1").setGroupId(1));
    }

    @Test
    void disablingPausesAndEnablingChecksAgain(VertxTestContext testContext)
    {
        probe.answerPing("10.99.0.2", PingResult.success(0.7, 0));

        var node = new Node().setId(2).setName("alive").setIp("10.99.0.2").setGroupId(1);

        var events = new ArrayList<TraceEvent>();

        traceBus.subscribe(context, event -> testContext.verify(() ->
        {
            events.add(event);

            switch (events.size())
            {
                case 1:
                    assertEquals(NodeStatus.UP, event.getNewStatus());

                    apply(node.copy().setEnabled(false));

                    break;

                case 2:
                    assertEquals(NodeStatus.PAUSED, event.getNewStatus());

                    assertEquals(StatusEngine.REASON_NODE_PAUSED, event.getReason());

                    apply(node.copy().setEnabled(true));

                    break;

                default:
                    assertEquals(NodeStatus.PAUSED, event.getOldStatus());

                    assertEquals(NodeStatus.UP, event.getNewStatus());

                    testContext.completeNow();
            }
        }), false);

        apply(node);
    }

    @Test
    void removedNodeLosesItsLoopAndStatus(Vertx vertx, VertxTestContext testContext)
    {
        probe.answerPing("10.99.0.3", PingResult.success(0.7, 0));

        apply(new Node().setId(3).setName("temp").setIp("10.99.0.3").setGroupId(1));

        vertx.setTimer(300, id -> context.runOnContext(v -> testContext.verify(() ->
        {
            assertTrue(scheduler.hasLoop(3));

            assertEquals(NodeStatus.UP, statusEngine.statusOf(3));

            var empty = new Inventory(List.of(group), List.of(), List.of(), List.of());

            inventory.set(empty);

            scheduler.reconcile(empty);

            assertFalse(scheduler.hasLoop(3));

            assertEquals(0, scheduler.loopCount());

            assertEquals(NodeStatus.WAITING, statusEngine.statusOf(3));

            assertFalse(scheduler.checkNow(3));

            testContext.completeNow();
        })));
    }

    @Test
    void snmpNodeStoresMetricSamples(Vertx vertx, VertxTestContext testContext)
    {
        var cpu = new MetricDefinition().setId(7).setName("CPU Load")
            .setOidTemplate(new OidTemplate("1.3.6.1.4.1.2021.11.11.0", false))
            .setType(MetricType.GAUGE).setUnit("%");

        probe.answerPing("10.99.0.4", PingResult.success(0.7, 0))
            .answerSnmp("10.99.0.4", "public", MetricCatalog.SYS_UPTIME_OID, SnmpResult.success("123456", 2))
            .answerSnmp("10.99.0.4", "public", "1.3.6.1.4.1.2021.11.11.0", SnmpResult.success("42", 2));

        var node = new Node().setId(4).setName("snmp-host").setIp("10.99.0.4").setGroupId(1).setMonitorSnmp(true);

        var binding = new NodeMetricConfig().setId(70).setNodeId(4).setDefinitionId(7);

        apply(List.of(cpu), List.of(binding), node);

        vertx.setTimer(500, id -> testContext.verify(() ->
        {
            assertFalse(stored.isEmpty());

            assertEquals(42.0, stored.get(0).getValue());

            assertEquals(70, stored.get(0).getNodeMetricId());

            assertEquals(NodeStatus.UP, statusEngine.statusOf(4));

            testContext.completeNow();
        }));
    }

    @Test
    void hungNodesDoNotStarveHealthyOnes(Vertx vertx, VertxTestContext testContext)
    {
        // Two nodes block a pool thread each for longer than the test, the third thread stays free
        probe.delay("10.99.0.11", 5000)
            .delay("10.99.0.12", 5000)
            .answerPing("10.99.0.13", PingResult.success(0.7, 0));

        var hungReasons = new CopyOnWriteArrayList<String>();

        traceBus.subscribe(context, event ->
        {
            if (event.getNodeId() != 13)
            {
                hungReasons.add(event.getReason());
            }
        }, false);

        apply(new Node().setId(11).setName("hung-a").setIp("10.99.0.11").setGroupId(1).setPacketCount(1),
            new Node().setId(12).setName("hung-b").setIp("10.99.0.12").setGroupId(1).setPacketCount(1),
            new Node().setId(13).setName("healthy").setIp("10.99.0.13").setGroupId(1));

        vertx.setTimer(3500, id -> context.runOnContext(v -> testContext.verify(() ->
        {
            assertEquals(NodeStatus.UP, statusEngine.statusOf(13));

            assertTrue(probe.pingCalls("10.99.0.13") >= 3);

            // A node whose probe is still running is never submitted again
            assertEquals(1, probe.pingCalls("10.99.0.11"));

            assertEquals(1, probe.pingCalls("10.99.0.12"));

            for (var hungId : List.of(11, 12))
            {
                var status = statusEngine.statusOf(hungId);

                assertTrue(status == NodeStatus.PENDING || status == NodeStatus.DOWN, "status of " + hungId + ": " + status);
            }

            assertTrue(hungReasons.contains(NodeCheckLoop.REASON_TIMED_OUT));

            testContext.completeNow();
        })));
    }

    @Test
    void unavailableProbeLeavesStatusUntouched(Vertx vertx, VertxTestContext testContext)
    {
        probe.unavailable(true);

        var events = new CopyOnWriteArrayList<TraceEvent>();

        traceBus.subscribe(context, events::add, false);

        apply(new Node().setId(6).setName("no-fping").setIp("10.99.0.6").setGroupId(1));

        vertx.setTimer(1500, id -> context.runOnContext(v -> testContext.verify(() ->
        {
            assertEquals(NodeStatus.WAITING, statusEngine.statusOf(6));

            assertTrue(events.isEmpty());

            // Checked again on the next tick
            assertTrue(probe.pingCalls("10.99.0.6") >= 2);

            testContext.completeNow();
        })));
    }

    @Test
    void intervalChangeRestartsLoopWithImmediateCheck(Vertx vertx, VertxTestContext testContext)
    {
        probe.answerPing("10.99.0.5", PingResult.success(0.7, 0));

        var node = new Node().setId(5).setName("core-sw").setIp("10.99.0.5").setGroupId(1);

        apply(node);

        vertx.setTimer(300, id -> context.runOnContext(v -> testContext.verify(() ->
        {
            assertEquals(1, scheduler.intervalOf(5));

            assertEquals(NodeStatus.UP, statusEngine.statusOf(5));

            var callsBefore = probe.pingCalls("10.99.0.5");

            apply(node.copy().setIntervalSeconds(5));

            vertx.setTimer(300, later -> context.runOnContext(w -> testContext.verify(() ->
            {
                assertTrue(scheduler.hasLoop(5));

                assertEquals(5, scheduler.intervalOf(5));

                assertEquals(callsBefore + 1, probe.pingCalls("10.99.0.5"));

                assertEquals(NodeStatus.UP, statusEngine.statusOf(5));

                testContext.completeNow();
            })));
        })));
    }

    @Test
    void pendingNodeIsRetriedFasterThanItsInterval(VertxTestContext testContext)
    {
        var pendingAt = new AtomicLong();

        traceBus.subscribe(context, event -> testContext.verify(() ->
        {
            if (event.getNewStatus() == NodeStatus.PENDING)
            {
                pendingAt.set(System.nanoTime());
            }
            else if (event.getNewStatus() == NodeStatus.DOWN)
            {
                var elapsedMs = (System.nanoTime() - pendingAt.get()) / 1_000_000;

                // Two retries a third of the 3s interval apart
                assertTrue(elapsedMs >= 1500 && elapsedMs < 3000, "PENDING to DOWN took " + elapsedMs + "ms");

                assertEquals(3, probe.pingCalls("10.99.0.7"));

                testContext.completeNow();
            }
        }), false);

        apply(new Node().setId(7).setName("flaky").setIp("10.99.0.7").setGroupId(1).setIntervalSeconds(3));
    }
}
