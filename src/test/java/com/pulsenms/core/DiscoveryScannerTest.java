package com.pulsenms.core;

import com.pulsenms.models.DiscoveryProgress;

import com.pulsenms.models.DiscoveryProtocol;

import com.pulsenms.models.DiscoverySettings;

import com.pulsenms.models.PingResult;

import com.pulsenms.models.SnmpResult;

import io.vertx.core.Vertx;

import io.vertx.core.WorkerExecutor;

import io.vertx.junit5.VertxExtension;

import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.AfterEach;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.extension.ExtendWith;

import java.util.EnumSet;

import java.util.List;

import java.util.Set;

import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import static org.junit.jupiter.api.Assertions.assertNotNull;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(VertxExtension.class)
class DiscoveryScannerTest
{

    private FakeProbe probe;

    private WorkerExecutor executor;

    private DiscoveryScanner scanner;

    @BeforeEach
    void setUp(Vertx vertx)
    {
        probe = new FakeProbe();

        executor = vertx.createSharedWorkerExecutor("discovery-test", 4);

        var settings = new DiscoverySettings(4, 500, 500, List.of("public", "private"));

        // No real DNS in tests: only .1 has a PTR record
        scanner = new DiscoveryScanner(probe, settings, executor, MutableClock.atEpoch(),
            ip -> ip.equals("10.9.0.1") ? "gw.lab.local" : null);
    }

    @AfterEach
    void tearDown()
    {
        executor.close();
    }

    @Test
    void icmpAndSnmpSweepMergesAnswers(VertxTestContext testContext)
    {
        probe.answerPing("10.9.0.1", PingResult.success(0.8, 0))
            .answerPing("10.9.0.3", PingResult.success(2.1, 0))
            .answerPing("10.9.0.5", PingResult.success(1.0, 0))
            .answerSnmp("10.9.0.3", "private", MetricCatalog.SYS_DESCR_OID, SnmpResult.success("Cisco IOS Software, C2960", 4))
            .answerSnmp("10.9.0.3", "private", MetricCatalog.SYS_NAME_OID, SnmpResult.success("access-sw-3", 4))
            // SNMP-only host is not included when ICMP was requested
            .answerSnmp("10.9.0.6", "public", MetricCatalog.SYS_DESCR_OID, SnmpResult.success("Linux nas", 4));

        scanner.scan("10.9.0.0/29", EnumSet.allOf(DiscoveryProtocol.class), List.of())
            .onComplete(testContext.succeeding(progress -> testContext.verify(() ->
            {
                assertFalse(progress.isRunning());

                assertEquals(6, progress.getTotal());

                assertEquals(6, progress.getScanned());

                assertEquals(100, progress.percent());

                assertEquals(3, progress.getIcmpFound());

                assertEquals(1, progress.getSnmpFound());

                var results = progress.getResults();

                assertEquals(3, results.size());

                assertEquals("10.9.0.1", results.get(0).getIp());

                assertEquals("gw.lab.local", results.get(0).getHostname());

                assertFalse(results.get(0).isSnmpEnabled());

                var switchResult = results.get(1);

                assertEquals("10.9.0.3", switchResult.getIp());

                assertTrue(switchResult.isSnmpEnabled());

                assertEquals("private", switchResult.getCommunity());

                assertEquals("access-sw-3", switchResult.getHostname());

                assertEquals("Cisco", switchResult.getVendor());

                assertEquals("10.9.0.5", results.get(2).getIp());

                assertNotNull(progress.getFinishedAt());

                testContext.completeNow();
            })));
    }

    @Test
    void snmpOnlySweepIncludesSnmpResponders(VertxTestContext testContext)
    {
        probe.answerPing("10.9.0.2", PingResult.success(0.5, 0))
            .answerSnmp("10.9.0.6", "public", MetricCatalog.SYS_DESCR_OID, SnmpResult.success("Synology DSM", 4));

        scanner.scan("10.9.0.1-6", Set.of(DiscoveryProtocol.SNMP), List.of("public"))
            .onComplete(testContext.succeeding(progress -> testContext.verify(() ->
            {
                assertEquals(0, probe.pingCalls());

                assertEquals(1, progress.getResults().size());

                var nas = progress.getResults().get(0);

                assertEquals("10.9.0.6", nas.getIp());

                assertNull(nas.getLatencyMs());

                assertEquals("Synology", nas.getVendor());

                assertEquals("NAS", nas.getDeviceType());

                testContext.completeNow();
            })));
    }

    @Test
    void invalidTargetFailsImmediately(VertxTestContext testContext)
    {
        scanner.scan("10.0.0.0/8", Set.of(), List.of())
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertInstanceOf(IllegalArgumentException.class, cause);

                assertFalse(scanner.isRunning());

                testContext.completeNow();
            })));
    }

    @Test
    void secondScanIsRejectedWhileRunning(VertxTestContext testContext)
    {
        probe.delay(200);

        var first = scanner.scan("10.9.0.0/29", Set.of(DiscoveryProtocol.ICMP), List.of());

        assertTrue(scanner.isRunning());

        scanner.scan("10.9.1.0/29", Set.of(DiscoveryProtocol.ICMP), List.of())
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertInstanceOf(IllegalStateException.class, cause);

                first.onComplete(testContext.succeeding(progress -> testContext.verify(() ->
                {
                    assertEquals(6, progress.getScanned());

                    assertEquals("10.9.0.0/29", progress.getTarget());

                    testContext.completeNow();
                })));
            })));
    }

    @Test
    void progressIsReportedWhileScanning(VertxTestContext testContext)
    {
        var reported = new CopyOnWriteArrayList<DiscoveryProgress>();

        scanner.setProgressListener(reported::add);

        scanner.scan("10.9.0.0/28", Set.of(DiscoveryProtocol.ICMP), List.of())
            .onComplete(testContext.succeeding(progress -> testContext.verify(() ->
            {
                // Start, one per batch of 4 over 14 addresses, finish
                assertEquals(6, reported.size());

                assertEquals(0, reported.get(0).getScanned());

                assertTrue(reported.get(0).isRunning());

                for (var i = 1; i < reported.size(); i++)
                {
                    assertTrue(reported.get(i).getScanned() >= reported.get(i - 1).getScanned());
                }

                assertFalse(reported.get(reported.size() - 1).isRunning());

                assertEquals(14, reported.get(reported.size() - 1).getScanned());

                testContext.completeNow();
            })));
    }
}
