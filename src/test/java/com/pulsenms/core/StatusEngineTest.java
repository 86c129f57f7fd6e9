package com.pulsenms.core;

import com.pulsenms.models.CheckResult;

import com.pulsenms.models.Group;

import com.pulsenms.models.Node;

import com.pulsenms.models.NodeStatus;

import com.pulsenms.models.PingResult;

import com.pulsenms.models.ProbeOutcome;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertNotNull;

import static org.junit.jupiter.api.Assertions.assertNull;

class StatusEngineTest
{

    private MutableClock clock;

    private StatusCache statusCache;

    private TraceBus traceBus;

    private StatusEngine engine;

    private Group group;

    private Node node;

    @BeforeEach
    void setUp()
    {
        clock = MutableClock.atEpoch();

        statusCache = new StatusCache(clock);

        traceBus = new TraceBus(500, 100);

        engine = new StatusEngine(statusCache, traceBus, clock, 3);

        group = new Group().setId(1).setName("core");

        node = new Node().setId(10).setName("sw-01").setIp("10.0.0.1").setGroupId(1);
    }

    private static CheckResult timeout()
    {
        return CheckResult.aggregate(PingResult.failure(ProbeOutcome.TIMEOUT), null);
    }

    private static CheckResult ok()
    {
        return CheckResult.aggregate(PingResult.success(1.5, 0), null);
    }

    @Test
    void threeTimeoutsGoPendingThenDownWithTwoEvents()
    {
        var first = engine.applyResult(node, group, timeout());

        var second = engine.applyResult(node, group, timeout());

        var third = engine.applyResult(node, group, timeout());

        assertNotNull(first);

        assertEquals(NodeStatus.WAITING, first.getOldStatus());

        assertEquals(NodeStatus.PENDING, first.getNewStatus());

        assertNull(second);

        assertNotNull(third);

        assertEquals(NodeStatus.PENDING, third.getOldStatus());

        assertEquals(NodeStatus.DOWN, third.getNewStatus());

        assertEquals("ping timeout", first.getReason());

        assertEquals("3 consecutive failures (ping timeout)", third.getReason());

        assertEquals(2, traceBus.size());

        assertEquals(3, statusCache.snapshot(10).getConsecutiveFailures());
    }

    @Test
    void successResetsCounterAndRecovers()
    {
        for (var i = 0; i < 3; i++)
        {
            engine.applyResult(node, group, timeout());
        }

        clock.advanceSeconds(90);

        var event = engine.applyResult(node, group, ok());

        assertEquals(NodeStatus.DOWN, event.getOldStatus());

        assertEquals(NodeStatus.UP, event.getNewStatus());

        assertEquals("responded after outage of 90s", event.getReason());

        var snapshot = statusCache.snapshot(10);

        assertEquals(0, snapshot.getConsecutiveFailures());

        assertEquals(1.5, snapshot.getLatencyMs());
    }

    @Test
    void recoveryReasonDescribesWhatWasRecovered()
    {
        assertEquals("first check succeeded", engine.applyResult(node, group, ok()).getReason());

        engine.applyResult(node, group, timeout());

        engine.applyResult(node, group, timeout());

        assertEquals("responded after 2 failed checks", engine.applyResult(node, group, ok()).getReason());

        node.setEnabled(false);

        engine.pause(node, group);

        node.setEnabled(true);

        assertEquals("responded after resume", engine.applyResult(node, group, ok()).getReason());
    }

    @Test
    void repeatedStatusPublishesNothing()
    {
        engine.applyResult(node, group, ok());

        assertNull(engine.applyResult(node, group, ok()));

        assertNull(engine.applyResult(node, group, ok()));

        assertEquals(1, traceBus.size());
    }

    @Test
    void failureWhileDownStaysDownWithoutEvent()
    {
        for (var i = 0; i < 3; i++)
        {
            engine.applyResult(node, group, timeout());
        }

        assertNull(engine.applyResult(node, group, timeout()));

        assertEquals(NodeStatus.DOWN, engine.statusOf(10));
    }

    @Test
    void pauseKeepsPreviousStatusAndResetsCounter()
    {
        engine.applyResult(node, group, timeout());

        engine.applyResult(node, group, timeout());

        node.setEnabled(false);

        var event = engine.pause(node, group);

        assertEquals(NodeStatus.PENDING, event.getOldStatus());

        assertEquals(NodeStatus.PAUSED, event.getNewStatus());

        assertEquals(StatusEngine.REASON_NODE_PAUSED, event.getReason());

        var snapshot = statusCache.snapshot(10);

        assertEquals(NodeStatus.PENDING, snapshot.getStatusBeforePause());

        assertEquals(0, snapshot.getConsecutiveFailures());

        assertNull(engine.pause(node, group));
    }

    @Test
    void groupPauseUsesGroupReason()
    {
        group.setEnabled(false);

        var event = engine.pause(node, group);

        assertEquals(StatusEngine.REASON_GROUP_PAUSED, event.getReason());
    }

    @Test
    void resumedNodeCountsFailuresFromZero()
    {
        engine.applyResult(node, group, timeout());

        engine.applyResult(node, group, timeout());

        engine.pause(node, group);

        // Resume: the next completed check decides, a single failure is only PENDING
        var event = engine.applyResult(node, group, timeout());

        assertEquals(NodeStatus.PAUSED, event.getOldStatus());

        assertEquals(NodeStatus.PENDING, event.getNewStatus());

        assertEquals(1, statusCache.snapshot(10).getConsecutiveFailures());
    }

    @Test
    void nodeOverrideBeatsGroupAndDefault()
    {
        group.setMaxRetries(5);

        node.setMaxRetries(1);

        var event = engine.applyResult(node, group, timeout());

        assertEquals(NodeStatus.DOWN, event.getNewStatus());
    }

    @Test
    void groupOverrideBeatsDefault()
    {
        group.setMaxRetries(2);

        engine.applyResult(node, group, timeout());

        var event = engine.applyResult(node, group, timeout());

        assertEquals(NodeStatus.DOWN, event.getNewStatus());
    }

    @Test
    void removeForgetsNode()
    {
        engine.applyResult(node, group, ok());

        engine.remove(10);

        assertEquals(NodeStatus.WAITING, engine.statusOf(10));

        assertNull(statusCache.snapshot(10));
    }
}
