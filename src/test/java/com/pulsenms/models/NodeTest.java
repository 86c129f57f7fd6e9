package com.pulsenms.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertNotSame;

import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeTest
{

    private final Group group = new Group().setId(1).setName("branch").setIntervalSeconds(30).setPacketCount(3)
        .setSnmpCommunity("branch-ro").setSnmpPort(1161).setMonitorPing(true).setMonitorSnmp(false);

    @Test
    void unsetFieldsInheritFromGroup()
    {
        var node = new Node().setId(1).setIp("10.2.0.1").setGroupId(1);

        assertEquals(30, node.effectiveInterval(group));

        assertEquals(3, node.effectivePacketCount(group));

        assertEquals("branch-ro", node.effectiveCommunity(group));

        assertEquals(1161, node.effectiveSnmpPort(group));

        assertTrue(node.effectiveMonitorPing(group));

        assertFalse(node.effectiveMonitorSnmp(group));
    }

    @Test
    void groupChangeReachesInheritingNodes()
    {
        var node = new Node().setId(1).setIp("10.2.0.1").setGroupId(1);

        group.setIntervalSeconds(120);

        assertEquals(120, node.effectiveInterval(group));
    }

    @Test
    void overridesWin()
    {
        var node = new Node().setId(1).setIp("10.2.0.1").setGroupId(1).setIntervalSeconds(10).setPacketCount(1)
            .setSnmpCommunity("node-ro").setSnmpPort(161).setMonitorPing(false).setMonitorSnmp(true);

        assertEquals(10, node.effectiveInterval(group));

        assertEquals(1, node.effectivePacketCount(group));

        assertEquals("node-ro", node.effectiveCommunity(group));

        assertEquals(161, node.effectiveSnmpPort(group));

        assertFalse(node.effectiveMonitorPing(group));

        assertTrue(node.effectiveMonitorSnmp(group));
    }

    @Test
    void emptyCommunityFallsBackToGroup()
    {
        var node = new Node().setSnmpCommunity("");

        assertEquals("branch-ro", node.effectiveCommunity(group));
    }

    @Test
    void maxRetriesPrecedence()
    {
        var node = new Node();

        assertEquals(3, node.effectiveMaxRetries(group, 3));

        group.setMaxRetries(4);

        assertEquals(4, node.effectiveMaxRetries(group, 3));

        node.setMaxRetries(0);

        assertEquals(1, node.effectiveMaxRetries(group, 3));
    }

    @Test
    void activeOnlyWhenNodeAndGroupEnabled()
    {
        var node = new Node().setEnabled(true);

        assertTrue(node.isActive(group));

        group.setEnabled(false);

        assertFalse(node.isActive(group));

        group.setEnabled(true);

        node.setEnabled(false);

        assertFalse(node.isActive(group));
    }

    @Test
    void copyIsIndependent()
    {
        var node = new Node().setId(5).setName("core-1").setIp("10.2.0.5").setGroupId(1).setNotificationPriority(2);

        var copy = node.copy();

        assertNotSame(node, copy);

        copy.setName("renamed");

        assertEquals("core-1", node.getName());

        assertEquals(Integer.valueOf(2), copy.getNotificationPriority());
    }
}
