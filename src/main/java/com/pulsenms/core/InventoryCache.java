package com.pulsenms.core;

import com.pulsenms.models.Group;

import com.pulsenms.models.Inventory;

import com.pulsenms.models.MetricDefinition;

import com.pulsenms.models.Node;

import com.pulsenms.models.NodeMetricConfig;

import com.pulsenms.services.InventorySource;

import com.pulsenms.utils.ValidationUtil;

import io.vertx.core.Future;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.List;

import java.util.concurrent.CopyOnWriteArrayList;

import java.util.function.Consumer;

import java.util.stream.Collectors;

/**
 * InventoryCache - Validated, read-only view of the monitoring configuration

 * Configuration inconsistencies are rejected here, when a new inventory is applied,
 * so the scheduler and the collector never see them:
 * - nodes with an unknown group or an invalid IP, port, community or priority
 * - metric bindings for unknown nodes or definitions
 * - enabled bindings without the interface index their definition requires

 * Lifecycle:
 * - refresh() re-reads the source (startup, "inventory.changed", periodic)
 * - listeners are told about every applied inventory
 */
public class InventoryCache
{

    private static final Logger logger = LoggerFactory.getLogger(InventoryCache.class);

    private final InventorySource source;

    private final List<Consumer<Inventory>> listeners = new CopyOnWriteArrayList<>();

    private volatile Inventory current = Inventory.empty();

    public InventoryCache(InventorySource source)
    {
        this.source = source;
    }

    /**
     * Re-read the source and apply the result.
     *
     * @return Future containing the applied inventory
     */
    public Future<Inventory> refresh()
    {
        return source.inventoryLoad()
            .map(this::apply)
            .onFailure(cause -> logger.error("Failed to refresh inventory: {}", cause.getMessage()));
    }

    /**
     * Validate and publish a raw inventory.
     *
     * @param raw Inventory as stored
     * @return Validated inventory now visible through current()
     */
    public Inventory apply(Inventory raw)
    {
        var groups = new ArrayList<Group>(raw.groups());

        var nodes = new ArrayList<Node>();

        for (var node : raw.nodes())
        {
            var rejection = validateNode(node, raw);

            if (rejection != null)
            {
                logger.warn("Node {} ({}) rejected: {}", node.getName(), node.getIp(), rejection);

                continue;
            }

            nodes.add(node);
        }

        var definitions = new ArrayList<MetricDefinition>(raw.definitions());

        var configs = new ArrayList<NodeMetricConfig>();

        var acceptedNodeIds = nodes.stream().map(Node::getId).collect(Collectors.toSet());

        for (var config : raw.metricConfigs())
        {
            var rejection = validateMetricConfig(config, raw, acceptedNodeIds.contains(config.getNodeId()));

            if (rejection != null)
            {
                logger.warn("Metric binding {} (node {}, definition {}) rejected: {}",
                    config.getId(), config.getNodeId(), config.getDefinitionId(), rejection);

                continue;
            }

            configs.add(config);
        }

        var validated = new Inventory(groups, nodes, definitions, configs);

        current = validated;

        logger.debug("Inventory applied: {} groups, {} nodes, {} metric bindings",
            groups.size(), nodes.size(), configs.size());

        for (var listener : listeners)
        {
            try
            {
                listener.accept(validated);
            }
            catch (Exception exception)
            {
                logger.error("Error in inventory listener: {}", exception.getMessage());
            }
        }

        return validated;
    }

    private static String validateNode(Node node, Inventory raw)
    {
        if (raw.group(node.getGroupId()) == null)
        {
            return "unknown group " + node.getGroupId();
        }

        if (!ValidationUtil.isValidIp(node.getIp()))
        {
            return "invalid IP address";
        }

        if (!ValidationUtil.isValidPort(node.getSnmpPort()))
        {
            return "SNMP port must be between 1 and 65535";
        }

        if (!ValidationUtil.isValidCommunity(node.getSnmpCommunity()))
        {
            return "SNMP community must be 1 to 255 characters";
        }

        if (!ValidationUtil.isValidPriority(node.getNotificationPriority()))
        {
            return "notification priority must be between -2 and 2";
        }

        if (!ValidationUtil.isValidInterval(node.getIntervalSeconds()))
        {
            return "interval must be at least 1 second";
        }

        return null;
    }

    private static String validateMetricConfig(NodeMetricConfig config, Inventory raw, boolean nodeAccepted)
    {
        if (!nodeAccepted)
        {
            return "node unknown or rejected";
        }

        var definition = raw.definition(config.getDefinitionId());

        if (definition == null)
        {
            return "unknown metric definition";
        }

        if (config.isEnabled() && definition.needsIndex() && config.getInterfaceIndex() == null)
        {
            return "'" + definition.getName() + "' requires an interface index";
        }

        if (config.getInterfaceIndex() != null && config.getInterfaceIndex() < 0)
        {
            return "interface index must not be negative";
        }

        return null;
    }

    public Inventory current()
    {
        return current;
    }

    public void addListener(Consumer<Inventory> listener)
    {
        listeners.add(listener);
    }
}
