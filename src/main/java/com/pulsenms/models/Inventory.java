package com.pulsenms.models;

import java.util.ArrayList;

import java.util.Collection;

import java.util.Collections;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.Map;

/**
 * Read-only view of the monitoring configuration: groups, nodes, metric catalog and bindings.
 */
public class Inventory
{

    private final Map<Integer, Group> groups;

    private final Map<Integer, Node> nodes;

    private final Map<Integer, MetricDefinition> definitions;

    private final List<NodeMetricConfig> metricConfigs;

    private final Map<String, Node> nodesByIp = new LinkedHashMap<>();

    private final Map<Integer, List<NodeMetricConfig>> configsByNode = new LinkedHashMap<>();

    public Inventory(Collection<Group> groups, Collection<Node> nodes, Collection<MetricDefinition> definitions,
                     Collection<NodeMetricConfig> metricConfigs)
    {
        var groupMap = new LinkedHashMap<Integer, Group>();

        groups.forEach(group -> groupMap.put(group.getId(), group));

        var nodeMap = new LinkedHashMap<Integer, Node>();

        nodes.forEach(node ->
        {
            nodeMap.put(node.getId(), node);

            nodesByIp.put(node.getIp(), node);
        });

        var definitionMap = new LinkedHashMap<Integer, MetricDefinition>();

        definitions.forEach(definition -> definitionMap.put(definition.getId(), definition));

        metricConfigs.forEach(config ->
            configsByNode.computeIfAbsent(config.getNodeId(), id -> new ArrayList<>()).add(config));

        this.groups = Collections.unmodifiableMap(groupMap);

        this.nodes = Collections.unmodifiableMap(nodeMap);

        this.definitions = Collections.unmodifiableMap(definitionMap);

        this.metricConfigs = List.copyOf(metricConfigs);
    }

    public static Inventory empty()
    {
        return new Inventory(List.of(), List.of(), List.of(), List.of());
    }

    public Group group(int groupId)
    {
        return groups.get(groupId);
    }

    public Node node(int nodeId)
    {
        return nodes.get(nodeId);
    }

    public Node nodeByIp(String ip)
    {
        return nodesByIp.get(ip);
    }

    public MetricDefinition definition(int definitionId)
    {
        return definitions.get(definitionId);
    }

    public List<NodeMetricConfig> metricConfigsFor(int nodeId)
    {
        return configsByNode.getOrDefault(nodeId, List.of());
    }

    public Collection<Group> groups()
    {
        return groups.values();
    }

    public Collection<Node> nodes()
    {
        return nodes.values();
    }

    public Collection<MetricDefinition> definitions()
    {
        return definitions.values();
    }

    public List<NodeMetricConfig> metricConfigs()
    {
        return metricConfigs;
    }
}
