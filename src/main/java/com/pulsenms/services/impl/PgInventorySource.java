package com.pulsenms.services.impl;

import com.pulsenms.models.AlertCondition;

import com.pulsenms.models.Group;

import com.pulsenms.models.Inventory;

import com.pulsenms.models.MetricCategory;

import com.pulsenms.models.MetricDefinition;

import com.pulsenms.models.MetricType;

import com.pulsenms.models.Node;

import com.pulsenms.models.NodeMetricConfig;

import com.pulsenms.models.OidTemplate;

import com.pulsenms.services.InventorySource;

import io.vertx.core.Future;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Row;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * PgInventorySource - Reads groups, nodes, metric definitions and metric bindings

 * Rows are mapped as stored; consistency checks are left to InventoryCache.
 * A definition with an unparsable OID template is skipped (its bindings are then
 * rejected as bound to an unknown definition).
 */
public class PgInventorySource implements InventorySource
{

    private static final Logger logger = LoggerFactory.getLogger(PgInventorySource.class);

    private static final String GROUPS_SQL = """
            SELECT id, name, interval_seconds, packet_count, snmp_community, snmp_port,
                   enabled, monitor_ping, monitor_snmp, max_retries
            FROM groups
            ORDER BY id
            """;

    private static final String NODES_SQL = """
            SELECT id, name, ip, group_id, interval_seconds, packet_count, max_retries,
                   snmp_community, snmp_port, monitor_ping, monitor_snmp, enabled, notification_priority
            FROM nodes
            ORDER BY id
            """;

    private static final String DEFINITIONS_SQL = """
            SELECT id, name, oid_template, metric_type, unit, category, requires_index, source, description
            FROM metric_definitions
            ORDER BY id
            """;

    private static final String BINDINGS_SQL = """
            SELECT id, node_id, metric_definition_id, interface_index, interface_name, interval_seconds,
                   enabled, alert_condition, warning_threshold, critical_threshold
            FROM node_metrics
            ORDER BY id
            """;

    private final Pool pgPool;

    /**
     * @param pgPool PostgresSQL connection pool
     */
    public PgInventorySource(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    @Override
    public Future<Inventory> inventoryLoad()
    {
        var groups = pgPool.query(GROUPS_SQL).execute().map(rows ->
        {
            var list = new ArrayList<Group>();

            for (var row : rows)
            {
                list.add(toGroup(row));
            }

            return list;
        });

        var nodes = pgPool.query(NODES_SQL).execute().map(rows ->
        {
            var list = new ArrayList<Node>();

            for (var row : rows)
            {
                list.add(toNode(row));
            }

            return list;
        });

        var definitions = pgPool.query(DEFINITIONS_SQL).execute().map(rows ->
        {
            var list = new ArrayList<MetricDefinition>();

            for (var row : rows)
            {
                try
                {
                    list.add(toDefinition(row));
                }
                catch (IllegalArgumentException exception)
                {
                    logger.warn("Metric definition {} skipped: {}", row.getInteger("id"), exception.getMessage());
                }
            }

            return list;
        });

        var bindings = pgPool.query(BINDINGS_SQL).execute().map(rows ->
        {
            var list = new ArrayList<NodeMetricConfig>();

            for (var row : rows)
            {
                list.add(toBinding(row));
            }

            return list;
        });

        return Future.all(groups, nodes, definitions, bindings)
            .map(v -> new Inventory(groups.result(), nodes.result(), definitions.result(), bindings.result()))
            .onSuccess(inventory -> logger.debug("Inventory loaded: {} groups, {} nodes, {} definitions, {} bindings",
                inventory.groups().size(), inventory.nodes().size(), inventory.definitions().size(),
                inventory.metricConfigs().size()))
            .onFailure(cause -> logger.error("Failed to load inventory: {}", cause.getMessage()));
    }

    static Group toGroup(Row row)
    {
        return new Group()
            .setId(row.getInteger("id"))
            .setName(row.getString("name"))
            .setIntervalSeconds(row.getInteger("interval_seconds"))
            .setPacketCount(row.getInteger("packet_count"))
            .setSnmpCommunity(row.getString("snmp_community"))
            .setSnmpPort(row.getInteger("snmp_port"))
            .setEnabled(row.getBoolean("enabled"))
            .setMonitorPing(row.getBoolean("monitor_ping"))
            .setMonitorSnmp(row.getBoolean("monitor_snmp"))
            .setMaxRetries(row.getInteger("max_retries"));
    }

    static Node toNode(Row row)
    {
        return new Node()
            .setId(row.getInteger("id"))
            .setName(row.getString("name"))
            .setIp(row.getString("ip"))
            .setGroupId(row.getInteger("group_id"))
            .setIntervalSeconds(row.getInteger("interval_seconds"))
            .setPacketCount(row.getInteger("packet_count"))
            .setMaxRetries(row.getInteger("max_retries"))
            .setSnmpCommunity(row.getString("snmp_community"))
            .setSnmpPort(row.getInteger("snmp_port"))
            .setMonitorPing(row.getBoolean("monitor_ping"))
            .setMonitorSnmp(row.getBoolean("monitor_snmp"))
            .setEnabled(row.getBoolean("enabled"))
            .setNotificationPriority(row.getInteger("notification_priority"));
    }

    static MetricDefinition toDefinition(Row row)
    {
        return new MetricDefinition()
            .setId(row.getInteger("id"))
            .setName(row.getString("name"))
            .setOidTemplate(new OidTemplate(row.getString("oid_template"), row.getBoolean("requires_index")))
            .setType(MetricType.fromCode(row.getString("metric_type")))
            .setUnit(row.getString("unit"))
            .setCategory(MetricCategory.fromCode(row.getString("category")))
            .setSource(row.getString("source"))
            .setDescription(row.getString("description"));
    }

    static NodeMetricConfig toBinding(Row row)
    {
        return new NodeMetricConfig()
            .setId(row.getInteger("id"))
            .setNodeId(row.getInteger("node_id"))
            .setDefinitionId(row.getInteger("metric_definition_id"))
            .setInterfaceIndex(row.getInteger("interface_index"))
            .setInterfaceName(row.getString("interface_name"))
            .setIntervalSeconds(row.getInteger("interval_seconds"))
            .setEnabled(row.getBoolean("enabled"))
            .setAlertCondition(AlertCondition.fromCode(row.getString("alert_condition")))
            .setWarningThreshold(row.getDouble("warning_threshold"))
            .setCriticalThreshold(row.getDouble("critical_threshold"));
    }
}
