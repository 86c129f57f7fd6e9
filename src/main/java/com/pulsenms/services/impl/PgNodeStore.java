package com.pulsenms.services.impl;

import com.pulsenms.models.Node;

import com.pulsenms.services.NodeStore;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * PgNodeStore - Node writes used by the discovery import
 */
public class PgNodeStore implements NodeStore
{

    private static final Logger logger = LoggerFactory.getLogger(PgNodeStore.class);

    private final Pool pgPool;

    /**
     * @param pgPool PostgresSQL connection pool
     */
    public PgNodeStore(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    /**
     * Insert a node.
     *
     * @param node Node without id
     * @return Future containing the node with its generated id
     */
    @Override
    public Future<Node> nodeCreate(Node node)
    {
        var promise = Promise.<Node>promise();

        var sql = """
                INSERT INTO nodes (name, ip, group_id, interval_seconds, packet_count, max_retries,
                                   snmp_community, snmp_port, monitor_ping, monitor_snmp, enabled,
                                   notification_priority)
                VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $10, $11, $12)
                RETURNING id
                """;

        pgPool.preparedQuery(sql)
                .execute(Tuple.from(Arrays.asList(node.getName(), node.getIp(), node.getGroupId(),
                        node.getIntervalSeconds(), node.getPacketCount(), node.getMaxRetries(),
                        node.getSnmpCommunity(), node.getSnmpPort(), node.getMonitorPing(), node.getMonitorSnmp(),
                        node.isEnabled(), node.getNotificationPriority())))
                .onSuccess(rows ->
                {
                    var id = rows.iterator().next().getInteger("id");

                    promise.complete(node.copy().setId(id));
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to create node {}: {}", node.getIp(), cause.getMessage());

                    if (cause.getMessage() != null && cause.getMessage().contains("duplicate key"))
                    {
                        promise.fail(new IllegalArgumentException("A node with IP " + node.getIp() + " already exists"));
                    }
                    else if (cause.getMessage() != null && cause.getMessage().contains("foreign key"))
                    {
                        promise.fail(new IllegalArgumentException("Invalid group ID"));
                    }
                    else
                    {
                        promise.fail(cause);
                    }
                });

        return promise.future();
    }

    /**
     * Merge discovery findings into the stored row.
     *
     * @param patch Node id with the flags and community to merge
     * @return Future containing the patch, failed when the node no longer exists
     */
    @Override
    public Future<Node> nodeMergeDiscovery(Node patch)
    {
        var promise = Promise.<Node>promise();

        var sql = """
                UPDATE nodes
                SET monitor_ping = COALESCE($2, monitor_ping),
                    monitor_snmp = COALESCE($3, monitor_snmp),
                    snmp_community = COALESCE(snmp_community, $4)
                WHERE id = $1
                """;

        pgPool.preparedQuery(sql)
                .execute(Tuple.from(Arrays.asList(patch.getId(), patch.getMonitorPing(), patch.getMonitorSnmp(),
                        patch.getSnmpCommunity())))
                .onSuccess(result ->
                {
                    if (result.rowCount() == 0)
                    {
                        promise.fail(new IllegalStateException("Node not found: " + patch.getId()));

                        return;
                    }

                    promise.complete(patch);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to merge discovery into node {}: {}", patch.getId(), cause.getMessage());

                    promise.fail(cause);
                });

        return promise.future();
    }
}
