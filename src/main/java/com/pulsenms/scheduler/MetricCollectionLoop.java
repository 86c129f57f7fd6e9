package com.pulsenms.scheduler;

import com.pulsenms.core.MetricCollector;

import com.pulsenms.models.Group;

import com.pulsenms.models.Inventory;

import com.pulsenms.models.MetricDefinition;

import com.pulsenms.models.Node;

import com.pulsenms.models.NodeMetricConfig;

import com.pulsenms.models.SnmpResult;

import com.pulsenms.services.MetricsSink;

import io.vertx.core.Vertx;

import io.vertx.core.WorkerExecutor;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.HashMap;

import java.util.HashSet;

import java.util.List;

import java.util.Map;

import java.util.function.Supplier;

/**
 * MetricCollectionLoop - SNMP metric collection of one node

 * Every enabled binding of the node has its own due time (binding interval, else the node's
 * effective interval). The loop sleeps until the earliest due binding, at most one node
 * interval, and re-reads the inventory on each wake-up so added, removed and re-configured
 * bindings are picked up without rebuilding the loop.

 * Bindings that are due together are polled one after the other in a single task, so a
 * node never holds more than one thread of the metric pool. While that task runs, bindings
 * falling due are skipped until the next wake-up.

 * Collection requires the node to be active and its effective monitor_snmp to be on.
 * A paused node clears its breach state. Removed bindings lose their last sample and
 * breach level.
 */
public class MetricCollectionLoop
{

    private static final Logger logger = LoggerFactory.getLogger(MetricCollectionLoop.class);

    private final Vertx vertx;

    private final WorkerExecutor executor;

    private final MetricCollector collector;

    private final MetricsSink metricsSink;

    private final Supplier<Inventory> inventory;

    private final Clock clock;

    private final int nodeId;

    // binding key -> next due time (epoch ms)
    private final Map<String, Long> dueAt = new HashMap<>();

    private boolean batchRunning;

    private long timerId = -1;

    private long generation;

    private boolean cancelled;

    public MetricCollectionLoop(Vertx vertx, WorkerExecutor executor, MetricCollector collector, MetricsSink metricsSink,
                                Supplier<Inventory> inventory, Clock clock, int nodeId)
    {
        this.vertx = vertx;

        this.executor = executor;

        this.collector = collector;

        this.metricsSink = metricsSink;

        this.inventory = inventory;

        this.clock = clock;

        this.nodeId = nodeId;
    }

    public void start()
    {
        schedule(1);
    }

    /**
     * Stop collecting. Values still being polled are discarded.
     */
    public void cancel()
    {
        cancelled = true;

        generation++;

        cancelTimer();
    }

    /**
     * Drop breach state and pending results of a node that was just paused.
     */
    public void pauseNow()
    {
        generation++;

        dueAt.clear();

        collector.clearBreaches(nodeId);
    }

    private void tick()
    {
        timerId = -1;

        if (cancelled)
        {
            return;
        }

        var nextWakeMs = 1000L;

        try
        {
            var snapshot = inventory.get();

            var node = snapshot.node(nodeId);

            if (node == null)
            {
                return;
            }

            var group = snapshot.group(node.getGroupId());

            if (group == null)
            {
                return;
            }

            var nodeInterval = node.effectiveInterval(group);

            nextWakeMs = nodeInterval * 1000L;

            if (!node.isActive(group))
            {
                if (!dueAt.isEmpty())
                {
                    pauseNow();
                }

                return;
            }

            if (!node.effectiveMonitorSnmp(group))
            {
                dueAt.clear();

                return;
            }

            var now = clock.millis();

            var activeKeys = new HashSet<String>();

            var batch = new ArrayList<NodeMetricConfig>();

            for (var config : snapshot.metricConfigsFor(nodeId))
            {
                var definition = snapshot.definition(config.getDefinitionId());

                if (!config.isEnabled() || definition == null)
                {
                    continue;
                }

                var key = config.key();

                activeKeys.add(key);

                var intervalMs = config.effectiveInterval(nodeInterval) * 1000L;

                var due = dueAt.getOrDefault(key, now);

                if (now >= due)
                {
                    batch.add(config);

                    due = due + ((now - due) / intervalMs + 1) * intervalMs;

                    dueAt.put(key, due);
                }

                nextWakeMs = Math.min(nextWakeMs, due - now);
            }

            // Bindings removed from the inventory
            dueAt.keySet().retainAll(activeKeys);

            collector.retainMetrics(nodeId, activeKeys);

            if (!batch.isEmpty())
            {
                collect(node, group, batch, snapshot);
            }
        }
        catch (Exception exception)
        {
            logger.error("Error in metric tick for node {}: {}", nodeId, exception.getMessage());
        }
        finally
        {
            schedule(nextWakeMs);
        }
    }

    private void collect(Node node, Group group, List<NodeMetricConfig> batch, Inventory snapshot)
    {
        if (batchRunning)
        {
            logger.debug("Metrics of {} still being collected, {} due bindings skipped", node.getName(), batch.size());

            return;
        }

        batchRunning = true;

        var collectGeneration = generation;

        var definitions = new ArrayList<MetricDefinition>();

        batch.forEach(config -> definitions.add(snapshot.definition(config.getDefinitionId())));

        executor.executeBlocking(() ->
            {
                var results = new ArrayList<SnmpResult>();

                for (var i = 0; i < batch.size(); i++)
                {
                    results.add(collector.poll(node, group, batch.get(i), definitions.get(i)));
                }

                return results;
            }, false)
            .onComplete(ar ->
            {
                batchRunning = false;

                if (collectGeneration != generation || cancelled)
                {
                    return;
                }

                if (ar.failed())
                {
                    logger.debug("Metrics of {} not collected: {}", node.getName(), ar.cause().getMessage());

                    return;
                }

                for (var i = 0; i < batch.size(); i++)
                {
                    store(node, batch.get(i), definitions.get(i), ar.result().get(i));
                }
            });
    }

    private void store(Node node, NodeMetricConfig config, MetricDefinition definition, SnmpResult result)
    {
        var sample = collector.process(node, config, definition, result);

        if (sample != null)
        {
            metricsSink.metricWrite(sample)
                .onFailure(cause -> logger.error("Failed to store metric {} for {}: {}",
                    definition.getName(), node.getName(), cause.getMessage()));
        }
    }

    private void schedule(long delayMs)
    {
        if (cancelled)
        {
            return;
        }

        cancelTimer();

        timerId = vertx.setTimer(Math.max(1, delayMs), id -> tick());
    }

    private void cancelTimer()
    {
        if (timerId >= 0)
        {
            vertx.cancelTimer(timerId);

            timerId = -1;
        }
    }

    public int getNodeId()
    {
        return nodeId;
    }
}
