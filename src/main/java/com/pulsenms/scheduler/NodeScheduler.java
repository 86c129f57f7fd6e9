package com.pulsenms.scheduler;

import com.pulsenms.core.MetricCollector;

import com.pulsenms.core.ProtocolProbe;

import com.pulsenms.core.StatusEngine;

import com.pulsenms.models.Inventory;

import com.pulsenms.models.MonitoringSettings;

import com.pulsenms.services.MetricsSink;

import io.vertx.core.Vertx;

import io.vertx.core.WorkerExecutor;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.HashMap;

import java.util.HashSet;

import java.util.Map;

import java.util.function.Supplier;

/**
 * NodeScheduler - Owns the per-node loops

 * Reconciliation against each applied inventory:
 * - new node            → check loop and metric loop started, first check immediately
 * - deleted node        → loops cancelled, status record dropped
 * - interval changed    → loops re-created on the new interval
 * - node/group disabled → PAUSED immediately, in-flight results discarded
 * - re-enabled          → immediate check, the next completed check decides the status

 * All methods must be called on the monitoring verticle's context.
 */
public class NodeScheduler
{

    private static final Logger logger = LoggerFactory.getLogger(NodeScheduler.class);

    private final Vertx vertx;

    private final WorkerExecutor checkExecutor;

    private final WorkerExecutor metricExecutor;

    private final ProtocolProbe probe;

    private final StatusEngine statusEngine;

    private final MetricCollector collector;

    private final MetricsSink metricsSink;

    private final MonitoringSettings settings;

    private final Supplier<Inventory> inventory;

    private final Clock clock;

    private final Map<Integer, NodeCheckLoop> checkLoops = new HashMap<>();

    private final Map<Integer, MetricCollectionLoop> metricLoops = new HashMap<>();

    private final Map<Integer, Boolean> activeState = new HashMap<>();

    /**
     * @param vertx Vert.x instance
     * @param checkExecutor Pool of the reachability probes, one thread per node at most
     * @param metricExecutor Pool of the SNMP metric polls, one thread per node at most
     * @param probe Protocol probe
     * @param statusEngine Status state machine
     * @param collector Metric collector
     * @param metricsSink Destination of metric samples
     * @param settings Monitoring settings
     * @param inventory Current inventory view
     * @param clock Time source
     */
    public NodeScheduler(Vertx vertx, WorkerExecutor checkExecutor, WorkerExecutor metricExecutor, ProtocolProbe probe,
                         StatusEngine statusEngine, MetricCollector collector, MetricsSink metricsSink,
                         MonitoringSettings settings, Supplier<Inventory> inventory, Clock clock)
    {
        this.vertx = vertx;

        this.checkExecutor = checkExecutor;

        this.metricExecutor = metricExecutor;

        this.probe = probe;

        this.statusEngine = statusEngine;

        this.collector = collector;

        this.metricsSink = metricsSink;

        this.settings = settings;

        this.inventory = inventory;

        this.clock = clock;
    }

    /**
     * Bring the running loops in line with an inventory.
     *
     * @param snapshot Validated inventory
     */
    public void reconcile(Inventory snapshot)
    {
        var seen = new HashSet<Integer>();

        var started = 0;

        for (var node : snapshot.nodes())
        {
            var group = snapshot.group(node.getGroupId());

            if (group == null)
            {
                continue;
            }

            var nodeId = node.getId();

            seen.add(nodeId);

            var interval = node.effectiveInterval(group);

            var active = node.isActive(group);

            var existing = checkLoops.get(nodeId);

            if (existing != null && existing.getIntervalSeconds() != interval)
            {
                logger.info("Interval of {} changed {}s -> {}s, restarting loops", node.getName(),
                    existing.getIntervalSeconds(), interval);

                stopLoops(nodeId);

                existing = null;
            }

            if (existing == null)
            {
                startLoops(nodeId, interval, active);

                started++;

                continue;
            }

            var wasActive = activeState.getOrDefault(nodeId, true);

            if (wasActive && !active)
            {
                existing.pauseNow();

                metricLoops.get(nodeId).pauseNow();
            }
            else if (!wasActive && active)
            {
                logger.info("Node {} resumed", node.getName());

                existing.checkNow();
            }

            activeState.put(nodeId, active);
        }

        var removed = new HashSet<>(checkLoops.keySet());

        removed.removeAll(seen);

        for (var nodeId : removed)
        {
            stopLoops(nodeId);

            statusEngine.remove(nodeId);

            logger.info("Node {} removed from monitoring", nodeId);
        }

        if (started > 0 && checkLoops.size() > settings.getProbePoolSize())
        {
            logger.warn("{} nodes monitored with a probe pool of {} threads, checks of healthy nodes may queue "
                + "behind unresponsive ones (raise monitoring.probe.pool.size)", checkLoops.size(), settings.getProbePoolSize());
        }

        if (started > 0 || !removed.isEmpty())
        {
            logger.debug("Scheduler reconciled: {} loops started, {} removed, {} running", started, removed.size(),
                checkLoops.size());
        }
    }

    private void startLoops(int nodeId, int interval, boolean active)
    {
        var checkLoop = new NodeCheckLoop(vertx, checkExecutor, probe, statusEngine, settings, inventory, clock, nodeId, interval);

        var metricLoop = new MetricCollectionLoop(vertx, metricExecutor, collector, metricsSink, inventory, clock, nodeId);

        checkLoops.put(nodeId, checkLoop);

        metricLoops.put(nodeId, metricLoop);

        activeState.put(nodeId, active);

        if (!active)
        {
            checkLoop.pauseNow();
        }

        checkLoop.start();

        metricLoop.start();
    }

    private void stopLoops(int nodeId)
    {
        var checkLoop = checkLoops.remove(nodeId);

        if (checkLoop != null)
        {
            checkLoop.cancel();
        }

        var metricLoop = metricLoops.remove(nodeId);

        if (metricLoop != null)
        {
            metricLoop.cancel();
        }

        activeState.remove(nodeId);
    }

    /**
     * Run a reachability check of one node now.
     *
     * @param nodeId Node id
     * @return false when the node has no loop
     */
    public boolean checkNow(int nodeId)
    {
        var loop = checkLoops.get(nodeId);

        if (loop == null)
        {
            return false;
        }

        loop.checkNow();

        return true;
    }

    public void stopAll()
    {
        for (var nodeId : new HashSet<>(checkLoops.keySet()))
        {
            stopLoops(nodeId);
        }

        logger.info("All monitoring loops stopped");
    }

    public int loopCount()
    {
        return checkLoops.size();
    }

    public boolean hasLoop(int nodeId)
    {
        return checkLoops.containsKey(nodeId);
    }

    /**
     * @return Interval the node's loop runs on, -1 when it has none
     */
    public int intervalOf(int nodeId)
    {
        var loop = checkLoops.get(nodeId);

        return loop != null ? loop.getIntervalSeconds() : -1;
    }
}
