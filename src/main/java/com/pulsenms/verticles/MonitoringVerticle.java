package com.pulsenms.verticles;

import com.pulsenms.core.InventoryCache;

import com.pulsenms.core.MetricCollector;

import com.pulsenms.core.ProtocolProbe;

import com.pulsenms.core.StatusCache;

import com.pulsenms.core.StatusEngine;

import com.pulsenms.models.MonitoringSettings;

import com.pulsenms.scheduler.NodeScheduler;

import com.pulsenms.services.InventorySource;

import com.pulsenms.services.MetricsSink;

import io.vertx.core.AbstractVerticle;

import io.vertx.core.Promise;

import io.vertx.core.WorkerExecutor;

import io.vertx.core.eventbus.Message;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * MonitoringVerticle - Per-node reachability and metric loops

 * Responsibilities:
 * - Owns the reachability pool ("pulsenms-probe"), the metric pool ("pulsenms-metric")
 *   and the NodeScheduler
 * - Reconciles loops with every applied inventory
 * - Re-reads the inventory on "inventory.changed" and periodically

 * Event bus:
 * - monitor.status    {node_id?} → status snapshot(s)
 * - monitor.check.now {node_id}  → immediate reachability check
 */
public class MonitoringVerticle extends AbstractVerticle
{

    private static final Logger logger = LoggerFactory.getLogger(MonitoringVerticle.class);

    public static final String STATUS_ADDRESS = "monitor.status";

    public static final String CHECK_NOW_ADDRESS = "monitor.check.now";

    public static final String PROBE_POOL_NAME = "pulsenms-probe";

    public static final String METRIC_POOL_NAME = "pulsenms-metric";

    private final ProtocolProbe probe;

    private final InventoryCache inventoryCache;

    private final StatusCache statusCache;

    private final StatusEngine statusEngine;

    private final MetricCollector collector;

    private final MetricsSink metricsSink;

    private final Clock clock;

    private WorkerExecutor probeExecutor;

    private WorkerExecutor metricExecutor;

    private NodeScheduler scheduler;

    private long refreshTimerId = -1;

    public MonitoringVerticle(ProtocolProbe probe, InventoryCache inventoryCache, StatusCache statusCache,
                              StatusEngine statusEngine, MetricCollector collector, MetricsSink metricsSink, Clock clock)
    {
        this.probe = probe;

        this.inventoryCache = inventoryCache;

        this.statusCache = statusCache;

        this.statusEngine = statusEngine;

        this.collector = collector;

        this.metricsSink = metricsSink;

        this.clock = clock;
    }

    /**
     * Start the verticle: create the probe pool, load the inventory and start the loops.
     *
     * @param startPromise promise completed once the first inventory is applied
     */
    @Override
    public void start(Promise<Void> startPromise)
    {
        try
        {
            logger.info("Starting MonitoringVerticle");

            var settings = MonitoringSettings.fromConfig(config());

            probeExecutor = vertx.createSharedWorkerExecutor(PROBE_POOL_NAME, settings.getProbePoolSize());

            metricExecutor = vertx.createSharedWorkerExecutor(METRIC_POOL_NAME, settings.getProbePoolSize());

            scheduler = new NodeScheduler(vertx, probeExecutor, metricExecutor, probe, statusEngine, collector, metricsSink, settings,
                inventoryCache::current, clock);

            var verticleContext = context;

            // Listeners may fire on another context (refresh triggered elsewhere)
            inventoryCache.addListener(inventory -> verticleContext.runOnContext(v -> scheduler.reconcile(inventory)));

            setupEventBusConsumers();

            inventoryCache.refresh()
                .onSuccess(inventory ->
                {
                    refreshTimerId = vertx.setPeriodic(settings.getInventoryRefreshSeconds() * 1000L,
                        id -> inventoryCache.refresh());

                    logger.info("MonitoringVerticle started: {} nodes, probe pool {}, timeout {}ms",
                        inventory.nodes().size(), settings.getProbePoolSize(), settings.getProbeTimeoutMs());

                    startPromise.complete();
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to load inventory: {}", cause.getMessage());

                    startPromise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in start: {}", exception.getMessage());

            startPromise.fail(exception);
        }
    }

    private void setupEventBusConsumers()
    {
        try
        {
            vertx.eventBus().consumer(InventorySource.CHANGED_ADDRESS, message ->
            {
                logger.debug("Inventory change notified, reloading");

                inventoryCache.refresh();
            });

            vertx.eventBus().<JsonObject>consumer(STATUS_ADDRESS, this::handleStatus);

            vertx.eventBus().<JsonObject>consumer(CHECK_NOW_ADDRESS, this::handleCheckNow);
        }
        catch (Exception exception)
        {
            logger.error("Error in setupEventBusConsumers: {}", exception.getMessage());
        }
    }

    private void handleStatus(Message<JsonObject> message)
    {
        try
        {
            var request = message.body() != null ? message.body() : new JsonObject();

            var nodeId = request.getInteger("node_id");

            if (nodeId != null)
            {
                var snapshot = statusCache.snapshot(nodeId);

                if (snapshot == null)
                {
                    message.fail(404, "Node not monitored: " + nodeId);

                    return;
                }

                message.reply(snapshot.toJson());

                return;
            }

            var statuses = new JsonArray();

            statusCache.snapshots().forEach(snapshot -> statuses.add(snapshot.toJson()));

            message.reply(statuses);
        }
        catch (Exception exception)
        {
            logger.error("Error in handleStatus: {}", exception.getMessage());

            message.fail(500, exception.getMessage());
        }
    }

    private void handleCheckNow(Message<JsonObject> message)
    {
        try
        {
            var nodeId = message.body() != null ? message.body().getInteger("node_id") : null;

            if (nodeId == null)
            {
                message.fail(400, "node_id is required");

                return;
            }

            if (!scheduler.checkNow(nodeId))
            {
                message.fail(404, "Node not monitored: " + nodeId);

                return;
            }

            message.reply(new JsonObject().put("node_id", nodeId).put("scheduled", true));
        }
        catch (Exception exception)
        {
            logger.error("Error in handleCheckNow: {}", exception.getMessage());

            message.fail(500, exception.getMessage());
        }
    }

    @Override
    public void stop()
    {
        if (refreshTimerId >= 0)
        {
            vertx.cancelTimer(refreshTimerId);
        }

        if (scheduler != null)
        {
            scheduler.stopAll();
        }

        if (probeExecutor != null)
        {
            probeExecutor.close();
        }

        if (metricExecutor != null)
        {
            metricExecutor.close();
        }

        logger.info("MonitoringVerticle stopped");
    }

    NodeScheduler getScheduler()
    {
        return scheduler;
    }
}
