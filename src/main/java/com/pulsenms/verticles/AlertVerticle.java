package com.pulsenms.verticles;

import com.pulsenms.core.AlertThrottler;

import com.pulsenms.core.InventoryCache;

import com.pulsenms.core.MetricCollector;

import com.pulsenms.core.TraceBus;

import com.pulsenms.core.TraceSubscription;

import com.pulsenms.models.BreachChange;

import com.pulsenms.models.TraceEvent;

import io.vertx.core.AbstractVerticle;

import io.vertx.core.Promise;

import io.vertx.core.eventbus.Message;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * AlertVerticle - Connects the trace bus and metric breaches to the alert throttler

 * Responsibilities:
 * - Live trace subscription feeding status changes to the throttler
 * - Re-publishes each trace event on "trace.event"
 * - Periodic storm re-evaluation

 * Event bus:
 * - alerts.maintenance {enabled} → toggles maintenance mode, replies with throttler status
 * - alerts.status                → throttler status
 * - trace.recent {limit?}        → most recent trace events, oldest first
 */
public class AlertVerticle extends AbstractVerticle
{

    private static final Logger logger = LoggerFactory.getLogger(AlertVerticle.class);

    public static final String TRACE_EVENT_ADDRESS = "trace.event";

    public static final String TRACE_RECENT_ADDRESS = "trace.recent";

    public static final String MAINTENANCE_ADDRESS = "alerts.maintenance";

    public static final String STATUS_ADDRESS = "alerts.status";

    static final long EVALUATE_PERIOD_MS = 5000;

    private final TraceBus traceBus;

    private final AlertThrottler throttler;

    private final InventoryCache inventoryCache;

    private final MetricCollector collector;

    private TraceSubscription subscription;

    private long evaluateTimerId = -1;

    public AlertVerticle(TraceBus traceBus, AlertThrottler throttler, InventoryCache inventoryCache, MetricCollector collector)
    {
        this.traceBus = traceBus;

        this.throttler = throttler;

        this.inventoryCache = inventoryCache;

        this.collector = collector;
    }

    @Override
    public void start(Promise<Void> startPromise)
    {
        try
        {
            logger.info("Starting AlertVerticle");

            subscribe();

            var verticleContext = context;

            collector.setBreachListener(change -> verticleContext.runOnContext(v -> handleBreach(change)));

            evaluateTimerId = vertx.setPeriodic(EVALUATE_PERIOD_MS, id -> throttler.evaluate());

            setupEventBusConsumers();

            logger.info("AlertVerticle started (maintenance mode: {})", throttler.isMaintenanceMode());

            startPromise.complete();
        }
        catch (Exception exception)
        {
            logger.error("Error in start: {}", exception.getMessage());

            startPromise.fail(exception);
        }
    }

    private void subscribe()
    {
        // Every DOWN and recovery must reach the throttler, a burst may not drop this subscriber
        subscription = traceBus.subscribeUnbounded(context, this::handleTraceEvent);
    }

    private void handleTraceEvent(TraceEvent event)
    {
        try
        {
            vertx.eventBus().publish(TRACE_EVENT_ADDRESS, event.toJson());

            var node = inventoryCache.current().node(event.getNodeId());

            var decision = throttler.onStatusChange(event, node != null ? node.getNotificationPriority() : null);

            logger.debug("Alert decision for {}: {}", event, decision);
        }
        catch (Exception exception)
        {
            logger.error("Error in handleTraceEvent: {}", exception.getMessage());
        }
    }

    private void handleBreach(BreachChange change)
    {
        try
        {
            var node = inventoryCache.current().node(change.getNodeId());

            var decision = throttler.onBreachChange(change, node != null ? node.getNotificationPriority() : null);

            logger.debug("Alert decision for {} on {}: {}", change.getMetricName(), change.getNodeName(), decision);
        }
        catch (Exception exception)
        {
            logger.error("Error in handleBreach: {}", exception.getMessage());
        }
    }

    private void setupEventBusConsumers()
    {
        try
        {
            vertx.eventBus().<JsonObject>consumer(MAINTENANCE_ADDRESS, this::handleMaintenance);

            vertx.eventBus().consumer(STATUS_ADDRESS, message -> message.reply(throttler.status()));

            vertx.eventBus().<JsonObject>consumer(TRACE_RECENT_ADDRESS, this::handleRecent);
        }
        catch (Exception exception)
        {
            logger.error("Error in setupEventBusConsumers: {}", exception.getMessage());
        }
    }

    private void handleMaintenance(Message<JsonObject> message)
    {
        try
        {
            var enabled = message.body() != null ? message.body().getBoolean("enabled") : null;

            if (enabled == null)
            {
                message.fail(400, "enabled is required");

                return;
            }

            throttler.setMaintenanceMode(enabled);

            message.reply(throttler.status());
        }
        catch (Exception exception)
        {
            logger.error("Error in handleMaintenance: {}", exception.getMessage());

            message.fail(500, exception.getMessage());
        }
    }

    private void handleRecent(Message<JsonObject> message)
    {
        try
        {
            var limit = message.body() != null ? message.body().getInteger("limit", traceBus.getCapacity()) : traceBus.getCapacity();

            var events = new JsonArray();

            traceBus.recent(limit).forEach(event -> events.add(event.toJson()));

            message.reply(events);
        }
        catch (Exception exception)
        {
            logger.error("Error in handleRecent: {}", exception.getMessage());

            message.fail(500, exception.getMessage());
        }
    }

    @Override
    public void stop()
    {
        if (evaluateTimerId >= 0)
        {
            vertx.cancelTimer(evaluateTimerId);
        }

        if (subscription != null)
        {
            subscription.close();
        }

        collector.setBreachListener(null);

        logger.info("AlertVerticle stopped");
    }
}
