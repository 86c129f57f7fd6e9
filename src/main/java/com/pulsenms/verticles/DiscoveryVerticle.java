package com.pulsenms.verticles;

import com.pulsenms.core.DiscoveryImporter;

import com.pulsenms.core.DiscoveryScanner;

import com.pulsenms.core.InventoryCache;

import com.pulsenms.core.ProtocolProbe;

import com.pulsenms.models.DiscoveryProtocol;

import com.pulsenms.models.DiscoveryResult;

import com.pulsenms.models.DiscoverySettings;

import com.pulsenms.services.InventorySource;

import com.pulsenms.services.NodeStore;

import io.vertx.core.AbstractVerticle;

import io.vertx.core.Promise;

import io.vertx.core.WorkerExecutor;

import io.vertx.core.eventbus.Message;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.List;

/**
 * DiscoveryVerticle - Subnet discovery and smart-merge import

 * Event bus:
 * - discovery.scan   {target, protocols?, communities?} → replies immediately with the initial progress,
 *                     fails with 400 (invalid target) or 409 (scan already running)
 * - discovery.status                                   → current progress
 * - discovery.import {group_id, results?}              → merge report; without results the last
 *                                                         scan's results are imported
 * - discovery.progress / discovery.completed           → published while / after scanning
 */
public class DiscoveryVerticle extends AbstractVerticle
{

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryVerticle.class);

    public static final String SCAN_ADDRESS = "discovery.scan";

    public static final String STATUS_ADDRESS = "discovery.status";

    public static final String IMPORT_ADDRESS = "discovery.import";

    public static final String PROGRESS_ADDRESS = "discovery.progress";

    public static final String COMPLETED_ADDRESS = "discovery.completed";

    public static final String DISCOVERY_POOL_NAME = "pulsenms-discovery";

    private final ProtocolProbe probe;

    private final InventoryCache inventoryCache;

    private final NodeStore nodeStore;

    private final Clock clock;

    private WorkerExecutor discoveryExecutor;

    private DiscoveryScanner scanner;

    private DiscoveryImporter importer;

    public DiscoveryVerticle(ProtocolProbe probe, InventoryCache inventoryCache, NodeStore nodeStore, Clock clock)
    {
        this.probe = probe;

        this.inventoryCache = inventoryCache;

        this.nodeStore = nodeStore;

        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise)
    {
        try
        {
            logger.info("Starting DiscoveryVerticle");

            var settings = DiscoverySettings.fromConfig(config());

            // Separate pool so a sweep never starves the monitoring probes
            discoveryExecutor = vertx.createSharedWorkerExecutor(DISCOVERY_POOL_NAME, settings.getConcurrency());

            scanner = new DiscoveryScanner(probe, settings, discoveryExecutor, clock);

            scanner.setProgressListener(progress -> vertx.eventBus().publish(PROGRESS_ADDRESS, progress.toJson()));

            importer = new DiscoveryImporter(nodeStore, inventoryCache::current);

            setupEventBusConsumers();

            logger.info("DiscoveryVerticle started (concurrency {}, communities {})", settings.getConcurrency(),
                settings.getCommunities());

            startPromise.complete();
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
            vertx.eventBus().<JsonObject>consumer(SCAN_ADDRESS, this::handleScan);

            vertx.eventBus().consumer(STATUS_ADDRESS, message -> message.reply(scanner.progress().toJson()));

            vertx.eventBus().<JsonObject>consumer(IMPORT_ADDRESS, this::handleImport);
        }
        catch (Exception exception)
        {
            logger.error("Error in setupEventBusConsumers: {}", exception.getMessage());
        }
    }

    private void handleScan(Message<JsonObject> message)
    {
        try
        {
            var request = message.body() != null ? message.body() : new JsonObject();

            var target = request.getString("target");

            if (target == null || target.isBlank())
            {
                message.fail(400, "target is required");

                return;
            }

            var protocols = DiscoveryProtocol.parse(request.getJsonArray("protocols", new JsonArray()));

            var communities = DiscoverySettings.toStringList(request.getJsonArray("communities", new JsonArray()));

            var scan = scanner.scan(target, protocols, communities);

            if (scan.failed())
            {
                var code = scan.cause() instanceof IllegalStateException ? 409 : 400;

                message.fail(code, scan.cause().getMessage());

                return;
            }

            message.reply(scanner.progress().toJson());

            scan.onSuccess(progress -> vertx.eventBus().publish(COMPLETED_ADDRESS, progress.toJson()))
                .onFailure(cause -> logger.error("Discovery scan of {} failed: {}", target, cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in handleScan: {}", exception.getMessage());

            message.fail(500, exception.getMessage());
        }
    }

    private void handleImport(Message<JsonObject> message)
    {
        try
        {
            var request = message.body() != null ? message.body() : new JsonObject();

            var groupId = request.getInteger("group_id");

            if (groupId == null)
            {
                message.fail(400, "group_id is required");

                return;
            }

            var progress = scanner.progress();

            List<DiscoveryResult> results;

            if (request.containsKey("results"))
            {
                results = new ArrayList<>();

                for (var item : request.getJsonArray("results", new JsonArray()))
                {
                    if (item instanceof JsonObject)
                    {
                        results.add(DiscoveryResult.fromJson((JsonObject) item));
                    }
                }
            }
            else
            {
                if (progress.isRunning())
                {
                    message.fail(409, "Scan still in progress");

                    return;
                }

                results = progress.getResults();
            }

            var protocols = request.containsKey("protocols")
                ? DiscoveryProtocol.parse(request.getJsonArray("protocols", new JsonArray()))
                : progress.getProtocols();

            importer.importResults(groupId, results, protocols)
                .onSuccess(report ->
                {
                    if (report.getCreated() + report.getUpdated() > 0)
                    {
                        vertx.eventBus().publish(InventorySource.CHANGED_ADDRESS, new JsonObject().put("source", "discovery"));
                    }

                    message.reply(report.toJson());
                })
                .onFailure(cause ->
                {
                    var code = cause instanceof IllegalArgumentException ? 400 : 500;

                    message.fail(code, cause.getMessage());
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in handleImport: {}", exception.getMessage());

            message.fail(500, exception.getMessage());
        }
    }

    @Override
    public void stop()
    {
        if (discoveryExecutor != null)
        {
            discoveryExecutor.close();
        }

        logger.info("DiscoveryVerticle stopped");
    }
}
