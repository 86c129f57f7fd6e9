package com.pulsenms;

import com.pulsenms.core.AlertThrottler;

import com.pulsenms.core.DatabaseInitializer;

import com.pulsenms.core.InventoryCache;

import com.pulsenms.core.LoggingConfigurator;

import com.pulsenms.core.MetricCollector;

import com.pulsenms.core.NetworkProbe;

import com.pulsenms.core.StatusCache;

import com.pulsenms.core.StatusEngine;

import com.pulsenms.core.TraceBus;

import com.pulsenms.models.AlertSettings;

import com.pulsenms.models.MonitoringSettings;

import com.pulsenms.models.TraceSettings;

import com.pulsenms.services.Notifier;

import com.pulsenms.services.impl.LoggingNotifier;

import com.pulsenms.services.impl.PushoverNotifier;

import com.pulsenms.verticles.AlertVerticle;

import com.pulsenms.verticles.DiscoveryVerticle;

import com.pulsenms.verticles.MonitoringVerticle;

import io.vertx.config.ConfigRetriever;

import io.vertx.config.ConfigRetrieverOptions;

import io.vertx.config.ConfigStoreOptions;

import io.vertx.core.DeploymentOptions;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.List;

/**
 * PulseNMS - Main Entry Point (Vert.x 5)

 * Startup sequence:
 * 1. Load application.conf (HOCON) and configure logging
 * 2. Initialize the database (pool, schema, metric catalog)
 * 3. Build the shared core: probe, status cache, trace bus, status engine, collector, throttler
 * 4. Deploy AlertVerticle → MonitoringVerticle → DiscoveryVerticle

 * AlertVerticle is deployed first so no status change is published before the
 * throttler listens.
 */
public class Bootstrap
{

    private static final Logger logger = LoggerFactory.getLogger(Bootstrap.class);

    private static Vertx vertx;

    private static JsonObject config;

    private static DatabaseInitializer databaseInitializer;

    private static NetworkProbe networkProbe;

    private static PushoverNotifier pushoverNotifier;

    private static final List<String> deployedVerticleIds = new ArrayList<>();

    public static void main(String[] args)
    {
        logger.info("Starting PulseNMS");

        vertx = Vertx.vertx();

        loadConfiguration()
            .compose(loaded ->
            {
                config = loaded;

                LoggingConfigurator.configure(loaded);

                databaseInitializer = new DatabaseInitializer(vertx, loaded.getJsonObject("database", new JsonObject()));

                return databaseInitializer.initialize();
            })
            .compose(v -> deployAllVerticles(config))
            .onSuccess(v ->
            {
                logger.info("PulseNMS started successfully");

                Runtime.getRuntime().addShutdownHook(new Thread(() ->
                {
                    logger.info("Shutdown signal received");

                    cleanup()
                        .compose(cleanupResult -> vertx.close())
                        .onSuccess(closeResult -> logger.info("Application stopped gracefully"))
                        .onFailure(cause -> logger.error("Error during graceful shutdown", cause));
                }));
            })
            .onFailure(cause ->
            {
                logger.error("Failed to start PulseNMS", cause);

                cleanup()
                    .compose(cleanupResult -> vertx.close())
                    .onComplete(closeResult ->
                    {
                        if (closeResult.failed())
                        {
                            logger.error("Failed to close Vertx instance", closeResult.cause());
                        }

                        System.exit(1);
                    });
            });
    }

    /**
     * Wire the shared core and deploy the verticles in order.
     *
     * @param config Application configuration
     * @return Future that completes when all verticles are deployed
     */
    private static Future<Void> deployAllVerticles(JsonObject config)
    {
        logger.info("Deploying verticles");

        var clock = Clock.systemUTC();

        var monitoringSettings = MonitoringSettings.fromConfig(config);

        var alertSettings = AlertSettings.fromConfig(config);

        var traceSettings = TraceSettings.fromConfig(config);

        networkProbe = new NetworkProbe(monitoringSettings.getFpingPath());

        var statusCache = new StatusCache(clock);

        var traceBus = new TraceBus(traceSettings.getCapacity(), traceSettings.getSubscriberBacklog());

        var statusEngine = new StatusEngine(statusCache, traceBus, clock, monitoringSettings.getMaxRetries());

        var collector = new MetricCollector(networkProbe, statusCache, clock, monitoringSettings.getProbeTimeoutMs());

        var inventoryCache = new InventoryCache(databaseInitializer.getInventorySource());

        var throttler = new AlertThrottler(createNotifier(alertSettings), alertSettings, clock);

        var options = new DeploymentOptions().setConfig(config);

        return vertx.deployVerticle(new AlertVerticle(traceBus, throttler, inventoryCache, collector), options)
            .compose(alertId ->
            {
                deployedVerticleIds.add(alertId);

                logger.debug("AlertVerticle deployed: {}", alertId);

                return vertx.deployVerticle(new MonitoringVerticle(networkProbe, inventoryCache, statusCache, statusEngine,
                    collector, databaseInitializer.getMetricsSink(), clock), options);
            })
            .compose(monitoringId ->
            {
                deployedVerticleIds.add(monitoringId);

                logger.debug("MonitoringVerticle deployed: {}", monitoringId);

                return vertx.deployVerticle(new DiscoveryVerticle(networkProbe, inventoryCache,
                    databaseInitializer.getNodeStore(), clock), options);
            })
            .compose(discoveryId ->
            {
                deployedVerticleIds.add(discoveryId);

                logger.debug("DiscoveryVerticle deployed: {}", discoveryId);

                logger.info("All {} verticles deployed successfully", deployedVerticleIds.size());

                return Future.<Void>succeededFuture();
            })
            .onFailure(cause -> logger.error("Failed to deploy verticles", cause));
    }

    private static Notifier createNotifier(AlertSettings alertSettings)
    {
        if (alertSettings.isPushoverConfigured())
        {
            pushoverNotifier = new PushoverNotifier(vertx, alertSettings);

            logger.info("Notifications via Pushover");

            return pushoverNotifier;
        }

        logger.warn("Pushover not configured, notifications are written to the log only");

        return new LoggingNotifier();
    }

    /**
     * Undeploy verticles, close the database pool, the probe and the notifier.
     *
     * @return Future that completes when cleanup is done
     */
    private static Future<Void> cleanup()
    {
        logger.info("Starting cleanup");

        var cleanupFutures = new ArrayList<Future<Void>>();

        for (var deploymentId : deployedVerticleIds)
        {
            var undeployFuture = vertx.undeploy(deploymentId)
                .onSuccess(v -> logger.debug("Verticle undeployed: {}", deploymentId))
                .onFailure(cause -> logger.error("Failed to undeploy verticle: {}", deploymentId, cause));

            cleanupFutures.add(undeployFuture);
        }

        return Future.join(cleanupFutures)
            .transform(undeployed ->
            {
                deployedVerticleIds.clear();

                return databaseInitializer != null ? databaseInitializer.cleanup() : Future.<Void>succeededFuture();
            })
            .onComplete(result ->
            {
                // Always release the probe and the HTTP client, regardless of success or failure
                if (networkProbe != null)
                {
                    networkProbe.close();
                }

                if (pushoverNotifier != null)
                {
                    pushoverNotifier.close();
                }
            });
    }

    /**
     * Loads application configuration from application.conf using HOCON format.
     *
     * @return Future containing the loaded configuration
     */
    private static Future<JsonObject> loadConfiguration()
    {
        var promise = Promise.<JsonObject>promise();

        var fileStore = new ConfigStoreOptions()
            .setType("file")
            .setFormat("hocon")
            .setConfig(new JsonObject().put("path", "application.conf"));

        var options = new ConfigRetrieverOptions().addStore(fileStore);

        var retriever = ConfigRetriever.create(vertx, options);

        retriever.getConfig()
            .onSuccess(loaded ->
            {
                var dbConfig = loaded.getJsonObject("database", new JsonObject());

                logger.info("Configuration loaded - Database: {}:{}/{}",
                    dbConfig.getString("host"),
                    dbConfig.getInteger("port"),
                    dbConfig.getString("database"));

                promise.complete(loaded);
            })
            .onFailure(cause ->
            {
                logger.error("Failed to load configuration from application.conf", cause);

                promise.fail(cause);
            });

        return promise.future();
    }
}
