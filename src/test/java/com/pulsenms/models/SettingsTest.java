package com.pulsenms.models;

import io.vertx.config.ConfigRetriever;

import io.vertx.config.ConfigRetrieverOptions;

import io.vertx.config.ConfigStoreOptions;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import io.vertx.junit5.VertxExtension;

import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

@ExtendWith(VertxExtension.class)
class SettingsTest
{

    @Test
    void bundledHoconConfigurationIsRead(Vertx vertx, VertxTestContext testContext)
    {
        var store = new ConfigStoreOptions()
            .setType("file")
            .setFormat("hocon")
            .setConfig(new JsonObject().put("path", "application.conf"));

        ConfigRetriever.create(vertx, new ConfigRetrieverOptions().addStore(store)).getConfig()
            .onComplete(testContext.succeeding(config -> testContext.verify(() ->
            {
                var monitoring = MonitoringSettings.fromConfig(config);

                assertEquals(5000, monitoring.getProbeTimeoutMs());

                assertEquals(32, monitoring.getProbePoolSize());

                assertEquals(3, monitoring.getMaxRetries());

                var alerts = AlertSettings.fromConfig(config);

                assertEquals(60, alerts.getWindowSeconds());

                assertEquals(5, alerts.getThreshold());

                assertFalse(alerts.isMaintenanceMode());

                var discovery = DiscoverySettings.fromConfig(config);

                assertEquals(16, discovery.getConcurrency());

                assertEquals(List.of("public"), discovery.getCommunities());

                var trace = TraceSettings.fromConfig(config);

                assertEquals(500, trace.getCapacity());

                assertEquals(100, trace.getSubscriberBacklog());

                testContext.completeNow();
            })));
    }

    @Test
    void missingSectionsFallBackToDefaults()
    {
        var empty = new JsonObject();

        assertEquals(5000, MonitoringSettings.fromConfig(empty).getProbeTimeoutMs());

        assertEquals(0, AlertSettings.fromConfig(empty).getDefaultPriority());

        assertFalse(AlertSettings.fromConfig(empty).isPushoverConfigured());

        assertEquals(500, TraceSettings.fromConfig(empty).getCapacity());
    }

    @Test
    void communityListDropsBlankEntries()
    {
        assertEquals(List.of("public", "lab"),
            DiscoverySettings.toStringList(new JsonArray().add(" public ").add("").add("lab").add("  ")));
    }
}
