package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

/**
 * Deployment-wide monitoring settings from the "monitoring" block of application.conf.

 * Configuration in application.conf:
 * monitoring {
 *   probe.timeout.ms = 5000             # Per-probe timeout
 *   probe.pool.size = 32                # Worker threads for blocking probes
 *   max.retries = 3                     # Failures before DOWN (group/node may override)
 *   inventory.refresh.seconds = 60      # Periodic inventory re-read
 *   fping.path = "fping"                # fping executable
 * }
 */
public class MonitoringSettings
{

    private final int probeTimeoutMs;

    private final int probePoolSize;

    private final int maxRetries;

    private final int inventoryRefreshSeconds;

    private final String fpingPath;

    public MonitoringSettings(int probeTimeoutMs, int probePoolSize, int maxRetries, int inventoryRefreshSeconds,
                              String fpingPath)
    {
        this.probeTimeoutMs = probeTimeoutMs;

        this.probePoolSize = probePoolSize;

        this.maxRetries = maxRetries;

        this.inventoryRefreshSeconds = inventoryRefreshSeconds;

        this.fpingPath = fpingPath;
    }

    /**
     * Read settings from the application configuration.
     *
     * @param config Full application configuration
     * @return Settings with defaults for missing keys
     */
    public static MonitoringSettings fromConfig(JsonObject config)
    {
        var monitoring = config.getJsonObject("monitoring", new JsonObject());

        // HOCON parses dotted keys as nested objects: probe.timeout.ms becomes probe -> timeout -> ms
        var probe = monitoring.getJsonObject("probe", new JsonObject());

        var probeTimeoutMs = probe.getJsonObject("timeout", new JsonObject()).getInteger("ms", 5000);

        var probePoolSize = probe.getJsonObject("pool", new JsonObject()).getInteger("size", 32);

        var maxRetries = monitoring.getJsonObject("max", new JsonObject()).getInteger("retries", 3);

        var refreshSeconds = monitoring.getJsonObject("inventory", new JsonObject())
                .getJsonObject("refresh", new JsonObject())
                .getInteger("seconds", 60);

        var fpingPath = monitoring.getJsonObject("fping", new JsonObject()).getString("path", "fping");

        return new MonitoringSettings(probeTimeoutMs, probePoolSize, maxRetries, refreshSeconds, fpingPath);
    }

    public int getProbeTimeoutMs()
    {
        return probeTimeoutMs;
    }

    public int getProbePoolSize()
    {
        return probePoolSize;
    }

    public int getMaxRetries()
    {
        return maxRetries;
    }

    public int getInventoryRefreshSeconds()
    {
        return inventoryRefreshSeconds;
    }

    public String getFpingPath()
    {
        return fpingPath;
    }
}
