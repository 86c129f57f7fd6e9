package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

/**
 * Alerting settings from the "alerts" block of application.conf.
 */
public class AlertSettings
{

    private final int windowSeconds;

    private final int threshold;

    private final int cooldownSeconds;

    private final int defaultPriority;

    private final boolean maintenanceMode;

    private final int metricCooldownSeconds;

    private final String pushoverToken;

    private final String pushoverUser;

    private final String pushoverUrl;

    public AlertSettings(int windowSeconds, int threshold, int cooldownSeconds, int defaultPriority,
                         boolean maintenanceMode, int metricCooldownSeconds, String pushoverToken,
                         String pushoverUser, String pushoverUrl)
    {
        this.windowSeconds = windowSeconds;

        this.threshold = Math.max(1, threshold);

        this.cooldownSeconds = cooldownSeconds;

        this.defaultPriority = defaultPriority;

        this.maintenanceMode = maintenanceMode;

        this.metricCooldownSeconds = metricCooldownSeconds;

        this.pushoverToken = pushoverToken;

        this.pushoverUser = pushoverUser;

        this.pushoverUrl = pushoverUrl;
    }

    public static AlertSettings fromConfig(JsonObject config)
    {
        var alerts = config.getJsonObject("alerts", new JsonObject());

        var windowSeconds = alerts.getJsonObject("window", new JsonObject()).getInteger("seconds", 60);

        var threshold = alerts.getInteger("threshold", 5);

        var cooldownSeconds = alerts.getJsonObject("cooldown", new JsonObject()).getInteger("seconds", 60);

        var defaultPriority = alerts.getJsonObject("default", new JsonObject()).getInteger("priority", 0);

        var maintenanceMode = alerts.getJsonObject("maintenance", new JsonObject()).getBoolean("mode", false);

        var metricCooldownSeconds = alerts.getJsonObject("metric", new JsonObject())
                .getJsonObject("cooldown", new JsonObject())
                .getInteger("seconds", 60);

        var pushover = alerts.getJsonObject("pushover", new JsonObject());

        return new AlertSettings(windowSeconds, threshold, cooldownSeconds, defaultPriority, maintenanceMode,
            metricCooldownSeconds,
            pushover.getString("token", ""),
            pushover.getString("user", ""),
            pushover.getString("url", "https://api.pushover.net/1/messages.json"));
    }

    public boolean isPushoverConfigured()
    {
        return pushoverToken != null && !pushoverToken.isBlank() && pushoverUser != null && !pushoverUser.isBlank();
    }

    public int getWindowSeconds()
    {
        return windowSeconds;
    }

    public int getThreshold()
    {
        return threshold;
    }

    public int getCooldownSeconds()
    {
        return cooldownSeconds;
    }

    public int getDefaultPriority()
    {
        return defaultPriority;
    }

    public boolean isMaintenanceMode()
    {
        return maintenanceMode;
    }

    public int getMetricCooldownSeconds()
    {
        return metricCooldownSeconds;
    }

    public String getPushoverToken()
    {
        return pushoverToken;
    }

    public String getPushoverUser()
    {
        return pushoverUser;
    }

    public String getPushoverUrl()
    {
        return pushoverUrl;
    }
}
