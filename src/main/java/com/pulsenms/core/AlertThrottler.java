package com.pulsenms.core;

import com.pulsenms.models.AlertDecision;

import com.pulsenms.models.AlertSettings;

import com.pulsenms.models.BreachChange;

import com.pulsenms.models.BreachLevel;

import com.pulsenms.models.NodeStatus;

import com.pulsenms.models.TraceEvent;

import com.pulsenms.services.Notifier;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayDeque;

import java.util.HashMap;

import java.util.LinkedHashSet;

import java.util.Locale;

import java.util.Map;

/**
 * AlertThrottler - Turns status changes and metric breaches into notifications

 * Storm mode:
 * - Transitions into DOWN are counted in a sliding window spanning all nodes
 * - When the window holds "threshold" entries one aggregated alert (priority 1) is sent
 *   and individual alerts are suppressed
 * - Storm mode ends once the window count is below the threshold and no DOWN arrived
 *   for the cool-down period

 * Maintenance mode suppresses every notification without affecting status tracking.

 * Priorities: node override when set, else the deployment default. CRITICAL metric
 * breaches are raised to at least 1.
 */
public class AlertThrottler
{

    private static final Logger logger = LoggerFactory.getLogger(AlertThrottler.class);

    public static final int STORM_PRIORITY = 1;

    private final Notifier notifier;

    private final AlertSettings settings;

    private final Clock clock;

    private final ArrayDeque<DownCandidate> window = new ArrayDeque<>();

    private final Map<String, Instant> metricNotifiedAt = new HashMap<>();

    private volatile boolean maintenanceMode;

    private boolean stormActive;

    private Instant stormStartedAt;

    private Instant lastDownAt;

    private int suppressedDuringStorm;

    public AlertThrottler(Notifier notifier, AlertSettings settings, Clock clock)
    {
        this.notifier = notifier;

        this.settings = settings;

        this.clock = clock;

        this.maintenanceMode = settings.isMaintenanceMode();
    }

    /**
     * Handle a status change from the trace bus.
     *
     * @param event Status change
     * @param nodePriority Node notification priority override, may be null
     * @return What was done with the event
     */
    public synchronized AlertDecision onStatusChange(TraceEvent event, Integer nodePriority)
    {
        var now = clock.instant();

        var goingDown = event.getNewStatus() == NodeStatus.DOWN;

        var recovering = event.getOldStatus() == NodeStatus.DOWN && event.getNewStatus() == NodeStatus.UP;

        if (!goingDown && !recovering)
        {
            evaluateAt(now);

            return AlertDecision.IGNORED;
        }

        if (goingDown)
        {
            window.addLast(new DownCandidate(now, event.getNodeName()));

            lastDownAt = now;
        }

        evaluateAt(now);

        if (goingDown && !stormActive && window.size() >= settings.getThreshold())
        {
            return startStorm(now);
        }

        if (maintenanceMode)
        {
            logger.debug("Maintenance mode: suppressed alert for {}", event);

            return AlertDecision.SUPPRESSED_MAINTENANCE;
        }

        if (stormActive)
        {
            suppressedDuringStorm++;

            logger.debug("Storm mode: suppressed alert for {}", event);

            return AlertDecision.SUPPRESSED_STORM;
        }

        var priority = resolvePriority(nodePriority);

        if (goingDown)
        {
            send(priority, "Node DOWN: " + event.getNodeName(),
                event.getNodeName() + " (" + event.getNodeIp() + ")" + groupSuffix(event) + " is DOWN: " + event.getReason());
        }
        else
        {
            send(priority, "Node UP: " + event.getNodeName(),
                event.getNodeName() + " (" + event.getNodeIp() + ")" + groupSuffix(event) + " has recovered");
        }

        return AlertDecision.SENT;
    }

    /**
     * Handle a metric breach level change.
     *
     * @param change Level change
     * @param nodePriority Node notification priority override, may be null
     * @return What was done with the change
     */
    public synchronized AlertDecision onBreachChange(BreachChange change, Integer nodePriority)
    {
        var now = clock.instant();

        evaluateAt(now);

        if (maintenanceMode)
        {
            return AlertDecision.SUPPRESSED_MAINTENANCE;
        }

        if (stormActive)
        {
            suppressedDuringStorm++;

            return AlertDecision.SUPPRESSED_STORM;
        }

        var cooldownKey = change.getNodeId() + "/" + change.getMetricKey();

        var lastNotified = metricNotifiedAt.get(cooldownKey);

        // Resolutions always go out so a sent breach alert is never left standing
        if (!change.isResolved() && lastNotified != null
            && Duration.between(lastNotified, now).getSeconds() < settings.getMetricCooldownSeconds())
        {
            logger.debug("Metric alert for {} suppressed by cooldown", cooldownKey);

            return AlertDecision.SUPPRESSED_COOLDOWN;
        }

        if (change.isResolved() && lastNotified == null)
        {
            return AlertDecision.IGNORED;
        }

        var priority = resolvePriority(nodePriority);

        String title;

        if (change.isResolved())
        {
            title = "RESOLVED: " + change.getMetricName() + " on " + change.getNodeName();

            metricNotifiedAt.remove(cooldownKey);
        }
        else
        {
            if (change.getCurrent() == BreachLevel.CRITICAL)
            {
                priority = Math.max(priority, 1);
            }

            title = change.getCurrent() + ": " + change.getMetricName() + " on " + change.getNodeName();

            metricNotifiedAt.put(cooldownKey, now);
        }

        var message = change.getNodeName() + " (" + change.getNodeIp() + ") " + change.getMetricName() + " = "
            + format(change.getValue()) + unitSuffix(change.getUnit())
            + (change.getThreshold() != null ? " (threshold " + format(change.getThreshold()) + unitSuffix(change.getUnit()) + ")" : "");

        send(priority, title, message);

        return AlertDecision.SENT;
    }

    /**
     * Re-evaluate storm mode. Called on every event and periodically.
     *
     * @return true while storm mode is active
     */
    public synchronized boolean evaluate()
    {
        evaluateAt(clock.instant());

        return stormActive;
    }

    private void evaluateAt(Instant now)
    {
        var windowStart = now.minusSeconds(settings.getWindowSeconds());

        while (!window.isEmpty() && !window.peekFirst().at.isAfter(windowStart))
        {
            window.pollFirst();
        }

        if (stormActive && window.size() < settings.getThreshold() && lastDownAt != null
            && Duration.between(lastDownAt, now).getSeconds() >= settings.getCooldownSeconds())
        {
            stormActive = false;

            logger.info("Alert storm over after {}s, {} alerts were suppressed",
                Duration.between(stormStartedAt, now).getSeconds(), suppressedDuringStorm);

            suppressedDuringStorm = 0;
        }
    }

    private AlertDecision startStorm(Instant now)
    {
        stormActive = true;

        stormStartedAt = now;

        suppressedDuringStorm = 0;

        var names = new LinkedHashSet<String>();

        window.forEach(candidate -> names.add(candidate.nodeName));

        logger.warn("Alert storm detected: {} nodes down within {}s", window.size(), settings.getWindowSeconds());

        if (maintenanceMode)
        {
            return AlertDecision.SUPPRESSED_MAINTENANCE;
        }

        send(STORM_PRIORITY, "Global Alert: " + window.size() + " nodes down",
            window.size() + " nodes went down within " + settings.getWindowSeconds() + "s: " + String.join(", ", names)
                + ". Individual alerts are paused until the network stabilises.");

        return AlertDecision.AGGREGATED;
    }

    private int resolvePriority(Integer nodePriority)
    {
        var priority = nodePriority != null ? nodePriority : settings.getDefaultPriority();

        return Math.max(-2, Math.min(2, priority));
    }

    private void send(int priority, String title, String message)
    {
        notifier.notificationSend(priority, title, message)
            .onFailure(cause -> logger.error("Failed to send notification '{}': {}", title, cause.getMessage()));
    }

    public void setMaintenanceMode(boolean maintenanceMode)
    {
        this.maintenanceMode = maintenanceMode;

        logger.info("Maintenance mode {}", maintenanceMode ? "enabled" : "disabled");
    }

    public boolean isMaintenanceMode()
    {
        return maintenanceMode;
    }

    public synchronized boolean isStormActive()
    {
        return stormActive;
    }

    public synchronized int windowCount()
    {
        return window.size();
    }

    public synchronized JsonObject status()
    {
        var nodes = new JsonArray();

        window.forEach(candidate -> nodes.add(candidate.nodeName));

        return new JsonObject()
            .put("maintenance_mode", maintenanceMode)
            .put("storm_active", stormActive)
            .put("storm_started_at", stormActive && stormStartedAt != null ? stormStartedAt.toString() : null)
            .put("window_count", window.size())
            .put("window_nodes", nodes)
            .put("suppressed", suppressedDuringStorm)
            .put("threshold", settings.getThreshold())
            .put("window_seconds", settings.getWindowSeconds());
    }

    private static String groupSuffix(TraceEvent event)
    {
        return event.getGroupName() != null ? " in " + event.getGroupName() : "";
    }

    private static String unitSuffix(String unit)
    {
        return unit != null && !unit.isBlank() ? " " + unit : "";
    }

    private static String format(double value)
    {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.format(Locale.ROOT, "%.2f", value);
    }

    private static class DownCandidate
    {
        private final Instant at;

        private final String nodeName;

        private DownCandidate(Instant at, String nodeName)
        {
            this.at = at;

            this.nodeName = nodeName;
        }
    }
}
