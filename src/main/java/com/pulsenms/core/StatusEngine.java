package com.pulsenms.core;

import com.pulsenms.models.CheckResult;

import com.pulsenms.models.Group;

import com.pulsenms.models.Node;

import com.pulsenms.models.NodeStatus;

import com.pulsenms.models.TraceEvent;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.time.Duration;

import java.time.Instant;

/**
 * StatusEngine - Per-node reachability state machine

 * Transitions:
 * - success                          → UP, failure counter reset
 * - failure n, n &lt; max retries      → PENDING
 * - failure n, n &gt;= max retries     → DOWN
 * - node or group disabled           → PAUSED (counter reset, previous status kept for display)

 * Exactly one TraceEvent is published per visible status change. Repeated
 * PENDING, DOWN or UP results publish nothing.
 */
public class StatusEngine
{

    private static final Logger logger = LoggerFactory.getLogger(StatusEngine.class);

    public static final String REASON_NODE_PAUSED = "paused by user";

    public static final String REASON_GROUP_PAUSED = "group paused";

    private final StatusCache statusCache;

    private final TraceBus traceBus;

    private final Clock clock;

    private final int defaultMaxRetries;

    /**
     * @param statusCache Per-node status records
     * @param traceBus Destination of status change events
     * @param clock Time source
     * @param defaultMaxRetries Deployment default used when neither node nor group override it
     */
    public StatusEngine(StatusCache statusCache, TraceBus traceBus, Clock clock, int defaultMaxRetries)
    {
        this.statusCache = statusCache;

        this.traceBus = traceBus;

        this.clock = clock;

        this.defaultMaxRetries = defaultMaxRetries;
    }

    /**
     * Apply the result of a completed check.
     *
     * @param node Node as currently configured
     * @param group Owning group
     * @param result Aggregated check result
     * @return Published event, or null when the visible status did not change
     */
    public TraceEvent applyResult(Node node, Group group, CheckResult result)
    {
        var record = statusCache.record(node.getId());

        var now = clock.instant();

        NodeStatus previous;

        NodeStatus next;

        String reason;

        synchronized (record)
        {
            var failuresBefore = record.getStatus() == NodeStatus.PAUSED ? 0 : record.getConsecutiveFailures();

            var statusSince = record.getStatusSince();

            if (result.isSuccess())
            {
                next = NodeStatus.UP;

                previous = record.transition(next, 0, result.getLatencyMs(), result.getPacketLossPercent(), now, now);

                reason = recoveryReason(previous, failuresBefore, statusSince, now);
            }
            else
            {
                // A record coming out of PAUSED starts counting from zero
                var failures = failuresBefore + 1;

                var maxRetries = node.effectiveMaxRetries(group, defaultMaxRetries);

                next = failures >= maxRetries ? NodeStatus.DOWN : NodeStatus.PENDING;

                previous = record.transition(next, failures, null, result.getPacketLossPercent(), now, now);

                reason = next == NodeStatus.DOWN
                    ? failures + " consecutive " + (failures == 1 ? "failure" : "failures") + " (" + result.getReason() + ")"
                    : result.getReason();

                logger.debug("Check failed for {} ({}): {} of {} [{}]",
                    node.getName(), node.getIp(), failures, maxRetries, result.getReason());
            }
        }

        if (previous == next)
        {
            return null;
        }

        return publish(node, group, previous, next, reason);
    }

    /**
     * Reason of a transition into UP.
     */
    static String recoveryReason(NodeStatus previous, int failuresBefore, Instant statusSince, Instant now)
    {
        switch (previous)
        {
            case DOWN:
                var outageSeconds = statusSince != null ? Duration.between(statusSince, now).getSeconds() : 0;

                return "responded after outage of " + outageSeconds + "s";

            case PENDING:
                return "responded after " + failuresBefore + (failuresBefore == 1 ? " failed check" : " failed checks");

            case PAUSED:
                return "responded after resume";

            default:
                return "first check succeeded";
        }
    }

    /**
     * Pause a node immediately because it or its group was disabled.
     *
     * @param node Node
     * @param group Owning group
     * @return Published event, or null when already paused
     */
    public TraceEvent pause(Node node, Group group)
    {
        var record = statusCache.record(node.getId());

        NodeStatus previous;

        synchronized (record)
        {
            previous = record.transition(NodeStatus.PAUSED, 0, null, null, null, clock.instant());

            record.clearBreachLevels();
        }

        if (previous == NodeStatus.PAUSED)
        {
            return null;
        }

        var reason = node.isEnabled() ? REASON_GROUP_PAUSED : REASON_NODE_PAUSED;

        return publish(node, group, previous, NodeStatus.PAUSED, reason);
    }

    /**
     * Forget a deleted node.
     *
     * @param nodeId Node id
     */
    public void remove(int nodeId)
    {
        statusCache.remove(nodeId);
    }

    public NodeStatus statusOf(int nodeId)
    {
        var record = statusCache.find(nodeId);

        return record != null ? record.getStatus() : NodeStatus.WAITING;
    }

    public int getDefaultMaxRetries()
    {
        return defaultMaxRetries;
    }

    private TraceEvent publish(Node node, Group group, NodeStatus previous, NodeStatus next, String reason)
    {
        var event = new TraceEvent(clock.instant(), node.getId(), node.getName(), node.getIp(),
            group != null ? group.getName() : null, previous, next, reason);

        if (next == NodeStatus.DOWN)
        {
            logger.warn("Node {}", event);
        }
        else
        {
            logger.info("Node {}", event);
        }

        traceBus.publish(event);

        return event;
    }
}
