package com.pulsenms.scheduler;

import com.pulsenms.core.MetricCatalog;

import com.pulsenms.core.ProbeUnavailableException;

import com.pulsenms.core.ProtocolProbe;

import com.pulsenms.core.StatusEngine;

import com.pulsenms.models.CheckResult;

import com.pulsenms.models.Group;

import com.pulsenms.models.Inventory;

import com.pulsenms.models.MonitoringSettings;

import com.pulsenms.models.Node;

import com.pulsenms.models.NodeStatus;

import com.pulsenms.models.PingResult;

import com.pulsenms.models.SnmpResult;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.WorkerExecutor;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.function.Supplier;

/**
 * NodeCheckLoop - Reachability loop of one node

 * Timing:
 * - Ticks are aligned to the loop anchor: next = anchor + k * interval
 * - While the node is PENDING the next check runs after a third of the interval (min 1s)
 * - A tick that finds the previous check still waiting for its result is skipped

 * Each tick re-reads node and group from the inventory. Disabled node or group means
 * PAUSED without probing. The blocking probe runs on the probe worker pool, guarded by a
 * hard timeout that counts as a failed check. The guard is armed when the probe starts
 * running, so time spent queued on a busy pool never counts against the node.

 * A node never holds more than one pool thread. While a probe that outlived its guard is
 * still running, each tick records another timeout without submitting a new probe.

 * Results are applied on the loop's event loop. A result belonging to an older
 * generation (loop cancelled, node paused or checked out of band) is discarded.
 */
public class NodeCheckLoop
{

    private static final Logger logger = LoggerFactory.getLogger(NodeCheckLoop.class);

    static final long MIN_RETRY_DELAY_MS = 1000;

    static final long GUARD_GRACE_MS = 2000;

    static final String REASON_TIMED_OUT = "probe timed out";

    private final Vertx vertx;

    private final WorkerExecutor executor;

    private final ProtocolProbe probe;

    private final StatusEngine statusEngine;

    private final MonitoringSettings settings;

    private final Supplier<Inventory> inventory;

    private final Clock clock;

    private final int nodeId;

    private final int intervalSeconds;

    private final long anchorMs;

    private long timerId = -1;

    private long guardTimerId = -1;

    private long generation;

    // Current generation's check is waiting for its result
    private boolean awaitingResult;

    // A probe task holds a pool thread
    private boolean workerBusy;

    // The running probe task outlived its guard
    private boolean workerOverdue;

    // A check was requested while the previous probe was still running
    private boolean checkWhenFree;

    private boolean cancelled;

    /**
     * @param vertx Vert.x instance (timers run on the calling context)
     * @param executor Probe worker pool
     * @param probe Protocol probe
     * @param statusEngine Status state machine
     * @param settings Monitoring settings (probe timeout)
     * @param inventory Current inventory view
     * @param clock Time source
     * @param nodeId Node id
     * @param intervalSeconds Effective check interval the loop was built for
     */
    public NodeCheckLoop(Vertx vertx, WorkerExecutor executor, ProtocolProbe probe, StatusEngine statusEngine,
                         MonitoringSettings settings, Supplier<Inventory> inventory, Clock clock, int nodeId,
                         int intervalSeconds)
    {
        this.vertx = vertx;

        this.executor = executor;

        this.probe = probe;

        this.statusEngine = statusEngine;

        this.settings = settings;

        this.inventory = inventory;

        this.clock = clock;

        this.nodeId = nodeId;

        this.intervalSeconds = Math.max(1, intervalSeconds);

        this.anchorMs = clock.millis();
    }

    /**
     * Start the loop with an immediate first check.
     */
    public void start()
    {
        schedule(1);
    }

    /**
     * Run a check now, dropping any result still in flight.
     */
    public void checkNow()
    {
        if (cancelled)
        {
            return;
        }

        cancelTimer();

        generation++;

        awaitingResult = false;

        schedule(1);
    }

    /**
     * Pause the node immediately and discard in-flight results. The loop keeps ticking
     * so that re-enabling is picked up at the next boundary.
     */
    public void pauseNow()
    {
        generation++;

        awaitingResult = false;

        var snapshot = inventory.get();

        var node = snapshot.node(nodeId);

        if (node != null)
        {
            statusEngine.pause(node, snapshot.group(node.getGroupId()));
        }
    }

    /**
     * Stop the loop. Results still in flight are discarded.
     */
    public void cancel()
    {
        cancelled = true;

        generation++;

        cancelTimer();

        cancelGuard();
    }

    private void tick()
    {
        timerId = -1;

        if (cancelled)
        {
            return;
        }

        try
        {
            var snapshot = inventory.get();

            var node = snapshot.node(nodeId);

            if (node == null)
            {
                return;
            }

            var group = snapshot.group(node.getGroupId());

            if (group == null || !node.isActive(group))
            {
                if (statusEngine.statusOf(nodeId) != NodeStatus.PAUSED)
                {
                    pauseNow();
                }

                scheduleAligned();

                return;
            }

            if (awaitingResult)
            {
                logger.debug("Check of {} still running, tick skipped", node.getName());

                scheduleAligned();

                return;
            }

            if (!node.effectiveMonitorPing(group) && !node.effectiveMonitorSnmp(group))
            {
                scheduleAligned();

                return;
            }

            if (workerBusy)
            {
                if (workerOverdue)
                {
                    logger.debug("Probe of {} still running past its timeout", node.getName());

                    applyResult(CheckResult.failure(REASON_TIMED_OUT));
                }
                else
                {
                    // The previous probe is within its timeout, check as soon as it returns
                    checkWhenFree = true;
                }

                return;
            }

            runCheck(node, group);
        }
        catch (Exception exception)
        {
            logger.error("Error in tick for node {}: {}", nodeId, exception.getMessage());

            scheduleAligned();
        }
    }

    private void runCheck(Node node, Group group)
    {
        awaitingResult = true;

        workerBusy = true;

        workerOverdue = false;

        var checkGeneration = generation;

        var promise = Promise.<CheckResult>promise();

        var guardMs = guardTimeoutMs(node, group);

        var context = vertx.getOrCreateContext();

        executor.executeBlocking(() ->
            {
                context.runOnContext(v -> armGuard(promise, guardMs));

                return probeNode(node, group);
            }, false)
            .onComplete(ar ->
            {
                workerBusy = false;

                workerOverdue = false;

                cancelGuard();

                if (ar.succeeded())
                {
                    promise.tryComplete(ar.result());
                }
                else
                {
                    promise.tryFail(ar.cause());
                }

                runDeferredCheck();
            });

        promise.future().onComplete(ar ->
        {
            if (checkGeneration != generation || cancelled)
            {
                logger.debug("Discarded stale check result for {}", node.getName());

                // A pause while the probe ran leaves no tick pending
                if (!cancelled && timerId < 0 && !checkWhenFree)
                {
                    scheduleAligned();
                }

                return;
            }

            awaitingResult = false;

            if (ar.failed())
            {
                if (ar.cause() instanceof ProbeUnavailableException)
                {
                    logger.debug("Probe unavailable for {}: {}", node.getName(), ar.cause().getMessage());
                }
                else
                {
                    logger.error("Check of {} failed: {}", node.getName(), ar.cause().getMessage());
                }

                scheduleAligned();

                return;
            }

            applyResult(ar.result());
        });
    }

    private void armGuard(Promise<CheckResult> promise, long guardMs)
    {
        if (promise.future().isComplete())
        {
            return;
        }

        guardTimerId = vertx.setTimer(guardMs, id ->
        {
            guardTimerId = -1;

            workerOverdue = true;

            promise.tryComplete(CheckResult.failure(REASON_TIMED_OUT));

            runDeferredCheck();
        });
    }

    private void cancelGuard()
    {
        if (guardTimerId >= 0)
        {
            vertx.cancelTimer(guardTimerId);

            guardTimerId = -1;
        }
    }

    private void runDeferredCheck()
    {
        if (checkWhenFree && (!workerBusy || workerOverdue))
        {
            checkWhenFree = false;

            schedule(1);
        }
    }

    private void applyResult(CheckResult result)
    {
        // Configuration may have changed while the probe was running
        var snapshot = inventory.get();

        var current = snapshot.node(nodeId);

        var currentGroup = current != null ? snapshot.group(current.getGroupId()) : null;

        if (current == null || currentGroup == null || !current.isActive(currentGroup))
        {
            scheduleAligned();

            return;
        }

        statusEngine.applyResult(current, currentGroup, result);

        if (statusEngine.statusOf(nodeId) == NodeStatus.PENDING)
        {
            schedule(retryDelayMs(intervalSeconds));
        }
        else
        {
            scheduleAligned();
        }
    }

    /**
     * Ping and/or SNMP health check as currently configured.

     * WARNING: This method is BLOCKING and runs on the probe worker pool.
     */
    private CheckResult probeNode(Node node, Group group)
    {
        PingResult ping = null;

        SnmpResult snmp = null;

        if (node.effectiveMonitorPing(group))
        {
            ping = probe.ping(node.getIp(), settings.getProbeTimeoutMs(), node.effectivePacketCount(group));
        }

        if (node.effectiveMonitorSnmp(group))
        {
            snmp = probe.snmpGet(node.getIp(), node.effectiveSnmpPort(group), node.effectiveCommunity(group),
                MetricCatalog.SYS_UPTIME_OID, settings.getProbeTimeoutMs());
        }

        return CheckResult.aggregate(ping, snmp);
    }

    private long guardTimeoutMs(Node node, Group group)
    {
        var probes = (node.effectiveMonitorPing(group) ? node.effectivePacketCount(group) : 0)
            + (node.effectiveMonitorSnmp(group) ? 1 : 0);

        return (long) settings.getProbeTimeoutMs() * Math.max(1, probes) + GUARD_GRACE_MS;
    }

    static long retryDelayMs(int intervalSeconds)
    {
        return Math.max(MIN_RETRY_DELAY_MS, intervalSeconds * 1000L / 3);
    }

    /**
     * Delay until the next boundary anchor + k * interval strictly after now.
     */
    static long alignedDelayMs(long anchorMs, long nowMs, int intervalSeconds)
    {
        var intervalMs = intervalSeconds * 1000L;

        var elapsed = Math.max(0, nowMs - anchorMs);

        var next = anchorMs + (elapsed / intervalMs + 1) * intervalMs;

        return Math.max(1, next - nowMs);
    }

    private void scheduleAligned()
    {
        schedule(alignedDelayMs(anchorMs, clock.millis(), intervalSeconds));
    }

    private void schedule(long delayMs)
    {
        if (cancelled)
        {
            return;
        }

        cancelTimer();

        timerId = vertx.setTimer(Math.max(1, delayMs), id -> tick());
    }

    private void cancelTimer()
    {
        if (timerId >= 0)
        {
            vertx.cancelTimer(timerId);

            timerId = -1;
        }
    }

    public int getNodeId()
    {
        return nodeId;
    }

    public int getIntervalSeconds()
    {
        return intervalSeconds;
    }

    public boolean isCancelled()
    {
        return cancelled;
    }
}
