package com.pulsenms.core;

import com.pulsenms.models.DiscoveryProgress;

import com.pulsenms.models.DiscoveryProtocol;

import com.pulsenms.models.DiscoveryResult;

import com.pulsenms.models.DiscoverySettings;

import com.pulsenms.models.Group;

import com.pulsenms.utils.DeviceClassifier;

import com.pulsenms.utils.IPRangeUtil;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.WorkerExecutor;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.net.InetAddress;

import java.net.UnknownHostException;

import java.time.Clock;

import java.time.Instant;

import java.util.ArrayList;

import java.util.Collections;

import java.util.Comparator;

import java.util.EnumSet;

import java.util.List;

import java.util.Objects;

import java.util.Set;

import java.util.concurrent.atomic.AtomicBoolean;

import java.util.concurrent.atomic.AtomicInteger;

import java.util.function.Consumer;

import java.util.function.Function;

/**
 * DiscoveryScanner - Subnet sweep with bounded concurrency

 * Workflow per address:
 * 1. ICMP ping (when requested)
 * 2. SNMP sysDescr / sysName with each configured community in turn, only on ICMP
 *    responders when ICMP was requested, on every address otherwise
 * 3. Reverse DNS hostname, falling back to sysName
 * 4. Vendor and device type guessed from sysDescr

 * Inclusion: ICMP responders when ICMP was requested, SNMP responders otherwise.

 * Concurrency: addresses are probed on the dedicated discovery worker pool in batches
 * of at most "concurrency" addresses (never more than the number of addresses).
 * Only one scan runs at a time. A failing address never aborts the scan.
 */
public class DiscoveryScanner
{

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryScanner.class);

    private final ProtocolProbe probe;

    private final DiscoverySettings settings;

    private final WorkerExecutor executor;

    private final Function<String, String> hostnameResolver;

    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final AtomicInteger scanned = new AtomicInteger();

    private final AtomicInteger icmpFound = new AtomicInteger();

    private final AtomicInteger snmpFound = new AtomicInteger();

    private final List<DiscoveryResult> results = Collections.synchronizedList(new ArrayList<>());

    private volatile Consumer<DiscoveryProgress> progressListener = progress -> { };

    private volatile String target;

    private volatile Set<DiscoveryProtocol> protocols = EnumSet.noneOf(DiscoveryProtocol.class);

    private volatile int total;

    private volatile Instant startedAt;

    private volatile Instant finishedAt;

    private volatile String error;

    /**
     * @param probe Probe used for ICMP and SNMP
     * @param settings Discovery settings
     * @param executor Dedicated discovery worker pool
     * @param clock Time source
     */
    public DiscoveryScanner(ProtocolProbe probe, DiscoverySettings settings, WorkerExecutor executor, Clock clock)
    {
        this(probe, settings, executor, clock, DiscoveryScanner::reverseLookup);
    }

    public DiscoveryScanner(ProtocolProbe probe, DiscoverySettings settings, WorkerExecutor executor, Clock clock,
                            Function<String, String> hostnameResolver)
    {
        this.probe = probe;

        this.settings = settings;

        this.executor = executor;

        this.clock = clock;

        this.hostnameResolver = hostnameResolver;
    }

    public void setProgressListener(Consumer<DiscoveryProgress> progressListener)
    {
        this.progressListener = progressListener != null ? progressListener : progress -> { };
    }

    /**
     * Start a scan.
     *
     * @param scanTarget CIDR block, range or single address
     * @param requested Protocols to use (both when empty)
     * @param communities Communities to try (deployment defaults when empty)
     * @return Future containing the final progress, failed with IllegalArgumentException for an
     *         invalid target or IllegalStateException when a scan is already running
     */
    public Future<DiscoveryProgress> scan(String scanTarget, Set<DiscoveryProtocol> requested, List<String> communities)
    {
        List<String> addresses;

        try
        {
            addresses = IPRangeUtil.expandTarget(scanTarget);
        }
        catch (IllegalArgumentException exception)
        {
            return Future.failedFuture(exception);
        }

        if (!running.compareAndSet(false, true))
        {
            return Future.failedFuture(new IllegalStateException("Scan already in progress"));
        }

        var scanProtocols = requested == null || requested.isEmpty()
            ? EnumSet.allOf(DiscoveryProtocol.class)
            : EnumSet.copyOf(requested);

        var scanCommunities = communities == null || communities.isEmpty() ? settings.getCommunities() : List.copyOf(communities);

        target = scanTarget.trim();

        protocols = scanProtocols;

        total = addresses.size();

        scanned.set(0);

        icmpFound.set(0);

        snmpFound.set(0);

        results.clear();

        startedAt = clock.instant();

        finishedAt = null;

        error = null;

        var batchSize = Math.min(settings.getConcurrency(), addresses.size());

        logger.info("Discovery scan of {} started: {} addresses, protocols {}, concurrency {}",
            target, total, scanProtocols, batchSize);

        notifyProgress();

        var processor = new QueueBatchProcessor<String, DiscoveryResult>(addresses, batchSize)
        {
            @Override
            protected Future<List<DiscoveryResult>> processBatch(List<String> batch)
            {
                var futures = new ArrayList<Future<DiscoveryResult>>();

                for (var ip : batch)
                {
                    futures.add(executor.executeBlocking(() -> probeAddress(ip, scanProtocols, scanCommunities), false));
                }

                return Future.join(futures).transform(ar ->
                {
                    List<DiscoveryResult> found = new ArrayList<>();

                    futures.stream()
                        .filter(Future::succeeded)
                        .map(Future::result)
                        .filter(Objects::nonNull)
                        .forEach(found::add);

                    notifyProgress();

                    return Future.succeededFuture(found);
                });
            }

            @Override
            protected void handleBatchFailure(List<String> batch, Throwable cause)
            {
                logger.warn("Discovery batch of {} addresses failed: {}", batch.size(), cause.getMessage());
            }
        };

        var promise = Promise.<List<DiscoveryResult>>promise();

        processor.processNext(promise);

        return promise.future()
            .transform(ar ->
            {
                if (ar.failed())
                {
                    error = ar.cause().getMessage();

                    logger.error("Discovery scan of {} failed: {}", target, error);
                }

                finishedAt = clock.instant();

                running.set(false);

                var finalProgress = progress();

                logger.info("Discovery scan of {} finished: {}/{} scanned, {} ICMP, {} SNMP, {} results",
                    target, finalProgress.getScanned(), total, icmpFound.get(), snmpFound.get(),
                    finalProgress.getResults().size());

                notifyProgress();

                return Future.succeededFuture(finalProgress);
            });
    }

    /**
     * Probe one address.

     * WARNING: This method is BLOCKING and runs on the discovery worker pool.
     *
     * @return Result, or null when the address is not included
     */
    private DiscoveryResult probeAddress(String ip, Set<DiscoveryProtocol> scanProtocols, List<String> communities)
    {
        try
        {
            var useIcmp = scanProtocols.contains(DiscoveryProtocol.ICMP);

            var useSnmp = scanProtocols.contains(DiscoveryProtocol.SNMP);

            Double latency = null;

            if (useIcmp)
            {
                var ping = probe.ping(ip, settings.getIcmpTimeoutMs(), 1);

                if (ping.isSuccess())
                {
                    latency = ping.getLatencyMs() != null ? ping.getLatencyMs() : 0.0;

                    icmpFound.incrementAndGet();
                }
            }

            String community = null;

            String sysDescr = null;

            String sysName = null;

            if (useSnmp && (!useIcmp || latency != null))
            {
                for (var candidate : communities)
                {
                    var descr = probe.snmpGet(ip, Group.DEFAULT_SNMP_PORT, candidate, MetricCatalog.SYS_DESCR_OID,
                        settings.getSnmpTimeoutMs());

                    if (descr.isSuccess())
                    {
                        community = candidate;

                        sysDescr = descr.getValue();

                        var name = probe.snmpGet(ip, Group.DEFAULT_SNMP_PORT, candidate, MetricCatalog.SYS_NAME_OID,
                            settings.getSnmpTimeoutMs());

                        sysName = name.isSuccess() ? name.getValue() : null;

                        snmpFound.incrementAndGet();

                        break;
                    }
                }
            }

            var include = useIcmp ? latency != null : community != null;

            if (!include)
            {
                return null;
            }

            var hostname = hostnameResolver.apply(ip);

            if ((hostname == null || hostname.isBlank()) && sysName != null && !sysName.isBlank())
            {
                hostname = sysName;
            }

            var result = new DiscoveryResult()
                .setIp(ip)
                .setHostname(hostname)
                .setLatencyMs(latency)
                .setSnmpEnabled(community != null)
                .setCommunity(community)
                .setSysDescr(sysDescr)
                .setVendor(DeviceClassifier.guessVendor(sysDescr))
                .setDeviceType(DeviceClassifier.guessType(sysDescr));

            results.add(result);

            return result;
        }
        catch (Exception exception)
        {
            logger.debug("Discovery probe of {} failed: {}", ip, exception.getMessage());

            return null;
        }
        finally
        {
            scanned.incrementAndGet();
        }
    }

    /**
     * Current progress, readable at any time from any thread.
     *
     * @return Progress snapshot
     */
    public DiscoveryProgress progress()
    {
        if (startedAt == null)
        {
            return DiscoveryProgress.idle();
        }

        List<DiscoveryResult> snapshot;

        synchronized (results)
        {
            snapshot = new ArrayList<>(results);
        }

        snapshot.sort(Comparator.comparingLong(result -> IPRangeUtil.toLong(result.getIp())));

        return new DiscoveryProgress(running.get(), target, protocols, scanned.get(), total, icmpFound.get(),
            snmpFound.get(), snapshot, startedAt, finishedAt, error);
    }

    public boolean isRunning()
    {
        return running.get();
    }

    private void notifyProgress()
    {
        try
        {
            progressListener.accept(progress());
        }
        catch (Exception exception)
        {
            logger.error("Error in discovery progress listener: {}", exception.getMessage());
        }
    }

    private static String reverseLookup(String ip)
    {
        try
        {
            var name = InetAddress.getByName(ip).getCanonicalHostName();

            return name.equals(ip) ? null : name;
        }
        catch (UnknownHostException exception)
        {
            return null;
        }
    }
}
