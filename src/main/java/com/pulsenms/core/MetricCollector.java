package com.pulsenms.core;

import com.pulsenms.models.BreachChange;

import com.pulsenms.models.BreachLevel;

import com.pulsenms.models.Group;

import com.pulsenms.models.MetricDefinition;

import com.pulsenms.models.MetricSample;

import com.pulsenms.models.Node;

import com.pulsenms.models.NodeMetricConfig;

import com.pulsenms.models.SnmpResult;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.time.Instant;

import java.util.Set;

import java.util.function.Consumer;

/**
 * MetricCollector - SNMP metric sampling, counter rates and threshold breaches

 * A collection pass for one binding is split in two steps:
 * 1. poll()    - BLOCKING SNMP GET of the resolved OID (worker thread)
 * 2. process() - rate derivation, sample bookkeeping and breach evaluation (loop context)

 * Only breach level changes are reported to the breach listener.
 */
public class MetricCollector
{

    private static final Logger logger = LoggerFactory.getLogger(MetricCollector.class);

    private final ProtocolProbe probe;

    private final StatusCache statusCache;

    private final Clock clock;

    private final int timeoutMs;

    private volatile Consumer<BreachChange> breachListener = change -> { };

    /**
     * @param probe SNMP access
     * @param statusCache Per-node records holding the last sample and breach level per binding
     * @param clock Time source
     * @param timeoutMs SNMP timeout
     */
    public MetricCollector(ProtocolProbe probe, StatusCache statusCache, Clock clock, int timeoutMs)
    {
        this.probe = probe;

        this.statusCache = statusCache;

        this.clock = clock;

        this.timeoutMs = timeoutMs;
    }

    public void setBreachListener(Consumer<BreachChange> breachListener)
    {
        this.breachListener = breachListener != null ? breachListener : change -> { };
    }

    /**
     * Read the current value of one binding.

     * WARNING: This method is BLOCKING and must be called from a worker thread.
     *
     * @param node Node
     * @param group Owning group (community and port defaults)
     * @param config Binding
     * @param definition Metric definition
     * @return SNMP result
     */
    public SnmpResult poll(Node node, Group group, NodeMetricConfig config, MetricDefinition definition)
    {
        var oid = definition.getOidTemplate().resolve(config.getInterfaceIndex());

        return probe.snmpGet(node.getIp(), node.effectiveSnmpPort(group), node.effectiveCommunity(group), oid, timeoutMs);
    }

    /**
     * Turn a polled value into a sample.
     *
     * @param node Node
     * @param config Binding
     * @param definition Metric definition
     * @param result SNMP result from poll()
     * @return Sample to persist, or null when the poll failed or returned a non-numeric value
     */
    public MetricSample process(Node node, NodeMetricConfig config, MetricDefinition definition, SnmpResult result)
    {
        if (!result.isSuccess())
        {
            logger.debug("Metric {} on {} not collected: {}", definition.getName(), node.getName(), result.getOutcome());

            return null;
        }

        var value = result.numericValue();

        if (value == null)
        {
            logger.debug("Metric {} on {} returned non-numeric value '{}'", definition.getName(), node.getName(),
                result.getValue());

            return null;
        }

        var now = clock.instant();

        var record = statusCache.record(node.getId());

        var key = config.key();

        var rate = definition.isCounter()
            ? RateCalculator.rate(record.getLastSample(key), value, now, definition.getUnit())
            : null;

        var sample = new MetricSample(node.getId(), config.getId(), definition.getId(), config.getInterfaceIndex(),
            value, rate, now);

        record.putSample(key, sample);

        // Counters are judged on their rate, gauges on the raw value
        var evaluated = definition.isCounter() ? rate : value;

        if (evaluated != null && config.hasThresholds())
        {
            evaluateThresholds(node, config, definition, evaluated, record.getBreachLevel(key), now);
        }

        return sample;
    }

    private void evaluateThresholds(Node node, NodeMetricConfig config, MetricDefinition definition, double value,
                                    BreachLevel previous, Instant now)
    {
        var level = ThresholdEvaluator.evaluate(value, config.getAlertCondition(), config.getWarningThreshold(),
            config.getCriticalThreshold(), previous);

        if (level == previous)
        {
            return;
        }

        statusCache.record(node.getId()).putBreachLevel(config.key(), level);

        var unit = definition.isCounter() ? RateCalculator.rateUnit(definition.getUnit()) : definition.getUnit();

        var threshold = ThresholdEvaluator.thresholdFor(level, config.getWarningThreshold(), config.getCriticalThreshold());

        var change = new BreachChange(node.getId(), node.getName(), node.getIp(), config.key(), displayName(config, definition),
            unit, previous, level, value, threshold, now);

        logger.info("Metric {} on {}: {} -> {} (value {})", change.getMetricName(), node.getName(), previous, level, value);

        try
        {
            breachListener.accept(change);
        }
        catch (Exception exception)
        {
            logger.error("Error in breach listener: {}", exception.getMessage());
        }
    }

    /**
     * Reset breach state of a paused node so it re-alerts from scratch on resume.
     *
     * @param nodeId Node id
     */
    public void clearBreaches(int nodeId)
    {
        var record = statusCache.find(nodeId);

        if (record != null)
        {
            record.clearBreachLevels();
        }
    }

    /**
     * Forget samples and breach state of bindings a node no longer has, so a binding that
     * comes back starts without a stale previous sample.
     *
     * @param nodeId Node id
     * @param activeKeys Keys of the node's current bindings
     */
    public void retainMetrics(int nodeId, Set<String> activeKeys)
    {
        var record = statusCache.find(nodeId);

        if (record != null && record.retainMetrics(activeKeys) > 0)
        {
            logger.debug("Dropped state of removed metric bindings on node {}", nodeId);
        }
    }

    private static String displayName(NodeMetricConfig config, MetricDefinition definition)
    {
        if (config.getInterfaceName() != null && !config.getInterfaceName().isBlank())
        {
            return definition.getName() + " (" + config.getInterfaceName() + ")";
        }

        if (config.getInterfaceIndex() != null)
        {
            return definition.getName() + " (if " + config.getInterfaceIndex() + ")";
        }

        return definition.getName();
    }
}
