package com.pulsenms.services;

import com.pulsenms.models.MetricSample;

import io.vertx.core.Future;

/**
 * MetricsSink - Persistence of collected metric samples
 */
public interface MetricsSink
{

    /**
     * Store one sample (node, binding, definition, interface index, value, rate, timestamp).
     *
     * @param sample Collected sample
     * @return Future that completes when the sample is stored
     */
    Future<Void> metricWrite(MetricSample sample);

}
