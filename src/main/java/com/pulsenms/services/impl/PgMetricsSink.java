package com.pulsenms.services.impl;

import com.pulsenms.models.MetricSample;

import com.pulsenms.services.MetricsSink;

import io.vertx.core.Future;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.ZoneOffset;

import java.util.Arrays;

/**
 * PgMetricsSink - Appends collected samples to metric_samples
 */
public class PgMetricsSink implements MetricsSink
{

    private static final Logger logger = LoggerFactory.getLogger(PgMetricsSink.class);

    private static final String INSERT_SQL = """
            INSERT INTO metric_samples (node_id, node_metric_id, metric_definition_id, interface_index,
                                        value, rate, sampled_at)
            VALUES ($1, $2, $3, $4, $5, $6, $7)
            """;

    private final Pool pgPool;

    public PgMetricsSink(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    @Override
    public Future<Void> metricWrite(MetricSample sample)
    {
        return pgPool.preparedQuery(INSERT_SQL)
                .execute(Tuple.from(Arrays.asList(sample.getNodeId(), sample.getNodeMetricId(),
                        sample.getDefinitionId(), sample.getInterfaceIndex(), sample.getValue(), sample.getRate(),
                        sample.getTimestamp().atOffset(ZoneOffset.UTC))))
                .onFailure(cause -> logger.error("Failed to store sample of binding {}: {}",
                        sample.getNodeMetricId(), cause.getMessage()))
                .mapEmpty();
    }
}
