package com.pulsenms.core;

import com.pulsenms.services.impl.PgInventorySource;

import com.pulsenms.services.impl.PgMetricsSink;

import com.pulsenms.services.impl.PgNodeStore;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import io.vertx.pgclient.PgBuilder;

import io.vertx.pgclient.PgConnectOptions;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.PoolOptions;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.List;

/**
 * DatabaseInitializer - One-time database setup at startup

 * Tasks performed before any verticle is deployed:
 * - Creates the PostgreSQL connection pool and checks connectivity
 * - Applies db/schema.sql (idempotent)
 * - Seeds the default metric catalog (existing names are left untouched)
 * - Instantiates the Pg-backed inventory source, node store and metrics sink
 */
public class DatabaseInitializer
{

    private static final Logger logger = LoggerFactory.getLogger(DatabaseInitializer.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final Vertx vertx;

    private final JsonObject databaseConfig;

    private Pool pgPool;

    private PgInventorySource inventorySource;

    private PgNodeStore nodeStore;

    private PgMetricsSink metricsSink;

    /**
     * @param vertx Vert.x instance
     * @param databaseConfig Database configuration from application.conf
     */
    public DatabaseInitializer(Vertx vertx, JsonObject databaseConfig)
    {
        this.vertx = vertx;

        this.databaseConfig = databaseConfig;
    }

    /**
     * Connect, apply the schema, seed the catalog and create the services.
     *
     * @return Future that completes when all initialization is done
     */
    public Future<Void> initialize()
    {
        try
        {
            logger.info("Initializing database");

            return setupDatabaseConnection()
                .compose(pool ->
                {
                    this.pgPool = pool;

                    return applySchema();
                })
                .compose(v -> seedMetricCatalog())
                .compose(seeded ->
                {
                    this.inventorySource = new PgInventorySource(pgPool);

                    this.nodeStore = new PgNodeStore(pgPool);

                    this.metricsSink = new PgMetricsSink(pgPool);

                    logger.info("Database initialization completed ({} catalog definitions added)", seeded);

                    return Future.<Void>succeededFuture();
                })
                .onFailure(cause -> logger.error("Failed to initialize database: {}", cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in initialize: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    private Future<Pool> setupDatabaseConnection()
    {
        var promise = Promise.<Pool>promise();

        try
        {
            var connectOptions = new PgConnectOptions()
                .setPort(databaseConfig.getInteger("port", 5432))
                .setHost(databaseConfig.getString("host", "localhost"))
                .setDatabase(databaseConfig.getString("database", "pulsenms"))
                .setUser(databaseConfig.getString("user", "pulsenms"))
                .setPassword(databaseConfig.getString("password", "pulsenms"));

            var poolOptions = new PoolOptions()
                .setMaxSize(databaseConfig.getInteger("maxSize", 5));

            var pool = PgBuilder.pool()
                .with(poolOptions)
                .connectingTo(connectOptions)
                .using(vertx)
                .build();

            pool.getConnection()
                .onSuccess(connection ->
                {
                    logger.info("Database connection established ({}:{}/{})", connectOptions.getHost(),
                        connectOptions.getPort(), connectOptions.getDatabase());

                    connection.close();

                    promise.complete(pool);
                })
                .onFailure(cause ->
                {
                    logger.error("Database connection failed: {}", cause.getMessage());

                    pool.close();

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Failed to setup database connection: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    private Future<Void> applySchema()
    {
        return vertx.fileSystem().readFile(SCHEMA_RESOURCE)
            .compose(buffer ->
            {
                var statements = splitStatements(buffer.toString());

                Future<Void> chain = Future.succeededFuture();

                for (var statement : statements)
                {
                    chain = chain.compose(v -> pgPool.query(statement).execute().<Void>mapEmpty());
                }

                return chain.onSuccess(v -> logger.debug("Schema applied: {} statements", statements.size()));
            });
    }

    /**
     * Insert the default metric definitions that are not present yet.
     *
     * @return Future containing the number of inserted definitions
     */
    private Future<Integer> seedMetricCatalog()
    {
        var sql = """
                INSERT INTO metric_definitions (name, oid_template, metric_type, unit, category, requires_index,
                                                source, description)
                VALUES ($1, $2, $3, $4, $5, $6, $7, $8)
                ON CONFLICT (name) DO NOTHING
                """;

        var batch = new ArrayList<Tuple>();

        for (var definition : MetricCatalog.defaults())
        {
            batch.add(Tuple.of(definition.getName(), definition.getOidTemplate().getTemplate(),
                definition.getType().code(), definition.getUnit(), definition.getCategory().code(),
                definition.getOidTemplate().requiresIndex(), definition.getSource(), definition.getDescription()));
        }

        return pgPool.preparedQuery(sql)
            .executeBatch(batch)
            .map(rows ->
            {
                var inserted = 0;

                for (var result = rows; result != null; result = result.next())
                {
                    inserted += result.rowCount();
                }

                return inserted;
            });
    }

    /**
     * Split a SQL script on ";" into non-empty statements.
     *
     * @param script SQL script without procedural blocks
     * @return Statements in order
     */
    static List<String> splitStatements(String script)
    {
        var statements = new ArrayList<String>();

        for (var piece : script.split(";"))
        {
            var statement = piece.trim();

            if (!statement.isEmpty())
            {
                statements.add(statement);
            }
        }

        return statements;
    }

    public PgInventorySource getInventorySource()
    {
        return inventorySource;
    }

    public PgNodeStore getNodeStore()
    {
        return nodeStore;
    }

    public PgMetricsSink getMetricsSink()
    {
        return metricsSink;
    }

    /**
     * Close the connection pool. Called during application shutdown.
     *
     * @return Future that completes when cleanup is done
     */
    public Future<Void> cleanup()
    {
        var promise = Promise.<Void>promise();

        try
        {
            logger.info("Cleaning up database resources");

            if (pgPool != null)
            {
                pgPool.close()
                    .onSuccess(v ->
                    {
                        logger.debug("Database connection pool closed");

                        promise.complete();
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Failed to close database pool: {}", cause.getMessage());

                        promise.fail(cause);
                    });
            }
            else
            {
                promise.complete();
            }
        }
        catch (Exception exception)
        {
            logger.error("Error in cleanup: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }
}
