package dev.mars.idledger.db.connection;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.idledger.api.error.IdLedgerErrorCodes;
import dev.mars.idledger.api.error.IdLedgerException;
import dev.mars.idledger.db.IdLedgerDefaults;
import dev.mars.idledger.db.config.PgConnectionConfig;
import dev.mars.idledger.db.config.PgPoolConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Owns the reactive PostgreSQL pools of an IdLedger process.
 *
 * <p>Pools are addressed by id; {@code null} selects {@link IdLedgerDefaults#DEFAULT_POOL_ID}, the
 * pool shared by the event log, the command handlers and the projection stores. All database access
 * goes through {@link #withConnection} or {@link #withTransaction}. An unknown pool id fails with an
 * {@code UNAVAILABLE} {@link IdLedgerException} so callers see the same error kind as for a database
 * that is down.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class PgConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    private final Vertx vertx;
    private final MeterRegistry meter;
    private final Map<String, ManagedPool> pools = new ConcurrentHashMap<>();

    public PgConnectionManager(Vertx vertx) {
        this(vertx, null);
    }

    /**
     * @param meter registry for pool counters and the in-flight gauge, or null for none
     */
    public PgConnectionManager(Vertx vertx, MeterRegistry meter) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.meter = meter;
    }

    /**
     * Returns the pool registered under the id, creating it on first use. Later calls with other
     * settings return the existing pool unchanged.
     */
    public Pool getOrCreatePool(String poolId, PgConnectionConfig connectionConfig, PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig, "connectionConfig");
        Objects.requireNonNull(poolConfig, "poolConfig");
        String id = resolvePoolId(poolId);
        return pools.computeIfAbsent(id, key -> createPool(key, connectionConfig, poolConfig)).pool;
    }

    private ManagedPool createPool(String id, PgConnectionConfig connectionConfig, PgPoolConfig poolConfig) {
        Pool pool = PgBuilder.pool()
            .with(poolConfig.toPoolOptions(id))
            .connectingTo(connectionConfig.toConnectOptions())
            .using(vertx)
            .build();
        ManagedPool managed = new ManagedPool(pool);
        if (meter != null) {
            Gauge.builder("idledger.db.operations.in-flight", managed.inFlight, AtomicInteger::get)
                .description("Database operations holding a pooled connection")
                .tag("pool", id)
                .register(meter);
        }
        increment("idledger.db.pool.created", id);
        logger.info("Created pool '{}' for {}:{}/{} ({})", id, connectionConfig.getHost(),
            connectionConfig.getPort(), connectionConfig.getDatabase(), poolConfig);
        return managed;
    }

    /**
     * @return the pool, or null if none is registered under the id
     */
    public Pool getPool(String poolId) {
        ManagedPool managed = pools.get(resolvePoolId(poolId));
        return managed != null ? managed.pool : null;
    }

    /**
     * Runs the operation on a pooled connection that is returned to the pool when the future completes.
     */
    public <T> Future<T> withConnection(String poolId, Function<SqlConnection, Future<T>> operation) {
        String id = resolvePoolId(poolId);
        ManagedPool managed = pools.get(id);
        if (managed == null) {
            return Future.failedFuture(missingPool(id));
        }
        managed.inFlight.incrementAndGet();
        return managed.pool.withConnection(operation)
            .onComplete(ar -> managed.inFlight.decrementAndGet());
    }

    /**
     * Runs the operation in a transaction that commits when the returned future succeeds and rolls
     * back when it fails.
     */
    public <T> Future<T> withTransaction(String poolId, Function<SqlConnection, Future<T>> operation) {
        String id = resolvePoolId(poolId);
        ManagedPool managed = pools.get(id);
        if (managed == null) {
            return Future.failedFuture(missingPool(id));
        }
        managed.inFlight.incrementAndGet();
        return managed.pool.withTransaction(operation)
            .onComplete(ar -> managed.inFlight.decrementAndGet());
    }

    /**
     * Runs {@code SELECT 1} on the pool.
     *
     * @return true if the database answered; never fails
     */
    public Future<Boolean> checkHealth(String poolId) {
        String id = resolvePoolId(poolId);
        if (!pools.containsKey(id)) {
            return Future.succeededFuture(false);
        }
        return withConnection(id, conn -> conn.query("SELECT 1").execute().map(rs -> true))
            .recover(err -> {
                logger.warn("Health check failed for pool '{}': {}", id, err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    public Future<Void> closePool(String poolId) {
        String id = resolvePoolId(poolId);
        ManagedPool managed = pools.remove(id);
        if (managed == null) {
            return Future.succeededFuture();
        }
        return managed.pool.close()
            .onSuccess(v -> {
                logger.debug("Closed pool '{}'", id);
                increment("idledger.db.pool.closed", id);
            })
            .onFailure(err -> logger.warn("Failed to close pool '{}'", id, err));
    }

    /**
     * Closes every pool. Never fails; close errors are logged.
     */
    public Future<Void> closeAsync() {
        List<Future<Void>> closing = new ArrayList<>();
        for (String id : pools.keySet()) {
            closing.add(closePool(id));
        }
        return Future.all(closing)
            .<Void>mapEmpty()
            .recover(err -> {
                logger.warn("Some pools failed to close cleanly: {}", err.getMessage());
                return Future.succeededFuture();
            });
    }

    /**
     * Blocking close; must not be called on an event loop thread.
     */
    @Override
    public void close() {
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing pools");
        } catch (Exception e) {
            logger.error("Error while closing pools", e);
        }
    }

    private static String resolvePoolId(String poolId) {
        return poolId == null || poolId.isBlank() ? IdLedgerDefaults.DEFAULT_POOL_ID : poolId;
    }

    private static IdLedgerException missingPool(String id) {
        return IdLedgerException.unavailable(IdLedgerErrorCodes.DATABASE_UNAVAILABLE,
            "No database pool registered under '" + id + "'", null);
    }

    private void increment(String name, String poolId) {
        if (meter != null) {
            Counter.builder(name).tag("pool", poolId).register(meter).increment();
        }
    }

    private static final class ManagedPool {
        final Pool pool;
        final AtomicInteger inFlight = new AtomicInteger();

        ManagedPool(Pool pool) {
            this.pool = pool;
        }
    }
}
