package dev.mars.idledger.runtime;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.idledger.api.event.EventLog;
import dev.mars.idledger.command.IdGenerator;
import dev.mars.idledger.command.idp.IdpConfigCommands;
import dev.mars.idledger.command.org.OrgCommands;
import dev.mars.idledger.command.org.OrgMemberCommands;
import dev.mars.idledger.command.user.UserCommands;
import dev.mars.idledger.db.config.IdLedgerConfiguration;
import dev.mars.idledger.db.config.IdLedgerConfiguration.ProjectionConfig;
import dev.mars.idledger.db.connection.PgConnectionManager;
import dev.mars.idledger.db.metrics.IdLedgerMetrics;
import dev.mars.idledger.db.setup.SchemaInitializer;
import dev.mars.idledger.eventstore.PgEventLog;
import dev.mars.idledger.projection.Projection;
import dev.mars.idledger.projection.idp.IdpConfigProjection;
import dev.mars.idledger.projection.org.OrgMemberProjection;
import dev.mars.idledger.projection.runner.ProjectionRunner;
import dev.mars.idledger.projection.store.PgProjectionStore;
import dev.mars.idledger.projection.store.ProjectionStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Wires and runs an IdLedger process: the Vert.x instance, the PostgreSQL pool, the event
 * log, the command handlers and the projection runner.
 *
 * <p>Construction creates the components without touching the database. {@link #startReactive()}
 * validates connectivity, applies the schema when {@code idledger.database.schema.initialize}
 * is set and starts the projection runner. Lifecycle steps are published on the event bus
 * address {@value #EVENT_BUS_ADDR}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class IdLedgerManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(IdLedgerManager.class);

    public static final String EVENT_BUS_ADDR = "idledger.lifecycle";
    private static final long HEALTH_CHECK_INTERVAL_MS = TimeUnit.SECONDS.toMillis(30);

    private final IdLedgerConfiguration configuration;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final MeterRegistry meterRegistry;
    private final boolean meterRegistryOwnedByManager;
    private final ObjectMapper objectMapper;

    private final PgConnectionManager connectionManager;
    private final IdLedgerMetrics metrics;
    private final PgEventLog eventLog;
    private final PgProjectionStore projectionStore;
    private final ProjectionRunner projectionRunner;

    private final OrgCommands orgCommands;
    private final UserCommands userCommands;
    private final OrgMemberCommands orgMemberCommands;
    private final IdpConfigCommands idpConfigCommands;

    private long healthTimerId = 0;
    private volatile boolean healthy = false;
    private volatile boolean started = false;
    private volatile boolean closed = false;

    public IdLedgerManager() {
        this(new IdLedgerConfiguration());
    }

    public IdLedgerManager(IdLedgerConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry(), null, true);
    }

    public IdLedgerManager(IdLedgerConfiguration configuration, MeterRegistry meterRegistry) {
        this(configuration, meterRegistry, null, false);
    }

    /**
     * Uses an application's Vert.x instance. The manager never closes a Vert.x it did not create.
     */
    public IdLedgerManager(IdLedgerConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx) {
        this(configuration, meterRegistry, vertx, false);
    }

    private IdLedgerManager(IdLedgerConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx,
                            boolean meterRegistryOwnedByManager) {
        this.configuration = configuration;
        this.meterRegistry = meterRegistry;
        this.meterRegistryOwnedByManager = meterRegistryOwnedByManager;
        this.objectMapper = createDefaultObjectMapper();

        logger.info("Initializing IdLedger manager with profile: {}", configuration.getProfile());

        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByManager = false;
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByManager = true;
        }

        this.connectionManager = new PgConnectionManager(this.vertx, meterRegistry);
        var dbConfig = configuration.getDatabaseConfig();
        logger.info("Connecting to {}:{}/{} as {}",
            dbConfig.getHost(), dbConfig.getPort(), dbConfig.getDatabase(), dbConfig.getUsername());
        connectionManager.getOrCreatePool(null, dbConfig, configuration.getPoolConfig());

        IdLedgerConfiguration.MetricsConfig metricsConfig = configuration.getMetricsConfig();
        this.metrics = new IdLedgerMetrics(metricsConfig.getInstanceId());
        if (metricsConfig.isEnabled()) {
            metrics.bindTo(meterRegistry);
        }

        this.eventLog = new PgEventLog(connectionManager, null, metrics);

        IdGenerator ids = IdGenerator.uuid();
        this.orgCommands = new OrgCommands(eventLog, ids, metrics);
        this.userCommands = new UserCommands(eventLog, ids, metrics);
        this.orgMemberCommands = new OrgMemberCommands(eventLog, ids, metrics);
        this.idpConfigCommands = new IdpConfigCommands(eventLog, ids, metrics);

        List<Projection> projections = List.of(new OrgMemberProjection(), new IdpConfigProjection());
        this.projectionStore = new PgProjectionStore(connectionManager, null);
        this.projectionRunner = new ProjectionRunner(this.vertx, eventLog, projectionStore, projections,
            configuration.getProjectionConfig(), metrics);

        logger.info("IdLedger manager initialized");
    }

    /**
     * Validates the database, applies the schema if configured and starts the projection runner.
     */
    public Future<Void> startReactive() {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("IdLedger manager is closed"));
        }
        if (started) {
            logger.warn("IdLedger manager is already started");
            return Future.succeededFuture();
        }

        logger.info("Starting IdLedger manager");
        return Future.succeededFuture()
            .compose(v -> validateDatabaseConnectivity())
            .compose(v -> publishLifecycleEvent("database.ready"))
            .compose(v -> initializeSchema())
            .compose(v -> startProjections())
            .compose(v -> {
                healthy = true;
                healthTimerId = vertx.setPeriodic(HEALTH_CHECK_INTERVAL_MS, id -> checkHealth());
                started = true;
                logger.info("IdLedger manager started");
                return publishLifecycleEvent("manager.ready");
            })
            .recover(error -> {
                logger.error("Failed to start IdLedger manager", error);
                return publishLifecycleEvent("manager.failed")
                    .compose(v -> Future.failedFuture(new RuntimeException("Failed to start IdLedger manager", error)));
            });
    }

    /**
     * Blocking variant of {@link #startReactive()}. Must not be called on an event loop thread.
     */
    public synchronized void start() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            throw new IllegalStateException("Do not call blocking start() on event-loop thread - use startReactive() instead");
        }
        try {
            startReactive()
                .toCompletionStage()
                .toCompletableFuture()
                .get(30, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new RuntimeException("Failed to start IdLedger manager", e);
        }
    }

    private Future<Void> validateDatabaseConnectivity() {
        return connectionManager.withConnection(null, conn -> conn.query("SELECT 1").execute().<Void>mapEmpty())
            .onSuccess(v -> logger.info("Database connectivity validated"))
            .recover(error -> {
                logger.error("Database connectivity validation failed: {}", error.getMessage());
                return Future.failedFuture(new IllegalStateException("Database startup validation failed", error));
            });
    }

    private Future<Void> initializeSchema() {
        if (!configuration.isSchemaInitializationEnabled()) {
            logger.debug("Schema initialization disabled");
            return Future.succeededFuture();
        }
        return new SchemaInitializer(connectionManager, null).initializeSchema()
            .compose(v -> publishLifecycleEvent("schema.ready"));
    }

    private Future<Void> startProjections() {
        ProjectionConfig projectionConfig = configuration.getProjectionConfig();
        if (!projectionConfig.isEnabled()) {
            logger.info("Projections disabled by configuration");
            return Future.succeededFuture();
        }
        projectionRunner.start();
        return publishLifecycleEvent("projections.started");
    }

    /**
     * Runs a database health check now and updates {@link #isHealthy()}.
     */
    public Future<Boolean> checkHealth() {
        return connectionManager.checkHealth(null).onSuccess(result -> {
            if (healthy != result) {
                logger.warn("IdLedger health changed to {}", result ? "healthy" : "unhealthy");
            }
            healthy = result;
        });
    }

    /**
     * Result of the last health check; false before start.
     */
    public boolean isHealthy() {
        return started && healthy;
    }

    public boolean isStarted() {
        return started;
    }

    private Future<Void> publishLifecycleEvent(String event) {
        JsonObject eventData = new JsonObject()
            .put("event", event)
            .put("timestamp", Instant.now().toString())
            .put("manager", "IdLedgerManager")
            .put("profile", configuration.getProfile());
        vertx.eventBus().publish(EVENT_BUS_ADDR, eventData);
        logger.debug("Published lifecycle event: {}", event);
        return Future.succeededFuture();
    }

    /**
     * Stops the projection runner and releases every resource the manager owns.
     */
    public Future<Void> closeReactive() {
        if (closed) {
            return Future.succeededFuture();
        }
        closed = true;
        started = false;
        healthy = false;
        logger.info("Closing IdLedger manager");

        if (healthTimerId != 0) {
            vertx.cancelTimer(healthTimerId);
            healthTimerId = 0;
        }
        projectionRunner.close();
        projectionStore.close();
        eventLog.close();

        return connectionManager.closeAsync()
            .compose(v -> {
                if (meterRegistryOwnedByManager) {
                    meterRegistry.close();
                    logger.debug("Closed manager-owned MeterRegistry");
                }
                if (vertxOwnedByManager) {
                    logger.info("Closing Vert.x instance (manager-owned)");
                    return vertx.close()
                        .recover(e -> {
                            logger.warn("Error closing Vert.x instance", e);
                            return Future.succeededFuture();
                        });
                }
                return Future.<Void>succeededFuture();
            })
            .onSuccess(v -> logger.info("IdLedger manager closed"));
    }

    /**
     * Starts an asynchronous close. Callers that need to wait use {@link #closeReactive()}.
     */
    @Override
    public void close() {
        closeReactive();
    }

    public IdLedgerConfiguration getConfiguration() { return configuration; }
    public Vertx getVertx() { return vertx; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public ObjectMapper getObjectMapper() { return objectMapper; }
    public PgConnectionManager getConnectionManager() { return connectionManager; }
    public IdLedgerMetrics getMetrics() { return metrics; }
    public EventLog getEventLog() { return eventLog; }
    public ProjectionStore getProjectionStore() { return projectionStore; }
    public ProjectionRunner getProjectionRunner() { return projectionRunner; }
    public OrgCommands getOrgCommands() { return orgCommands; }
    public UserCommands getUserCommands() { return userCommands; }
    public OrgMemberCommands getOrgMemberCommands() { return orgMemberCommands; }
    public IdpConfigCommands getIdpConfigCommands() { return idpConfigCommands; }

    /**
     * ObjectMapper for callers that serialize command results and payloads, with ISO-8601 dates.
     */
    private static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
