package dev.mars.idledger.db.config;

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

import io.vertx.sqlclient.PoolOptions;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Sizing and timeouts of the pool shared by the event log, the command handlers and the
 * projection runner.
 *
 * <p>Projection batches hold a connection for a whole transaction, so {@code maxSize} should
 * leave room for command appends. {@code maxWaitQueueSize} bounds the callers waiting for a
 * connection: once full, appends fail fast and surface as {@code UNAVAILABLE}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public final class PgPoolConfig {
    private final int maxSize;
    private final int maxWaitQueueSize;
    private final Duration connectionTimeout;
    private final Duration idleTimeout;

    private PgPoolConfig(Builder builder) {
        this.maxSize = builder.maxSize;
        this.maxWaitQueueSize = builder.maxWaitQueueSize;
        this.connectionTimeout = builder.connectionTimeout;
        this.idleTimeout = builder.idleTimeout;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getMaxWaitQueueSize() {
        return maxWaitQueueSize;
    }

    /**
     * How long a caller waits to acquire a connection.
     */
    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    /**
     * Maps onto Vert.x pool options; the name shows up in pool metrics and logs.
     */
    public PoolOptions toPoolOptions(String poolName) {
        return new PoolOptions()
            .setName(poolName)
            .setMaxSize(maxSize)
            .setMaxWaitQueueSize(maxWaitQueueSize)
            .setConnectionTimeout((int) connectionTimeout.toMillis())
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout((int) idleTimeout.toSeconds())
            .setIdleTimeoutUnit(TimeUnit.SECONDS);
    }

    @Override
    public String toString() {
        return "PgPoolConfig{maxSize=" + maxSize + ", maxWaitQueueSize=" + maxWaitQueueSize
            + ", connectionTimeout=" + connectionTimeout + ", idleTimeout=" + idleTimeout + '}';
    }

    public static final class Builder {
        private int maxSize = 16;
        private int maxWaitQueueSize = 128;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(10);

        public Builder maxSize(int maxSize) {
            if (maxSize < 1) {
                throw new IllegalArgumentException("maxSize must be at least 1");
            }
            this.maxSize = maxSize;
            return this;
        }

        /**
         * -1 leaves the wait queue unbounded.
         */
        public Builder maxWaitQueueSize(int maxWaitQueueSize) {
            this.maxWaitQueueSize = maxWaitQueueSize;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = positive(connectionTimeout, "connectionTimeout");
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
            return this;
        }

        public PgPoolConfig build() {
            return new PgPoolConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
