package dev.mars.idledger.test.containers;

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

import dev.mars.idledger.test.PostgreSQLTestConstants;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.PostgreSQLContainer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JUnit 5 Extension that provides a single shared PostgreSQL container for all tests.
 *
 * <p>This extension ensures that:</p>
 * <ul>
 *   <li>Only ONE PostgreSQL container is started per test JVM</li>
 *   <li>The IdLedger schema ({@value #SCHEMA_RESOURCE}) is applied exactly ONCE</li>
 *   <li>Container is stopped when the JVM exits</li>
 * </ul>
 *
 * <p>Tests isolate themselves by using a fresh instance id rather than by truncating tables.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * {@code
 * @Testcontainers(disabledWithoutDocker = true)
 * @ExtendWith(SharedPostgresExtension.class)
 * class MyTest {
 *     @Test
 *     void myTest() {
 *         PostgreSQLContainer<?> postgres = SharedPostgresExtension.getContainer();
 *     }
 * }
 * }
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class SharedPostgresExtension implements BeforeAllCallback {

    private static final Logger logger = LoggerFactory.getLogger(SharedPostgresExtension.class);

    /** Classpath location of the schema script shipped by the idledger-db module. */
    public static final String SCHEMA_RESOURCE = "/db/idledger-schema.sql";

    private static final Lock INIT_LOCK = new ReentrantLock();
    private static volatile PostgreSQLContainer<?> container;

    /**
     * Get the shared PostgreSQL container instance.
     *
     * @return the shared container
     * @throws IllegalStateException if container has not been initialized or started
     */
    public static PostgreSQLContainer<?> getContainer() {
        if (container == null) {
            throw new IllegalStateException("PostgreSQL container not initialized. Ensure @ExtendWith(SharedPostgresExtension.class) is present.");
        }
        if (!container.isRunning()) {
            throw new IllegalStateException("PostgreSQL container is not running. Container may have been stopped prematurely.");
        }
        return container;
    }

    @Override
    public void beforeAll(ExtensionContext context) throws Exception {
        if (container == null) {
            INIT_LOCK.lock();
            try {
                if (container == null) {
                    logger.info("Initializing shared PostgreSQL container for all tests");
                    PostgreSQLContainer<?> started = startContainer();
                    applySchema(started);
                    container = started;
                    logger.info("Shared PostgreSQL container initialized successfully");
                }
            } finally {
                INIT_LOCK.unlock();
            }
        }
    }

    private PostgreSQLContainer<?> startContainer() {
        PostgreSQLContainer<?> tempContainer = PostgreSQLTestConstants.createStandardContainer()
                .withCommand("postgres", "-c", "fsync=off", "-c", "synchronous_commit=off");

        tempContainer.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Stopping shared PostgreSQL container");
            if (tempContainer.isRunning()) {
                tempContainer.stop();
            }
        }));

        logger.info("PostgreSQL container started: {}:{}",
                tempContainer.getHost(), tempContainer.getFirstMappedPort());
        return tempContainer;
    }

    /**
     * Applies the schema script over JDBC so it completes before any test starts.
     */
    private void applySchema(PostgreSQLContainer<?> target) throws Exception {
        String script = loadSchemaScript();
        try (Connection conn = DriverManager.getConnection(target.getJdbcUrl(), target.getUsername(), target.getPassword());
             Statement stmt = conn.createStatement()) {
            stmt.execute(script);
        }
        logger.info("Applied schema {} to shared container", SCHEMA_RESOURCE);
    }

    private String loadSchemaScript() throws IOException {
        try (InputStream is = SharedPostgresExtension.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Schema script not found on classpath: " + SCHEMA_RESOURCE);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
