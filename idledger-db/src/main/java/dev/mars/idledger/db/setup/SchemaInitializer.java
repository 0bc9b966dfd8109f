package dev.mars.idledger.db.setup;

import dev.mars.idledger.db.connection.PgConnectionManager;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies the IdLedger schema script in one transaction.
 *
 * The script only contains {@code IF NOT EXISTS} statements, so applying it to an
 * initialized database is a no-op. Intended for development and tests; production
 * databases are migrated by external tooling.
 */
public class SchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(SchemaInitializer.class);

    public static final String SCHEMA_RESOURCE = "/db/idledger-schema.sql";

    private final PgConnectionManager connectionManager;
    private final String serviceId;

    public SchemaInitializer(PgConnectionManager connectionManager, String serviceId) {
        this.connectionManager = connectionManager;
        this.serviceId = serviceId;
    }

    public Future<Void> initializeSchema() {
        logger.info("Initializing IdLedger schema from {}", SCHEMA_RESOURCE);

        return loadSchemaScript()
            .compose(this::executeSchemaScript)
            .onSuccess(v -> logger.info("IdLedger schema initialized successfully"))
            .onFailure(error -> logger.error("Failed to initialize IdLedger schema", error));
    }

    private Future<String> loadSchemaScript() {
        try (InputStream is = getClass().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (is == null) {
                return Future.failedFuture(new IllegalStateException("Schema script not found: " + SCHEMA_RESOURCE));
            }
            return Future.succeededFuture(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            return Future.failedFuture(e);
        }
    }

    private Future<Void> executeSchemaScript(String sql) {
        List<String> statements = parseSqlStatements(sql);
        logger.debug("Executing {} schema statements", statements.size());

        return connectionManager.withTransaction(serviceId, conn -> {
            Future<Void> chain = Future.succeededFuture();
            for (String statement : statements) {
                chain = chain.compose(v -> {
                    logger.trace("Executing: {}...", statement.substring(0, Math.min(60, statement.length())));
                    return conn.query(statement).execute().<Void>mapEmpty();
                });
            }
            return chain;
        });
    }

    /**
     * Splits a script on semicolons, dropping {@code --} comments. The schema script uses
     * no dollar-quoted bodies.
     */
    static List<String> parseSqlStatements(String content) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (String line : content.split("\n")) {
            int comment = line.indexOf("--");
            String code = comment >= 0 ? line.substring(0, comment) : line;
            int start = 0;
            int semicolon;
            while ((semicolon = code.indexOf(';', start)) >= 0) {
                current.append(code, start, semicolon);
                addStatement(statements, current);
                current.setLength(0);
                start = semicolon + 1;
            }
            current.append(code.substring(start)).append('\n');
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder statement) {
        String trimmed = statement.toString().trim();
        if (!trimmed.isEmpty()) {
            statements.add(trimmed);
        }
    }
}
