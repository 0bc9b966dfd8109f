package dev.mars.idledger.db;

/**
 * Default constants for IdLedger configuration.
 *
 * <p>These constants are implementation details of the db module. External modules pass
 * {@code null} as the service id to use the default pool.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public final class IdLedgerDefaults {

    /**
     * The pool identifier used when no specific service id is provided.
     */
    public static final String DEFAULT_POOL_ID = "idledger-main";

    /**
     * Instance id used by single-tenant deployments that never set one.
     */
    public static final String DEFAULT_INSTANCE_ID = "default";

    private IdLedgerDefaults() {
        // Prevent instantiation
    }
}
