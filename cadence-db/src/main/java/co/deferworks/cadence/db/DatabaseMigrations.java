package co.deferworks.cadence.db;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;

/**
 * Applies the scheduler schema (the {@code jobs} and {@code job_executions} tables) with Flyway.
 */
public class DatabaseMigrations {

    public static final String LOCATION = "classpath:db/migration";

    public static MigrateResult runMigrations(String jdbcUrl, String username, String password) {
        Flyway flyway = Flyway.configure(DatabaseMigrations.class.getClassLoader())
                .dataSource(jdbcUrl, username, password)
                .locations(LOCATION)
                .load();
        return flyway.migrate();
    }
}
