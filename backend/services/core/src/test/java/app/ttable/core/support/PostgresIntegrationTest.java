package app.ttable.core.support;

import org.junit.jupiter.api.Assumptions;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Base class for tests that need the real {@code ttable} schema.
 * <p>
 * Connection settings come from the same environment variables the service reads.
 * Tests are skipped when the server is unreachable or when schema {@code ttable}
 * already holds tables without Flyway history.
 */
public abstract class PostgresIntegrationTest {

    static final String SCHEMA = "ttable";

    record Database(String url, String user, String password) {

        static Database fromEnv() {
            return new Database(
                    envOr("jdbc:postgresql://localhost:5432/ttable", "SPRING_DATASOURCE_URL"),
                    envOr("ttable", "SPRING_DATASOURCE_USERNAME", "POSTGRES_USER"),
                    envOr("", "SPRING_DATASOURCE_PASSWORD", "POSTGRES_PASSWORD")
            );
        }
    }

    enum SchemaState {
        UNREACHABLE,
        ABSENT,
        MIGRATED,
        FOREIGN
    }

    private static final Database DATABASE = Database.fromEnv();

    @DynamicPropertySource
    static void configureDataSource(DynamicPropertyRegistry registry) {
        SchemaState state = inspect(DATABASE);
        Assumptions.assumeTrue(state != SchemaState.UNREACHABLE,
                "Postgres is not reachable at " + DATABASE.url() + " for user " + DATABASE.user());
        Assumptions.assumeTrue(state != SchemaState.FOREIGN,
                "Schema " + SCHEMA + " at " + DATABASE.url() + " exists but is not managed by Flyway");

        registry.add("spring.datasource.url", DATABASE::url);
        registry.add("spring.datasource.username", DATABASE::user);
        registry.add("spring.datasource.password", DATABASE::password);
        registry.add("spring.flyway.url", DATABASE::url);
        registry.add("spring.flyway.user", DATABASE::user);
        registry.add("spring.flyway.password", DATABASE::password);
        registry.add("spring.flyway.schemas", () -> SCHEMA);
    }

    static SchemaState inspect(Database db) {
        try (Connection connection = DriverManager.getConnection(db.url(), db.user(), db.password());
             Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("""
                     select exists(select 1 from information_schema.tables where table_schema = '%s'),
                            to_regclass('%s.flyway_schema_history') is not null
                     """.formatted(SCHEMA, SCHEMA))) {
            rs.next();
            // пустую схему Flyway займёт сам
            if (!rs.getBoolean(1)) {
                return SchemaState.ABSENT;
            }
            return rs.getBoolean(2) ? SchemaState.MIGRATED : SchemaState.FOREIGN;
        } catch (SQLException e) {
            return SchemaState.UNREACHABLE;
        }
    }

    private static String envOr(String fallback, String... names) {
        for (String name : names) {
            String value = System.getenv(name);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return fallback;
    }
}
