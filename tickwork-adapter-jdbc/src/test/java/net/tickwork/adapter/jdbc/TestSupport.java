package net.tickwork.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.sql.Statement;

/**
 * One migrated database per test class. Defaults to an in-memory H2 in PostgreSQL mode;
 * {@code TICKWORK_JDBC_URL} (with {@code TICKWORK_JDBC_USERNAME}/{@code TICKWORK_JDBC_PASSWORD})
 * points the suite at a real server instead. Tables are emptied before every test.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    private static final String[] TABLES = {
            "TB_STREAM_DELIVERY", "TB_STREAM_GROUP", "TB_STREAM_MESSAGE",
            "TB_IDEMPOTENCY", "TB_EVENT_HANDLER", "TB_JOB_EXECUTION", "TB_JOB"
    };

    protected DataSource ds;
    protected JdbcTxRunner tx;

    protected record Database(String url, String username, String password) {}

    /** Overridden by tests that bring their own server. */
    protected Database database() {
        String url = System.getenv("TICKWORK_JDBC_URL");
        if (url != null && !url.isBlank()) {
            return new Database(url, System.getenv("TICKWORK_JDBC_USERNAME"), System.getenv("TICKWORK_JDBC_PASSWORD"));
        }
        return new Database("jdbc:h2:mem:" + getClass().getSimpleName() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
    }

    @BeforeAll
    void setupDb() {
        Database db = database();
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(db.url());
        cfg.setUsername(db.username());
        cfg.setPassword(db.password());
        cfg.setMaximumPoolSize(12);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);
        tx = new JdbcTxRunner(ds);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/tickwork")
                .baselineOnMigrate(true)
                .load()
                .migrate();
    }

    @BeforeEach
    void truncateAll() throws Exception {
        tx.required(() -> {
            try (Statement st = TxContext.mustConn().createStatement()) {
                // children first, TRUNCATE refuses referenced tables on some databases
                for (String t : TABLES) st.execute("DELETE FROM " + t);
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
    }
}
