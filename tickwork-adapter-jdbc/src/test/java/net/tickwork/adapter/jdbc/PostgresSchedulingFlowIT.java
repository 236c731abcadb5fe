package net.tickwork.adapter.jdbc;

import org.junit.jupiter.api.AfterAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;

/** The scheduling flow against a real PostgreSQL (Testcontainers). Needs Docker; runs on {@code mvn verify}. */
class PostgresSchedulingFlowIT extends JdbcSchedulingFlowAcceptanceTest {
    private PostgreSQLContainer<?> postgres;

    @Override
    protected Database database() {
        postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
                .withStartupTimeout(Duration.ofMinutes(2));
        postgres.start();
        return new Database(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    }

    @AfterAll
    void stopContainer() {
        if (postgres != null) postgres.stop();
    }
}
