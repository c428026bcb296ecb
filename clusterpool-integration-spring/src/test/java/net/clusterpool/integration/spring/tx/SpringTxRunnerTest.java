package net.clusterpool.integration.spring.tx;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.clusterpool.adapter.jdbc.TxContext;
import net.clusterpool.adapter.jdbc.repo.JdbcClusterConfigurationRepository;
import net.clusterpool.core.error.ConfigurationNotFoundException;
import net.clusterpool.core.model.ClusterConfiguration;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.sql.Connection;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SpringTxRunnerTest {

    HikariDataSource ds;
    SpringTxRunner tx;
    JdbcTemplate jdbc;
    JdbcClusterConfigurationRepository repo;

    @BeforeAll
    void setupDb() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:SpringTxRunnerTest;MODE=Oracle;DB_CLOSE_DELAY=-1");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(4);
        ds = new HikariDataSource(cfg);
        Flyway.configure().dataSource(ds).locations("classpath:db/migration").load().migrate();

        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
        jdbc = new JdbcTemplate(ds);
        repo = new JdbcClusterConfigurationRepository(ds);
    }

    @AfterAll
    void cleanup() {
        ds.close();
    }

    @BeforeEach
    void clean() {
        jdbc.update("DELETE FROM TB_CLUSTER_CONFIGURATION");
    }

    private ClusterConfiguration cfg(String version) {
        return new ClusterConfiguration(null, "etl", version, "s3://cfg/etl/" + version + ".json", "alice",
                Instant.parse("2024-01-31T09:00:00Z"));
    }

    private int rows() {
        return jdbc.queryForObject("SELECT COUNT(*) FROM TB_CLUSTER_CONFIGURATION", Integer.class);
    }

    @Test
    void commits_and_clears_the_context() throws Exception {
        tx.required(() -> repo.insert(cfg("1")));

        assertEquals(1, rows());
        assertNull(TxContext.get());
    }

    @Test
    void checked_failure_rolls_back_and_surfaces_unchanged() {
        ConfigurationNotFoundException boom = new ConfigurationNotFoundException("no such template");

        ConfigurationNotFoundException thrown = assertThrows(ConfigurationNotFoundException.class,
                () -> tx.required(() -> {
                    repo.insert(cfg("1"));
                    throw boom;
                }));

        assertSame(boom, thrown);
        assertEquals(0, rows());
    }

    @Test
    void requires_new_survives_an_outer_rollback_and_gives_the_outer_connection_back() {
        assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            Connection outer = TxContext.get();
            repo.insert(cfg("1"));
            tx.requiresNew(() -> {
                assertNotSame(outer, TxContext.get());
                return repo.insert(cfg("2"));
            });
            assertSame(outer, TxContext.get());
            // the outer connection still works after the inner commit
            repo.insert(cfg("3"));
            throw new IllegalStateException("outer fails");
        }));

        assertEquals(1, rows());
        assertEquals("2", jdbc.queryForObject("SELECT VERSION FROM TB_CLUSTER_CONFIGURATION", String.class));
    }
}
