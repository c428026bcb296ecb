package net.clusterpool.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.clusterpool.adapter.jdbc.crypto.CredentialsCipher;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.util.Base64;

/**
 * One migrated database per test class. Points at {@code CLUSTERPOOL_JDBC_URL} when set
 * (an Oracle schema, say), otherwise at an in-memory H2 in Oracle mode.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static final String KEY = Base64.getEncoder().encodeToString(new byte[32]);

    protected DataSource ds;
    protected JdbcTxRunner tx;
    protected CredentialsCipher cipher;

    @BeforeAll
    void setupDb() {
        String url = System.getenv("CLUSTERPOOL_JDBC_URL");
        String user = System.getenv("CLUSTERPOOL_JDBC_USERNAME");
        String pass = System.getenv("CLUSTERPOOL_JDBC_PASSWORD");

        if (url == null || url.isBlank()) {
            url = "jdbc:h2:mem:" + getClass().getSimpleName() + ";MODE=Oracle;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
            user = "sa";
            pass = "";
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(6);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .load()
                .migrate();

        tx = new JdbcTxRunner(ds);
        cipher = CredentialsCipher.fromBase64(KEY);
    }

    protected void clean() throws Exception {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.executeUpdate("DELETE FROM TB_WORK_UNIT");
            st.executeUpdate("DELETE FROM TB_CLUSTER");
            st.executeUpdate("DELETE FROM TB_CLUSTER_CONFIGURATION");
        }
    }

    protected int count(String sql) throws Exception {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement(); var rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
    }
}
