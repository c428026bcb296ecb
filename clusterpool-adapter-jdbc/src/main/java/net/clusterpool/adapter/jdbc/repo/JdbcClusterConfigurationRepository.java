package net.clusterpool.adapter.jdbc.repo;

import net.clusterpool.adapter.jdbc.JdbcUtil;
import net.clusterpool.adapter.jdbc.TxContext;
import net.clusterpool.adapter.jdbc.mapper.RowMappers;
import net.clusterpool.core.model.ClusterConfiguration;
import net.clusterpool.core.spi.ClusterConfigurationRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcClusterConfigurationRepository implements ClusterConfigurationRepository {
    private final DataSource ds;
    public JdbcClusterConfigurationRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        Connection c = TxContext.get();
        if (c == null) throw new IllegalStateException("TxContext required");
        return c;
    }

    @Override
    public ClusterConfiguration insert(ClusterConfiguration cfg) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_CLUSTER_CONFIGURATION (NAME, VERSION, CONTENT_URI, OWNER, CREATED_AT)
            VALUES (?,?,?,?,?)
        """, new String[]{"ID"})) {
            ps.setString(1, cfg.name());
            ps.setString(2, cfg.version());
            ps.setString(3, cfg.contentUri());
            ps.setString(4, cfg.owner());
            ps.setTimestamp(5, JdbcUtil.ts(cfg.createdAt()));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("no generated key for TB_CLUSTER_CONFIGURATION");
                return cfg.withId(keys.getLong(1));
            }
        }
    }

    @Override
    public Optional<ClusterConfiguration> findLatest(String name) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_CLUSTER_CONFIGURATION
             WHERE NAME=?
             ORDER BY VERSION DESC
             FETCH FIRST 1 ROWS ONLY
        """)) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toConfiguration(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<ClusterConfiguration> findByNameAndVersion(String name, String version) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_CLUSTER_CONFIGURATION WHERE NAME=? AND VERSION=?")) {
            ps.setString(1, name);
            ps.setString(2, version);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toConfiguration(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<ClusterConfiguration> findAllByName(String name) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_CLUSTER_CONFIGURATION WHERE NAME=? ORDER BY VERSION DESC")) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                List<ClusterConfiguration> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toConfiguration(rs));
                return out;
            }
        }
    }
}
