package net.clusterpool.adapter.jdbc.repo;

import net.clusterpool.adapter.jdbc.JdbcUtil;
import net.clusterpool.adapter.jdbc.TxContext;
import net.clusterpool.adapter.jdbc.crypto.CredentialsCipher;
import net.clusterpool.adapter.jdbc.mapper.RowMappers;
import net.clusterpool.core.json.Json;
import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.spi.ClusterRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public final class JdbcClusterRepository implements ClusterRepository {
    private static final String TERMINAL_CODES = Cluster.Status.TERMINAL.stream()
            .map(s -> "'" + s.code() + "'")
            .sorted()
            .collect(Collectors.joining(","));

    private final DataSource ds;
    private final CredentialsCipher cipher;

    public JdbcClusterRepository(DataSource ds, CredentialsCipher cipher) {
        this.ds = ds;
        this.cipher = cipher;
    }

    private Connection mustConn() {
        Connection c = TxContext.get();
        if (c == null) throw new IllegalStateException("TxContext required");
        return c;
    }

    @Override
    public void insert(Cluster cl) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_CLUSTER
              (ID, STATUS, KIND, MANAGED_BY_SCHEDULER, OWNER, CREDENTIALS, LAUNCH_CONFIG, CONFIG_HASH,
               ASSIGNED_WORK_UNITS, TERMINATE_ON, SNAPSHOT, CREATED_AT, UPDATED_AT)
            VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)
        """)) {
            ps.setString(1, cl.id());
            ps.setString(2, cl.status().code());
            ps.setString(3, cl.kind().code());
            ps.setString(4, JdbcUtil.flag(cl.managedByScheduler()));
            ps.setString(5, cl.owner());
            JdbcUtil.setClob(ps, 6, cipher.encrypt(cl.credentials()));
            JdbcUtil.setClob(ps, 7, cl.launchConfig().canonicalJson());
            ps.setString(8, cl.configHash());
            JdbcUtil.setClob(ps, 9, Json.write(cl.assignedWorkUnits()));
            ps.setTimestamp(10, JdbcUtil.ts(cl.terminateOn()));
            JdbcUtil.setClob(ps, 11, Json.write(cl.snapshot()));
            ps.setTimestamp(12, JdbcUtil.ts(cl.createdAt()));
            ps.setTimestamp(13, JdbcUtil.ts(cl.updatedAt()));
            ps.executeUpdate();
        }
    }

    @Override
    public boolean update(Cluster cl) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_CLUSTER
               SET STATUS=?, ASSIGNED_WORK_UNITS=?, TERMINATE_ON=?, SNAPSHOT=?, UPDATED_AT=?
             WHERE ID=?
               AND STATUS NOT IN (""" + TERMINAL_CODES + ")")) {
            ps.setString(1, cl.status().code());
            JdbcUtil.setClob(ps, 2, Json.write(cl.assignedWorkUnits()));
            ps.setTimestamp(3, JdbcUtil.ts(cl.terminateOn()));
            JdbcUtil.setClob(ps, 4, Json.write(cl.snapshot()));
            ps.setTimestamp(5, JdbcUtil.ts(cl.updatedAt()));
            ps.setString(6, cl.id());
            if (ps.executeUpdate() == 1) return true;
        }
        if (findById(cl.id()).isEmpty()) throw new SQLException("cluster " + cl.id() + " not found");
        return false;
    }

    @Override
    public Optional<Cluster> findById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_CLUSTER WHERE ID=?")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toCluster(rs, cipher)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Cluster> lockById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_CLUSTER WHERE ID=? FOR UPDATE")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toCluster(rs, cipher)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Cluster> findNonTerminal() throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_CLUSTER WHERE STATUS NOT IN (" + TERMINAL_CODES + ") ORDER BY CREATED_AT, ID")) {
            return list(ps);
        }
    }

    @Override
    public List<Cluster> findIdleManaged() throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_CLUSTER
             WHERE MANAGED_BY_SCHEDULER='Y'
               AND STATUS=?
             ORDER BY CREATED_AT, ID
        """)) {
            ps.setString(1, Cluster.Status.IDLE.code());
            return list(ps);
        }
    }

    @Override
    public List<Cluster> lockExpired(Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_CLUSTER WHERE STATUS NOT IN (" + TERMINAL_CODES + ")"
                        + " AND TERMINATE_ON IS NOT NULL AND TERMINATE_ON < ? ORDER BY TERMINATE_ON, ID FOR UPDATE")) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            return list(ps);
        }
    }

    private List<Cluster> list(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            List<Cluster> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toCluster(rs, cipher));
            return out;
        }
    }
}
