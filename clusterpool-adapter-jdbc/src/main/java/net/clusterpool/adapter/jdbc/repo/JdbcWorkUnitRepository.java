package net.clusterpool.adapter.jdbc.repo;

import net.clusterpool.adapter.jdbc.JdbcUtil;
import net.clusterpool.adapter.jdbc.TxContext;
import net.clusterpool.adapter.jdbc.crypto.CredentialsCipher;
import net.clusterpool.adapter.jdbc.mapper.RowMappers;
import net.clusterpool.core.json.Json;
import net.clusterpool.core.model.WorkUnit;
import net.clusterpool.core.spi.WorkUnitRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public final class JdbcWorkUnitRepository implements WorkUnitRepository {
    private static final String TERMINAL_CODES = WorkUnit.Status.TERMINAL.stream()
            .map(s -> "'" + s.code() + "'")
            .sorted()
            .collect(Collectors.joining(","));

    private final DataSource ds;
    private final CredentialsCipher cipher;

    public JdbcWorkUnitRepository(DataSource ds, CredentialsCipher cipher) {
        this.ds = ds;
        this.cipher = cipher;
    }

    private Connection mustConn() {
        Connection c = TxContext.get();
        if (c == null) throw new IllegalStateException("TxContext required");
        return c;
    }

    @Override
    public long insert(WorkUnit u) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_WORK_UNIT
              (NAME, REMOTE_ID, STATUS, CLUSTER_ID, OWNER, IS_TEST, CREDENTIALS, WORK_SPEC,
               LAUNCH_CONFIG, CONFIG_HASH, CUSTOM_METADATA, SNAPSHOT, CREATED_AT, UPDATED_AT)
            VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)
        """, new String[]{"ID"})) {
            ps.setString(1, u.name());
            ps.setString(2, u.remoteId());
            ps.setString(3, u.status().code());
            ps.setString(4, u.clusterId());
            ps.setString(5, u.owner());
            ps.setString(6, JdbcUtil.flag(u.test()));
            JdbcUtil.setClob(ps, 7, cipher.encrypt(u.credentials()));
            JdbcUtil.setClob(ps, 8, Json.write(u.workSpec()));
            JdbcUtil.setClob(ps, 9, u.launchConfig().canonicalJson());
            ps.setString(10, u.configHash());
            JdbcUtil.setClob(ps, 11, Json.write(u.customMetadata()));
            JdbcUtil.setClob(ps, 12, Json.write(u.snapshot()));
            ps.setTimestamp(13, JdbcUtil.ts(u.createdAt()));
            ps.setTimestamp(14, JdbcUtil.ts(u.updatedAt()));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("no generated key for TB_WORK_UNIT");
                long id = keys.getLong(1);
                u.assignId(id);
                return id;
            }
        }
    }

    @Override
    public boolean update(WorkUnit u) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_WORK_UNIT
               SET REMOTE_ID=?, STATUS=?, CLUSTER_ID=?, SNAPSHOT=?, UPDATED_AT=?
             WHERE ID=?
               AND STATUS NOT IN (""" + TERMINAL_CODES + ")")) {
            ps.setString(1, u.remoteId());
            ps.setString(2, u.status().code());
            ps.setString(3, u.clusterId());
            JdbcUtil.setClob(ps, 4, Json.write(u.snapshot()));
            ps.setTimestamp(5, JdbcUtil.ts(u.updatedAt()));
            ps.setLong(6, u.id());
            if (ps.executeUpdate() == 1) return true;
        }
        // terminal rows are never rewritten
        if (findById(u.id()).isEmpty()) throw new SQLException("work unit " + u.id() + " not found");
        return false;
    }

    @Override
    public Optional<WorkUnit> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WORK_UNIT WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toWorkUnit(rs, cipher)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<WorkUnit> lockById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WORK_UNIT WHERE ID=? FOR UPDATE")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toWorkUnit(rs, cipher)) : Optional.empty();
            }
        }
    }

    @Override
    public List<WorkUnit> lockUnassigned(Collection<Long> ids) throws Exception {
        if (ids != null && ids.isEmpty()) return Collections.emptyList();
        String filter = ids == null ? "" :
                " AND ID IN (" + ids.stream().map(x -> "?").collect(Collectors.joining(",")) + ")";
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_WORK_UNIT WHERE STATUS='UNASSIGNED'" + filter + " ORDER BY ID FOR UPDATE")) {
            if (ids != null) {
                int i = 1;
                for (Long id : ids) ps.setLong(i++, id);
            }
            return list(ps);
        }
    }

    @Override
    public List<WorkUnit> findNonTerminal() throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT * FROM TB_WORK_UNIT WHERE STATUS NOT IN (" + TERMINAL_CODES + ") ORDER BY ID")) {
            return list(ps);
        }
    }

    @Override
    public List<WorkUnit> findByStatus(WorkUnit.Status status) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WORK_UNIT WHERE STATUS=? ORDER BY ID")) {
            ps.setString(1, status.code());
            return list(ps);
        }
    }

    @Override
    public List<WorkUnit> findByCluster(String clusterId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WORK_UNIT WHERE CLUSTER_ID=? ORDER BY ID")) {
            ps.setString(1, clusterId);
            return list(ps);
        }
    }

    private List<WorkUnit> list(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            List<WorkUnit> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toWorkUnit(rs, cipher));
            return out;
        }
    }
}
