package net.clusterpool.adapter.jdbc.mapper;

import net.clusterpool.adapter.jdbc.JdbcUtil;
import net.clusterpool.adapter.jdbc.crypto.CredentialsCipher;
import net.clusterpool.core.json.Json;
import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.model.ClusterConfiguration;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.model.WorkUnit;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- WorkUnit ---
    public static WorkUnit toWorkUnit(ResultSet rs, CredentialsCipher cipher) throws SQLException {
        return WorkUnit.restore(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("REMOTE_ID"),
                WorkUnit.Status.from(rs.getString("STATUS")),
                rs.getString("CLUSTER_ID"),
                rs.getString("OWNER"),
                JdbcUtil.isYes(rs.getString("IS_TEST")),
                cipher.decrypt(JdbcUtil.getClob(rs, "CREDENTIALS")),
                Json.readObject(JdbcUtil.getClob(rs, "WORK_SPEC")),
                LaunchConfig.parse(JdbcUtil.getClob(rs, "LAUNCH_CONFIG")),
                Json.readObject(JdbcUtil.getClob(rs, "CUSTOM_METADATA")),
                Json.readObject(JdbcUtil.getClob(rs, "SNAPSHOT")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- Cluster ---
    public static Cluster toCluster(ResultSet rs, CredentialsCipher cipher) throws SQLException {
        return Cluster.restore(
                rs.getString("ID"),
                Cluster.Status.from(rs.getString("STATUS")),
                Cluster.Kind.from(rs.getString("KIND")),
                JdbcUtil.isYes(rs.getString("MANAGED_BY_SCHEDULER")),
                rs.getString("OWNER"),
                cipher.decrypt(JdbcUtil.getClob(rs, "CREDENTIALS")),
                LaunchConfig.parse(JdbcUtil.getClob(rs, "LAUNCH_CONFIG")),
                Json.readStrings(JdbcUtil.getClob(rs, "ASSIGNED_WORK_UNITS")),
                JdbcUtil.toInstant(rs.getTimestamp("TERMINATE_ON")),
                Json.readObject(JdbcUtil.getClob(rs, "SNAPSHOT")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- ClusterConfiguration ---
    public static ClusterConfiguration toConfiguration(ResultSet rs) throws SQLException {
        return new ClusterConfiguration(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("VERSION"),
                rs.getString("CONTENT_URI"),
                rs.getString("OWNER"),
                rs.getTimestamp("CREATED_AT").toInstant()
        );
    }
}
