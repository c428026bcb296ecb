package net.clusterpool.adapter.jdbc;

import java.io.StringReader;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static String flag(boolean b) { return b ? "Y" : "N"; }

    public static boolean isYes(String s) { return "Y".equals(s); }

    /** binds a CLOB column; streams so large documents work on every driver */
    public static void setClob(PreparedStatement ps, int index, String text) throws SQLException {
        if (text == null) ps.setNull(index, Types.CLOB);
        else ps.setCharacterStream(index, new StringReader(text), text.length());
    }

    public static String getClob(ResultSet rs, String column) throws SQLException {
        return rs.getString(column);
    }
}
