package net.clusterpool.adapter.jdbc;

import net.clusterpool.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/**
 * Plain-JDBC transactions bound to the calling thread through {@link TxContext}.
 * Any {@link Throwable} rolls back and is rethrown unchanged.
 */
public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // join the running transaction
            return body.call();
        }
        return inNewTransaction(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        // suspend the outer transaction, run on a fresh connection, then restore
        Connection suspended = TxContext.get();
        try {
            return inNewTransaction(body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {
                safeRollback(c);
                sneakyThrow(t);
                return null; // unreachable
            } finally {
                TxContext.clear();
                try { c.setAutoCommit(prevAuto); } catch (SQLException e) { log.debug("autocommit reset failed: {}", e.getMessage()); }
            }
        }
    }

    private static void safeRollback(Connection c) {
        try { c.rollback(); } catch (SQLException e) { log.warn("rollback failed: {}", e.getMessage()); }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}
