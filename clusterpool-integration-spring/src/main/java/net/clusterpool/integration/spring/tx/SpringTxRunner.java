package net.clusterpool.integration.spring.tx;

import net.clusterpool.adapter.jdbc.TxContext;
import net.clusterpool.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * {@link TxRunner} on a Spring transaction manager. The connection Spring binds for the transaction
 * is published through {@link TxContext} so the JDBC repositories pick it up. For REQUIRES_NEW the
 * outer connection is put back once the inner transaction ends.
 * <p>
 * Checked exceptions from the body still roll back and reach the caller unchanged.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                Connection outer = TxContext.get();
                // the physical connection of the current Spring transaction
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedBodyFailure(e);
                } finally {
                    if (outer != null) TxContext.set(outer);
                    else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedBodyFailure f) {
            throw f.checked();
        }
    }

    private static final class CheckedBodyFailure extends RuntimeException {
        CheckedBodyFailure(Exception cause) { super(cause); }

        Exception checked() { return (Exception) getCause(); }
    }
}
