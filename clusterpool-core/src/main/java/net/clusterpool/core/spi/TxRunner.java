package net.clusterpool.core.spi;

import java.util.concurrent.Callable;

/**
 * Transaction boundary of the entity store.
 * <p>
 * {@code required} joins a transaction already bound to the calling thread, {@code requiresNew}
 * always commits on its own (used to make a freshly created cluster visible before the pass ends).
 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;
}
