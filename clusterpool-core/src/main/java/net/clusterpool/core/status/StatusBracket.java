package net.clusterpool.core.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs a state-changing operation and maps its outcome onto a status.
 * <ul>
 *   <li>success: the success status, if one is configured, otherwise the status is left alone</li>
 *   <li>failure whose text indicates expired credentials: the expired-token status, always</li>
 *   <li>failure of a preserved type: status left as it was</li>
 *   <li>any other failure: the error status</li>
 * </ul>
 * The original exception is always rethrown; swallowing is the caller's decision.
 * No transactional work happens here.
 *
 * @param <S> status enum of the entity
 */
public final class StatusBracket<S> {
    private static final Logger log = LoggerFactory.getLogger(StatusBracket.class);

    @FunctionalInterface
    public interface Operation<T, E extends Exception> {
        T run() throws E;
    }

    private final String subject;
    private final Consumer<S> apply;
    private final S expiredToken;
    private final S onError;
    private final S onSuccess;
    private final Class<? extends Exception> preserveOn;

    private StatusBracket(String subject, Consumer<S> apply, S expiredToken,
                          S onError, S onSuccess, Class<? extends Exception> preserveOn) {
        this.subject = subject;
        this.apply = apply;
        this.expiredToken = expiredToken;
        this.onError = onError;
        this.onSuccess = onSuccess;
        this.preserveOn = preserveOn;
    }

    public static <S> StatusBracket<S> of(String subject, Consumer<S> apply, S expiredToken) {
        return new StatusBracket<>(subject, Objects.requireNonNull(apply), Objects.requireNonNull(expiredToken),
                null, null, null);
    }

    public StatusBracket<S> onError(S status) {
        return new StatusBracket<>(subject, apply, expiredToken, status, onSuccess, preserveOn);
    }

    public StatusBracket<S> onSuccess(S status) {
        return new StatusBracket<>(subject, apply, expiredToken, onError, status, preserveOn);
    }

    public StatusBracket<S> preserveOn(Class<? extends Exception> type) {
        return new StatusBracket<>(subject, apply, expiredToken, onError, onSuccess, type);
    }

    public <T, E extends Exception> T run(Operation<T, E> operation) throws E {
        T result;
        try {
            result = operation.run();
        } catch (Exception e) {
            S next = statusFor(e);
            if (next != null) {
                log.error("{} -> {}: {}", subject, next, e.getMessage());
                apply.accept(next);
            } else {
                log.warn("{} kept its status: {}", subject, e.getMessage());
            }
            throw e;
        }
        if (onSuccess != null) apply.accept(onSuccess);
        return result;
    }

    private S statusFor(Exception e) {
        if (CredentialExpiry.indicatedBy(e)) return expiredToken;
        if (preserveOn != null && preserveOn.isInstance(e)) return null;
        return onError;
    }
}
