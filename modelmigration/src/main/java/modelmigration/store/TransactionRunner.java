package modelmigration.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Builds and applies a transaction, rebuilding it from fresh state after an abort.
 *
 * <p>The builder receives the attempt number. On attempt 0 it works from what
 * the caller already knows; on later attempts it must re-read the store and
 * either produce a new transaction, return an empty list when the desired
 * state is already in place, or throw a definitive error. The runner itself
 * never decides that an abort is harmless.
 *
 * <h2>Usage:</h2>
 * <pre>
 * runner.run(attempt -&gt; {
 *     if (attempt &gt; 0 &amp;&amp; alreadyDone()) {
 *         return List.of();
 *     }
 *     return List.of(TxnOp.insert(COLLECTION, id, doc));
 * });
 * </pre>
 */
public final class TransactionRunner {

    private static final Logger log = LoggerFactory.getLogger(TransactionRunner.class);

    /**
     * Produces the operations for one attempt.
     *
     * @param <E> the definitive error the builder may raise
     */
    @FunctionalInterface
    public interface TxnBuilder<E extends Exception> {
        List<TxnOp> build(int attempt) throws E;
    }

    private final DocumentStore store;
    private final int maxAttempts;

    /**
     * @param store the store to write to
     * @param maxAttempts how many times the transaction may be built, at least 1
     */
    public TransactionRunner(DocumentStore store, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.maxAttempts = maxAttempts;
    }

    /**
     * Runs the builder until a transaction commits, the builder has nothing to
     * do, the builder throws, or the attempts are used up.
     *
     * @throws E whatever the builder throws
     * @throws TransactionAbortedException the last abort, once attempts are exhausted
     */
    public <E extends Exception> void run(TxnBuilder<E> builder) throws E, TransactionAbortedException {
        TransactionAbortedException last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            List<TxnOp> ops = builder.build(attempt);
            if (ops.isEmpty()) {
                return;
            }
            try {
                store.apply(ops);
                return;
            } catch (TransactionAbortedException e) {
                log.debug("Attempt {} of {} aborted: {}", attempt + 1, maxAttempts, e.getFailedOp());
                last = e;
            }
        }
        throw last;
    }
}
