package modelmigration.sequence;

import modelmigration.store.DocumentStore;
import modelmigration.store.StoredDocument;
import modelmigration.store.TransactionAbortedException;
import modelmigration.store.TxnOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-model counters stored alongside the model's other documents.
 *
 * <p>Each (model, name) pair has its own counter starting at 0. Values are
 * handed out in two ways:
 * <ul>
 *   <li>{@link #next(String, String)} draws a value immediately.</li>
 *   <li>{@link #claim(String, String)} reports the value the next draw would
 *       produce together with the operation that consumes it. Adding that
 *       operation to a larger transaction makes the draw commit or abort with
 *       the rest of the transaction, so a failed caller never burns a value.</li>
 * </ul>
 */
public final class SequenceGenerator {

    private static final Logger log = LoggerFactory.getLogger(SequenceGenerator.class);

    public static final String COLLECTION = "sequence";

    /**
     * Stored counter: the value the next draw will return.
     */
    public record SequenceDoc(String modelUUID, String name, int counter) {
        SequenceDoc withCounter(int value) {
            return new SequenceDoc(modelUUID, name, value);
        }
    }

    /**
     * A value reserved for a pending transaction.
     *
     * @param value the value the caller may use if {@code op} commits
     * @param op the operation that consumes the value; it aborts if another draw got there first
     */
    public record Claim(int value, TxnOp op) {
    }

    private final DocumentStore store;

    public SequenceGenerator(DocumentStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Prepares to consume the next value of a counter.
     *
     * @param modelUUID the owning model
     * @param name the counter name, e.g. {@code "modelmigration"}
     * @return the value and the operation consuming it
     */
    public Claim claim(String modelUUID, String name) {
        String id = docId(modelUUID, name);
        Optional<StoredDocument<SequenceDoc>> doc = store.find(COLLECTION, id, SequenceDoc.class);
        if (doc.isEmpty()) {
            return new Claim(0, TxnOp.insert(COLLECTION, id, new SequenceDoc(modelUUID, name, 1)));
        }
        int value = doc.get().value().counter();
        return new Claim(value, TxnOp.update(COLLECTION, id, SequenceDoc.class,
                d -> d.counter() == value,
                d -> d.withCounter(value + 1)));
    }

    /**
     * Draws the next value of a counter.
     *
     * <p>A lost race with another draw only means that draw took the value,
     * so this simply claims again.
     *
     * @return the drawn value
     */
    public int next(String modelUUID, String name) {
        while (true) {
            Claim claim = claim(modelUUID, name);
            try {
                store.apply(List.of(claim.op()));
                return claim.value();
            } catch (TransactionAbortedException e) {
                log.debug("Sequence {} raced at {}, claiming again", docId(modelUUID, name), claim.value());
            }
        }
    }

    /**
     * The value the next draw would return, without consuming it.
     */
    public int peek(String modelUUID, String name) {
        return store.find(COLLECTION, docId(modelUUID, name), SequenceDoc.class)
                .map(d -> d.value().counter())
                .orElse(0);
    }

    static String docId(String modelUUID, String name) {
        return modelUUID + ":" + name;
    }
}
