package modelmigration.store;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A single conditional operation inside a {@link DocumentStore} transaction.
 *
 * <p>Every operation carries an assertion about the current state of one
 * document. A transaction is applied only when all of its assertions hold:
 * <ul>
 *   <li>{@link #insert} - the document must not exist</li>
 *   <li>{@link #update} - the document must exist and satisfy the predicate</li>
 *   <li>{@link #remove} - the document must exist</li>
 *   <li>{@link #assertMissing} / {@link #assertThat} - pure assertions, nothing is written</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>
 * store.apply(List.of(
 *     TxnOp.update("models", uuid, ModelRecord.class,
 *             m -&gt; m.activeMigrationId() == null,
 *             m -&gt; m.startMigration(id, mode)),
 *     TxnOp.insert("migrations", id, doc)));
 * </pre>
 */
public final class TxnOp {

    public enum Kind { INSERT, UPDATE, REMOVE, ASSERT }

    private final Kind kind;
    private final String collection;
    private final String id;
    private final Predicate<Object> assertion;
    private final UnaryOperator<Object> change;
    private final String description;

    private TxnOp(Kind kind,
                  String collection,
                  String id,
                  Predicate<Object> assertion,
                  UnaryOperator<Object> change,
                  String description) {
        this.kind = kind;
        this.collection = Objects.requireNonNull(collection, "collection");
        this.id = Objects.requireNonNull(id, "id");
        this.assertion = assertion;
        this.change = change;
        this.description = description;
    }

    /**
     * Inserts a document that must not already exist.
     */
    public static <T> TxnOp insert(String collection, String id, T document) {
        Objects.requireNonNull(document, "document");
        return new TxnOp(Kind.INSERT, collection, id,
                Objects::isNull,
                ignored -> document,
                "insert " + collection + "/" + id);
    }

    /**
     * Replaces a document that must exist and satisfy {@code assertion}.
     *
     * @param type the stored document type
     * @param assertion condition on the current body
     * @param change produces the new body from the current one
     */
    public static <T> TxnOp update(String collection,
                                   String id,
                                   Class<T> type,
                                   Predicate<? super T> assertion,
                                   UnaryOperator<T> change) {
        Objects.requireNonNull(change, "change");
        return new TxnOp(Kind.UPDATE, collection, id,
                current -> type.isInstance(current) && assertion.test(type.cast(current)),
                current -> Objects.requireNonNull(change.apply(type.cast(current)), "updated document"),
                "update " + collection + "/" + id);
    }

    /**
     * Replaces a document that must exist.
     */
    public static <T> TxnOp update(String collection, String id, Class<T> type, UnaryOperator<T> change) {
        return update(collection, id, type, current -> true, change);
    }

    /**
     * Removes a document that must exist.
     */
    public static TxnOp remove(String collection, String id) {
        return new TxnOp(Kind.REMOVE, collection, id,
                Objects::nonNull,
                ignored -> null,
                "remove " + collection + "/" + id);
    }

    /**
     * Asserts that a document does not exist.
     */
    public static TxnOp assertMissing(String collection, String id) {
        return new TxnOp(Kind.ASSERT, collection, id,
                Objects::isNull,
                null,
                "assert missing " + collection + "/" + id);
    }

    /**
     * Asserts that a document exists and satisfies {@code assertion}.
     */
    public static <T> TxnOp assertThat(String collection, String id, Class<T> type, Predicate<? super T> assertion) {
        return new TxnOp(Kind.ASSERT, collection, id,
                current -> type.isInstance(current) && assertion.test(type.cast(current)),
                null,
                "assert " + collection + "/" + id);
    }

    public Kind kind() {
        return kind;
    }

    public String collection() {
        return collection;
    }

    public String id() {
        return id;
    }

    boolean holds(Object current) {
        return assertion.test(current);
    }

    boolean writes() {
        return kind != Kind.ASSERT;
    }

    Object applyTo(Object current) {
        return change.apply(current);
    }

    @Override
    public String toString() {
        return description;
    }
}
