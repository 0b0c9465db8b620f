package modelmigration.store;

/**
 * One document written by a committed transaction.
 *
 * <p>{@code before} is null for inserts, {@code after} is null for removals.
 *
 * @param collection the collection of the changed document
 * @param id the document id
 * @param before the body before the transaction, or null
 * @param after the body after the transaction, or null
 */
public record DocumentChange(String collection, String id, Object before, Object after) {

    public boolean isInsert() {
        return before == null && after != null;
    }

    public boolean isRemove() {
        return before != null && after == null;
    }

    public boolean in(String collectionName) {
        return collection.equals(collectionName);
    }

    /**
     * Returns the body before the change if it has the given type.
     */
    public <T> T before(Class<T> type) {
        return type.isInstance(before) ? type.cast(before) : null;
    }

    /**
     * Returns the body after the change if it has the given type.
     */
    public <T> T after(Class<T> type) {
        return type.isInstance(after) ? type.cast(after) : null;
    }
}
