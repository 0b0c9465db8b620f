package modelmigration.store;

/**
 * A document as read from a {@link DocumentStore}.
 *
 * @param collection the collection holding the document
 * @param id the document id, unique within its collection
 * @param revision the store transaction that last wrote the document
 * @param value the immutable document body
 * @param <T> the document type
 */
public record StoredDocument<T>(String collection, String id, long revision, T value) {
}
