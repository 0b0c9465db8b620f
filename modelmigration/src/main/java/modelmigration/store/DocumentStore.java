package modelmigration.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory document store with optimistic, assert-and-set transactions.
 *
 * <p>Documents are immutable values grouped into named collections. The only
 * way to write is {@link #apply(List)}, which commits a list of {@link TxnOp}s
 * atomically: all assertions are checked against the current state (including
 * writes made by earlier operations of the same transaction) and either every
 * operation is applied or none is. There are no blocking locks visible to
 * callers; a writer that loses a race gets a {@link TransactionAbortedException}
 * and decides for itself what to do next.
 *
 * <p>Each committed transaction gets a new revision and is published as one
 * {@link ChangeSet} on the store's {@link ChangeFeed}.
 *
 * @see TxnOp
 * @see TransactionRunner
 */
public final class DocumentStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, NavigableMap<String, StoredDocument<?>>> collections = new HashMap<>();
    private final ChangeFeed feed = new ChangeFeed();
    private final ConcurrentLinkedDeque<Runnable> beforeHooks = new ConcurrentLinkedDeque<>();

    private long revision;

    /**
     * Checks that every hook registered by {@link #setBeforeHooks(Runnable...)} ran.
     */
    public interface HooksChecker {
        /**
         * @throws IllegalStateException if some hooks never ran; they are discarded
         */
        void check();
    }

    /**
     * Reads one document.
     *
     * @param collection the collection name
     * @param id the document id
     * @param type the expected body type
     * @return the document, or empty if it does not exist
     * @throws IllegalStateException if the stored body has a different type
     */
    public <T> Optional<StoredDocument<T>> find(String collection, String id, Class<T> type) {
        lock.readLock().lock();
        try {
            NavigableMap<String, StoredDocument<?>> docs = collections.get(collection);
            StoredDocument<?> doc = docs != null ? docs.get(id) : null;
            return Optional.ofNullable(doc).map(d -> typed(d, type));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reads every document whose id starts with {@code idPrefix}, in id order.
     */
    public <T> List<StoredDocument<T>> findByPrefix(String collection, String idPrefix, Class<T> type) {
        lock.readLock().lock();
        try {
            NavigableMap<String, StoredDocument<?>> docs = collections.get(collection);
            if (docs == null) {
                return List.of();
            }
            List<StoredDocument<T>> result = new ArrayList<>();
            for (StoredDocument<?> doc : docs.subMap(idPrefix, true, idPrefix + Character.MAX_VALUE, false).values()) {
                result.add(typed(doc, type));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reads every document of a collection matching {@code filter}, in id order.
     */
    public <T> List<StoredDocument<T>> findAll(String collection, Class<T> type, Predicate<? super T> filter) {
        lock.readLock().lock();
        try {
            NavigableMap<String, StoredDocument<?>> docs = collections.get(collection);
            if (docs == null) {
                return List.of();
            }
            List<StoredDocument<T>> result = new ArrayList<>();
            for (StoredDocument<?> doc : docs.values()) {
                StoredDocument<T> typedDoc = typed(doc, type);
                if (filter.test(typedDoc.value())) {
                    result.add(typedDoc);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies a transaction atomically.
     *
     * @param ops the operations, applied in order
     * @return the revision assigned to the transaction, or the current revision if {@code ops} is empty
     * @throws TransactionAbortedException if any assertion fails; nothing is written
     */
    public long apply(List<TxnOp> ops) throws TransactionAbortedException {
        runBeforeHook();
        if (ops.isEmpty()) {
            return currentRevision();
        }

        lock.writeLock().lock();
        try {
            Map<DocKey, Object> staged = new LinkedHashMap<>();
            Map<DocKey, Object> original = new HashMap<>();

            for (TxnOp op : ops) {
                DocKey key = new DocKey(op.collection(), op.id());
                Object current = staged.containsKey(key) ? staged.get(key) : valueOf(key);
                if (!op.holds(current)) {
                    log.debug("Transaction aborted on {}", op);
                    throw new TransactionAbortedException(op.toString());
                }
                if (op.writes()) {
                    original.putIfAbsent(key, current);
                    staged.put(key, op.applyTo(current));
                }
            }

            long txnRevision = ++revision;
            List<DocumentChange> changes = new ArrayList<>(staged.size());
            for (Map.Entry<DocKey, Object> entry : staged.entrySet()) {
                DocKey key = entry.getKey();
                Object after = entry.getValue();
                NavigableMap<String, StoredDocument<?>> docs =
                        collections.computeIfAbsent(key.collection(), c -> new TreeMap<>());
                if (after == null) {
                    docs.remove(key.id());
                } else {
                    docs.put(key.id(), new StoredDocument<>(key.collection(), key.id(), txnRevision, after));
                }
                changes.add(new DocumentChange(key.collection(), key.id(), original.get(key), after));
            }

            // published under the write lock so subscribers see commit order
            feed.publish(new ChangeSet(txnRevision, changes));
            return txnRevision;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Revision of the most recent committed transaction. */
    public long currentRevision() {
        lock.readLock().lock();
        try {
            return revision;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Subscribes to committed change sets.
     *
     * @see ChangeFeed#subscribe(Consumer)
     */
    public ChangeFeed.Subscription subscribe(Consumer<ChangeSet> listener) {
        return feed.subscribe(listener);
    }

    /** The feed change sets are published on. */
    public ChangeFeed changeFeed() {
        return feed;
    }

    /**
     * Registers hooks to run just before upcoming transactions, one hook per
     * transaction, outside the store's lock. A hook may itself write to the
     * store, which lets tests stage a concurrent writer deterministically.
     *
     * @param hooks hooks in the order they should run
     * @return a checker verifying that every hook ran
     */
    public HooksChecker setBeforeHooks(Runnable... hooks) {
        List<Runnable> registered = Collections.unmodifiableList(Arrays.asList(hooks));
        beforeHooks.addAll(registered);
        return () -> {
            int pending = 0;
            for (Runnable hook : registered) {
                if (beforeHooks.remove(hook)) {
                    pending++;
                }
            }
            if (pending > 0) {
                throw new IllegalStateException(pending + " transaction hook(s) did not run");
            }
        };
    }

    @Override
    public void close() {
        feed.close();
    }

    private void runBeforeHook() {
        Runnable hook = beforeHooks.pollFirst();
        if (hook != null) {
            log.debug("Running transaction hook");
            hook.run();
        }
    }

    private Object valueOf(DocKey key) {
        NavigableMap<String, StoredDocument<?>> docs = collections.get(key.collection());
        StoredDocument<?> doc = docs != null ? docs.get(key.id()) : null;
        return doc != null ? doc.value() : null;
    }

    private static <T> StoredDocument<T> typed(StoredDocument<?> doc, Class<T> type) {
        if (!type.isInstance(doc.value())) {
            throw new IllegalStateException("document " + doc.collection() + "/" + doc.id()
                    + " is a " + doc.value().getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return new StoredDocument<>(doc.collection(), doc.id(), doc.revision(), type.cast(doc.value()));
    }

    private record DocKey(String collection, String id) {
    }
}
