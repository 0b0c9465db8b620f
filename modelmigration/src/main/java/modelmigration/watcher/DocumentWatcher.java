package modelmigration.watcher;

import modelmigration.store.ChangeFeed;
import modelmigration.store.ChangeSet;
import modelmigration.store.DocumentChange;
import modelmigration.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * {@link NotifyWatcher} driven by a {@link DocumentStore}'s change feed.
 *
 * <p>Every committed change set is tested against a predicate over its
 * {@link DocumentChange}s; a match raises a single pending flag, so a burst of
 * matching writes is seen by the consumer as one event. The flag starts raised
 * to produce the initial event, which covers every commit up to the revision
 * current when the watcher started; older change sets still in flight on the
 * feed are ignored.
 */
public final class DocumentWatcher implements NotifyWatcher {

    private static final Logger log = LoggerFactory.getLogger(DocumentWatcher.class);

    private final String name;
    private final Predicate<DocumentChange> filter;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private boolean pending = true;
    private boolean stopped;
    private volatile ChangeFeed.Subscription subscription;
    private volatile long startRevision = Long.MAX_VALUE;

    private DocumentWatcher(String name, Predicate<DocumentChange> filter) {
        this.name = Objects.requireNonNull(name, "name");
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    /**
     * Starts a watcher.
     *
     * @param name label used in logs
     * @param store the store whose commits are watched
     * @param filter selects the document changes that raise an event
     * @return the running watcher
     */
    public static DocumentWatcher start(String name, DocumentStore store, Predicate<DocumentChange> filter) {
        DocumentWatcher watcher = new DocumentWatcher(name, filter);
        watcher.subscription = store.subscribe(watcher::onChangeSet);
        watcher.startRevision = store.currentRevision();
        log.debug("Watcher {} started", name);
        return watcher;
    }

    private void onChangeSet(ChangeSet changes) {
        if (changes.revision() <= startRevision || changes.changes().stream().noneMatch(filter)) {
            return;
        }
        lock.lock();
        try {
            if (!stopped) {
                pending = true;
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean awaitChange(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!pending && !stopped) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return consume();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean awaitChange() throws InterruptedException {
        lock.lock();
        try {
            while (!pending && !stopped) {
                changed.await();
            }
            return consume();
        } finally {
            lock.unlock();
        }
    }

    private boolean consume() {
        if (stopped) {
            return false;
        }
        pending = false;
        return true;
    }

    @Override
    public void stop() {
        ChangeFeed.Subscription toClose;
        lock.lock();
        try {
            if (stopped) {
                return;
            }
            stopped = true;
            pending = false;
            toClose = subscription;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        toClose.close();
        log.debug("Watcher {} stopped", name);
    }

    @Override
    public boolean isStopped() {
        lock.lock();
        try {
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "DocumentWatcher{" + name + '}';
    }
}
