package modelmigration.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Publishes committed {@link ChangeSet}s to subscribers.
 *
 * <p>Delivery happens on a single dispatcher thread, in commit order, so a
 * writer never waits for a subscriber. A subscriber that throws is logged
 * and does not affect other subscribers.
 */
public final class ChangeFeed implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChangeFeed.class);

    /**
     * Handle returned by {@link #subscribe(Consumer)}. Closing it stops delivery.
     */
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private final List<Consumer<ChangeSet>> listeners = new CopyOnWriteArrayList<>();

    // daemon thread so an unclosed store does not keep the JVM alive
    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "migration-change-feed");
        t.setDaemon(true);
        return t;
    });

    /**
     * Registers a listener for every subsequent change set.
     *
     * @param listener receives change sets on the dispatcher thread
     * @return a subscription that unregisters the listener when closed
     */
    public Subscription subscribe(Consumer<ChangeSet> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Number of live subscriptions. */
    public int subscriberCount() {
        return listeners.size();
    }

    void publish(ChangeSet changes) {
        try {
            dispatcher.execute(() -> deliver(changes));
        } catch (RejectedExecutionException e) {
            log.debug("Change feed closed, dropping revision {}", changes.revision());
        }
    }

    private void deliver(ChangeSet changes) {
        for (Consumer<ChangeSet> listener : listeners) {
            try {
                listener.accept(changes);
            } catch (RuntimeException e) {
                log.warn("Change listener failed on revision {}", changes.revision(), e);
            }
        }
    }

    @Override
    public void close() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(1, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        listeners.clear();
    }
}
