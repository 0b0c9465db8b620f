package modelmigration.watcher;

import java.time.Duration;

/**
 * Signals that something a consumer is interested in has changed.
 *
 * <p>A watcher delivers one event as soon as it starts, so the consumer reads
 * the current state first. After that, any number of changes between two
 * reads collapse into a single event: consumers learn <em>that</em> something
 * changed and re-read the state they care about.
 *
 * <h2>Usage:</h2>
 * <pre>
 * try (NotifyWatcher w = coordinator.watchMigrationStatus(modelUUID)) {
 *     while (w.awaitChange()) {
 *         ModelMigration mig = coordinator.latestForModel(modelUUID);
 *         ...
 *     }
 * }
 * </pre>
 */
public interface NotifyWatcher extends AutoCloseable {

    /**
     * Waits for the next event.
     *
     * @param timeout how long to wait
     * @return true if an event was consumed, false on timeout or once stopped
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean awaitChange(Duration timeout) throws InterruptedException;

    /**
     * Waits for the next event with no time limit.
     *
     * @return true if an event was consumed, false once the watcher is stopped
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean awaitChange() throws InterruptedException;

    /**
     * Stops the watcher. Pending and future events are discarded and the
     * underlying feed subscription is released. Safe to call more than once.
     */
    void stop();

    boolean isStopped();

    @Override
    default void close() {
        stop();
    }
}
