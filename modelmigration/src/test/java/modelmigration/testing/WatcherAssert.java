package modelmigration.testing;

import modelmigration.watcher.NotifyWatcher;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Assertions over {@link NotifyWatcher} events.
 *
 * <p>Change sets are delivered asynchronously, so "no change" is checked by
 * waiting a short while for an event that must not come.
 */
public final class WatcherAssert {

    private static final Duration LONG_WAIT = Duration.ofSeconds(5);
    private static final Duration SHORT_WAIT = Duration.ofMillis(100);

    private WatcherAssert() {}

    /** Exactly one (coalesced) event is pending. */
    public static void assertOneChange(NotifyWatcher w) throws InterruptedException {
        assertThat(w.awaitChange(LONG_WAIT)).as("expected a change on %s", w).isTrue();
        assertNoChange(w);
    }

    public static void assertNoChange(NotifyWatcher w) throws InterruptedException {
        assertThat(w.awaitChange(SHORT_WAIT)).as("unexpected change on %s", w).isFalse();
    }

    /** Stops the watcher and checks it no longer delivers. */
    public static void assertStops(NotifyWatcher w) throws InterruptedException {
        w.stop();
        assertThat(w.isStopped()).isTrue();
        assertThat(w.awaitChange(SHORT_WAIT)).isFalse();
        assertThat(w.awaitChange()).isFalse();
    }
}
