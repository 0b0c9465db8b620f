package modelmigration.phase;

import modelmigration.exceptions.NotValidException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Phases of a model migration and the legal transitions between them.
 *
 * <p>{@link #QUIESCE} is the only initial phase. {@link #DONE}, {@link #ABORTDONE}
 * and {@link #REAPFAILED} are terminal. Legality is decided solely by the
 * adjacency table below; declaration order carries no meaning.
 *
 * <pre>
 * QUIESCE -&gt; READONLY -&gt; PRECHECK -&gt; IMPORT -&gt; VALIDATION -&gt; SUCCESS -&gt; LOGTRANSFER -&gt; REAP -&gt; DONE
 *    |          |           |          |           |                                         \-&gt; REAPFAILED
 *    \----------+-----------+----------+-----------+--&gt; ABORT -&gt; ABORTDONE
 * </pre>
 */
public enum MigrationPhase {
    QUIESCE,
    READONLY,
    PRECHECK,
    IMPORT,
    VALIDATION,
    SUCCESS,
    LOGTRANSFER,
    REAP,
    REAPFAILED,
    DONE,
    ABORT,
    ABORTDONE;

    private static final Map<MigrationPhase, Set<MigrationPhase>> TRANSITIONS = new EnumMap<>(MigrationPhase.class);

    /** Phases at or beyond SUCCESS, in the order a successful migration visits them. */
    private static final List<MigrationPhase> SUCCESS_PATH = List.of(SUCCESS, LOGTRANSFER, REAP, REAPFAILED, DONE);

    static {
        TRANSITIONS.put(QUIESCE, EnumSet.of(READONLY, ABORT));
        TRANSITIONS.put(READONLY, EnumSet.of(PRECHECK, ABORT));
        TRANSITIONS.put(PRECHECK, EnumSet.of(IMPORT, ABORT));
        TRANSITIONS.put(IMPORT, EnumSet.of(VALIDATION, ABORT));
        TRANSITIONS.put(VALIDATION, EnumSet.of(SUCCESS, ABORT));
        TRANSITIONS.put(SUCCESS, EnumSet.of(LOGTRANSFER));
        TRANSITIONS.put(LOGTRANSFER, EnumSet.of(REAP));
        TRANSITIONS.put(REAP, EnumSet.of(DONE, REAPFAILED));
        TRANSITIONS.put(ABORT, EnumSet.of(ABORTDONE));
        for (MigrationPhase phase : values()) {
            TRANSITIONS.putIfAbsent(phase, EnumSet.noneOf(MigrationPhase.class));
        }
    }

    /** The phase every migration starts in. */
    public static MigrationPhase initial() {
        return QUIESCE;
    }

    /**
     * Phases reachable in one step from this one.
     *
     * @return an unmodifiable set, empty for terminal phases
     */
    public Set<MigrationPhase> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    /**
     * @param next the requested phase
     * @return true if {@code next} is in this phase's allowed set
     */
    public boolean canTransitionTo(MigrationPhase next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }

    /** True for phases that end a migration. */
    public boolean isTerminal() {
        return this == DONE || this == ABORTDONE || this == REAPFAILED;
    }

    /** True while the migration is still making forward progress. */
    public boolean isRunning() {
        return !isTerminal() && this != ABORT;
    }

    /**
     * True if a migration in this phase has passed SUCCESS.
     *
     * <p>Decides which mode a model is left in once its migration ends.
     */
    public boolean hasReachedSuccess() {
        return SUCCESS_PATH.contains(this);
    }

    /**
     * Parses a phase name, ignoring case.
     *
     * @param name phase name such as {@code "readonly"}
     * @return the phase
     * @throws NotValidException if the name is not a phase
     */
    public static MigrationPhase parse(String name) throws NotValidException {
        if (name != null) {
            String wanted = name.trim().toUpperCase(Locale.ROOT);
            for (MigrationPhase phase : values()) {
                if (phase.name().equals(wanted)) {
                    return phase;
                }
            }
        }
        throw NotValidException.of("phase", "phase \"" + name + "\"");
    }
}
