package modelmigration.exceptions;

/**
 * The requested phase is not reachable from the migration's current phase.
 *
 * <p>Message format: {@code "illegal phase change: QUIESCE -> SUCCESS"}.
 */
public class IllegalPhaseTransitionException extends MigrationException {

    private final String from;
    private final String to;

    public IllegalPhaseTransitionException(String migrationId, String from, String to) {
        super("illegal phase change: " + from + " -> " + to, migrationId, from, null, null, null);
        this.from = from;
        this.to = to;
    }

    /** The phase the migration was in. */
    public String getFrom() {
        return from;
    }

    /** The phase that was requested. */
    public String getTo() {
        return to;
    }
}
