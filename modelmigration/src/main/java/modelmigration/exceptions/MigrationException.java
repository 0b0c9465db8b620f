package modelmigration.exceptions;

/**
 * Base class for every failure surfaced by the migration coordinator.
 *
 * <p>Carries optional diagnostic context so that callers can log or display
 * the failure without further lookups:
 * <ul>
 *   <li>the migration id ({@code <modelUUID>:<attempt>})</li>
 *   <li>the phase involved</li>
 *   <li>the agent involved (minion reports)</li>
 *   <li>the offending field (spec validation)</li>
 * </ul>
 *
 * <p>The message returned by {@link #getMessage()} is exactly the message the
 * exception was constructed with; context is exposed through getters and
 * {@link #describe()}.
 *
 * @see NotValidException
 * @see MigrationConflictException
 * @see MigrationRaceException
 * @see NotFoundException
 * @see IllegalPhaseTransitionException
 * @see ReportConflictException
 */
public class MigrationException extends Exception {

    private final String migrationId;
    private final String phase;
    private final String agent;
    private final String field;

    public MigrationException(String message) {
        this(message, null, null, null, null, null);
    }

    public MigrationException(String message, Throwable cause) {
        this(message, null, null, null, null, cause);
    }

    /**
     * Creates an exception with full diagnostic context.
     *
     * @param message the error message
     * @param migrationId migration involved, may be null
     * @param phase phase name involved, may be null
     * @param agent agent tag involved, may be null
     * @param field spec field involved, may be null
     * @param cause underlying cause, may be null
     */
    protected MigrationException(String message,
                                 String migrationId,
                                 String phase,
                                 String agent,
                                 String field,
                                 Throwable cause) {
        super(message, cause);
        this.migrationId = migrationId;
        this.phase = phase;
        this.agent = agent;
        this.field = field;
    }

    /** Migration id the failure relates to, or null. */
    public String getMigrationId() {
        return migrationId;
    }

    /** Phase the failure relates to, or null. */
    public String getPhase() {
        return phase;
    }

    /** Agent tag the failure relates to, or null. */
    public String getAgent() {
        return agent;
    }

    /** Spec field the failure relates to, or null. */
    public String getField() {
        return field;
    }

    /**
     * Message plus any diagnostic context, for log lines.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(String.valueOf(getMessage()));
        if (migrationId != null) sb.append(" [migration=").append(migrationId).append("]");
        if (phase != null) sb.append(" [phase=").append(phase).append("]");
        if (agent != null) sb.append(" [agent=").append(agent).append("]");
        if (field != null) sb.append(" [field=").append(field).append("]");
        return sb.toString();
    }
}
