package modelmigration.exceptions;

/**
 * An agent reported a different outcome for a phase it had already reported.
 *
 * <p>This signals a bug in the reporting agent rather than a race, so it is
 * never retried.
 */
public class ReportConflictException extends MigrationException {

    public ReportConflictException(String migrationId, String phase, String agent) {
        super(String.format("conflicting reports received for %s/%s/%s", migrationId, phase, agent),
                migrationId, phase, agent, null, null);
    }
}
