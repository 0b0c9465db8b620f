package modelmigration.alert;

import modelmigration.config.AlertLevel;
import modelmigration.phase.MigrationPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for model migration events.
 *
 * <p>Every entry starts with an event name followed by key=value pairs, so log
 * aggregators can alert on them without parsing free text.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: migration created, phase changed, migration ended</li>
 *   <li>WARN: creation rejected, phase change lost a race</li>
 *   <li>ERROR: an agent sent conflicting reports</li>
 * </ul>
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs warnings and errors only</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - MIGRATION_CREATED id=8f1c...:0 model=8f1c... target=controller-5d2e... by=user-admin
 * 12:00:00.100 INFO  migration - PHASE_CHANGED id=8f1c...:0 from=QUIESCE to=READONLY
 * 12:00:05.000 INFO  migration - MIGRATION_ENDED id=8f1c...:0 phase=DONE mode=migrated
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level, null resets to WARNING
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    /**
     * Log a newly created migration.
     *
     * @param migrationId the new migration id
     * @param modelUUID the migrating model
     * @param target the target controller tag
     * @param initiatedBy the user tag that asked for the migration
     */
    public static void migrationCreated(String migrationId, String modelUUID, String target, String initiatedBy) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_CREATED id={} model={} target={} by={}", migrationId, modelUUID, target, initiatedBy);
        }
    }

    /**
     * Log a committed phase change.
     */
    public static void phaseChanged(String migrationId, MigrationPhase from, MigrationPhase to) {
        if (shouldLogInfo()) {
            log.info("PHASE_CHANGED id={} from={} to={}", migrationId, from.name(), to.name());
        }
    }

    /**
     * Log a migration reaching a terminal phase.
     *
     * @param migrationId the migration id
     * @param phase the terminal phase
     * @param mode the mode the model was left in
     */
    public static void migrationEnded(String migrationId, MigrationPhase phase, String mode) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_ENDED id={} phase={} mode={}", migrationId, phase.name(), mode);
        }
    }

    /**
     * Log a refused migration request.
     *
     * @param modelUUID the model the request was for
     * @param reason the error message returned to the caller
     */
    public static void createRejected(String modelUUID, String reason) {
        if (shouldLogWarn()) {
            log.warn("CREATE_REJECTED model={} reason=\"{}\"", modelUUID, reason);
        }
    }

    /**
     * Log a phase change that lost to a concurrent writer.
     *
     * @param migrationId the migration id
     * @param expected the phase the writer believed current
     * @param requested the phase it tried to set
     */
    public static void phaseChangeRace(String migrationId, MigrationPhase expected, MigrationPhase requested) {
        if (shouldLogWarn()) {
            log.warn("PHASE_CHANGE_RACE id={} expected={} requested={}", migrationId, expected.name(), requested.name());
        }
    }

    /**
     * Log an agent contradicting its own earlier report.
     */
    public static void reportConflict(String migrationId, MigrationPhase phase, String agent, boolean success) {
        // Always log errors
        log.error("REPORT_CONFLICT id={} phase={} agent={} success={}", migrationId, phase.name(), agent, success);
    }
}
