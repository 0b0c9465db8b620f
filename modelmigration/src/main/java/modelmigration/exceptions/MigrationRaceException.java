package modelmigration.exceptions;

/**
 * Another writer changed the migration between the caller's last read and its write.
 *
 * <p>Unlike {@link MigrationConflictException}, this is retryable: the caller
 * may {@code refresh()} its handle and decide whether to try again. The
 * coordinator itself never retries.
 */
public class MigrationRaceException extends MigrationException {

    public MigrationRaceException(String message, String migrationId, String phase) {
        super(message, migrationId, phase, null, null, null);
    }

    public MigrationRaceException(String message, String migrationId, Throwable cause) {
        super(message, migrationId, null, null, null, cause);
    }
}
