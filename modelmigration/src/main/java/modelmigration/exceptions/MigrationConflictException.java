package modelmigration.exceptions;

/**
 * The requested operation conflicts with the current state of the model.
 *
 * <p>Raised when a migration is already in progress, when the target
 * controller is the model's current controller, when the model is not alive,
 * or when a migration cannot be removed yet. These conditions are definitive:
 * retrying the same call will fail the same way until the state changes.
 *
 * @see MigrationRaceException
 */
public class MigrationConflictException extends MigrationException {

    public MigrationConflictException(String message) {
        super(message);
    }

    public MigrationConflictException(String message, String migrationId) {
        super(message, migrationId, null, null, null, null);
    }
}
