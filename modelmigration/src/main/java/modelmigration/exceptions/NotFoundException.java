package modelmigration.exceptions;

/**
 * The requested migration or model does not exist.
 */
public class NotFoundException extends MigrationException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, String migrationId) {
        super(message, migrationId, null, null, null, null);
    }
}
