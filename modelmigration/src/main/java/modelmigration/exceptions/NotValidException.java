package modelmigration.exceptions;

/**
 * A migration spec (or a value parsed from user input) is malformed.
 *
 * <p>The message names the offending field, e.g. {@code "empty Password not valid"}.
 */
public class NotValidException extends MigrationException {

    /**
     * @param field the field that failed validation
     * @param message the full message, naming the field
     */
    public NotValidException(String field, String message) {
        super(message, null, null, null, field, null);
    }

    /**
     * Builds the conventional {@code "<what> not valid"} message.
     *
     * @param field the field that failed validation
     * @param what description of the problem, e.g. {@code "empty CACert"}
     * @return the exception
     */
    public static NotValidException of(String field, String what) {
        return new NotValidException(field, what + " not valid");
    }
}
