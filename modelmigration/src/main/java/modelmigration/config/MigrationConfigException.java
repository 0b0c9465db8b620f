package modelmigration.config;

/**
 * Exception thrown when migration configuration cannot be loaded or is invalid.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>No configuration file is found on the classpath</li>
 *   <li>A configuration file cannot be parsed (invalid YAML/properties syntax)</li>
 * </ul>
 *
 * <p>Unchecked, so that configuration loading can sit in initialization code
 * without forced exception handling.
 *
 * @see MigrationConfigLoader
 */
public class MigrationConfigException extends RuntimeException {

    public MigrationConfigException(String message) {
        super(message);
    }

    public MigrationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
