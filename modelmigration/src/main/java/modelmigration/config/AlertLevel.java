package modelmigration.config;

/**
 * Alert level for migration logging.
 *
 * <p>Controls the minimum severity of events written by
 * {@link modelmigration.alert.MigrationAlertLogger}. Configured via the
 * {@code migration.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - everything: creations, phase changes and endings as well as warnings and errors</li>
 *   <li>{@link #WARNING} - rejected creations, lost phase races and errors</li>
 *   <li>{@link #ERROR} - conflicting minion reports only</li>
 * </ul>
 *
 * @see MigrationConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log every migration event. Use for development and troubleshooting. */
    DEBUG,

    /** Log warnings and errors only. This is the default. */
    WARNING,

    /** Log errors only. */
    ERROR
}
