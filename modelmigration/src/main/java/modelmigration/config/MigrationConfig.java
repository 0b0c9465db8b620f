package modelmigration.config;

/**
 * Central configuration for the migration coordinator.
 *
 * <p>Covers:
 * <ul>
 *   <li>Model mode labels written when a migration starts, succeeds or is aborted</li>
 *   <li>The status message a new migration starts with</li>
 *   <li>How many times a creation or report transaction is rebuilt after losing a race</li>
 *   <li>Alert level for {@link modelmigration.alert.MigrationAlertLogger}</li>
 * </ul>
 *
 * <p>Loaded from {@code migration.properties} or {@code migration.yml} by
 * {@link MigrationConfigLoader}.
 *
 * @see MigrationConfigLoader
 */
public final class MigrationConfig {

    public static final MigrationConfig DEFAULTS = builder().build();

    private final String activeMode;
    private final String exportingMode;
    private final String migratedMode;
    private final String initialStatusMessage;
    private final int txnAttempts;
    private final AlertLevel alertLevel;

    private MigrationConfig(Builder b) {
        this.activeMode = b.activeMode;
        this.exportingMode = b.exportingMode;
        this.migratedMode = b.migratedMode;
        this.initialStatusMessage = b.initialStatusMessage;
        this.txnAttempts = b.txnAttempts;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Mode of a model that is not migrating (and the mode restored on abort). */
    public String activeMode() { return activeMode; }

    /** Mode of a model while a migration is exporting it. */
    public String exportingMode() { return exportingMode; }

    /** Mode of a model whose migration went past SUCCESS and ended. */
    public String migratedMode() { return migratedMode; }

    /** Status message of a freshly created migration. */
    public String initialStatusMessage() { return initialStatusMessage; }

    /** Maximum number of times a creation or report transaction is built. */
    public int txnAttempts() { return txnAttempts; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "activeMode=" + activeMode +
                ", exportingMode=" + exportingMode +
                ", migratedMode=" + migratedMode +
                ", initialStatusMessage=" + initialStatusMessage +
                ", txnAttempts=" + txnAttempts +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigrationConfig} instances.
     */
    public static final class Builder {
        private String activeMode = "active";
        private String exportingMode = "exporting";
        private String migratedMode = "migrated";
        private String initialStatusMessage = "starting";
        private int txnAttempts = 3;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder activeMode(String mode) {
            this.activeMode = requireLabel(mode, "activeMode");
            return this;
        }

        public Builder exportingMode(String mode) {
            this.exportingMode = requireLabel(mode, "exportingMode");
            return this;
        }

        public Builder migratedMode(String mode) {
            this.migratedMode = requireLabel(mode, "migratedMode");
            return this;
        }

        public Builder initialStatusMessage(String message) {
            if (message == null) throw new IllegalArgumentException("initialStatusMessage must not be null");
            this.initialStatusMessage = message;
            return this;
        }

        public Builder txnAttempts(int attempts) {
            if (attempts <= 0) throw new IllegalArgumentException("txnAttempts must be positive");
            this.txnAttempts = attempts;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigrationConfig build() {
            if (activeMode.equals(exportingMode) || exportingMode.equals(migratedMode)) {
                throw new IllegalArgumentException("exporting mode must differ from active and migrated modes");
            }
            return new MigrationConfig(this);
        }

        private static String requireLabel(String mode, String name) {
            if (mode == null || mode.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return mode;
        }
    }
}
