package modelmigration.alert;

import modelmigration.config.AlertLevel;
import modelmigration.phase.MigrationPhase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("MigrationAlertLogger")
class MigrationAlertLoggerTest {

    @AfterEach
    void resetLevel() {
        MigrationAlertLogger.setAlertLevel(AlertLevel.WARNING);
    }

    @Nested
    @DisplayName("alert level")
    class Level {

        @Test
        @DisplayName("should default to WARNING when reset with null")
        void shouldDefaultToWarning() {
            MigrationAlertLogger.setAlertLevel(AlertLevel.ERROR);
            MigrationAlertLogger.setAlertLevel(null);

            assertThat(MigrationAlertLogger.getAlertLevel()).isEqualTo(AlertLevel.WARNING);
        }

        @Test
        @DisplayName("DEBUG should log info and warnings")
        void debugShouldLogEverything() {
            MigrationAlertLogger.setAlertLevel(AlertLevel.DEBUG);

            assertThat(MigrationAlertLogger.shouldLogInfo()).isTrue();
            assertThat(MigrationAlertLogger.shouldLogWarn()).isTrue();
        }

        @Test
        @DisplayName("WARNING should skip info")
        void warningShouldSkipInfo() {
            MigrationAlertLogger.setAlertLevel(AlertLevel.WARNING);

            assertThat(MigrationAlertLogger.shouldLogInfo()).isFalse();
            assertThat(MigrationAlertLogger.shouldLogWarn()).isTrue();
        }

        @Test
        @DisplayName("ERROR should skip info and warnings")
        void errorShouldSkipWarnings() {
            MigrationAlertLogger.setAlertLevel(AlertLevel.ERROR);

            assertThat(MigrationAlertLogger.shouldLogInfo()).isFalse();
            assertThat(MigrationAlertLogger.shouldLogWarn()).isFalse();
        }
    }

    @Nested
    @DisplayName("events")
    class Events {

        @Test
        @DisplayName("should log every event at DEBUG")
        void shouldLogEveryEvent() {
            MigrationAlertLogger.setAlertLevel(AlertLevel.DEBUG);

            assertThatCode(() -> {
                MigrationAlertLogger.migrationCreated("m:0", "m", "controller-c", "user-admin");
                MigrationAlertLogger.phaseChanged("m:0", MigrationPhase.QUIESCE, MigrationPhase.READONLY);
                MigrationAlertLogger.migrationEnded("m:0", MigrationPhase.DONE, "migrated");
                MigrationAlertLogger.createRejected("m", "failed to create migration: already in progress");
                MigrationAlertLogger.phaseChangeRace("m:0", MigrationPhase.QUIESCE, MigrationPhase.READONLY);
                MigrationAlertLogger.reportConflict("m:0", MigrationPhase.QUIESCE, "machine-0", false);
            }).doesNotThrowAnyException();
        }
    }
}
