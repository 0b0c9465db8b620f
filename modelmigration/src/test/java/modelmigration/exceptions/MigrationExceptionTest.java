package modelmigration.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MigrationException")
class MigrationExceptionTest {

    @Nested
    @DisplayName("constructor with message only")
    class ConstructorWithMessageOnly {

        @Test
        @DisplayName("should store message")
        void shouldStoreMessage() {
            MigrationException ex = new MigrationException("something broke");

            assertThat(ex.getMessage()).isEqualTo("something broke");
            assertThat(ex.getCause()).isNull();
        }

        @Test
        @DisplayName("should have null diagnostic fields")
        void shouldHaveNullDiagnosticFields() {
            MigrationException ex = new MigrationException("Error");

            assertThat(ex.getMigrationId()).isNull();
            assertThat(ex.getPhase()).isNull();
            assertThat(ex.getAgent()).isNull();
            assertThat(ex.getField()).isNull();
            assertThat(ex.describe()).isEqualTo("Error");
        }
    }

    @Nested
    @DisplayName("subclasses")
    class Subclasses {

        @Test
        @DisplayName("NotValidException should name the field")
        void notValidShouldNameField() {
            NotValidException ex = NotValidException.of("CACert", "empty CACert");

            assertThat(ex.getMessage()).isEqualTo("empty CACert not valid");
            assertThat(ex.getField()).isEqualTo("CACert");
            assertThat(ex.describe()).isEqualTo("empty CACert not valid [field=CACert]");
        }

        @Test
        @DisplayName("IllegalPhaseTransitionException should name both phases")
        void illegalTransitionShouldNameBothPhases() {
            IllegalPhaseTransitionException ex = new IllegalPhaseTransitionException("m:0", "QUIESCE", "SUCCESS");

            assertThat(ex.getMessage()).isEqualTo("illegal phase change: QUIESCE -> SUCCESS");
            assertThat(ex.getFrom()).isEqualTo("QUIESCE");
            assertThat(ex.getTo()).isEqualTo("SUCCESS");
            assertThat(ex.getMigrationId()).isEqualTo("m:0");
        }

        @Test
        @DisplayName("ReportConflictException should carry migration, phase and agent")
        void reportConflictShouldCarryContext() {
            ReportConflictException ex = new ReportConflictException("m:2", "QUIESCE", "machine-42");

            assertThat(ex.getMessage()).isEqualTo("conflicting reports received for m:2/QUIESCE/machine-42");
            assertThat(ex.describe()).contains("[migration=m:2]", "[phase=QUIESCE]", "[agent=machine-42]");
        }

        @Test
        @DisplayName("race and conflict errors should be distinct types")
        void raceAndConflictShouldBeDistinct() {
            MigrationException race = new MigrationRaceException("phase already changed", "m:0", "QUIESCE");
            MigrationException conflict = new MigrationConflictException("failed to create migration: already in progress");

            assertThat(race).isNotInstanceOf(MigrationConflictException.class);
            assertThat(conflict).isNotInstanceOf(MigrationRaceException.class);
        }
    }
}
