package modelmigration.state;

import modelmigration.exceptions.NotValidException;
import modelmigration.names.Tag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MigrationSpec")
class MigrationSpecTest {

    private static final Tag TARGET = Tag.controller("9a8b7c6d-5e4f-4a3b-8c2d-1e0f9a8b7c6d");

    private static TargetInfo target() {
        return TargetInfo.withPassword(TARGET, List.of("1.2.3.4:5555", "4.3.2.1:6666"), "cert",
                Tag.user("user"), "password");
    }

    private static MigrationSpec spec(TargetInfo info) {
        return new MigrationSpec(Tag.user("admin"), info);
    }

    private static void assertNotValid(MigrationSpec spec, String field, String message) {
        assertThatThrownBy(spec::validate)
                .isInstanceOfSatisfying(NotValidException.class, e -> assertThat(e.getField()).isEqualTo(field))
                .hasMessage(message);
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("should accept a plausible spec")
        void shouldAcceptPlausibleSpec() {
            assertThatCode(() -> spec(target()).validate()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should accept a token instead of a password")
        void shouldAcceptToken() {
            TargetInfo info = new TargetInfo(TARGET, List.of("[::1]:17070"), "cert", Tag.user("user"), "", "tok");

            assertThatCode(() -> spec(info).validate()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reject a bad initiator")
        void shouldRejectBadInitiator() {
            assertNotValid(new MigrationSpec(Tag.user(""), target()), "InitiatedBy", "InitiatedBy not valid");
            assertNotValid(new MigrationSpec(Tag.machine("0"), target()), "InitiatedBy", "InitiatedBy not valid");
            assertNotValid(new MigrationSpec(null, target()), "InitiatedBy", "InitiatedBy not valid");
        }

        @Test
        @DisplayName("should reject a bad controller tag")
        void shouldRejectBadControllerTag() {
            TargetInfo info = TargetInfo.withPassword(Tag.controller("not-a-uuid"), List.of("1.2.3.4:5555"),
                    "cert", Tag.user("user"), "password");

            assertNotValid(spec(info), "ControllerTag", "ControllerTag not valid");
        }

        @Test
        @DisplayName("should reject missing or malformed addresses")
        void shouldRejectBadAddresses() {
            TargetInfo none = TargetInfo.withPassword(TARGET, List.of(), "cert", Tag.user("user"), "password");
            TargetInfo noPort = TargetInfo.withPassword(TARGET, List.of("1.2.3.4"), "cert", Tag.user("user"), "pw");
            TargetInfo badPort = TargetInfo.withPassword(TARGET, List.of("host:70000"), "cert", Tag.user("user"), "pw");

            assertNotValid(spec(none), "Addrs", "empty Addrs not valid");
            assertNotValid(spec(noPort), "Addrs", "\"1.2.3.4\" in Addrs not valid");
            assertNotValid(spec(badPort), "Addrs", "\"host:70000\" in Addrs not valid");
        }

        @Test
        @DisplayName("should reject missing certificate, identity and credentials")
        void shouldRejectMissingCredentials() {
            assertNotValid(spec(TargetInfo.withPassword(TARGET, List.of("h:1"), "", Tag.user("user"), "pw")),
                    "CACert", "empty CACert not valid");
            assertNotValid(spec(TargetInfo.withPassword(TARGET, List.of("h:1"), "cert", null, "pw")),
                    "AuthTag", "empty AuthTag not valid");
            assertNotValid(spec(TargetInfo.withPassword(TARGET, List.of("h:1"), "cert", Tag.user("user"), "")),
                    "Password", "empty Password not valid");
        }
    }

    @Nested
    @DisplayName("TargetInfo")
    class Target {

        @Test
        @DisplayName("should hide credentials in toString")
        void shouldHideCredentials() {
            assertThat(target().toString())
                    .doesNotContain("password=password")
                    .contains("password=<hidden>", "token=<none>", "1.2.3.4:5555");
        }

        @Test
        @DisplayName("should copy addresses")
        void shouldCopyAddresses() {
            java.util.ArrayList<String> addrs = new java.util.ArrayList<>(List.of("h:1"));
            TargetInfo info = TargetInfo.withPassword(TARGET, addrs, "cert", Tag.user("user"), "pw");
            addrs.add("h:2");

            assertThat(info.addrs()).containsExactly("h:1");
        }
    }
}
