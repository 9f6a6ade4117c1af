package tech.yump.boundary.secrets;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretPolicyTableTest {

    @Test
    void defaults_shouldCoverEveryType() {
        SecretPolicyTable table = SecretPolicyTable.defaults();

        for (SecretType type : SecretType.values()) {
            assertThat(table.policyFor(type)).as("policy for %s", type).isPresent();
        }
    }

    @Test
    void defaults_shouldMatchDocumentedValues() {
        SecretPolicyTable table = SecretPolicyTable.defaults();

        SecretPolicy db = table.policyFor(SecretType.DATABASE_CREDENTIAL).orElseThrow();
        assertThat(db.rotationIntervalDays()).isEqualTo(30);
        assertThat(db.minLength()).isEqualTo(16);
        assertThat(db.complexityRequired()).isTrue();

        SecretPolicy encryption = table.policyFor(SecretType.ENCRYPTION_KEY).orElseThrow();
        assertThat(encryption.allowsLocalFallbackInDev()).isFalse();
        assertThat(encryption.rotationInterval()).isEqualTo(Duration.ofDays(365));
    }

    @Test
    void withOverrides_shouldReplaceOnlyGivenTypes() {
        SecretPolicy custom = new SecretPolicy(true, false, 7, 40, false, 40);

        SecretPolicyTable table = SecretPolicyTable.withOverrides(Map.of(SecretType.API_KEY, custom));

        assertThat(table.policyFor(SecretType.API_KEY)).contains(custom);
        assertThat(table.policyFor(SecretType.JWT_SECRET)).isEqualTo(SecretPolicyTable.defaults().policyFor(SecretType.JWT_SECRET));
    }

    @Test
    void of_shouldHoldExactlyTheGivenPolicies() {
        assertThat(SecretPolicyTable.of(Map.of()).asMap()).isEmpty();
        assertThat(SecretPolicyTable.of(Map.of(SecretType.API_KEY, new SecretPolicy(true, true, 1, 8, false, 8)))
                .policyFor(SecretType.JWT_SECRET)).isEmpty();
    }

    @Test
    void policy_shouldRejectGeneratedLengthBelowMinimum() {
        assertThatThrownBy(() -> new SecretPolicy(true, true, 30, 32, false, 16))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describeViolation_shouldCheckLengthThenComplexity() {
        SecretPolicy db = SecretPolicyTable.defaults().policyFor(SecretType.DATABASE_CREDENTIAL).orElseThrow();

        assertThat(db.describeViolation("Short1!")).contains("minimum length");
        assertThat(db.describeViolation("alllowercaseletters")).contains("upper-case");
        assertThat(db.describeViolation("Abcdefgh12345678!")).isNull();
    }

    @Test
    void isRotationDue_shouldBeTrueOnceIntervalElapsed() {
        SecretPolicy policy = new SecretPolicy(true, true, 30, 16, false, 32);
        Instant rotated = Instant.parse("2024-01-01T00:00:00Z");

        assertThat(policy.isRotationDue(rotated, rotated.plus(Duration.ofDays(29)))).isFalse();
        assertThat(policy.isRotationDue(rotated, rotated.plus(Duration.ofDays(30)))).isTrue();
    }
}
