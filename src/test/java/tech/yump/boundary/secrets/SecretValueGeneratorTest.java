package tech.yump.boundary.secrets;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretValueGeneratorTest {

    private final SecretValueGenerator generator = new SecretValueGenerator();

    @Test
    void urlSafeToken_shouldHaveExactLengthAndUrlSafeAlphabet() {
        for (int length : new int[]{1, 24, 48, 64, 65}) {
            assertThat(generator.urlSafeToken(length)).hasSize(length).matches("[A-Za-z0-9_-]+");
        }
    }

    @Test
    void password_shouldContainEveryCharacterClass() {
        for (int i = 0; i < 50; i++) {
            String password = generator.password(16);
            assertThat(password).hasSize(16);
            assertThat(SecretPolicy.meetsComplexity(password)).isTrue();
        }
    }

    @Test
    void password_shouldRejectTooShortLength() {
        assertThatThrownBy(() -> generator.password(3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generate_shouldSatisfyTheTypePolicy() {
        SecretPolicyTable table = SecretPolicyTable.defaults();
        for (SecretType type : SecretType.values()) {
            SecretPolicy policy = table.policyFor(type).orElseThrow();
            String value = generator.generate(type, policy);
            assertThat(value).hasSize(policy.generatedLength());
            assertThat(policy.describeViolation(value)).as("violation for %s", type).isNull();
        }
    }

    @Test
    void generate_shouldNotRepeat() {
        assertThat(generator.urlSafeToken(32)).isNotEqualTo(generator.urlSafeToken(32));
    }
}
