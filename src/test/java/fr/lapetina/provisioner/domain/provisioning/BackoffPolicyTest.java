package fr.lapetina.provisioner.domain.provisioning;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    @DisplayName("should wait nothing by default")
    void shouldBeDisabledByDefault() {
        BackoffPolicy policy = BackoffPolicy.none();

        assertThat(policy.isEnabled()).isFalse();
        assertThat(policy.delayBeforeRetry(1)).isZero();
        assertThat(policy.delayBeforeRetry(5)).isZero();
    }

    @Test
    @DisplayName("should grow exponentially up to the cap")
    void shouldGrowExponentially() {
        BackoffPolicy policy = BackoffPolicy.exponential(Duration.ofMillis(100), Duration.ofMillis(500), 2.0);

        assertThat(policy.delayBeforeRetry(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayBeforeRetry(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayBeforeRetry(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.delayBeforeRetry(4)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayBeforeRetry(60)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("should keep a constant delay with multiplier 1")
    void shouldSupportConstantDelay() {
        BackoffPolicy policy = BackoffPolicy.exponential(Duration.ofMillis(250), Duration.ofSeconds(5), 1.0);

        assertThat(policy.delayBeforeRetry(1)).isEqualTo(policy.delayBeforeRetry(7));
    }

    @Test
    @DisplayName("should reject shrinking multipliers and negative delays")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> BackoffPolicy.exponential(Duration.ofMillis(100), Duration.ofMillis(500), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.exponential(Duration.ofMillis(-1), Duration.ofMillis(500), 2.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
