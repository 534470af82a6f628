package fr.lapetina.provisioner.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProvisionOutcomeTest {

    private static final InventoryRecord HOST = InventoryRecord.of("db1", "10.1.0.7");

    @Test
    @DisplayName("should make dry-run outcomes with zero attempts and no error")
    void shouldCreateDryRun() {
        ProvisionOutcome outcome = ProvisionOutcome.dryRun(HOST);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.DRY_RUN);
        assertThat(outcome.attempts()).isZero();
        assertThat(outcome.error()).isEmpty();
        assertThat(outcome.isFailed()).isFalse();
    }

    @Test
    @DisplayName("should capture the cause of a task failure")
    void shouldCaptureTaskFailure() {
        ProvisionOutcome outcome = ProvisionOutcome.taskFailure(HOST, new IllegalStateException("pool exhausted"));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.attempts()).isZero();
        assertThat(outcome.errorType()).isEqualTo(ErrorType.TASK_FAILURE);
        assertThat(outcome.error()).contains("IllegalStateException: pool exhausted");
    }

    @Test
    @DisplayName("should use the exception type when it has no message")
    void shouldDescribeTaskFailureWithoutMessage() {
        ProvisionOutcome outcome = ProvisionOutcome.taskFailure(HOST, new NullPointerException());

        assertThat(outcome.errorMessage()).isEqualTo("NullPointerException");
    }

    @Test
    @DisplayName("should reject negative attempt counts")
    void shouldRejectNegativeAttempts() {
        assertThatThrownBy(() -> ProvisionOutcome.completed(HOST, -1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should strip and validate inventory records")
    void shouldValidateRecords() {
        assertThat(InventoryRecord.of("  web1 ", " 10.0.0.1 ")).isEqualTo(InventoryRecord.of("web1", "10.0.0.1"));
        assertThat(InventoryRecord.of("web1", "10.0.0.1")).hasToString("web1(10.0.0.1)");
        assertThatThrownBy(() -> InventoryRecord.of(" ", "10.0.0.1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InventoryRecord.of("web1", "10.0.0")).isInstanceOf(IllegalArgumentException.class);
    }
}
