package fr.lapetina.provisioner.domain.event;

import fr.lapetina.provisioner.domain.model.InventoryRecord;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class CompositeProvisioningListenerTest {

    @Test
    @DisplayName("should deliver events to every listener")
    void shouldDeliverToEveryListener() {
        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();
        ProvisioningListener composite = CompositeProvisioningListener.of(first, second);

        composite.onOutcome(ProvisionOutcome.dryRun(InventoryRecord.of("web1", "10.0.0.1")));

        assertThat(first.outcomes).hasSize(1);
        assertThat(second.outcomes).hasSize(1);
    }

    @Test
    @DisplayName("should keep notifying after a listener throws")
    void shouldIsolateFailingListener() {
        ProvisioningListener failing = new ProvisioningListener() {
            @Override
            public void onOutcome(ProvisionOutcome outcome) {
                throw new IllegalStateException("broken sink");
            }
        };
        RecordingListener recording = new RecordingListener();
        ProvisioningListener composite = new CompositeProvisioningListener(List.of(failing, recording));

        assertThatCode(() -> composite.onOutcome(ProvisionOutcome.dryRun(InventoryRecord.of("web1", "10.0.0.1"))))
                .doesNotThrowAnyException();
        assertThat(recording.outcomes).hasSize(1);
    }

    @Test
    @DisplayName("should return a single listener unwrapped")
    void shouldNotWrapSingleListener() {
        RecordingListener only = new RecordingListener();

        assertThat(CompositeProvisioningListener.of(only)).isSameAs(only);
    }
}
