package fr.lapetina.provisioner;

import fr.lapetina.provisioner.infrastructure.config.ConfigLoader;
import fr.lapetina.provisioner.infrastructure.config.ProvisionerConfig;
import fr.lapetina.provisioner.infrastructure.http.ProvisioningHttpClient;
import fr.lapetina.provisioner.infrastructure.http.SimulatedProvisioningApi;
import fr.lapetina.provisioner.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProvisioningFactoryTest {

    @Test
    @DisplayName("should wire the HTTP client by default and release metrics on close")
    void shouldWireHttpClientAndClose() {
        ProvisioningFactory factory = ProvisioningFactory.create(ConfigLoader.createDefault());
        MetricsRegistry metrics = factory.getMetricsRegistry().orElseThrow();

        assertThat(factory.getApi()).isInstanceOf(ProvisioningHttpClient.class);

        factory.close();

        assertThat(metrics.getRegistry().isClosed()).isTrue();
    }

    @Test
    @DisplayName("should wire the simulated API when configured")
    void shouldWireSimulatedApi() {
        ProvisionerConfig config = new ConfigLoader("test-config.yaml").load();

        try (ProvisioningFactory factory = ProvisioningFactory.create(config)) {
            assertThat(factory.getApi()).isInstanceOf(SimulatedProvisioningApi.class);
            assertThat(factory.getSettings().maxRetries()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("should close cleanly without a metrics registry")
    void shouldCloseWithoutMetrics() {
        ProvisionerConfig config = ConfigLoader.createDefault();
        config.getMetrics().setEnabled(false);

        ProvisioningFactory factory = ProvisioningFactory.create(config);
        factory.close();

        assertThat(factory.getMetricsRegistry()).isEmpty();
    }
}
