package fr.lapetina.provisioner.integration;

import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.model.ParseResult;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import fr.lapetina.provisioner.domain.model.RunSummary;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningRequest;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for parse, dispatch and aggregation wired from test-config.yaml.
 */
class ProvisioningPipelineIntegrationTest {

    private static final String INVENTORY = String.join("\n",
            "# comment",
            "host1,192.168.1.10",
            "host2,10.0.0.5",
            "host3,172.0.10.1",
            "",
            "invalid line",
            "invalid-host4,999.999.999");

    private TestProvisioningFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestProvisioningFactory.create();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private RunSummary run(String inventory) throws InterruptedException {
        ParseResult parsed = factory.getParser().parse(inventory);
        return factory.getDispatcher().run(parsed, factory.getSettings());
    }

    @Test
    @DisplayName("should provision every valid host and count parse errors")
    void shouldProvisionValidHosts() throws Exception {
        factory.setSuccessResponse();

        RunSummary summary = run(INVENTORY);

        assertThat(summary.valid()).isEqualTo(3);
        assertThat(summary.parseErrors()).isEqualTo(2);
        assertThat(summary.completed()).isEqualTo(3);
        assertThat(summary.failed()).isZero();
        assertThat(factory.getRequests())
                .extracting(r -> r.host().hostname())
                .containsExactlyInAnyOrder("host1", "host2", "host3");
        assertThat(factory.getRequests())
                .allSatisfy(r -> assertThat(r.credential()).isEqualTo("test-key"));
    }

    @Test
    @DisplayName("should retry failing hosts up to the configured budget")
    void shouldRetryFailingHost() throws Exception {
        factory.setResponse((ProvisioningRequest req) -> req.host().hostname().equals("host2")
                ? ProvisioningResponse.failure(503, ErrorType.REMOTE_ERROR, "HTTP 503", Duration.ZERO)
                : ProvisioningResponse.success(200, "{}", Duration.ZERO));

        RunSummary summary = run(INVENTORY);

        assertThat(summary.completed()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.outcomes())
                .filteredOn(ProvisionOutcome::isFailed)
                .singleElement()
                .satisfies(o -> assertThat(o.attempts()).isEqualTo(3));
        assertThat(factory.getRequests()).hasSize(5);
    }

    @Test
    @DisplayName("should turn API exceptions into failed outcomes")
    void shouldHandleApiException() throws Exception {
        factory.setErrorResponse(new RuntimeException("Connection refused"));

        RunSummary summary = run("web1,10.0.0.1");

        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.outcomes()).singleElement()
                .satisfies(o -> assertThat(o.errorType()).isEqualTo(ErrorType.INTERNAL_ERROR));
    }

    @Test
    @DisplayName("should report empty fields as diagnostics in strict mode")
    void shouldUseStrictInventoryFromConfig() throws Exception {
        factory.setSuccessResponse();

        RunSummary summary = run("web1,\nweb2,10.0.0.2");

        assertThat(summary.valid()).isEqualTo(1);
        assertThat(summary.parseErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("should expose run metrics")
    void shouldRecordMetrics() throws Exception {
        factory.setSuccessResponse();

        run(INVENTORY);

        assertThat(factory.getMetricsRegistry()).isPresent();
        assertThat(factory.getMetricsRegistry().get().scrape())
                .containsPattern("test_provisioner_outcomes_total\\{status=\"COMPLETED\",?} 3\\.0")
                .contains("test_provisioner_parse_diagnostics_total");
    }
}
