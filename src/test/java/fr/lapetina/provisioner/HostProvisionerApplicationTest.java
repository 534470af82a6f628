package fr.lapetina.provisioner;

import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.model.RunSummary;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningResponse;
import fr.lapetina.provisioner.infrastructure.config.ProvisionerConfig;
import fr.lapetina.provisioner.integration.TestProvisioningFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HostProvisionerApplicationTest {

    private static final String INVENTORY = String.join("\n",
            "# comment",
            "host1,192.168.1.10",
            "host2,10.0.0.5",
            "host3,172.0.10.1",
            "",
            "invalid line",
            "invalid-host4,999.999.999",
            "");

    @TempDir
    Path tempDir;

    private Path inventory;

    @BeforeEach
    void setUp() throws IOException {
        inventory = tempDir.resolve("hosts.csv");
        Files.writeString(inventory, INVENTORY);
    }

    /**
     * Application wired to the stub API instead of HTTP.
     */
    static class StubbedApplication extends HostProvisionerApplication {
        TestProvisioningFactory factory;
        boolean failHost2;

        @Override
        protected ProvisioningFactory createFactory(ProvisionerConfig config) {
            factory = TestProvisioningFactory.create(config);
            factory.setResponse(req -> failHost2 && req.host().hostname().equals("host2")
                    ? ProvisioningResponse.failure(503, ErrorType.REMOTE_ERROR, "HTTP 503", Duration.ZERO)
                    : ProvisioningResponse.success(200, "{}", Duration.ZERO));
            return factory;
        }
    }

    private static int execute(HostProvisionerApplication app, String... args) {
        return new CommandLine(app).execute(args);
    }

    @Nested
    @DisplayName("Runs")
    class Runs {

        @Test
        @DisplayName("should dry-run the sample inventory without calling the API")
        void shouldDryRun() {
            StubbedApplication app = new StubbedApplication();

            int exitCode = execute(app, "--dry-run", inventory.toString());

            assertThat(exitCode).isZero();
            assertThat(app.getLastSummary()).get().satisfies(summary -> {
                assertThat(summary.valid()).isEqualTo(3);
                assertThat(summary.parseErrors()).isEqualTo(2);
                assertThat(summary.dryRun()).isEqualTo(3);
                assertThat(summary.completed()).isZero();
            });
            assertThat(app.factory.getRequests()).isEmpty();
        }

        @Test
        @DisplayName("should exit 0 even when a host fails")
        void shouldExitZeroWithFailedHosts() {
            StubbedApplication app = new StubbedApplication();
            app.failHost2 = true;

            int exitCode = execute(app, "--retries", "1", inventory.toString());

            assertThat(exitCode).isZero();
            RunSummary summary = app.getLastSummary().orElseThrow();
            assertThat(summary.completed()).isEqualTo(2);
            assertThat(summary.failed()).isEqualTo(1);
            assertThat(app.factory.getRequests()).hasSize(4);
        }

        @Test
        @DisplayName("should pass command-line overrides through to each request")
        void shouldApplyOverrides() {
            StubbedApplication app = new StubbedApplication();

            int exitCode = execute(app,
                    "--api-url", "http://provisioning.internal:9000/hosts",
                    "--api-key", "k-123",
                    "--timeout", "1500",
                    "--concurrency", "2",
                    inventory.toString());

            assertThat(exitCode).isZero();
            assertThat(app.factory.getSettings().concurrency()).isEqualTo(2);
            assertThat(app.factory.getRequests()).hasSize(3).allSatisfy(r -> {
                assertThat(r.endpoint()).hasToString("http://provisioning.internal:9000/hosts");
                assertThat(r.credential()).isEqualTo("k-123");
                assertThat(r.timeout()).isEqualTo(Duration.ofMillis(1500));
            });
        }

        @Test
        @DisplayName("should run against the simulated API and write metrics")
        void shouldSimulateAndWriteMetrics() throws IOException {
            Path config = tempDir.resolve("sim.yaml");
            Files.writeString(config, String.join("\n",
                    "api:",
                    "  simulation:",
                    "    minLatencyMs: 0",
                    "    maxLatencyMs: 5",
                    "    failureRate: 0.0",
                    ""));
            Path metricsOut = tempDir.resolve("out/metrics.prom");
            HostProvisionerApplication app = new HostProvisionerApplication();

            int exitCode = execute(app,
                    "--config", config.toString(),
                    "--simulate",
                    "--metrics-out", metricsOut.toString(),
                    inventory.toString());

            assertThat(exitCode).isZero();
            assertThat(app.getLastSummary()).get()
                    .satisfies(summary -> assertThat(summary.completed()).isEqualTo(3));
            assertThat(metricsOut).exists();
            assertThat(Files.readString(metricsOut))
                    .contains("provisioner_outcomes_total")
                    .contains("provisioner_parse_diagnostics_total");
        }

        @Test
        @DisplayName("should run an empty inventory to an empty summary")
        void shouldHandleEmptyInventory() throws IOException {
            Path empty = tempDir.resolve("empty.csv");
            Files.writeString(empty, "# nothing yet\n\n");
            StubbedApplication app = new StubbedApplication();

            int exitCode = execute(app, empty.toString());

            assertThat(exitCode).isZero();
            assertThat(app.getLastSummary()).get()
                    .satisfies(summary -> assertThat(summary.processed()).isZero());
        }
    }

    @Nested
    @DisplayName("Input errors")
    class InputErrors {

        @Test
        @DisplayName("should exit 2 when the inventory file is missing")
        void shouldFailForMissingInventory() {
            StubbedApplication app = new StubbedApplication();

            int exitCode = execute(app, tempDir.resolve("absent.csv").toString());

            assertThat(exitCode).isEqualTo(2);
            assertThat(app.getLastSummary()).isEmpty();
        }

        @Test
        @DisplayName("should exit 2 when the config file is missing")
        void shouldFailForMissingConfig() {
            StubbedApplication app = new StubbedApplication();

            int exitCode = execute(app, "--config", tempDir.resolve("absent.yaml").toString(), inventory.toString());

            assertThat(exitCode).isEqualTo(2);
            assertThat(app.factory).isNull();
        }

        @Test
        @DisplayName("should exit 2 for out-of-range overrides")
        void shouldFailForInvalidOverrides() {
            assertThat(execute(new StubbedApplication(), "--retries", "-1", inventory.toString())).isEqualTo(2);
            assertThat(execute(new StubbedApplication(), "--retries", "2147483647", inventory.toString())).isEqualTo(2);
            assertThat(execute(new StubbedApplication(), "--timeout", "0", inventory.toString())).isEqualTo(2);
            assertThat(execute(new StubbedApplication(), "--api-url", "not a url", inventory.toString())).isEqualTo(2);
        }

        @Test
        @DisplayName("should report usage errors without running")
        void shouldRejectUnknownOption() {
            StubbedApplication app = new StubbedApplication();

            int exitCode = execute(app, "--bogus", inventory.toString());

            assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(app.factory).isNull();
        }
    }

    @Test
    @DisplayName("should print help and exit 0")
    void shouldPrintHelp() {
        assertThat(execute(new HostProvisionerApplication(), "--help")).isZero();
    }
}
