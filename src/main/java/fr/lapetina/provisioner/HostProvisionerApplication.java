package fr.lapetina.provisioner;

import fr.lapetina.provisioner.domain.model.ParseResult;
import fr.lapetina.provisioner.domain.model.RunSummary;
import fr.lapetina.provisioner.infrastructure.config.ConfigLoader;
import fr.lapetina.provisioner.infrastructure.config.ProvisionerConfig;
import fr.lapetina.provisioner.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Main entry point: provisions every host of an inventory file.
 *
 * <p>Exit codes: 0 when the run completed (individual hosts may have failed), 2 when the
 * inventory or the configuration cannot be read, 1 on any other fatal error.
 */
@Command(
        name = "host-provisioner",
        mixinStandardHelpOptions = true,
        version = "host-provisioner 1.0.0",
        description = "Provisions the hosts listed in a hostname,address inventory through the remote API.")
public class HostProvisionerApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HostProvisionerApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_INPUT_ERROR = 2;

    @Parameters(index = "0", description = "Inventory file: one 'hostname,address' pair per line")
    Path inventory;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file (built-in defaults otherwise)")
    String configPath;

    @Option(names = "--retries", description = "Retries after the first attempt (default: 3)")
    Integer retries;

    @Option(names = "--dry-run", description = "Parse and dispatch without calling the API")
    Boolean dryRun;

    @Option(names = "--concurrency", description = "Worker threads, capped by host count and 256 (default: 12)")
    Integer concurrency;

    @Option(names = "--api-url", description = "Provisioning API endpoint (default: https://api.example.local/)")
    String apiUrl;

    @Option(names = "--api-key", description = "API key sent as a bearer token")
    String apiKey;

    @Option(names = "--timeout", description = "Per-request timeout in milliseconds (default: 30000)")
    Long timeoutMs;

    @Option(names = "--simulate", description = "Use the in-process simulated API instead of HTTP")
    Boolean simulate;

    @Option(names = "--strict-inventory", description = "Report lines with an empty hostname or address")
    Boolean strictInventory;

    @Option(names = "--metrics-out", description = "Write Prometheus metrics to this file after the run")
    Path metricsOut;

    private RunSummary lastSummary;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HostProvisionerApplication()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        ProvisionerConfig config;
        try {
            config = loadConfig();
            applyOverrides(config);
            config.validate();
        } catch (ConfigLoader.ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        try (ProvisioningFactory factory = createFactory(config)) {
            ParseResult parsed;
            try {
                parsed = factory.getParser().parse(inventory);
            } catch (NoSuchFileException e) {
                log.error("Inventory file not found: {}", inventory);
                return EXIT_INPUT_ERROR;
            } catch (IOException e) {
                log.error("Inventory file unreadable: path={}, error={}", inventory, e.getMessage());
                return EXIT_INPUT_ERROR;
            }

            RunSummary summary = factory.getDispatcher().run(parsed, factory.getSettings());
            lastSummary = summary;

            if (metricsOut != null) {
                writeMetrics(factory.getMetricsRegistry());
            }
            return EXIT_OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Provisioning interrupted");
            return EXIT_FATAL;
        } catch (ConfigLoader.ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (RuntimeException e) {
            log.error("Provisioning failed", e);
            return EXIT_FATAL;
        }
    }

    /**
     * Summary of the last completed run, empty before a run or when the run never started.
     */
    public Optional<RunSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    /**
     * Builds the wired provisioner. Tests override this to substitute the API.
     */
    protected ProvisioningFactory createFactory(ProvisionerConfig config) {
        return ProvisioningFactory.create(config);
    }

    private ProvisionerConfig loadConfig() {
        if (configPath == null) {
            return ConfigLoader.createDefault();
        }
        return new ConfigLoader(configPath).load();
    }

    private void applyOverrides(ProvisionerConfig config) {
        if (retries != null) {
            config.getRetry().setMaxRetries(retries);
        }
        if (dryRun != null) {
            config.getDispatch().setDryRun(dryRun);
        }
        if (concurrency != null) {
            config.getDispatch().setConcurrency(concurrency);
        }
        if (apiUrl != null) {
            config.getApi().setEndpoint(apiUrl);
        }
        if (apiKey != null) {
            config.getApi().setCredential(apiKey);
        }
        if (timeoutMs != null) {
            config.getApi().setRequestTimeoutMs(timeoutMs);
        }
        if (Boolean.TRUE.equals(simulate)) {
            config.getApi().setMode(ProvisionerConfig.ApiConfig.MODE_SIMULATED);
        }
        if (strictInventory != null) {
            config.getInventory().setDiagnoseEmptyFields(strictInventory);
        }
        if (metricsOut != null) {
            config.getMetrics().setEnabled(true);
        }
    }

    /**
     * A failed write is logged; it does not change the run's exit code.
     */
    private void writeMetrics(Optional<MetricsRegistry> metrics) {
        if (metrics.isEmpty()) {
            log.warn("Metrics disabled, nothing written to {}", metricsOut);
            return;
        }
        try {
            Path parent = metricsOut.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(metricsOut, metrics.get().scrape(), StandardCharsets.UTF_8);
            log.info("Metrics written: path={}", metricsOut);
        } catch (IOException e) {
            log.error("Failed to write metrics: path={}, error={}", metricsOut, e.getMessage());
        }
    }
}
