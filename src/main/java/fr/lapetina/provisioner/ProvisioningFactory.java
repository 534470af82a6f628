package fr.lapetina.provisioner;

import fr.lapetina.provisioner.dispatch.ProvisioningDispatcher;
import fr.lapetina.provisioner.domain.event.CompositeProvisioningListener;
import fr.lapetina.provisioner.domain.event.ProvisioningListener;
import fr.lapetina.provisioner.domain.inventory.InventoryParser;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningApi;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningSettings;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningWorker;
import fr.lapetina.provisioner.infrastructure.config.ConfigLoader;
import fr.lapetina.provisioner.infrastructure.config.ProvisionerConfig;
import fr.lapetina.provisioner.infrastructure.http.ProvisioningHttpClient;
import fr.lapetina.provisioner.infrastructure.http.SimulatedProvisioningApi;
import fr.lapetina.provisioner.infrastructure.logging.LoggingProvisioningListener;
import fr.lapetina.provisioner.infrastructure.metrics.MetricsProvisioningListener;
import fr.lapetina.provisioner.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Factory for creating a fully-wired provisioner from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ProvisioningFactory factory = ProvisioningFactory.create(config)) {
 *     ParseResult inventory = factory.getParser().parse(path);
 *     RunSummary summary = factory.getDispatcher().run(inventory, factory.getSettings());
 * }
 * }</pre>
 */
public class ProvisioningFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningFactory.class);

    private final ProvisionerConfig config;
    private final ProvisioningSettings settings;
    private final MetricsRegistry metricsRegistry;
    private final ProvisioningListener listener;
    private final ProvisioningApi api;
    private final InventoryParser parser;
    private final ProvisioningDispatcher dispatcher;

    protected ProvisioningFactory(ProvisionerConfig config, ProvisioningApi apiOverride) {
        this.config = config;

        // Validates the configuration as a side effect
        this.settings = config.toSettings();
        log.info("Initializing provisioner: {}", settings);

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        List<ProvisioningListener> listeners = new ArrayList<>();
        listeners.add(new LoggingProvisioningListener());
        if (metricsRegistry != null) {
            listeners.add(new MetricsProvisioningListener(metricsRegistry));
        }
        this.listener = new CompositeProvisioningListener(listeners);

        // Initialize API (allow override for testing)
        this.api = apiOverride != null ? apiOverride : createApi();

        this.parser = new InventoryParser(listener, config.getInventory().isDiagnoseEmptyFields());
        ProvisioningWorker worker = new ProvisioningWorker(api, listener);
        this.dispatcher = new ProvisioningDispatcher(worker, listener, config.getDispatch().getRingBufferSize());
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static ProvisioningFactory create(ProvisionerConfig config) {
        return new ProvisioningFactory(config, null);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ProvisioningFactory create(String configPath) {
        return create(new ConfigLoader(configPath).load());
    }

    private ProvisioningApi createApi() {
        ProvisionerConfig.ApiConfig apiConfig = config.getApi();
        if (apiConfig.isSimulated()) {
            ProvisionerConfig.SimulationConfig simulation = apiConfig.getSimulation();
            log.info("Using simulated provisioning API: latencyMs={}..{}, failureRate={}",
                    simulation.getMinLatencyMs(), simulation.getMaxLatencyMs(), simulation.getFailureRate());
            return new SimulatedProvisioningApi(
                    Duration.ofMillis(simulation.getMinLatencyMs()),
                    Duration.ofMillis(simulation.getMaxLatencyMs()),
                    simulation.getFailureRate()
            );
        }
        return new ProvisioningHttpClient(Duration.ofMillis(apiConfig.getConnectTimeoutMs()));
    }

    public ProvisionerConfig getConfig() {
        return config;
    }

    public ProvisioningSettings getSettings() {
        return settings;
    }

    public InventoryParser getParser() {
        return parser;
    }

    public ProvisioningDispatcher getDispatcher() {
        return dispatcher;
    }

    public ProvisioningApi getApi() {
        return api;
    }

    public Optional<MetricsRegistry> getMetricsRegistry() {
        return Optional.ofNullable(metricsRegistry);
    }

    @Override
    public void close() {
        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }
    }
}
