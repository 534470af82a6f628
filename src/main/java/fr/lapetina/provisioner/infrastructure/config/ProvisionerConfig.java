package fr.lapetina.provisioner.infrastructure.config;

import fr.lapetina.provisioner.domain.provisioning.BackoffPolicy;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningSettings;

import java.net.URI;
import java.time.Duration;

/**
 * Root configuration object for the provisioner.
 * Designed to be populated from YAML.
 */
public class ProvisionerConfig {

    private ApiConfig api = new ApiConfig();
    private DispatchConfig dispatch = new DispatchConfig();
    private RetryConfig retry = new RetryConfig();
    private InventoryConfig inventory = new InventoryConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ApiConfig getApi() { return api; }
    public void setApi(ApiConfig api) { this.api = api; }

    public DispatchConfig getDispatch() { return dispatch; }
    public void setDispatch(DispatchConfig dispatch) { this.dispatch = dispatch; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public InventoryConfig getInventory() { return inventory; }
    public void setInventory(InventoryConfig inventory) { this.inventory = inventory; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Builds the immutable run settings shared by the dispatcher and the workers.
     *
     * @throws ConfigLoader.ConfigurationException if a value is out of range
     */
    public ProvisioningSettings toSettings() {
        validate();
        BackoffPolicy backoff = retry.getInitialBackoffMs() > 0
                ? BackoffPolicy.exponential(
                        Duration.ofMillis(retry.getInitialBackoffMs()),
                        Duration.ofMillis(retry.getMaxBackoffMs()),
                        retry.getBackoffMultiplier())
                : BackoffPolicy.none();

        return ProvisioningSettings.builder()
                .dryRun(dispatch.isDryRun())
                .maxRetries(retry.getMaxRetries())
                .requestTimeout(Duration.ofMillis(api.getRequestTimeoutMs()))
                .endpoint(URI.create(api.getEndpoint()))
                .credential(api.getCredential())
                .concurrency(dispatch.getConcurrency())
                .backoff(backoff)
                .build();
    }

    /**
     * Checks value ranges that YAML typing cannot express.
     *
     * @throws ConfigLoader.ConfigurationException on the first invalid value
     */
    public void validate() {
        if (api.getEndpoint() == null || api.getEndpoint().isBlank()) {
            throw new ConfigLoader.ConfigurationException("api.endpoint is required");
        }
        try {
            URI endpoint = URI.create(api.getEndpoint());
            if (endpoint.getScheme() == null || endpoint.getHost() == null) {
                throw new ConfigLoader.ConfigurationException("api.endpoint must be an absolute URL: " + api.getEndpoint());
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigLoader.ConfigurationException("api.endpoint is not a valid URI: " + api.getEndpoint(), e);
        }
        if (!ApiConfig.MODE_HTTP.equals(api.getMode()) && !ApiConfig.MODE_SIMULATED.equals(api.getMode())) {
            throw new ConfigLoader.ConfigurationException("api.mode must be 'http' or 'simulated': " + api.getMode());
        }
        if (api.getRequestTimeoutMs() <= 0) {
            throw new ConfigLoader.ConfigurationException("api.requestTimeoutMs must be positive: " + api.getRequestTimeoutMs());
        }
        if (api.getConnectTimeoutMs() <= 0) {
            throw new ConfigLoader.ConfigurationException("api.connectTimeoutMs must be positive: " + api.getConnectTimeoutMs());
        }
        SimulationConfig simulation = api.getSimulation();
        if (simulation.getMinLatencyMs() < 0 || simulation.getMaxLatencyMs() < simulation.getMinLatencyMs()) {
            throw new ConfigLoader.ConfigurationException("api.simulation latency range is invalid: "
                    + simulation.getMinLatencyMs() + ".." + simulation.getMaxLatencyMs());
        }
        if (simulation.getFailureRate() < 0.0 || simulation.getFailureRate() > 1.0) {
            throw new ConfigLoader.ConfigurationException("api.simulation.failureRate must be within [0, 1]: "
                    + simulation.getFailureRate());
        }
        if (Integer.bitCount(dispatch.getRingBufferSize()) != 1) {
            throw new ConfigLoader.ConfigurationException("dispatch.ringBufferSize must be power of 2: "
                    + dispatch.getRingBufferSize());
        }
        if (retry.getMaxRetries() < 0 || retry.getMaxRetries() > ProvisioningSettings.MAX_RETRIES) {
            throw new ConfigLoader.ConfigurationException("retry.maxRetries must be within [0, "
                    + ProvisioningSettings.MAX_RETRIES + "]: " + retry.getMaxRetries());
        }
        if (retry.getInitialBackoffMs() < 0 || retry.getMaxBackoffMs() < 0) {
            throw new ConfigLoader.ConfigurationException("retry backoff delays must not be negative");
        }
        if (retry.getBackoffMultiplier() < 1.0) {
            throw new ConfigLoader.ConfigurationException("retry.backoffMultiplier must be >= 1.0: "
                    + retry.getBackoffMultiplier());
        }
    }

    /**
     * Remote API configuration.
     */
    public static class ApiConfig {
        public static final String MODE_HTTP = "http";
        public static final String MODE_SIMULATED = "simulated";

        private String endpoint = "https://api.example.local/";
        private String credential = "";
        private String mode = MODE_HTTP;
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 30000;
        private SimulationConfig simulation = new SimulationConfig();

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getCredential() { return credential; }
        public void setCredential(String credential) { this.credential = credential; }

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public boolean isSimulated() { return MODE_SIMULATED.equals(mode); }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public SimulationConfig getSimulation() { return simulation; }
        public void setSimulation(SimulationConfig simulation) { this.simulation = simulation; }
    }

    /**
     * Simulated API behaviour, used when {@code api.mode} is {@code simulated}.
     */
    public static class SimulationConfig {
        private long minLatencyMs = 50;
        private long maxLatencyMs = 600;
        private double failureRate = 0.0;

        public long getMinLatencyMs() { return minLatencyMs; }
        public void setMinLatencyMs(long minLatencyMs) { this.minLatencyMs = minLatencyMs; }

        public long getMaxLatencyMs() { return maxLatencyMs; }
        public void setMaxLatencyMs(long maxLatencyMs) { this.maxLatencyMs = maxLatencyMs; }

        public double getFailureRate() { return failureRate; }
        public void setFailureRate(double failureRate) { this.failureRate = failureRate; }
    }

    /**
     * Worker pool and outcome buffer configuration.
     */
    public static class DispatchConfig {
        private int concurrency = 12;
        private boolean dryRun = false;
        private int ringBufferSize = 1024;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public boolean isDryRun() { return dryRun; }
        public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }
    }

    /**
     * Retry configuration. No backoff unless initialBackoffMs is set.
     */
    public static class RetryConfig {
        private int maxRetries = 3;
        private long initialBackoffMs = 0;
        private long maxBackoffMs = 5000;
        private double backoffMultiplier = 2.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Inventory parsing configuration.
     */
    public static class InventoryConfig {
        private boolean diagnoseEmptyFields = false;

        public boolean isDiagnoseEmptyFields() { return diagnoseEmptyFields; }
        public void setDiagnoseEmptyFields(boolean diagnoseEmptyFields) { this.diagnoseEmptyFields = diagnoseEmptyFields; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "provisioner";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
