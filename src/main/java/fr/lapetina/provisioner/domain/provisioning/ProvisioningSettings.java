package fr.lapetina.provisioner.domain.provisioning;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable per-run settings shared by the dispatcher and every worker invocation.
 *
 * @param dryRun         skip the remote call entirely
 * @param maxRetries     retries after the first attempt; total attempts = maxRetries + 1
 * @param requestTimeout bound for one remote call
 * @param endpoint       remote API endpoint
 * @param credential     API key or token, may be empty
 * @param concurrency    requested worker count, clamped by the dispatcher
 * @param backoff        delay between attempts
 */
public record ProvisioningSettings(
        boolean dryRun,
        int maxRetries,
        Duration requestTimeout,
        URI endpoint,
        String credential,
        int concurrency,
        BackoffPolicy backoff
) {
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.example.local/");

    /** Largest retry budget whose attempt count still fits in an int. */
    public static final int MAX_RETRIES = Integer.MAX_VALUE - 1;

    public ProvisioningSettings {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES) {
            throw new IllegalArgumentException("Max retries must be within [0, " + MAX_RETRIES + "]: " + maxRetries);
        }
        Objects.requireNonNull(requestTimeout, "Request timeout is required");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("Request timeout must be positive: " + requestTimeout);
        }
        if (endpoint == null) {
            endpoint = DEFAULT_ENDPOINT;
        }
        if (credential == null) {
            credential = "";
        }
        if (backoff == null) {
            backoff = BackoffPolicy.none();
        }
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    @Override
    public String toString() {
        return "ProvisioningSettings{dryRun=" + dryRun
                + ", maxRetries=" + maxRetries
                + ", requestTimeout=" + requestTimeout
                + ", endpoint=" + endpoint
                + ", credential=" + (credential.isEmpty() ? "<none>" : "****")
                + ", concurrency=" + concurrency
                + ", backoff=" + backoff + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean dryRun;
        private int maxRetries = 3;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private URI endpoint = DEFAULT_ENDPOINT;
        private String credential = "";
        private int concurrency = 12;
        private BackoffPolicy backoff = BackoffPolicy.none();

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = URI.create(endpoint);
            return this;
        }

        public Builder credential(String credential) {
            this.credential = credential;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        public ProvisioningSettings build() {
            return new ProvisioningSettings(
                    dryRun, maxRetries, requestTimeout, endpoint, credential, concurrency, backoff
            );
        }
    }
}
