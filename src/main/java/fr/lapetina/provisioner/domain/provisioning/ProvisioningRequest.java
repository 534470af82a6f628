package fr.lapetina.provisioner.domain.provisioning;

import fr.lapetina.provisioner.domain.model.InventoryRecord;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * One remote provisioning call.
 *
 * @param requestId  unique id for this attempt, sent as {@code X-Request-ID}
 * @param endpoint   remote API endpoint
 * @param credential API key or token, may be empty
 * @param host       payload: the host to provision
 * @param timeout    upper bound for this single call
 * @param attempt    attempt number, starting at 1
 */
public record ProvisioningRequest(
        String requestId,
        URI endpoint,
        String credential,
        InventoryRecord host,
        Duration timeout,
        int attempt
) {
    public ProvisioningRequest {
        Objects.requireNonNull(endpoint, "Endpoint is required");
        Objects.requireNonNull(host, "Host is required");
        Objects.requireNonNull(timeout, "Timeout is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (credential == null) {
            credential = "";
        }
    }

    public static ProvisioningRequest of(ProvisioningSettings settings, InventoryRecord host, int attempt) {
        return new ProvisioningRequest(null, settings.endpoint(), settings.credential(),
                host, settings.requestTimeout(), attempt);
    }

    public boolean hasCredential() {
        return !credential.isEmpty();
    }

    @Override
    public String toString() {
        // keep the credential out of logs
        return "ProvisioningRequest{requestId=" + requestId
                + ", endpoint=" + endpoint
                + ", host=" + host
                + ", attempt=" + attempt + '}';
    }
}
