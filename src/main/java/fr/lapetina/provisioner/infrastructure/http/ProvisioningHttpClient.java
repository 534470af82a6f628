package fr.lapetina.provisioner.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningApi;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningRequest;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP transport for the provisioning API.
 *
 * Uses java.net.http.HttpClient in blocking mode: the calling worker thread owns the attempt.
 * Sends one JSON POST per attempt and maps the result onto {@link ProvisioningResponse}:
 * - 2xx: success
 * - 4xx: CLIENT_ERROR
 * - 5xx: REMOTE_ERROR
 * - request timeout: TIMEOUT
 * - connection and I/O errors: REMOTE_ERROR
 */
public class ProvisioningHttpClient implements ProvisioningApi {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ProvisioningHttpClient(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ProvisioningHttpClient() {
        this(Duration.ofSeconds(10));
    }

    @Override
    public ProvisioningResponse provision(ProvisioningRequest request) throws InterruptedException {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build request: hostname={}, requestId={}",
                    request.host().hostname(), request.requestId(), e);
            return ProvisioningResponse.failure(0, ErrorType.INTERNAL_ERROR,
                    "Failed to build request: " + e.getMessage(), Duration.ZERO);
        }

        Instant startTime = Instant.now();
        log.debug("Sending request: hostname={}, requestId={}, attempt={}, endpoint={}",
                request.host().hostname(), request.requestId(), request.attempt(), httpRequest.uri());

        try {
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            return handleResponse(request, response, Duration.between(startTime, Instant.now()));
        } catch (HttpTimeoutException e) {
            Duration latency = Duration.between(startTime, Instant.now());
            log.debug("Request timeout: hostname={}, requestId={}, latencyMs={}",
                    request.host().hostname(), request.requestId(), latency.toMillis());
            return ProvisioningResponse.failure(0, ErrorType.TIMEOUT,
                    "timed out after " + request.timeout().toMillis() + "ms", latency);
        } catch (IOException e) {
            Duration latency = Duration.between(startTime, Instant.now());
            String reason = describe(e);
            log.debug("Connection error: hostname={}, requestId={}, error={}",
                    request.host().hostname(), request.requestId(), reason);
            return ProvisioningResponse.failure(0, ErrorType.REMOTE_ERROR, reason, latency);
        }
    }

    private HttpRequest buildHttpRequest(ProvisioningRequest request) throws JsonProcessingException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.endpoint())
                .timeout(request.timeout())
                .header("Content-Type", "application/json")
                .header("X-Request-ID", request.requestId())
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(request)));

        if (request.hasCredential()) {
            builder.header("Authorization", "Bearer " + request.credential());
        }
        return builder.build();
    }

    private String buildRequestBody(ProvisioningRequest request) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("hostname", request.host().hostname());
        body.put("address", request.host().address());
        return objectMapper.writeValueAsString(body);
    }

    private ProvisioningResponse handleResponse(
            ProvisioningRequest request,
            HttpResponse<String> response,
            Duration latency
    ) {
        int statusCode = response.statusCode();

        if (statusCode >= 200 && statusCode < 300) {
            log.debug("Request successful: hostname={}, requestId={}, status={}, latencyMs={}",
                    request.host().hostname(), request.requestId(), statusCode, latency.toMillis());
            return ProvisioningResponse.success(statusCode, response.body(), latency);
        }

        ErrorType errorType;
        if (statusCode >= 400 && statusCode < 500) {
            errorType = ErrorType.CLIENT_ERROR;
        } else if (statusCode >= 500) {
            errorType = ErrorType.REMOTE_ERROR;
        } else {
            errorType = ErrorType.INTERNAL_ERROR;
        }

        String reason = extractErrorMessage(response.body()).orElse("HTTP " + statusCode);
        log.debug("Request failed with HTTP error: hostname={}, requestId={}, status={}, latencyMs={}",
                request.host().hostname(), request.requestId(), statusCode, latency.toMillis());
        return ProvisioningResponse.failure(statusCode, errorType, reason, latency);
    }

    /**
     * Reads {@code error}, then {@code message}, from a JSON error body.
     */
    Optional<String> extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            for (String field : new String[]{"error", "message"}) {
                JsonNode value = node.get(field);
                if (value != null && value.isTextual() && !value.asText().isBlank()) {
                    return Optional.of(value.asText());
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON, using status code: {}", e.getOriginalMessage());
        }
        return Optional.empty();
    }

    private static String describe(IOException e) {
        if (e instanceof ConnectException) {
            return "connection refused";
        }
        return e.getMessage() != null
                ? e.getClass().getSimpleName() + ": " + e.getMessage()
                : e.getClass().getSimpleName();
    }
}
