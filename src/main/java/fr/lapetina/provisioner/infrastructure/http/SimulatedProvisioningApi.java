package fr.lapetina.provisioner.infrastructure.http;

import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningApi;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningRequest;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

/**
 * In-process stand-in for the provisioning API.
 *
 * Each call sleeps a latency drawn uniformly from [minLatency, maxLatency], then fails with
 * probability {@code failureRate} (503) or succeeds (200). A drawn latency above the request
 * timeout is cut at the timeout and reported as TIMEOUT.
 */
public class SimulatedProvisioningApi implements ProvisioningApi {

    private static final Logger log = LoggerFactory.getLogger(SimulatedProvisioningApi.class);

    private final Duration minLatency;
    private final Duration maxLatency;
    private final double failureRate;
    private final Random random;

    public SimulatedProvisioningApi(Duration minLatency, Duration maxLatency, double failureRate, Random random) {
        if (minLatency.isNegative() || maxLatency.compareTo(minLatency) < 0) {
            throw new IllegalArgumentException("Invalid latency range: " + minLatency + ".." + maxLatency);
        }
        if (failureRate < 0.0 || failureRate > 1.0) {
            throw new IllegalArgumentException("Failure rate must be within [0, 1]: " + failureRate);
        }
        this.minLatency = minLatency;
        this.maxLatency = maxLatency;
        this.failureRate = failureRate;
        this.random = random;
    }

    public SimulatedProvisioningApi(Duration minLatency, Duration maxLatency, double failureRate) {
        this(minLatency, maxLatency, failureRate, new Random());
    }

    @Override
    public ProvisioningResponse provision(ProvisioningRequest request) throws InterruptedException {
        Duration latency = drawLatency();
        boolean fail;
        synchronized (random) {
            fail = failureRate > 0.0 && random.nextDouble() < failureRate;
        }

        if (latency.compareTo(request.timeout()) > 0) {
            Thread.sleep(request.timeout().toMillis());
            log.debug("Simulated timeout: hostname={}, requestId={}, latencyMs={}",
                    request.host().hostname(), request.requestId(), latency.toMillis());
            return ProvisioningResponse.failure(0, ErrorType.TIMEOUT,
                    "timed out after " + request.timeout().toMillis() + "ms", request.timeout());
        }

        Thread.sleep(latency.toMillis());

        if (fail) {
            log.debug("Simulated failure: hostname={}, requestId={}", request.host().hostname(), request.requestId());
            return ProvisioningResponse.failure(503, ErrorType.REMOTE_ERROR, "simulated failure", latency);
        }
        return ProvisioningResponse.success(200, "{\"status\":\"ok\"}", latency);
    }

    private Duration drawLatency() {
        long min = minLatency.toMillis();
        long span = maxLatency.toMillis() - min;
        if (span == 0) {
            return minLatency;
        }
        double fraction;
        synchronized (random) {
            fraction = random.nextDouble();
        }
        return Duration.ofMillis(min + Math.round(fraction * span));
    }
}
