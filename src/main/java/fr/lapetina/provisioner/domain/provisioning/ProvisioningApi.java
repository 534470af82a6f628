package fr.lapetina.provisioner.domain.provisioning;

/**
 * Remote API that brings a host to its desired state.
 *
 * <p>Implementations block for at most the request's timeout. They report non-2xx answers and
 * timeouts as failed {@link ProvisioningResponse}s; an exception thrown from {@link #provision}
 * is also treated as a failed attempt by the worker.
 */
@FunctionalInterface
public interface ProvisioningApi {

    ProvisioningResponse provision(ProvisioningRequest request) throws Exception;
}
