/**
 * YAML configuration loading.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.provisioner.infrastructure.config.ProvisionerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.provisioner.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code api} - Endpoint, credential, transport mode and timeouts</li>
 *   <li>{@code dispatch} - Concurrency, dry-run and outcome ring buffer size</li>
 *   <li>{@code retry} - Retry budget and optional backoff</li>
 *   <li>{@code inventory} - Parser strictness</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.provisioner.infrastructure.config;
