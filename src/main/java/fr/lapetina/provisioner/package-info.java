/**
 * Host Provisioner - provisions every host of a {@code hostname,address} inventory through a
 * remote API, with bounded concurrency, per-host retry and a dry-run mode.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.provisioner.ProvisioningFactory} - Wires configuration, listeners,
 *       API client, parser and dispatcher</li>
 *   <li>{@link fr.lapetina.provisioner.HostProvisionerApplication} - Command line entry point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ProvisioningFactory factory = ProvisioningFactory.create(ConfigLoader.createDefault())) {
 *     ParseResult inventory = factory.getParser().parse(Path.of("hosts.csv"));
 *     RunSummary summary = factory.getDispatcher().run(inventory, factory.getSettings());
 * }
 * }</pre>
 *
 * @see fr.lapetina.provisioner.dispatch.ProvisioningDispatcher
 */
package fr.lapetina.provisioner;
