/**
 * Domain model classes shared by the parser, the worker and the dispatcher.
 *
 * <p>This package contains immutable value objects created once and never mutated.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.provisioner.domain.model.InventoryRecord} - A validated (hostname, address) pair</li>
 *   <li>{@link fr.lapetina.provisioner.domain.model.ParseDiagnostic} - One rejected inventory line</li>
 *   <li>{@link fr.lapetina.provisioner.domain.model.ParseResult} - Records, diagnostics and line accounting</li>
 *   <li>{@link fr.lapetina.provisioner.domain.model.ProvisionOutcome} - Terminal result for one host</li>
 *   <li>{@link fr.lapetina.provisioner.domain.model.RunSummary} - Aggregate counts for one run</li>
 *   <li>{@link fr.lapetina.provisioner.domain.model.ErrorType} - Categorized failure types</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All records are immutable. {@code RunSummary.Accumulator} is the single mutable type and is
 * only ever touched by the dispatcher's aggregation thread.
 */
package fr.lapetina.provisioner.domain.model;
