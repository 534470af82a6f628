/**
 * Bounded-concurrency dispatch of provisioning work.
 *
 * <p>Hosts fan out to a fixed worker pool; outcomes fan back in through an LMAX Disruptor ring
 * buffer to a single aggregation handler, the only writer of the run summary:
 * <pre>
 * worker threads (N) → ring buffer (multi-producer) → OutcomeAggregationHandler (1)
 * </pre>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.provisioner.dispatch;
