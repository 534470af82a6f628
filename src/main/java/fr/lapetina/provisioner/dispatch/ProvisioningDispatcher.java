package fr.lapetina.provisioner.dispatch;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventTranslatorTwoArg;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.provisioner.domain.event.OutcomeEvent;
import fr.lapetina.provisioner.domain.event.OutcomeEventFactory;
import fr.lapetina.provisioner.domain.event.ProvisioningListener;
import fr.lapetina.provisioner.domain.model.InventoryRecord;
import fr.lapetina.provisioner.domain.model.ParseResult;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import fr.lapetina.provisioner.domain.model.RunSummary;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningSettings;
import fr.lapetina.provisioner.domain.provisioning.ProvisioningWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one provisioning pass over a set of hosts.
 *
 * <p>Fan-out: a fixed pool of {@code max(1, min(concurrency, hosts, 256))} threads; every host is
 * submitted once, in inventory order, and each worker invocation keeps its thread for all of
 * that host's attempts.
 *
 * <p>Fan-in: whichever host finishes first publishes its outcome first into a multi-producer
 * Disruptor ring buffer. A single {@link OutcomeAggregationHandler} consumes the ring, so the
 * run summary has exactly one writer and needs no lock. A worker invocation that throws, or a
 * host the pool refuses, becomes a synthetic {@code FAILED} outcome with zero attempts; it never
 * aborts the run.
 *
 * <p>{@link #run} returns only after every submitted host has produced its outcome.
 */
public final class ProvisioningDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningDispatcher.class);

    /** Hard upper bound on pool size, whatever the requested concurrency. */
    public static final int MAX_WORKERS = 256;

    public static final int DEFAULT_RING_BUFFER_SIZE = 1024;

    private static final EventTranslatorTwoArg<OutcomeEvent, ProvisionOutcome, Boolean> TRANSLATOR =
            (event, sequence, outcome, synthetic) -> event.set(outcome, synthetic);

    private final ProvisioningWorker worker;
    private final ProvisioningListener listener;
    private final int ringBufferSize;

    public ProvisioningDispatcher(ProvisioningWorker worker, ProvisioningListener listener, int ringBufferSize) {
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("Ring buffer size must be power of 2: " + ringBufferSize);
        }
        this.worker = Objects.requireNonNull(worker, "Worker is required");
        this.listener = listener != null ? listener : ProvisioningListener.NOOP;
        this.ringBufferSize = ringBufferSize;
    }

    public ProvisioningDispatcher(ProvisioningWorker worker, ProvisioningListener listener) {
        this(worker, listener, DEFAULT_RING_BUFFER_SIZE);
    }

    /**
     * Pool size for a run: the requested concurrency, clamped to [1, min(hosts, 256)].
     */
    public static int effectiveWorkers(int concurrency, int recordCount) {
        return Math.max(1, Math.min(Math.min(concurrency, recordCount), MAX_WORKERS));
    }

    /**
     * Provisions every valid record of a parsed inventory; the summary also reports its
     * diagnostic count.
     */
    public RunSummary run(ParseResult inventory, ProvisioningSettings settings) throws InterruptedException {
        return run(inventory.records(), settings, inventory.diagnostics().size());
    }

    /**
     * Provisions every record and waits for all outcomes.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public RunSummary run(List<InventoryRecord> records, ProvisioningSettings settings) throws InterruptedException {
        return run(records, settings, 0);
    }

    private RunSummary run(List<InventoryRecord> records, ProvisioningSettings settings, int parseErrors)
            throws InterruptedException {
        Objects.requireNonNull(settings, "Settings are required");

        if (records.isEmpty()) {
            log.info("No valid entries to process");
            RunSummary summary = RunSummary.empty(parseErrors);
            notifyRunCompleted(summary);
            return summary;
        }

        int workers = effectiveWorkers(settings.concurrency(), records.size());
        log.info("Begin provisioning: hosts={}, workers={}, dryRun={}, maxRetries={}, endpoint={}",
                records.size(), workers, settings.dryRun(), settings.maxRetries(), settings.endpoint());
        notifyRunStarted(records.size(), workers, settings.dryRun());

        Instant start = Instant.now();
        RunSummary.Accumulator accumulator = new RunSummary.Accumulator(records.size(), parseErrors);
        CountDownLatch remaining = new CountDownLatch(records.size());

        Disruptor<OutcomeEvent> disruptor = new Disruptor<>(
                new OutcomeEventFactory(),
                ringBufferSize,
                new NamedThreadFactory("provision-outcomes", true),
                ProducerType.MULTI, // every worker thread publishes
                new BlockingWaitStrategy()
        );
        disruptor.handleEventsWith(new OutcomeAggregationHandler(accumulator, remaining, listener));
        disruptor.setDefaultExceptionHandler(new OutcomeExceptionHandler());
        RingBuffer<OutcomeEvent> ringBuffer = disruptor.start();

        ExecutorService pool = Executors.newFixedThreadPool(workers, new NamedThreadFactory("provision-worker", false));
        boolean allReported = false;
        try {
            for (InventoryRecord record : records) {
                submit(pool, ringBuffer, record, settings);
            }
            remaining.await();
            allReported = true;
        } finally {
            shutdown(pool, disruptor, allReported);
        }

        RunSummary summary = accumulator.toSummary(Duration.between(start, Instant.now()));
        log.info("Provisioning finished: valid={}, parseErrors={}, completed={}, failed={}, dryRun={}, durationMs={}",
                summary.valid(), summary.parseErrors(), summary.completed(), summary.failed(),
                summary.dryRun(), summary.duration().toMillis());
        notifyRunCompleted(summary);
        return summary;
    }

    private void submit(
            ExecutorService pool,
            RingBuffer<OutcomeEvent> ringBuffer,
            InventoryRecord record,
            ProvisioningSettings settings
    ) {
        CompletableFuture<ProvisionOutcome> task;
        try {
            task = CompletableFuture.supplyAsync(() -> worker.provision(record, settings), pool);
        } catch (RejectedExecutionException e) {
            log.error("Provisioning task rejected: hostname={}, address={}", record.hostname(), record.address(), e);
            publish(ringBuffer, ProvisionOutcome.taskFailure(record, e), true);
            return;
        }

        task.whenComplete((outcome, failure) -> {
            if (failure != null) {
                Throwable cause = unwrap(failure);
                log.error("Provisioning task failed: hostname={}, address={}, error={}",
                        record.hostname(), record.address(), cause.toString(), cause);
                publish(ringBuffer, ProvisionOutcome.taskFailure(record, cause), true);
            } else if (outcome == null) {
                publish(ringBuffer, ProvisionOutcome.taskFailure(record,
                        new IllegalStateException("worker returned no outcome")), true);
            } else {
                publish(ringBuffer, outcome, false);
            }
        });
    }

    private void publish(RingBuffer<OutcomeEvent> ringBuffer, ProvisionOutcome outcome, boolean synthetic) {
        ringBuffer.publishEvent(TRANSLATOR, outcome, synthetic);
    }

    private static Throwable unwrap(Throwable failure) {
        if ((failure instanceof CompletionException || failure instanceof ExecutionException)
                && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    /**
     * Normal completion: every outcome is already consumed, so both shut down immediately.
     * Otherwise (interrupted wait): in-flight attempts are abandoned and the consumer halted.
     */
    private void shutdown(ExecutorService pool, Disruptor<OutcomeEvent> disruptor, boolean allReported) {
        if (!allReported) {
            log.warn("Provisioning run interrupted, abandoning in-flight hosts");
            pool.shutdownNow();
            disruptor.halt();
            return;
        }

        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in time");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            disruptor.shutdown(30, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Outcome ring buffer shutdown timed out, halting...");
            disruptor.halt();
        }
    }

    private void notifyRunStarted(int records, int workers, boolean dryRun) {
        try {
            listener.onRunStarted(records, workers, dryRun);
        } catch (Exception e) {
            log.error("Error notifying listener of run start", e);
        }
    }

    private void notifyRunCompleted(RunSummary summary) {
        try {
            listener.onRunCompleted(summary);
        } catch (Exception e) {
            log.error("Error notifying listener of run completion", e);
        }
    }

    /**
     * Thread factory for worker and consumer threads.
     */
    private static class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final boolean daemon;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix, boolean daemon) {
            this.namePrefix = namePrefix;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(daemon);
            return t;
        }
    }

    /**
     * Exception handler for the outcome consumer. Logs and keeps consuming.
     */
    private static class OutcomeExceptionHandler implements ExceptionHandler<OutcomeEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, OutcomeEvent event) {
            log.error("Exception in outcome handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during outcome consumer start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during outcome consumer shutdown", ex);
        }
    }
}
