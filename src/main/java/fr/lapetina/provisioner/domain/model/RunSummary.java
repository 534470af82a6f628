package fr.lapetina.provisioner.domain.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate result of one provisioning run.
 *
 * @param valid       records submitted to the dispatcher
 * @param parseErrors diagnostics produced while reading the inventory
 * @param completed   outcomes with status {@code COMPLETED}
 * @param failed      outcomes with status {@code FAILED}
 * @param dryRun      outcomes with status {@code DRY_RUN}
 * @param outcomes    every outcome, in arrival order
 * @param duration    wall-clock duration of the dispatch
 */
public record RunSummary(
        int valid,
        int parseErrors,
        int completed,
        int failed,
        int dryRun,
        List<ProvisionOutcome> outcomes,
        Duration duration
) {
    public RunSummary {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    public static RunSummary empty(int parseErrors) {
        return new RunSummary(0, parseErrors, 0, 0, 0, List.of(), Duration.ZERO);
    }

    public int processed() {
        return completed + failed + dryRun;
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    /**
     * Mutable running counts for a run in progress.
     * Not thread-safe: exactly one thread folds outcomes into it.
     */
    public static final class Accumulator {
        private final int valid;
        private final int parseErrors;
        private final List<ProvisionOutcome> outcomes;
        private int completed;
        private int failed;
        private int dryRun;

        public Accumulator(int valid, int parseErrors) {
            this.valid = valid;
            this.parseErrors = parseErrors;
            this.outcomes = new ArrayList<>(valid);
        }

        public void add(ProvisionOutcome outcome) {
            outcomes.add(outcome);
            switch (outcome.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case DRY_RUN -> dryRun++;
            }
        }

        public int size() {
            return outcomes.size();
        }

        public RunSummary toSummary(Duration duration) {
            return new RunSummary(valid, parseErrors, completed, failed, dryRun, outcomes, duration);
        }
    }
}
