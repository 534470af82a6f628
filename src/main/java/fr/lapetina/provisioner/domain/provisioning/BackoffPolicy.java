package fr.lapetina.provisioner.domain.provisioning;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay inserted between two attempts for the same host.
 *
 * <p>Exponential: the delay before retry {@code n} (1-based) is
 * {@code initialDelay * multiplier^(n-1)}, capped at {@code maxDelay}.
 * A zero initial delay disables backoff.
 */
public record BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier) {

    private static final BackoffPolicy NONE = new BackoffPolicy(Duration.ZERO, Duration.ZERO, 1.0);

    public BackoffPolicy {
        Objects.requireNonNull(initialDelay, "Initial delay is required");
        Objects.requireNonNull(maxDelay, "Max delay is required");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1.0: " + multiplier);
        }
    }

    public static BackoffPolicy none() {
        return NONE;
    }

    public static BackoffPolicy exponential(Duration initialDelay, Duration maxDelay, double multiplier) {
        return new BackoffPolicy(initialDelay, maxDelay, multiplier);
    }

    public boolean isEnabled() {
        return !initialDelay.isZero();
    }

    /**
     * Delay to wait before the given retry.
     *
     * @param retry 1 for the second attempt, 2 for the third, ...
     */
    public Duration delayBeforeRetry(int retry) {
        if (!isEnabled() || retry < 1) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(capped, 0));
    }
}
