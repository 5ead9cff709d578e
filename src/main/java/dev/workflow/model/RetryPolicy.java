package dev.workflow.model;

/**
 * Per-step retry budget. A step is attempted at most {@code maxAttempts} times.
 */
public record RetryPolicy(
    int maxAttempts,
    long backoffMs
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 1;
    public static final long DEFAULT_BACKOFF_MS = 0L;

    public static RetryPolicy none() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_MS);
    }

    public boolean allowsAnotherAttempt(int attempt) {
        return attempt < maxAttempts;
    }
}
