package io.projectmemory.error;

/**
 * Stable, machine-readable error kinds returned to callers.
 *
 * <p>Capacity and rate-limit rejections are distinct from validation failures so a caller can pick
 * the right remediation. Only {@link #RATE_LIMIT_EXCEEDED} and {@link #POOL_EXHAUSTED} are safe to
 * retry automatically.</p>
 */
public enum ErrorKind {
    VALIDATION_ERROR(false),
    CAPACITY_EXCEEDED(false),
    RATE_LIMIT_EXCEEDED(true),
    POOL_EXHAUSTED(true),
    STORAGE_INTEGRITY(false),
    STORAGE_ERROR(false),
    PERMISSION_DENIED(false),
    SCHEMA_VERSION(false),
    UNKNOWN_OPERATION(false),
    INTERNAL_ERROR(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
