package com.antxl.utils.retryentry;

import org.apache.commons.lang3.Validate;

/**
 * Outcome of {@link RetryEntry#run()}.
 * <p>
 * Branch on {@link #success()}, never on whether {@link #lastError()} is {@code null}: an accepted
 * error is a success that still reports the error which caused it. A failed result always carries
 * its last error.
 */
public record RetryResult(Termination termination, Throwable lastError, int attempts) {
    public RetryResult {
        Validate.notNull(termination, "Termination should not be null.");
        Validate.isTrue(attempts > 0, "Attempts should be positive.");
        if (termination == Termination.SUCCEEDED)
            Validate.isTrue(lastError == null, "A clean success carries no error.");
        else
            Validate.notNull(lastError, "A %s result should carry its last error.", termination);
    }

    public static RetryResult succeeded(int attempts) {
        return new RetryResult(Termination.SUCCEEDED, null, attempts);
    }

    public static RetryResult accepted(Throwable error, int attempts) {
        return new RetryResult(Termination.ACCEPTED, error, attempts);
    }

    public static RetryResult fatal(Throwable error, int attempts) {
        return new RetryResult(Termination.FATAL, error, attempts);
    }

    public static RetryResult exhausted(Throwable error, int attempts) {
        return new RetryResult(Termination.EXHAUSTED, error, attempts);
    }

    public boolean success() {
        return termination.isSuccess();
    }

    public boolean lastErrorMatches(ErrorMatcher matcher) {
        Validate.notNull(matcher, "Matcher should not be null.");
        return lastError != null && matcher.matches(lastError);
    }

    public RetryResult throwIfFailed() {
        if (!success())
            throw new RetryFailedException(this);
        return this;
    }

    public enum Termination {
        SUCCEEDED(true),
        ACCEPTED(true),
        FATAL(false),
        EXHAUSTED(false);

        private final boolean success;

        Termination(boolean success) {
            this.success = success;
        }

        public boolean isSuccess() {
            return success;
        }
    }
}
