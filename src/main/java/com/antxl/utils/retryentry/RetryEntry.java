package com.antxl.utils.retryentry;

import lombok.Getter;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Runs a {@link Task} until it succeeds, throws an acceptable error, throws an error that is not
 * retryable, or uses up {@code maxAttempts}.
 * <pre>{@code
 * RetryResult result = RetryEntry.of(() -> orderDao.insert(order), 3)
 *         .withAcceptableErrors(ErrorMatcher.duplicateEntry("orders.uniq_biz_id"))
 *         .withRetryErrors(ErrorMatcher.instanceOf(SQLTransientException.class))
 *         .run();
 * }</pre>
 * Entries are immutable, every {@code with*} call returns a new one. Acceptable errors are checked
 * before retryable ones, and within a list the first matching matcher wins.
 */
@Getter
public final class RetryEntry {
    private static final Logger log = LoggerFactory.getLogger(RetryEntry.class);

    private final Task task;
    private final int maxAttempts;
    private final List<ErrorMatcher> acceptableErrors;
    private final List<ErrorMatcher> retryErrors;

    private RetryEntry(Task task, int maxAttempts, List<ErrorMatcher> acceptableErrors, List<ErrorMatcher> retryErrors) {
        this.task = task;
        this.maxAttempts = maxAttempts;
        this.acceptableErrors = acceptableErrors;
        this.retryErrors = retryErrors;
    }

    public static RetryEntry of(Task task, int maxAttempts) {
        Validate.notNull(task, "Task should not be null.");
        Validate.isTrue(maxAttempts > 0, "Max attempts should be positive, got %d.", maxAttempts);
        return new RetryEntry(task, maxAttempts, List.of(), List.of());
    }

    public RetryEntry withAcceptableErrors(ErrorMatcher... matchers) {
        return withAcceptableErrors(matchers == null ? List.of() : Arrays.asList(matchers));
    }

    public RetryEntry withAcceptableErrors(List<ErrorMatcher> matchers) {
        return new RetryEntry(task, maxAttempts, copyOf(matchers), retryErrors);
    }

    public RetryEntry withRetryErrors(ErrorMatcher... matchers) {
        return withRetryErrors(matchers == null ? List.of() : Arrays.asList(matchers));
    }

    public RetryEntry withRetryErrors(List<ErrorMatcher> matchers) {
        return new RetryEntry(task, maxAttempts, acceptableErrors, copyOf(matchers));
    }

    public RetryResult run() {
        Exception lastError = null;
        for (int i = 0; i < maxAttempts; i++) {
            int attempt = i + 1;
            try {
                task.execute();
                log.debug("Task succeeded on attempt {}/{}", attempt, maxAttempts);
                return RetryResult.succeeded(attempt);
            } catch (Exception e) {
                if (e instanceof InterruptedException)
                    Thread.currentThread().interrupt();
                lastError = e;
                if (anyMatches(acceptableErrors, e)) {
                    log.debug("Task failed on attempt {}/{} with an acceptable error: {}", attempt, maxAttempts, e.toString());
                    return RetryResult.accepted(e, attempt);
                }
                if (!anyMatches(retryErrors, e)) {
                    log.warn("Task failed on attempt {}/{} with a non-retryable error: {}", attempt, maxAttempts, e.toString());
                    return RetryResult.fatal(e, attempt);
                }
                log.debug("Task failed on attempt {}/{} with a retryable error: {}", attempt, maxAttempts, e.toString());
            }
        }
        log.warn("Task gave up after {} attempts: {}", maxAttempts, String.valueOf(lastError));
        return RetryResult.exhausted(lastError, maxAttempts);
    }

    private static boolean anyMatches(List<ErrorMatcher> matchers, Throwable error) {
        for (ErrorMatcher matcher : matchers) {
            if (matcher.matches(error))
                return true;
        }
        return false;
    }

    private static List<ErrorMatcher> copyOf(List<ErrorMatcher> matchers) {
        if (matchers == null || matchers.isEmpty())
            return List.of();
        Validate.noNullElements(matchers, "Matcher at index %d should not be null.");
        return List.copyOf(matchers);
    }

    @Override
    public String toString() {
        return "RetryEntry: {" +
                "max attempts: " + maxAttempts +
                ", acceptable errors: " + acceptableErrors.size() +
                ", retry errors: " + retryErrors.size() +
                "}";
    }
}
