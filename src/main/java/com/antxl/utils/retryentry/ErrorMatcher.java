package com.antxl.utils.retryentry;

import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.exception.ExceptionUtils;

// Implementations answer false for null and never throw.
@FunctionalInterface
public interface ErrorMatcher {
    boolean matches(Throwable error);

    default ErrorMatcher or(ErrorMatcher other) {
        Validate.notNull(other, "Matcher should not be null.");
        return error -> matches(error) || other.matches(error);
    }

    static ErrorMatcher is(Throwable target) {
        return error -> target != null && error == target;
    }

    static ErrorMatcher causedBy(Throwable target) {
        return error -> target != null && ExceptionUtils.getThrowableList(error).stream().anyMatch(t -> t == target);
    }

    static ErrorMatcher instanceOf(Class<? extends Throwable> type) {
        Validate.notNull(type, "Error type should not be null.");
        return type::isInstance;
    }

    static ErrorMatcher duplicateEntry(String entryName) {
        return new DuplicateEntryErrorMatcher(entryName);
    }
}
