package com.antxl.utils.retryentry;

import lombok.Getter;

@Getter
public final class RetryFailedException extends RuntimeException {
    private final RetryResult.Termination termination;
    private final int attempts;

    RetryFailedException(RetryResult result) {
        super("Task failed (" + result.termination() + ") after " + result.attempts() + " attempt(s)", result.lastError());
        this.termination = result.termination();
        this.attempts = result.attempts();
    }
}
