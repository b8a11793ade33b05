package com.antxl.utils.retryentry;

import org.apache.commons.lang3.Validate;

@FunctionalInterface
public interface Task {
    void execute() throws Exception;

    static Task of(Runnable runnable) {
        Validate.notNull(runnable, "Runnable should not be null.");
        return runnable::run;
    }
}
