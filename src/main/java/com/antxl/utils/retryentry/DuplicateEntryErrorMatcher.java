package com.antxl.utils.retryentry;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.sql.SQLIntegrityConstraintViolationException;

public record DuplicateEntryErrorMatcher(String entryName) implements ErrorMatcher {
    public static final int DUPLICATE_ENTRY_ERROR_CODE = 1062;

    public DuplicateEntryErrorMatcher {
        Validate.notNull(entryName, "Entry name should not be null.");
    }

    @Override
    public boolean matches(Throwable error) {
        return isDuplicateEntryError(error, entryName);
    }

    public static boolean isDuplicateEntryError(Throwable error, String entryName) {
        SQLIntegrityConstraintViolationException violation =
                ExceptionUtils.throwableOfType(error, SQLIntegrityConstraintViolationException.class);
        if (violation == null || violation.getErrorCode() != DUPLICATE_ENTRY_ERROR_CODE)
            return false;
        return StringUtils.contains(violation.getMessage(), entryName);
    }
}
