package org.flagenums.exception;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.helpers.MessageFormatter;
import org.springframework.core.NestedRuntimeException;

/**
 * Base of every error raised by flag enum operations. Messages use slf4j {@code {}} patterns.
 */
public class InvalidException extends NestedRuntimeException {
    private static final long serialVersionUID = 3150298427861135510L;

    public static RuntimeException sneaky(Throwable cause) {
        ExceptionUtils.rethrow(cause);
        return wrap(cause);
    }

    public static InvalidException wrap(Throwable cause) {
        if (cause == null) {
            return null;
        }
        if (cause instanceof InvalidException) {
            return (InvalidException) cause;
        }
        return new InvalidException(cause);
    }

    protected InvalidException(Throwable e) {
        super(e.getMessage(), e);
    }

    public InvalidException(String messagePattern, Object... args) {
        super(messagePattern != null ? MessageFormatter.arrayFormat(messagePattern, args).getMessage() : null,
                MessageFormatter.getThrowableCandidate(args));
    }
}
