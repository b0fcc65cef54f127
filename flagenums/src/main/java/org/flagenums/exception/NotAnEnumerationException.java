package org.flagenums.exception;

import lombok.Getter;

/**
 * The type argument is not an enum implementing {@code NEnum}.
 */
@Getter
public class NotAnEnumerationException extends InvalidException {
    private static final long serialVersionUID = -6011874035342561129L;

    private final Class<?> type;

    public NotAnEnumerationException(Class<?> type) {
        super("Type {} is not an NEnum enumeration", type != null ? type.getName() : null);
        this.type = type;
    }
}
