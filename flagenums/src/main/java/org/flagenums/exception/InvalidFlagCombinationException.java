package org.flagenums.exception;

import lombok.Getter;

@Getter
public class InvalidFlagCombinationException extends InvalidException {
    private static final long serialVersionUID = 8934020761538829346L;

    private final Class<?> type;
    private final String paramName;
    private final long value;

    public InvalidFlagCombinationException(Class<?> type, String paramName, long value) {
        super("Argument {}={} is not a valid flag combination of {}", paramName, value, type.getName());
        this.type = type;
        this.paramName = paramName;
        this.value = value;
    }
}
