package org.flagenums.exception;

import lombok.Getter;

/**
 * A string argument is empty or consists only of whitespace.
 */
@Getter
public class BlankArgumentException extends InvalidException {
    private static final long serialVersionUID = -2367170957815400512L;

    private final String paramName;

    public BlankArgumentException(String paramName) {
        super("Argument {} must not be empty or whitespace", paramName);
        this.paramName = paramName;
    }
}
