package org.flagenums.exception;

import lombok.Getter;

@Getter
public class UnresolvedFlagNameException extends InvalidException {
    private static final long serialVersionUID = 5542176403198717250L;

    private final Class<?> type;
    private final String token;

    public UnresolvedFlagNameException(Class<?> type, String token) {
        super("Token '{}' is neither a member of {} nor a numeric value", token, type.getName());
        this.type = type;
        this.token = token;
    }
}
