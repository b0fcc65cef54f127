package org.flagenums.exception;

import lombok.Getter;
import org.flagenums.core.UnderlyingType;

/**
 * A numeric literal does not fit the underlying integer type of the enum.
 */
@Getter
public class FlagOverflowException extends InvalidException {
    private static final long serialVersionUID = -419560883742516613L;

    private final String token;
    private final UnderlyingType underlyingType;

    public FlagOverflowException(String token, UnderlyingType underlyingType) {
        super("Value {} is out of range of {} [{}, {}]", token, underlyingType,
                underlyingType.getMinText(), underlyingType.getMaxText());
        this.token = token;
        this.underlyingType = underlyingType;
    }
}
