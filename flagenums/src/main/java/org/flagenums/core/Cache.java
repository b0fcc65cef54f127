package org.flagenums.core;

import org.flagenums.util.function.BiFunc;

public interface Cache<TK, TV> {
    TV get(TK key);

    /**
     * Returns the cached value, computing it with {@code loadingFunc} on first access.
     * Concurrent callers for the same key wait for one computation and share its result.
     */
    TV get(TK key, BiFunc<TK, TV> loadingFunc);

    long size();
}
