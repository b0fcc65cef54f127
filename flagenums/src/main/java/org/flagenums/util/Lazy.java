package org.flagenums.util;

import lombok.NonNull;
import lombok.SneakyThrows;
import org.flagenums.util.function.Func;

public final class Lazy<T> {
    private Func<T> func;
    private volatile T value;

    public Lazy(@NonNull Func<T> func) {
        this.func = func;
    }

    public boolean isValueCreated() {
        return value != null;
    }

    @SneakyThrows
    public T getValue() {
        if (value == null) {
            synchronized (this) {
                if (value == null) {
                    value = func.invoke();
                    func = null;
                }
            }
        }
        return value;
    }
}
