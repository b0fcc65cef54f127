package org.flagenums.util.function;

import lombok.SneakyThrows;

import java.util.function.Supplier;

@FunctionalInterface
public interface Func<T> extends Supplier<T> {
    T invoke() throws Throwable;

    @SneakyThrows
    @Override
    default T get() {
        return invoke();
    }
}
