package org.flagenums.annotation;

import org.flagenums.core.UnderlyingType;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;

/**
 * Integer storage of an {@code NEnum}, {@link UnderlyingType#INT} when absent.
 */
@Target(TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnumStorage {
    UnderlyingType value();
}
