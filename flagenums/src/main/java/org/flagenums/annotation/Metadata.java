package org.flagenums.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.TYPE;

/**
 * Display text of an enum constant, rendered by {@code EnumFormat.DESCRIPTION}.
 */
@Target({TYPE, FIELD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Metadata {
    String value() default "";
}
