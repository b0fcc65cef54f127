package org.flagenums.core;

import lombok.NonNull;
import org.apache.commons.lang3.reflect.TypeUtils;
import org.flagenums.annotation.Metadata;

import java.lang.reflect.AnnotatedElement;

@SuppressWarnings(Constants.NON_UNCHECKED)
public interface Extends {
    static String metadata(@NonNull AnnotatedElement annotatedElement) {
        Metadata m = annotatedElement.getAnnotation(Metadata.class);
        if (m == null) {
            return null;
        }
        //bare @Metadata has no text
        return Strings.defaultIfBlank(m.value(), null);
    }

    static <T> T as(Object obj, Class<T> type) {
        if (!TypeUtils.isInstance(obj, type)) {
            return null;
        }
        return (T) obj;
    }
}
