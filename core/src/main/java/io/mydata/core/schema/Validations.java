package io.mydata.core.schema;

import io.mydata.core.model.ErrorKind;
import io.mydata.core.spi.ValidationRule;
import java.util.Collection;

/** Built-in validation rules. */
public final class Validations {

    private Validations() {}

    /**
     * Requires the attribute to be present: not {@code null}, not a blank string and not an empty
     * collection. Reports {@link ErrorKind#BLANK}.
     */
    public static ValidationRule presence(String attribute) {
        return (resource, errors) -> {
            if (isBlank(resource.value(attribute))) {
                errors.add(attribute, ErrorKind.BLANK);
            }
        };
    }

    static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }
}
