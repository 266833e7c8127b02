package io.mydata.core.spi;

import io.mydata.core.model.ValidationErrors;
import io.mydata.core.schema.Resource;

/**
 * A local, field-level validation rule registered on a kind. Rules inspect the instance and report
 * failures into the builder; they never throw for invalid data.
 */
@FunctionalInterface
public interface ValidationRule {

    void validate(Resource resource, ValidationErrors.Builder errors);
}
