package io.mydata.core.schema;

import io.mydata.core.model.ErrorKind;
import io.mydata.core.model.ValidationErrors;
import io.mydata.core.model.ValidationResult;
import io.mydata.core.spi.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validity check for a resource and, recursively, every nested resource it owns. Stateless: the
 * result is built from scratch on every call and nothing is stored on the instance.
 */
final class ValidationCascade {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationCascade.class);

    static final String NESTED_MESSAGE_DELIMITER = ", ";

    private ValidationCascade() {}

    static ValidationResult validate(Resource resource) {
        ResourceKind kind = resource.kind();
        ValidationErrors.Builder errors = ValidationErrors.builder();

        for (ValidationRule rule : kind.rules()) {
            rule.validate(resource, errors);
        }

        // Unset entries are dropped by resources(); collections are already flattened.
        for (AttributeDescriptor descriptor : kind.descriptors().values()) {
            if (!descriptor.isResource()) {
                continue;
            }
            for (Resource nested : resource.get(descriptor.name()).resources()) {
                ValidationResult nestedResult = validate(nested);
                if (!nestedResult.valid()) {
                    errors.add(
                            descriptor.name(),
                            ErrorKind.INVALID_RESOURCE,
                            String.join(NESTED_MESSAGE_DELIMITER, nestedResult.errors().fullMessages()));
                }
            }
        }

        ValidationResult result = ValidationResult.of(errors.build());
        if (!result.valid()) {
            LOG.debug("Validation failed: kind={}, errors={}", kind.name(), result.errors().fullMessages());
        }
        return result;
    }
}
