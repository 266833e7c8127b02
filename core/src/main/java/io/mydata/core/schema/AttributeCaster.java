package io.mydata.core.schema;

import io.mydata.core.error.TypeCastException;
import io.mydata.core.spi.TypeCaster;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Routes a raw value through the {@link TypeCaster} according to its attribute descriptor.
 * Collections are cast element by element in input order; nested kinds are only passed for
 * resource attributes.
 */
final class AttributeCaster {

    private AttributeCaster() {}

    static AttributeValue cast(ResourceKind kind, AttributeDescriptor descriptor, Object raw) {
        TypeCaster caster = kind.registry().caster();
        try {
            if (!descriptor.collection()) {
                return castOne(caster, descriptor, raw);
            }
            if (raw == null) {
                return AttributeValue.ABSENT;
            }
            Iterable<?> items = asIterable(raw);
            if (items == null) {
                throw new TypeCastException(
                        "Expected a collection of " + descriptor.valueType() + " but got "
                                + raw.getClass().getSimpleName(),
                        descriptor.valueType().tag());
            }
            List<AttributeValue> elements = new ArrayList<>();
            for (Object item : items) {
                elements.add(castOne(caster, descriptor, item));
            }
            return new AttributeValue.Many(elements);
        } catch (TypeCastException e) {
            throw e.forAttribute(kind.name(), descriptor.name());
        }
    }

    private static AttributeValue castOne(TypeCaster caster, AttributeDescriptor descriptor, Object raw) {
        Object typed = caster.cast(raw, descriptor.valueType().tag(), descriptor.nestedKind());
        return AttributeValue.of(typed);
    }

    private static Iterable<?> asIterable(Object raw) {
        if (raw instanceof Iterable<?> iterable) {
            return iterable;
        }
        if (raw instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }
}
