package io.mydata.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed state of one attribute on a resource instance.
 *
 * <ul>
 *   <li>{@link Absent}: never assigned, or assigned a value that cast to nothing.
 *   <li>{@link Scalar}: a primitive value produced by the type caster.
 *   <li>{@link Nested}: a single nested resource owned by the enclosing instance.
 *   <li>{@link Many}: an ordered sequence of values for a collection attribute.
 * </ul>
 */
public sealed interface AttributeValue
        permits AttributeValue.Absent, AttributeValue.Scalar, AttributeValue.Nested, AttributeValue.Many {

    /** Shared absent value. */
    AttributeValue ABSENT = new Absent();

    /** Shared empty collection value. */
    Many EMPTY = new Many(List.of());

    /** Wraps a value returned by the type caster. */
    static AttributeValue of(Object typed) {
        if (typed == null) {
            return ABSENT;
        }
        if (typed instanceof Resource resource) {
            return new Nested(resource);
        }
        return new Scalar(typed);
    }

    /** The plain Java value: {@code null}, the scalar, the {@link Resource}, or a list of raw values. */
    Object raw();

    /** Nested resources held directly by this value, flattened for collections. */
    List<Resource> resources();

    /** The value as it appears in a serializable view, nested resources expanded. */
    Object serializable();

    record Absent() implements AttributeValue {

        @Override
        public Object raw() {
            return null;
        }

        @Override
        public List<Resource> resources() {
            return List.of();
        }

        @Override
        public Object serializable() {
            return null;
        }
    }

    record Scalar(Object value) implements AttributeValue {

        public Scalar {
            Objects.requireNonNull(value, "value must not be null; use AttributeValue.ABSENT");
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public List<Resource> resources() {
            return List.of();
        }

        @Override
        public Object serializable() {
            return value;
        }
    }

    record Nested(Resource resource) implements AttributeValue {

        public Nested {
            Objects.requireNonNull(resource, "resource must not be null");
        }

        @Override
        public Object raw() {
            return resource;
        }

        @Override
        public List<Resource> resources() {
            return List.of(resource);
        }

        @Override
        public Object serializable() {
            return resource.serializableView();
        }
    }

    record Many(List<AttributeValue> elements) implements AttributeValue {

        public Many {
            elements = List.copyOf(elements);
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        public int size() {
            return elements.size();
        }

        @Override
        public Object raw() {
            // elements may be absent, so List.copyOf cannot be used here
            List<Object> values = new ArrayList<>(elements.size());
            for (AttributeValue element : elements) {
                values.add(element.raw());
            }
            return Collections.unmodifiableList(values);
        }

        @Override
        public List<Resource> resources() {
            List<Resource> nested = new ArrayList<>();
            for (AttributeValue element : elements) {
                nested.addAll(element.resources());
            }
            return Collections.unmodifiableList(nested);
        }

        @Override
        public Object serializable() {
            List<Object> values = new ArrayList<>(elements.size());
            for (AttributeValue element : elements) {
                values.add(element.serializable());
            }
            return values;
        }
    }
}
