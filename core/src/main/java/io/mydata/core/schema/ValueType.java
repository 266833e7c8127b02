package io.mydata.core.schema;

import io.mydata.core.spi.TypeCaster;
import java.util.Objects;

/**
 * What an attribute holds: a primitive value identified by a type tag, or a nested resource of a
 * resolved kind. Closed so that casting, validation and serialization handle both cases
 * exhaustively.
 */
public sealed interface ValueType permits ValueType.Primitive, ValueType.Nested {

    /** The type tag as declared, e.g. {@code "integer"} or {@code "resource"}. */
    String tag();

    /** Primitive value cast by the {@link TypeCaster} under the given tag. */
    record Primitive(String tag) implements ValueType {

        public Primitive {
            Objects.requireNonNull(tag, "tag must not be null");
        }

        @Override
        public String toString() {
            return tag;
        }
    }

    /** Nested resource instance of a resolved kind. */
    record Nested(ResourceKind kind) implements ValueType {

        public Nested {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public String tag() {
            return TypeCaster.RESOURCE;
        }

        @Override
        public String toString() {
            return kind.name();
        }
    }
}
