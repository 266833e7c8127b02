package io.mydata.core.schema;

import java.util.Objects;

/**
 * Declared metadata for one attribute of a kind. Immutable once declared.
 *
 * @param name                  attribute name, unique within the kind
 * @param valueType             primitive tag or resolved nested kind
 * @param collection            whether the attribute holds an ordered sequence of values
 * @param collectionElementName element name for each entry when rendering markup, or {@code null}
 */
public record AttributeDescriptor(
        String name, ValueType valueType, boolean collection, String collectionElementName) {

    public AttributeDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
    }

    /** Returns {@code true} if the attribute holds nested resources. */
    public boolean isResource() {
        return valueType instanceof ValueType.Nested;
    }

    /** The nested kind for resource attributes, {@code null} for primitives. */
    public ResourceKind nestedKind() {
        return valueType instanceof ValueType.Nested nested ? nested.kind() : null;
    }

    /** Type as shown by {@link ResourceKind#describe()}: {@code integer}, {@code LineItem}, {@code [LineItem]}. */
    public String describeType() {
        String type = valueType.toString();
        return collection ? "[" + type + "]" : type;
    }

    @Override
    public String toString() {
        return name + ": " + describeType();
    }
}
