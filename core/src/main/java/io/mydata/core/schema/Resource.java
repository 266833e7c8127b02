package io.mydata.core.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mydata.core.error.TypeCastException;
import io.mydata.core.model.ValidationResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An instance of a {@link ResourceKind}: typed attribute values behind the accessor contract the
 * kind declares.
 *
 * <p>Values enter only through {@link #set(String, Object)} or {@link #setAttributes(Map)}, which
 * route every raw value through the kind's cast dispatch. Nested resources are owned by their
 * parent: assigning an existing instance copies it, so graphs stay trees.
 *
 * <p>Bulk assignment is an overlay merge: keys that are not declared attributes are skipped, and
 * declared attributes missing from the input keep their current value.
 *
 * <p>Not thread-safe: an instance must have a single owner while it is being mutated.
 */
public final class Resource {

    private static final Logger LOG = LoggerFactory.getLogger(Resource.class);

    private final ResourceKind kind;
    private final Map<String, AttributeValue> values = new HashMap<>();

    Resource(ResourceKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ResourceKind kind() {
        return kind;
    }

    // ── Accessors ──

    /**
     * Returns the typed value of an attribute. An unset collection reads as an empty {@link
     * AttributeValue.Many}; an unset single value reads as {@link AttributeValue#ABSENT}.
     *
     * @throws IllegalArgumentException if the attribute is not declared
     */
    public AttributeValue get(String attribute) {
        AttributeDescriptor descriptor = kind.requireDescriptor(attribute);
        AttributeValue value = values.get(attribute);
        if (value == null || value instanceof AttributeValue.Absent) {
            return descriptor.collection() ? AttributeValue.EMPTY : AttributeValue.ABSENT;
        }
        return value;
    }

    /**
     * Returns the plain value of an attribute: {@code null} when unset, the scalar, the nested
     * {@link Resource}, or an unmodifiable list for collections (never {@code null}).
     */
    public Object value(String attribute) {
        return get(attribute).raw();
    }

    /** Typed variant of {@link #value(String)}. */
    public <T> T value(String attribute, Class<T> type) {
        return type.cast(value(attribute));
    }

    /**
     * Returns the elements of a collection attribute cast to the given type.
     *
     * @throws IllegalArgumentException if the attribute is not a collection
     */
    public <T> List<T> list(String attribute, Class<T> elementType) {
        if (!kind.requireDescriptor(attribute).collection()) {
            throw new IllegalArgumentException("Attribute '" + attribute + "' on " + kind.name() + " is not a collection");
        }
        List<T> elements = new ArrayList<>();
        for (Object element : (List<?>) value(attribute)) {
            elements.add(elementType.cast(element));
        }
        return elements;
    }

    /** Returns {@code true} if the attribute holds a value (for collections: any value, even empty). */
    public boolean isSet(String attribute) {
        kind.requireDescriptor(attribute);
        AttributeValue value = values.get(attribute);
        return value != null && !(value instanceof AttributeValue.Absent);
    }

    /**
     * Casts the raw value through the attribute's descriptor and stores it, replacing any prior
     * value.
     *
     * @throws IllegalArgumentException if the attribute is not declared
     * @throws TypeCastException        if the value cannot be cast
     */
    public Resource set(String attribute, Object raw) {
        AttributeDescriptor descriptor = kind.requireDescriptor(attribute);
        values.put(attribute, kind.cast(descriptor, raw));
        return this;
    }

    // ── Bulk read/write ──

    /** Snapshot of every declared attribute in declaration order; nested resources appear as themselves. */
    public Map<String, Object> attributes() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (String attribute : kind.descriptors().keySet()) {
            snapshot.put(attribute, value(attribute));
        }
        return snapshot;
    }

    /**
     * Assigns every entry whose key names a declared attribute; other keys are ignored.
     *
     * @return the resulting {@link #attributes()} snapshot
     * @throws TypeCastException if a value cannot be cast; earlier entries stay assigned
     */
    public Map<String, Object> setAttributes(Map<?, ?> source) {
        Objects.requireNonNull(source, "source must not be null");
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String attribute = String.valueOf(entry.getKey());
            if (!kind.hasAttribute(attribute)) {
                LOG.trace("Ignoring undeclared attribute: kind={}, key={}", kind.name(), attribute);
                continue;
            }
            set(attribute, entry.getValue());
        }
        return attributes();
    }

    /** Assigns from another instance's {@link #attributes()} view. */
    public Map<String, Object> setAttributes(Resource source) {
        Objects.requireNonNull(source, "source must not be null");
        return setAttributes(source.attributes());
    }

    /** Values of the resource-typed attributes, in declaration order. */
    public Map<String, Object> resources() {
        Map<String, Object> nested = new LinkedHashMap<>();
        for (AttributeDescriptor descriptor : kind.descriptors().values()) {
            if (descriptor.isResource()) {
                nested.put(descriptor.name(), value(descriptor.name()));
            }
        }
        return nested;
    }

    // ── Validation ──

    /**
     * Runs the kind's local rules, then validates every nested resource recursively. Each invalid
     * nested instance adds an {@code INVALID_RESOURCE} error on the attribute that holds it.
     * Computed fresh on every call.
     */
    public ValidationResult validate() {
        return ValidationCascade.validate(this);
    }

    public boolean isValid() {
        return validate().valid();
    }

    // ── Serialization ──

    /** Ordered key/value tree of this instance; nested resources and collections are expanded. */
    public Map<String, Object> serializableView() {
        Map<String, Object> view = new LinkedHashMap<>();
        for (String attribute : kind.descriptors().keySet()) {
            view.put(attribute, get(attribute).serializable());
        }
        return view;
    }

    /**
     * Ordered key/value tree where each value of the {@link #attributes()} snapshot is replaced by
     * {@code transform(key, value)}. No recursive expansion is applied.
     */
    public Map<String, Object> serializableView(BiFunction<String, Object, Object> transform) {
        Objects.requireNonNull(transform, "transform must not be null");
        Map<String, Object> view = attributes();
        view.replaceAll(transform);
        return view;
    }

    /** The serializable view as a Jackson tree; dates are written as ISO-8601 text. */
    public ObjectNode toJson() {
        return ResourceJson.toTree(serializableView());
    }

    public String toJsonString() {
        return toJson().toString();
    }

    /** Renders this instance with the registry's markup renderer. */
    public String renderMarkup() {
        return kind.registry().markupRenderer().render(this);
    }

    // ── Object ──

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Resource other) || other.kind != kind) {
            return false;
        }
        for (String attribute : kind.descriptors().keySet()) {
            if (!get(attribute).equals(other.get(attribute))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = kind.hashCode();
        for (String attribute : kind.descriptors().keySet()) {
            hash = 31 * hash + get(attribute).hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return kind.name()
                + serializableView().entrySet().stream()
                        .map(e -> e.getKey() + ": " + e.getValue())
                        .collect(Collectors.joining(", ", "(", ")"));
    }
}
