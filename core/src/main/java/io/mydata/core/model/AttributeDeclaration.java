package io.mydata.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One attribute as described by an external schema source, before it is declared on a kind.
 *
 * @param name     attribute name
 * @param type     type tag, e.g. {@code string} or {@code resource}
 * @param options  declaration options ({@code class_name}, {@code collection},
 *                 {@code collection_element_name})
 * @param required whether a presence rule should be registered for the attribute
 */
public record AttributeDeclaration(String name, String type, Map<String, Object> options, boolean required) {

    public AttributeDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }

    /** Creates an optional attribute declaration without options. */
    public static AttributeDeclaration of(String name, String type) {
        return new AttributeDeclaration(name, type, null, false);
    }
}
