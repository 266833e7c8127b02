package io.mydata.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root element name and attributes used when a resource kind is rendered as markup. Opaque to the
 * schema engine itself; only the markup renderer reads it.
 *
 * @param name       element name of the document root
 * @param attributes attributes written on the root element, in insertion order
 */
public record ContainerMetadata(String name, Map<String, String> attributes) {

    /** Canonical constructor with defensive copies. */
    public ContainerMetadata {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    /** Creates container metadata with no root attributes. */
    public static ContainerMetadata named(String name) {
        return new ContainerMetadata(name, null);
    }
}
