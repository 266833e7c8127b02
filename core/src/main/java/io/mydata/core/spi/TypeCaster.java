package io.mydata.core.spi;

import io.mydata.core.schema.ResourceKind;

/**
 * Pluggable coercion of raw values into typed attribute values. The schema engine consults it at
 * declaration time to reject unknown type tags and at assignment time to cast each value.
 *
 * <p>Implementations MUST be deterministic and side-effect free, and thread-safe: one caster is
 * shared by every kind of a registry.
 */
public interface TypeCaster {

    /** The type tag for attributes holding a nested resource. Always known. */
    String RESOURCE = "resource";

    /**
     * Returns {@code true} if attributes may be declared with the given type tag.
     *
     * @param type a type tag such as {@code "string"} or {@code "resource"}
     */
    boolean isKnownType(String type);

    /**
     * Casts a single raw value to the given type.
     *
     * @param value      the raw value, possibly {@code null}
     * @param type       the declared type tag
     * @param nestedKind the nested kind when {@code type} is {@value #RESOURCE}, otherwise {@code null}
     * @return the typed value, or {@code null} when the raw value denotes absence
     * @throws io.mydata.core.error.TypeCastException if the value cannot be coerced
     */
    Object cast(Object value, String type, ResourceKind nestedKind);
}
