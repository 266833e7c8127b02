package io.mydata.core.model;

/**
 * Which part of an external schema description a kind is declared from.
 *
 * <ul>
 *   <li>{@link #DOCUMENT}: a top-level document: contributes container metadata and attributes.
 *   <li>{@link #COMPLEX_TYPE}: a reusable nested type: contributes attributes only.
 * </ul>
 */
public enum SchemaMode {
    DOCUMENT,
    COMPLEX_TYPE
}
