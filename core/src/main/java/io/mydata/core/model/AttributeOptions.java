package io.mydata.core.model;

import java.util.Set;

/** Option keys accepted by an attribute declaration. */
public final class AttributeOptions {

    /** Name of the nested kind for {@code resource} attributes. */
    public static final String CLASS_NAME = "class_name";

    /** Marks the attribute as an ordered collection of values. */
    public static final String COLLECTION = "collection";

    /** Element name used for each collection entry when rendering markup. */
    public static final String COLLECTION_ELEMENT_NAME = "collection_element_name";

    /** The complete set of recognized option keys. */
    public static final Set<String> ALLOWED = Set.of(CLASS_NAME, COLLECTION, COLLECTION_ELEMENT_NAME);

    private AttributeOptions() {}
}
