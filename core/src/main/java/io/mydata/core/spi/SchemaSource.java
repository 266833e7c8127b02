package io.mydata.core.spi;

import io.mydata.core.model.AttributeDeclaration;
import io.mydata.core.model.ContainerMetadata;
import io.mydata.core.model.SchemaMode;
import java.util.List;

/**
 * External description of resource kinds, consumed by {@code fromDocumentSchema()} and {@code
 * fromComplexTypeSchema()} during declaration.
 */
public interface SchemaSource {

    /**
     * Returns the root element metadata for a document kind.
     *
     * @param kindName the kind being declared
     * @throws io.mydata.core.error.SchemaSourceException if the kind is not described as a document
     */
    ContainerMetadata documentContainer(String kindName);

    /**
     * Returns the attributes of a kind in declaration order.
     *
     * @param kindName the kind being declared
     * @param mode     whether the kind is described as a document or as a complex type
     * @throws io.mydata.core.error.SchemaSourceException if the kind is not described in that mode
     */
    List<AttributeDeclaration> attributes(String kindName, SchemaMode mode);
}
