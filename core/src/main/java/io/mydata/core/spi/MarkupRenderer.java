package io.mydata.core.spi;

import io.mydata.core.schema.Resource;

/**
 * Renders a resource instance as a markup document. Implementations read the kind's container
 * metadata, attribute order and descriptors to decide element names, nesting and collection
 * wrapping.
 */
@FunctionalInterface
public interface MarkupRenderer {

    /**
     * @param resource the instance to render
     * @return the rendered document text
     * @throws io.mydata.core.error.MarkupRenderException if rendering fails
     */
    String render(Resource resource);
}
