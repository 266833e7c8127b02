package io.mydata.core.config;

import java.nio.file.Path;

/**
 * Runtime configuration for a {@code KindRegistry}. All fields have defaults; use {@link
 * #builder()} to construct instances.
 *
 * @param schemaCatalog        YAML schema catalog backing {@code fromDocumentSchema()} and {@code
 *                             fromComplexTypeSchema()}, or {@code null} for none
 * @param markupIndent         pretty-print rendered XML
 * @param markupXmlDeclaration emit the XML declaration in rendered documents
 */
public record MyDataConfig(Path schemaCatalog, boolean markupIndent, boolean markupXmlDeclaration) {

    /** Configuration with every default applied. */
    public static MyDataConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link MyDataConfig}. */
    public static final class Builder {

        private Path schemaCatalog;
        private boolean markupIndent = false;
        private boolean markupXmlDeclaration = true;

        Builder() {}

        public Builder schemaCatalog(Path schemaCatalog) {
            this.schemaCatalog = schemaCatalog;
            return this;
        }

        public Builder markupIndent(boolean markupIndent) {
            this.markupIndent = markupIndent;
            return this;
        }

        public Builder markupXmlDeclaration(boolean markupXmlDeclaration) {
            this.markupXmlDeclaration = markupXmlDeclaration;
            return this;
        }

        public MyDataConfig build() {
            return new MyDataConfig(schemaCatalog, markupIndent, markupXmlDeclaration);
        }
    }
}
