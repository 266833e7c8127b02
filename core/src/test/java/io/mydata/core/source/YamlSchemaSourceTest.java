package io.mydata.core.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mydata.core.error.SchemaSourceException;
import io.mydata.core.model.AttributeDeclaration;
import io.mydata.core.model.ContainerMetadata;
import io.mydata.core.model.SchemaMode;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the YAML schema catalog: structure, lookup by full and short kind name, and strict
 * rejection of malformed catalogs.
 */
@DisplayName("YamlSchemaSource")
class YamlSchemaSourceTest {

    private YamlSchemaSource source;

    @BeforeEach
    void setUp() {
        InputStream in = YamlSchemaSourceTest.class.getClassLoader().getResourceAsStream("schemas/invoices.yaml");
        source = YamlSchemaSource.load(in, "schemas/invoices.yaml");
    }

    private static YamlSchemaSource parse(String yaml) {
        return YamlSchemaSource.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline.yaml");
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Lists documents and complex types")
        void names() {
            assertThat(source.documentNames()).containsExactly("InvoicesDoc");
            assertThat(source.complexTypeNames()).containsExactly("Invoice");
            assertThat(source.source()).isEqualTo("schemas/invoices.yaml");
        }

        @Test
        @DisplayName("Document container carries name and root attributes")
        void documentContainer() {
            ContainerMetadata container = source.documentContainer("InvoicesDoc");

            assertThat(container.name()).isEqualTo("Invoices");
            assertThat(container.attributes()).containsEntry("xmlns", "http://www.example.com/invoice");
        }

        @Test
        @DisplayName("Document attributes keep order, options and required flags")
        void documentAttributes() {
            List<AttributeDeclaration> attributes = source.attributes("InvoicesDoc", SchemaMode.DOCUMENT);

            assertThat(attributes).extracting(AttributeDeclaration::name).containsExactly("issued_on", "invoice");
            AttributeDeclaration invoice = attributes.get(1);
            assertThat(invoice.type()).isEqualTo("resource");
            assertThat(invoice.required()).isTrue();
            assertThat(invoice.options())
                    .containsEntry("class_name", "Invoice")
                    .containsEntry("collection", true);
        }

        @Test
        @DisplayName("Kinds are also found by their short name")
        void shortNameLookup() {
            assertThat(source.documentContainer("billing::InvoicesDoc").name()).isEqualTo("Invoices");
            assertThat(source.attributes("com.acme.Invoice", SchemaMode.COMPLEX_TYPE))
                    .extracting(AttributeDeclaration::name)
                    .containsExactly("uid", "amount", "tags");
        }

        @Test
        @DisplayName("Unknown kinds fail with the available names")
        void unknownKind() {
            assertThatThrownBy(() -> source.attributes("Receipt", SchemaMode.COMPLEX_TYPE))
                    .isInstanceOf(SchemaSourceException.class)
                    .hasMessageContaining("No complex type described for 'Receipt'")
                    .hasMessageContaining("[Invoice]");
            assertThatThrownBy(() -> source.documentContainer("Invoice"))
                    .isInstanceOf(SchemaSourceException.class)
                    .hasMessageContaining("No document described for 'Invoice'");
        }

        @Test
        @DisplayName("A document without container block uses the short kind name")
        void defaultContainer() {
            YamlSchemaSource inline = parse("""
                    documents:
                      "billing::Receipt":
                        attributes:
                          - name: uid
                            type: string
                    """);

            assertThat(inline.documentContainer("billing::Receipt").name()).isEqualTo("Receipt");
            assertThat(inline.documentContainer("billing::Receipt").attributes()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Malformed catalogs")
    class Malformed {

        @Test
        void emptyCatalog() {
            assertThatThrownBy(() -> parse(""))
                    .isInstanceOf(SchemaSourceException.class)
                    .hasMessage("Schema catalog is empty");
        }

        @Test
        void unknownRootKey() {
            assertThatThrownBy(() -> parse("types: {}\n"))
                    .isInstanceOf(SchemaSourceException.class)
                    .hasMessageStartingWith("Unknown key in 'catalog root': [types]");
        }

        @Test
        void unknownAttributeKey() {
            assertThatThrownBy(() -> parse("""
                            complex-types:
                              Invoice:
                                attributes:
                                  - name: tags
                                    type: string
                                    colection: true
                            """))
                    .isInstanceOf(SchemaSourceException.class)
                    .hasMessageStartingWith("Unknown key in 'Invoice.attributes[0]': [colection]")
                    .satisfies(e -> {
                        SchemaSourceException ex = (SchemaSourceException) e;
                        assertThat(ex.kind()).isEqualTo("Invoice");
                        assertThat(ex.source()).isEqualTo("inline.yaml");
                    });
        }

        @Test
        void missingType() {
            assertThatThrownBy(() -> parse("""
                            complex-types:
                              Invoice:
                                attributes:
                                  - name: uid
                            """))
                    .isInstanceOf(SchemaSourceException.class)
                    .hasMessage("Missing or invalid required field 'type' in 'Invoice.attributes[0]'");
        }

        @Test
        void attributesMustBeAList() {
            assertThatThrownBy(() -> parse("""
                            complex-types:
                              Invoice:
                                attributes:
                                  uid: string
                            """))
                    .isInstanceOf(SchemaSourceException.class)
                    .hasMessage("'attributes' of 'Invoice' must be a YAML list");
        }

        @Test
        void missingFile(@TempDir Path tempDir) {
            Path missing = tempDir.resolve("missing.yaml");

            assertThatThrownBy(() -> YamlSchemaSource.load(missing))
                    .isInstanceOf(SchemaSourceException.class)
                    .hasMessageStartingWith("Failed to read or parse YAML")
                    .satisfies(e -> assertThat(((SchemaSourceException) e).source()).isEqualTo(missing.toString()));
        }
    }
}
