package io.mydata.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.mydata.core.error.SchemaSourceException;
import io.mydata.core.model.AttributeDeclaration;
import io.mydata.core.model.ContainerMetadata;
import io.mydata.core.model.SchemaMode;
import io.mydata.core.source.YamlSchemaSource;
import io.mydata.core.spi.SchemaSource;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for declaring kinds from an external schema description. */
@DisplayName("Declaration from a schema source")
class SchemaDeclarationTest {

    private KindRegistry registry;

    @BeforeEach
    void setUp() {
        YamlSchemaSource catalog = YamlSchemaSource.load(
                SchemaDeclarationTest.class.getClassLoader().getResourceAsStream("schemas/invoices.yaml"),
                "schemas/invoices.yaml");
        registry = KindRegistry.builder().schemaSource(catalog).build();
        registry.declare("Invoice", ResourceKind.Declaration::fromComplexTypeSchema);
        registry.declare("InvoicesDoc", ResourceKind.Declaration::fromDocumentSchema);
    }

    @Test
    @DisplayName("Complex types contribute attributes and keep the default container")
    void complexType() {
        ResourceKind invoice = registry.require("Invoice");

        assertThat(invoice.describe()).isEqualTo("Invoice uid: string, amount: decimal, tags: [string]");
        assertThat(invoice.requireDescriptor("tags").collectionElementName()).isEqualTo("tag");
        assertThat(invoice.container().name()).isEqualTo("Invoice");
    }

    @Test
    @DisplayName("Documents contribute container metadata and attributes")
    void document() {
        ResourceKind doc = registry.require("InvoicesDoc");

        assertThat(doc.container().name()).isEqualTo("Invoices");
        assertThat(doc.container().attributes()).containsEntry("xmlns", "http://www.example.com/invoice");
        assertThat(doc.requireDescriptor("invoice").nestedKind()).isSameAs(registry.require("Invoice"));
    }

    @Test
    @DisplayName("Required attributes get presence rules")
    void requiredAttributes() {
        ResourceKind doc = registry.require("InvoicesDoc");

        Resource valid = doc.newInstance(Map.of(
                "issued_on", "2024-01-31",
                "invoice", List.of(Map.of("uid", "A-1", "amount", "10.50", "tags", List.of("paid")))));
        assertThat(valid.isValid()).isTrue();
        assertThat(valid.value("issued_on")).isEqualTo(LocalDate.of(2024, 1, 31));
        assertThat(valid.list("invoice", Resource.class).get(0).value("amount")).isEqualTo(new BigDecimal("10.50"));

        Resource invalid = doc.newInstance(Map.of("invoice", List.of(Map.of("amount", 1))));
        assertThat(invalid.validate().errors().fullMessages())
                .containsExactly("Issued on can't be blank", "Invoice Uid can't be blank");
    }

    @Test
    @DisplayName("Any SchemaSource implementation can back declarations")
    void pluggableSource() {
        SchemaSource source = mock(SchemaSource.class);
        when(source.documentContainer("Note")).thenReturn(ContainerMetadata.named("note"));
        when(source.attributes("Note", SchemaMode.DOCUMENT))
                .thenReturn(List.of(new AttributeDeclaration("body", "string", null, true)));
        KindRegistry custom = KindRegistry.builder().schemaSource(source).build();

        ResourceKind note = custom.declare("Note", ResourceKind.Declaration::fromDocumentSchema);

        assertThat(note.container().name()).isEqualTo("note");
        assertThat(note.attributeNames()).containsExactly("body");
        assertThat(note.rules()).hasSize(1);
        verify(source, never()).attributes("Note", SchemaMode.COMPLEX_TYPE);
    }

    @Test
    @DisplayName("Kinds missing from the catalog fail and are not registered")
    void missingFromCatalog() {
        assertThatThrownBy(() -> registry.declare("Receipt", ResourceKind.Declaration::fromComplexTypeSchema))
                .isInstanceOf(SchemaSourceException.class)
                .hasMessageContaining("No complex type described for 'Receipt'");
        assertThat(registry.contains("Receipt")).isFalse();
    }

    @Test
    @DisplayName("Schema declarations need a configured source")
    void noSource() {
        KindRegistry bare = KindRegistry.withDefaults();

        assertThatThrownBy(() -> bare.declare("Invoice", ResourceKind.Declaration::fromComplexTypeSchema))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No SchemaSource configured for the registry declaring 'Invoice'");
    }
}
