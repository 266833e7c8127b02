package io.mydata.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy. Verifies the two-tier structure, common fields, and all
 * concrete exception types.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void resourceExceptionIsAbstractAndRoot() {
        assertThat(ResourceException.class).isAbstract();
        assertThat(ResourceException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void declarationExceptionIsAbstract() {
        assertThat(ResourceDeclarationException.class).isAbstract();
        assertThat(ResourceDeclarationException.class.getSuperclass()).isEqualTo(ResourceException.class);
    }

    // --- Declaration-time exceptions ---

    @Test
    void unknownAttributeTypeExtendsDeclarationException() {
        var ex = new UnknownAttributeTypeException("Wrong type: weight: money", "Parcel", "weight");

        assertThat(ex).isInstanceOf(ResourceDeclarationException.class);
        assertThat(ex.kind()).isEqualTo("Parcel");
        assertThat(ex.attribute()).isEqualTo("weight");
        assertThat(ex.detail()).isEqualTo("Wrong type: weight: money");
        assertThat(ex.phase()).isEqualTo(ResourceException.Phase.DECLARATION);
    }

    @Test
    void optionAndDuplicateExceptionsExtendDeclarationException() {
        assertThat(new UnsupportedOptionException("bad", "K", "a")).isInstanceOf(ResourceDeclarationException.class);
        assertThat(new DuplicateAttributeException("dup", "K", "a")).isInstanceOf(ResourceDeclarationException.class);
        assertThat(new UnresolvedResourceException("missing", "K", "a"))
                .isInstanceOf(ResourceDeclarationException.class);
    }

    @Test
    void duplicateKindHasNoAttribute() {
        var ex = new DuplicateKindException("Resource kind already declared: 'Order'", "Order");

        assertThat(ex.kind()).isEqualTo("Order");
        assertThat(ex.attribute()).isNull();
        assertThat(ex.phase()).isEqualTo(ResourceException.Phase.DECLARATION);
    }

    @Test
    void schemaSourceExceptionCarriesSource() {
        var cause = new RuntimeException("io");
        var ex = new SchemaSourceException("unreadable", cause, null, "/catalog.yaml");

        assertThat(ex).isInstanceOf(ResourceDeclarationException.class);
        assertThat(ex.source()).isEqualTo("/catalog.yaml");
        assertThat(ex.kind()).isNull();
        assertThat(ex.getCause()).isSameAs(cause);
    }

    // --- Assignment and rendering ---

    @Test
    void typeCastExceptionIsAssignmentPhase() {
        var ex = new TypeCastException("Invalid integer: 'x'", "integer");

        assertThat(ex).isInstanceOf(ResourceException.class).isNotInstanceOf(ResourceDeclarationException.class);
        assertThat(ex.phase()).isEqualTo(ResourceException.Phase.ASSIGNMENT);
        assertThat(ex.type()).isEqualTo("integer");
        assertThat(ex.attribute()).isNull();
        assertThat(ex.kind()).isNull();
        assertThat(ex.reason()).isEqualTo("Invalid integer: 'x'");
    }

    @Test
    void typeCastAttributionJoinsPaths() {
        var root = new NumberFormatException("x");
        var ex = new TypeCastException("Invalid integer: 'x'", root, "integer")
                .forAttribute("LineItem", "qty")
                .forAttribute("Order", "items");

        assertThat(ex.getMessage()).isEqualTo("Cannot assign 'items.qty' on Order: Invalid integer: 'x'");
        assertThat(ex.attribute()).isEqualTo("items.qty");
        assertThat(ex.kind()).isEqualTo("Order");
        assertThat(ex.type()).isEqualTo("integer");
        assertThat(ex.getCause()).isSameAs(root);
    }

    @Test
    void markupRenderExceptionIsRenderingPhase() {
        var cause = new IllegalStateException("stream closed");
        var ex = new MarkupRenderException("Failed to render Order as XML", cause, "Order");

        assertThat(ex.phase()).isEqualTo(ResourceException.Phase.RENDERING);
        assertThat(ex.kind()).isEqualTo("Order");
        assertThat(ex.getCause()).isSameAs(cause);
    }
}
