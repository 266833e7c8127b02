package io.mydata.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.mydata.core.error.TypeCastException;
import io.mydata.core.spi.TypeCaster;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for routing raw values through a pluggable {@link TypeCaster}. */
@ExtendWith(MockitoExtension.class)
@DisplayName("Cast dispatch")
class AttributeCasterTest {

    @Mock
    private TypeCaster caster;

    private KindRegistry registry;
    private ResourceKind counter;

    @BeforeEach
    void setUp() {
        when(caster.isKnownType("integer")).thenReturn(true);
        registry = KindRegistry.builder().caster(caster).build();
        counter = registry.declare("Counter", d -> d.attribute("count", "integer")
                .attribute("samples", "integer", Map.of("collection", true)));
    }

    @Test
    @DisplayName("Single values are cast once with no nested kind")
    void singleValue() {
        when(caster.cast("7", "integer", null)).thenReturn(7L);

        Resource resource = counter.newInstance().set("count", "7");

        assertThat(resource.value("count")).isEqualTo(7L);
        verify(caster).cast("7", "integer", null);
    }

    @Test
    @DisplayName("Collections are cast element by element in input order")
    void collectionElementWise() {
        when(caster.cast(any(), eq("integer"), isNull()))
                .thenAnswer(invocation -> Long.valueOf(invocation.getArgument(0).toString()));

        Resource resource = counter.newInstance().set("samples", List.of("3", "1", "2"));

        assertThat(resource.value("samples")).isEqualTo(List.of(3L, 1L, 2L));
        InOrder order = inOrder(caster);
        order.verify(caster).cast("3", "integer", null);
        order.verify(caster).cast("1", "integer", null);
        order.verify(caster).cast("2", "integer", null);
    }

    @Test
    @DisplayName("Empty and null collections never reach the caster")
    void emptyCollection() {
        Resource resource = counter.newInstance().set("samples", List.of());
        assertThat(resource.value("samples")).isEqualTo(List.of());

        resource.set("samples", null);
        assertThat(resource.value("samples")).isEqualTo(List.of());
        assertThat(resource.isSet("samples")).isFalse();

        verify(caster, never()).cast(any(), any(), any());
    }

    @Test
    @DisplayName("A null result is stored as absent")
    void nullResultIsAbsent() {
        when(caster.cast("", "integer", null)).thenReturn(null);

        Resource resource = counter.newInstance().set("count", "");

        assertThat(resource.get("count")).isSameAs(AttributeValue.ABSENT);
    }

    @Test
    @DisplayName("Resource attributes receive their nested kind")
    void nestedKindPassed() {
        ResourceKind node = registry.declare("Node", d -> d.attribute("parent", "resource", Map.of("class_name", "Node")));
        Resource parent = node.newInstance();
        Map<String, Object> raw = Map.of();
        when(caster.cast(same(raw), eq("resource"), same(node))).thenReturn(parent);

        Resource child = node.newInstance().set("parent", raw);

        assertThat(child.value("parent")).isSameAs(parent);
    }

    @Test
    @DisplayName("Caster failures are attributed to the kind and attribute")
    void failureAttributed() {
        when(caster.cast("x", "integer", null)).thenThrow(new TypeCastException("Invalid integer: 'x'", "integer"));
        Resource resource = counter.newInstance();

        assertThatThrownBy(() -> resource.set("count", "x"))
                .isInstanceOf(TypeCastException.class)
                .hasMessage("Cannot assign 'count' on Counter: Invalid integer: 'x'")
                .satisfies(e -> {
                    TypeCastException ex = (TypeCastException) e;
                    assertThat(ex.kind()).isEqualTo("Counter");
                    assertThat(ex.attribute()).isEqualTo("count");
                    assertThat(ex.getCause()).isInstanceOf(TypeCastException.class);
                });
        assertThat(resource.isSet("count")).isFalse();
    }

    @Test
    @DisplayName("Type tags unknown to the caster are rejected at declaration")
    void unknownTagRejected() {
        when(caster.isKnownType("money")).thenReturn(false);

        assertThatThrownBy(() -> registry.declare("Wallet", d -> d.attribute("balance", "money")))
                .hasMessage("Wrong type: balance: money");
    }
}
