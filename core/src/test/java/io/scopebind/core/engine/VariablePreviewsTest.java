package io.scopebind.core.engine;

import static io.scopebind.core.expression.VariableIdentifiers.encode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.scopebind.core.model.InstanceSelector;
import io.scopebind.core.model.Variable;
import io.scopebind.core.model.VariableValue;
import io.scopebind.core.spi.VariableValueProvider;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link VariablePreviews}. */
class VariablePreviewsTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final InstanceSelector AT_BOX = InstanceSelector.of("box", "body");

    private VariableValueProvider provider;
    private VariablePreviews previews;

    @BeforeEach
    void setUp() {
        FakeInstanceTree tree = new FakeInstanceTree().add("body", "Body").add("box", "Box").add("aside", "Box");
        BindingStore store = new BindingStore(StoreSnapshot.builder()
                .addVariable(Variable.value("count", "body", "count", VariableValue.of(NODES.numberNode(3))))
                .addVariable(Variable.resource("posts", "body", "posts", "r1"))
                .addVariable(Variable.parameter("item", "box", "item"))
                .addVariable(Variable.value("hidden", "aside", "hidden", VariableValue.of(NODES.numberNode(1))))
                .build());
        provider = mock(VariableValueProvider.class);
        when(provider.valuesFor(any())).thenReturn(Map.of("posts", NODES.arrayNode().add("a"), "hidden", NODES.nullNode()));
        previews = new VariablePreviews(store, new ScopeResolver(tree, "ws:collection"), provider);
    }

    @Test
    void runtimeValuesWithStoredLiteralFallback() {
        Map<String, JsonNode> values = previews.valuesFor(AT_BOX);

        assertThat(values).containsOnlyKeys("count", "posts");
        assertThat(values.get("count").intValue()).isEqualTo(3);
        assertThat(values.get("posts").get(0).asText()).isEqualTo("a");
    }

    @Test
    void editorScopeIsKeyedByEncodedIdentifier() {
        assertThat(previews.editorScope(AT_BOX)).containsOnlyKeys(encode("count"), encode("posts"));
    }

    @Test
    void editorAliasesNameEveryVisibleVariable() {
        assertThat(previews.editorAliases(AT_BOX))
                .containsExactly(
                        Map.entry(encode("count"), "count"),
                        Map.entry(encode("posts"), "posts"),
                        Map.entry(encode("item"), "item"));
    }

    @Test
    void labelShowsPreviewWhenValueIsKnown() {
        Variable count = Variable.value("count", "body", "count", VariableValue.of(NODES.numberNode(3)));

        assertThat(VariablePreviews.label(count, NODES.numberNode(3))).isEqualTo("count: 3");
        assertThat(VariablePreviews.label(count, null)).isEqualTo("count");
    }
}
