package io.scopebind.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.scopebind.core.model.InstanceSelector;
import io.scopebind.core.model.Variable;
import io.scopebind.core.model.VariableValue;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ScopeResolver}. */
class ScopeResolverTest {

    private static final VariableValue ZERO = VariableValue.of(JsonNodeFactory.instance.numberNode(0));

    private final Variable rootVar = Variable.value("v-root", "root", "site", ZERO);
    private final Variable listItem = Variable.parameter("v-item", "list", "item");
    private final Variable listVar = Variable.value("v-list", "list", "page", ZERO);
    private final Variable cardVar = Variable.value("v-card", "card", "card", ZERO);
    private final Variable siblingVar = Variable.value("v-sibling", "sidebar", "other", ZERO);
    private final List<Variable> all = List.of(rootVar, listItem, listVar, cardVar, siblingVar);

    private ScopeResolver resolver;

    @BeforeEach
    void setUp() {
        FakeInstanceTree tree = new FakeInstanceTree()
                .add("root", "Body")
                .add("list", "ws:collection")
                .add("card", "Box")
                .add("sidebar", "Box");
        resolver = new ScopeResolver(tree, "ws:collection");
    }

    @Test
    @DisplayName("target and ancestor variables are visible, in collection order")
    void ancestorsAreVisible() {
        InstanceSelector selector = InstanceSelector.of("card", "list", "root");

        assertThat(resolver.visibleVariables(selector, all)).containsExactly(rootVar, listItem, listVar, cardVar);
    }

    @Test
    void siblingScopesAreInvisible() {
        assertThat(resolver.visibleVariables(InstanceSelector.of("card", "list", "root"), all))
                .doesNotContain(siblingVar);
    }

    @Test
    @DisplayName("a collection does not see its own item parameter")
    void collectionHidesOwnParameter() {
        InstanceSelector atList = InstanceSelector.of("list", "root");

        assertThat(resolver.visibleVariables(atList, all)).containsExactly(rootVar, listVar);
        assertThat(resolver.isVisible(atList, listItem)).isFalse();
        assertThat(resolver.isVisible(InstanceSelector.of("card", "list", "root"), listItem)).isTrue();
    }

    @Test
    void nonCollectionKeepsOwnParameter() {
        Variable slotParam = Variable.parameter("v-slot", "card", "slot");

        assertThat(resolver.visibleVariables(InstanceSelector.of("card", "list", "root"), List.of(slotParam)))
                .containsExactly(slotParam);
    }

    @Test
    @DisplayName("appending ancestors never hides a visible variable")
    void visibilityIsMonotonicInSelectorLength() {
        List<Variable> shortPath = resolver.visibleVariables(InstanceSelector.of("card"), all);
        List<Variable> longerPath = resolver.visibleVariables(InstanceSelector.of("card", "list"), all);
        List<Variable> fullPath = resolver.visibleVariables(InstanceSelector.of("card", "list", "root"), all);

        assertThat(longerPath).containsAll(shortPath);
        assertThat(fullPath).containsAll(longerPath);
    }
}
