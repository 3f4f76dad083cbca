package io.scopebind.core.engine;

import static io.scopebind.core.expression.VariableIdentifiers.encode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.scopebind.core.config.BindingsConfig;
import io.scopebind.core.error.DeletionBlockedException;
import io.scopebind.core.model.InstanceSelector;
import io.scopebind.core.model.Prop;
import io.scopebind.core.model.PropKind;
import io.scopebind.core.model.PropMeta;
import io.scopebind.core.model.PropValue;
import io.scopebind.core.model.ValueType;
import io.scopebind.core.model.Variable;
import io.scopebind.core.model.VariableListItem;
import io.scopebind.core.spi.TransactionListener.CommittedTransaction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * End-to-end tests for {@link BindingEngine}: a variable is created through an edit session,
 * bound into a prop, protected from deletion while in use, then deleted once unbound.
 */
class BindingEngineTest {

    private static final InstanceSelector AT_BOX = InstanceSelector.of("box", "body");
    private static final PropMeta REQUIRED_NUMBER = new PropMeta(ValueType.NUMBER, true, null);

    private final List<CommittedTransaction> committed = new ArrayList<>();
    private BindingEngine engine;

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        engine = BindingEngine.builder()
                .config(BindingsConfig.DEFAULT)
                .instanceTree(new FakeInstanceTree().add("body", "Body").add("box", "Box"))
                .valueProvider(selector -> Map.of())
                .idGenerator(() -> "id" + ids.incrementAndGet())
                .transactionListener(committed::add)
                .build();
    }

    @Test
    void variableLifecycleThroughBindingAndDeletion() {
        // --- create ---
        VariableEditSession session = engine.openSession(() -> Optional.of(AT_BOX));
        session.open();
        session.add();
        assertThat(session.save("count", "0")).isEmpty();

        Variable count = engine.variables().visibleVariables(AT_BOX).get(0);
        assertThat(count.name()).isEqualTo("count");
        assertThat(count.scopeInstanceId()).isEqualTo("box");

        // --- bind ---
        Prop prop = engine.props().bindVariable(AT_BOX, null, "text", count.id());
        assertThat(prop.value().expression()).isEqualTo(encode(count.id()));
        assertThat(engine.props().expressionVariables(prop.id())).containsExactly(count.id());

        // --- delete blocked ---
        assertThatThrownBy(() -> engine.variables().deleteVariable(count.id()))
                .isInstanceOf(DeletionBlockedException.class)
                .hasMessageContaining("count");
        assertThat(engine.store().snapshot().variable(count.id())).isNotNull();

        // --- unbind, then delete ---
        Optional<Prop> cleared = engine.props().clearBinding(AT_BOX, prop.id(), "text", REQUIRED_NUMBER);
        assertThat(cleared).map(Prop::kind).contains(PropKind.LITERAL);

        engine.variables().deleteVariable(count.id());
        assertThat(engine.store().snapshot().variable(count.id())).isNull();
        assertThat(committed).hasSize(4);
    }

    @Test
    void committedValuesCannotBeChangedOutsideTransactions() {
        Variable list = engine.variables().saveValueVariable(AT_BOX, null, "list", "[1]");
        int commits = committed.size();

        ((ArrayNode) engine.store().snapshot().variable(list.id()).value().value()).add(2);

        assertThat(engine.store().snapshot().variable(list.id()).value().value()).hasSize(1);
        assertThat(committed).hasSize(commits);
    }

    @Test
    void committedResourceAndLiteralNodesAreCopies() {
        Variable posts = engine.variables()
                .saveResourceVariable(AT_BOX, null, "posts", JsonNodeFactory.instance.objectNode().put("url", "/a"));
        Prop prop = engine.props()
                .setPropValue(AT_BOX, null, "items", PropValue.literal(JsonNodeFactory.instance.arrayNode().add(1)));

        ((ObjectNode) engine.store().snapshot().resource(posts.resourceId()).descriptor()).put("url", "/b");
        ((ArrayNode) engine.store().snapshot().prop(prop.id()).value().literal()).removeAll();

        assertThat(engine.store().snapshot().resource(posts.resourceId()).descriptor().get("url").asText())
                .isEqualTo("/a");
        assertThat(engine.store().snapshot().prop(prop.id()).value().literal()).hasSize(1);
    }

    @Test
    void listMarksSelectedAndDeletableEntries() {
        Variable count = engine.variables().saveValueVariable(AT_BOX, null, "count", "3");
        Variable flag = engine.variables().saveValueVariable(AT_BOX, null, "flag", "true");
        Prop prop = engine.props().bindVariable(AT_BOX, null, "text", count.id());

        List<VariableListItem> items = engine.listVariables(AT_BOX, prop.id());

        assertThat(items).extracting(VariableListItem::label).containsExactly("count: 3", "flag: true");
        assertThat(items).extracting(VariableListItem::selected).containsExactly(true, false);
        assertThat(items).extracting(VariableListItem::deletable).containsExactly(false, true);
        assertThat(items.get(1).variable()).isEqualTo(flag);
    }

    @Test
    void listWithoutPropSelectsNothing() {
        engine.variables().saveValueVariable(AT_BOX, null, "count", "3");

        assertThat(engine.listVariables(AT_BOX, null)).extracting(VariableListItem::selected).containsExactly(false);
    }

    @Test
    void initialStateSeedsTheStore() {
        StoreSnapshot seeded = StoreSnapshot.builder()
                .addVariable(Variable.parameter("item", "box", "item"))
                .build();
        BindingEngine seededEngine = BindingEngine.builder()
                .instanceTree(new FakeInstanceTree().add("box", "Box"))
                .initialState(seeded)
                .build();

        assertThat(seededEngine.store().snapshot()).isSameAs(seeded);
        assertThat(seededEngine.config()).isEqualTo(BindingsConfig.DEFAULT);
    }

    @Test
    void builderRequiresInstanceTree() {
        assertThatThrownBy(() -> BindingEngine.builder().build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("instanceTree is required");
    }
}
