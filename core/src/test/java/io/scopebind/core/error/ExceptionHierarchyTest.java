package io.scopebind.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.scopebind.core.error.BindingException.Phase;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Verifies the exception hierarchy: abstract parents, phases and carried details. */
class ExceptionHierarchyTest {

    // --- structure ---

    @Test
    void parentsAreAbstract() {
        assertThat(Modifier.isAbstract(BindingException.class.getModifiers())).isTrue();
        assertThat(Modifier.isAbstract(ExpressionException.class.getModifiers())).isTrue();
        assertThat(Modifier.isAbstract(StoreException.class.getModifiers())).isTrue();
    }

    @Test
    void everythingIsUnchecked() {
        assertThat(RuntimeException.class).isAssignableFrom(BindingException.class);
        assertThat(ExpressionException.class.getSuperclass()).isEqualTo(BindingException.class);
        assertThat(StoreException.class.getSuperclass()).isEqualTo(BindingException.class);
    }

    // --- expression errors ---

    @Test
    void parseErrorCarriesPosition() {
        var e = new ExpressionParseException("Unexpected token", "a +", 3);

        assertThat(e).isInstanceOf(ExpressionException.class);
        assertThat(e.phase()).isEqualTo(Phase.VALIDATION);
        assertThat(e.position()).isEqualTo(3);
        assertThat(e.expression()).isEqualTo("a +");
        assertThat(e.detail()).isEqualTo("Unexpected token");
    }

    @Test
    void unknownIdentifierNamesTheIdentifier() {
        var e = new UnknownIdentifierException("$ws$dataSource$x", "$ws$dataSource$x + 1");

        assertThat(e.phase()).isEqualTo(Phase.VALIDATION);
        assertThat(e.identifier()).isEqualTo("$ws$dataSource$x");
        assertThat(e.getMessage()).isEqualTo("Unknown variable \"$ws$dataSource$x\"");
    }

    @Test
    void evaluationErrorsHaveEvaluationPhase() {
        var eval = new ExpressionEvalException("Division failed", "1 / x");
        var dependent = new ValueDependsOnVariablesException(List.of("a", "b"), "a + b");

        assertThat(eval.phase()).isEqualTo(Phase.EVALUATION);
        assertThat(dependent.phase()).isEqualTo(Phase.EVALUATION);
        assertThat(dependent.identifiers()).containsExactly("a", "b");
        assertThat(dependent.getMessage()).isEqualTo("Cannot use variables a, b as variable value");
    }

    // --- store errors ---

    @Test
    void storeErrorsHaveCommitPhase() {
        var invalid = new InvalidVariableException("Variable name is required");
        var blocked = new DeletionBlockedException("v1", "count", Set.of("p1", "p2"));
        var aborted = new TransactionAbortException("aborted", invalid, List.of("variables"));

        assertThat(invalid.phase()).isEqualTo(Phase.COMMIT);
        assertThat(blocked.phase()).isEqualTo(Phase.COMMIT);
        assertThat(aborted.phase()).isEqualTo(Phase.COMMIT);
        assertThat(aborted.getCause()).isSameAs(invalid);
        assertThat(aborted.collections()).containsExactly("variables");
    }

    @Test
    void deletionBlockedNamesVariableAndProps() {
        var e = new DeletionBlockedException("v1", "count", Set.of("p1", "p2"));

        assertThat(e.variableId()).isEqualTo("v1");
        assertThat(e.propIds()).containsExactlyInAnyOrder("p1", "p2");
        assertThat(e.getMessage()).isEqualTo("Variable \"count\" is used by 2 prop(s) and cannot be deleted");
    }
}
