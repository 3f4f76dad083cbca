package io.scopebind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.scopebind.core.error.BindingException;
import io.scopebind.core.error.TransactionAbortException;
import io.scopebind.core.model.InstanceSelector;
import io.scopebind.core.model.Variable;
import io.scopebind.core.model.VariableKind;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one variable-editing session:
 * {@code CLOSED -> EDITING_LIST -> EDITING_ONE(VALUE | RESOURCE) -> CLOSED}.
 *
 * <p>
 * {@link #save} always attempts the write. It closes the session on success; on failure the
 * session stays in {@code EDITING_ONE} and the error message is kept in {@link #error()}.
 * {@link #cancel} goes back one step without writing anything. Calling an operation in a state
 * that does not allow it throws {@link IllegalStateException}.
 *
 * <p>
 * Not thread-safe: one session per editing user.
 */
public final class VariableEditSession {

    private static final Logger LOG = LoggerFactory.getLogger(VariableEditSession.class);

    static final String NO_INSTANCE_SELECTED = "No instance selected";

    /** Session states. */
    public enum State {
        CLOSED,
        EDITING_LIST,
        EDITING_ONE
    }

    /** Form tab shown while editing one variable. */
    public enum Tab {
        VALUE,
        RESOURCE
    }

    private final VariableService variables;
    private final Supplier<Optional<InstanceSelector>> selectorSource;

    private State state = State.CLOSED;
    private Tab tab = Tab.VALUE;
    private Variable editing;
    private String error;

    /**
     * @param variables      the service performing the writes
     * @param selectorSource supplies the currently selected instance, if any
     */
    public VariableEditSession(VariableService variables, Supplier<Optional<InstanceSelector>> selectorSource) {
        this.variables = Objects.requireNonNull(variables, "variables must not be null");
        this.selectorSource = Objects.requireNonNull(selectorSource, "selectorSource must not be null");
    }

    public State state() {
        return state;
    }

    public Tab tab() {
        return tab;
    }

    /** The variable being edited; empty while adding a new one or outside {@code EDITING_ONE}. */
    public Optional<Variable> editing() {
        return Optional.ofNullable(editing);
    }

    /** The message of the last failed save, if any. */
    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    /** Opens the variables list. */
    public void open() {
        require(State.CLOSED, "open");
        state = State.EDITING_LIST;
    }

    /** Closes the session from any state, discarding unsaved input. */
    public void close() {
        state = State.CLOSED;
        editing = null;
        error = null;
        tab = Tab.VALUE;
    }

    /** Starts adding a new variable on the value tab. */
    public void add() {
        require(State.EDITING_LIST, "add");
        editing = null;
        error = null;
        tab = Tab.VALUE;
        state = State.EDITING_ONE;
    }

    /**
     * Starts editing an existing variable, on the tab matching its kind.
     *
     * @param variable the variable to edit
     */
    public void edit(Variable variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        require(State.EDITING_LIST, "edit");
        editing = variable;
        error = null;
        tab = variable.kind() == VariableKind.RESOURCE ? Tab.RESOURCE : Tab.VALUE;
        state = State.EDITING_ONE;
    }

    /** Switches the form tab. */
    public void selectTab(Tab newTab) {
        require(State.EDITING_ONE, "selectTab");
        tab = Objects.requireNonNull(newTab, "tab must not be null");
    }

    /** Goes back one step: from a single variable to the list, from the list to closed. */
    public void cancel() {
        switch (state) {
            case EDITING_ONE -> {
                editing = null;
                error = null;
                tab = Tab.VALUE;
                state = State.EDITING_LIST;
            }
            case EDITING_LIST -> close();
            case CLOSED -> throw new IllegalStateException("Cannot cancel a closed session");
        }
    }

    /**
     * Saves the form of the value tab. For a parameter only the name is saved and the value text
     * is ignored.
     *
     * @param name      variable name
     * @param valueText literal expression text
     * @return the error message if the save failed, empty on success
     */
    public Optional<String> save(String name, String valueText) {
        require(State.EDITING_ONE, "save");
        if (tab != Tab.VALUE) {
            throw new IllegalStateException("Cannot save a value on the " + tab + " tab");
        }
        return attempt(selector -> {
            if (editing != null && editing.kind() == VariableKind.PARAMETER) {
                variables.renameVariable(editing.id(), name);
            } else {
                variables.saveValueVariable(selector, editing, name, valueText);
            }
        });
    }

    /**
     * Saves the form of the resource tab.
     *
     * @param name       variable name
     * @param descriptor resource descriptor
     * @return the error message if the save failed, empty on success
     */
    public Optional<String> saveResource(String name, JsonNode descriptor) {
        require(State.EDITING_ONE, "saveResource");
        if (tab != Tab.RESOURCE) {
            throw new IllegalStateException("Cannot save a resource on the " + tab + " tab");
        }
        return attempt(selector -> variables.saveResourceVariable(selector, editing, name, descriptor));
    }

    private Optional<String> attempt(Consumer<InstanceSelector> write) {
        Optional<InstanceSelector> selector = selectorSource.get();
        if (selector.isEmpty()) {
            error = NO_INSTANCE_SELECTED;
            return Optional.of(error);
        }
        try {
            write.accept(selector.get());
        } catch (BindingException e) {
            error = messageOf(e);
            LOG.debug("Variable save failed: {}", error);
            return Optional.of(error);
        }
        close();
        return Optional.empty();
    }

    private static String messageOf(BindingException e) {
        if (e instanceof TransactionAbortException && e.getCause() instanceof BindingException cause) {
            return cause.getMessage();
        }
        return e.getMessage();
    }

    private void require(State expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + operation + " in state " + state);
        }
    }
}
