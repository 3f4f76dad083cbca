package io.scopebind.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One step of an action prop.
 *
 * @param args names of the arguments the step receives when the action fires
 * @param code effectful expression text
 */
public record ActionStep(List<String> args, String code) {

    public ActionStep {
        args = args == null ? List.of() : List.copyOf(args);
        Objects.requireNonNull(code, "code must not be null");
    }
}
