package org.carball.cfgaudit.model.statement;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * if / else. An elif chain is an else body holding exactly one nested {@code Conditional}.
 */
public record Conditional(Expression condition, List<Statement> thenBody, List<Statement> elseBody) implements Statement {
    public Conditional {
        Objects.requireNonNull(condition, "condition");
        thenBody = List.copyOf(Optional.ofNullable(thenBody).orElseGet(List::of));
        elseBody = List.copyOf(Optional.ofNullable(elseBody).orElseGet(List::of));
    }

    public boolean hasElifChain() {
        return elseBody.size() == 1 && elseBody.get(0) instanceof Conditional;
    }
}
