package org.carball.cfgaudit.model.statement;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Iteration over a collection: {@code for target in iterable}.
 */
public record ForLoop(Expression target, Expression iterable, List<Statement> body) implements Statement {
    public ForLoop {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(iterable, "iterable");
        body = List.copyOf(Optional.ofNullable(body).orElseGet(List::of));
    }
}
