package org.carball.cfgaudit.model.statement;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record WhileLoop(Expression condition, List<Statement> body) implements Statement {
    public WhileLoop {
        Objects.requireNonNull(condition, "condition");
        body = List.copyOf(Optional.ofNullable(body).orElseGet(List::of));
    }
}
