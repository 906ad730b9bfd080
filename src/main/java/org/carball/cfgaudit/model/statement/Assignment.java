package org.carball.cfgaudit.model.statement;

import java.util.List;
import java.util.Objects;

/**
 * {@code a = b = value}. Chained targets are kept in source order.
 */
public record Assignment(List<Expression> targets, Expression value) implements Statement {
    public Assignment {
        targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        Objects.requireNonNull(value, "value");
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("Assignment needs at least one target");
        }
    }
}
