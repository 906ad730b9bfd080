package org.carball.cfgaudit.model.statement;

import java.util.Objects;

/**
 * {@code target op= value}; the operator is stored without the trailing '=' (e.g. "+").
 */
public record AugmentedAssignment(Expression target, String operator, Expression value) implements Statement {
    public AugmentedAssignment {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }
}
