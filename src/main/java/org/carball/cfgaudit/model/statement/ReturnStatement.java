package org.carball.cfgaudit.model.statement;

import java.util.Optional;

/**
 * @param value returned expression, null for a bare return
 */
public record ReturnStatement(Expression value) implements Statement {

    public static ReturnStatement bare() {
        return new ReturnStatement(null);
    }

    public Optional<Expression> valueExpression() {
        return Optional.ofNullable(value);
    }
}
