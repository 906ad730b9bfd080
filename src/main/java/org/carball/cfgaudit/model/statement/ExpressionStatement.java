package org.carball.cfgaudit.model.statement;

import java.util.Objects;

public record ExpressionStatement(Expression expression) implements Statement {
    public ExpressionStatement {
        Objects.requireNonNull(expression, "expression");
    }

    public boolean isCall() {
        return expression instanceof CallExpression;
    }
}
