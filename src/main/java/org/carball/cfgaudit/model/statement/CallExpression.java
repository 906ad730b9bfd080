package org.carball.cfgaudit.model.statement;

import java.util.Objects;

/**
 * A call. {@code callee} is the called name, possibly qualified ("System.out.println").
 */
public record CallExpression(String callee, String text) implements Expression {
    public CallExpression {
        Objects.requireNonNull(callee, "callee");
    }

    public static CallExpression of(String callee, String text) {
        return new CallExpression(callee, text);
    }

    /**
     * Last segment of a qualified callee name.
     */
    public String simpleName() {
        int dot = callee.lastIndexOf('.');
        return dot >= 0 ? callee.substring(dot + 1) : callee;
    }

    @Override
    public String kind() {
        return "Call";
    }

    @Override
    public String render() {
        if (text == null || text.isBlank()) {
            throw new ExpressionRenderingException("No source text for call to " + callee);
        }
        return text;
    }
}
