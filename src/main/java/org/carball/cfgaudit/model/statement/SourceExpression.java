package org.carball.cfgaudit.model.statement;

/**
 * Expression carrying its pre-rendered source text.
 */
public record SourceExpression(String kind, String text) implements Expression {
    public SourceExpression {
        kind = kind == null || kind.isBlank() ? "Expression" : kind;
    }

    public static SourceExpression of(String text) {
        return new SourceExpression("Expression", text);
    }

    @Override
    public String render() {
        if (text == null || text.isBlank()) {
            throw new ExpressionRenderingException("No source text for " + kind);
        }
        return text;
    }
}
