package org.carball.cfgaudit.model.statement;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Expression sub-tree as supplied by the parser, together with its capability to render back to text.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = SourceExpression.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = SourceExpression.class, name = "source"),
        @JsonSubTypes.Type(value = CallExpression.class, name = "call")
})
public interface Expression {

    /**
     * Structural kind name of the expression, e.g. "Compare" or "BinaryExpr".
     */
    String kind();

    /**
     * Renders the expression to display text.
     *
     * @throws ExpressionRenderingException when the sub-tree cannot be rendered
     */
    String render();
}
