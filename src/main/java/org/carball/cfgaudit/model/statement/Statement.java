package org.carball.cfgaudit.model.statement;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of the statement tree handed over by an external parser.
 * The {@code type} property selects the concrete statement when the tree is read from JSON.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProgramUnit.class, name = "program"),
        @JsonSubTypes.Type(value = FunctionDefinition.class, name = "function"),
        @JsonSubTypes.Type(value = Conditional.class, name = "if"),
        @JsonSubTypes.Type(value = WhileLoop.class, name = "while"),
        @JsonSubTypes.Type(value = ForLoop.class, name = "for"),
        @JsonSubTypes.Type(value = ReturnStatement.class, name = "return"),
        @JsonSubTypes.Type(value = Assignment.class, name = "assign"),
        @JsonSubTypes.Type(value = AugmentedAssignment.class, name = "aug_assign"),
        @JsonSubTypes.Type(value = ExpressionStatement.class, name = "expr"),
        @JsonSubTypes.Type(value = OtherStatement.class, name = "other")
})
public interface Statement {

    /**
     * Structural kind name, used as a placeholder when nothing better can be displayed.
     */
    default String kindName() {
        return getClass().getSimpleName();
    }
}
