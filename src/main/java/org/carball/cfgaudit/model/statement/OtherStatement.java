package org.carball.cfgaudit.model.statement;

import java.util.Objects;

/**
 * Any statement shape the builder has no dedicated rule for.
 *
 * @param kind structural kind name reported by the parser
 * @param text best-effort source text, may be null
 */
public record OtherStatement(String kind, String text) implements Statement {
    public OtherStatement {
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public String kindName() {
        return kind;
    }
}
