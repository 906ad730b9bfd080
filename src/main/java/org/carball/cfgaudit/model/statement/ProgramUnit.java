package org.carball.cfgaudit.model.statement;

import java.util.List;
import java.util.Optional;

public record ProgramUnit(List<Statement> body) implements Statement {
    public ProgramUnit {
        body = List.copyOf(Optional.ofNullable(body).orElseGet(List::of));
    }
}
