package org.carball.cfgaudit.model.statement;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record FunctionDefinition(String name, List<String> parameters, List<Statement> body) implements Statement {
    public FunctionDefinition {
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(Optional.ofNullable(parameters).orElseGet(List::of));
        body = List.copyOf(Optional.ofNullable(body).orElseGet(List::of));
    }
}
