package org.carball.cfgaudit.parser;

import org.carball.cfgaudit.model.statement.ProgramUnit;

public interface StatementTreeParser {

    String name();

    ProgramUnit parse(String source) throws SourceParseException;
}
