package org.carball.cfgaudit.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.cfgaudit.model.statement.ProgramUnit;
import org.carball.cfgaudit.model.statement.Statement;

import java.util.List;

/**
 * Reads a statement tree serialized as JSON by an external parser.
 * The root is normally a {@code "program"} node; any other statement is wrapped into a program.
 */
@Slf4j
public class JsonStatementTreeParser implements StatementTreeParser {

    private final ObjectMapper objectMapper;

    public JsonStatementTreeParser() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public ProgramUnit parse(String source) throws SourceParseException {
        if (source == null || source.isBlank()) {
            throw new SourceParseException("Statement tree document is empty");
        }
        try {
            Statement root = objectMapper.readValue(source, Statement.class);
            if (root == null) {
                throw new SourceParseException("Statement tree document is empty");
            }
            if (root instanceof ProgramUnit program) {
                log.debug("Read program with {} top-level statements", program.body().size());
                return program;
            }
            return new ProgramUnit(List.of(root));
        } catch (JsonProcessingException e) {
            log.warn("Invalid statement tree: {}", e.getOriginalMessage());
            throw new SourceParseException("Invalid statement tree: " + e.getOriginalMessage(), e);
        }
    }
}
