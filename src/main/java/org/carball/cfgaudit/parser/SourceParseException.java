package org.carball.cfgaudit.parser;

/**
 * The external parser could not produce a statement tree; no graph is built for the source.
 */
public class SourceParseException extends Exception {

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
