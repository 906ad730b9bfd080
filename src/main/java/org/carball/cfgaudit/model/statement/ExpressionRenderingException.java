package org.carball.cfgaudit.model.statement;

/**
 * Raised by {@link Expression#render()} when an expression cannot be turned into display text.
 */
public class ExpressionRenderingException extends RuntimeException {

    public ExpressionRenderingException(String message) {
        super(message);
    }
}
