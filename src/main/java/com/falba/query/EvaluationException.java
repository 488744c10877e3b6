package com.falba.query;

/**
 * The expression could not be evaluated against one run's binding: unknown
 * name, type mismatch, syntax error or a non-boolean result.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
