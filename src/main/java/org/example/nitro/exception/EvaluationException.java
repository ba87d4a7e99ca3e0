package org.example.nitro.exception;

/**
 * Exception thrown by a package evaluator when it cannot preload, describe or
 * evaluate a package.
 */
public class EvaluationException extends NitroException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
