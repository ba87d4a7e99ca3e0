package org.example.nitro.exception;

/**
 * Base exception for all package layer errors.
 */
public class NitroException extends Exception {

    public NitroException(String message) {
        super(message);
    }

    public NitroException(String message, Throwable cause) {
        super(message, cause);
    }
}
