package com.compara.exception;

/**
 * The comparison request is malformed or cannot be served by the selected models.
 */
public class InputValidationException extends ComparaException {

    public InputValidationException(String message) {
        super("INVALID_INPUT", message);
    }
}
