package com.compara.exception;

/**
 * Base exception for all business failures, tagged with a stable error code.
 */
public class ComparaException extends RuntimeException {

    private final String errorCode;

    public ComparaException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ComparaException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
