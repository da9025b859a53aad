package com.compara.exception;

/**
 * The credit ledger could not be read or written.
 */
public class LedgerException extends ComparaException {

    public LedgerException(String message, Throwable cause) {
        super("LEDGER_ERROR", message, cause);
    }
}
