package com.compara.exception;

/**
 * Admission denied: the identity has no credits left for the current period.
 */
public class InsufficientCreditsException extends ComparaException {

    private final long creditsAllocated;

    public InsufficientCreditsException(String message, long creditsAllocated) {
        super("INSUFFICIENT_CREDITS", message);
        this.creditsAllocated = creditsAllocated;
    }

    public long getCreditsAllocated() {
        return creditsAllocated;
    }
}
