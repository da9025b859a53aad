package com.compara.exception;

import java.util.List;

/**
 * One or more requested models are not available on the caller's tier.
 */
public class ModelAccessDeniedException extends ComparaException {

    private final List<String> restrictedModels;

    public ModelAccessDeniedException(String message, List<String> restrictedModels) {
        super("MODEL_NOT_AVAILABLE", message);
        this.restrictedModels = List.copyOf(restrictedModels);
    }

    public List<String> getRestrictedModels() {
        return restrictedModels;
    }
}
