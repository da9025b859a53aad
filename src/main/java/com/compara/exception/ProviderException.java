package com.compara.exception;

/**
 * Failure reported by (or while talking to) an upstream model provider.
 */
public class ProviderException extends ComparaException {

    private final Integer statusCode;
    private final String providerError;
    private final String providerName;

    public ProviderException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    public ProviderException(String message, Integer statusCode, String providerError,
                             String providerName, Throwable cause) {
        super("PROVIDER_ERROR", message, cause);
        this.statusCode = statusCode;
        this.providerError = providerError;
        this.providerName = providerName;
    }

    /**
     * HTTP status returned by the provider, if any.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Raw error text forwarded from the underlying provider behind a gateway.
     */
    public String getProviderError() {
        return providerError;
    }

    public String getProviderName() {
        return providerName;
    }
}
