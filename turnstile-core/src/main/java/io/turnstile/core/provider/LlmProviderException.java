package io.turnstile.core.provider;

/**
 * Raised when a completion engine cannot produce a usable response: transport failure, non-2xx
 * status after retries, unparseable body, or malformed tool requests.
 */
public class LlmProviderException extends RuntimeException {
    private final String provider;

    public LlmProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public LlmProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
