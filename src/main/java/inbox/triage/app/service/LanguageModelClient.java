package inbox.triage.app.service;

/**
 * Text-in, text-out access to a hosted language model.
 * Implementations make exactly one request per call and never retry.
 */
public interface LanguageModelClient {
    /**
     * Thrown when the provider rejects a request for quota or rate limit reasons.
     */
    class QuotaException extends RuntimeException {
        public QuotaException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Send a prompt and return the raw completion text.
     * @param prompt The full prompt
     * @param maxTokens Upper bound on generated tokens
     * @param temperature Sampling temperature
     * @param jsonOutput Whether the caller expects a JSON object back
     * @return The completion text, never null
     * @throws QuotaException if the provider quota is exceeded
     */
    String complete(String prompt, int maxTokens, double temperature, boolean jsonOutput);

    /**
     * Provider name used in logs.
     */
    String providerName();
}
