package tech.noetzold.waf_api.client;

/**
 * A chat-style model endpoint: one system instruction, one user message, text back.
 */
public interface LanguageEngine {

    /** Label recorded as the classifier of verdicts this engine produces. */
    String name();

    /** False when no credential is set; callers skip the engine entirely. */
    boolean isConfigured();

    /**
     * @throws EngineException on transport failures, non-2xx replies or an empty body
     */
    String complete(String systemPrompt, String userMessage, int maxTokens);
}
