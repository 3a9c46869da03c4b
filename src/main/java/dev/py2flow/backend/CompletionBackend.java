package dev.py2flow.backend;

import java.time.Duration;

/**
 * Abstraction over text-completion services used by the model-backed
 * analyzer. Implementations own transport, credentials and retries; none is
 * shipped with the engine.
 */
public interface CompletionBackend {

    /**
     * Send a prompt and wait for the completion.
     *
     * @param prompt  the full prompt text, including the answer format block
     * @param model   backend-specific model identifier, or null for {@link #defaultModel()}
     * @param timeout upper bound for the call; the backend must give up after it
     * @return structured response; failures are reported in the response, not thrown
     */
    CompletionResponse complete(String prompt, String model, Duration timeout);

    /** Backend display name, also accepted as {@code default_provider}. */
    String getName();

    /** Model used when the caller passes none, or null for the service default. */
    String defaultModel();
}
