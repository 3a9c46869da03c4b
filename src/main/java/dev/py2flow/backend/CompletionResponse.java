package dev.py2flow.backend;

/**
 * Structured response from a completion backend.
 */
public record CompletionResponse(
    boolean success,
    String responseText,
    String error,
    Long inputTokens,
    Long outputTokens
) {

    public static CompletionResponse ok(String responseText) {
        return new CompletionResponse(true, responseText, null, null, null);
    }

    public static CompletionResponse failed(String error) {
        return new CompletionResponse(false, null, error, null, null);
    }
}
