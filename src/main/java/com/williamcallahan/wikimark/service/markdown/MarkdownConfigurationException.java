package com.williamcallahan.wikimark.service.markdown;

/**
 * Signals that the markdown engine cannot be built from its configuration.
 *
 * <p>Thrown during startup only; a misconfigured engine would silently mis-render every
 * document, so callers must not recover from it.</p>
 */
public class MarkdownConfigurationException extends IllegalStateException {

    /**
     * Creates a configuration exception with a summary.
     *
     * @param message failure summary
     */
    public MarkdownConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates a configuration exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public MarkdownConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
