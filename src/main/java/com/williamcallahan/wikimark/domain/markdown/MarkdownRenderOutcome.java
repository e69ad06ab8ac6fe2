package com.williamcallahan.wikimark.domain.markdown;

import java.util.Objects;

/**
 * Describes the outcome of rendering markdown to a wiki HTML fragment.
 */
public record MarkdownRenderOutcome(String html, String source) implements MarkdownRenderResponse {
    public MarkdownRenderOutcome {
        Objects.requireNonNull(html, "Rendered HTML cannot be null");
        Objects.requireNonNull(source, "Render source cannot be null");
    }
}
