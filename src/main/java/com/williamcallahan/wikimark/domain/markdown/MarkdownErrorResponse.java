package com.williamcallahan.wikimark.domain.markdown;

import java.util.Objects;

/**
 * Describes a rendering failure returned to HTTP callers.
 */
public record MarkdownErrorResponse(String error, String details) implements MarkdownRenderResponse {
    public MarkdownErrorResponse {
        Objects.requireNonNull(error, "Error message cannot be null");
        details = details == null ? "" : details;
    }
}
