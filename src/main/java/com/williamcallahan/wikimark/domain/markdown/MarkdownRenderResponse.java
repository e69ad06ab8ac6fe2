package com.williamcallahan.wikimark.domain.markdown;

/**
 * Represents the response variants for markdown rendering endpoints.
 */
public sealed interface MarkdownRenderResponse
    permits MarkdownRenderOutcome, MarkdownErrorResponse {
}
