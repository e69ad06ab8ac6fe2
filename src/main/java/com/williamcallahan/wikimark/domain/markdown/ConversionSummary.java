package com.williamcallahan.wikimark.domain.markdown;

/**
 * Counts the custom constructs rendered while converting one document.
 */
public record ConversionSummary(int emoji, int passthroughFences, int inlineMath, int displayMath) {
    public ConversionSummary {
        if (emoji < 0 || passthroughFences < 0 || inlineMath < 0 || displayMath < 0) {
            throw new IllegalArgumentException("Conversion counts must be non-negative");
        }
    }
}
