package com.williamcallahan.wikimark.domain.math;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Requests a rasterized image of a math expression.
 *
 * <p>Format, dpi and font size are optional; null means "use the configured default".</p>
 */
public record MathImageRequest(String expression, String format, Integer dpi, Integer fontSize) {

    @JsonCreator
    public static MathImageRequest create(
            @JsonProperty("expression") String expression,
            @JsonProperty("format") String format,
            @JsonProperty("dpi") Integer dpi,
            @JsonProperty("fontSize") Integer fontSize) {
        return new MathImageRequest(expression == null ? "" : expression, format, dpi, fontSize);
    }
}
