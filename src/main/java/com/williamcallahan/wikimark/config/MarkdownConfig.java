package com.williamcallahan.wikimark.config;

import com.williamcallahan.wikimark.service.markdown.CustomFence;

import java.util.List;
import java.util.Locale;

/**
 * Custom fence configuration for the markdown engine.
 */
public class MarkdownConfig {

    private static final String MATH_FENCE_DEF = "math";
    private static final String MATH_CLASS_DEF = "arithmatex";
    private static final String PASSTHROUGH_FENCE_DEF = "csf";
    private static final String PASSTHROUGH_CLASS_DEF = "csf";
    private static final String MATH_FENCE_KEY = "app.markdown.math-fence";
    private static final String MATH_CLASS_KEY = "app.markdown.math-css-class";
    private static final String PASSTHROUGH_FENCE_KEY = "app.markdown.passthrough-fence";
    private static final String PASSTHROUGH_CLASS_KEY = "app.markdown.passthrough-css-class";
    private static final String NULL_TEXT_FMT = "%s must not be null.";
    private static final String BLANK_TEXT_FMT = "%s must not be blank.";
    private static final String DUPLICATE_FENCE_FMT = "%s and %s must name different fences (both are '%s').";

    private String mathFence = MATH_FENCE_DEF;
    private String mathCssClass = MATH_CLASS_DEF;
    private String passthroughFence = PASSTHROUGH_FENCE_DEF;
    private String passthroughCssClass = PASSTHROUGH_CLASS_DEF;

    /**
     * Validates fence settings.
     */
    public void validateConfiguration() {
        requireNonBlank(MATH_FENCE_KEY, mathFence);
        requireNonBlank(MATH_CLASS_KEY, mathCssClass);
        requireNonBlank(PASSTHROUGH_FENCE_KEY, passthroughFence);
        requireNonBlank(PASSTHROUGH_CLASS_KEY, passthroughCssClass);
        if (mathFence.strip().equals(passthroughFence.strip())) {
            throw new IllegalStateException(String.format(Locale.ROOT, DUPLICATE_FENCE_FMT,
                MATH_FENCE_KEY, PASSTHROUGH_FENCE_KEY, mathFence.strip()));
        }
    }

    /**
     * Returns the configured fences, math first.
     *
     * @return custom fences for the engine
     */
    public List<CustomFence> customFences() {
        return List.of(
            new CustomFence(mathFence.strip(), mathCssClass.strip()),
            new CustomFence(passthroughFence.strip(), passthroughCssClass.strip()));
    }

    public String getMathFence() {
        return mathFence;
    }

    public void setMathFence(final String mathFence) {
        this.mathFence = requireNonNullText(MATH_FENCE_KEY, mathFence);
    }

    public String getMathCssClass() {
        return mathCssClass;
    }

    public void setMathCssClass(final String mathCssClass) {
        this.mathCssClass = requireNonNullText(MATH_CLASS_KEY, mathCssClass);
    }

    public String getPassthroughFence() {
        return passthroughFence;
    }

    public void setPassthroughFence(final String passthroughFence) {
        this.passthroughFence = requireNonNullText(PASSTHROUGH_FENCE_KEY, passthroughFence);
    }

    public String getPassthroughCssClass() {
        return passthroughCssClass;
    }

    public void setPassthroughCssClass(final String passthroughCssClass) {
        this.passthroughCssClass = requireNonNullText(PASSTHROUGH_CLASS_KEY, passthroughCssClass);
    }

    private static void requireNonBlank(final String propertyKey, final String text) {
        requireNonNullText(propertyKey, text);
        if (text.isBlank()) {
            throw new IllegalStateException(String.format(Locale.ROOT, BLANK_TEXT_FMT, propertyKey));
        }
    }

    private static String requireNonNullText(final String propertyKey, final String text) {
        if (text == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, propertyKey));
        }
        return text;
    }
}
