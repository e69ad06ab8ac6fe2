package com.williamcallahan.wikimark.service.markdown;

import java.util.List;
import java.util.Objects;

/**
 * Binds a fence language tag to the CSS class of its passthrough {@code <div>}.
 *
 * @param language fence language tag, e.g. {@code math}
 * @param cssClass class placed first on the rendered element
 */
public record CustomFence(String language, String cssClass) {

    /** Math fences, rendered later by a math-aware page assembler. */
    public static final CustomFence MATH = new CustomFence("math", "arithmatex");

    /** Confluence Storage Format passthrough fences. */
    public static final CustomFence STORAGE_FORMAT = new CustomFence("csf", "csf");

    public CustomFence {
        Objects.requireNonNull(language, "Fence language cannot be null");
        Objects.requireNonNull(cssClass, "Fence CSS class cannot be null");
    }

    /**
     * Returns the fences registered when nothing else is configured.
     */
    public static List<CustomFence> defaults() {
        return List.of(MATH, STORAGE_FORMAT);
    }
}
