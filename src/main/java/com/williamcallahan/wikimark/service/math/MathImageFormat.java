package com.williamcallahan.wikimark.service.math;

import java.util.Locale;

/**
 * Output formats supported by {@link MathRasterizer}.
 */
public enum MathImageFormat {
    PNG("image/png"),
    SVG("image/svg+xml");

    private final String mediaType;

    MathImageFormat(String mediaType) {
        this.mediaType = mediaType;
    }

    public String mediaType() {
        return mediaType;
    }

    /**
     * Parses a case-insensitive format name.
     *
     * @param name {@code png} or {@code svg}
     * @return matching format
     * @throws IllegalArgumentException for any other name
     */
    public static MathImageFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Math image format must not be blank");
        }
        try {
            return valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknownFormat) {
            throw new IllegalArgumentException("Unsupported math image format: " + name, unknownFormat);
        }
    }
}
