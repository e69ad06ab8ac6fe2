package com.williamcallahan.wikimark.config;

import com.williamcallahan.wikimark.service.math.MathImageFormat;

import java.util.Locale;

/**
 * Math image rendering configuration.
 */
public class MathRenderingConfig {

    private static final String FORMAT_DEF = "png";
    private static final int DPI_DEF = 100;
    private static final int FONT_SIZE_DEF = 12;
    private static final int CACHE_SIZE_DEF = 256;
    private static final int MIN_POSITIVE = 1;
    private static final String FORMAT_KEY = "app.math.format";
    private static final String DPI_KEY = "app.math.dpi";
    private static final String FONT_SIZE_KEY = "app.math.font-size";
    private static final String CACHE_SIZE_KEY = "app.math.cache-size";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String FORMAT_FMT = "%s must be png or svg (was '%s').";

    private String format = FORMAT_DEF;
    private int dpi = DPI_DEF;
    private int fontSize = FONT_SIZE_DEF;
    private int cacheSize = CACHE_SIZE_DEF;

    /**
     * Validates math rendering settings.
     */
    public void validateConfiguration() {
        requirePositive(DPI_KEY, dpi);
        requirePositive(FONT_SIZE_KEY, fontSize);
        requirePositive(CACHE_SIZE_KEY, cacheSize);
        try {
            MathImageFormat.fromName(format);
        } catch (IllegalArgumentException invalidFormat) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, FORMAT_FMT, FORMAT_KEY, format), invalidFormat);
        }
    }

    /**
     * Returns the default image format as an enum value.
     *
     * @return parsed default format
     */
    public MathImageFormat defaultFormat() {
        return MathImageFormat.fromName(format);
    }

    public String getFormat() { return format; }
    public void setFormat(final String format) { this.format = format; }

    public int getDpi() { return dpi; }
    public void setDpi(final int dpi) { this.dpi = dpi; }

    public int getFontSize() { return fontSize; }
    public void setFontSize(final int fontSize) { this.fontSize = fontSize; }

    public int getCacheSize() { return cacheSize; }
    public void setCacheSize(final int cacheSize) { this.cacheSize = cacheSize; }

    private static void requirePositive(final String propertyKey, final int value) {
        if (value < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
