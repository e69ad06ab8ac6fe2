package com.williamcallahan.wikimark.config;

import com.williamcallahan.wikimark.service.markdown.CustomFence;
import com.williamcallahan.wikimark.service.math.MathImageFormat;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Verifies app property validation for fence and math rendering settings.
 */
class AppPropertiesValidationTest {

    @Test
    void defaultsAreValid() {
        AppProperties appProperties = new AppProperties();

        assertDoesNotThrow(appProperties::validateConfiguration);
        assertEquals(CustomFence.defaults(), appProperties.getMarkdown().customFences());
        assertEquals(MathImageFormat.PNG, appProperties.getMath().defaultFormat());
    }

    @Test
    void rejectsNonPositiveDpi() {
        AppProperties appProperties = new AppProperties();
        appProperties.getMath().setDpi(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveFontSizeAndCacheSize() {
        AppProperties fontSizeProperties = new AppProperties();
        fontSizeProperties.getMath().setFontSize(0);
        AppProperties cacheSizeProperties = new AppProperties();
        cacheSizeProperties.getMath().setCacheSize(-1);

        assertThrows(IllegalArgumentException.class, fontSizeProperties::validateConfiguration);
        assertThrows(IllegalArgumentException.class, cacheSizeProperties::validateConfiguration);
    }

    @Test
    void rejectsUnknownFormat() {
        AppProperties appProperties = new AppProperties();
        appProperties.getMath().setFormat("gif");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsIdenticalFenceNames() {
        AppProperties appProperties = new AppProperties();
        appProperties.getMarkdown().setPassthroughFence("math");

        assertThrows(IllegalStateException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsBlankFenceSettings() {
        AppProperties appProperties = new AppProperties();
        appProperties.getMarkdown().setMathCssClass("  ");

        assertThrows(IllegalStateException.class, appProperties::validateConfiguration);
        assertThrows(IllegalArgumentException.class, () -> appProperties.getMarkdown().setMathFence(null));
    }
}
