package com.williamcallahan.wikimark.service.math;

import java.util.Objects;

/**
 * Identifies one rendered image; used as the cache key.
 */
record FormulaImageKey(String expression, MathImageFormat format, int dpi, int fontSize) {
    FormulaImageKey {
        Objects.requireNonNull(expression, "Math expression cannot be null");
        Objects.requireNonNull(format, "Math image format cannot be null");
    }
}
