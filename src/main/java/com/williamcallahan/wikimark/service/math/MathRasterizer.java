package com.williamcallahan.wikimark.service.math;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;

/**
 * Renders math expressions as transparent PNG or SVG images in display style.
 *
 * <p>The JLaTeXMath backend is optional. Without it every call fails with
 * {@link MathRenderingUnavailableException}; conversion of the surrounding document is not
 * affected because math fences are emitted as passthrough markup either way.</p>
 */
public class MathRasterizer {

    private static final Logger logger = LoggerFactory.getLogger(MathRasterizer.class);

    static final String BACKEND_CLASS = "org.scilab.forge.jlatexmath.TeXFormula";
    private static final String INSTALL_HINT =
        "Math rendering backend not installed; add org.scilab.forge:jlatexmath (and org.jfree:org.jfree.svg for SVG) to the classpath";

    public static final int DEFAULT_DPI = 100;
    public static final int DEFAULT_FONT_SIZE = 12;

    private final boolean backendAvailable;
    private final Cache<FormulaImageKey, byte[]> imageCache;

    /**
     * Creates a rasterizer that checks the classpath for the backend.
     *
     * @param cacheSize maximum number of rendered images kept in memory
     */
    public MathRasterizer(int cacheSize) {
        this(cacheSize, ClassUtils.isPresent(BACKEND_CLASS, MathRasterizer.class.getClassLoader()));
    }

    MathRasterizer(int cacheSize, boolean backendAvailable) {
        if (cacheSize < 1) {
            throw new IllegalArgumentException("Math image cache size must be greater than 0");
        }
        this.backendAvailable = backendAvailable;
        this.imageCache = Caffeine.newBuilder()
            .maximumSize(cacheSize)
            .build();
        if (backendAvailable) {
            logger.info("Math rasterizer ready (cache size {})", cacheSize);
        } else {
            logger.warn(INSTALL_HINT);
        }
    }

    /**
     * Reports whether the rendering backend is present.
     */
    public boolean isAvailable() {
        return backendAvailable;
    }

    /**
     * Renders an expression with default resolution and font size.
     */
    public byte[] renderMath(String expression, MathImageFormat format) {
        return renderMath(expression, format, DEFAULT_DPI, DEFAULT_FONT_SIZE);
    }

    /**
     * Renders an expression.
     *
     * @param expression LaTeX math expression without surrounding dollars, e.g. {@code \frac{a}{b}}
     * @param format output format
     * @param dpi output resolution, at least 1
     * @param fontSize font size in points, at least 1
     * @return encoded image bytes (a fresh copy on every call)
     * @throws MathRenderingUnavailableException when the backend is missing
     * @throws MathRenderingException when the expression cannot be rendered
     */
    public byte[] renderMath(String expression, MathImageFormat format, int dpi, int fontSize) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Math expression must not be blank");
        }
        if (format == null) {
            throw new IllegalArgumentException("Math image format must not be null");
        }
        if (dpi < 1) {
            throw new IllegalArgumentException("Math image dpi must be greater than 0");
        }
        if (fontSize < 1) {
            throw new IllegalArgumentException("Math font size must be greater than 0");
        }
        if (!backendAvailable) {
            throw new MathRenderingUnavailableException(INSTALL_HINT);
        }
        FormulaImageKey key = new FormulaImageKey(expression, format, dpi, fontSize);
        byte[] image = imageCache.get(key, LatexImageWriter::write);
        logger.debug("Rendered {} math image ({} bytes) for expression of length {}",
            format, image.length, expression.length());
        return image.clone();
    }

    /**
     * Returns how many rendered images are currently cached.
     */
    public long cachedImageCount() {
        return imageCache.estimatedSize();
    }
}
