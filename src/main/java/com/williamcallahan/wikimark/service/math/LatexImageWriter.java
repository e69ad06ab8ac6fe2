package com.williamcallahan.wikimark.service.math;

import org.jfree.svg.SVGGraphics2D;
import org.jfree.svg.SVGHints;
import org.scilab.forge.jlatexmath.ParseException;
import org.scilab.forge.jlatexmath.TeXConstants;
import org.scilab.forge.jlatexmath.TeXFormula;
import org.scilab.forge.jlatexmath.TeXIcon;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Insets;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Draws formulas with JLaTeXMath.
 *
 * <p>Only referenced after {@link MathRasterizer} has confirmed the backend is present, so
 * its imports never load on a classpath without JLaTeXMath.</p>
 */
final class LatexImageWriter {

    private static final float POINTS_PER_INCH = 72f;

    private LatexImageWriter() {}

    static byte[] write(FormulaImageKey request) {
        TeXIcon icon = createIcon(request);
        int width = Math.max(1, icon.getIconWidth());
        int height = Math.max(1, icon.getIconHeight());
        return switch (request.format()) {
            case PNG -> writePng(icon, width, height);
            case SVG -> writeSvg(icon, width, height);
        };
    }

    private static TeXIcon createIcon(FormulaImageKey request) {
        try {
            TeXFormula formula = new TeXFormula(request.expression());
            float pixelSize = request.fontSize() * request.dpi() / POINTS_PER_INCH;
            TeXIcon icon = formula.createTeXIcon(TeXConstants.STYLE_DISPLAY, pixelSize);
            icon.setInsets(new Insets(0, 0, 0, 0));
            icon.setForeground(Color.BLACK);
            return icon;
        } catch (ParseException parseException) {
            throw new MathRenderingException("Invalid math expression: " + parseException.getMessage(), parseException);
        }
    }

    // Transparent background: TYPE_INT_ARGB starts fully transparent.
    private static byte[] writePng(TeXIcon icon, int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            icon.paintIcon(null, graphics, 0, 0);
        } finally {
            graphics.dispose();
        }
        try (ByteArrayOutputStream imageBytes = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", imageBytes);
            return imageBytes.toByteArray();
        } catch (IOException ioException) {
            throw new MathRenderingException("Failed to encode PNG image", ioException);
        }
    }

    private static byte[] writeSvg(TeXIcon icon, int width, int height) {
        SVGGraphics2D graphics = new SVGGraphics2D(width, height);
        // Glyphs as outlines so the SVG does not depend on installed fonts.
        graphics.setRenderingHint(SVGHints.KEY_DRAW_STRING_TYPE, SVGHints.VALUE_DRAW_STRING_TYPE_VECTOR);
        icon.paintIcon(null, graphics, 0, 0);
        return graphics.getSVGDocument().getBytes(StandardCharsets.UTF_8);
    }
}
