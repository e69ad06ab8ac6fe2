package com.williamcallahan.wikimark.web;

import com.williamcallahan.wikimark.config.AppProperties;
import com.williamcallahan.wikimark.config.MathRenderingConfig;
import com.williamcallahan.wikimark.domain.markdown.MarkdownRenderOutcome;
import com.williamcallahan.wikimark.domain.markdown.MarkdownRenderRequest;
import com.williamcallahan.wikimark.domain.markdown.MarkdownRenderResponse;
import com.williamcallahan.wikimark.domain.math.MathImageRequest;
import com.williamcallahan.wikimark.service.markdown.MarkdownConversionService;
import com.williamcallahan.wikimark.service.math.MathImageFormat;
import com.williamcallahan.wikimark.service.math.MathRasterizer;
import com.williamcallahan.wikimark.service.math.MathRenderingException;
import com.williamcallahan.wikimark.service.math.MathRenderingUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for markdown conversion and math image rendering.
 */
@RestController
@RequestMapping("/api/markdown")
public class MarkdownController {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownController.class);
    private static final String SERVER_SOURCE = "server";

    private final MarkdownConversionService conversionService;
    private final MathRasterizer mathRasterizer;
    private final AppProperties appProperties;
    private final ExceptionResponseBuilder exceptionBuilder;

    public MarkdownController(MarkdownConversionService conversionService, MathRasterizer mathRasterizer,
                              AppProperties appProperties, ExceptionResponseBuilder exceptionBuilder) {
        this.conversionService = conversionService;
        this.mathRasterizer = mathRasterizer;
        this.appProperties = appProperties;
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Converts markdown text to a wiki HTML fragment.
     *
     * @param request A JSON object containing the markdown to render. Expected format:
     *                <pre>{@code
     *                  {
     *                    "content": "Your **markdown** text here."
     *                  }
     *                }</pre>
     * @return {@code {"html": "<p>...", "source": "server"}} on success, an error body with
     *         status 500 otherwise
     */
    @PostMapping(value = "/render",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<? extends MarkdownRenderResponse> renderMarkdown(@RequestBody MarkdownRenderRequest request) {
        if (request.isBlank()) {
            return ResponseEntity.ok(new MarkdownRenderOutcome("", SERVER_SOURCE));
        }
        try {
            logger.debug("Processing markdown of length: {}", request.content().length());
            String html = conversionService.convert(request.content());
            return ResponseEntity.ok(new MarkdownRenderOutcome(html, SERVER_SOURCE));
        } catch (RuntimeException conversionFailure) {
            logger.error("Error rendering markdown", conversionFailure);
            return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to render markdown", conversionFailure);
        }
    }

    /**
     * Renders a math expression as an image.
     *
     * <p>Missing format, dpi or font size fall back to the {@code app.math.*} defaults.</p>
     *
     * @param request expression and optional rendering parameters
     * @return image bytes with {@code image/png} or {@code image/svg+xml}; 400 for invalid
     *         input, 503 when no rendering backend is installed
     */
    @PostMapping(value = "/math", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> renderMath(@RequestBody MathImageRequest request) {
        MathRenderingConfig defaults = appProperties.getMath();
        try {
            MathImageFormat format = request.format() == null
                ? defaults.defaultFormat()
                : MathImageFormat.fromName(request.format());
            int dpi = request.dpi() == null ? defaults.getDpi() : request.dpi();
            int fontSize = request.fontSize() == null ? defaults.getFontSize() : request.fontSize();

            byte[] image = mathRasterizer.renderMath(request.expression(), format, dpi, fontSize);
            return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(format.mediaType()))
                .body(image);
        } catch (MathRenderingUnavailableException unavailable) {
            logger.error("Math rendering backend unavailable: {}", unavailable.getMessage());
            return exceptionBuilder.buildErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE, "Math rendering unavailable", unavailable);
        } catch (IllegalArgumentException | MathRenderingException invalidInput) {
            logger.error("Rejected math rendering request: {}", invalidInput.getMessage());
            return exceptionBuilder.buildErrorResponse(
                HttpStatus.BAD_REQUEST, "Invalid math rendering request", invalidInput);
        }
    }
}
