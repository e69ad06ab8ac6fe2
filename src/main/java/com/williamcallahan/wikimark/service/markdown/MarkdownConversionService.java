package com.williamcallahan.wikimark.service.markdown;

import com.williamcallahan.wikimark.domain.markdown.ConversionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Converts markdown documents into wiki HTML fragments.
 *
 * <p>Each call resets the engine, rewrites two-space list nesting, then parses and renders.
 * Engine failures are not caught: a document either converts completely or the exception
 * reaches the caller.</p>
 */
@Service
public class MarkdownConversionService {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownConversionService.class);

    private final MarkdownEngine markdownEngine;

    public MarkdownConversionService(MarkdownEngine markdownEngine) {
        this.markdownEngine = markdownEngine;
    }

    /**
     * Converts one markdown document.
     *
     * @param content markdown source, already decoded
     * @return HTML fragment without a wrapping document
     */
    public String convert(String content) {
        long startTime = System.currentTimeMillis();
        try (MarkdownEngine.EngineSession session = markdownEngine.openSession()) {
            String normalized = ListIndentationNormalizer.normalize(content);
            String html = session.render(normalized);

            ConversionSummary summary = session.summary();
            logger.debug("Converted {} chars of markdown in {}ms: {} emoji, {} passthrough fences, {} inline math, {} display math",
                content == null ? 0 : content.length(), System.currentTimeMillis() - startTime,
                summary.emoji(), summary.passthroughFences(), summary.inlineMath(), summary.displayMath());
            return html;
        }
    }
}
