package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.ext.emoji.EmojiExtension;
import com.vladsch.flexmark.ext.footnotes.FootnoteExtension;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughSubscriptExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.parser.ParserEmulationProfile;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.williamcallahan.wikimark.domain.markdown.ConversionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the configured flexmark parser and renderer.
 *
 * <p>All conversions go through {@link #openSession()}: opening a session takes the engine
 * lock and clears per-document state, closing it releases the lock. Reset and render
 * therefore form one transaction, and concurrent callers wait their turn. A thread that
 * already holds a session cannot open a second one.</p>
 *
 * <pre>{@code
 * try (MarkdownEngine.EngineSession session = engine.openSession()) {
 *     String html = session.render(markdown);
 * }
 * }</pre>
 */
public class MarkdownEngine {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownEngine.class);

    private final Parser parser;
    private final HtmlRenderer renderer;
    private final ConversionStatistics statistics = new ConversionStatistics();
    private final ReentrantLock sessionLock = new ReentrantLock();

    /**
     * Builds the engine with the wiki rendering hooks and the fixed extension set.
     *
     * @param markupRenderer hooks for emoji and custom fences
     * @param emojiCatalog shortcode lookup
     * @param customFences fence languages routed to {@link WikiMarkupRenderer#formatFence}
     * @throws MarkdownConfigurationException when the fence configuration is unusable
     */
    public MarkdownEngine(WikiMarkupRenderer markupRenderer, EmojiCatalog emojiCatalog, List<CustomFence> customFences) {
        if (markupRenderer == null || emojiCatalog == null) {
            throw new MarkdownConfigurationException("Markdown engine requires a markup renderer and an emoji catalog");
        }
        Map<String, String> cssClassByLanguage = indexFences(customFences);

        MutableDataSet options = new MutableDataSet();
        // Four-space list nesting; two-space input is rewritten beforehand.
        options.setFrom(ParserEmulationProfile.FIXED_INDENT);
        options.set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                FootnoteExtension.create(),
                new AdmonitionSyntaxExtension(),
                StrikethroughSubscriptExtension.create(),
                AutolinkExtension.create(),
                EmojiExtension.create(),
                new WikiMarkdownExtension(markupRenderer, emojiCatalog, cssClassByLanguage, statistics)
            ))
            .set(Parser.LISTS_ITEM_TYPE_MISMATCH_TO_NEW_LIST, true)
            .set(HtmlRenderer.ESCAPE_HTML, false)
            .set(HtmlRenderer.SUPPRESS_HTML, false)
            .set(HtmlRenderer.FENCED_CODE_LANGUAGE_CLASS_PREFIX, "language-")
            .set(TablesExtension.APPEND_MISSING_COLUMNS, true)
            .set(TablesExtension.DISCARD_EXTRA_COLUMNS, true);

        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();

        logger.info("Markdown engine initialized with custom fences {}", cssClassByLanguage.keySet());
    }

    /**
     * Starts a conversion transaction.
     *
     * <p>Blocks while another thread holds a session.</p>
     *
     * @return session that must be closed, typically with try-with-resources
     * @throws IllegalStateException when the calling thread already holds a session
     */
    public EngineSession openSession() {
        if (sessionLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Markdown engine session is already open on this thread");
        }
        sessionLock.lock();
        statistics.reset();
        return new EngineSession();
    }

    private static Map<String, String> indexFences(List<CustomFence> customFences) {
        if (customFences == null || customFences.isEmpty()) {
            throw new MarkdownConfigurationException("At least one custom fence must be configured");
        }
        Map<String, String> cssClassByLanguage = new LinkedHashMap<>();
        for (CustomFence fence : customFences) {
            if (fence.language().isBlank() || fence.cssClass().isBlank()) {
                throw new MarkdownConfigurationException("Custom fence language and CSS class must not be blank: " + fence);
            }
            if (cssClassByLanguage.putIfAbsent(fence.language(), fence.cssClass()) != null) {
                throw new MarkdownConfigurationException(String.format(Locale.ROOT,
                    "Custom fence language '%s' is configured more than once", fence.language()));
            }
        }
        return cssClassByLanguage;
    }

    /**
     * One conversion transaction. Not shareable across threads.
     */
    public final class EngineSession implements AutoCloseable {
        private boolean closed;

        private EngineSession() {}

        /**
         * Parses and renders already-normalized markdown.
         *
         * <p>Parse failures propagate unchanged.</p>
         *
         * @param markdown normalized markdown text
         * @return rendered HTML fragment
         */
        public String render(String markdown) {
            if (closed) {
                throw new IllegalStateException("Markdown engine session is closed");
            }
            Node document = parser.parse(markdown);
            return renderer.render(document);
        }

        /**
         * Returns what has been rendered in this session so far.
         */
        public ConversionSummary summary() {
            return statistics.summary();
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                sessionLock.unlock();
            }
        }
    }
}
