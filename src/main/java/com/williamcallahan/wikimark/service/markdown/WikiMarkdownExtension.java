package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataHolder;

import java.util.Map;

/**
 * Flexmark extension wiring the wiki rendering hooks into parser and renderer.
 *
 * <p>Registers display and inline math parsing, the mark and caret delimiters, emoji
 * resolution, and the node renderer for everything the wiki renders itself.</p>
 */
class WikiMarkdownExtension implements Parser.ParserExtension, HtmlRenderer.HtmlRendererExtension {

    private final WikiMarkupRenderer markupRenderer;
    private final EmojiCatalog emojiCatalog;
    private final Map<String, String> cssClassByLanguage;
    private final ConversionStatistics statistics;

    WikiMarkdownExtension(WikiMarkupRenderer markupRenderer, EmojiCatalog emojiCatalog,
                          Map<String, String> cssClassByLanguage, ConversionStatistics statistics) {
        this.markupRenderer = markupRenderer;
        this.emojiCatalog = emojiCatalog;
        this.cssClassByLanguage = Map.copyOf(cssClassByLanguage);
        this.statistics = statistics;
    }

    @Override
    public void parserOptions(MutableDataHolder options) {
        // No options
    }

    @Override
    public void rendererOptions(MutableDataHolder options) {
        // No options
    }

    @Override
    public void extend(Parser.Builder parserBuilder) {
        parserBuilder.customBlockParserFactory(new DisplayMathBlockParser.Factory());
        parserBuilder.customInlineParserExtensionFactory(new InlineMathParser.Factory());
        parserBuilder.customDelimiterProcessor(new MarkDelimiterProcessor());
        parserBuilder.customDelimiterProcessor(new CaretDelimiterProcessor());
        parserBuilder.postProcessorFactory(new EmojiNodePostProcessor.Factory(emojiCatalog));
    }

    @Override
    public void extend(HtmlRenderer.Builder rendererBuilder, String rendererType) {
        rendererBuilder.nodeRendererFactory(
            options -> new WikiNodeRenderer(markupRenderer, cssClassByLanguage, statistics));
    }
}
