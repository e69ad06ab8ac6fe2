package com.williamcallahan.wikimark.config;

import com.williamcallahan.wikimark.service.markdown.DefaultWikiMarkupRenderer;
import com.williamcallahan.wikimark.service.markdown.EmojiCatalog;
import com.williamcallahan.wikimark.service.markdown.MarkdownEngine;
import com.williamcallahan.wikimark.service.markdown.WikiMarkupRenderer;
import com.williamcallahan.wikimark.service.math.MathRasterizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the markdown engine and math rasterizer from {@link AppProperties}.
 *
 * <p>The engine and rasterizer are single instances per context; the engine serializes
 * conversions itself.</p>
 */
@Configuration
public class MarkdownEngineConfig {

    @Bean
    public EmojiCatalog emojiCatalog() {
        return EmojiCatalog.loadDefault();
    }

    @Bean
    public WikiMarkupRenderer wikiMarkupRenderer() {
        return new DefaultWikiMarkupRenderer();
    }

    @Bean
    public MarkdownEngine markdownEngine(WikiMarkupRenderer wikiMarkupRenderer, EmojiCatalog emojiCatalog,
                                         AppProperties appProperties) {
        return new MarkdownEngine(wikiMarkupRenderer, emojiCatalog, appProperties.getMarkdown().customFences());
    }

    @Bean
    public MathRasterizer mathRasterizer(AppProperties appProperties) {
        return new MathRasterizer(appProperties.getMath().getCacheSize());
    }
}
