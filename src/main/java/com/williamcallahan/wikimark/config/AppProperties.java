package com.williamcallahan.wikimark.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private MarkdownConfig markdown = new MarkdownConfig();
    private MathRenderingConfig math = new MathRenderingConfig();

    /**
     * Validates every nested section; an invalid value aborts context startup.
     */
    @PostConstruct
    public void validateConfiguration() {
        markdown.validateConfiguration();
        math.validateConfiguration();
    }

    public MarkdownConfig getMarkdown() {
        return markdown;
    }

    public void setMarkdown(MarkdownConfig markdown) {
        this.markdown = markdown;
    }

    public MathRenderingConfig getMath() {
        return math;
    }

    public void setMath(MathRenderingConfig math) {
        this.math = math;
    }
}
