package com.williamcallahan.wikimark.cli;

import com.williamcallahan.wikimark.service.markdown.CustomFence;
import com.williamcallahan.wikimark.service.markdown.DefaultWikiMarkupRenderer;
import com.williamcallahan.wikimark.service.markdown.EmojiCatalog;
import com.williamcallahan.wikimark.service.markdown.MarkdownConversionService;
import com.williamcallahan.wikimark.service.markdown.MarkdownEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkdownFileConverterTest {

    @TempDir
    Path tempDir;

    private final MarkdownConversionService conversionService = new MarkdownConversionService(
        new MarkdownEngine(new DefaultWikiMarkupRenderer(), EmojiCatalog.loadDefault(), CustomFence.defaults()));

    @Test
    void convertsFileIntoNewDirectory() throws Exception {
        Path input = tempDir.resolve("page.md");
        Files.writeString(input, "# Título\n\n- a\n  - b\n", StandardCharsets.UTF_8);
        Path output = tempDir.resolve("out/page.html");

        MarkdownFileConverter.convertFile(conversionService, input, output);

        String html = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(html.contains("<h1>Título</h1>"), html);
        assertTrue(html.contains("<ul>"), html);
    }

    @Test
    void missingInputPropagates() {
        assertThrows(NoSuchFileException.class, () -> MarkdownFileConverter.convertFile(
            conversionService, tempDir.resolve("absent.md"), tempDir.resolve("out.html")));
    }
}
