package com.williamcallahan.wikimark.service.markdown;

import com.williamcallahan.wikimark.domain.markdown.EmojiMatch;
import com.williamcallahan.wikimark.domain.markdown.FencedBlockMatch;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DefaultWikiMarkupRendererTest {

    private final DefaultWikiMarkupRenderer renderer = new DefaultWikiMarkupRenderer();

    @Test
    @DisplayName("smile renders U+1F604 with its code point attribute")
    void rendersEmojiWithCodepoints() {
        Element emoji = renderer.renderEmoji(new EmojiMatch("smile", null, "1f604", ":smile:"));

        assertEquals("x-emoji", emoji.tagName());
        assertEquals("smile", emoji.attr("data-shortname"));
        assertEquals("1f604", emoji.attr("data-unicode"));
        assertEquals(new String(Character.toChars(0x1F604)), emoji.text());
    }

    @Test
    void stripsColonsFromShortname() {
        Element emoji = renderer.renderEmoji(new EmojiMatch(":smile:", null, "1f604", ":smile:"));

        assertEquals("smile", emoji.attr("data-shortname"));
    }

    @Test
    void typedAliasWinsOverCanonicalName() {
        Element emoji = renderer.renderEmoji(new EmojiMatch("laughing", "satisfied", "1f606", ":satisfied:"));

        assertEquals("satisfied", emoji.attr("data-shortname"));
        assertEquals("1f606", emoji.attr("data-unicode"));
    }

    @Test
    void fallsBackToTextWithoutCodepoints() {
        Element emoji = renderer.renderEmoji(new EmojiMatch("partyparrot", null, null, ":partyparrot:"));

        assertEquals("partyparrot", emoji.attr("data-shortname"));
        assertFalse(emoji.hasAttr("data-unicode"));
        assertEquals(":partyparrot:", emoji.text());
    }

    @Test
    void decodesMultiCodepointSequences() {
        Element emoji = renderer.renderEmoji(new EmojiMatch("us", null, "1f1fa-1f1f8", ":us:"));

        assertArrayEquals(new int[] {0x1F1FA, 0x1F1F8}, emoji.text().codePoints().toArray());
    }

    @Test
    void rejectsInvalidHex() {
        assertThrows(NumberFormatException.class, () -> DefaultWikiMarkupRenderer.decodeCodepoints("zz"));
    }

    @Test
    void formatsPlainFence() {
        assertEquals("<div class=\"arithmatex\">x^2</div>",
            renderer.formatFence(FencedBlockMatch.of("x^2", "arithmatex")));
    }

    @Test
    void keepsSourceUnescaped() {
        assertEquals("<div class=\"csf\"><ac:structured-macro ac:name=\"toc\"/></div>",
            renderer.formatFence(FencedBlockMatch.of("<ac:structured-macro ac:name=\"toc\"/>", "csf")));
    }

    @Test
    void formatsIdClassesAndAttributesInOrder() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("data-scale", "2");
        attributes.put("title", "Energy");
        FencedBlockMatch match = new FencedBlockMatch(
            "E=mc^2", "math", "arithmatex", "eq1", List.of("wide", "tall"), attributes);

        assertEquals("<div id=\"eq1\" class=\"arithmatex wide tall\" data-scale=\"2\" title=\"Energy\">E=mc^2</div>",
            renderer.formatFence(match));
    }

    @Test
    @DisplayName("Configured class is prepended without removing a repeated extra class")
    void prependsConfiguredClassToEveryExtraClass() {
        FencedBlockMatch match = new FencedBlockMatch(
            "x", "math", "arithmatex", "", List.of("arithmatex", "wide"), Map.of());

        assertEquals("<div class=\"arithmatex arithmatex wide\">x</div>", renderer.formatFence(match));
    }
}
