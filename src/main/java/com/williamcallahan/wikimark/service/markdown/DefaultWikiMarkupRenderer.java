package com.williamcallahan.wikimark.service.markdown;

import com.williamcallahan.wikimark.domain.markdown.EmojiMatch;
import com.williamcallahan.wikimark.domain.markdown.FencedBlockMatch;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Produces the placeholder markup that the wiki page assembler post-processes.
 *
 * <p>Emoji become {@code <x-emoji>} elements with {@code data-shortname} and, when known,
 * {@code data-unicode}. Math and passthrough fences become a {@code <div>} whose body is
 * the raw fence source.</p>
 */
public class DefaultWikiMarkupRenderer implements WikiMarkupRenderer {

    static final String EMOJI_TAG = "x-emoji";
    private static final String CODEPOINT_SEPARATOR = "-";
    private static final int HEX_RADIX = 16;

    @Override
    public Element renderEmoji(EmojiMatch match) {
        String typedName = match.alias() != null && !match.alias().isEmpty() ? match.alias() : match.shortname();
        Element emoji = new Element(EMOJI_TAG).attr("data-shortname", stripColons(typedName));
        if (match.hasCodepoints()) {
            emoji.attr("data-unicode", match.codepoints());
            emoji.text(decodeCodepoints(match.codepoints()));
        } else {
            emoji.text(match.fallbackText());
        }
        return emoji;
    }

    @Override
    public String formatFence(FencedBlockMatch match) {
        // The configured class leads, followed by the extra classes as given.
        List<String> classes = new ArrayList<>();
        classes.add(match.cssClass());
        classes.addAll(match.extraClasses());

        StringBuilder html = new StringBuilder("<div");
        if (!match.elementId().isEmpty()) {
            html.append(" id=\"").append(match.elementId()).append('"');
        }
        html.append(" class=\"").append(String.join(" ", classes)).append('"');
        for (Map.Entry<String, String> attribute : match.attributes().entrySet()) {
            html.append(' ').append(attribute.getKey()).append("=\"").append(attribute.getValue()).append('"');
        }
        return html.append('>').append(match.source()).append("</div>").toString();
    }

    /**
     * Decodes a hyphen-delimited sequence of hexadecimal code points into text.
     *
     * @param codepoints sequence such as {@code 1f604} or {@code 1f1fa-1f1f8}
     * @return the concatenated characters
     * @throws NumberFormatException when a token is not valid hexadecimal
     */
    static String decodeCodepoints(String codepoints) {
        StringBuilder text = new StringBuilder();
        for (String token : codepoints.split(CODEPOINT_SEPARATOR)) {
            text.appendCodePoint(Integer.parseInt(token.strip(), HEX_RADIX));
        }
        return text.toString();
    }

    private static String stripColons(String name) {
        int start = 0;
        int end = name.length();
        while (start < end && name.charAt(start) == ':') {
            start++;
        }
        while (end > start && name.charAt(end - 1) == ':') {
            end--;
        }
        return name.substring(start, end);
    }
}
