package com.williamcallahan.wikimark.domain.markdown;

import java.util.Objects;

/**
 * Describes an emoji shortcode matched in the source text.
 *
 * @param shortname canonical shortname, with or without colon delimiters
 * @param alias the alias the author typed when it differs from the canonical name, otherwise null
 * @param codepoints hyphen-delimited hexadecimal code points such as {@code 1f1fa-1f1f8}, or null
 * @param fallbackText literal text rendered when no code points are known
 */
public record EmojiMatch(String shortname, String alias, String codepoints, String fallbackText) {
    public EmojiMatch {
        Objects.requireNonNull(shortname, "Emoji shortname cannot be null");
        fallbackText = fallbackText == null ? "" : fallbackText;
    }

    /**
     * Indicates whether the match carries a code point sequence.
     *
     * @return true when code points take precedence over the fallback text
     */
    public boolean hasCodepoints() {
        return codepoints != null && !codepoints.isBlank();
    }
}
