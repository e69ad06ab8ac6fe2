package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.sequence.BasedSequence;
import com.williamcallahan.wikimark.domain.markdown.EmojiMatch;

/**
 * AST node for a shortcode that resolved against the emoji catalog.
 */
public class EmojiGlyph extends Node {

    private final EmojiMatch match;

    EmojiGlyph(BasedSequence chars, EmojiMatch match) {
        super(chars);
        this.match = match;
    }

    public EmojiMatch getMatch() {
        return match;
    }

    @Override
    public BasedSequence[] getSegments() {
        return new BasedSequence[] {getChars()};
    }
}
