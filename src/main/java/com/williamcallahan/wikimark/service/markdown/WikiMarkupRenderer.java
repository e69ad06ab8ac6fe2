package com.williamcallahan.wikimark.service.markdown;

import com.williamcallahan.wikimark.domain.markdown.EmojiMatch;
import com.williamcallahan.wikimark.domain.markdown.FencedBlockMatch;
import org.jsoup.nodes.Element;

/**
 * Rendering hooks invoked by the markdown engine for constructs it does not render itself.
 *
 * <p>Registered once when the engine is built; the engine calls one method per matched
 * construct.</p>
 */
public interface WikiMarkupRenderer {

    /**
     * Builds the inline element that stands in for an emoji shortcode.
     *
     * @param match resolved shortcode
     * @return inline element, never block-level
     */
    Element renderEmoji(EmojiMatch match);

    /**
     * Formats a math or passthrough fence as a {@code <div>} carrying the untouched source.
     *
     * @param match fence body, classes and attributes
     * @return HTML markup
     */
    String formatFence(FencedBlockMatch match);
}
