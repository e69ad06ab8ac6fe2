package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.ext.emoji.Emoji;
import com.vladsch.flexmark.parser.block.NodePostProcessor;
import com.vladsch.flexmark.parser.block.NodePostProcessorFactory;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.ast.NodeTracker;

/**
 * Swaps flexmark's emoji nodes for {@link EmojiGlyph} nodes resolved against the catalog.
 *
 * <p>Names the catalog does not know are put back as literal {@code :name:} text, so the
 * stock emoji renderer never runs.</p>
 */
class EmojiNodePostProcessor extends NodePostProcessor {

    private final EmojiCatalog emojiCatalog;

    EmojiNodePostProcessor(EmojiCatalog emojiCatalog) {
        this.emojiCatalog = emojiCatalog;
    }

    @Override
    public void process(NodeTracker state, Node node) {
        if (node instanceof Emoji emoji) {
            Node replacement = emojiCatalog.resolve(emoji.getChars().toString())
                .<Node>map(match -> new EmojiGlyph(emoji.getChars(), match))
                .orElseGet(() -> new Text(emoji.getChars()));
            emoji.insertBefore(replacement);
            emoji.unlink();
            state.nodeAdded(replacement);
            state.nodeRemoved(emoji);
        }
    }

    static class Factory extends NodePostProcessorFactory {
        private final EmojiCatalog emojiCatalog;

        Factory(EmojiCatalog emojiCatalog) {
            super(false);
            this.emojiCatalog = emojiCatalog;
            addNodes(Emoji.class);
        }

        @Override
        public NodePostProcessor apply(Document document) {
            return new EmojiNodePostProcessor(emojiCatalog);
        }
    }
}
