package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.ext.admonition.AdmonitionExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataHolder;

/**
 * Registers only the parsing half of flexmark's admonition extension.
 *
 * <p>Admonition blocks are rendered by {@link WikiNodeRenderer} as
 * {@code <div class="admonition type">} with a {@code <p class="admonition-title">},
 * without the icon markup flexmark's own renderer adds.</p>
 */
class AdmonitionSyntaxExtension implements Parser.ParserExtension {

    private final AdmonitionExtension admonitions = AdmonitionExtension.create();

    @Override
    public void parserOptions(MutableDataHolder options) {
        admonitions.parserOptions(options);
    }

    @Override
    public void extend(Parser.Builder parserBuilder) {
        admonitions.extend(parserBuilder);
    }
}
