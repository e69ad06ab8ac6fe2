package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.ast.DelimitedNodeImpl;
import com.vladsch.flexmark.util.sequence.BasedSequence;

/**
 * Highlighted span written as {@code ==text==}.
 */
public class MarkedText extends DelimitedNodeImpl {

    MarkedText(BasedSequence openingMarker, BasedSequence text, BasedSequence closingMarker) {
        super(openingMarker, text, closingMarker);
    }
}
