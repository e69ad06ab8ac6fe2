package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.ast.DelimitedNodeImpl;
import com.vladsch.flexmark.util.sequence.BasedSequence;

/**
 * Inserted span written as {@code ^^text^^}.
 */
public class InsertedText extends DelimitedNodeImpl {

    InsertedText(BasedSequence openingMarker, BasedSequence text, BasedSequence closingMarker) {
        super(openingMarker, text, closingMarker);
    }
}
