package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.util.ast.Block;
import com.vladsch.flexmark.util.sequence.BasedSequence;

/**
 * Block written between {@code $$} delimiters, either on one line or spanning several.
 *
 * <p>A block whose closing delimiter never arrived is kept as unclosed and rendered as
 * plain paragraph text.</p>
 */
public class DisplayMath extends Block {

    private String expression = "";
    private boolean closed;

    public String getExpression() {
        return expression;
    }

    void setExpression(String expression) {
        this.expression = expression;
    }

    public boolean isClosed() {
        return closed;
    }

    void setClosed(boolean closed) {
        this.closed = closed;
    }

    @Override
    public BasedSequence[] getSegments() {
        return EMPTY_SEGMENTS;
    }
}
