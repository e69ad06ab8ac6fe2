package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.sequence.BasedSequence;

/**
 * AST node for {@code $expression$} inside a paragraph.
 */
public class InlineMath extends Node {

    private final BasedSequence expression;

    InlineMath(BasedSequence chars, BasedSequence expression) {
        super(chars);
        this.expression = expression;
    }

    public BasedSequence getExpression() {
        return expression;
    }

    @Override
    public BasedSequence[] getSegments() {
        return new BasedSequence[] {expression};
    }
}
