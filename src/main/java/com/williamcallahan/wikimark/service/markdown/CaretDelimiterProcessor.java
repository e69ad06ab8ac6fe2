package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.parser.InlineParser;
import com.vladsch.flexmark.parser.core.delimiter.Delimiter;
import com.vladsch.flexmark.parser.delimiter.DelimiterProcessor;
import com.vladsch.flexmark.parser.delimiter.DelimiterRun;
import com.vladsch.flexmark.util.ast.DelimitedNode;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.sequence.BasedSequence;

/**
 * Handles both caret forms: {@code ^^text^^} becomes {@link InsertedText} and
 * {@code ^text^} becomes {@link SuperscriptText}.
 *
 * <p>flexmark allows one processor per delimiter character, so the two spans share
 * this processor. A doubled caret is only consumed when both sides are doubled.</p>
 */
class CaretDelimiterProcessor implements DelimiterProcessor {

    private static final char DELIMITER = '^';
    private static final int INSERT_LENGTH = 2;
    private static final int SUPERSCRIPT_LENGTH = 1;

    @Override
    public char getOpeningCharacter() {
        return DELIMITER;
    }

    @Override
    public char getClosingCharacter() {
        return DELIMITER;
    }

    @Override
    public int getMinLength() {
        return SUPERSCRIPT_LENGTH;
    }

    @Override
    public int getDelimiterUse(DelimiterRun opener, DelimiterRun closer) {
        if (opener.length() >= INSERT_LENGTH && closer.length() >= INSERT_LENGTH) {
            return INSERT_LENGTH;
        }
        return SUPERSCRIPT_LENGTH;
    }

    @Override
    public void process(Delimiter opener, Delimiter closer, int delimitersUsed) {
        BasedSequence openingMarker = opener.getTailChars(delimitersUsed);
        BasedSequence closingMarker = closer.getLeadChars(delimitersUsed);
        DelimitedNode span = delimitersUsed == INSERT_LENGTH
            ? new InsertedText(openingMarker, BasedSequence.NULL, closingMarker)
            : new SuperscriptText(openingMarker, BasedSequence.NULL, closingMarker);
        opener.moveNodesBetweenDelimitersTo(span, closer);
    }

    @Override
    public Node unmatchedDelimiterNode(InlineParser inlineParser, DelimiterRun delimiter) {
        return null;
    }

    @Override
    public boolean canBeOpener(String before, String after, boolean leftFlanking, boolean rightFlanking,
                               boolean beforeIsPunctuation, boolean afterIsPunctuation,
                               boolean beforeIsWhitespace, boolean afterIsWhitespace) {
        return leftFlanking;
    }

    @Override
    public boolean canBeCloser(String before, String after, boolean leftFlanking, boolean rightFlanking,
                               boolean beforeIsPunctuation, boolean afterIsPunctuation,
                               boolean beforeIsWhitespace, boolean afterIsWhitespace) {
        return rightFlanking;
    }

    @Override
    public boolean skipNonOpenerCloser() {
        return false;
    }
}
