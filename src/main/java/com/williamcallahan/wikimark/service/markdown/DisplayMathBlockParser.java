package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.parser.block.AbstractBlockParser;
import com.vladsch.flexmark.parser.block.AbstractBlockParserFactory;
import com.vladsch.flexmark.parser.block.BlockContinue;
import com.vladsch.flexmark.parser.block.BlockParserFactory;
import com.vladsch.flexmark.parser.block.BlockStart;
import com.vladsch.flexmark.parser.block.CustomBlockParserFactory;
import com.vladsch.flexmark.parser.block.MatchedBlockParser;
import com.vladsch.flexmark.parser.block.ParserState;
import com.vladsch.flexmark.util.ast.Block;
import com.vladsch.flexmark.util.data.DataHolder;
import com.vladsch.flexmark.util.sequence.BasedSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses {@code $$expression$$} and
 *
 * <pre>
 * $$
 * expression
 * $$
 * </pre>
 *
 * <p>into {@link DisplayMath} blocks. The opener must start the block; it does not
 * interrupt a paragraph. A blank line before the closing {@code $$} ends the block
 * unclosed.</p>
 */
class DisplayMathBlockParser extends AbstractBlockParser {

    static final String DELIMITER = "$$";
    private static final int MAX_INDENT = 4;

    private final DisplayMath block = new DisplayMath();
    private final List<String> lines = new ArrayList<>();
    private final BasedSequence firstLine;
    private BasedSequence lastLine;
    private boolean closed;

    private DisplayMathBlockParser(BasedSequence firstLine) {
        this.firstLine = firstLine;
        this.lastLine = firstLine;
    }

    @Override
    public Block getBlock() {
        return block;
    }

    @Override
    public BlockContinue tryContinue(ParserState state) {
        if (closed || state.isBlank()) {
            return BlockContinue.none();
        }
        BasedSequence line = state.getLine();
        lastLine = line;
        String text = line.subSequence(state.getIndex()).toString();
        String trimmed = text.stripTrailing();
        if (trimmed.endsWith(DELIMITER)) {
            String body = trimmed.substring(0, trimmed.length() - DELIMITER.length());
            if (!body.isBlank()) {
                lines.add(body);
            }
            closed = true;
            return BlockContinue.finished();
        }
        lines.add(text);
        return BlockContinue.atIndex(line.length());
    }

    @Override
    public void closeBlock(ParserState state) {
        block.setExpression(String.join("\n", lines));
        block.setClosed(closed);
        block.setChars(firstLine.baseSubSequence(firstLine.getStartOffset(), lastLine.getEndOffset()));
    }

    static class Factory implements CustomBlockParserFactory {
        @Override
        public Set<Class<?>> getAfterDependents() {
            return null;
        }

        @Override
        public Set<Class<?>> getBeforeDependents() {
            return null;
        }

        @Override
        public boolean affectsGlobalScope() {
            return false;
        }

        @Override
        public BlockParserFactory apply(DataHolder options) {
            return new StartFactory(options);
        }
    }

    private static class StartFactory extends AbstractBlockParserFactory {

        StartFactory(DataHolder options) {
            super(options);
        }

        @Override
        public BlockStart tryStart(ParserState state, MatchedBlockParser matchedBlockParser) {
            if (state.getIndent() >= MAX_INDENT || matchedBlockParser.getBlockParser().isParagraphParser()) {
                return BlockStart.none();
            }
            BasedSequence line = state.getLine();
            String text = line.subSequence(state.getNextNonSpaceIndex()).toString().strip();
            if (!text.startsWith(DELIMITER)) {
                return BlockStart.none();
            }
            String rest = text.substring(DELIMITER.length());
            DisplayMathBlockParser parser = new DisplayMathBlockParser(line);
            int closing = rest.indexOf(DELIMITER);
            if (closing >= 0) {
                // Single-line form: nothing may follow the closing delimiter.
                String expression = rest.substring(0, closing);
                if (expression.isBlank() || !rest.substring(closing + DELIMITER.length()).isBlank()) {
                    return BlockStart.none();
                }
                parser.lines.add(expression.strip());
                parser.closed = true;
            } else if (!rest.isBlank()) {
                parser.lines.add(rest);
            }
            return BlockStart.of(parser).atIndex(line.length());
        }
    }
}
