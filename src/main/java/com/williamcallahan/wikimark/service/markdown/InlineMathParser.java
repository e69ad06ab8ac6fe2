package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.parser.InlineParser;
import com.vladsch.flexmark.parser.InlineParserExtension;
import com.vladsch.flexmark.parser.InlineParserExtensionFactory;
import com.vladsch.flexmark.parser.LightInlineParser;
import com.vladsch.flexmark.util.sequence.BasedSequence;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes {@code $expression$} spans.
 *
 * <p>The opening dollar must not be followed by whitespace and the closing one must not be
 * preceded by whitespace or followed by a digit, so prices such as "$5 and $6" stay text.
 * Doubled dollars are left alone.</p>
 */
class InlineMathParser implements InlineParserExtension {

    private static final Pattern INLINE_MATH =
        Pattern.compile("\\$(?![\\s$])((?:\\\\.|[^\\\\$\\n])+?)(?<!\\s)\\$(?![\\d$])");

    InlineMathParser(LightInlineParser inlineParser) {
    }

    @Override
    public void finalizeDocument(InlineParser inlineParser) {
    }

    @Override
    public void finalizeBlock(InlineParser inlineParser) {
    }

    @Override
    public boolean parse(LightInlineParser inlineParser) {
        BasedSequence input = inlineParser.getInput();
        int index = inlineParser.getIndex();
        if (index > 0 && input.charAt(index - 1) == '$') {
            return false;
        }
        Matcher matcher = inlineParser.matcher(INLINE_MATH);
        if (matcher == null) {
            return false;
        }
        inlineParser.flushTextNode();
        InlineMath inlineMath = new InlineMath(
            input.subSequence(matcher.start(), matcher.end()),
            input.subSequence(matcher.start(1), matcher.end(1)));
        inlineParser.getBlock().appendChild(inlineMath);
        return true;
    }

    static class Factory implements InlineParserExtensionFactory {
        @Override
        public Set<Class<?>> getAfterDependents() {
            return null;
        }

        @Override
        public CharSequence getCharacters() {
            return "$";
        }

        @Override
        public Set<Class<?>> getBeforeDependents() {
            return null;
        }

        @Override
        public InlineParserExtension apply(LightInlineParser lightInlineParser) {
            return new InlineMathParser(lightInlineParser);
        }

        @Override
        public boolean affectsGlobalScope() {
            return false;
        }
    }
}
