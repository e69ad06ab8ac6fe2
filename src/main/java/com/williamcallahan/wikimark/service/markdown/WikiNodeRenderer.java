package com.williamcallahan.wikimark.service.markdown;

import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ext.admonition.AdmonitionBlock;
import com.vladsch.flexmark.html.HtmlWriter;
import com.vladsch.flexmark.html.renderer.NodeRenderer;
import com.vladsch.flexmark.html.renderer.NodeRendererContext;
import com.vladsch.flexmark.html.renderer.NodeRenderingHandler;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.sequence.BasedSequence;
import com.williamcallahan.wikimark.domain.markdown.FencedBlockMatch;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders emoji, math, admonitions, custom fences and the mark/insert/superscript
 * spans, delegating emoji and fence markup to a {@link WikiMarkupRenderer}.
 *
 * <p>Fences whose language is not registered fall back to the engine's stock code block
 * rendering.</p>
 */
class WikiNodeRenderer implements NodeRenderer {
    private static final Logger logger = LoggerFactory.getLogger(WikiNodeRenderer.class);

    static final String MATH_CLASS = "arithmatex";
    static final String ADMONITION_CLASS = "admonition";
    static final String ADMONITION_TITLE_CLASS = "admonition-title";

    private final WikiMarkupRenderer markupRenderer;
    private final Map<String, String> cssClassByLanguage;
    private final ConversionStatistics statistics;

    WikiNodeRenderer(WikiMarkupRenderer markupRenderer, Map<String, String> cssClassByLanguage,
                     ConversionStatistics statistics) {
        this.markupRenderer = markupRenderer;
        this.cssClassByLanguage = cssClassByLanguage;
        this.statistics = statistics;
    }

    @Override
    public Set<NodeRenderingHandler<?>> getNodeRenderingHandlers() {
        Set<NodeRenderingHandler<?>> handlers = new HashSet<>();
        handlers.add(new NodeRenderingHandler<>(FencedCodeBlock.class, this::renderFence));
        handlers.add(new NodeRenderingHandler<>(EmojiGlyph.class, this::renderEmoji));
        handlers.add(new NodeRenderingHandler<>(InlineMath.class, this::renderInlineMath));
        handlers.add(new NodeRenderingHandler<>(DisplayMath.class, this::renderDisplayMath));
        handlers.add(new NodeRenderingHandler<>(AdmonitionBlock.class, this::renderAdmonition));
        handlers.add(new NodeRenderingHandler<>(MarkedText.class, (node, context, html) -> renderSpan(node, context, html, "mark")));
        handlers.add(new NodeRenderingHandler<>(InsertedText.class, (node, context, html) -> renderSpan(node, context, html, "ins")));
        handlers.add(new NodeRenderingHandler<>(SuperscriptText.class, (node, context, html) -> renderSpan(node, context, html, "sup")));
        return handlers;
    }

    private void renderFence(FencedCodeBlock node, NodeRendererContext context, HtmlWriter html) {
        FenceInfoParser.FenceInfo info = FenceInfoParser.parse(node.getInfo().toString());
        String cssClass = cssClassByLanguage.get(info.language());
        if (cssClass == null) {
            context.delegateRender();
            return;
        }
        // Content lines keep their own indentation; drop each line terminator and rejoin.
        String source = node.getContentLines()
            .stream()
            .map(line -> line.trimEOL().toString())
            .collect(Collectors.joining("\n"));
        FencedBlockMatch match = new FencedBlockMatch(
            source, info.language(), cssClass, info.elementId(), info.classes(), info.attributes());

        logger.debug("Formatting {} fence, source length={}", info.language(), source.length());
        statistics.recordPassthroughFence();
        html.line();
        html.raw(markupRenderer.formatFence(match));
        html.line();
    }

    private void renderEmoji(EmojiGlyph node, NodeRendererContext context, HtmlWriter html) {
        statistics.recordEmoji();
        Element emoji = markupRenderer.renderEmoji(node.getMatch());
        // A detached element serializes with jsoup's pretty printer; emoji sit inside running text.
        Document owner = new Document("");
        owner.outputSettings().prettyPrint(false);
        owner.appendChild(emoji);
        html.raw(emoji.outerHtml());
    }

    private void renderInlineMath(InlineMath node, NodeRendererContext context, HtmlWriter html) {
        statistics.recordInlineMath();
        html.raw("<span class=\"" + MATH_CLASS + "\">");
        html.text(node.getExpression());
        html.raw("</span>");
    }

    private void renderDisplayMath(DisplayMath node, NodeRendererContext context, HtmlWriter html) {
        html.line();
        if (!node.isClosed()) {
            html.raw("<p>");
            html.text(node.getChars().trimEOL());
            html.raw("</p>");
        } else {
            statistics.recordDisplayMath();
            html.raw("<div class=\"" + MATH_CLASS + "\">");
            html.text(node.getExpression());
            html.raw("</div>");
        }
        html.line();
    }

    private void renderAdmonition(AdmonitionBlock node, NodeRendererContext context, HtmlWriter html) {
        String type = node.getInfo().toString().toLowerCase(Locale.ROOT);
        html.attr("class", ADMONITION_CLASS + " " + type).withAttr().tag("div").line();
        String title = admonitionTitle(type, node.getTitle());
        if (!title.isEmpty()) {
            html.attr("class", ADMONITION_TITLE_CLASS).withAttr().tag("p");
            html.text(title);
            html.tag("/p").line();
        }
        context.renderChildren(node);
        html.tag("/div").line();
    }

    private static String admonitionTitle(String type, BasedSequence title) {
        if (title.isNull()) {
            return type.isEmpty() ? "" : Character.toUpperCase(type.charAt(0)) + type.substring(1);
        }
        return title.toString().strip();
    }

    private static void renderSpan(Node node, NodeRendererContext context, HtmlWriter html, String tag) {
        html.withAttr().tag(tag);
        context.renderChildren(node);
        html.tag("/" + tag);
    }
}
