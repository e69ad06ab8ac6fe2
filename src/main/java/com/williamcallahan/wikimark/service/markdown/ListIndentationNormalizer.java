package com.williamcallahan.wikimark.service.markdown;

import java.util.Arrays;
import java.util.List;

/**
 * Rewrites two-space list nesting into the four-space nesting the engine expects.
 *
 * <p>Level {@code n} of a two-space list ({@code 2n} spaces) becomes {@code 4n} spaces.
 * Fenced code, admonition bodies, headings, quotes, inline-code openers and any line
 * outside a detected two-space list pass through byte-for-byte. The output always has
 * the same number of lines as the input.</p>
 */
final class ListIndentationNormalizer {
    private ListIndentationNormalizer() {}

    private static final String LINE_SEPARATOR = "\n";
    private static final String ADMONITION_MARKER = "!!!";
    private static final int ORDINAL_MARKER_SCAN_LIMIT = 10;
    private static final int TARGET_INDENT_WIDTH = 4;

    static String normalize(String markdownText) {
        if (markdownText == null || markdownText.isEmpty()) {
            return "";
        }
        List<String> lines = Arrays.asList(markdownText.split(LINE_SEPARATOR, -1));
        StringBuilder normalizedBuilder = new StringBuilder(markdownText.length() + 64);
        CodeFenceStateTracker fenceTracker = new CodeFenceStateTracker();
        boolean inAdmonition = false;

        for (int lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
            if (lineIndex > 0) {
                normalizedBuilder.append(LINE_SEPARATOR);
            }
            String line = lines.get(lineIndex);
            if (line.isBlank()) {
                normalizedBuilder.append(line);
                continue;
            }

            String content = line.stripLeading();
            if (fenceTracker.processLine(line.strip()) || fenceTracker.isInsideFence()) {
                normalizedBuilder.append(line);
                continue;
            }

            if (content.startsWith(ADMONITION_MARKER)) {
                inAdmonition = true;
                normalizedBuilder.append(line);
                continue;
            }

            int leadingSpaces = line.length() - content.length();
            // First unindented line closes the admonition body, then is processed normally.
            if (inAdmonition && leadingSpaces == 0) {
                inAdmonition = false;
            }

            if (leadingSpaces == 0 || isNeverReindented(content) || inAdmonition) {
                normalizedBuilder.append(line);
                continue;
            }

            if (shouldReindent(lines, lineIndex, leadingSpaces, content)) {
                int nestingLevel = leadingSpaces / 2;
                normalizedBuilder.append(" ".repeat(nestingLevel * TARGET_INDENT_WIDTH)).append(content);
            } else {
                normalizedBuilder.append(line);
            }
        }
        return normalizedBuilder.toString();
    }

    private static boolean shouldReindent(List<String> lines, int lineIndex, int leadingSpaces, String content) {
        if (leadingSpaces % 2 != 0) {
            return false;
        }
        if (!IndentationHeuristics.looksLike2SpaceSystem(lines, lineIndex)) {
            return false;
        }
        return IndentationHeuristics.startsWithBulletMarker(content)
            || startsWithOrdinalMarker(content)
            || IndentationHeuristics.isListContinuation(lines, lineIndex);
    }

    // Headings, block quotes and inline code keep their indentation.
    private static boolean isNeverReindented(String content) {
        char firstChar = content.charAt(0);
        return firstChar == '`' || firstChar == '#' || firstChar == '>';
    }

    private static boolean startsWithOrdinalMarker(String content) {
        if (!Character.isDigit(content.charAt(0))) {
            return false;
        }
        String head = content.substring(0, Math.min(ORDINAL_MARKER_SCAN_LIMIT, content.length()));
        return head.contains(". ");
    }
}
