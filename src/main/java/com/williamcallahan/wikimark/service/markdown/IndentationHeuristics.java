package com.williamcallahan.wikimark.service.markdown;

import java.util.List;

/**
 * Look-around predicates that decide whether a line sits in a two-space list convention.
 *
 * <p>Both checks are pure functions of the line list and an index. The window radius and
 * the continuation look-back are fixed; changing either changes which documents get
 * reindented, so treat any edit here as a behavioral change and add cases to
 * {@code IndentationHeuristicsTest}.</p>
 */
final class IndentationHeuristics {

    /** Lines inspected on each side of the current line when looking for 2-space evidence. */
    static final int WINDOW_RADIUS = 5;

    /** Maximum number of preceding lines inspected when deciding list continuation. */
    static final int CONTINUATION_LOOKBACK = 4;

    private static final int TWO_SPACE_STEP = 2;
    private static final int FOUR_SPACE_STEP = 4;

    private IndentationHeuristics() {}

    /**
     * Decides whether the text around {@code index} uses two-space list nesting.
     *
     * <p>Collects the indentation of every indented bullet line in
     * {@code [index - 5, index + 5)} and reports true as soon as one of them is even but
     * not a multiple of four (2, 6, 10...). A single such level is decisive even when the
     * other levels in the window are already four-space aligned.</p>
     *
     * @param lines document lines
     * @param index line under consideration
     * @return true when the window carries two-space evidence
     */
    static boolean looksLike2SpaceSystem(List<String> lines, int index) {
        int windowStart = Math.max(0, index - WINDOW_RADIUS);
        int windowEnd = Math.min(lines.size(), index + WINDOW_RADIUS);

        for (int lineIndex = windowStart; lineIndex < windowEnd; lineIndex++) {
            String line = lines.get(lineIndex);
            if (line.isBlank()) {
                continue;
            }
            String content = line.stripLeading();
            if (!startsWithBulletMarker(content)) {
                continue;
            }
            int leadingSpaces = line.length() - content.length();
            if (leadingSpaces == 0) {
                continue;
            }
            if (leadingSpaces % TWO_SPACE_STEP == 0 && leadingSpaces % FOUR_SPACE_STEP != 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Decides whether the line at {@code index} continues a list item.
     *
     * <p>Walks back at most four lines. A bullet line ends the walk with true; an
     * unindented non-blank line is a paragraph boundary and ends it with false.</p>
     *
     * @param lines document lines
     * @param index line under consideration
     * @return true when a bullet precedes the line before any paragraph boundary
     */
    static boolean isListContinuation(List<String> lines, int index) {
        if (index <= 0) {
            return false;
        }
        int lowestIndex = Math.max(0, index - CONTINUATION_LOOKBACK);
        for (int lineIndex = index - 1; lineIndex >= lowestIndex; lineIndex--) {
            String line = lines.get(lineIndex);
            if (line.isBlank()) {
                continue;
            }
            String content = line.stripLeading();
            if (startsWithBulletMarker(content)) {
                return true;
            }
            if (content.length() == line.length()) {
                return false;
            }
        }
        return false;
    }

    /**
     * Returns whether already-stripped content opens a bullet item ({@code * }, {@code - }, {@code + }).
     */
    static boolean startsWithBulletMarker(String content) {
        if (content.length() < 2 || content.charAt(1) != ' ') {
            return false;
        }
        char marker = content.charAt(0);
        return marker == '*' || marker == '-' || marker == '+';
    }
}
