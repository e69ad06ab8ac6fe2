package com.williamcallahan.wikimark.service.markdown;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndentationHeuristicsTest {

    @Test
    void detectsTwoSpaceBulletInWindow() {
        List<String> lines = List.of("- a", "  - b", "text");

        assertTrue(IndentationHeuristics.looksLike2SpaceSystem(lines, 2));
    }

    @Test
    void fourSpaceMultiplesAreNotEvidence() {
        List<String> lines = List.of("- a", "    - b", "        - c");

        assertFalse(IndentationHeuristics.looksLike2SpaceSystem(lines, 1));
    }

    @Test
    void singleTwoSpaceLevelIsDecisiveAmongFourSpaceLevels() {
        List<String> lines = List.of("- a", "    - b", "      - c");

        assertTrue(IndentationHeuristics.looksLike2SpaceSystem(lines, 1));
    }

    @Test
    void indentedNonBulletLinesAreNotEvidence() {
        List<String> lines = List.of("para", "  indented prose", "  more prose");

        assertFalse(IndentationHeuristics.looksLike2SpaceSystem(lines, 1));
    }

    @Test
    void windowEndIsExclusive() {
        List<String> lines = List.of("x", "x", "x", "x", "x", "  - b", "x");

        assertFalse(IndentationHeuristics.looksLike2SpaceSystem(lines, 0));
        assertTrue(IndentationHeuristics.looksLike2SpaceSystem(lines, 1));
    }

    @Test
    void windowStartIsInclusive() {
        List<String> lines = List.of("  - b", "x", "x", "x", "x", "x", "x", "x");

        assertTrue(IndentationHeuristics.looksLike2SpaceSystem(lines, 5));
        assertFalse(IndentationHeuristics.looksLike2SpaceSystem(lines, 6));
    }

    @Test
    void continuationFollowsBulletAcrossBlankLines() {
        List<String> lines = List.of("- a", "", "", "", "  text");

        assertTrue(IndentationHeuristics.isListContinuation(lines, 4));
    }

    @Test
    void continuationLookBackIsBounded() {
        List<String> lines = List.of("- a", "", "", "", "", "  text");

        assertFalse(IndentationHeuristics.isListContinuation(lines, 5));
    }

    @Test
    void unindentedLineIsParagraphBoundary() {
        List<String> lines = List.of("- a", "Paragraph", "  text");

        assertFalse(IndentationHeuristics.isListContinuation(lines, 2));
    }

    @Test
    void indentedProseDoesNotStopTheWalk() {
        List<String> lines = List.of("- a", "  first", "  second");

        assertTrue(IndentationHeuristics.isListContinuation(lines, 2));
    }

    @Test
    void firstLineIsNeverContinuation() {
        assertFalse(IndentationHeuristics.isListContinuation(List.of("  text"), 0));
    }

    @Test
    void recognizesBulletMarkers() {
        assertTrue(IndentationHeuristics.startsWithBulletMarker("- item"));
        assertTrue(IndentationHeuristics.startsWithBulletMarker("* item"));
        assertTrue(IndentationHeuristics.startsWithBulletMarker("+ item"));
        assertFalse(IndentationHeuristics.startsWithBulletMarker("-item"));
        assertFalse(IndentationHeuristics.startsWithBulletMarker("-"));
        assertFalse(IndentationHeuristics.startsWithBulletMarker("1. item"));
    }
}
