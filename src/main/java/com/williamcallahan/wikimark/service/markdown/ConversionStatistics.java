package com.williamcallahan.wikimark.service.markdown;

import com.williamcallahan.wikimark.domain.markdown.ConversionSummary;

/**
 * Per-document counters written by the node renderer.
 *
 * <p>Owned by {@link MarkdownEngine} and only touched while its session lock is held.</p>
 */
final class ConversionStatistics {
    private int emoji;
    private int passthroughFences;
    private int inlineMath;
    private int displayMath;

    void recordEmoji() {
        emoji++;
    }

    void recordPassthroughFence() {
        passthroughFences++;
    }

    void recordInlineMath() {
        inlineMath++;
    }

    void recordDisplayMath() {
        displayMath++;
    }

    void reset() {
        emoji = 0;
        passthroughFences = 0;
        inlineMath = 0;
        displayMath = 0;
    }

    ConversionSummary summary() {
        return new ConversionSummary(emoji, passthroughFences, inlineMath, displayMath);
    }
}
