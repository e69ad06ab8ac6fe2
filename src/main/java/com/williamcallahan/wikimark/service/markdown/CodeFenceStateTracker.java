package com.williamcallahan.wikimark.service.markdown;

/**
 * Tracks whether a line-by-line scan is currently inside a fenced code block.
 *
 * <p>Any line whose trimmed content begins with three backticks or three tildes
 * toggles the state. The opening and closing markers are not required to match,
 * which mirrors how the indentation pre-pass has always treated fences: it only
 * needs to know which lines must never be touched.</p>
 */
final class CodeFenceStateTracker {

    /** Minimum fence length for valid code fences (CommonMark requires three). */
    static final int FENCE_MIN_LENGTH = 3;

    private static final char BACKTICK = '`';
    private static final char TILDE = '~';

    private boolean inFence;

    /**
     * Describes a detected fence marker at the start of a trimmed line.
     *
     * @param character the fence character (backtick or tilde)
     * @param length number of consecutive fence characters
     */
    record FenceMarker(char character, int length) {}

    /**
     * Scans for a fence marker (3+ backticks or tildes) at the given position.
     *
     * @param text source text
     * @param index position to scan from
     * @return fence marker if found, null otherwise
     */
    static FenceMarker scanFenceMarker(String text, int index) {
        if (text == null || index < 0 || index >= text.length()) {
            return null;
        }
        char markerChar = text.charAt(index);
        if (markerChar != BACKTICK && markerChar != TILDE) {
            return null;
        }
        int length = 0;
        while (index + length < text.length() && text.charAt(index + length) == markerChar) {
            length++;
        }
        return length >= FENCE_MIN_LENGTH ? new FenceMarker(markerChar, length) : null;
    }

    /**
     * Feeds one trimmed line into the tracker.
     *
     * @param trimmedLine line with surrounding whitespace removed
     * @return true when the line is a fence delimiter (and the state was toggled)
     */
    boolean processLine(String trimmedLine) {
        if (scanFenceMarker(trimmedLine, 0) == null) {
            return false;
        }
        inFence = !inFence;
        return true;
    }

    /**
     * Returns whether the scan is inside a fenced code block.
     */
    boolean isInsideFence() {
        return inFence;
    }
}
