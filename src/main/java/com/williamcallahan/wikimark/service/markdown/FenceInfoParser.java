package com.williamcallahan.wikimark.service.markdown;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a fence info string into language, id, classes and attributes.
 *
 * <p>Accepts {@code math}, {@code math {#eq1 .wide data-scale="2"}} and the attribute-only
 * form {@code {.math #eq1}}, where the first class names the language. Parsing is
 * best-effort: unknown tokens are ignored, missing values become empty strings, and no
 * input makes it throw.</p>
 */
final class FenceInfoParser {

    private static final char ATTRIBUTES_OPEN = '{';
    private static final char ATTRIBUTES_CLOSE = '}';

    private FenceInfoParser() {}

    /**
     * Parsed fence info.
     *
     * @param language fence language tag, empty when absent
     * @param elementId element id, empty when absent
     * @param classes extra classes in source order
     * @param attributes key/value attributes in source order
     */
    record FenceInfo(String language, String elementId, List<String> classes, Map<String, String> attributes) {}

    static FenceInfo parse(String info) {
        String text = info == null ? "" : info.strip();
        int attributesStart = text.indexOf(ATTRIBUTES_OPEN);
        String language = firstWord(attributesStart < 0 ? text : text.substring(0, attributesStart));

        String elementId = "";
        List<String> classes = new ArrayList<>();
        Map<String, String> attributes = new LinkedHashMap<>();
        if (attributesStart >= 0) {
            int attributesEnd = text.lastIndexOf(ATTRIBUTES_CLOSE);
            String body = attributesEnd > attributesStart
                ? text.substring(attributesStart + 1, attributesEnd)
                : text.substring(attributesStart + 1);
            for (String token : tokenize(body)) {
                if (token.startsWith("#")) {
                    elementId = token.substring(1);
                } else if (token.startsWith(".")) {
                    if (token.length() > 1) {
                        classes.add(token.substring(1));
                    }
                } else {
                    int separator = token.indexOf('=');
                    if (separator > 0) {
                        attributes.put(token.substring(0, separator), unquote(token.substring(separator + 1)));
                    }
                }
            }
        }
        if (language.isEmpty() && !classes.isEmpty()) {
            language = classes.remove(0);
        }
        return new FenceInfo(language, elementId, classes, attributes);
    }

    private static String firstWord(String text) {
        String stripped = text.strip();
        for (int cursor = 0; cursor < stripped.length(); cursor++) {
            if (Character.isWhitespace(stripped.charAt(cursor))) {
                return stripped.substring(0, cursor);
            }
        }
        return stripped;
    }

    // Whitespace separates tokens except inside single or double quotes.
    private static List<String> tokenize(String body) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char openQuote = 0;
        for (int cursor = 0; cursor < body.length(); cursor++) {
            char currentChar = body.charAt(cursor);
            if (openQuote != 0) {
                current.append(currentChar);
                if (currentChar == openQuote) {
                    openQuote = 0;
                }
            } else if (currentChar == '"' || currentChar == '\'') {
                openQuote = currentChar;
                current.append(currentChar);
            } else if (Character.isWhitespace(currentChar)) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(currentChar);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && last == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        if (!value.isEmpty() && (value.charAt(0) == '"' || value.charAt(0) == '\'')) {
            return value.substring(1);
        }
        return value;
    }
}
