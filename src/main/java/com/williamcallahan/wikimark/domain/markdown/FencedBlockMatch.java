package com.williamcallahan.wikimark.domain.markdown;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes a fenced block routed to the passthrough formatter.
 *
 * <p>Missing optional parts default to empty values; attribute insertion order is kept.</p>
 *
 * @param source raw fence body, never escaped
 * @param language fence language tag
 * @param cssClass configured class for the language, always rendered first
 * @param elementId optional element id, empty when absent
 * @param extraClasses caller-supplied classes in source order
 * @param attributes remaining attributes in source order
 */
public record FencedBlockMatch(
        String source,
        String language,
        String cssClass,
        String elementId,
        List<String> extraClasses,
        Map<String, String> attributes) {

    public FencedBlockMatch {
        Objects.requireNonNull(cssClass, "Fence CSS class cannot be null");
        source = source == null ? "" : source;
        language = language == null ? "" : language;
        elementId = elementId == null ? "" : elementId;
        extraClasses = extraClasses == null ? List.of() : List.copyOf(extraClasses);
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates a match with only a body and a class.
     *
     * @param source raw fence body
     * @param cssClass configured class
     * @return match without id, extra classes or attributes
     */
    public static FencedBlockMatch of(String source, String cssClass) {
        return new FencedBlockMatch(source, "", cssClass, "", List.of(), Map.of());
    }
}
