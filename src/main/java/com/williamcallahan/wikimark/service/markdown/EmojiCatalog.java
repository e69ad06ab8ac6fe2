package com.williamcallahan.wikimark.service.markdown;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vladsch.flexmark.ext.emoji.internal.EmojiReference;
import com.vladsch.flexmark.ext.emoji.internal.EmojiShortcuts;
import com.williamcallahan.wikimark.domain.markdown.EmojiMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Looks up emoji shortcodes by canonical name or alias.
 *
 * <p>Names come from flexmark's emoji reference. The bundled catalog at
 * {@value #DEFAULT_RESOURCE}, a JSON array of {@code {"shortname", "codepoints", "aliases"}}
 * objects, is consulted first: it carries the aliases flexmark does not know and the
 * fully-qualified sequences (with {@code fe0f}) where flexmark stores the bare code point.</p>
 */
public class EmojiCatalog {

    private static final Logger logger = LoggerFactory.getLogger(EmojiCatalog.class);

    static final String DEFAULT_RESOURCE = "emoji/emoji-catalog.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, EmojiDefinition> definitionsByShortname = new HashMap<>();
    private final Map<String, EmojiDefinition> definitionsByAlias = new HashMap<>();

    /**
     * One catalog entry.
     *
     * @param shortname canonical name without colons
     * @param codepoints hyphen-delimited hexadecimal code points, or null when only text is known
     * @param aliases alternative names without colons
     */
    public record EmojiDefinition(String shortname, String codepoints, List<String> aliases) {
        public EmojiDefinition {
            if (shortname == null || shortname.isBlank()) {
                throw new IllegalArgumentException("Emoji shortname must not be blank");
            }
            aliases = aliases == null ? List.of() : List.copyOf(aliases);
        }
    }

    /**
     * Builds a catalog from explicit definitions.
     *
     * @param definitions catalog entries
     * @throws MarkdownConfigurationException when a name or alias is declared twice
     */
    public EmojiCatalog(Collection<EmojiDefinition> definitions) {
        for (EmojiDefinition definition : definitions) {
            register(definitionsByShortname, definition.shortname(), definition);
            for (String alias : definition.aliases()) {
                register(definitionsByAlias, alias, definition);
            }
        }
    }

    /**
     * Loads the catalog bundled with the application.
     */
    public static EmojiCatalog loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads a catalog from a classpath resource.
     *
     * @param resourcePath classpath location of the JSON catalog
     * @return loaded catalog
     * @throws MarkdownConfigurationException when the resource is missing or malformed
     */
    public static EmojiCatalog load(String resourcePath) {
        try (InputStream catalogStream = EmojiCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (catalogStream == null) {
                throw new MarkdownConfigurationException("Emoji catalog not found on classpath: " + resourcePath);
            }
            List<EmojiDefinition> definitions = MAPPER.readValue(catalogStream, new TypeReference<List<EmojiDefinition>>() {});
            EmojiCatalog catalog = new EmojiCatalog(definitions);
            logger.info("Loaded {} emoji definitions from {}", catalog.size(), resourcePath);
            return catalog;
        } catch (IOException ioException) {
            throw new MarkdownConfigurationException("Failed to read emoji catalog " + resourcePath, ioException);
        }
    }

    /**
     * Resolves a shortcode as typed by the author.
     *
     * @param typedName name with or without surrounding colons
     * @return match carrying the alias when one was typed; empty for unknown names
     */
    public Optional<EmojiMatch> resolve(String typedName) {
        if (typedName == null) {
            return Optional.empty();
        }
        String name = typedName.strip();
        if (name.length() > 1 && name.startsWith(":") && name.endsWith(":")) {
            name = name.substring(1, name.length() - 1);
        }
        if (name.isEmpty()) {
            return Optional.empty();
        }
        String fallbackText = ":" + name + ":";
        EmojiDefinition canonical = definitionsByShortname.get(name);
        if (canonical != null) {
            return Optional.of(new EmojiMatch(canonical.shortname(), null, canonical.codepoints(), fallbackText));
        }
        EmojiDefinition aliased = definitionsByAlias.get(name);
        if (aliased != null) {
            return Optional.of(new EmojiMatch(aliased.shortname(), name, aliased.codepoints(), fallbackText));
        }
        EmojiReference.Emoji reference = EmojiShortcuts.getEmojiFromShortcut(name);
        if (reference != null) {
            return Optional.of(new EmojiMatch(name, null, referenceCodepoints(reference.unicodeChars), fallbackText));
        }
        return Optional.empty();
    }

    /**
     * Converts flexmark's {@code U+1F1FA U+1F1F8} notation to {@code 1f1fa-1f1f8}.
     *
     * @return the hyphenated sequence, or null for emoji without a Unicode form
     */
    static String referenceCodepoints(String unicodeChars) {
        if (unicodeChars == null || unicodeChars.isBlank()) {
            return null;
        }
        StringJoiner codepoints = new StringJoiner("-");
        for (String token : unicodeChars.strip().split("\\s+")) {
            String hex = token.regionMatches(true, 0, "U+", 0, 2) ? token.substring(2) : token;
            codepoints.add(hex.toLowerCase(Locale.ROOT));
        }
        return codepoints.toString();
    }

    /**
     * Returns the number of canonical entries in the bundled catalog.
     */
    public int size() {
        return definitionsByShortname.size();
    }

    private static void register(Map<String, EmojiDefinition> index, String name, EmojiDefinition definition) {
        EmojiDefinition previous = index.putIfAbsent(name, definition);
        if (previous != null) {
            throw new MarkdownConfigurationException(String.format(Locale.ROOT,
                "Emoji name '%s' is declared by both '%s' and '%s'", name, previous.shortname(), definition.shortname()));
        }
    }
}
