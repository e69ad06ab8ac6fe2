package com.williamcallahan.wikimark.service.markdown;

import com.williamcallahan.wikimark.domain.markdown.EmojiMatch;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmojiCatalogTest {

    private static EmojiCatalog catalog;

    @BeforeAll
    static void loadCatalog() {
        catalog = EmojiCatalog.loadDefault();
    }

    @Test
    void bundledCatalogIsNotEmpty() {
        assertTrue(catalog.size() > 0);
    }

    @Test
    @DisplayName("Names missing from the bundled catalog resolve through flexmark's reference")
    void resolvesReferenceOnlyNames() {
        EmojiMatch match = catalog.resolve(":100:").orElseThrow();

        assertEquals("100", match.shortname());
        assertNull(match.alias());
        assertEquals("1f4af", match.codepoints());
        assertEquals(":100:", match.fallbackText());
    }

    @Test
    void bundledEntryWinsOverReference() {
        assertEquals("2764-fe0f", catalog.resolve(":heart:").orElseThrow().codepoints());
    }

    @Test
    void convertsReferenceNotation() {
        assertEquals("1f1fa-1f1f8", EmojiCatalog.referenceCodepoints("U+1F1FA U+1F1F8"));
        assertEquals("1f604", EmojiCatalog.referenceCodepoints("U+1F604"));
        assertNull(EmojiCatalog.referenceCodepoints(" "));
        assertNull(EmojiCatalog.referenceCodepoints(null));
    }

    @Test
    void resolvesCanonicalNameWithOrWithoutColons() {
        EmojiMatch bare = catalog.resolve("smile").orElseThrow();
        EmojiMatch delimited = catalog.resolve(":smile:").orElseThrow();

        assertEquals("smile", bare.shortname());
        assertNull(bare.alias());
        assertEquals("1f604", bare.codepoints());
        assertEquals(":smile:", bare.fallbackText());
        assertEquals(bare, delimited);
    }

    @Test
    void resolvesAliasToCanonicalEntry() {
        EmojiMatch match = catalog.resolve(":rolling_on_the_floor_laughing:").orElseThrow();

        assertEquals("rofl", match.shortname());
        assertEquals("rolling_on_the_floor_laughing", match.alias());
        assertEquals("1f923", match.codepoints());
    }

    @Test
    void unknownNamesAreEmpty() {
        assertTrue(catalog.resolve(":definitely_not_an_emoji:").isEmpty());
        assertTrue(catalog.resolve("::").isEmpty());
        assertTrue(catalog.resolve(null).isEmpty());
    }

    @Test
    void rejectsDuplicateNames() {
        List<EmojiCatalog.EmojiDefinition> definitions = List.of(
            new EmojiCatalog.EmojiDefinition("smile", "1f604", List.of("happy")),
            new EmojiCatalog.EmojiDefinition("grin", "1f601", List.of("happy")));

        assertThrows(MarkdownConfigurationException.class, () -> new EmojiCatalog(definitions));
    }

    @Test
    void rejectsBlankShortname() {
        assertThrows(IllegalArgumentException.class, () -> new EmojiCatalog.EmojiDefinition(" ", "1f604", null));
    }

    @Test
    void missingResourceIsConfigurationError() {
        assertThrows(MarkdownConfigurationException.class, () -> EmojiCatalog.load("emoji/missing.json"));
    }
}
