package org.example.notebook.kindle;

import org.example.notebook.kindle.MetadataExtractor.HeadingMetadata;
import org.example.notebook.model.HighlightColor;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MetadataExtractorTest {

    @Test
    void extractReadsPageLocationAndColor() {
        HeadingMetadata metadata = MetadataExtractor.extract("Highlight (Yellow) - Page 12 · Location 340");

        assertEquals("12", metadata.page());
        assertEquals("340", metadata.location());
        assertEquals(HighlightColor.YELLOW, metadata.color());
    }

    @Test
    void extractKeepsLocationRangesVerbatim() {
        HeadingMetadata metadata = MetadataExtractor.extract("Highlight (pink) - Location 1406-1408");

        assertEquals("1406-1408", metadata.location());
        assertNull(metadata.page());
        assertEquals(HighlightColor.PINK, metadata.color());
    }

    @Test
    void extractColorUsesReferenceSpellingRegardlessOfSourceCase() {
        assertEquals(Optional.of(HighlightColor.BLUE), MetadataExtractor.extractColor("Highlight(BLUE) - Location 9"));
        assertEquals("Blue", MetadataExtractor.extractColor("highlight (bLuE)").orElseThrow().displayName());
    }

    @Test
    void extractColorToleratesSpacesLeftByStrippedMarkup() {
        String heading = TextNormalizer.normalize(
            "Highlight(<span class=\"highlight_orange\">orange</span>) - Location 77");

        assertEquals(Optional.of(HighlightColor.ORANGE), MetadataExtractor.extractColor(heading));
    }

    @Test
    void extractColorIgnoresColorsOutsideTheKnownSet() {
        assertTrue(MetadataExtractor.extractColor("Highlight (Purple) - Location 5").isEmpty());
        assertTrue(MetadataExtractor.extractColor("Yellow highlight without parentheses").isEmpty());
    }

    @Test
    void extractMatchesKeywordsCaseInsensitively() {
        assertEquals(Optional.of("77"), MetadataExtractor.extractLocation("note - location 77"));
        assertEquals(Optional.of("3-4"), MetadataExtractor.extractPage("PAGE 3-4"));
    }

    @Test
    void extractSkipsNonNumericPageLabels() {
        HeadingMetadata metadata = MetadataExtractor.extract("Note - Page xiv");

        assertNull(metadata.page());
        assertNull(metadata.location());
        assertNull(metadata.color());
    }

    @Test
    void extractReturnsEmptyMetadataForBlankHeading() {
        assertEquals(HeadingMetadata.EMPTY, MetadataExtractor.extract(""));
        assertEquals(HeadingMetadata.EMPTY, MetadataExtractor.extract(null));
    }
}
