package org.example.notebook.config;

import org.example.notebook.kindle.BlockScanner.BlockMarkers;
import org.example.notebook.kindle.KindleNotebookParser;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NotebookParserConfigTest {

    @Test
    void resolveMarkersUsesConfiguredClasses() {
        BlockMarkers markers = NotebookParserConfig.resolveMarkers(" heading ", "text");

        assertEquals("heading", markers.headingClass());
        assertEquals("text", markers.bodyClass());
    }

    @Test
    void resolveMarkersFallsBackToDefaultsWhenBlank() {
        assertEquals(BlockMarkers.DEFAULT, NotebookParserConfig.resolveMarkers("", "noteText"));
        assertEquals(BlockMarkers.DEFAULT, NotebookParserConfig.resolveMarkers("noteHeading", null));
    }

    @Test
    void kindleNotebookParserReadsConfiguredMarkers() {
        NotebookParserConfig config = new NotebookParserConfig();
        ReflectionTestUtils.setField(config, "headingClass", "heading");
        ReflectionTestUtils.setField(config, "bodyClass", "text");

        KindleNotebookParser parser = config.kindleNotebookParser();

        assertEquals(1, parser.parse("<div class=\"heading\">Highlight</div><div class=\"text\">Body</div>")
                .highlights().size());
    }
}
