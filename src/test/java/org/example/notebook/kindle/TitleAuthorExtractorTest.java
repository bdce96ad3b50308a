package org.example.notebook.kindle;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TitleAuthorExtractorTest {

    private final TitleAuthorExtractor extractor = new TitleAuthorExtractor();

    @Test
    void extractsTitleAndAuthorFromEmailExportTemplate() {
        String html = """
            <div class="bodyContainer">
                <div class="notebookFor">Notebook Export</div>
                <div class="bookTitle">The Atlas &amp; the Map</div>
                <div class="authors">J. Doe</div>
            </div>
            """;

        assertEquals("The Atlas & the Map", extractor.extractTitle(html));
        assertEquals(Optional.of("J. Doe"), extractor.extractAuthor(html));
    }

    @Test
    void extractsTitleAndAuthorFromWebNotebookTemplate() {
        String html = """
            <div id="kp-notebook-annotations">
                <h3 class='kp-notebook-title'>  Atlas  </h3>
                <p class='kp-notebook-subtitle'>Jane <i>Roe</i></p>
            </div>
            """;

        assertEquals("Atlas", extractor.extractTitle(html));
        assertEquals(Optional.of("Jane Roe"), extractor.extractAuthor(html));
    }

    @Test
    void fallsBackToTitleTagAndMetaAuthor() {
        String html = """
            <html>
            <head>
                <title>My Clippings</title>
                <meta name="author" content="Smith &amp; Jones">
            </head>
            <body><p>Nothing else here</p></body>
            </html>
            """;

        assertEquals("My Clippings", extractor.extractTitle(html));
        assertEquals(Optional.of("Smith & Jones"), extractor.extractAuthor(html));
    }

    @Test
    void notebookTitleClassWinsOverEarlierTitleTag() {
        String html = """
            <html>
            <head><title>Browser Tab Title</title></head>
            <body><div class="bookTitle">Real Title</div></body>
            </html>
            """;

        assertEquals("Real Title", extractor.extractTitle(html));
    }

    @Test
    void blankCandidateFallsThroughToNextOne() {
        String html = """
            <html>
            <head><title>Fallback Title</title></head>
            <body><div class="bookTitle">   </div></body>
            </html>
            """;

        assertEquals("Fallback Title", extractor.extractTitle(html));
    }

    @Test
    void classMarkerMustMatchWholeAttribute() {
        String html = "<div class=\"bookTitle extra\">Not a title</div>";

        assertEquals("Kindle Notebook", extractor.extractTitle(html));
    }

    @Test
    void defaultsTitleAndLeavesAuthorAbsentWhenNothingMatches() {
        String html = "<p>plain page</p>";

        assertEquals("Kindle Notebook", extractor.extractTitle(html));
        assertTrue(extractor.extractAuthor(html).isEmpty());
        assertEquals("Kindle Notebook", extractor.extractTitle(null));
    }

    @Test
    void keepsEntitiesOutsideTheNormalizedSetLiteral() {
        String html = """
            <div class="bookTitle">Don&#8217;t Caf&eacute; &amp; Co</div>
            <div class="authors">Ren&eacute;e</div>
            """;

        assertEquals("Don&#8217;t Caf&eacute; & Co", extractor.extractTitle(html));
        assertEquals(Optional.of("Ren&eacute;e"), extractor.extractAuthor(html));
    }

    @Test
    void metaAuthorIsReadFromRawAttributeText() {
        String html = """
            <html><head>
            <meta name="author" content="O&#8217;Brien &amp; Sons">
            </head><body></body></html>
            """;

        assertEquals(Optional.of("O&#8217;Brien & Sons"), extractor.extractAuthor(html));
    }

    @Test
    void capturedTitleStopsAtFirstClosingDiv() {
        String html = "<div class=\"bookTitle\">Outer <div>inner</div> trailing</div>";

        assertEquals("Outer inner", extractor.extractTitle(html));
    }

    @Test
    void extractResolvesTitleAndAuthorInOnePass() {
        TitleAuthorExtractor.TitleAuthor titleAuthor = extractor.extract(
            "<title>Tab</title><div class=\"authors\">J. Doe</div>");

        assertEquals("Tab", titleAuthor.title());
        assertEquals(Optional.of("J. Doe"), titleAuthor.author());
    }
}
