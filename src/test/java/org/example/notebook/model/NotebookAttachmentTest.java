package org.example.notebook.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class NotebookAttachmentTest {

    @Test
    void equalsComparesAttachmentBytesByContent() {
        NotebookAttachment first = new NotebookAttachment("a.html", "text/html", "<p>x</p>".getBytes(StandardCharsets.UTF_8));
        NotebookAttachment second = new NotebookAttachment("a.html", "text/html", "<p>x</p>".getBytes(StandardCharsets.UTF_8));
        NotebookAttachment different = new NotebookAttachment("a.html", "text/html", "<p>y</p>".getBytes(StandardCharsets.UTF_8));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, different);
    }

    @Test
    void bytesAreCopiedOnTheWayInAndOut() {
        byte[] source = {1, 2, 3};
        NotebookAttachment attachment = new NotebookAttachment("a.html", null, source);

        source[0] = 9;
        attachment.data()[1] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, attachment.data());
    }

    @Test
    void missingFilenameAndDataFallBackToDefaults() {
        NotebookAttachment attachment = new NotebookAttachment(" ", null, null);

        assertEquals("notebook.html", attachment.filename());
        assertEquals(0, attachment.data().length);
        assertTrue(attachment.isHtml());
    }

    @Test
    void isHtmlIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));

            assertTrue(new NotebookAttachment("KINDLE HIGHLIGHTS.HTML", "text/html", new byte[0]).isHtml());
            assertFalse(new NotebookAttachment("notebook.pdf", "application/pdf", new byte[0]).isHtml());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
