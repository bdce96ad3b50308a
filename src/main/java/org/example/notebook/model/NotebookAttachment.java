package org.example.notebook.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * A notebook export as handed over by a mail collaborator: raw attachment bytes plus
 * the filename and MIME type reported by the message part.
 */
public record NotebookAttachment(
        String filename,
        String mimeType,
        byte[] data
) {

    public static final String DEFAULT_FILENAME = "notebook.html";

    public NotebookAttachment {
        filename = filename == null || filename.isBlank() ? DEFAULT_FILENAME : filename;
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public boolean isHtml() {
        return filename.toLowerCase(Locale.ROOT).endsWith(".html");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotebookAttachment other)) return false;
        return filename.equals(other.filename)
                && Objects.equals(mimeType, other.mimeType)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(filename, mimeType) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "NotebookAttachment[filename=" + filename + ", mimeType=" + mimeType
                + ", size=" + data.length + "]";
    }
}
