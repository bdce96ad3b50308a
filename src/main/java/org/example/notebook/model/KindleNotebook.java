package org.example.notebook.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record KindleNotebook(
        String title,
        String author,
        List<KindleHighlight> highlights
) {

    public static final String DEFAULT_TITLE = "Kindle Notebook";

    public KindleNotebook {
        title = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        author = author == null || author.isBlank() ? null : author;
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
    }
}
