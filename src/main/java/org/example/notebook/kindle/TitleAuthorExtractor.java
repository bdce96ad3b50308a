package org.example.notebook.kindle;

import org.example.notebook.model.KindleNotebook;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Range;
import org.jsoup.parser.Parser;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Finds the book title and author in a notebook export. Each export template puts them
 * in a different place, so both are resolved from an ordered list of candidates; the
 * first candidate that yields non-blank text wins.
 *
 * <p>jsoup only locates the candidate element. The captured text is sliced from the raw
 * source, so entities reach {@link TextNormalizer} undecoded, the same as note blocks.
 */
public final class TitleAuthorExtractor {

    public record Candidate(String name, String cssQuery, BiFunction<Element, String, String> capture) {

        Optional<String> extract(Document document, String source) {
            Element element = document.selectFirst(cssQuery);
            if (element == null) {
                return Optional.empty();
            }
            String normalized = TextNormalizer.normalize(capture.apply(element, source));
            return normalized.isEmpty() ? Optional.empty() : Optional.of(normalized);
        }
    }

    public record TitleAuthor(String title, Optional<String> author) {}

    static final List<Candidate> TITLE_CANDIDATES = List.of(
        new Candidate("notebook-title", "[class=kp-notebook-title], [class=bookTitle]", TitleAuthorExtractor::rawInnerMarkup),
        new Candidate("title-tag", "title", TitleAuthorExtractor::rawInnerMarkup)
    );

    static final List<Candidate> AUTHOR_CANDIDATES = List.of(
        new Candidate("notebook-authors", "[class=authors], [class=kp-notebook-subtitle]", TitleAuthorExtractor::rawInnerMarkup),
        new Candidate("meta-author", "meta[name=author][content]", TitleAuthorExtractor::rawContentAttribute)
    );

    private final List<Candidate> titleCandidates;
    private final List<Candidate> authorCandidates;

    public TitleAuthorExtractor() {
        this(TITLE_CANDIDATES, AUTHOR_CANDIDATES);
    }

    public TitleAuthorExtractor(List<Candidate> titleCandidates, List<Candidate> authorCandidates) {
        this.titleCandidates = List.copyOf(titleCandidates);
        this.authorCandidates = List.copyOf(authorCandidates);
    }

    public TitleAuthor extract(String html) {
        String source = html == null ? "" : html;
        Document document = parseTracked(source);
        return new TitleAuthor(
            firstMatch(titleCandidates, document, source).orElse(KindleNotebook.DEFAULT_TITLE),
            firstMatch(authorCandidates, document, source)
        );
    }

    public String extractTitle(String html) {
        return extract(html).title();
    }

    public Optional<String> extractAuthor(String html) {
        return extract(html).author();
    }

    private static Document parseTracked(String source) {
        return Jsoup.parse(source, "", Parser.htmlParser().setTrackPosition(true));
    }

    private Optional<String> firstMatch(List<Candidate> candidates, Document document, String source) {
        for (Candidate candidate : candidates) {
            Optional<String> value = candidate.extract(document, source);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Source text between the element's opening tag and the first closing tag of the same
     * name, e.g. up to the first {@code </div>} even when divs are nested.
     */
    static String rawInnerMarkup(Element element, String source) {
        Range range = element.sourceRange();
        if (!range.isTracked() || range.endPos() > source.length()) {
            return "";
        }
        int close = BlockScanner.indexOfIgnoreCase(source, "</" + element.normalName() + ">", range.endPos());
        return close < 0 ? "" : source.substring(range.endPos(), close);
    }

    static String rawContentAttribute(Element element, String source) {
        Range range = element.sourceRange();
        if (!range.isTracked() || range.endPos() > source.length()) {
            return "";
        }
        String openTag = source.substring(range.startPos(), range.endPos());
        int attributesStart = 1 + element.normalName().length();
        int attributesEnd = openTag.endsWith(">") ? openTag.length() - 1 : openTag.length();
        if (attributesStart > attributesEnd) {
            return "";
        }
        String value = BlockScanner.attributeValue(openTag.substring(attributesStart, attributesEnd), "content");
        return value == null ? "" : value;
    }
}
