package com.bibliogrant;

import java.util.Objects;

/**
 * Renders one entry as a single citation line.
 *
 * <p>Full style:
 * <pre>
 * Authors. "Title." Preprint, arXiv:2107.04567 [hep-th], 2021.
 * Authors. "Title." Nature 2021, 591(7849): 229-233. DOI: 10.1038/x URL: https://...
 * Authors. "Title." 2019.
 * </pre>
 * Compact style:
 * <pre>
 * First Author et al., Arxiv:2107.04567
 * First Author et al., Nature 2021, 591(7849): 229-233
 * </pre>
 * Pieces that are missing are dropped together with their punctuation.
 */
public final class EntryRenderer {

    private EntryRenderer() {
    }

    private static final String[] COMPACT_VENUE_FIELDS = {
            "journaltitle", "journal", "booktitle", "publisher", "organization", "institution", "howpublished"
    };

    public static String render(BibRecord record, CitationStyle style) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(style, "style");

        EntryCategory category = EntryCategory.of(record);
        return switch (style) {
            case FULL -> switch (category) {
                case PREPRINT -> fullPreprint(record);
                case ARTICLE -> fullArticle(record);
                case GENERIC -> fullGeneric(record);
            };
            case COMPACT -> category == EntryCategory.PREPRINT
                    ? compactPreprint(record)
                    : compactPublished(record);
        };
    }

    // ---- full ----

    static String fullPreprint(BibRecord record) {
        StringBuilder core = lead(record);
        appendSpaced(core, "Preprint, " + FieldNormalizer.repositoryId(record));
        String year = FieldNormalizer.year(record);
        if (!year.isEmpty()) core.append(", ").append(year);
        return withLinks(record, ensureTerminalPunctuation(core.toString()));
    }

    static String fullArticle(BibRecord record) {
        StringBuilder core = lead(record);
        String journal = FieldNormalizer.firstText(record, "journaltitle", "journal");
        String year = FieldNormalizer.year(record);
        appendSpaced(core, journal);
        appendSpaced(core, year);
        appendIssueDetails(core, record);
        return withLinks(record, ensureTerminalPunctuation(core.toString()));
    }

    static String fullGeneric(BibRecord record) {
        StringBuilder core = lead(record);
        appendSpaced(core, FieldNormalizer.year(record));
        return withLinks(record, ensureTerminalPunctuation(core.toString()));
    }

    // ---- compact ----

    static String compactPreprint(BibRecord record) {
        return joinNonEmpty(", ", compactAuthor(record), FieldNormalizer.compactRepositoryId(record));
    }

    static String compactPublished(BibRecord record) {
        String venue = FieldNormalizer.firstText(record, COMPACT_VENUE_FIELDS);
        String year = FieldNormalizer.year(record);
        String volume = FieldNormalizer.text(record, "volume");
        String number = FieldNormalizer.text(record, "number");
        String pages = FieldNormalizer.text(record, "pages");

        StringBuilder issue = new StringBuilder(volume);
        if (!number.isEmpty()) issue.append('(').append(number).append(')');
        if (!pages.isEmpty()) {
            if (issue.length() > 0) issue.append(": ");
            issue.append(pages);
        }

        String tail = joinNonEmpty(", ", joinNonEmpty(" ", venue, year), issue.toString());
        return joinNonEmpty(", ", compactAuthor(record), tail);
    }

    private static String compactAuthor(BibRecord record) {
        AuthorNameReshaper.FirstAuthor first = AuthorNameReshaper.firstAuthor(record);
        if (first.name().isEmpty()) {
            return "";
        }
        return first.hasCoauthors() ? first.name() + " et al." : first.name();
    }

    // ---- shared pieces ----

    /** {@code Authors. "Title."} */
    private static StringBuilder lead(BibRecord record) {
        StringBuilder sb = new StringBuilder();
        String authors = AuthorNameReshaper.formatAuthors(record);
        String title = FieldNormalizer.text(record, "title");
        if (!authors.isEmpty()) sb.append(authors).append('.');
        if (!title.isEmpty()) appendSpaced(sb, "\"" + title + ".\"");
        return sb;
    }

    private static void appendIssueDetails(StringBuilder core, BibRecord record) {
        String volume = FieldNormalizer.text(record, "volume");
        String number = FieldNormalizer.text(record, "number");
        String pages = FieldNormalizer.text(record, "pages");
        if (!volume.isEmpty()) core.append(", ").append(volume);
        if (!number.isEmpty()) core.append('(').append(number).append(')');
        if (!pages.isEmpty()) core.append(": ").append(pages);
    }

    private static String withLinks(BibRecord record, String core) {
        StringBuilder sb = new StringBuilder(core);
        String doi = FieldNormalizer.doi(record);
        String url = FieldNormalizer.url(record);
        if (!doi.isEmpty()) sb.append(" DOI: ").append(doi);
        if (!url.isEmpty()) sb.append(" URL: ").append(url);
        return sb.toString();
    }

    static String ensureTerminalPunctuation(String s) {
        String trimmed = s.strip();
        if (trimmed.endsWith(".") || trimmed.endsWith("!") || trimmed.endsWith("?")) {
            return trimmed;
        }
        return trimmed + ".";
    }

    private static void appendSpaced(StringBuilder sb, String piece) {
        if (piece.isEmpty()) return;
        if (sb.length() > 0) sb.append(' ');
        sb.append(piece);
    }

    private static String joinNonEmpty(String separator, String first, String second) {
        if (first.isEmpty()) return second;
        if (second.isEmpty()) return first;
        return first + separator + second;
    }
}
