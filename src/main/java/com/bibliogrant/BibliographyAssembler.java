package com.bibliogrant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Orders a collection of entries and renders it into output lines.
 *
 * <p>Date orders put the newest entries first; {@link BibliographyOptions#reverse()} flips them.
 * Sorting is stable and the keys end with the author/title text, so the same input always
 * yields the same lines.
 *
 * <p>Only the grouped publication order emits blank lines itself: each section is a header, a
 * blank line, and the entries separated by blank lines; the two sections are separated by one
 * more blank line.
 */
public final class BibliographyAssembler {

    private static final Logger log = LoggerFactory.getLogger(BibliographyAssembler.class);

    public static final String PREPRINTS_HEADER = "PREPRINTS";
    public static final String PUBLICATIONS_HEADER = "PUBLICATIONS";

    private BibliographyAssembler() {
    }

    public static List<String> buildLines(List<BibRecord> records, BibliographyOptions options) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(options, "options");

        CitationStyle style = options.style();
        List<String> lines = switch (options.orderBy()) {
            case KEEP_BIB -> {
                List<BibRecord> ordered = new ArrayList<>(records);
                if (options.reverse()) {
                    Collections.reverse(ordered);
                }
                yield render(ordered, style);
            }
            case PREPRINT_DATE -> render(sorted(records, SortKeys.byPreprintDate(), options.reverse()), style);
            case PUBLICATION_DATE -> options.groupPreprints()
                    ? grouped(records, options)
                    : render(sorted(records, SortKeys.byPublicationDate(), options.reverse()), style);
        };

        log.debug("Assembled {} lines from {} entries ({})", lines.size(), records.size(), options);
        return lines;
    }

    private static List<String> grouped(List<BibRecord> records, BibliographyOptions options) {
        List<BibRecord> preprints = new ArrayList<>();
        List<BibRecord> publications = new ArrayList<>();
        for (BibRecord record : records) {
            if (PreprintClassifier.isPreprint(record)) {
                preprints.add(record);
            } else {
                publications.add(record);
            }
        }

        List<String> lines = new ArrayList<>();
        appendSection(lines, PREPRINTS_HEADER,
                sorted(preprints, SortKeys.byPreprintDate(), options.reverse()), options.style());
        appendSection(lines, PUBLICATIONS_HEADER,
                sorted(publications, SortKeys.byPublicationDate(), options.reverse()), options.style());
        return lines;
    }

    private static void appendSection(List<String> lines, String header, List<BibRecord> entries, CitationStyle style) {
        if (entries.isEmpty()) {
            return;
        }
        if (!lines.isEmpty()) {
            lines.add("");
        }
        lines.add(header);
        lines.add("");
        for (int i = 0; i < entries.size(); i++) {
            lines.add(EntryRenderer.render(entries.get(i), style));
            if (i != entries.size() - 1) {
                lines.add("");
            }
        }
    }

    private static List<BibRecord> sorted(List<BibRecord> records, Comparator<BibRecord> ascending, boolean oldestFirst) {
        List<BibRecord> copy = new ArrayList<>(records);
        copy.sort(oldestFirst ? ascending : ascending.reversed());
        return copy;
    }

    private static List<String> render(List<BibRecord> records, CitationStyle style) {
        List<String> lines = new ArrayList<>(records.size());
        for (BibRecord record : records) {
            lines.add(EntryRenderer.render(record, style));
        }
        return lines;
    }
}
