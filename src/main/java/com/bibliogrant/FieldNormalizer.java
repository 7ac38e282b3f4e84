package com.bibliogrant;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads fields out of a {@link BibRecord} as clean Unicode text.
 *
 * <p>Every textual value goes through {@link LatexTransliterator} exactly once here, so the
 * classifier and the renderers never see raw markup. Missing fields come back as "".
 */
public final class FieldNormalizer {

    private FieldNormalizer() {
    }

    /** Sentinel year for entries without a usable year; sorts first in ascending order. */
    public static final int UNKNOWN_YEAR = -1;

    private static final String DEFAULT_REPOSITORY = "arXiv";

    private static final Pattern FOUR_DIGITS = Pattern.compile("\\d{4}");

    public static String clean(String value) {
        return value == null ? "" : LatexTransliterator.transliterate(value);
    }

    public static String text(BibRecord record, String name) {
        return clean(record.get(name));
    }

    /**
     * The cleaned value of the first present field among {@code names}, or "".
     */
    public static String firstText(BibRecord record, String... names) {
        return clean(record.firstPresent(names).orElse(""));
    }

    /**
     * Year taken from {@code year}, falling back to the first four characters of {@code date}.
     */
    public static String year(BibRecord record) {
        Optional<String> year = record.field("year");
        if (year.isPresent()) {
            return clean(year.get());
        }
        String date = record.get("date").strip();
        return clean(date.length() > 4 ? date.substring(0, 4) : date);
    }

    /**
     * First four-digit run of {@link #year(BibRecord)}, or {@link #UNKNOWN_YEAR}.
     */
    public static int numericYear(BibRecord record) {
        Matcher m = FOUR_DIGITS.matcher(year(record));
        return m.find() ? Integer.parseInt(m.group()) : UNKNOWN_YEAR;
    }

    /**
     * Full repository identifier, e.g. {@code arXiv:2107.04567 [hep-th]}.
     * The class in brackets is only added for arXiv identifiers.
     */
    public static String repositoryId(BibRecord record) {
        String repo = repository(record).orElse(DEFAULT_REPOSITORY);
        String eprint = text(record, "eprint");
        String eprintClass = text(record, "eprintclass");

        String id = eprint.isEmpty() ? repo : repo + ":" + eprint;
        if (isArxiv(repo) && !eprintClass.isEmpty()) {
            id += " [" + eprintClass + "]";
        }
        return id;
    }

    /**
     * Compact repository identifier without the class, e.g. {@code Arxiv:2107.04567}.
     * Falls back to "preprint" when the entry names neither a repository nor an identifier.
     */
    public static String compactRepositoryId(BibRecord record) {
        Optional<String> named = repository(record);
        String eprint = text(record, "eprint");
        if (named.isEmpty() && eprint.isEmpty()) {
            return "preprint";
        }

        String repo = named.orElse(DEFAULT_REPOSITORY);
        if (isArxiv(repo)) {
            repo = capitalize(repo);
        }
        return eprint.isEmpty() ? repo : repo + ":" + eprint;
    }

    public static String doi(BibRecord record) {
        return record.get("doi").strip();
    }

    public static String url(BibRecord record) {
        return record.get("url").strip();
    }

    private static Optional<String> repository(BibRecord record) {
        return record.firstPresent("eprinttype", "archiveprefix")
                .map(FieldNormalizer::clean)
                .filter(s -> !s.isEmpty());
    }

    private static boolean isArxiv(String repo) {
        return repo.toLowerCase(Locale.ROOT).equals("arxiv");
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) return s;
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
