package com.bibliogrant;

import java.util.Comparator;
import java.util.Locale;

/**
 * Sort keys used to order a bibliography.
 *
 * <p>Both keys end with the lower-cased author and title text, so two entries only compare
 * equal when they print the same names and title.
 */
public final class SortKeys {

    private SortKeys() {
    }

    public record PreprintKey(int year, int month, int sequence, String secondary)
            implements Comparable<PreprintKey> {

        private static final Comparator<PreprintKey> ORDER = Comparator
                .comparingInt(PreprintKey::year)
                .thenComparingInt(PreprintKey::month)
                .thenComparingInt(PreprintKey::sequence)
                .thenComparing(PreprintKey::secondary);

        @Override
        public int compareTo(PreprintKey other) {
            return ORDER.compare(this, other);
        }
    }

    public record PublicationKey(int year, String secondary) implements Comparable<PublicationKey> {

        private static final Comparator<PublicationKey> ORDER = Comparator
                .comparingInt(PublicationKey::year)
                .thenComparing(PublicationKey::secondary);

        @Override
        public int compareTo(PublicationKey other) {
            return ORDER.compare(this, other);
        }
    }

    /**
     * arXiv submission date and sequence; falls back to the entry year with month and sequence 0.
     */
    public static PreprintKey preprintKey(BibRecord record) {
        String secondary = secondary(record);
        return ArxivIdentifier.parse(FieldNormalizer.text(record, "eprint"))
                .map(id -> new PreprintKey(id.year(), id.month(), id.sequence(), secondary))
                .orElseGet(() -> new PreprintKey(FieldNormalizer.numericYear(record), 0, 0, secondary));
    }

    public static PublicationKey publicationKey(BibRecord record) {
        return new PublicationKey(FieldNormalizer.numericYear(record), secondary(record));
    }

    public static Comparator<BibRecord> byPreprintDate() {
        return Comparator.comparing(SortKeys::preprintKey);
    }

    public static Comparator<BibRecord> byPublicationDate() {
        return Comparator.comparing(SortKeys::publicationKey);
    }

    static String secondary(BibRecord record) {
        String names = FieldNormalizer.clean(AuthorNameReshaper.nameField(record));
        String title = FieldNormalizer.text(record, "title");
        return (names + " " + title).toLowerCase(Locale.ROOT);
    }
}
