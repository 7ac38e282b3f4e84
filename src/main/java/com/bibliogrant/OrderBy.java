package com.bibliogrant;

import java.util.Locale;

/**
 * How the bibliography is ordered.
 */
public enum OrderBy {
    /** Order of the .bib file. */
    KEEP_BIB,
    /** Publication year; preprints and publications go into separate sections unless disabled. */
    PUBLICATION_DATE,
    /** arXiv submission date, falling back to the year. */
    PREPRINT_DATE;

    /**
     * Parses the command line spelling ({@code keep_bib}, {@code publication_date},
     * {@code preprint_date}), ignoring case; hyphens are accepted for underscores.
     */
    public static OrderBy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Order must not be empty");
        }
        String normalized = name.strip().replace('-', '_').toUpperCase(Locale.ROOT);
        for (OrderBy value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException(
                "Unknown order '" + name + "' (expected keep_bib, publication_date or preprint_date)");
    }
}
