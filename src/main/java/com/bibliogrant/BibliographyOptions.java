package com.bibliogrant;

import java.util.Objects;

/**
 * Options controlling how a bibliography is ordered and rendered.
 *
 * @param orderBy        ordering mode
 * @param reverse        for date orders: oldest first instead of newest first; for
 *                       {@link OrderBy#KEEP_BIB}: reverse file order
 * @param groupPreprints with {@link OrderBy#PUBLICATION_DATE}: print a PREPRINTS section before
 *                       a PUBLICATIONS section
 * @param compact        compact one-line citations instead of full ones
 */
public record BibliographyOptions(OrderBy orderBy, boolean reverse, boolean groupPreprints, boolean compact) {

    public BibliographyOptions {
        Objects.requireNonNull(orderBy, "orderBy");
    }

    public static BibliographyOptions defaults() {
        return new BibliographyOptions(OrderBy.KEEP_BIB, false, true, false);
    }

    public BibliographyOptions withOrderBy(OrderBy value) {
        return new BibliographyOptions(value, reverse, groupPreprints, compact);
    }

    public BibliographyOptions withReverse(boolean value) {
        return new BibliographyOptions(orderBy, value, groupPreprints, compact);
    }

    public BibliographyOptions withGroupPreprints(boolean value) {
        return new BibliographyOptions(orderBy, reverse, value, compact);
    }

    public BibliographyOptions withCompact(boolean value) {
        return new BibliographyOptions(orderBy, reverse, groupPreprints, value);
    }

    public CitationStyle style() {
        return compact ? CitationStyle.COMPACT : CitationStyle.FULL;
    }
}
