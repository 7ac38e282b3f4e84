package com.bibliogrant;

/**
 * Rendering category of an entry.
 */
public enum EntryCategory {
    PREPRINT,   // article/unpublished/misc without a journal
    ARTICLE,    // published article with a journal
    GENERIC;    // books, proceedings, theses, reports, ...

    public static EntryCategory of(BibRecord record) {
        if (PreprintClassifier.isPreprint(record)) {
            return PREPRINT;
        }
        return record.isType("article") ? ARTICLE : GENERIC;
    }
}
