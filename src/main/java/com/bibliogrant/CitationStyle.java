package com.bibliogrant;

public enum CitationStyle {
    /** Authors, quoted title, venue details, DOI and URL. */
    FULL,
    /** First author (et al.) and venue/year, or the repository identifier for preprints. */
    COMPACT
}
