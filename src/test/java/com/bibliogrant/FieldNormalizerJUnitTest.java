package com.bibliogrant;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldNormalizerJUnitTest {

    private static BibRecord misc(Map<String, String> fields) {
        return BibRecord.of("misc", "k", fields);
    }

    @Test
    void clean_nullAndMarkup() {
        assertEquals("", FieldNormalizer.clean(null));
        assertEquals("Gödel", FieldNormalizer.clean("G{\\\"o}del"));
        assertEquals("", FieldNormalizer.text(misc(Map.of()), "title"));
    }

    @Test
    void year_prefersYearOverDate() {
        assertEquals("2020", FieldNormalizer.year(misc(Map.of("year", "2020", "date", "2019-04-01"))));
        assertEquals("2019", FieldNormalizer.year(misc(Map.of("date", "2019-04-01"))));
        assertEquals("201", FieldNormalizer.year(misc(Map.of("date", "201"))));
        assertEquals("", FieldNormalizer.year(misc(Map.of())));
    }

    @Test
    void numericYear_findsFourDigitsOrSentinel() {
        assertEquals(1999, FieldNormalizer.numericYear(misc(Map.of("year", "circa 1999"))));
        assertEquals(2021, FieldNormalizer.numericYear(misc(Map.of("year", "{2021}"))));
        assertEquals(FieldNormalizer.UNKNOWN_YEAR, FieldNormalizer.numericYear(misc(Map.of("year", "n.d."))));
        assertEquals(-1, FieldNormalizer.numericYear(misc(Map.of())));
    }

    @Test
    void repositoryId_fullForm() {
        assertEquals("arXiv:2107.04567 [hep-th]", FieldNormalizer.repositoryId(
                misc(Map.of("eprint", "2107.04567", "eprintclass", "hep-th"))));
        assertEquals("arXiv:2107.04567", FieldNormalizer.repositoryId(misc(Map.of("eprint", "2107.04567"))));
        assertEquals("arxiv:2107.04567 [cs.LG]", FieldNormalizer.repositoryId(
                misc(Map.of("archiveprefix", "arxiv", "eprint", "2107.04567", "eprintclass", "cs.LG"))));
        assertEquals("HAL:hal-0123", FieldNormalizer.repositoryId(
                misc(Map.of("eprinttype", "HAL", "archiveprefix", "arXiv", "eprint", "hal-0123", "eprintclass", "x"))));
        assertEquals("arXiv", FieldNormalizer.repositoryId(misc(Map.of())));
    }

    @Test
    void compactRepositoryId_capitalizesArxivOnly() {
        assertEquals("Arxiv:2003.00012", FieldNormalizer.compactRepositoryId(misc(Map.of("eprint", "2003.00012"))));
        assertEquals("Arxiv:2003.00012", FieldNormalizer.compactRepositoryId(
                misc(Map.of("eprinttype", "arXiv", "eprint", "2003.00012", "eprintclass", "cs.AI"))));
        assertEquals("bioRxiv:2020.01.01.123", FieldNormalizer.compactRepositoryId(
                misc(Map.of("eprinttype", "bioRxiv", "eprint", "2020.01.01.123"))));
        assertEquals("Arxiv", FieldNormalizer.compactRepositoryId(misc(Map.of("archiveprefix", "arXiv"))));
        assertEquals("preprint", FieldNormalizer.compactRepositoryId(misc(Map.of("title", "Untracked"))));
    }

    @Test
    void doiAndUrl_areTrimmedButNotTransliterated() {
        BibRecord r = misc(Map.of("doi", " 10.1000/a_b ", "url", "https://example.org/~x/a_b"));
        assertEquals("10.1000/a_b", FieldNormalizer.doi(r));
        assertEquals("https://example.org/~x/a_b", FieldNormalizer.url(r));
        assertEquals("", FieldNormalizer.doi(misc(Map.of())));
    }

    @Test
    void firstText_usesPriorityOrder() {
        BibRecord r = misc(Map.of("publisher", "Springer", "organization", "IEEE"));
        assertEquals("Springer", FieldNormalizer.firstText(r, "journal", "publisher", "organization"));
        assertEquals("", FieldNormalizer.firstText(r, "journal", "booktitle"));
    }
}
