package com.bibliogrant;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SortKeysJUnitTest {

    @Test
    void preprintKey_usesArxivIdentifier() {
        BibRecord r = BibRecord.of("misc", "k", Map.of(
                "eprint", "2107.04567", "year", "2022", "author", "Smith, John", "title", "{B}ig Data"));
        assertEquals(new SortKeys.PreprintKey(2021, 7, 4567, "smith, john big data"), SortKeys.preprintKey(r));
    }

    @Test
    void preprintKey_readsBracedEprint() {
        BibRecord r = BibRecord.of("misc", "k", Map.of("eprint", "{2107.04567}", "year", "2019", "title", "T"));
        assertEquals(new SortKeys.PreprintKey(2021, 7, 4567, " t"), SortKeys.preprintKey(r));
    }

    @Test
    void preprintKey_fallsBackToYear() {
        BibRecord withYear = BibRecord.of("misc", "k", Map.of("eprint", "hal-0001", "year", "2019", "title", "T"));
        assertEquals(new SortKeys.PreprintKey(2019, 0, 0, " t"), SortKeys.preprintKey(withYear));

        BibRecord undated = BibRecord.of("misc", "k", Map.of("title", "T"));
        assertEquals(-1, SortKeys.preprintKey(undated).year());
    }

    @Test
    void publicationKey_usesYearOrDateOrSentinel() {
        assertEquals(2020, SortKeys.publicationKey(BibRecord.of("book", "k", Map.of("date", "2020-05-01"))).year());
        assertEquals(1999, SortKeys.publicationKey(BibRecord.of("book", "k", Map.of("year", "circa 1999"))).year());
        assertEquals(-1, SortKeys.publicationKey(BibRecord.of("book", "k", Map.of())).year());
    }

    @Test
    void secondary_usesEditorWhenNoAuthor() {
        BibRecord r = BibRecord.of("book", "k", Map.of("editor", "Knuth, D.", "title", "Selected \\'Etudes"));
        assertEquals("knuth, d. selected études", SortKeys.secondary(r));
    }

    @Test
    void keys_orderByDateThenText() {
        SortKeys.PreprintKey a = new SortKeys.PreprintKey(2021, 7, 4567, "b");
        SortKeys.PreprintKey b = new SortKeys.PreprintKey(2021, 7, 4568, "a");
        SortKeys.PreprintKey c = new SortKeys.PreprintKey(2021, 7, 4568, "b");
        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(c) < 0);
        assertEquals(0, c.compareTo(new SortKeys.PreprintKey(2021, 7, 4568, "b")));

        SortKeys.PublicationKey undated = new SortKeys.PublicationKey(-1, "z");
        SortKeys.PublicationKey old = new SortKeys.PublicationKey(1900, "a");
        assertTrue(undated.compareTo(old) < 0);
    }

    @Test
    void byPublicationDate_breaksTiesWithAuthorAndTitle() {
        BibRecord zed = BibRecord.of("book", "z", Map.of("author", "Zed, Z.", "year", "2020"));
        BibRecord abe = BibRecord.of("book", "a", Map.of("author", "Abe, A.", "year", "2020"));
        BibRecord older = BibRecord.of("book", "o", Map.of("author", "Old, O.", "year", "2001"));

        List<BibRecord> records = new ArrayList<>(List.of(zed, older, abe));
        records.sort(SortKeys.byPublicationDate());
        assertEquals(List.of(older, abe, zed), records);
    }
}
