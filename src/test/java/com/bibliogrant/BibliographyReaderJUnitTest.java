package com.bibliogrant;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BibliographyReaderJUnitTest {

    private static final String BIB = """
            % grant references
            @Article{curie1903,
              Author  = {Curie, Marie and Curie, Pierre},
              Title   = {Radioactive {S}ubstances},
              Journal = {Nature},
              Year    = 1903
            }

            @misc{doe2020,
              author = "Doe, Jane",
              title = "A Preprint",
              eprint = {2003.00012},
              archivePrefix = {arXiv}
            }

            @article{nokey title = {Broken}}
            """;

    @Test
    void parse_buildsRecordsInFileOrder() {
        List<BibRecord> records = BibliographyReader.parse(BIB);
        assertEquals(2, records.size());

        BibRecord curie = records.get(0);
        assertEquals("article", curie.type());
        assertEquals("curie1903", curie.key());
        assertEquals("Radioactive {S}ubstances", curie.get("title"));
        assertEquals("1903", curie.get("year"));
        assertEquals("Nature", curie.field("journal").orElseThrow());

        BibRecord doe = records.get(1);
        assertEquals("arXiv", doe.get("archiveprefix"));
        assertTrue(doe.field("journal").isEmpty());
        assertTrue(PreprintClassifier.isPreprint(doe));
    }

    @Test
    void parse_emptyInput() {
        assertTrue(BibliographyReader.parse("").isEmpty());
        assertTrue(BibliographyReader.parse(null).isEmpty());
    }

    @Test
    void read_fromUtf8File(@TempDir Path dir) throws IOException {
        Path bib = dir.resolve("refs.bib");
        Files.writeString(bib, "@book{b, author={Gödel, Kurt}, title={Über formal unentscheidbare Sätze}, year={1931}}",
                StandardCharsets.UTF_8);

        List<BibRecord> records = BibliographyReader.read(bib);
        assertEquals(1, records.size());
        assertEquals("Über formal unentscheidbare Sätze", records.get(0).get("title"));
    }

    @Test
    void read_missingFilePropagates(@TempDir Path dir) {
        assertThrows(NoSuchFileException.class, () -> BibliographyReader.read(dir.resolve("missing.bib")));
    }
}
