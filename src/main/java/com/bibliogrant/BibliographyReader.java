package com.bibliogrant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads {@link BibRecord}s from BibTeX text.
 *
 * <p>Broken entries are skipped with a warning; the rest of the file is still read.
 */
public final class BibliographyReader {

    private static final Logger log = LoggerFactory.getLogger(BibliographyReader.class);

    private BibliographyReader() {
    }

    public static List<BibRecord> read(Path bibFile) throws IOException {
        Objects.requireNonNull(bibFile, "bibFile");
        String content = Files.readString(bibFile, StandardCharsets.UTF_8);
        List<BibRecord> records = parse(content);
        log.info("Read {} entries from {}", records.size(), bibFile);
        return records;
    }

    public static List<BibRecord> parse(String bibtex) {
        BibTeXParser.ParseResult parsed = BibTeXParser.parseEntries(bibtex);
        for (String error : parsed.errors()) {
            log.warn("Skipping malformed BibTeX: {}", error);
        }

        List<BibRecord> records = new ArrayList<>(parsed.entries().size());
        for (BibTeXParser.Entry entry : parsed.entries()) {
            BibRecord record = BibRecord.fromEntry(entry);
            if (record.fields().isEmpty()) {
                log.debug("Entry {} has no fields", entry.key());
            }
            records.add(record);
        }
        return records;
    }
}
