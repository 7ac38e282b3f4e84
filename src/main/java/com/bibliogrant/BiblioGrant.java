package com.bibliogrant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry points for turning a .bib file into a grant-friendly plain-text bibliography.
 *
 * <p>{@link #print} and {@link #save} produce the same content; printing only adds blank lines
 * between lines for readability on a terminal.
 */
public final class BiblioGrant {

    private static final Logger log = LoggerFactory.getLogger(BiblioGrant.class);

    private BiblioGrant() {
    }

    public static List<String> buildLines(Path bibFile, BibliographyOptions options) throws IOException {
        List<BibRecord> records = BibliographyReader.read(bibFile);
        return BibliographyAssembler.buildLines(records, options);
    }

    public static void print(Path bibFile, BibliographyOptions options, PrintStream out) throws IOException {
        BibliographyWriter.print(buildLines(bibFile, options), out);
    }

    public static void save(Path bibFile, Path outFile, BibliographyOptions options) throws IOException {
        List<String> lines = buildLines(bibFile, options);
        BibliographyWriter.save(lines, outFile);
        log.info("Wrote {} lines to {}", lines.size(), outFile);
    }
}
