package com.bibliogrant;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes assembled lines to a console stream or to a text file.
 *
 * <p>The console adds a blank line between consecutive lines (not after the last one). The file
 * gets the lines exactly as assembled, joined with "\n" and ending with a single newline.
 */
public final class BibliographyWriter {

    private BibliographyWriter() {
    }

    public static void print(List<String> lines, PrintStream out) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(out, "out");
        for (int i = 0; i < lines.size(); i++) {
            out.println(lines.get(i));
            if (i < lines.size() - 1) {
                out.println();
            }
        }
        out.flush();
    }

    public static void save(List<String> lines, Path outFile) throws IOException {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(outFile, "outFile");
        Files.writeString(outFile, toFileContent(lines), StandardCharsets.UTF_8);
    }

    static String toFileContent(List<String> lines) {
        return String.join("\n", lines) + "\n";
    }
}
