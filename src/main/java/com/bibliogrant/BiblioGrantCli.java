package com.bibliogrant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line front end.
 *
 * <pre>
 * bibliogrant refs.bib [--order-by keep_bib|publication_date|preprint_date]
 *                      [--reverse] [--compact] [--no-group-preprints] [--out output.txt]
 * </pre>
 *
 * Option defaults may also be set in {@code ~/.bibliogrant.properties}, e.g. {@code order-by = publication_date}.
 */
@Command(
        name = "bibliogrant",
        version = "bibliogrant 1.0.0",
        mixinStandardHelpOptions = true,
        sortOptions = false,
        defaultValueProvider = CommandLine.PropertiesDefaultProvider.class,
        description = "Turn a BibTeX .bib file into a grant-friendly plain-text bibliography."
)
public class BiblioGrantCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BiblioGrantCli.class);

    static final int EXIT_IO_ERROR = 1;

    @Parameters(index = "0", paramLabel = "BIBFILE", description = "Path to the .bib file")
    Path bibFile;

    @Option(names = "--order-by", paramLabel = "ORDER", defaultValue = "keep_bib",
            converter = OrderByConverter.class,
            description = "Sorting criterion: keep_bib, publication_date or preprint_date (default: ${DEFAULT-VALUE})")
    OrderBy orderBy;

    @Option(names = "--reverse",
            description = "Reverse the chosen ordering (oldest first for date-based sorts; reverse .bib order for keep_bib)")
    boolean reverse;

    @Option(names = "--compact",
            description = "Compact mode: 'First Author et al., Venue Year, Vol(Issue): Pages' or 'First Author et al., Arxiv:ID'")
    boolean compact;

    @Option(names = "--no-group-preprints",
            description = "With publication_date, do NOT print preprints and publications as separate sections")
    boolean noGroupPreprints;

    @Option(names = "--out", paramLabel = "FILE",
            description = "Save to this file instead of printing to stdout")
    Path out;

    private final PrintStream stdout;

    public BiblioGrantCli() {
        this(System.out);
    }

    BiblioGrantCli(PrintStream stdout) {
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        System.exit(execute(System.out, args));
    }

    static int execute(PrintStream stdout, String... args) {
        return new CommandLine(new BiblioGrantCli(stdout)).execute(args);
    }

    BibliographyOptions options() {
        return new BibliographyOptions(orderBy, reverse, !noGroupPreprints, compact);
    }

    @Override
    public Integer call() {
        BibliographyOptions options = options();
        try {
            if (out != null) {
                BiblioGrant.save(bibFile, out, options);
            } else {
                BiblioGrant.print(bibFile, options, stdout);
            }
        } catch (IOException e) {
            log.error("Cannot process {}{}: {}", bibFile, out == null ? "" : " into " + out, e.toString());
            return EXIT_IO_ERROR;
        }
        return CommandLine.ExitCode.OK;
    }

    public static final class OrderByConverter implements CommandLine.ITypeConverter<OrderBy> {
        @Override
        public OrderBy convert(String value) {
            return OrderBy.fromName(value);
        }
    }
}
