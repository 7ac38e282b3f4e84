package com.bibliogrant;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Submission date and sequence number decoded from an arXiv identifier.
 *
 * <p>Two formats are recognised:
 * <ul>
 *   <li>new style (since 2007): {@code YYMM.NNNNN}, e.g. {@code 2107.04567}</li>
 *   <li>old style: {@code archive/YYMMNNN}, e.g. {@code astro-ph/9901023}; years 90-99 belong to
 *       the 1900s</li>
 * </ul>
 * Months outside 1..12 are clamped.
 */
public record ArxivIdentifier(int year, int month, int sequence) {

    private static final Pattern NEW_STYLE = Pattern.compile("^(\\d{2})(\\d{2})\\.(\\d{4,5})$");

    private static final Pattern OLD_STYLE = Pattern.compile(
            "^[a-z\\-]+/(\\d{2})(\\d{2})(\\d{3,4})$", Pattern.CASE_INSENSITIVE);

    private static final int OLD_STYLE_CENTURY_PIVOT = 90;

    public static Optional<ArxivIdentifier> parse(String eprint) {
        if (eprint == null || eprint.isBlank()) {
            return Optional.empty();
        }
        String id = eprint.strip();

        Matcher m = NEW_STYLE.matcher(id);
        if (m.matches()) {
            int yy = Integer.parseInt(m.group(1));
            return Optional.of(new ArxivIdentifier(2000 + yy, clampMonth(m.group(2)), Integer.parseInt(m.group(3))));
        }

        m = OLD_STYLE.matcher(id);
        if (m.matches()) {
            int yy = Integer.parseInt(m.group(1));
            int year = yy >= OLD_STYLE_CENTURY_PIVOT ? 1900 + yy : 2000 + yy;
            return Optional.of(new ArxivIdentifier(year, clampMonth(m.group(2)), Integer.parseInt(m.group(3))));
        }

        return Optional.empty();
    }

    private static int clampMonth(String mm) {
        return Math.max(1, Math.min(Integer.parseInt(mm), 12));
    }
}
