package com.bibliogrant;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rewrites BibTeX name lists into reading order.
 *
 * <p>Conversions:
 * <ul>
 *   <li>{@code Last, First M.} → {@code First M. Last}</li>
 *   <li>{@code First M. Last} → unchanged</li>
 *   <li>{@code Last, Jr., First} → {@code First Jr. Last} (every segment between the first and
 *       the last comma is kept as a middle component)</li>
 * </ul>
 */
public final class AuthorNameReshaper {

    private AuthorNameReshaper() {
    }

    public record FirstAuthor(String name, int authorCount) {

        public boolean hasCoauthors() {
            return authorCount > 1;
        }
    }

    /**
     * Raw name list of a record: {@code author}, else {@code editor}, else "".
     */
    public static String nameField(BibRecord record) {
        return record.firstPresent("author", "editor").orElse("");
    }

    public static List<String> splitNames(String nameField) {
        if (nameField == null || nameField.isBlank()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (String part : nameField.replace("\n", " ").split(" and ")) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                names.add(trimmed);
            }
        }
        return names;
    }

    public static String reshape(String rawName) {
        String name = FieldNormalizer.clean(rawName);
        String[] parts = name.split(",", -1);

        if (parts.length == 1) {
            String[] tokens = name.strip().split("\\s+");
            if (tokens.length <= 1) {
                return name.strip();
            }
            String last = tokens[tokens.length - 1];
            String firsts = String.join(" ", Arrays.copyOf(tokens, tokens.length - 1));
            return firsts + " " + last;
        }

        String last = parts[0].strip();
        String firsts = parts[parts.length - 1].strip();
        String middle = Arrays.stream(parts, 1, parts.length - 1)
                .map(String::strip)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.joining(" "));

        String reshaped = middle.isEmpty()
                ? firsts + " " + last
                : firsts + " " + middle + " " + last;
        return reshaped.strip();
    }

    /**
     * All names of the record, reshaped and joined with ", ".
     */
    public static String formatAuthors(BibRecord record) {
        return String.join(", ", reshapedNames(record));
    }

    public static FirstAuthor firstAuthor(BibRecord record) {
        List<String> names = reshapedNames(record);
        if (names.isEmpty()) {
            return new FirstAuthor("", 0);
        }
        return new FirstAuthor(names.get(0), names.size());
    }

    // Names that clean down to nothing, such as "{}", are neither printed nor counted.
    private static List<String> reshapedNames(BibRecord record) {
        return splitNames(nameField(record)).stream()
                .map(AuthorNameReshaper::reshape)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toList());
    }
}
