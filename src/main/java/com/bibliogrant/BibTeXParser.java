package com.bibliogrant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small, resilient BibTeX entry parser.
 *
 * <p>Goal: reliably extract entries, their keys and their fields from real-world .bib files.
 * An entry starts with '@' followed by an entry type, then a brace-delimited or
 * paren-delimited body.
 *
 * <p>The scanner:
 * <ul>
 *   <li>Ignores parens that occur inside quoted strings or braced values</li>
 *   <li>Treats a quote inside a braced value as a literal character</li>
 *   <li>Handles escaped quotes (\")</li>
 *   <li>Handles nested braces</li>
 *   <li>Skips @comment/@preamble/@string (not reference entries)</li>
 * </ul>
 *
 * <p>Field values are returned raw: LaTeX markup is preserved for {@link LatexTransliterator}.
 */
public final class BibTeXParser {

    private BibTeXParser() {
    }

    public static ParseResult parseEntries(String input) {
        List<Entry> entries = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        if (input == null || input.isEmpty()) {
            return new ParseResult(entries, errors);
        }

        int n = input.length();
        int i = 0;

        while (i < n) {
            int at = input.indexOf('@', i);
            if (at < 0) break;

            int typeStart = at + 1;
            while (typeStart < n && Character.isWhitespace(input.charAt(typeStart))) typeStart++;
            if (typeStart >= n) break;

            int typeEnd = typeStart;
            while (typeEnd < n) {
                char c = input.charAt(typeEnd);
                if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
                    typeEnd++;
                } else {
                    break;
                }
            }

            if (typeEnd == typeStart) {
                // Stray '@', e.g. inside an e-mail address in a comment
                i = at + 1;
                continue;
            }

            String type = input.substring(typeStart, typeEnd).trim().toLowerCase();

            int j = typeEnd;
            while (j < n && Character.isWhitespace(input.charAt(j))) j++;
            if (j >= n) break;

            char open = input.charAt(j);
            if (open != '{' && open != '(') {
                i = j + 1;
                continue;
            }
            char close = (open == '{') ? '}' : ')';

            // The key runs up to the first top-level comma of the body.
            int k = j + 1;
            while (k < n && Character.isWhitespace(input.charAt(k))) k++;

            int keyStart = k;
            boolean inQuotes = false;
            boolean escaped = false;

            while (k < n) {
                char c = input.charAt(k);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inQuotes = !inQuotes;
                } else if (!inQuotes && (c == ',' || c == close || c == '=')) {
                    break;
                }
                k++;
            }

            String key = null;
            if (k > keyStart && k < n && input.charAt(k) != '=') {
                key = input.substring(keyStart, k).trim();
                if (key.isEmpty()) key = null;
            }

            // Find the matching closing brace/paren for the entry. A '"' only delimits a value
            // outside braces; inside {...} it is a literal character.
            int depth = 1;
            int braces = 0;
            int p = j + 1;
            inQuotes = false;
            escaped = false;

            while (p < n && depth > 0) {
                char c = input.charAt(p);
                int valueBraces = (open == '{') ? depth - 1 : braces;
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    if (valueBraces == 0) inQuotes = !inQuotes;
                } else if (open == '{') {
                    if (c == '{') depth++;
                    else if (c == '}') depth--;
                } else if (c == '{') {
                    braces++;
                } else if (c == '}') {
                    braces = Math.max(0, braces - 1);
                } else if (!inQuotes && braces == 0) {
                    if (c == '(') depth++;
                    else if (c == ')') depth--;
                }
                p++;
            }

            if (depth != 0) {
                errors.add("Unclosed entry starting at index " + at + " (@" + type + ")");
                i = n;
                continue;
            }

            int entryEndExclusive = p;
            String raw = input.substring(at, entryEndExclusive).trim();

            if (!type.equals("comment") && !type.equals("preamble") && !type.equals("string")) {
                if (key == null) {
                    errors.add("Entry without key at index " + at + " (@" + type + ")");
                } else {
                    entries.add(new Entry(type, key, raw));
                }
            }

            i = entryEndExclusive;
        }

        return new ParseResult(entries, errors);
    }

    public record Entry(String type, String key, String raw) {}

    public record ParseResult(List<Entry> entries, List<String> errors) {}

    /**
     * Extracts every field of a raw BibTeX entry, in declaration order.
     *
     * <p>Supports {@code field = { ... }} with nested braces, {@code field = "..."} with escaped
     * quotes, and bare values (numbers, month macros) up to the next comma. Field names are
     * lower-cased; when a field is repeated the first occurrence wins. Internal whitespace runs,
     * including newlines, are collapsed to one space.
     */
    public static Map<String, String> parseFields(String rawEntry) {
        if (rawEntry == null || rawEntry.isBlank()) return Map.of();

        // Start scanning after the comma that ends the key.
        int start = rawEntry.indexOf(',');
        if (start < 0) return Map.of();

        Map<String, String> fields = new LinkedHashMap<>();
        int n = rawEntry.length();
        int i = start + 1;

        while (i < n) {
            while (i < n) {
                char c = rawEntry.charAt(i);
                if (Character.isWhitespace(c) || c == ',') i++;
                else break;
            }
            if (i >= n) break;

            char c = rawEntry.charAt(i);
            if (c == '}' || c == ')') break;

            int nameStart = i;
            while (i < n) {
                char cc = rawEntry.charAt(i);
                if (Character.isLetterOrDigit(cc) || cc == '_' || cc == '-' || cc == ':' || cc == '.') i++;
                else break;
            }
            if (i == nameStart) {
                i++;
                continue;
            }
            String fieldName = rawEntry.substring(nameStart, i).toLowerCase();

            while (i < n && Character.isWhitespace(rawEntry.charAt(i))) i++;
            if (i >= n || rawEntry.charAt(i) != '=') {
                // malformed; keep scanning from here
                continue;
            }
            i++;
            while (i < n && Character.isWhitespace(rawEntry.charAt(i))) i++;
            if (i >= n) break;

            char open = rawEntry.charAt(i);
            String value;

            if (open == '{') {
                int depth = 1;
                int p = i + 1;
                boolean escaped = false;
                while (p < n && depth > 0) {
                    char pc = rawEntry.charAt(p);
                    if (escaped) {
                        escaped = false;
                    } else if (pc == '\\') {
                        escaped = true;
                    } else if (pc == '{') {
                        depth++;
                    } else if (pc == '}') {
                        depth--;
                    }
                    p++;
                }
                if (depth != 0) {
                    // unbalanced; nothing after this point can be trusted
                    break;
                }
                value = rawEntry.substring(i + 1, p - 1);
                i = p;
            } else if (open == '"') {
                int p = i + 1;
                boolean escaped = false;
                int depth = 0;
                while (p < n) {
                    char pc = rawEntry.charAt(p);
                    if (escaped) {
                        escaped = false;
                    } else if (pc == '\\') {
                        escaped = true;
                    } else if (pc == '{') {
                        depth++;
                    } else if (pc == '}') {
                        depth = Math.max(0, depth - 1);
                    } else if (pc == '"' && depth == 0) {
                        break;
                    }
                    p++;
                }
                if (p >= n) break;
                value = rawEntry.substring(i + 1, p);
                i = p + 1;
            } else {
                int p = i;
                while (p < n) {
                    char pc = rawEntry.charAt(p);
                    if (pc == ',' || pc == '}' || pc == ')') break;
                    p++;
                }
                value = rawEntry.substring(i, p);
                i = p;
            }

            fields.putIfAbsent(fieldName, value.replaceAll("\\s+", " ").trim());
        }

        return Collections.unmodifiableMap(fields);
    }
}
