package com.bibliogrant;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One bibliographic entry: a type tag, a citation key and an ordered map of raw field values.
 *
 * <p>Which fields exist varies from entry to entry, so callers query them by name. A field that
 * is absent and a field whose value is blank are treated alike.
 */
public record BibRecord(String type, String key, Map<String, String> fields) {

    public BibRecord {
        type = type == null ? "" : type.toLowerCase(Locale.ROOT);
        key = key == null ? "" : key;
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static BibRecord of(String type, String key, Map<String, String> fields) {
        return new BibRecord(type, key, fields);
    }

    static BibRecord fromEntry(BibTeXParser.Entry entry) {
        Objects.requireNonNull(entry, "entry");
        return new BibRecord(entry.type(), entry.key(), BibTeXParser.parseFields(entry.raw()));
    }

    /**
     * The raw value of a field, or empty when the field is absent or blank.
     */
    public Optional<String> field(String name) {
        String value = fields.get(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    /**
     * The raw value of a field, or the empty string.
     */
    public String get(String name) {
        return field(name).orElse("");
    }

    /**
     * The first of the given fields that has a value, in priority order.
     */
    public Optional<String> firstPresent(String... names) {
        for (String name : names) {
            Optional<String> value = field(name);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public boolean isType(String candidate) {
        return type.equalsIgnoreCase(candidate);
    }
}
