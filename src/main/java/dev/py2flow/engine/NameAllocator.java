package dev.py2flow.engine;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out unique, sanitized names: the first request for a base gets the
 * base itself, later ones get {@code _2}, {@code _3}, ...
 */
final class NameAllocator {

    private final Set<String> used = new HashSet<>();
    private final String prefix;
    private final String suffix;

    NameAllocator(String prefix, String suffix) {
        this.prefix = prefix == null ? "" : prefix;
        this.suffix = suffix == null ? "" : suffix;
    }

    NameAllocator() {
        this("", "");
    }

    /** Marks an existing name as taken. */
    void reserve(String name) {
        used.add(name);
    }

    String allocate(String base) {
        String candidate = sanitize(prefix + base + suffix);
        String name = candidate;
        for (int counter = 2; used.contains(name); counter++) {
            name = candidate + "_" + counter;
        }
        used.add(name);
        return name;
    }

    /** Restricts to {@code [A-Za-z0-9_]}; names never start with a digit. */
    static String sanitize(String raw) {
        String cleaned = raw == null ? "" : raw.strip().replaceAll("[^A-Za-z0-9_]+", "_");
        cleaned = cleaned.replaceAll("_{2,}", "_");
        if (cleaned.length() > 1 && cleaned.endsWith("_")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        if (cleaned.isEmpty() || cleaned.equals("_")) {
            return "dataset";
        }
        return Character.isDigit(cleaned.charAt(0)) ? "ds_" + cleaned : cleaned;
    }

    /** File name without directories and extension, e.g. {@code data/sales.2024.csv} gives {@code sales.2024}. */
    static String stem(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        String file = normalized.substring(normalized.lastIndexOf('/') + 1);
        int query = file.indexOf('?');
        if (query >= 0) {
            file = file.substring(0, query);
        }
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
