package com.tuorg.programservice.service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Ids for synthesized placeholder exercises. One instance per generation
 * run: a monotonic counter plus a record of issued ids, so no two
 * placeholders in a run share an id. Not thread-safe.
 */
public class PlaceholderIdGenerator {

    private final Set<String> issued = new HashSet<>();
    private final Set<String> reserved = new HashSet<>();
    private long counter;

    /** Ids that must never be produced, typically real catalog ids. */
    public void reserve(String id) {
        if (id != null) reserved.add(id);
    }

    public String next(String name) {
        String base = "placeholder-" + slug(name);
        String candidate;
        do {
            candidate = base + "-" + (++counter);
        } while (issued.contains(candidate) || reserved.contains(candidate));
        issued.add(candidate);
        return candidate;
    }

    public int issuedCount() {
        return issued.size();
    }

    private static String slug(String name) {
        if (name == null || name.isBlank()) return "exercise";
        String s = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        s = s.replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "exercise" : s;
    }
}
