package com.tuorg.programservice.service;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Canonical equipment names. Both the selector and the validator go through
 * here so an exercise accepted by one is never rejected by the other.
 */
@Component
public class EquipmentNormalizer {

    private static final Map<String, List<String>> PRESETS = Map.of(
            "full_gym", List.of("barbell", "dumbbells", "cables", "machines", "bench", "rack",
                    "pull_up_bar", "leg_press_machine", "leg_curl_machine", "squat_rack"),
            "home_basic", List.of("dumbbells", "bench", "resistance_bands", "pull_up_bar"),
            "home_advanced", List.of("barbell", "dumbbells", "bench", "rack", "cables",
                    "squat_rack", "pull_up_bar"),
            "bodyweight", List.of("bodyweight", "pull_up_bar")
    );

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("dumbbell", "dumbbells"),
            Map.entry("cable", "cables"),
            Map.entry("machine", "machines"),
            Map.entry("power_rack", "rack"),
            Map.entry("squat_rack", "rack"),
            Map.entry("pullup_bar", "pull_up_bar"),
            Map.entry("pull-up_bar", "pull_up_bar"),
            Map.entry("barbell_bench", "bench"),
            Map.entry("flat_bench", "bench"),
            Map.entry("incline_bench", "bench")
    );

    // Entries in an exercise's own list that mean "nothing required".
    private static final Set<String> NO_EQUIPMENT = Set.of("bodyweight", "none");

    /** Expands presets, resolves aliases and drops blanks and duplicates. Order is kept. */
    public Set<String> normalize(Collection<String> equipment) {
        Set<String> out = new LinkedHashSet<>();
        if (equipment == null) return out;
        for (String raw : equipment) {
            String key = canonicalKey(raw);
            if (key.isEmpty()) continue;
            List<String> preset = PRESETS.get(key);
            if (preset != null) {
                for (String item : preset) out.add(ALIASES.getOrDefault(item, item));
            } else {
                out.add(ALIASES.getOrDefault(key, key));
            }
        }
        return out;
    }

    /** What an exercise needs, with "bodyweight"/"none" removed. */
    public Set<String> required(Collection<String> exerciseEquipment) {
        Set<String> required = new LinkedHashSet<>();
        if (exerciseEquipment == null) return required;
        for (String raw : exerciseEquipment) {
            String key = canonicalKey(raw);
            if (key.isEmpty() || NO_EQUIPMENT.contains(key)) continue;
            required.add(ALIASES.getOrDefault(key, key));
        }
        return required;
    }

    /** Subset rule: everything the exercise needs is available. Empty needs always pass. */
    public boolean isSatisfiedBy(Collection<String> exerciseEquipment, Collection<String> available) {
        Set<String> required = required(exerciseEquipment);
        if (required.isEmpty()) return true;
        return normalize(available).containsAll(required);
    }

    /** Items the exercise needs that are not available, for error messages. */
    public Set<String> missing(Collection<String> exerciseEquipment, Collection<String> available) {
        Set<String> missing = required(exerciseEquipment);
        missing.removeAll(normalize(available));
        return missing;
    }

    private static String canonicalKey(String raw) {
        if (raw == null) return "";
        return raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
