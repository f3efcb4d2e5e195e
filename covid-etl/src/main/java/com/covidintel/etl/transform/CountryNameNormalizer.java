package com.covidintel.etl.transform;

import java.util.Map;
import java.util.Set;

/**
 * Maps the source's country aliases onto one canonical spelling so snapshots
 * and historical series join on the same name.
 *
 * Placeholder values ("null", "N/A", ...) become null and are then reported by
 * the null_required_fields check rather than silently dropped.
 */
public class CountryNameNormalizer {

    private static final Set<String> PLACEHOLDERS = Set.of("", "null", "undefined", "n/a", "unknown");

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("US", "United States"),
            Map.entry("USA", "United States"),
            Map.entry("United States of America", "United States"),
            Map.entry("UK", "United Kingdom"),
            Map.entry("Britain", "United Kingdom"),
            Map.entry("Great Britain", "United Kingdom"),
            Map.entry("S. Korea", "Korea, South"),
            Map.entry("South Korea", "Korea, South"),
            Map.entry("North Korea", "Korea, North"),
            Map.entry("Czech Republic", "Czechia"),
            Map.entry("Macedonia", "North Macedonia"),
            Map.entry("Burma", "Myanmar"),
            Map.entry("Ivory Coast", "Cote d'Ivoire"),
            Map.entry("Congo (Kinshasa)", "Congo, Democratic Republic of the"),
            Map.entry("DRC", "Congo, Democratic Republic of the"),
            Map.entry("Congo (Brazzaville)", "Congo")
    );

    public String normalize(String name) {
        if (name == null) return null;
        String trimmed = name.trim().replaceAll("\\s+", " ");
        if (PLACEHOLDERS.contains(trimmed.toLowerCase())) return null;
        return ALIASES.getOrDefault(trimmed, trimmed);
    }
}
