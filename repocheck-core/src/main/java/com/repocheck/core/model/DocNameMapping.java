package com.repocheck.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * Explicit overrides from a model family name to its documentation filename.
 *
 * <p>Only needed where the file name cannot be derived from the family name
 * (irregular spelling, acronyms, compound names).
 *
 * @param overrides family name to documentation filename
 */
public record DocNameMapping(
    Map<String, String> overrides
) {
    /**
     * Compact constructor with validation.
     */
    public DocNameMapping {
        overrides = overrides != null ? Map.copyOf(overrides) : Map.of();
    }

    public static DocNameMapping empty() {
        return new DocNameMapping(Map.of());
    }

    /**
     * Looks up the override for a family name.
     *
     * @param familyName resolved family name
     * @return documentation filename, if overridden
     */
    public Optional<String> overrideFor(String familyName) {
        return Optional.ofNullable(overrides.get(familyName));
    }

    /**
     * Returns the documentation filename for a family.
     *
     * @param familyName resolved family name
     * @param extension documentation file extension including the dot (e.g., ".rst")
     * @return override if present, otherwise {@code familyName + extension}
     */
    public String docFileFor(String familyName, String extension) {
        return overrideFor(familyName).orElse(familyName + extension);
    }
}
