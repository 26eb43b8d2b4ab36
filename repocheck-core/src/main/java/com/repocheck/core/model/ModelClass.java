package com.repocheck.core.model;

import java.util.Objects;

/**
 * A concrete model implementation class.
 *
 * <p>A class belongs to the module that literally defines it, never to a module
 * that merely re-exports it.
 *
 * @param name simple class name (e.g., "BertForMaskedLM")
 * @param moduleIdentifier identifier of the defining module (e.g., "modeling_bert")
 */
public record ModelClass(
    String name,
    String moduleIdentifier
) {
    /**
     * Compact constructor with validation.
     */
    public ModelClass {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(moduleIdentifier, "moduleIdentifier must not be null");
    }
}
