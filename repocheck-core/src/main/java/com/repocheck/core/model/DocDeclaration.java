package com.repocheck.core.model;

import java.util.Set;

/**
 * The classes a documentation page pulls in through its auto-include directive.
 *
 * @param classNames documented class names
 */
public record DocDeclaration(
    Set<String> classNames
) {
    /**
     * Compact constructor with validation.
     */
    public DocDeclaration {
        classNames = classNames != null ? Set.copyOf(classNames) : Set.of();
    }

    public boolean documents(String className) {
        return classNames.contains(className);
    }
}
