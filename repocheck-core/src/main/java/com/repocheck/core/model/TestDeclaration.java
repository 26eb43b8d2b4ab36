package com.repocheck.core.model;

import java.util.List;

/**
 * The model classes a test file declares under common-test coverage.
 *
 * <p>An absent declaration (the test file has no {@code all_model_classes}
 * assignment at all) is a distinct state from a present but empty one.
 *
 * @param present whether a declaration was found
 * @param classNames declared class names, in declaration order (empty when absent)
 */
public record TestDeclaration(
    boolean present,
    List<String> classNames
) {
    private static final TestDeclaration ABSENT = new TestDeclaration(false, List.of());

    /**
     * Compact constructor with validation.
     */
    public TestDeclaration {
        classNames = classNames != null ? List.copyOf(classNames) : List.of();
        if (!present && !classNames.isEmpty()) {
            throw new IllegalArgumentException("An absent declaration cannot list classes");
        }
    }

    /**
     * Returns the sentinel for a test file without any declaration.
     *
     * @return absent declaration
     */
    public static TestDeclaration absent() {
        return ABSENT;
    }

    /**
     * Creates a present declaration.
     *
     * @param classNames declared class names (may be empty)
     * @return present declaration
     */
    public static TestDeclaration of(List<String> classNames) {
        return new TestDeclaration(true, classNames);
    }

    public boolean isAbsent() {
        return !present;
    }

    /**
     * Checks if the given class is declared.
     *
     * @param className class name
     * @return true if declared
     */
    public boolean declares(String className) {
        return classNames.contains(className);
    }
}
