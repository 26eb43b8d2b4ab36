package com.repocheck.core.model;

import java.util.Set;

/**
 * Maintained allow-lists exempting classes or files from coverage rules.
 *
 * <p>Membership is an exception and should not be the rule: every entry is a
 * known, reviewed gap.
 *
 * @param ignoreNonTested classes exempt from the tested-coverage check
 * @param ignoreNonDocumented classes exempt from the documented-coverage check
 * @param testFilesWithNoCommonTests test files allowed to have no {@code all_model_classes} declaration
 */
public record ExceptionList(
    Set<String> ignoreNonTested,
    Set<String> ignoreNonDocumented,
    Set<String> testFilesWithNoCommonTests
) {
    /**
     * Compact constructor with validation.
     */
    public ExceptionList {
        ignoreNonTested = ignoreNonTested != null ? Set.copyOf(ignoreNonTested) : Set.of();
        ignoreNonDocumented = ignoreNonDocumented != null ? Set.copyOf(ignoreNonDocumented) : Set.of();
        testFilesWithNoCommonTests = testFilesWithNoCommonTests != null
            ? Set.copyOf(testFilesWithNoCommonTests)
            : Set.of();
    }

    /**
     * Creates an exception list with no entries.
     *
     * @return empty exception list
     */
    public static ExceptionList empty() {
        return new ExceptionList(Set.of(), Set.of(), Set.of());
    }

    public boolean isTestExempt(String className) {
        return ignoreNonTested.contains(className);
    }

    public boolean isDocExempt(String className) {
        return ignoreNonDocumented.contains(className);
    }

    public boolean hasNoCommonTests(String testFile) {
        return testFilesWithNoCommonTests.contains(testFile);
    }
}
