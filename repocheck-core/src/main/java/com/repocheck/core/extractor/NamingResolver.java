package com.repocheck.core.extractor;

/**
 * Maps a module identifier to the model family it implements.
 *
 * <p>The family is the last underscore-separated token of the identifier, except for
 * two irregular two-token families:
 * <ul>
 *   <li>{@code modeling_transfo_xl} → {@code transfo_xl} (any identifier ending in {@code _xl})</li>
 *   <li>{@code modeling_xlm_roberta} → {@code xlm_roberta}</li>
 * </ul>
 *
 * <p>No other normalization is applied.
 */
public final class NamingResolver {

    private static final String SEPARATOR = "_";
    private static final String TWO_TOKEN_SUFFIX = "xl";
    private static final String XLM = "xlm";
    private static final String ROBERTA = "roberta";

    private NamingResolver() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Resolves the family name of a module.
     *
     * @param moduleIdentifier underscore-separated module identifier (e.g., "modeling_tf_bert")
     * @return family name (e.g., "bert")
     */
    public static String familyName(String moduleIdentifier) {
        String[] tokens = moduleIdentifier.split(SEPARATOR);
        int last = tokens.length - 1;
        if (last < 1) {
            return tokens[last];
        }
        if (TWO_TOKEN_SUFFIX.equals(tokens[last])) {
            return tokens[last - 1] + SEPARATOR + tokens[last];
        }
        if (ROBERTA.equals(tokens[last]) && XLM.equals(tokens[last - 1])) {
            return tokens[last - 1] + SEPARATOR + tokens[last];
        }
        return tokens[last];
    }
}
