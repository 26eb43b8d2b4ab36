package com.repocheck.core.extractor.base;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for extractors that read declared coverage out of raw file text.
 *
 * <p>Test and documentation files are never parsed as code. Each extractor owns a small,
 * documented declaration syntax and matches it with precompiled patterns. This class
 * provides:
 * <ul>
 *   <li>Logger initialization (one logger per extractor class)</li>
 *   <li>First-match and all-matches helpers returning immutable {@link MatchResult}s</li>
 *   <li>Comma-separated list splitting</li>
 * </ul>
 *
 * @param <T> declaration type produced by the extractor
 * @since 1.0.0
 */
public abstract class AbstractRegexExtractor<T> {

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    protected AbstractRegexExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Extracts the declaration from raw file text.
     *
     * @param content file content
     * @return extracted declaration, never null
     */
    public abstract T extract(String content);

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return match if found
     */
    protected Optional<MatchResult> findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.toMatchResult()) : Optional.empty();
    }

    /**
     * Finds the first match among several patterns, trying them in order.
     *
     * @param text text to search
     * @param patterns patterns in priority order
     * @return first match of the first pattern that matches
     */
    protected Optional<MatchResult> findFirstOf(String text, Pattern... patterns) {
        for (Pattern pattern : patterns) {
            Optional<MatchResult> match = findFirst(pattern, text);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * Finds all matches of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matches in order of appearance
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    // ==================== String Utilities ====================

    /**
     * Splits a comma-separated list, trimming entries and dropping empty ones.
     *
     * @param text comma-separated text (may be null)
     * @return non-empty trimmed entries in order
     */
    protected List<String> splitList(String text) {
        List<String> entries = new ArrayList<>();
        if (text == null) {
            return entries;
        }
        for (String part : text.split(",")) {
            String entry = part.strip();
            if (!entry.isEmpty()) {
                entries.add(entry);
            }
        }
        return entries;
    }
}
