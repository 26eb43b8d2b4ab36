package com.repocheck.core.extractor;

import com.repocheck.core.extractor.base.AbstractRegexExtractor;
import com.repocheck.core.model.DocDeclaration;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extracts the classes a reStructuredText page documents through {@code autoclass}.
 *
 * <pre>{@code
 * BertModel
 * ~~~~~~~~~
 *
 * .. autoclass:: transformers.BertModel
 *     :members: forward
 * }</pre>
 *
 * <p>Only directives naming a class under the library's top-level package count.
 * Duplicate directives collapse.
 */
public class DocCoverageExtractor extends AbstractRegexExtractor<DocDeclaration> {

    private final Pattern directivePattern;

    /**
     * Creates an extractor for the given library.
     *
     * @param libraryName top-level package that documented classes are referenced under
     */
    public DocCoverageExtractor(String libraryName) {
        Objects.requireNonNull(libraryName, "libraryName must not be null");
        this.directivePattern = Pattern.compile("autoclass:: " + Pattern.quote(libraryName) + "\\.(\\S+)\\s+");
    }

    @Override
    public DocDeclaration extract(String content) {
        Set<String> documented = new LinkedHashSet<>();
        for (MatchResult match : findMatches(directivePattern, content)) {
            documented.add(match.group(1));
        }
        return new DocDeclaration(documented);
    }
}
