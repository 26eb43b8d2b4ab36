package com.repocheck.core.extractor;

import com.repocheck.core.extractor.base.AbstractRegexExtractor;
import com.repocheck.core.model.TestDeclaration;

import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extracts the model classes a test file puts under the common tests.
 *
 * <p>Recognizes an assignment of the form:
 * <pre>{@code
 * all_model_classes = (
 *     (BertModel, BertForMaskedLM)
 *     if is_torch_available()
 *     else ()
 * )
 * }</pre>
 * or with a single level of parentheses:
 * <pre>{@code
 * all_model_classes = (BertModel, BertForMaskedLM) if is_torch_available() else ()
 * }</pre>
 *
 * <p>The nested form is tried first. When neither form is found the result is
 * {@link TestDeclaration#absent()}; a matching assignment with no names is a present,
 * empty declaration.
 */
public class TestCoverageExtractor extends AbstractRegexExtractor<TestDeclaration> {

    static final Pattern NESTED_DECLARATION =
        Pattern.compile("all_model_classes\\s+=\\s+\\(\\s*\\(([^\\)]*)\\)");

    static final Pattern FLAT_DECLARATION =
        Pattern.compile("all_model_classes\\s+=\\s+\\(([^\\)]*)\\)");

    @Override
    public TestDeclaration extract(String content) {
        Optional<MatchResult> match = findFirstOf(content, NESTED_DECLARATION, FLAT_DECLARATION);
        if (match.isEmpty()) {
            return TestDeclaration.absent();
        }

        List<String> names = splitList(match.get().group(1));
        log.trace("Declared model classes: {}", names);
        return TestDeclaration.of(names);
    }
}
