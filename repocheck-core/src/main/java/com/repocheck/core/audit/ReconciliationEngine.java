package com.repocheck.core.audit;

import com.repocheck.core.extractor.DocCoverageExtractor;
import com.repocheck.core.extractor.NamingResolver;
import com.repocheck.core.extractor.TestCoverageExtractor;
import com.repocheck.core.model.DocDeclaration;
import com.repocheck.core.model.DocNameMapping;
import com.repocheck.core.model.Discrepancy;
import com.repocheck.core.model.DiscrepancyKind;
import com.repocheck.core.model.ExceptionList;
import com.repocheck.core.model.ModelClass;
import com.repocheck.core.model.ModelModule;
import com.repocheck.core.model.TestDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reconciles model modules against the coverage their test files and doc pages declare.
 *
 * <p>Runs two independent passes. Each pass walks every module and collects all
 * discrepancies; nothing is raised until the caller hands the list to a {@link Reporter}.
 *
 * <p><b>Tested-coverage pass:</b>
 * <ol>
 *   <li>Expected test file is {@code test_<module>.py}. If the corpus lacks it, report
 *       {@link DiscrepancyKind#MISSING_TEST_FILE} and move on to the next module.</li>
 *   <li>No {@code all_model_classes} declaration: report
 *       {@link DiscrepancyKind#MISSING_TEST_DECLARATION} unless the file is exempt.</li>
 *   <li>Each model class neither declared nor exempt: report
 *       {@link DiscrepancyKind#CLASS_NOT_TESTED}.</li>
 * </ol>
 *
 * <p><b>Documented-coverage pass:</b>
 * <ol>
 *   <li>Expected doc file is the mapped override for the module's family, otherwise
 *       {@code <family><extension>}. If missing, report {@link DiscrepancyKind#MISSING_DOC_FILE}
 *       and move on.</li>
 *   <li>Each model class neither auto-included nor exempt: report
 *       {@link DiscrepancyKind#CLASS_NOT_DOCUMENTED}.</li>
 * </ol>
 *
 * <p>Output order follows module order, then class order, so identical inputs always
 * produce identical lists.
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    static final String TEST_FILE_PREFIX = "test_";
    static final String TEST_FILE_SUFFIX = ".py";

    private final CoverageCorpus testCorpus;
    private final CoverageCorpus docCorpus;
    private final ExceptionList exceptions;
    private final DocNameMapping docNameMapping;
    private final String docExtension;
    private final TestCoverageExtractor testExtractor;
    private final DocCoverageExtractor docExtractor;

    /**
     * Creates an engine.
     *
     * @param testCorpus discovered model test files
     * @param docCorpus discovered model documentation pages
     * @param exceptions maintained allow-lists
     * @param docNameMapping family name to doc filename overrides
     * @param docExtension documentation file extension including the dot
     * @param testExtractor reads {@code all_model_classes} declarations
     * @param docExtractor reads {@code autoclass} directives
     */
    public ReconciliationEngine(CoverageCorpus testCorpus,
                                CoverageCorpus docCorpus,
                                ExceptionList exceptions,
                                DocNameMapping docNameMapping,
                                String docExtension,
                                TestCoverageExtractor testExtractor,
                                DocCoverageExtractor docExtractor) {
        this.testCorpus = Objects.requireNonNull(testCorpus, "testCorpus must not be null");
        this.docCorpus = Objects.requireNonNull(docCorpus, "docCorpus must not be null");
        this.exceptions = Objects.requireNonNull(exceptions, "exceptions must not be null");
        this.docNameMapping = Objects.requireNonNull(docNameMapping, "docNameMapping must not be null");
        this.docExtension = Objects.requireNonNull(docExtension, "docExtension must not be null");
        this.testExtractor = Objects.requireNonNull(testExtractor, "testExtractor must not be null");
        this.docExtractor = Objects.requireNonNull(docExtractor, "docExtractor must not be null");
    }

    /**
     * Returns the test file a module is expected to have.
     *
     * @param module model module
     * @return test file name (e.g., "test_modeling_bert.py")
     */
    public static String expectedTestFile(ModelModule module) {
        return TEST_FILE_PREFIX + module.identifier() + TEST_FILE_SUFFIX;
    }

    /**
     * Returns the documentation page a module is expected to have.
     *
     * @param module model module
     * @return doc file name (e.g., "bert.rst")
     */
    public String expectedDocFile(ModelModule module) {
        return docNameMapping.docFileFor(NamingResolver.familyName(module.identifier()), docExtension);
    }

    // ==================== Tested Coverage ====================

    /**
     * Checks that every model class is declared by its module's test file.
     *
     * @param modules model modules
     * @return all discrepancies, empty if every model is covered
     * @throws IOException if a test file cannot be read
     */
    public List<Discrepancy> checkModelsAreTested(List<ModelModule> modules) throws IOException {
        List<Discrepancy> discrepancies = new ArrayList<>();
        for (ModelModule module : modules) {
            String testFile = expectedTestFile(module);
            if (!testCorpus.contains(testFile)) {
                discrepancies.add(Discrepancy.of(DiscrepancyKind.MISSING_TEST_FILE, module.qualifiedName(), testFile,
                    module.qualifiedName() + " does not have its corresponding test file " + testFile + "."));
                continue;
            }
            discrepancies.addAll(checkModelsAreTested(module, testFile));
        }
        log.debug("Tested-coverage pass: {} modules, {} discrepancies", modules.size(), discrepancies.size());
        return discrepancies;
    }

    private List<Discrepancy> checkModelsAreTested(ModelModule module, String testFile) throws IOException {
        TestDeclaration declaration = testExtractor.extract(testCorpus.read(testFile));

        if (declaration.isAbsent()) {
            if (exceptions.hasNoCommonTests(testFile)) {
                log.debug("{} has no common tests (exempt)", testFile);
                return List.of();
            }
            return List.of(Discrepancy.of(DiscrepancyKind.MISSING_TEST_DECLARATION, module.qualifiedName(), testFile,
                testFile + " should define `all_model_classes` to apply common tests to the models it tests. "
                    + "If this is intentional, add the test filename to `filesWithNoCommonTests` "
                    + "in the repocheck configuration."));
        }

        List<Discrepancy> discrepancies = new ArrayList<>();
        for (ModelClass model : module.classes()) {
            if (!declaration.declares(model.name()) && !exceptions.isTestExempt(model.name())) {
                discrepancies.add(Discrepancy.of(DiscrepancyKind.CLASS_NOT_TESTED, module.qualifiedName(), model.name(),
                    model.name() + " is defined in " + module.qualifiedName() + " but is not tested in "
                        + testCorpus.location(testFile) + ". Add it to the all_model_classes in that file. "
                        + "If common tests should not be applied to that model, add its name to "
                        + "`ignoreNonTested` in the repocheck configuration."));
            }
        }
        return discrepancies;
    }

    // ==================== Documented Coverage ====================

    /**
     * Checks that every model class is auto-included by its family's documentation page.
     *
     * @param modules model modules
     * @return all discrepancies, empty if every model is documented
     * @throws IOException if a doc file cannot be read
     */
    public List<Discrepancy> checkModelsAreDocumented(List<ModelModule> modules) throws IOException {
        List<Discrepancy> discrepancies = new ArrayList<>();
        for (ModelModule module : modules) {
            String docFile = expectedDocFile(module);
            if (!docCorpus.contains(docFile)) {
                discrepancies.add(Discrepancy.of(DiscrepancyKind.MISSING_DOC_FILE, module.qualifiedName(), docFile,
                    module.qualifiedName() + " does not have its corresponding doc file " + docFile + ". "
                        + "If the doc file exists but isn't named " + docFile + ", update `modelNameToDocFile` "
                        + "in the repocheck configuration."));
                continue;
            }
            discrepancies.addAll(checkModelsAreDocumented(module, docFile));
        }
        log.debug("Documented-coverage pass: {} modules, {} discrepancies", modules.size(), discrepancies.size());
        return discrepancies;
    }

    private List<Discrepancy> checkModelsAreDocumented(ModelModule module, String docFile) throws IOException {
        DocDeclaration declaration = docExtractor.extract(docCorpus.read(docFile));

        List<Discrepancy> discrepancies = new ArrayList<>();
        for (ModelClass model : module.classes()) {
            if (!declaration.documents(model.name()) && !exceptions.isDocExempt(model.name())) {
                discrepancies.add(Discrepancy.of(DiscrepancyKind.CLASS_NOT_DOCUMENTED, module.qualifiedName(),
                    model.name(),
                    model.name() + " is defined in " + module.qualifiedName() + " but is not documented in "
                        + docCorpus.location(docFile) + ". Add it to that file. "
                        + "If this model should not be documented, add its name to `ignoreNonDocumented` "
                        + "in the repocheck configuration."));
            }
        }
        return discrepancies;
    }
}
