package com.repocheck.core.audit;

import com.repocheck.core.config.AuditConfig;
import com.repocheck.core.extractor.DocCoverageExtractor;
import com.repocheck.core.extractor.ModelExtractor;
import com.repocheck.core.extractor.ModuleEnumerator;
import com.repocheck.core.extractor.TestCoverageExtractor;
import com.repocheck.core.library.LibrarySurface;
import com.repocheck.core.library.PythonSourceLibrarySurface;
import com.repocheck.core.model.CoveragePass;
import com.repocheck.core.model.Discrepancy;
import com.repocheck.core.model.ModelModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point of an audit run.
 *
 * <p>Enumerates the model modules and their classes once, then runs the requested
 * coverage passes over them:
 * <pre>{@code
 * AuditConfig config = ConfigLoader.load(root.resolve("repocheck.yaml"));
 * RepoAudit audit = RepoAudit.forProject(root, config);
 * for (AuditReport report : audit.runAll()) {
 *     report.orThrow();
 * }
 * }</pre>
 */
public class RepoAudit {

    private static final Logger log = LoggerFactory.getLogger(RepoAudit.class);

    private final ReconciliationEngine engine;
    private final Reporter reporter;
    private final List<ModelModule> modules;

    /**
     * Creates an audit over an already-loaded library and corpora.
     *
     * @param library library surface
     * @param testCorpus model test files
     * @param docCorpus model documentation pages
     * @param config audit configuration
     */
    public RepoAudit(LibrarySurface library, CoverageCorpus testCorpus, CoverageCorpus docCorpus, AuditConfig config) {
        AuditConfig.LibraryConfig libraryConfig = config.library();
        ModuleEnumerator enumerator = new ModuleEnumerator(libraryConfig.modulePrefix(), libraryConfig.ignoredModules());
        ModelExtractor extractor = new ModelExtractor(libraryConfig.baseModelTypes(), libraryConfig.abstractMarkers());

        this.modules = enumerator.enumerate(library).stream()
            .map(module -> extractor.toModelModule(module, library.name()))
            .toList();
        this.engine = new ReconciliationEngine(
            testCorpus,
            docCorpus,
            config.exceptionList(),
            config.docNameMapping(),
            config.docs().extension(),
            new TestCoverageExtractor(),
            new DocCoverageExtractor(library.name())
        );
        this.reporter = new Reporter();
    }

    /**
     * Loads the library sources, test files and doc pages of a project checkout.
     *
     * @param projectRoot repository root that the configured paths are relative to
     * @param config audit configuration
     * @return audit ready to run
     * @throws IOException if the library or a corpus directory cannot be read
     */
    public static RepoAudit forProject(Path projectRoot, AuditConfig config) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        AuditConfig.PathsConfig paths = config.paths();

        LibrarySurface library = PythonSourceLibrarySurface.load(root.resolve(paths.library()), config.library().name());
        CoverageCorpus tests = DirectoryCorpus.open(root.resolve(paths.tests()), root,
            config.tests().filePrefix(), ReconciliationEngine.TEST_FILE_SUFFIX, config.tests().ignoredFiles());
        CoverageCorpus docs = DirectoryCorpus.open(root.resolve(paths.docs()), root,
            "", config.docs().extension(), config.docs().ignoredFiles());

        return new RepoAudit(library, tests, docs, config);
    }

    /**
     * Returns the audited model modules.
     *
     * @return model modules sorted by identifier
     */
    public List<ModelModule> modelModules() {
        return modules;
    }

    public ReconciliationEngine engine() {
        return engine;
    }

    /**
     * Runs one coverage pass.
     *
     * @param pass pass to run
     * @return report of the pass
     * @throws IOException if a test or doc file cannot be read
     */
    public AuditReport run(CoveragePass pass) throws IOException {
        log.info("Checking all models are properly {}.", pass.label());
        List<Discrepancy> discrepancies = switch (pass) {
            case TESTED -> engine.checkModelsAreTested(modules);
            case DOCUMENTED -> engine.checkModelsAreDocumented(modules);
        };
        return reporter.report(pass, discrepancies);
    }

    /**
     * Runs the given passes in declaration order.
     *
     * @param passes passes to run
     * @return one report per pass
     * @throws IOException if a test or doc file cannot be read
     */
    public List<AuditReport> run(Set<CoveragePass> passes) throws IOException {
        List<AuditReport> reports = new ArrayList<>();
        if (passes.isEmpty()) {
            return reports;
        }
        for (CoveragePass pass : EnumSet.copyOf(passes)) {
            reports.add(run(pass));
        }
        return reports;
    }

    /**
     * Runs both passes.
     *
     * @return tested and documented reports
     * @throws IOException if a test or doc file cannot be read
     */
    public List<AuditReport> runAll() throws IOException {
        return run(EnumSet.allOf(CoveragePass.class));
    }
}
