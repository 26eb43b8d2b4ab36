package com.repocheck.cli;

import com.repocheck.core.audit.ReconciliationEngine;
import com.repocheck.core.audit.RepoAudit;
import com.repocheck.core.config.AuditConfig;
import com.repocheck.core.config.ConfigLoader;
import com.repocheck.core.model.ModelClass;
import com.repocheck.core.model.ModelModule;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the audited model modules.
 *
 * <p>Shows, per model module, the model classes found and the test and documentation
 * files the audit expects for it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * repocheck list
 * repocheck list /path/to/transformers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List model modules, their model classes and expected coverage files",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: repocheck.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        RepoAudit audit;
        try {
            AuditConfig config = AuditCommandSupport.loadConfiguration(projectPath, configPath);
            audit = RepoAudit.forProject(projectPath, config);
        } catch (IOException e) {
            log.error("Failed to load project {}: {}", projectPath, e.getMessage());
            spec.commandLine().getErr().println("✗ Failed to load project: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return AuditCommandSupport.EXIT_ERROR;
        }

        List<ModelModule> modules = audit.modelModules();
        ReconciliationEngine engine = audit.engine();

        out.println("Model Modules:");
        out.println();

        for (ModelModule module : modules) {
            out.printf("  • %s%n", module.qualifiedName());
            out.printf("    Test file: %s%n", ReconciliationEngine.expectedTestFile(module));
            out.printf("    Doc file: %s%n", engine.expectedDocFile(module));
            for (ModelClass model : module.classes()) {
                out.printf("    - %s%n", model.name());
            }
            out.println();
        }

        if (modules.isEmpty()) {
            out.println("  No model modules found.");
        }
        out.flush();

        return AuditCommandSupport.EXIT_OK;
    }
}
