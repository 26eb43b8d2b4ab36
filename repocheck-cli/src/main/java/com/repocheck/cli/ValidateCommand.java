package com.repocheck.cli;

import com.repocheck.core.config.AuditConfig;
import com.repocheck.core.util.FileUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file against a project checkout.
 *
 * <p>Checks that the configuration file exists and parses, and that the library, tests
 * and docs directories it points to are present.
 */
@Command(
    name = "validate",
    description = "Validate the configuration file and the directories it references",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Config file to validate", defaultValue = "repocheck.yaml")
    private Path configFile;

    @Option(
        names = {"-r", "--root"},
        description = "Project directory the configured paths are relative to (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        log.info("Validating configuration: {}", configFile);

        Path resolvedConfig = AuditCommandSupport.resolveConfigPath(projectPath, configFile);
        if (!Files.isRegularFile(resolvedConfig)) {
            out.println("✗ Configuration file not found: " + resolvedConfig);
            out.flush();
            return AuditCommandSupport.EXIT_FAILURES;
        }

        AuditConfig config;
        try {
            config = AuditCommandSupport.loadConfiguration(projectPath, configFile);
        } catch (IOException e) {
            log.debug("Configuration rejected", e);
            out.println("✗ Invalid configuration: " + e.getMessage());
            out.flush();
            return AuditCommandSupport.EXIT_FAILURES;
        }
        out.println("✓ Configuration parsed: " + resolvedConfig);

        Map<String, String> directories = new LinkedHashMap<>();
        directories.put("library", config.paths().library());
        directories.put("tests", config.paths().tests());
        directories.put("docs", config.paths().docs());

        boolean valid = true;
        for (Map.Entry<String, String> entry : directories.entrySet()) {
            Path directory = projectPath.resolve(entry.getValue());
            if (FileUtils.isDirectory(directory)) {
                out.printf("✓ %s directory: %s%n", entry.getKey(), directory);
            } else {
                out.printf("✗ %s directory missing: %s%n", entry.getKey(), directory);
                valid = false;
            }
        }
        out.flush();

        return valid ? AuditCommandSupport.EXIT_OK : AuditCommandSupport.EXIT_FAILURES;
    }
}
