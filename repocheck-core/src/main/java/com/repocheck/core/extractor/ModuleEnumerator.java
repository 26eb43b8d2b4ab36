package com.repocheck.core.extractor;

import com.repocheck.core.library.LibraryModule;
import com.repocheck.core.library.LibrarySurface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Discovers the library modules that define models.
 *
 * <p>A top-level member is a model module when its name starts with the module prefix,
 * it is not block-listed, and it actually is a module. Block-listed modules hold shared
 * output types, auto-dispatch classes or low-level helpers.
 */
public class ModuleEnumerator {

    private static final Logger log = LoggerFactory.getLogger(ModuleEnumerator.class);

    private final String modulePrefix;
    private final Set<String> ignoredModules;

    /**
     * Creates an enumerator.
     *
     * @param modulePrefix prefix of model module identifiers (e.g., "modeling")
     * @param ignoredModules identifiers never returned
     */
    public ModuleEnumerator(String modulePrefix, Collection<String> ignoredModules) {
        this.modulePrefix = Objects.requireNonNull(modulePrefix, "modulePrefix must not be null");
        this.ignoredModules = Set.copyOf(ignoredModules);
    }

    /**
     * Lists the model modules of a library.
     *
     * @param library library surface
     * @return model modules sorted by identifier
     */
    public List<LibraryModule> enumerate(LibrarySurface library) {
        List<LibraryModule> modules = new ArrayList<>();
        library.topLevelNames().stream()
            .filter(name -> name.startsWith(modulePrefix))
            .filter(name -> !ignoredModules.contains(name))
            .sorted()
            .forEach(name -> {
                Optional<LibraryModule> module = library.module(name);
                if (module.isPresent()) {
                    modules.add(module.get());
                } else {
                    log.debug("Skipping {}: not a module", name);
                }
            });

        log.debug("Found {} model modules in {}", modules.size(), library.name());
        return modules;
    }
}
