package com.repocheck.core.library;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of a model library's exported namespace.
 *
 * <p>The audit depends only on this capability set: which names the library exposes,
 * which of them are modules, and per module which members it exposes together with
 * their type information. How the library is loaded is up to the implementation.
 *
 * @see InMemoryLibrarySurface
 * @see PythonSourceLibrarySurface
 */
public interface LibrarySurface {

    /**
     * Returns the library's top-level package name (e.g., "transformers").
     *
     * <p>Used to qualify module names in reports and to match documentation directives.
     *
     * @return library name
     */
    String name();

    /**
     * Returns every name exposed by the library's top-level namespace.
     *
     * <p>Includes modules as well as classes, functions and constants re-exported
     * at the top level.
     *
     * @return top-level names
     */
    Set<String> topLevelNames();

    /**
     * Resolves a top-level name to a module.
     *
     * @param name top-level name
     * @return the module, or empty if the name is unknown or not a module
     */
    Optional<LibraryModule> module(String name);
}
