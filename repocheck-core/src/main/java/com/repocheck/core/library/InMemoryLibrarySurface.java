package com.repocheck.core.library;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Library surface backed by an explicit registry of modules and members.
 *
 * <p>Model implementations register themselves (module, class, supertypes) and the
 * audit walks the table instead of introspecting a live library.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LibrarySurface surface = InMemoryLibrarySurface.builder("transformers")
 *     .module("modeling_bert")
 *         .defineClass("BertModel", "BertPreTrainedModel", "PreTrainedModel")
 *         .importFrom("modeling_utils", "PreTrainedModel")
 *         .done()
 *     .topLevelValue("is_torch_available")
 *     .build();
 * }</pre>
 */
public final class InMemoryLibrarySurface implements LibrarySurface {

    private final String name;
    private final Set<String> topLevelNames;
    private final Map<String, LibraryModule> modules;

    private InMemoryLibrarySurface(String name, Set<String> topLevelNames, Map<String, LibraryModule> modules) {
        this.name = name;
        this.topLevelNames = Collections.unmodifiableSet(new TreeSet<>(topLevelNames));
        this.modules = Map.copyOf(modules);
    }

    public static Builder builder(String libraryName) {
        return new Builder(libraryName);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> topLevelNames() {
        return topLevelNames;
    }

    @Override
    public Optional<LibraryModule> module(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    /**
     * Builder for {@link InMemoryLibrarySurface}.
     */
    public static final class Builder {

        private final String libraryName;
        private final Set<String> topLevelNames = new TreeSet<>();
        private final Map<String, ModuleBuilder> modules = new LinkedHashMap<>();

        private Builder(String libraryName) {
            this.libraryName = Objects.requireNonNull(libraryName, "libraryName must not be null");
        }

        /**
         * Starts (or resumes) the registration of a module.
         *
         * @param identifier module identifier
         * @return module builder
         */
        public ModuleBuilder module(String identifier) {
            topLevelNames.add(identifier);
            return modules.computeIfAbsent(identifier, id -> new ModuleBuilder(this, id));
        }

        /**
         * Registers a top-level name that is not a module.
         *
         * @param valueName exposed name
         * @return this builder
         */
        public Builder topLevelValue(String valueName) {
            topLevelNames.add(valueName);
            return this;
        }

        public InMemoryLibrarySurface build() {
            Map<String, LibraryModule> built = new LinkedHashMap<>();
            for (ModuleBuilder module : modules.values()) {
                built.put(module.identifier, module.toModule());
            }
            return new InMemoryLibrarySurface(libraryName, topLevelNames, built);
        }

        private Optional<ExportedMember> definedMember(String moduleIdentifier, String memberName) {
            ModuleBuilder module = modules.get(moduleIdentifier);
            if (module == null) {
                return Optional.empty();
            }
            return module.defined.stream().filter(m -> m.name().equals(memberName)).findFirst();
        }
    }

    /**
     * Registers the members of one module.
     */
    public static final class ModuleBuilder {

        private final Builder parent;
        private final String identifier;
        private final List<ExportedMember> defined = new ArrayList<>();
        private final Map<String, String> imports = new LinkedHashMap<>();

        private ModuleBuilder(Builder parent, String identifier) {
            this.parent = parent;
            this.identifier = identifier;
        }

        /**
         * Defines a class in this module.
         *
         * @param className class name
         * @param ancestors transitive supertype names
         * @return this builder
         */
        public ModuleBuilder defineClass(String className, String... ancestors) {
            defined.add(ExportedMember.classMember(className, identifier, Set.of(ancestors)));
            return this;
        }

        /**
         * Defines a non-class member in this module.
         *
         * @param valueName member name
         * @return this builder
         */
        public ModuleBuilder defineValue(String valueName) {
            defined.add(ExportedMember.value(valueName, identifier));
            return this;
        }

        /**
         * Re-exports members defined in another registered module.
         *
         * <p>Imports are resolved when the surface is built, so the source module may be
         * registered later.
         *
         * @param sourceModule identifier of the defining module
         * @param names imported member names
         * @return this builder
         */
        public ModuleBuilder importFrom(String sourceModule, String... names) {
            for (String importedName : names) {
                imports.put(importedName, sourceModule);
            }
            return this;
        }

        public Builder done() {
            return parent;
        }

        private LibraryModule toModule() {
            List<ExportedMember> members = new ArrayList<>(defined);
            imports.forEach((importedName, sourceModule) -> members.add(
                parent.definedMember(sourceModule, importedName)
                    .orElseGet(() -> ExportedMember.value(importedName, sourceModule))));
            members.sort((a, b) -> a.name().compareTo(b.name()));
            return new LibraryModule(identifier, members);
        }
    }
}
