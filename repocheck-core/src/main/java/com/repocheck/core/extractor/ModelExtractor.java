package com.repocheck.core.extractor;

import com.repocheck.core.library.LibraryModule;
import com.repocheck.core.model.ModelClass;
import com.repocheck.core.model.ModelModule;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Extracts the concrete model classes a module defines.
 *
 * <p>A member qualifies when it:
 * <ol>
 *   <li>is a class,</li>
 *   <li>derives from one of the base model types,</li>
 *   <li>is defined in the module itself (re-exported imports are skipped), and</li>
 *   <li>has no abstract marker (e.g. {@code PreTrained}) in its name.</li>
 * </ol>
 */
public class ModelExtractor {

    private final Set<String> baseModelTypes;
    private final List<String> abstractMarkers;

    /**
     * Creates an extractor.
     *
     * @param baseModelTypes names of the base "trainable model" types
     * @param abstractMarkers name fragments identifying abstract base classes
     */
    public ModelExtractor(Collection<String> baseModelTypes, Collection<String> abstractMarkers) {
        this.baseModelTypes = Set.copyOf(baseModelTypes);
        this.abstractMarkers = List.copyOf(abstractMarkers);
    }

    /**
     * Returns the model classes defined in the module.
     *
     * @param module library module
     * @return model classes, in member order
     */
    public List<ModelClass> extract(LibraryModule module) {
        return module.members().stream()
            .filter(member -> !hasAbstractMarker(member.name()))
            .filter(member -> member.isSubclassOfAny(baseModelTypes))
            .filter(member -> member.isDefinedIn(module.identifier()))
            .map(member -> new ModelClass(member.name(), module.identifier()))
            .toList();
    }

    /**
     * Builds the audited view of a module.
     *
     * @param module library module
     * @param libraryName library package name used to qualify the module
     * @return model module
     */
    public ModelModule toModelModule(LibraryModule module, String libraryName) {
        return new ModelModule(module.identifier(), libraryName + "." + module.identifier(), extract(module));
    }

    private boolean hasAbstractMarker(String name) {
        return abstractMarkers.stream().anyMatch(name::contains);
    }
}
