package com.repocheck.core.library;

import java.util.Objects;
import java.util.Set;

/**
 * A member exposed by a library module, with the runtime type information the audit needs.
 *
 * @param name exposed name
 * @param isClass whether the member is a class
 * @param definingModule identifier of the module that literally defines the member
 * @param ancestors transitive supertype names (empty for non-classes)
 */
public record ExportedMember(
    String name,
    boolean isClass,
    String definingModule,
    Set<String> ancestors
) {
    public ExportedMember {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(definingModule, "definingModule must not be null");
        ancestors = ancestors != null ? Set.copyOf(ancestors) : Set.of();
    }

    /**
     * Creates a class member.
     *
     * @param name class name
     * @param definingModule defining module identifier
     * @param ancestors transitive supertype names
     * @return class member
     */
    public static ExportedMember classMember(String name, String definingModule, Set<String> ancestors) {
        return new ExportedMember(name, true, definingModule, ancestors);
    }

    /**
     * Creates a non-class member (function, constant, ...).
     *
     * @param name member name
     * @param definingModule defining module identifier
     * @return non-class member
     */
    public static ExportedMember value(String name, String definingModule) {
        return new ExportedMember(name, false, definingModule, Set.of());
    }

    /**
     * Checks if this member is a class deriving from any of the given types.
     *
     * <p>A type counts as its own subclass.
     *
     * @param typeNames supertype names
     * @return true if this is a class and one of the types is itself or an ancestor
     */
    public boolean isSubclassOfAny(Set<String> typeNames) {
        if (!isClass) {
            return false;
        }
        if (typeNames.contains(name)) {
            return true;
        }
        return ancestors.stream().anyMatch(typeNames::contains);
    }

    /**
     * Checks if the member is defined in the given module rather than imported into it.
     *
     * @param moduleIdentifier module identifier
     * @return true if defined there
     */
    public boolean isDefinedIn(String moduleIdentifier) {
        return definingModule.equals(moduleIdentifier);
    }
}
