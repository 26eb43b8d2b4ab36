package com.repocheck.core.library;

import java.util.List;
import java.util.Objects;

/**
 * A module of the library and the members it exposes.
 *
 * @param identifier module identifier (e.g., "modeling_bert")
 * @param members exposed members, both defined and re-exported
 */
public record LibraryModule(
    String identifier,
    List<ExportedMember> members
) {
    public LibraryModule {
        Objects.requireNonNull(identifier, "identifier must not be null");
        members = members != null ? List.copyOf(members) : List.of();
    }
}
