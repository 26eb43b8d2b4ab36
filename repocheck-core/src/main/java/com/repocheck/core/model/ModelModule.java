package com.repocheck.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A library module defining the model classes of one model family.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ModelModule module = new ModelModule(
 *     "modeling_bert",
 *     "transformers.modeling_bert",
 *     List.of(new ModelClass("BertModel", "modeling_bert"))
 * );
 * }</pre>
 *
 * @param identifier module identifier, unique within the library
 * @param qualifiedName identifier prefixed with the library name, used in reports
 * @param classes model classes defined by this module
 */
public record ModelModule(
    String identifier,
    String qualifiedName,
    List<ModelClass> classes
) {
    /**
     * Compact constructor with validation.
     */
    public ModelModule {
        Objects.requireNonNull(identifier, "identifier must not be null");
        if (qualifiedName == null || qualifiedName.isBlank()) {
            qualifiedName = identifier;
        }
        classes = classes != null ? List.copyOf(classes) : List.of();
    }

    /**
     * Returns the names of the model classes defined by this module.
     *
     * @return class names in definition order
     */
    public List<String> classNames() {
        return classes.stream().map(ModelClass::name).toList();
    }
}
