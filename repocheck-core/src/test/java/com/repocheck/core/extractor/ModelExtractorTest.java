package com.repocheck.core.extractor;

import com.repocheck.core.library.InMemoryLibrarySurface;
import com.repocheck.core.library.LibraryModule;
import com.repocheck.core.library.LibrarySurface;
import com.repocheck.core.model.ModelClass;
import com.repocheck.core.model.ModelModule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ModelExtractor}.
 */
class ModelExtractorTest {

    private final ModelExtractor extractor =
        new ModelExtractor(List.of("PreTrainedModel", "TFPreTrainedModel"), List.of("Pretrained", "PreTrained"));

    @Test
    void extract_concreteSubclasses_areModels() {
        LibrarySurface library = InMemoryLibrarySurface.builder("transformers")
            .module("modeling_bert")
                .defineClass("BertModel", "BertPreTrainedModel", "PreTrainedModel")
                .defineClass("BertForMaskedLM", "BertPreTrainedModel", "PreTrainedModel")
                .done()
            .build();

        List<ModelClass> models = extractor.extract(module(library, "modeling_bert"));

        assertThat(models).extracting(ModelClass::name).containsExactly("BertForMaskedLM", "BertModel");
        assertThat(models).allMatch(model -> model.moduleIdentifier().equals("modeling_bert"));
    }

    @Test
    void extract_abstractMarkerInName_isNeverAModel() {
        LibrarySurface library = InMemoryLibrarySurface.builder("transformers")
            .module("modeling_bert")
                .defineClass("BertPreTrainedModel", "PreTrainedModel")
                .defineClass("TFBertPretrainedMainLayer", "TFPreTrainedModel")
                .defineClass("BertModel", "BertPreTrainedModel", "PreTrainedModel")
                .done()
            .build();

        List<ModelClass> models = extractor.extract(module(library, "modeling_bert"));

        assertThat(models).extracting(ModelClass::name).containsExactly("BertModel");
    }

    @Test
    void extract_classesNotDerivedFromBaseModel_areIgnored() {
        LibrarySurface library = InMemoryLibrarySurface.builder("transformers")
            .module("modeling_bert")
                .defineClass("BertEmbeddings", "Module")
                .defineClass("BertModel", "PreTrainedModel")
                .defineValue("load_tf_weights_in_bert")
                .done()
            .build();

        List<ModelClass> models = extractor.extract(module(library, "modeling_bert"));

        assertThat(models).extracting(ModelClass::name).containsExactly("BertModel");
    }

    @Test
    void extract_importedClass_isAttributedToDefiningModuleOnly() {
        // Given: modeling_roberta re-exports a class defined in modeling_bert
        LibrarySurface library = InMemoryLibrarySurface.builder("transformers")
            .module("modeling_bert")
                .defineClass("BertModel", "PreTrainedModel")
                .done()
            .module("modeling_roberta")
                .importFrom("modeling_bert", "BertModel")
                .defineClass("RobertaModel", "BertModel", "PreTrainedModel")
                .done()
            .build();

        // When
        List<ModelClass> bertModels = extractor.extract(module(library, "modeling_bert"));
        List<ModelClass> robertaModels = extractor.extract(module(library, "modeling_roberta"));

        // Then
        assertThat(bertModels).extracting(ModelClass::name).containsExactly("BertModel");
        assertThat(robertaModels).extracting(ModelClass::name).containsExactly("RobertaModel");
    }

    @Test
    void toModelModule_qualifiesIdentifierWithLibraryName() {
        LibrarySurface library = InMemoryLibrarySurface.builder("transformers")
            .module("modeling_tf_bert")
                .defineClass("TFBertModel", "TFPreTrainedModel")
                .done()
            .build();

        ModelModule module = extractor.toModelModule(module(library, "modeling_tf_bert"), library.name());

        assertThat(module.identifier()).isEqualTo("modeling_tf_bert");
        assertThat(module.qualifiedName()).isEqualTo("transformers.modeling_tf_bert");
        assertThat(module.classNames()).containsExactly("TFBertModel");
    }

    private static LibraryModule module(LibrarySurface library, String identifier) {
        return library.module(identifier).orElseThrow();
    }
}
