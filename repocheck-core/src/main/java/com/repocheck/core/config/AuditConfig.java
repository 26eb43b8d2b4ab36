package com.repocheck.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.repocheck.core.model.DocNameMapping;
import com.repocheck.core.model.ExceptionList;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for a RepoCheck audit.
 *
 * <p>Loaded from {@code repocheck.yaml} in the project root. Defines where the library,
 * tests and documentation live, how model modules and classes are recognized, and the
 * maintained exception tables.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * paths:
 *   library: "src/transformers"
 *   tests: "tests"
 *   docs: "docs/source/model_doc"
 *
 * library:
 *   name: transformers
 *   modulePrefix: modeling
 *
 * tests:
 *   ignoreNonTested:
 *     - BertLMHeadModel
 *
 * docs:
 *   modelNameToDocFile:
 *     openai: gpt.rst
 * }</pre>
 *
 * <p>Any section left out falls back to {@link #defaults()}.
 *
 * @param paths corpus locations, relative to the project root
 * @param library module and class recognition rules
 * @param tests test corpus rules and exceptions
 * @param docs documentation corpus rules and exceptions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(
    @JsonProperty("paths") PathsConfig paths,
    @JsonProperty("library") LibraryConfig library,
    @JsonProperty("tests") TestsConfig tests,
    @JsonProperty("docs") DocsConfig docs
) {
    /**
     * Compact constructor filling missing sections with defaults.
     */
    public AuditConfig {
        paths = paths != null ? paths : PathsConfig.defaults();
        library = library != null ? library : LibraryConfig.defaults();
        tests = tests != null ? tests : TestsConfig.defaults();
        docs = docs != null ? docs : DocsConfig.defaults();
    }

    /**
     * Creates the default configuration for a transformers-style repository.
     *
     * @return default configuration
     */
    public static AuditConfig defaults() {
        return new AuditConfig(null, null, null, null);
    }

    /**
     * Collects the three allow-lists.
     *
     * @return exception list
     */
    public ExceptionList exceptionList() {
        return new ExceptionList(
            new LinkedHashSet<>(tests.ignoreNonTested()),
            new LinkedHashSet<>(docs.ignoreNonDocumented()),
            new LinkedHashSet<>(tests.filesWithNoCommonTests())
        );
    }

    public DocNameMapping docNameMapping() {
        return new DocNameMapping(docs.modelNameToDocFile());
    }

    /**
     * Corpus locations.
     *
     * @param library Python package directory of the library
     * @param tests directory holding the model test files
     * @param docs directory holding the model documentation pages
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PathsConfig(
        @JsonProperty("library") String library,
        @JsonProperty("tests") String tests,
        @JsonProperty("docs") String docs
    ) {
        public PathsConfig {
            library = library != null ? library : "src/transformers";
            tests = tests != null ? tests : "tests";
            docs = docs != null ? docs : "docs/source/model_doc";
        }

        public static PathsConfig defaults() {
            return new PathsConfig(null, null, null);
        }
    }

    /**
     * Model module and model class recognition.
     *
     * @param name library package name, used in qualified names and doc directives
     * @param modulePrefix prefix of model-bearing module identifiers
     * @param ignoredModules utility modules never audited
     * @param baseModelTypes base classes every model class derives from
     * @param abstractMarkers name fragments marking abstract base classes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LibraryConfig(
        @JsonProperty("name") String name,
        @JsonProperty("modulePrefix") String modulePrefix,
        @JsonProperty("ignoredModules") List<String> ignoredModules,
        @JsonProperty("baseModelTypes") List<String> baseModelTypes,
        @JsonProperty("abstractMarkers") List<String> abstractMarkers
    ) {
        public LibraryConfig {
            name = name != null ? name : "transformers";
            modulePrefix = modulePrefix != null ? modulePrefix : "modeling";
            ignoredModules = ignoredModules != null ? List.copyOf(ignoredModules) : List.of(
                "modeling_auto",
                "modeling_encoder_decoder",
                "modeling_marian",
                "modeling_mmbt",
                "modeling_outputs",
                "modeling_retribert",
                "modeling_utils",
                "modeling_transfo_xl_utilities",
                "modeling_tf_auto",
                "modeling_tf_outputs",
                "modeling_tf_pytorch_utils",
                "modeling_tf_utils",
                "modeling_tf_transfo_xl_utilities"
            );
            baseModelTypes = baseModelTypes != null ? List.copyOf(baseModelTypes)
                : List.of("PreTrainedModel", "TFPreTrainedModel");
            abstractMarkers = abstractMarkers != null ? List.copyOf(abstractMarkers)
                : List.of("Pretrained", "PreTrained");
        }

        public static LibraryConfig defaults() {
            return new LibraryConfig(null, null, null, null, null);
        }
    }

    /**
     * Test corpus rules.
     *
     * @param filePrefix prefix of model test file names
     * @param ignoredFiles test file stems that are not model test files
     * @param filesWithNoCommonTests test files allowed to lack an {@code all_model_classes} declaration
     * @param ignoreNonTested model classes exempt from the tested-coverage check
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TestsConfig(
        @JsonProperty("filePrefix") String filePrefix,
        @JsonProperty("ignoredFiles") List<String> ignoredFiles,
        @JsonProperty("filesWithNoCommonTests") List<String> filesWithNoCommonTests,
        @JsonProperty("ignoreNonTested") List<String> ignoreNonTested
    ) {
        public TestsConfig {
            filePrefix = filePrefix != null ? filePrefix : "test_modeling";
            ignoredFiles = ignoredFiles != null ? List.copyOf(ignoredFiles) : List.of(
                "test_modeling_common",
                "test_modeling_encoder_decoder",
                "test_modeling_marian",
                "test_modeling_mbart",
                "test_modeling_tf_common"
            );
            filesWithNoCommonTests = filesWithNoCommonTests != null ? List.copyOf(filesWithNoCommonTests) : List.of(
                "test_modeling_camembert.py",
                "test_modeling_tf_camembert.py",
                "test_modeling_tf_xlm_roberta.py",
                "test_modeling_xlm_roberta.py"
            );
            ignoreNonTested = ignoreNonTested != null ? List.copyOf(ignoreNonTested) : List.of(
                "BertLMHeadModel",
                "DPREncoder",
                "DPRSpanPredictor",
                "ReformerForMaskedLM",
                "T5Stack",
                "TFAlbertForMultipleChoice",
                "TFAlbertForTokenClassification",
                "TFBertLMHeadModel",
                "TFElectraForMultipleChoice",
                "TFElectraForQuestionAnswering",
                "TFElectraForSequenceClassification",
                "TFElectraMainLayer",
                "TFRobertaForMultipleChoice"
            );
        }

        public static TestsConfig defaults() {
            return new TestsConfig(null, null, null, null);
        }
    }

    /**
     * Documentation corpus rules.
     *
     * @param extension documentation file extension including the dot
     * @param ignoredFiles documentation file stems that are not model pages
     * @param ignoreNonDocumented model classes exempt from the documented-coverage check
     * @param modelNameToDocFile family name to documentation filename overrides
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocsConfig(
        @JsonProperty("extension") String extension,
        @JsonProperty("ignoredFiles") List<String> ignoredFiles,
        @JsonProperty("ignoreNonDocumented") List<String> ignoreNonDocumented,
        @JsonProperty("modelNameToDocFile") Map<String, String> modelNameToDocFile
    ) {
        public DocsConfig {
            extension = extension != null ? extension : ".rst";
            ignoredFiles = ignoredFiles != null ? List.copyOf(ignoredFiles)
                : List.of("auto", "dialogpt", "marian", "retribert");
            ignoreNonDocumented = ignoreNonDocumented != null ? List.copyOf(ignoreNonDocumented) : List.of(
                "DPREncoder",
                "DPRSpanPredictor",
                "T5Stack",
                "TFElectraMainLayer"
            );
            modelNameToDocFile = modelNameToDocFile != null ? Map.copyOf(modelNameToDocFile) : Map.of(
                "openai", "gpt.rst",
                "transfo_xl", "transformerxl.rst",
                "xlm_roberta", "xlmroberta.rst"
            );
        }

        public static DocsConfig defaults() {
            return new DocsConfig(null, null, null, null);
        }
    }
}
