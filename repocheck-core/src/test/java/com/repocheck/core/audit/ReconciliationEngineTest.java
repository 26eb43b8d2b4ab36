package com.repocheck.core.audit;

import com.repocheck.core.extractor.DocCoverageExtractor;
import com.repocheck.core.extractor.TestCoverageExtractor;
import com.repocheck.core.model.Discrepancy;
import com.repocheck.core.model.DiscrepancyKind;
import com.repocheck.core.model.DocNameMapping;
import com.repocheck.core.model.ExceptionList;
import com.repocheck.core.model.ModelClass;
import com.repocheck.core.model.ModelModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReconciliationEngine}.
 *
 * <p>Covers both passes: missing coverage files, missing declarations, per-class gaps,
 * exception lists, and deterministic output.
 */
class ReconciliationEngineTest {

    private InMemoryCorpus tests;
    private InMemoryCorpus docs;

    @BeforeEach
    void setUp() {
        tests = new InMemoryCorpus("tests");
        docs = new InMemoryCorpus("docs/source/model_doc");
    }

    // ========== Tested Coverage ==========

    @Test
    void checkModelsAreTested_undeclaredClass_reportsExactlyThatClass() throws IOException {
        // Given: FooForMaskedLM is missing from the declaration
        ModelModule foo = module("modeling_foo", "FooModel", "FooForMaskedLM");
        tests.with("test_modeling_foo.py", "all_model_classes = (FooModel,)");

        // When
        List<Discrepancy> discrepancies = engine(ExceptionList.empty()).checkModelsAreTested(List.of(foo));

        // Then
        assertThat(discrepancies).hasSize(1);
        Discrepancy discrepancy = discrepancies.get(0);
        assertThat(discrepancy.kind()).isEqualTo(DiscrepancyKind.CLASS_NOT_TESTED);
        assertThat(discrepancy.subject()).isEqualTo("FooForMaskedLM");
        assertThat(discrepancy.module()).isEqualTo("transformers.modeling_foo");
        assertThat(discrepancy.message())
            .contains("FooForMaskedLM is defined in transformers.modeling_foo")
            .contains("tests/test_modeling_foo.py")
            .contains("ignoreNonTested");
    }

    @Test
    void checkModelsAreTested_missingTestFile_reportsOnlyTheFile() throws IOException {
        ModelModule foo = module("modeling_foo", "FooModel", "FooForMaskedLM");

        List<Discrepancy> discrepancies = engine(ExceptionList.empty()).checkModelsAreTested(List.of(foo));

        assertThat(discrepancies).singleElement().satisfies(discrepancy -> {
            assertThat(discrepancy.kind()).isEqualTo(DiscrepancyKind.MISSING_TEST_FILE);
            assertThat(discrepancy.subject()).isEqualTo("test_modeling_foo.py");
            assertThat(discrepancy.message())
                .isEqualTo("transformers.modeling_foo does not have its corresponding test file test_modeling_foo.py.");
        });
    }

    @Test
    void checkModelsAreTested_missingDeclaration_reportsFile() throws IOException {
        ModelModule foo = module("modeling_foo", "FooModel");
        tests.with("test_modeling_foo.py", "class FooIntegrationTest(unittest.TestCase):\n    pass\n");

        List<Discrepancy> discrepancies = engine(ExceptionList.empty()).checkModelsAreTested(List.of(foo));

        assertThat(discrepancies).singleElement().satisfies(discrepancy -> {
            assertThat(discrepancy.kind()).isEqualTo(DiscrepancyKind.MISSING_TEST_DECLARATION);
            assertThat(discrepancy.subject()).isEqualTo("test_modeling_foo.py");
            assertThat(discrepancy.message()).contains("filesWithNoCommonTests");
        });
    }

    @Test
    void checkModelsAreTested_missingDeclarationInExemptFile_passes() throws IOException {
        ModelModule camembert = module("modeling_camembert", "CamembertModel");
        tests.with("test_modeling_camembert.py", "class CamembertModelIntegrationTest:\n    pass\n");
        ExceptionList exceptions = new ExceptionList(Set.of(), Set.of(), Set.of("test_modeling_camembert.py"));

        List<Discrepancy> discrepancies = engine(exceptions).checkModelsAreTested(List.of(camembert));

        assertThat(discrepancies).isEmpty();
    }

    @Test
    void checkModelsAreTested_emptyDeclaration_reportsEveryClass() throws IOException {
        // Given: a present but empty declaration is not treated as absent
        ModelModule foo = module("modeling_foo", "FooModel", "FooForMaskedLM");
        tests.with("test_modeling_foo.py", "all_model_classes = ()");
        ExceptionList exceptions = new ExceptionList(Set.of(), Set.of(), Set.of("test_modeling_foo.py"));

        List<Discrepancy> discrepancies = engine(exceptions).checkModelsAreTested(List.of(foo));

        assertThat(discrepancies).extracting(Discrepancy::kind)
            .containsOnly(DiscrepancyKind.CLASS_NOT_TESTED);
        assertThat(discrepancies).extracting(Discrepancy::subject)
            .containsExactly("FooModel", "FooForMaskedLM");
    }

    @Test
    void checkModelsAreTested_exemptClass_isNeverReported() throws IOException {
        ModelModule bert = module("modeling_bert", "BertModel", "BertLMHeadModel");
        tests.with("test_modeling_bert.py", "all_model_classes = (BertModel,)");
        ExceptionList exceptions = new ExceptionList(Set.of("BertLMHeadModel"), Set.of(), Set.of());

        List<Discrepancy> discrepancies = engine(exceptions).checkModelsAreTested(List.of(bert));

        assertThat(discrepancies).isEmpty();
    }

    @Test
    void checkModelsAreTested_multipleModules_collectsAllDiscrepancies() throws IOException {
        // Given: one module without a test file, one with an incomplete declaration
        ModelModule bert = module("modeling_bert", "BertModel", "BertForMaskedLM");
        ModelModule gpt2 = module("modeling_gpt2", "GPT2Model");
        ModelModule xlnet = module("modeling_xlnet", "XLNetModel");
        tests.with("test_modeling_bert.py", "all_model_classes = (BertModel,)")
            .with("test_modeling_xlnet.py", "all_model_classes = ((XLNetModel,))");

        // When
        List<Discrepancy> discrepancies = engine(ExceptionList.empty())
            .checkModelsAreTested(List.of(bert, gpt2, xlnet));

        // Then: nothing short-circuits after the first problem
        assertThat(discrepancies).extracting(Discrepancy::kind)
            .containsExactly(DiscrepancyKind.CLASS_NOT_TESTED, DiscrepancyKind.MISSING_TEST_FILE);
        assertThat(discrepancies).extracting(Discrepancy::subject)
            .containsExactly("BertForMaskedLM", "test_modeling_gpt2.py");
    }

    @Test
    void checkModelsAreTested_runTwice_yieldsIdenticalLists() throws IOException {
        List<ModelModule> modules = List.of(
            module("modeling_bert", "BertModel", "BertForMaskedLM", "BertForQuestionAnswering"),
            module("modeling_gpt2", "GPT2Model"),
            module("modeling_t5", "T5Model"));
        tests.with("test_modeling_bert.py", "all_model_classes = (BertModel,)")
            .with("test_modeling_t5.py", "no declaration here");
        ReconciliationEngine engine = engine(ExceptionList.empty());

        List<Discrepancy> first = engine.checkModelsAreTested(modules);
        List<Discrepancy> second = engine.checkModelsAreTested(modules);

        assertThat(first).hasSize(4);
        assertThat(second).containsExactlyElementsOf(first);
    }

    // ========== Documented Coverage ==========

    @Test
    void checkModelsAreDocumented_undocumentedClass_isReported() throws IOException {
        ModelModule bert = module("modeling_bert", "BertModel", "BertForMaskedLM");
        docs.with("bert.rst", ".. autoclass:: transformers.BertModel\n    :members:\n");

        List<Discrepancy> discrepancies = engine(ExceptionList.empty()).checkModelsAreDocumented(List.of(bert));

        assertThat(discrepancies).singleElement().satisfies(discrepancy -> {
            assertThat(discrepancy.kind()).isEqualTo(DiscrepancyKind.CLASS_NOT_DOCUMENTED);
            assertThat(discrepancy.subject()).isEqualTo("BertForMaskedLM");
            assertThat(discrepancy.message())
                .contains("docs/source/model_doc/bert.rst")
                .contains("ignoreNonDocumented");
        });
    }

    @Test
    void checkModelsAreDocumented_tfModuleSharesFamilyPage() throws IOException {
        ModelModule tfBert = module("modeling_tf_bert", "TFBertModel");
        docs.with("bert.rst", ".. autoclass:: transformers.TFBertModel\n");

        List<Discrepancy> discrepancies = engine(ExceptionList.empty()).checkModelsAreDocumented(List.of(tfBert));

        assertThat(discrepancies).isEmpty();
    }

    @Test
    void checkModelsAreDocumented_missingDocFile_reportsOnlyTheFile() throws IOException {
        ModelModule foo = module("modeling_foo", "FooModel", "FooForMaskedLM");

        List<Discrepancy> discrepancies = engine(ExceptionList.empty()).checkModelsAreDocumented(List.of(foo));

        assertThat(discrepancies).singleElement().satisfies(discrepancy -> {
            assertThat(discrepancy.kind()).isEqualTo(DiscrepancyKind.MISSING_DOC_FILE);
            assertThat(discrepancy.subject()).isEqualTo("foo.rst");
            assertThat(discrepancy.message()).contains("modelNameToDocFile");
        });
    }

    @Test
    void checkModelsAreDocumented_irregularFamily_usesNameMapping() throws IOException {
        ModelModule transfoXl = module("modeling_transfo_xl", "TransfoXLModel");
        ModelModule openai = module("modeling_openai", "OpenAIGPTModel");
        docs.with("transformerxl.rst", ".. autoclass:: transformers.TransfoXLModel\n")
            .with("gpt.rst", ".. autoclass:: transformers.OpenAIGPTModel\n");

        List<Discrepancy> discrepancies = engine(ExceptionList.empty())
            .checkModelsAreDocumented(List.of(transfoXl, openai));

        assertThat(discrepancies).isEmpty();
    }

    @Test
    void checkModelsAreDocumented_exemptClass_isNeverReported() throws IOException {
        ModelModule t5 = module("modeling_t5", "T5Model", "T5Stack");
        docs.with("t5.rst", ".. autoclass:: transformers.T5Model\n");
        ExceptionList exceptions = new ExceptionList(Set.of(), Set.of("T5Stack"), Set.of());

        List<Discrepancy> discrepancies = engine(exceptions).checkModelsAreDocumented(List.of(t5));

        assertThat(discrepancies).isEmpty();
    }

    @Test
    void passes_areIndependent() throws IOException {
        // Given: tested but not documented
        ModelModule foo = module("modeling_foo", "FooModel");
        tests.with("test_modeling_foo.py", "all_model_classes = (FooModel,)");
        ReconciliationEngine engine = engine(ExceptionList.empty());

        assertThat(engine.checkModelsAreTested(List.of(foo))).isEmpty();
        assertThat(engine.checkModelsAreDocumented(List.of(foo)))
            .extracting(Discrepancy::kind)
            .containsExactly(DiscrepancyKind.MISSING_DOC_FILE);
    }

    @Test
    void expectedFiles_followNamingConventions() {
        ReconciliationEngine engine = engine(ExceptionList.empty());
        ModelModule xlmRoberta = module("modeling_tf_xlm_roberta", "TFXLMRobertaModel");

        assertThat(ReconciliationEngine.expectedTestFile(xlmRoberta)).isEqualTo("test_modeling_tf_xlm_roberta.py");
        assertThat(engine.expectedDocFile(xlmRoberta)).isEqualTo("xlmroberta.rst");
    }

    private ReconciliationEngine engine(ExceptionList exceptions) {
        return new ReconciliationEngine(
            tests,
            docs,
            exceptions,
            new DocNameMapping(Map.of(
                "openai", "gpt.rst",
                "transfo_xl", "transformerxl.rst",
                "xlm_roberta", "xlmroberta.rst")),
            ".rst",
            new TestCoverageExtractor(),
            new DocCoverageExtractor("transformers"));
    }

    private static ModelModule module(String identifier, String... classNames) {
        List<ModelClass> classes = Arrays.stream(classNames)
            .map(name -> new ModelClass(name, identifier))
            .toList();
        return new ModelModule(identifier, "transformers." + identifier, classes);
    }
}
