package com.repocheck.core.config;

import com.repocheck.core.model.ExceptionList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AuditConfig} defaults.
 */
class AuditConfigTest {

    @Test
    void defaults_describeTransformersLayout() {
        AuditConfig config = AuditConfig.defaults();

        assertThat(config.paths().library()).isEqualTo("src/transformers");
        assertThat(config.paths().tests()).isEqualTo("tests");
        assertThat(config.paths().docs()).isEqualTo("docs/source/model_doc");
        assertThat(config.library().name()).isEqualTo("transformers");
        assertThat(config.library().modulePrefix()).isEqualTo("modeling");
        assertThat(config.library().ignoredModules()).contains("modeling_utils", "modeling_tf_auto");
        assertThat(config.library().baseModelTypes()).containsExactly("PreTrainedModel", "TFPreTrainedModel");
        assertThat(config.docs().extension()).isEqualTo(".rst");
        assertThat(config.docs().ignoredFiles()).contains("auto");
    }

    @Test
    void exceptionList_collectsAllThreeTables() {
        ExceptionList exceptions = AuditConfig.defaults().exceptionList();

        assertThat(exceptions.isTestExempt("BertLMHeadModel")).isTrue();
        assertThat(exceptions.isTestExempt("BertModel")).isFalse();
        assertThat(exceptions.isDocExempt("T5Stack")).isTrue();
        assertThat(exceptions.hasNoCommonTests("test_modeling_xlm_roberta.py")).isTrue();
    }

    @Test
    void docNameMapping_coversIrregularFamilies() {
        AuditConfig config = AuditConfig.defaults();

        assertThat(config.docNameMapping().docFileFor("openai", ".rst")).isEqualTo("gpt.rst");
        assertThat(config.docNameMapping().docFileFor("transfo_xl", ".rst")).isEqualTo("transformerxl.rst");
        assertThat(config.docNameMapping().docFileFor("bert", ".rst")).isEqualTo("bert.rst");
    }

    @Test
    void sections_copyGivenLists() {
        List<String> ignored = new java.util.ArrayList<>(List.of("modeling_helpers"));
        AuditConfig.LibraryConfig library = new AuditConfig.LibraryConfig(null, null, ignored, null, null);

        ignored.add("modeling_more");

        assertThat(library.ignoredModules()).containsExactly("modeling_helpers");
    }
}
