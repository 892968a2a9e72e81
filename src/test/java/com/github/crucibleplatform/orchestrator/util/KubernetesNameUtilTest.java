package com.github.crucibleplatform.orchestrator.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author crucible-platform
 */
class KubernetesNameUtilTest {

    @Test
    void jobName_sanitizesAndTruncatesEvaluationId() {
        assertThat(KubernetesNameUtil.jobName("Eval_42", "abc12345")).isEqualTo("eval-42-abc12345");
        assertThat(KubernetesNameUtil.jobName("a-very-long-evaluation-identifier-indeed", "abc12345"))
                .isEqualTo("a-very-long-evaluati-abc12345");
        assertThat(KubernetesNameUtil.jobName("___", "abc12345")).isEqualTo("eval-abc12345");
    }

    @Test
    void jobName_generatesRandomSuffix() {
        final String first = KubernetesNameUtil.jobName("eval-1");
        final String second = KubernetesNameUtil.jobName("eval-1");

        assertThat(first).matches("eval-1-[0-9a-f]{8}");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void labelValue_fitsLabelRules() {
        assertThat(KubernetesNameUtil.labelValue("Run/01.Final")).isEqualTo("run-01-final");
        assertThat(KubernetesNameUtil.labelValue("x".repeat(80))).hasSize(63);
    }

}
