package com.github.crucibleplatform.orchestrator.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author crucible-platform
 */
class RiskLevelTest {

    @Test
    void fromString_missingValueIsStandard() {
        assertThat(RiskLevel.fromString(null)).isEqualTo(RiskLevel.STANDARD);
        assertThat(RiskLevel.fromString("  ")).isEqualTo(RiskLevel.STANDARD);
    }

    @Test
    void fromString_ignoresCaseAndSurroundingWhitespace() {
        assertThat(RiskLevel.fromString(" Trusted ")).isEqualTo(RiskLevel.TRUSTED);
        assertThat(RiskLevel.fromString("untrusted")).isEqualTo(RiskLevel.UNTRUSTED);
    }

    @Test
    void fromString_unknownValueIsRejected() {
        assertThatThrownBy(() -> RiskLevel.fromString("reckless"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reckless");
    }

}
