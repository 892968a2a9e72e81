package com.github.crucibleplatform.orchestrator.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author crucible-platform
 */
class PriorityUtilTest {

    @Test
    void normalize_mapsLegacyScale() {
        assertThat(PriorityUtil.normalize(null)).isEqualTo(PriorityUtil.DEFAULT_PRIORITY);
        assertThat(PriorityUtil.normalize(-1)).isEqualTo(PriorityUtil.TEST_LOW_PRIORITY);
        assertThat(PriorityUtil.normalize(0)).isEqualTo(PriorityUtil.TEST_NORMAL_PRIORITY);
        assertThat(PriorityUtil.normalize(1)).isEqualTo(PriorityUtil.TEST_HIGH_PRIORITY);
        assertThat(PriorityUtil.normalize(1500)).isEqualTo(1500);
    }

    @ParameterizedTest
    @CsvSource({
            "5000, critical-priority",
            "1000, high-priority-evaluation",
            "999, normal-priority-evaluation",
            "450, test-infrastructure-priority",
            "350, test-high-priority-evaluation",
            "250, test-normal-priority-evaluation",
            "150, test-low-priority-evaluation",
            "10, low-priority-evaluation",
            "-20, low-priority-evaluation"
    })
    void priorityClassName(final int priority, final String expected) {
        assertThat(PriorityUtil.priorityClassName(priority)).isEqualTo(expected);
    }

}
