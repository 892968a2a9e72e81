package com.github.crucibleplatform.orchestrator.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * @author crucible-platform
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class PriorityUtil {

    public static final int TEST_LOW_PRIORITY = 150;

    public static final int TEST_NORMAL_PRIORITY = 250;

    public static final int TEST_HIGH_PRIORITY = 350;

    public static final int DEFAULT_PRIORITY = TEST_NORMAL_PRIORITY;

    private static final String FALLBACK_PRIORITY_CLASS = "low-priority-evaluation";

    private static final List<PriorityRange> PRIORITY_CLASSES = List.of(
            new PriorityRange(2000, Integer.MAX_VALUE, "critical-priority"),
            new PriorityRange(1000, 1999, "high-priority-evaluation"),
            new PriorityRange(500, 999, "normal-priority-evaluation"),
            new PriorityRange(400, 499, "test-infrastructure-priority"),
            new PriorityRange(350, 399, "test-high-priority-evaluation"),
            new PriorityRange(250, 349, "test-normal-priority-evaluation"),
            new PriorityRange(150, 249, "test-low-priority-evaluation"),
            new PriorityRange(0, 149, FALLBACK_PRIORITY_CLASS));

    /**
     * Maps the legacy -1/0/1 scale onto the numeric scale. Other values pass through unchanged.
     */
    public static int normalize(final Integer priority) {
        if (priority == null) {
            return DEFAULT_PRIORITY;
        }
        return switch (priority) {
            case -1 -> TEST_LOW_PRIORITY;
            case 0 -> TEST_NORMAL_PRIORITY;
            case 1 -> TEST_HIGH_PRIORITY;
            default -> priority;
        };
    }

    public static String priorityClassName(final int priority) {
        return PRIORITY_CLASSES.stream()
                .filter(range -> range.contains(priority))
                .map(PriorityRange::className)
                .findFirst()
                .orElse(FALLBACK_PRIORITY_CLASS);
    }

    private record PriorityRange(int min, int max, String className) {

        boolean contains(final int priority) {
            return priority >= min && priority <= max;
        }

    }

}
