package com.github.crucibleplatform.orchestrator.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.UUID;

/**
 * Builds names and label values that satisfy Kubernetes' DNS-1123 rules.
 *
 * @author crucible-platform
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class KubernetesNameUtil {

    private static final int MAX_EVALUATION_ID_PART = 20;

    private static final int MAX_LABEL_VALUE_LENGTH = 63;

    public static String jobName(final String evaluationId) {
        return jobName(evaluationId, UUID.randomUUID().toString().replace("-", "").substring(0, 8));
    }

    public static String jobName(final String evaluationId, final String suffix) {
        String safe = sanitize(evaluationId);
        if (safe.length() > MAX_EVALUATION_ID_PART) {
            safe = trimDashes(safe.substring(0, MAX_EVALUATION_ID_PART));
        }
        if (safe.isEmpty()) {
            safe = "eval";
        }
        return safe + "-" + suffix;
    }

    public static String labelValue(final String value) {
        String safe = sanitize(value);
        if (safe.length() > MAX_LABEL_VALUE_LENGTH) {
            safe = trimDashes(safe.substring(0, MAX_LABEL_VALUE_LENGTH));
        }
        return safe;
    }

    private static String sanitize(final String value) {
        final String lowerCase = value == null ? "" : value.toLowerCase(Locale.ROOT).replace('_', '-');
        return trimDashes(lowerCase.replaceAll("[^a-z0-9-]", "-"));
    }

    private static String trimDashes(final String value) {
        return value.replaceAll("^-+", "").replaceAll("-+$", "");
    }

}
