package com.github.crucibleplatform.orchestrator.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Parses Kubernetes style quantities into the units used for capacity accounting.
 *
 * @author crucible-platform
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ResourceUtil {

    /**
     * @param memory quantity such as {@code 512Mi}, {@code 1Gi}, {@code 1024Ki} or a plain number of bytes
     * @return memory in MiB
     * @throws IllegalArgumentException if the quantity cannot be parsed
     */
    public static int parseMemoryToMb(final String memory) {
        final String value = requireText(memory, "memory");
        try {
            if (value.endsWith("Ti")) {
                return (int) (Double.parseDouble(value.substring(0, value.length() - 2)) * 1024 * 1024);
            } else if (value.endsWith("Gi")) {
                return (int) (Double.parseDouble(value.substring(0, value.length() - 2)) * 1024);
            } else if (value.endsWith("Mi")) {
                return Integer.parseInt(value.substring(0, value.length() - 2));
            } else if (value.endsWith("Ki")) {
                return (int) (Double.parseDouble(value.substring(0, value.length() - 2)) / 1024);
            }
            return (int) (Long.parseLong(value) / 1024 / 1024);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid memory quantity: " + memory, e);
        }
    }

    /**
     * @param cpu quantity such as {@code 100m}, {@code 0.5}, {@code 2} or nanocores like {@code 250000000n}
     * @return cpu in millicores
     * @throws IllegalArgumentException if the quantity cannot be parsed
     */
    public static int parseCpuToMillicores(final String cpu) {
        final String value = requireText(cpu, "cpu");
        try {
            if (value.endsWith("m")) {
                return Integer.parseInt(value.substring(0, value.length() - 1));
            } else if (value.endsWith("n")) {
                return (int) (Long.parseLong(value.substring(0, value.length() - 1)) / 1_000_000);
            }
            return (int) (Double.parseDouble(value) * 1000);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cpu quantity: " + cpu, e);
        }
    }

    private static String requireText(final String value, final String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing " + name + " quantity");
        }
        return value.trim();
    }

}
