package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public record CapacityStatus(int capacity,
                             int freeSlots,
                             int activeSlots,
                             long freeMemoryMb,
                             long freeCpuMillicores,
                             long doubleReleases) {
}
