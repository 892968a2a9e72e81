package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public record ResourceRequirements(int memoryMb, int cpuMillicores, int timeoutSeconds) {

    public String memoryQuantity() {
        return memoryMb + "Mi";
    }

    public String cpuQuantity() {
        return cpuMillicores + "m";
    }

}
