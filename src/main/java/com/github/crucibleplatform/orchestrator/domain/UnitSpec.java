package com.github.crucibleplatform.orchestrator.domain;

/**
 * Everything a sandbox provider needs to create one isolated execution unit.
 *
 * @author crucible-platform
 */
public record UnitSpec(String evaluationId,
                       String code,
                       ResourceRequirements resourceRequirements,
                       int gracePeriodSeconds,
                       String priorityClassName,
                       String image) {
}
