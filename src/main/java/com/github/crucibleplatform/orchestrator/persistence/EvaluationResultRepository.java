package com.github.crucibleplatform.orchestrator.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * @author crucible-platform
 */
public interface EvaluationResultRepository extends JpaRepository<EvaluationResultEntity, String> {
}
