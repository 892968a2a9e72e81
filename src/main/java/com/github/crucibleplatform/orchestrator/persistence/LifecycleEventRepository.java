package com.github.crucibleplatform.orchestrator.persistence;

import com.github.crucibleplatform.orchestrator.domain.LifecycleEventType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * @author crucible-platform
 */
public interface LifecycleEventRepository extends JpaRepository<LifecycleEventEntity, Long> {

    List<LifecycleEventEntity> findByEvaluationIdOrderBySequenceHintAsc(String evaluationId);

    boolean existsByEvaluationIdAndEventType(String evaluationId, LifecycleEventType eventType);

}
