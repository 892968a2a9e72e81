package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.EvaluationState;
import com.github.crucibleplatform.orchestrator.mapper.EvaluationResultMapper;
import com.github.crucibleplatform.orchestrator.persistence.EvaluationResultEntity;
import com.github.crucibleplatform.orchestrator.persistence.EvaluationResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * @author crucible-platform
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaResultStorage implements ResultStorage {

    private final EvaluationResultRepository evaluationResultRepository;

    private final EvaluationResultMapper evaluationResultMapper;

    @Override
    @Transactional
    public void persist(final String evaluationId, final EvaluationState finalState, final String outputRef) {
        if (evaluationResultRepository.existsById(evaluationId)) {
            log.debug("Result of evaluation {} already stored", evaluationId);
            return;
        }
        final EvaluationResultEntity evaluationResultEntity = evaluationResultMapper.toEntity(finalState);
        evaluationResultEntity.setOutputRef(outputRef);
        evaluationResultRepository.save(evaluationResultEntity);
    }

}
