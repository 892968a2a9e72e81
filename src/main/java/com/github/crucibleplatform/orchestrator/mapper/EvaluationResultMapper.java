package com.github.crucibleplatform.orchestrator.mapper;

import com.github.crucibleplatform.orchestrator.domain.EvaluationState;
import com.github.crucibleplatform.orchestrator.persistence.EvaluationResultEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * @author crucible-platform
 */
@Mapper
public interface EvaluationResultMapper {

    @Mapping(target = "exitReason", source = "exitOutcome.reason")
    @Mapping(target = "exitCode", source = "exitOutcome.exitCode")
    @Mapping(target = "exitCodeKnown", source = "exitOutcome.exitCodeKnown")
    @Mapping(target = "message", source = "exitOutcome.message")
    EvaluationResultEntity toEntity(EvaluationState evaluationState);

}
