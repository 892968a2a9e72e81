package com.github.crucibleplatform.orchestrator.mapper;

import com.github.crucibleplatform.orchestrator.api.ExecuteRequest;
import com.github.crucibleplatform.orchestrator.api.StatusResponse;
import com.github.crucibleplatform.orchestrator.domain.EvaluationRequest;
import com.github.crucibleplatform.orchestrator.domain.EvaluationState;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * @author crucible-platform
 */
@Mapper
public interface EvaluationApiMapper {

    EvaluationRequest toEvaluationRequest(ExecuteRequest executeRequest);

    @Mapping(target = "exitReason", source = "exitOutcome.reason")
    @Mapping(target = "exitCode", source = "exitOutcome.exitCode")
    @Mapping(target = "exitCodeKnown", source = "exitOutcome.exitCodeKnown")
    @Mapping(target = "message", source = "exitOutcome.message")
    @Mapping(target = "positionInQueue", ignore = true)
    StatusResponse toStatusResponse(EvaluationState evaluationState);

}
