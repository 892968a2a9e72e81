package com.github.crucibleplatform.orchestrator.api;

import com.github.crucibleplatform.orchestrator.domain.EvaluationStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author crucible-platform
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteResponse {

    private String evaluationId;

    private String unitReference;

    private EvaluationStatus status;

}
