package com.github.crucibleplatform.orchestrator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.crucibleplatform.orchestrator.domain.EvaluationStatus;
import com.github.crucibleplatform.orchestrator.domain.ExitReason;
import com.github.crucibleplatform.orchestrator.domain.RiskLevel;
import lombok.Data;

import java.time.ZonedDateTime;

/**
 * @author crucible-platform
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {

    private String evaluationId;

    private EvaluationStatus status;

    private int priority;

    private RiskLevel riskLevel;

    private ZonedDateTime createdAt;

    private ZonedDateTime startedAt;

    private ZonedDateTime completedAt;

    private ExitReason exitReason;

    private Integer exitCode;

    private Boolean exitCodeKnown;

    private String message;

    private String unitReference;

    private String outputRef;

    private long version;

    /** Only set while the evaluation waits in the queue. */
    private Integer positionInQueue;

}
