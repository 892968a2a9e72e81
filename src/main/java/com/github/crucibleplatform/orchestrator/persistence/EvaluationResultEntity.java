package com.github.crucibleplatform.orchestrator.persistence;

import com.github.crucibleplatform.orchestrator.domain.EvaluationStatus;
import com.github.crucibleplatform.orchestrator.domain.ExitReason;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * @author crucible-platform
 */
@Entity
@Data
@AllArgsConstructor
@NoArgsConstructor
public class EvaluationResultEntity {

    @Id
    private String evaluationId;

    @Enumerated(EnumType.STRING)
    private EvaluationStatus status;

    @Enumerated(EnumType.STRING)
    private ExitReason exitReason;

    private Integer exitCode;

    private boolean exitCodeKnown;

    private int priority;

    private ZonedDateTime createdAt;

    private ZonedDateTime startedAt;

    private ZonedDateTime completedAt;

    private String unitReference;

    private String outputRef;

    @Lob
    private String message;

}
