package com.github.crucibleplatform.orchestrator.persistence;

import com.github.crucibleplatform.orchestrator.domain.LifecycleEventType;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * @author crucible-platform
 */
@Entity
@Table(uniqueConstraints = @UniqueConstraint(columnNames = {"evaluationId", "eventType"}))
@Data
@AllArgsConstructor
@NoArgsConstructor
public class LifecycleEventEntity {

    @Id
    @GeneratedValue
    private Long id;

    private String evaluationId;

    @Enumerated(EnumType.STRING)
    private LifecycleEventType eventType;

    private ZonedDateTime timestamp;

    private long sequenceHint;

    @Lob
    private String payload;

}
