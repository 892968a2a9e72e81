package com.github.crucibleplatform.orchestrator.api;

import com.github.crucibleplatform.orchestrator.domain.LogsAvailability;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author crucible-platform
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogsResponse {

    private String evaluationId;

    private LogsAvailability availability;

    private String logs;

}
