package com.github.crucibleplatform.orchestrator.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

/**
 * Submission body of {@code POST /execute} and {@code POST /evaluations}. Snake case names are accepted as well.
 *
 * @author crucible-platform
 */
@Data
public class ExecuteRequest {

    @JsonAlias("eval_id")
    private String evaluationId;

    private String code;

    private Integer priority;

    @JsonAlias("memory_limit")
    private String memoryLimit;

    @JsonAlias("cpu_limit")
    private String cpuLimit;

    @JsonAlias("timeout")
    private Integer timeoutSeconds;

    @JsonAlias("risk_level")
    private String riskLevel;

    @JsonAlias("executor_image")
    private String executorImage;

}
