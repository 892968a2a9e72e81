package com.github.crucibleplatform.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * @author crucible-platform
 */
@Data
@ConfigurationProperties(prefix = "crucible.sandbox")
public class SandboxProperties {

    /** {@code kubernetes} or {@code local}. */
    private String provider = "kubernetes";

    private String namespace = "crucible";

    /** Image used when a submission names none. */
    private String defaultImage = "python-base";

    /** Named executor images, e.g. {@code python-ml -> registry/executor-ml:1.2}. */
    private Map<String, String> images = new HashMap<>(Map.of("python-base", "executor-base:latest"));

    /** Fail unit creation instead of falling back when the gVisor runtime class is missing. */
    private boolean requireGvisor = false;

    private String runtimeClassName = "gvisor";

    private int jobTtlSecondsAfterFinished = 300;

    /** Added to timeout and grace period for the job's own deadline, which only backs up the dispatcher's. */
    private int jobDeadlineMarginSeconds = 30;

    private int logTailLines = 100;

    /** Interpreter command of the local process provider. */
    private String localInterpreter = "python3";

}
