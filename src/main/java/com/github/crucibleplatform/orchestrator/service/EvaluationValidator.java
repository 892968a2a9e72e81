package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.EvaluationRequest;
import com.github.crucibleplatform.orchestrator.domain.EvaluationTask;
import com.github.crucibleplatform.orchestrator.domain.ResourceRequirements;
import com.github.crucibleplatform.orchestrator.domain.RiskLevel;
import com.github.crucibleplatform.orchestrator.util.PriorityUtil;
import com.github.crucibleplatform.orchestrator.util.ResourceUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * Turns submissions into tasks and rejects requests that exceed the absolute limits of the cluster. A request
 * rejected here would never fit, no matter how long it waited.
 *
 * @author crucible-platform
 */
@Component
@RequiredArgsConstructor
public class EvaluationValidator {

    private static final int MAX_EVALUATION_ID_LENGTH = 128;

    private final SettingsService settingsService;

    private final ExecutorImageResolver executorImageResolver;

    public EvaluationTask createTask(final EvaluationRequest request) throws InvalidEvaluationException {
        final String evaluationId = StringUtils.hasText(request.evaluationId()) ? request.evaluationId().trim()
                : UUID.randomUUID().toString();

        final int memoryMb;
        final int cpuMillicores;
        final RiskLevel riskLevel;
        try {
            memoryMb = ResourceUtil.parseMemoryToMb(StringUtils.hasText(request.memoryLimit())
                    ? request.memoryLimit() : settingsService.getDefaultMemory());
            cpuMillicores = ResourceUtil.parseCpuToMillicores(StringUtils.hasText(request.cpuLimit())
                    ? request.cpuLimit() : settingsService.getDefaultCpu());
            riskLevel = RiskLevel.fromString(request.riskLevel());
        } catch (IllegalArgumentException e) {
            throw new InvalidEvaluationException(e.getMessage(), e);
        }

        final int timeoutSeconds = request.timeoutSeconds() != null ? request.timeoutSeconds()
                : settingsService.getDefaultTimeoutSeconds();

        final EvaluationTask task = new EvaluationTask(evaluationId, request.code(),
                PriorityUtil.normalize(request.priority()),
                new ResourceRequirements(memoryMb, cpuMillicores, timeoutSeconds), riskLevel,
                request.executorImage(), ZonedDateTime.now());
        validate(task);
        return task;
    }

    public void validate(final EvaluationTask task) throws InvalidEvaluationException {
        if (!StringUtils.hasText(task.evaluationId()) || task.evaluationId().length() > MAX_EVALUATION_ID_LENGTH) {
            throw new InvalidEvaluationException("Evaluation id must contain 1 to " + MAX_EVALUATION_ID_LENGTH
                    + " characters");
        }
        if (!StringUtils.hasText(task.code())) {
            throw new InvalidEvaluationException("Code must not be empty");
        }
        final int codeSize = task.code().getBytes(StandardCharsets.UTF_8).length;
        if (codeSize > settingsService.getMaxCodeSizeBytes()) {
            throw new InvalidEvaluationException(String.format("Code size of %d bytes exceeds the limit of %d bytes",
                    codeSize, settingsService.getMaxCodeSizeBytes()));
        }

        final ResourceRequirements requirements = task.resourceRequirements();
        final int maxMemoryMb = ResourceUtil.parseMemoryToMb(settingsService.getMaxMemory());
        if (requirements.memoryMb() <= 0 || requirements.memoryMb() > maxMemoryMb) {
            throw new InvalidEvaluationException(String.format("Memory limit of %dMi is outside 1Mi..%dMi",
                    requirements.memoryMb(), maxMemoryMb));
        }
        final int maxCpuMillicores = ResourceUtil.parseCpuToMillicores(settingsService.getMaxCpu());
        if (requirements.cpuMillicores() <= 0 || requirements.cpuMillicores() > maxCpuMillicores) {
            throw new InvalidEvaluationException(String.format("CPU limit of %dm is outside 1m..%dm",
                    requirements.cpuMillicores(), maxCpuMillicores));
        }
        if (requirements.timeoutSeconds() <= 0 || requirements.timeoutSeconds() > settingsService.getMaxTimeoutSeconds()) {
            throw new InvalidEvaluationException(String.format("Timeout of %d seconds is outside 1..%d seconds",
                    requirements.timeoutSeconds(), settingsService.getMaxTimeoutSeconds()));
        }
        if (executorImageResolver.resolve(task.executorImage()).isEmpty()) {
            throw new InvalidEvaluationException("Unknown executor image: " + task.executorImage());
        }
    }

}
