package com.github.crucibleplatform.orchestrator.api;

import com.github.crucibleplatform.orchestrator.config.SandboxProperties;
import com.github.crucibleplatform.orchestrator.domain.DispatchResult;
import com.github.crucibleplatform.orchestrator.domain.EvaluationState;
import com.github.crucibleplatform.orchestrator.domain.EvaluationStatus;
import com.github.crucibleplatform.orchestrator.domain.EvaluationTask;
import com.github.crucibleplatform.orchestrator.domain.LogsResult;
import com.github.crucibleplatform.orchestrator.mapper.EvaluationApiMapper;
import com.github.crucibleplatform.orchestrator.service.DispatcherService;
import com.github.crucibleplatform.orchestrator.service.EvaluationStateMachine;
import com.github.crucibleplatform.orchestrator.service.EvaluationValidator;
import com.github.crucibleplatform.orchestrator.service.InvalidEvaluationException;
import com.github.crucibleplatform.orchestrator.service.TaskRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.TreeMap;

/**
 * Dispatcher API: direct execution without queueing, status and logs of any evaluation.
 *
 * @author crucible-platform
 */
@RestController
@Slf4j
public class DispatcherController {

    private final DispatcherService dispatcherService;

    private final EvaluationStateMachine stateMachine;

    private final EvaluationValidator evaluationValidator;

    private final TaskRouter taskRouter;

    private final EvaluationApiMapper evaluationApiMapper;

    private final SandboxProperties sandboxProperties;

    public DispatcherController(final DispatcherService dispatcherService,
                                final EvaluationStateMachine stateMachine,
                                final EvaluationValidator evaluationValidator,
                                final TaskRouter taskRouter,
                                final EvaluationApiMapper evaluationApiMapper,
                                final SandboxProperties sandboxProperties) {
        this.dispatcherService = dispatcherService;
        this.stateMachine = stateMachine;
        this.evaluationValidator = evaluationValidator;
        this.taskRouter = taskRouter;
        this.evaluationApiMapper = evaluationApiMapper;
        this.sandboxProperties = sandboxProperties;
    }

    @RequestMapping(value = "/execute", method = RequestMethod.POST)
    public ResponseEntity<Object> execute(@RequestBody final ExecuteRequest executeRequest)
            throws InvalidEvaluationException {
        final EvaluationTask task = evaluationValidator.createTask(evaluationApiMapper.toEvaluationRequest(executeRequest));
        final DispatchResult result = dispatcherService.execute(task);

        if (result.accepted()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(new ExecuteResponse(task.evaluationId(), result.unitReference(), EvaluationStatus.PROVISIONING));
        }
        log.info("Execution of evaluation {} rejected: {} ({})", task.evaluationId(), result.reason(), result.message());
        return ResponseEntity.status(toHttpStatus(result))
                .body(new ApiError(result.reason().name(), result.message(), result.retryable()));
    }

    @RequestMapping(value = "/status/{evaluation_id}", method = RequestMethod.GET)
    public StatusResponse getStatus(@PathVariable("evaluation_id") final String evaluationId) {
        final EvaluationState state = stateMachine.get(evaluationId)
                .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
        final StatusResponse statusResponse = evaluationApiMapper.toStatusResponse(state);
        if (state.status().isQueued()) {
            final int positionInQueue = taskRouter.getPositionInQueue(evaluationId);
            statusResponse.setPositionInQueue(positionInQueue > 0 ? positionInQueue : null);
        }
        return statusResponse;
    }

    @RequestMapping(value = "/logs/{evaluation_id}", method = RequestMethod.GET)
    public ResponseEntity<Object> getLogs(@PathVariable("evaluation_id") final String evaluationId) {
        final LogsResult logsResult = dispatcherService.logs(evaluationId);
        return switch (logsResult.availability()) {
            case AVAILABLE -> ResponseEntity.ok(new LogsResponse(evaluationId, logsResult.availability(),
                    logsResult.content()));
            case NOT_YET_AVAILABLE -> ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(new LogsResponse(evaluationId, logsResult.availability(), null));
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ApiError(ApiError.REASON_NOT_FOUND, "No logs for evaluation " + evaluationId, false));
        };
    }

    @RequestMapping(value = "/images", method = RequestMethod.GET)
    public Map<String, Object> getExecutorImages() {
        return Map.of(
                "defaultImage", sandboxProperties.getDefaultImage(),
                "images", new TreeMap<>(sandboxProperties.getImages()));
    }

    static HttpStatus toHttpStatus(final DispatchResult result) {
        return switch (result.reason()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CAPACITY_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case INFRASTRUCTURE -> HttpStatus.SERVICE_UNAVAILABLE;
            case ALREADY_TERMINAL, DUPLICATE -> HttpStatus.CONFLICT;
        };
    }

}
