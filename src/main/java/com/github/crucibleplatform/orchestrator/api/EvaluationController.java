package com.github.crucibleplatform.orchestrator.api;

import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;
import com.github.crucibleplatform.orchestrator.domain.RejectionReason;
import com.github.crucibleplatform.orchestrator.domain.SubmissionResult;
import com.github.crucibleplatform.orchestrator.domain.TransitionResult;
import com.github.crucibleplatform.orchestrator.mapper.EvaluationApiMapper;
import com.github.crucibleplatform.orchestrator.service.EvaluationStateMachine;
import com.github.crucibleplatform.orchestrator.service.LifecycleEventRecorder;
import com.github.crucibleplatform.orchestrator.service.TaskRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Queued submissions through the task router.
 *
 * @author crucible-platform
 */
@RestController
@RequestMapping("/evaluations")
@Slf4j
public class EvaluationController {

    private final TaskRouter taskRouter;

    private final EvaluationStateMachine stateMachine;

    private final LifecycleEventRecorder lifecycleEventRecorder;

    private final EvaluationApiMapper evaluationApiMapper;

    public EvaluationController(final TaskRouter taskRouter,
                                final EvaluationStateMachine stateMachine,
                                final LifecycleEventRecorder lifecycleEventRecorder,
                                final EvaluationApiMapper evaluationApiMapper) {
        this.taskRouter = taskRouter;
        this.stateMachine = stateMachine;
        this.lifecycleEventRecorder = lifecycleEventRecorder;
        this.evaluationApiMapper = evaluationApiMapper;
    }

    @RequestMapping(method = RequestMethod.POST)
    public ResponseEntity<Object> submit(@RequestBody final ExecuteRequest executeRequest) {
        final SubmissionResult result = taskRouter.submit(evaluationApiMapper.toEvaluationRequest(executeRequest));
        if (result.accepted()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
        }
        return ResponseEntity.badRequest()
                .body(new ApiError(RejectionReason.VALIDATION.name(), result.message(), false));
    }

    @RequestMapping(value = "/{evaluation_id}", method = RequestMethod.DELETE)
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable("evaluation_id") final String evaluationId) {
        if (stateMachine.get(evaluationId).isEmpty()) {
            throw new EvaluationNotFoundException(evaluationId);
        }
        final TransitionResult result = taskRouter.cancel(evaluationId);
        log.info("Cancellation of evaluation {} requested: {}", evaluationId, result);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("evaluationId", evaluationId, "result", result.name()));
    }

    @RequestMapping(value = "/{evaluation_id}/events", method = RequestMethod.GET)
    public List<LifecycleEvent> getEvents(@PathVariable("evaluation_id") final String evaluationId) {
        if (stateMachine.get(evaluationId).isEmpty()) {
            throw new EvaluationNotFoundException(evaluationId);
        }
        return lifecycleEventRecorder.findEvents(evaluationId);
    }

}
