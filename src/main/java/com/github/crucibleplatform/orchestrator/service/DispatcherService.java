package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.async.UnitSupervisor;
import com.github.crucibleplatform.orchestrator.domain.ClaimResult;
import com.github.crucibleplatform.orchestrator.domain.DispatchResult;
import com.github.crucibleplatform.orchestrator.domain.EvaluationState;
import com.github.crucibleplatform.orchestrator.domain.EvaluationStatus;
import com.github.crucibleplatform.orchestrator.domain.EvaluationTask;
import com.github.crucibleplatform.orchestrator.domain.ExecutionSlot;
import com.github.crucibleplatform.orchestrator.domain.ExitOutcome;
import com.github.crucibleplatform.orchestrator.domain.LogsResult;
import com.github.crucibleplatform.orchestrator.domain.RejectionReason;
import com.github.crucibleplatform.orchestrator.domain.TransitionResult;
import com.github.crucibleplatform.orchestrator.domain.UnitHandle;
import com.github.crucibleplatform.orchestrator.domain.UnitSpec;
import com.github.crucibleplatform.orchestrator.util.PriorityUtil;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Admits evaluations against the capacity pool, creates their execution units and hands them to a
 * {@link UnitSupervisor}. Owns the slot of every evaluation it accepted.
 *
 * @author crucible-platform
 */
@Service
@Slf4j
public class DispatcherService {

    private final CapacityManager capacityManager;

    private final EvaluationStateMachine stateMachine;

    private final SandboxProvider sandboxProvider;

    private final SettingsService settingsService;

    private final EvaluationValidator evaluationValidator;

    private final ExecutorImageResolver executorImageResolver;

    private final ScheduledExecutorService supervisionScheduler;

    private final Executor watchExecutor;

    private final RetryTemplate watchRetryTemplate;

    private final Map<String, UnitSupervisor> activeSupervisors = new ConcurrentHashMap<>();

    private final Map<String, UnitHandle> unitHandles = new ConcurrentHashMap<>();

    /** Evaluations registered by a direct call whose unit could not be created, with the time of the failure. */
    private final Map<String, Instant> undispatchedEvaluations = new ConcurrentHashMap<>();

    public DispatcherService(final CapacityManager capacityManager,
                             final EvaluationStateMachine stateMachine,
                             final SandboxProvider sandboxProvider,
                             final SettingsService settingsService,
                             final EvaluationValidator evaluationValidator,
                             final ExecutorImageResolver executorImageResolver,
                             @Qualifier("supervisionScheduler") final ScheduledExecutorService supervisionScheduler,
                             @Qualifier("watchExecutor") final Executor watchExecutor,
                             @Qualifier("watchRetryTemplate") final RetryTemplate watchRetryTemplate) {
        this.capacityManager = capacityManager;
        this.stateMachine = stateMachine;
        this.sandboxProvider = sandboxProvider;
        this.settingsService = settingsService;
        this.evaluationValidator = evaluationValidator;
        this.executorImageResolver = executorImageResolver;
        this.supervisionScheduler = supervisionScheduler;
        this.watchExecutor = watchExecutor;
        this.watchRetryTemplate = watchRetryTemplate;
    }

    public DispatchResult execute(final EvaluationTask task) {
        final String evaluationId = task.evaluationId();
        try {
            evaluationValidator.validate(task);
        } catch (InvalidEvaluationException e) {
            log.info("Rejecting evaluation {}: {}", evaluationId, e.getMessage());
            return DispatchResult.rejected(RejectionReason.VALIDATION, e.getMessage());
        }
        if (unitHandles.containsKey(evaluationId)) {
            return DispatchResult.rejected(RejectionReason.DUPLICATE,
                    "Evaluation " + evaluationId + " has already been dispatched");
        }

        final ClaimResult claim = capacityManager.tryClaim(evaluationId, task.resourceRequirements());
        if (!claim.isClaimed()) {
            return DispatchResult.rejected(RejectionReason.CAPACITY_EXCEEDED, "No execution capacity available");
        }
        final ExecutionSlot slot = claim.slot();

        final boolean registeredHere = stateMachine.register(task);
        final Optional<EvaluationStatus> status = stateMachine.getStatus(evaluationId);
        if (status.isEmpty() || status.get() != EvaluationStatus.QUEUED) {
            capacityManager.release(slot);
            final boolean terminal = status.map(EvaluationStatus::isFinal).orElse(false);
            log.info("Not dispatching evaluation {} in status {}", evaluationId, status.orElse(null));
            return DispatchResult.rejected(terminal ? RejectionReason.ALREADY_TERMINAL : RejectionReason.DUPLICATE,
                    "Evaluation " + evaluationId + " is " + status.map(Enum::name).orElse("unknown"));
        }

        final UnitHandle handle;
        try {
            handle = sandboxProvider.createUnit(createUnitSpec(task));
        } catch (SandboxQuotaExceededException e) {
            capacityManager.release(slot);
            trackUndispatched(evaluationId, registeredHere);
            log.info("Sandbox quota exhausted for evaluation {}: {}", evaluationId, e.getMessage());
            return DispatchResult.rejected(RejectionReason.CAPACITY_EXCEEDED, e.getMessage());
        } catch (SandboxProviderException e) {
            capacityManager.release(slot);
            trackUndispatched(evaluationId, registeredHere);
            log.error("Could not create execution unit for evaluation {}", evaluationId, e);
            return DispatchResult.rejected(RejectionReason.INFRASTRUCTURE, e.getMessage());
        }
        unitHandles.put(evaluationId, handle);
        undispatchedEvaluations.remove(evaluationId);

        final UnitSupervisor supervisor = UnitSupervisor.builder()
                .task(task)
                .handle(handle)
                .slot(slot)
                .stateMachine(stateMachine)
                .capacityManager(capacityManager)
                .sandboxProvider(sandboxProvider)
                .scheduler(supervisionScheduler)
                .watchExecutor(watchExecutor)
                .watchRetryTemplate(watchRetryTemplate)
                .gracePeriod(settingsService.getGracePeriod(task.riskLevel()))
                .exitCodeJoinWindow(Duration.ofMillis(settingsService.getExitCodeJoinMillis()))
                .onFinished(this::onSupervisionFinished)
                .build();
        activeSupervisors.put(evaluationId, supervisor);

        final TransitionResult provisioning = stateMachine.transition(evaluationId, EvaluationStatus.PROVISIONING,
                null, handle.reference());
        if (!provisioning.isApplied()) {
            log.info("Evaluation {} changed while its unit was created ({}), removing unit {}", evaluationId,
                    provisioning, handle.unitName());
            supervisor.abandon();
            return DispatchResult.rejected(RejectionReason.ALREADY_TERMINAL,
                    "Evaluation " + evaluationId + " was cancelled");
        }

        supervisor.start();
        log.info("Dispatched evaluation {} to unit {}", evaluationId, handle.reference());
        return DispatchResult.accepted(handle.reference());
    }

    /**
     * Cancels an evaluation that was handed to the dispatcher. A no-op if it already reached a terminal status.
     */
    public TransitionResult cancel(final String evaluationId) {
        final UnitSupervisor supervisor = activeSupervisors.get(evaluationId);
        if (supervisor != null) {
            return supervisor.cancel();
        }
        return stateMachine.transition(evaluationId, EvaluationStatus.CANCELLED, ExitOutcome.cancelled());
    }

    public LogsResult logs(final String evaluationId) {
        final Optional<EvaluationState> state = stateMachine.get(evaluationId);
        if (state.isEmpty()) {
            return LogsResult.notFound(evaluationId);
        }
        final UnitHandle handle = unitHandles.get(evaluationId);
        if (handle == null) {
            // a finished evaluation without a unit either never got one or its unit has been forgotten
            return state.get().status().isFinal() ? LogsResult.notFound(evaluationId)
                    : LogsResult.notYetAvailable(evaluationId);
        }

        try {
            return sandboxProvider.fetchLogs(handle)
                    .map(content -> LogsResult.available(evaluationId, content))
                    .orElseGet(() -> LogsResult.notYetAvailable(evaluationId));
        } catch (UnitNotFoundException e) {
            log.debug("Unit {} of evaluation {} no longer exists", handle.unitName(), evaluationId);
            return state.get().status().isFinal() ? LogsResult.notFound(evaluationId)
                    : LogsResult.notYetAvailable(evaluationId);
        } catch (SandboxProviderException e) {
            log.warn("Could not fetch logs of evaluation {}: {}", evaluationId, e.getMessage());
            return LogsResult.notYetAvailable(evaluationId);
        }
    }

    public boolean isSupervised(final String evaluationId) {
        return activeSupervisors.containsKey(evaluationId);
    }

    public int getNumberOfActiveUnits() {
        return activeSupervisors.size();
    }

    public void updateCapacity(final int maxConcurrentEvaluations) {
        capacityManager.resize(maxConcurrentEvaluations);
        settingsService.setMaxConcurrentEvaluations(maxConcurrentEvaluations);
    }

    /**
     * Recovers slots whose owner is gone: slots without a supervisor and slots held far beyond their
     * evaluation's timeout.
     */
    @Scheduled(fixedDelayString = "${CRUCIBLE_STALE_SLOT_SWEEP_MILLIS:30000}",
            initialDelayString = "${CRUCIBLE_STALE_SLOT_SWEEP_MILLIS:30000}")
    public void recoverStaleSlots() {
        final Instant now = Instant.now();
        final Duration margin = Duration.ofSeconds(settingsService.getStaleSlotMarginSeconds());

        for (final ExecutionSlot slot : List.copyOf(capacityManager.getActiveSlots().values())) {
            final String evaluationId = slot.getEvaluationId();
            final UnitSupervisor supervisor = activeSupervisors.get(evaluationId);
            final Duration held = Duration.between(slot.getClaimedAt(), now);

            if (supervisor == null) {
                if (held.compareTo(margin) > 0) {
                    log.warn("Releasing orphaned slot of evaluation {} held for {}", evaluationId, held);
                    capacityManager.release(slot);
                }
                continue;
            }

            final Duration limit = Duration.ofSeconds(slot.getResourceRequirements().timeoutSeconds())
                    .plus(supervisor.getGracePeriod())
                    .plus(margin);
            if (held.compareTo(limit) > 0) {
                log.warn("Slot of evaluation {} held for {} exceeds {}, failing evaluation", evaluationId, held,
                        limit);
                supervisor.failInfrastructure("stale execution slot");
            }
        }

        expireUndispatchedEvaluations(now);
    }

    /**
     * Fails evaluations of direct callers that were not dispatched again within the queue SLA. Routed evaluations
     * are not tracked here, the router expires those itself.
     */
    void expireUndispatchedEvaluations(final Instant now) {
        final Duration queueSla = Duration.ofSeconds(settingsService.getQueueSlaSeconds());
        for (final Map.Entry<String, Instant> entry : List.copyOf(undispatchedEvaluations.entrySet())) {
            final String evaluationId = entry.getKey();
            if (stateMachine.getStatus(evaluationId).map(status -> status != EvaluationStatus.QUEUED).orElse(true)) {
                undispatchedEvaluations.remove(evaluationId, entry.getValue());
                continue;
            }
            if (Duration.between(entry.getValue(), now).compareTo(queueSla) >= 0) {
                undispatchedEvaluations.remove(evaluationId, entry.getValue());
                final TransitionResult result = stateMachine.transition(evaluationId, EvaluationStatus.FAILED,
                        ExitOutcome.infrastructure("no execution unit could be created within " + queueSla));
                if (result.isApplied()) {
                    log.error("Evaluation {} could not be dispatched within {}, marking it failed", evaluationId,
                            queueSla);
                }
            }
        }
    }

    @PreDestroy
    public void cancelAllActiveEvaluations() {
        activeSupervisors.values().forEach(supervisor -> {
            log.info("Shutting down, cancelling evaluation {}", supervisor.getEvaluationId());
            supervisor.cancel();
        });
    }

    private void onSupervisionFinished(final UnitSupervisor supervisor) {
        activeSupervisors.remove(supervisor.getEvaluationId(), supervisor);
        final Runnable forget = () -> unitHandles.remove(supervisor.getEvaluationId(), supervisor.getHandle());
        try {
            supervisionScheduler.schedule(forget, settingsService.getUnitRetentionSeconds(), TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler shut down, forgetting unit of evaluation {} now", supervisor.getEvaluationId());
            forget.run();
        }
    }

    private void trackUndispatched(final String evaluationId, final boolean registeredHere) {
        if (registeredHere) {
            undispatchedEvaluations.putIfAbsent(evaluationId, Instant.now());
        }
    }

    private UnitSpec createUnitSpec(final EvaluationTask task) {
        final String image = executorImageResolver.resolve(task.executorImage())
                .orElseThrow(() -> new IllegalStateException("Executor image vanished: " + task.executorImage()));
        return new UnitSpec(task.evaluationId(), task.code(), task.resourceRequirements(),
                (int) settingsService.getGracePeriod(task.riskLevel()).toSeconds(),
                PriorityUtil.priorityClassName(task.priority()), image);
    }

}
