package com.github.crucibleplatform.orchestrator.async;

import com.github.crucibleplatform.orchestrator.domain.EvaluationStatus;
import com.github.crucibleplatform.orchestrator.domain.EvaluationTask;
import com.github.crucibleplatform.orchestrator.domain.ExecutionSlot;
import com.github.crucibleplatform.orchestrator.domain.ExitOutcome;
import com.github.crucibleplatform.orchestrator.domain.ExitReason;
import com.github.crucibleplatform.orchestrator.domain.TransitionResult;
import com.github.crucibleplatform.orchestrator.domain.UnitHandle;
import com.github.crucibleplatform.orchestrator.domain.UnitSignal;
import com.github.crucibleplatform.orchestrator.service.CapacityManager;
import com.github.crucibleplatform.orchestrator.service.EvaluationStateMachine;
import com.github.crucibleplatform.orchestrator.service.SandboxProvider;
import com.github.crucibleplatform.orchestrator.service.SandboxProviderException;
import com.github.crucibleplatform.orchestrator.service.UnitWatch;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Supervises one dispatched execution unit from creation until its slot is released.
 * <p>
 * Unit signals, the deadline and cancellation race against each other; the state machine decides which terminal
 * status wins. Whatever wins, {@link #cleanup(boolean)} runs once and releases the slot exactly once.
 *
 * @author crucible-platform
 */
@Slf4j
public class UnitSupervisor {

    @Getter
    private final EvaluationTask task;

    @Getter
    private final UnitHandle handle;

    @Getter
    private final ExecutionSlot slot;

    private final EvaluationStateMachine stateMachine;

    private final CapacityManager capacityManager;

    private final SandboxProvider sandboxProvider;

    private final ScheduledExecutorService scheduler;

    private final Executor watchExecutor;

    private final RetryTemplate watchRetryTemplate;

    @Getter
    private final Duration gracePeriod;

    private final Duration exitCodeJoinWindow;

    private final Consumer<UnitSupervisor> onFinished;

    private final AtomicBoolean finished = new AtomicBoolean(false);

    private final Object exitLock = new Object();

    private volatile UnitWatch watch;

    private volatile ScheduledFuture<?> deadline;

    private ScheduledFuture<?> exitJoinTimer;

    private Boolean nativeSucceeded;

    private String nativeMessage;

    private Integer exitCode;

    private boolean exitResolved;

    @Builder
    UnitSupervisor(final EvaluationTask task, final UnitHandle handle, final ExecutionSlot slot,
                   final EvaluationStateMachine stateMachine, final CapacityManager capacityManager,
                   final SandboxProvider sandboxProvider, final ScheduledExecutorService scheduler,
                   final Executor watchExecutor, final RetryTemplate watchRetryTemplate, final Duration gracePeriod,
                   final Duration exitCodeJoinWindow, final Consumer<UnitSupervisor> onFinished) {
        this.task = task;
        this.handle = handle;
        this.slot = slot;
        this.stateMachine = stateMachine;
        this.capacityManager = capacityManager;
        this.sandboxProvider = sandboxProvider;
        this.scheduler = scheduler;
        this.watchExecutor = watchExecutor;
        this.watchRetryTemplate = watchRetryTemplate;
        this.gracePeriod = gracePeriod;
        this.exitCodeJoinWindow = exitCodeJoinWindow;
        this.onFinished = onFinished == null ? supervisor -> { } : onFinished;
    }

    public String getEvaluationId() {
        return task.evaluationId();
    }

    public boolean isFinished() {
        return finished.get();
    }

    /**
     * Arms the deadline and starts observing the unit. The deadline counts from unit creation.
     */
    public void start() {
        deadline = scheduler.schedule(this::onDeadline, task.resourceRequirements().timeoutSeconds(),
                TimeUnit.SECONDS);
        watchExecutor.execute(this::openWatch);
    }

    public TransitionResult cancel() {
        final TransitionResult result = stateMachine.transition(getEvaluationId(), EvaluationStatus.CANCELLED,
                ExitOutcome.cancelled());
        if (result.isApplied()) {
            log.info("Cancelling unit {} of evaluation {}", handle.unitName(), getEvaluationId());
            shutdown();
        }
        return result;
    }

    /**
     * Gives up the unit without recording a status, e.g. when the evaluation became terminal while the unit was
     * being created.
     */
    public void abandon() {
        cleanup(true);
    }

    /**
     * Marks the evaluation failed for an infrastructure reason and removes the unit.
     */
    public void failInfrastructure(final String message) {
        final TransitionResult result = stateMachine.transition(getEvaluationId(), EvaluationStatus.FAILED,
                ExitOutcome.infrastructure(message));
        if (result.isApplied()) {
            log.error("Evaluation {} failed because of infrastructure problems: {}", getEvaluationId(), message);
        }
        cleanup(true);
    }

    void onSignal(final UnitHandle unitHandle, final UnitSignal signal) {
        if (finished.get()) {
            log.debug("Ignoring {} for finished evaluation {}", signal.type(), getEvaluationId());
            return;
        }
        log.debug("Signal {} for evaluation {} (unit {})", signal.type(), getEvaluationId(), unitHandle.unitName());

        switch (signal.type()) {
            case STARTED -> stateMachine.transition(getEvaluationId(), EvaluationStatus.RUNNING);
            case SUCCEEDED -> recordNativeCompletion(true, signal.message());
            case FAILED -> recordNativeCompletion(false, signal.message());
            case DEADLINE_EXCEEDED -> onPlatformDeadline(signal.message());
            case EXIT_CODE -> recordExitCode(signal.exitCode());
            case GONE -> onUnitGone(signal.message());
            case WATCH_LOST -> {
                log.warn("Lost watch on unit {} of evaluation {}: {}", unitHandle.unitName(), getEvaluationId(),
                        signal.message());
                watchExecutor.execute(this::openWatch);
            }
        }
    }

    void openWatch() {
        if (finished.get()) {
            return;
        }
        closeWatch();
        try {
            watch = watchRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Re-establishing watch on unit {} of evaluation {} (attempt {})", handle.unitName(),
                            getEvaluationId(), context.getRetryCount() + 1);
                }
                return sandboxProvider.watch(handle, this::onSignal);
            });
        } catch (SandboxProviderException e) {
            log.error("Could not watch unit {} of evaluation {}", handle.unitName(), getEvaluationId(), e);
            failInfrastructure("watch could not be established: " + e.getMessage());
            return;
        }
        if (finished.get()) {
            closeWatch();
        }
    }

    private void recordNativeCompletion(final boolean succeeded, final String message) {
        synchronized (exitLock) {
            if (exitResolved || nativeSucceeded != null) {
                return;
            }
            nativeSucceeded = succeeded;
            nativeMessage = message;
            if (exitCode != null) {
                resolveExit();
            } else {
                armExitJoinTimer();
            }
        }
    }

    private void recordExitCode(final Integer code) {
        if (code == null) {
            return;
        }
        synchronized (exitLock) {
            if (exitResolved || exitCode != null) {
                return;
            }
            exitCode = code;
            if (nativeSucceeded != null) {
                resolveExit();
            } else {
                armExitJoinTimer();
            }
        }
    }

    private void armExitJoinTimer() {
        if (exitJoinTimer == null) {
            exitJoinTimer = scheduler.schedule(this::onExitJoinWindowElapsed, exitCodeJoinWindow.toMillis(),
                    TimeUnit.MILLISECONDS);
        }
    }

    private void onExitJoinWindowElapsed() {
        synchronized (exitLock) {
            if (!exitResolved) {
                resolveExit();
            }
        }
    }

    /**
     * Joins both completion channels. The native status decides when present; the exit code alone decides
     * otherwise. Called with {@link #exitLock} held.
     */
    private void resolveExit() {
        exitResolved = true;
        if (exitJoinTimer != null) {
            exitJoinTimer.cancel(false);
        }

        final ExitOutcome outcome;
        if (nativeSucceeded != null && exitCode != null) {
            outcome = new ExitOutcome(nativeSucceeded ? ExitReason.SUCCESS : ExitReason.FAILURE, exitCode, true,
                    nativeMessage != null ? nativeMessage : "Process exited with code " + exitCode);
        } else if (nativeSucceeded != null) {
            log.warn("No exit code reported for evaluation {}, recording exit code as unknown", getEvaluationId());
            outcome = ExitOutcome.exitCodeUnknown(nativeSucceeded, nativeMessage);
        } else {
            outcome = ExitOutcome.fromExitCode(exitCode);
        }

        stateMachine.transition(getEvaluationId(), outcome.terminalStatus(), outcome);
        scheduler.execute(() -> cleanup(false));
    }

    private void onUnitGone(final String message) {
        synchronized (exitLock) {
            if (nativeSucceeded != null || exitCode != null) {
                // a completion signal is already being joined
                return;
            }
        }
        if (stateMachine.isTerminal(getEvaluationId())) {
            cleanup(false);
            return;
        }
        failInfrastructure("unit disappeared" + (message != null ? ": " + message : ""));
    }

    private void onDeadline() {
        final TransitionResult result = stateMachine.transition(getEvaluationId(), EvaluationStatus.TIMEOUT,
                ExitOutcome.timeout(task.resourceRequirements().timeoutSeconds()));
        if (!result.isApplied()) {
            return;
        }
        log.info("Evaluation {} exceeded its timeout of {} seconds, stopping unit {} with a grace period of {}",
                getEvaluationId(), task.resourceRequirements().timeoutSeconds(), handle.unitName(), gracePeriod);
        shutdown();
    }

    private void onPlatformDeadline(final String message) {
        final TransitionResult result = stateMachine.transition(getEvaluationId(), EvaluationStatus.TIMEOUT,
                ExitOutcome.timeout(task.resourceRequirements().timeoutSeconds()));
        if (result.isApplied()) {
            log.info("Unit {} of evaluation {} was stopped by the platform deadline ({})", handle.unitName(),
                    getEvaluationId(), message);
            cleanup(true);
        }
    }

    /**
     * Cooperative stop first; forced termination and slot release once the grace period has elapsed, unless the
     * unit reports its exit earlier.
     */
    private void shutdown() {
        try {
            sandboxProvider.stop(handle, gracePeriod);
        } catch (SandboxProviderException e) {
            log.warn("Cooperative stop of unit {} failed, terminating after grace period", handle.unitName(), e);
        }
        scheduler.schedule(() -> cleanup(true), gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cleanup(final boolean terminateUnit) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        if (deadline != null) {
            deadline.cancel(false);
        }
        synchronized (exitLock) {
            if (exitJoinTimer != null) {
                exitJoinTimer.cancel(false);
            }
        }
        closeWatch();

        if (terminateUnit) {
            try {
                sandboxProvider.terminate(handle);
            } catch (SandboxProviderException e) {
                log.error("Failed to terminate unit {} of evaluation {}", handle.unitName(), getEvaluationId(), e);
            }
        }

        capacityManager.release(slot);
        log.info("Supervision of evaluation {} finished (unit {})", getEvaluationId(), handle.unitName());
        onFinished.accept(this);
    }

    private void closeWatch() {
        final UnitWatch current = watch;
        if (current != null) {
            watch = null;
            current.close();
        }
    }

}
