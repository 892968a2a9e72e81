package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.DispatchResult;
import com.github.crucibleplatform.orchestrator.domain.EvaluationRequest;
import com.github.crucibleplatform.orchestrator.domain.EvaluationStatus;
import com.github.crucibleplatform.orchestrator.domain.EvaluationTask;
import com.github.crucibleplatform.orchestrator.domain.ExitOutcome;
import com.github.crucibleplatform.orchestrator.domain.RejectionReason;
import com.github.crucibleplatform.orchestrator.domain.SubmissionResult;
import com.github.crucibleplatform.orchestrator.domain.TransitionResult;
import com.github.crucibleplatform.orchestrator.util.ExponentialBackoff;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Priority queue in front of the dispatcher. Higher priority first, FIFO within a priority. Tasks rejected for
 * lack of capacity are re-enqueued with backoff until the queue SLA runs out.
 *
 * @author crucible-platform
 */
@Service
@Slf4j
public class TaskRouter {

    static final Comparator<QueuedTask> DISPATCH_ORDER = Comparator
            .comparingInt((QueuedTask queuedTask) -> queuedTask.task().priority()).reversed()
            .thenComparingLong(QueuedTask::sequence);

    private final DispatcherService dispatcherService;

    private final EvaluationStateMachine stateMachine;

    private final EvaluationValidator evaluationValidator;

    private final SettingsService settingsService;

    private final ThreadPoolTaskExecutor taskExecutor;

    private final ScheduledExecutorService retryScheduler;

    private final ExponentialBackoff dispatchBackoff;

    private final PriorityBlockingQueue<QueuedTask> evaluationQueue = new PriorityBlockingQueue<>(64, DISPATCH_ORDER);

    private final Map<String, PendingRetry> pendingRetries = new ConcurrentHashMap<>();

    private final AtomicLong sequenceGenerator = new AtomicLong();

    private final List<Future<?>> activeWorkers = new ArrayList<>();

    private final Object queueLock = new Object();

    public TaskRouter(final DispatcherService dispatcherService,
                      final EvaluationStateMachine stateMachine,
                      final EvaluationValidator evaluationValidator,
                      final SettingsService settingsService,
                      @Qualifier("routerTaskExecutor") final ThreadPoolTaskExecutor taskExecutor,
                      @Qualifier("supervisionScheduler") final ScheduledExecutorService retryScheduler,
                      @Qualifier("dispatchBackoff") final ExponentialBackoff dispatchBackoff) {
        this.dispatcherService = dispatcherService;
        this.stateMachine = stateMachine;
        this.evaluationValidator = evaluationValidator;
        this.settingsService = settingsService;
        this.taskExecutor = taskExecutor;
        this.retryScheduler = retryScheduler;
        this.dispatchBackoff = dispatchBackoff;
    }

    @PostConstruct
    public synchronized void start() {
        if (!activeWorkers.isEmpty()) {
            return;
        }
        final int workers = Math.max(1, settingsService.getRouterWorkers());
        for (int i = 0; i < workers; i++) {
            activeWorkers.add(taskExecutor.submit(new RouterWorker()));
        }
        log.info("Started {} router workers", workers);
    }

    @PreDestroy
    public synchronized void stop() {
        activeWorkers.forEach(worker -> worker.cancel(true));
        activeWorkers.clear();
        pendingRetries.values().forEach(pendingRetry -> pendingRetry.future().cancel(false));
    }

    public SubmissionResult submit(final EvaluationRequest request) {
        final EvaluationTask task;
        try {
            task = evaluationValidator.createTask(request);
        } catch (InvalidEvaluationException e) {
            log.info("Rejecting submission {}: {}", request.evaluationId(), e.getMessage());
            return SubmissionResult.rejected(request.evaluationId(), e.getMessage());
        }
        return submit(task);
    }

    public SubmissionResult submit(final EvaluationTask task) {
        try {
            evaluationValidator.validate(task);
        } catch (InvalidEvaluationException e) {
            log.info("Rejecting submission {}: {}", task.evaluationId(), e.getMessage());
            return SubmissionResult.rejected(task.evaluationId(), e.getMessage());
        }
        if (!stateMachine.register(task)) {
            return SubmissionResult.rejected(task.evaluationId(),
                    "Evaluation " + task.evaluationId() + " already exists");
        }

        evaluationQueue.add(new QueuedTask(task, sequenceGenerator.incrementAndGet(), 0, Instant.now()));
        return SubmissionResult.queued(task.evaluationId(), getPositionInQueue(task.evaluationId()));
    }

    /**
     * Cancels a queued evaluation without involving the dispatcher, or forwards the cancellation of an
     * evaluation that already left the queue.
     */
    public TransitionResult cancel(final String evaluationId) {
        final boolean removed;
        synchronized (queueLock) {
            final boolean removedFromQueue = evaluationQueue.removeIf(queued -> queued.evaluationId().equals(evaluationId));
            final PendingRetry pendingRetry = pendingRetries.remove(evaluationId);
            if (pendingRetry != null) {
                pendingRetry.future().cancel(false);
            }
            removed = removedFromQueue || pendingRetry != null;
        }

        if (removed) {
            log.info("Cancelled queued evaluation {}", evaluationId);
            return stateMachine.transition(evaluationId, EvaluationStatus.CANCELLED, ExitOutcome.cancelled());
        }
        return dispatcherService.cancel(evaluationId);
    }

    /**
     * @return 1-based position in dispatch order, or -1 if the evaluation is not waiting
     */
    public int getPositionInQueue(final String evaluationId) {
        final List<QueuedTask> waiting = new ArrayList<>(evaluationQueue);
        pendingRetries.values().forEach(pendingRetry -> waiting.add(pendingRetry.queuedTask()));
        waiting.sort(DISPATCH_ORDER);

        int positionInQueue = 1;
        for (final QueuedTask queuedTask : waiting) {
            if (queuedTask.evaluationId().equals(evaluationId)) {
                return positionInQueue;
            }
            positionInQueue++;
        }
        return -1;
    }

    public int getQueueSize() {
        return evaluationQueue.size() + pendingRetries.size();
    }

    void route(final QueuedTask queuedTask) {
        final String evaluationId = queuedTask.evaluationId();
        if (stateMachine.isTerminal(evaluationId)) {
            log.debug("Skipping evaluation {}, it is already terminal", evaluationId);
            return;
        }
        if (isQueueSlaExceeded(queuedTask)) {
            failQueueTimeout(queuedTask);
            return;
        }

        final DispatchResult result = dispatcherService.execute(queuedTask.task());
        if (result.accepted()) {
            return;
        }

        if (result.retryable()) {
            scheduleRetry(queuedTask, result);
        } else if (result.reason() != RejectionReason.ALREADY_TERMINAL) {
            log.warn("Evaluation {} rejected by dispatcher: {}", evaluationId, result.message());
            stateMachine.transition(evaluationId, EvaluationStatus.FAILED, ExitOutcome.rejected(result.message()));
        }
    }

    private void scheduleRetry(final QueuedTask queuedTask, final DispatchResult result) {
        final Duration remainingSla = Duration.ofSeconds(settingsService.getQueueSlaSeconds())
                .minus(Duration.between(queuedTask.enqueuedAt(), Instant.now()));
        if (remainingSla.isNegative() || remainingSla.isZero()) {
            failQueueTimeout(queuedTask);
            return;
        }

        final Duration backoff = dispatchBackoff.delayFor(queuedTask.attempt());
        final Duration delay = backoff.compareTo(remainingSla) < 0 ? backoff : remainingSla;
        final QueuedTask retry = queuedTask.nextAttempt();
        log.debug("Evaluation {} not dispatched ({}), retry {} in {} ms", queuedTask.evaluationId(), result.reason(),
                retry.attempt(), delay.toMillis());

        synchronized (queueLock) {
            if (stateMachine.isTerminal(queuedTask.evaluationId())) {
                return;
            }
            final ScheduledFuture<?> future = retryScheduler.schedule(() -> requeue(retry), delay.toMillis(),
                    TimeUnit.MILLISECONDS);
            pendingRetries.put(queuedTask.evaluationId(), new PendingRetry(retry, future));
        }
    }

    private void requeue(final QueuedTask queuedTask) {
        synchronized (queueLock) {
            if (pendingRetries.remove(queuedTask.evaluationId()) == null) {
                return;
            }
            evaluationQueue.add(queuedTask);
        }
    }

    private boolean isQueueSlaExceeded(final QueuedTask queuedTask) {
        final Duration waited = Duration.between(queuedTask.enqueuedAt(), Instant.now());
        return waited.compareTo(Duration.ofSeconds(settingsService.getQueueSlaSeconds())) >= 0;
    }

    private void failQueueTimeout(final QueuedTask queuedTask) {
        final long waitedSeconds = Duration.between(queuedTask.enqueuedAt(), Instant.now()).toSeconds();
        log.warn("Evaluation {} waited {} seconds for capacity, exceeding the queue SLA", queuedTask.evaluationId(),
                waitedSeconds);
        stateMachine.transition(queuedTask.evaluationId(), EvaluationStatus.FAILED,
                ExitOutcome.queueTimeout(waitedSeconds));
    }

    record QueuedTask(EvaluationTask task, long sequence, int attempt, Instant enqueuedAt) {

        String evaluationId() {
            return task.evaluationId();
        }

        QueuedTask nextAttempt() {
            return new QueuedTask(task, sequence, attempt + 1, enqueuedAt);
        }

    }

    private record PendingRetry(QueuedTask queuedTask, ScheduledFuture<?> future) {
    }

    class RouterWorker implements Runnable {

        @Override
        public void run() {
            log.info("Router worker {} started", Thread.currentThread().getName());
            while (!Thread.currentThread().isInterrupted()) {
                final QueuedTask queuedTask;
                try {
                    queuedTask = evaluationQueue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }

                try {
                    route(queuedTask);
                } catch (RuntimeException e) {
                    log.error("Routing evaluation {} failed", queuedTask.evaluationId(), e);
                    stateMachine.transition(queuedTask.evaluationId(), EvaluationStatus.FAILED,
                            ExitOutcome.infrastructure(e.getMessage()));
                }
            }
            log.info("Router worker {} stopped", Thread.currentThread().getName());
        }

    }

}
