package com.github.crucibleplatform.orchestrator.api;

import com.github.crucibleplatform.orchestrator.domain.EvaluationState;
import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;
import com.github.crucibleplatform.orchestrator.event.LifecycleEventBus;
import com.github.crucibleplatform.orchestrator.event.LifecycleEventListener;
import com.github.crucibleplatform.orchestrator.event.Subscription;
import com.github.crucibleplatform.orchestrator.mapper.EvaluationApiMapper;
import com.github.crucibleplatform.orchestrator.service.EvaluationStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-sent lifecycle events, per evaluation or for all evaluations.
 *
 * @author crucible-platform
 */
@RestController
@RequestMapping("/events")
@Slf4j
public class LiveStatusController {

    static final String STATE_EVENT_NAME = "state";

    private final LifecycleEventBus lifecycleEventBus;

    private final EvaluationStateMachine stateMachine;

    private final EvaluationApiMapper evaluationApiMapper;

    private final long emitterTimeoutMillis;

    public LiveStatusController(final LifecycleEventBus lifecycleEventBus,
                                final EvaluationStateMachine stateMachine,
                                final EvaluationApiMapper evaluationApiMapper,
                                @Value("${CRUCIBLE_SSE_TIMEOUT_MILLIS:1800000}") final long emitterTimeoutMillis) {
        this.lifecycleEventBus = lifecycleEventBus;
        this.stateMachine = stateMachine;
        this.evaluationApiMapper = evaluationApiMapper;
        this.emitterTimeoutMillis = emitterTimeoutMillis;
    }

    @RequestMapping(method = RequestMethod.GET, produces = "text/event-stream")
    public SseEmitter streamAll() {
        final SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        final AtomicReference<Subscription> subscription = new AtomicReference<>();
        subscription.set(lifecycleEventBus.subscribeToAll(event -> send(emitter, event, subscription.get())));
        registerCleanup(emitter, subscription);
        return emitter;
    }

    /**
     * Sends the current state first, then every following lifecycle event. Completes after the terminal event.
     */
    @RequestMapping(value = "/{evaluation_id}", method = RequestMethod.GET, produces = "text/event-stream")
    public SseEmitter streamEvaluation(@PathVariable("evaluation_id") final String evaluationId) throws IOException {
        final EvaluationState current = stateMachine.get(evaluationId)
                .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
        final SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        if (current.status().isFinal()) {
            sendState(emitter, current);
            emitter.complete();
            return emitter;
        }

        final AtomicReference<Subscription> subscription = new AtomicReference<>();
        final EvaluationStream stream = new EvaluationStream(emitter, subscription);
        subscription.set(lifecycleEventBus.subscribeToEvaluation(evaluationId, stream));
        registerCleanup(emitter, subscription);

        final EvaluationState state = stateMachine.get(evaluationId)
                .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
        stream.open(state);
        return emitter;
    }

    private void sendState(final SseEmitter emitter, final EvaluationState state) throws IOException {
        emitter.send(SseEmitter.event()
                .name(STATE_EVENT_NAME)
                .id(String.valueOf(state.version()))
                .data(evaluationApiMapper.toStatusResponse(state)));
    }

    private void send(final SseEmitter emitter, final LifecycleEvent event, final Subscription subscription) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.topic())
                    .id(String.valueOf(event.sequenceHint()))
                    .data(event));
        } catch (IOException | IllegalStateException e) {
            log.debug("Live status client went away: {}", e.getMessage());
            if (subscription != null) {
                subscription.cancel();
            }
            emitter.completeWithError(e);
        }
    }

    private void registerCleanup(final SseEmitter emitter, final AtomicReference<Subscription> subscription) {
        final Runnable cancel = () -> {
            final Subscription current = subscription.get();
            if (current != null) {
                current.cancel();
            }
        };
        emitter.onCompletion(cancel);
        emitter.onTimeout(cancel);
        emitter.onError(error -> cancel.run());
    }

    /**
     * Holds back events until the snapshot is sent, then forwards those newer than the snapshot.
     */
    private final class EvaluationStream implements LifecycleEventListener {

        private final SseEmitter emitter;

        private final AtomicReference<Subscription> subscription;

        private final List<LifecycleEvent> pending = new ArrayList<>();

        private long snapshotVersion;

        private boolean opened;

        private boolean completed;

        EvaluationStream(final SseEmitter emitter, final AtomicReference<Subscription> subscription) {
            this.emitter = emitter;
            this.subscription = subscription;
        }

        @Override
        public synchronized void onEvent(final LifecycleEvent event) {
            if (!opened) {
                pending.add(event);
                return;
            }
            forward(event);
        }

        synchronized void open(final EvaluationState state) throws IOException {
            snapshotVersion = state.version();
            opened = true;
            sendState(emitter, state);
            if (state.status().isFinal()) {
                complete();
                return;
            }
            pending.forEach(this::forward);
            pending.clear();
        }

        private void forward(final LifecycleEvent event) {
            // events up to the snapshot's version are already contained in it
            if (completed || event.sequenceHint() <= snapshotVersion) {
                return;
            }
            send(emitter, event, subscription.get());
            if (event.eventType().isTerminal()) {
                complete();
            }
        }

        private void complete() {
            completed = true;
            final Subscription current = subscription.get();
            if (current != null) {
                current.cancel();
            }
            emitter.complete();
        }

    }

}
