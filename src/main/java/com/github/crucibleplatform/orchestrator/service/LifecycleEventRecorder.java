package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;
import com.github.crucibleplatform.orchestrator.event.LifecycleEventBus;
import com.github.crucibleplatform.orchestrator.event.Subscription;
import com.github.crucibleplatform.orchestrator.mapper.LifecycleEventMapper;
import com.github.crucibleplatform.orchestrator.persistence.LifecycleEventRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Journal of lifecycle events. Stores each event type at most once per evaluation, so redelivered events do not
 * create duplicate rows.
 *
 * @author crucible-platform
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecycleEventRecorder {

    private final LifecycleEventBus lifecycleEventBus;

    private final LifecycleEventRepository lifecycleEventRepository;

    private final LifecycleEventMapper lifecycleEventMapper;

    private Subscription subscription;

    @PostConstruct
    public void subscribe() {
        subscription = lifecycleEventBus.subscribeToAll(this::record);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.cancel();
        }
    }

    void record(final LifecycleEvent event) {
        if (lifecycleEventRepository.existsByEvaluationIdAndEventType(event.evaluationId(), event.eventType())) {
            log.debug("Event {} of evaluation {} already recorded", event.topic(), event.evaluationId());
            return;
        }
        try {
            lifecycleEventRepository.save(lifecycleEventMapper.toEntity(event));
        } catch (DataIntegrityViolationException e) {
            log.debug("Event {} of evaluation {} recorded concurrently", event.topic(), event.evaluationId());
        }
    }

    public List<LifecycleEvent> findEvents(final String evaluationId) {
        return lifecycleEventRepository.findByEvaluationIdOrderBySequenceHintAsc(evaluationId)
                .stream()
                .map(lifecycleEventMapper::toDomainObject)
                .toList();
    }

}
