package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;
import com.github.crucibleplatform.orchestrator.domain.LifecycleEventType;
import com.github.crucibleplatform.orchestrator.event.InMemoryLifecycleEventBus;
import com.github.crucibleplatform.orchestrator.mapper.LifecycleEventMapperImpl;
import com.github.crucibleplatform.orchestrator.persistence.LifecycleEventEntity;
import com.github.crucibleplatform.orchestrator.persistence.LifecycleEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author crucible-platform
 */
@ExtendWith(MockitoExtension.class)
class LifecycleEventRecorderTest {

    @Mock
    LifecycleEventRepository lifecycleEventRepository;

    InMemoryLifecycleEventBus eventBus;

    LifecycleEventRecorder lifecycleEventRecorder;

    @BeforeEach
    void setUp() {
        eventBus = new InMemoryLifecycleEventBus(Runnable::run, 3);
        lifecycleEventRecorder = new LifecycleEventRecorder(eventBus, lifecycleEventRepository,
                new LifecycleEventMapperImpl());
        lifecycleEventRecorder.subscribe();
    }

    @Test
    void publishedEvent_isStoredWithPayload() {
        // given
        when(lifecycleEventRepository.existsByEvaluationIdAndEventType("eval-1", LifecycleEventType.COMPLETED))
                .thenReturn(false);

        // when
        eventBus.publish(new LifecycleEvent("eval-1", LifecycleEventType.COMPLETED, ZonedDateTime.now(), 4,
                Map.of(LifecycleEvent.PAYLOAD_EXIT_CODE, "0")));

        // then
        final ArgumentCaptor<LifecycleEventEntity> captor = ArgumentCaptor.forClass(LifecycleEventEntity.class);
        verify(lifecycleEventRepository).save(captor.capture());
        assertThat(captor.getValue().getEvaluationId()).isEqualTo("eval-1");
        assertThat(captor.getValue().getSequenceHint()).isEqualTo(4);
        assertThat(captor.getValue().getPayload()).contains("\"exitCode\":\"0\"");
    }

    @Test
    void redeliveredEvent_isStoredOnlyOnce() {
        // given
        when(lifecycleEventRepository.existsByEvaluationIdAndEventType("eval-1", LifecycleEventType.QUEUED))
                .thenReturn(true);

        // when
        eventBus.publish(new LifecycleEvent("eval-1", LifecycleEventType.QUEUED, ZonedDateTime.now(), 1, Map.of()));

        // then
        verify(lifecycleEventRepository, never()).save(any());
    }

    @Test
    void concurrentlyRecordedEvent_isNotAnError() {
        // given
        when(lifecycleEventRepository.existsByEvaluationIdAndEventType("eval-1", LifecycleEventType.QUEUED))
                .thenReturn(false);
        when(lifecycleEventRepository.save(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        // when / then
        assertThatCode(() -> lifecycleEventRecorder.record(
                new LifecycleEvent("eval-1", LifecycleEventType.QUEUED, ZonedDateTime.now(), 1, Map.of())))
                .doesNotThrowAnyException();
    }

    @Test
    void findEvents_mapsJournalBackToEvents() {
        // given
        when(lifecycleEventRepository.findByEvaluationIdOrderBySequenceHintAsc("eval-1")).thenReturn(List.of(
                new LifecycleEventEntity(1L, "eval-1", LifecycleEventType.QUEUED, ZonedDateTime.now(), 1, null),
                new LifecycleEventEntity(2L, "eval-1", LifecycleEventType.FAILED, ZonedDateTime.now(), 3,
                        "{\"reason\":\"INFRASTRUCTURE\"}")));

        // when
        final List<LifecycleEvent> events = lifecycleEventRecorder.findEvents("eval-1");

        // then
        assertThat(events).extracting(LifecycleEvent::eventType)
                .containsExactly(LifecycleEventType.QUEUED, LifecycleEventType.FAILED);
        assertThat(events.get(0).payload()).isEmpty();
        assertThat(events.get(1).payload()).containsEntry(LifecycleEvent.PAYLOAD_REASON, "INFRASTRUCTURE");
    }

}
