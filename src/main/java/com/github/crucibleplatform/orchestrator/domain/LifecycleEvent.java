package com.github.crucibleplatform.orchestrator.domain;

import java.time.ZonedDateTime;
import java.util.Map;

/**
 * @author crucible-platform
 */
public record LifecycleEvent(String evaluationId,
                             LifecycleEventType eventType,
                             ZonedDateTime timestamp,
                             long sequenceHint,
                             Map<String, String> payload) {

    public static final String PAYLOAD_EXIT_CODE = "exitCode";

    public static final String PAYLOAD_EXIT_CODE_KNOWN = "exitCodeKnown";

    public static final String PAYLOAD_REASON = "reason";

    public static final String PAYLOAD_MESSAGE = "message";

    public static final String PAYLOAD_UNIT_REFERENCE = "unitReference";

    public LifecycleEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public String topic() {
        return eventType.topic();
    }

}
