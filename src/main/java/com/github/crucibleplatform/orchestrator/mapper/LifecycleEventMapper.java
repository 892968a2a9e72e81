package com.github.crucibleplatform.orchestrator.mapper;

import com.github.crucibleplatform.orchestrator.domain.LifecycleEvent;
import com.github.crucibleplatform.orchestrator.persistence.LifecycleEventEntity;
import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.lang.reflect.Type;
import java.util.Map;

/**
 * @author crucible-platform
 */
@Mapper
public interface LifecycleEventMapper {

    Gson GSON = new Gson();

    Type PAYLOAD_TYPE = new TypeToken<Map<String, String>>() {
    }.getType();

    LifecycleEvent toDomainObject(LifecycleEventEntity lifecycleEventEntity);

    @Mapping(target = "id", ignore = true)
    LifecycleEventEntity toEntity(LifecycleEvent lifecycleEvent);

    default String payloadToJson(final Map<String, String> payload) {
        return payload == null || payload.isEmpty() ? null : GSON.toJson(payload, PAYLOAD_TYPE);
    }

    default Map<String, String> payloadFromJson(final String payload) {
        if (payload == null || payload.isBlank()) {
            return Map.of();
        }
        return GSON.fromJson(payload, PAYLOAD_TYPE);
    }

}
