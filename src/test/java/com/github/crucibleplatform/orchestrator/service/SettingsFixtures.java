package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.persistence.SettingsRepository;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.test.util.ReflectionTestUtils;

import static org.mockito.Mockito.mock;

/**
 * Settings backed by an empty settings table, so every value falls back to its default.
 *
 * @author crucible-platform
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class SettingsFixtures {

    public static SettingsService defaults() {
        return new SettingsService(mock(SettingsRepository.class));
    }

    /**
     * Overrides one of the environment defaults, e.g. {@code exitCodeJoinMillis}.
     */
    public static SettingsService with(final SettingsService settingsService, final String field, final Object value) {
        ReflectionTestUtils.setField(settingsService, field, value);
        return settingsService;
    }

}
