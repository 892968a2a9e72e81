package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.RiskLevel;
import com.github.crucibleplatform.orchestrator.persistence.SettingsEntity;
import com.github.crucibleplatform.orchestrator.persistence.SettingsRepository;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Runtime tunable settings. Values stored in the settings table win over the environment defaults.
 *
 * @author crucible-platform
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsService {

    private static final String KEY_MAX_CONCURRENT_EVALUATIONS = "maxConcurrentEvaluations";

    private static final String KEY_DEFAULT_TIMEOUT_SECONDS = "defaultTimeoutSeconds";

    private static final String KEY_MAX_TIMEOUT_SECONDS = "maxTimeoutSeconds";

    private static final String KEY_DEFAULT_MEMORY = "defaultMemory";

    private static final String KEY_MAX_MEMORY = "maxMemory";

    private static final String KEY_DEFAULT_CPU = "defaultCpu";

    private static final String KEY_MAX_CPU = "maxCpu";

    private static final String KEY_MAX_CODE_SIZE_BYTES = "maxCodeSizeBytes";

    private static final String KEY_QUEUE_SLA_SECONDS = "queueSlaSeconds";

    private static final String KEY_GRACE_PERIOD_PREFIX = "gracePeriodSeconds.";

    private final SettingsRepository settingsRepository;

    @Value("${CRUCIBLE_MAX_CONCURRENT_EVALUATIONS:10}")
    private int defaultMaxConcurrentEvaluations = 10;

    @Getter
    @Value("${CRUCIBLE_CAPACITY_MEMORY_MB:0}")
    private long capacityMemoryMb = 0;

    @Getter
    @Value("${CRUCIBLE_CAPACITY_CPU_MILLICORES:0}")
    private long capacityCpuMillicores = 0;

    @Value("${CRUCIBLE_DEFAULT_TIMEOUT_SECONDS:300}")
    private int defaultTimeoutSeconds = 300;

    @Value("${CRUCIBLE_MAX_TIMEOUT_SECONDS:600}")
    private int defaultMaxTimeoutSeconds = 600;

    @Value("${CRUCIBLE_DEFAULT_MEMORY:128Mi}")
    private String defaultMemory = "128Mi";

    @Value("${CRUCIBLE_MAX_MEMORY:512Mi}")
    private String defaultMaxMemory = "512Mi";

    @Value("${CRUCIBLE_DEFAULT_CPU:100m}")
    private String defaultCpu = "100m";

    @Value("${CRUCIBLE_MAX_CPU:500m}")
    private String defaultMaxCpu = "500m";

    @Value("${CRUCIBLE_MAX_CODE_SIZE_BYTES:1048576}")
    private int defaultMaxCodeSizeBytes = 1_048_576;

    @Value("${CRUCIBLE_QUEUE_SLA_SECONDS:900}")
    private int defaultQueueSlaSeconds = 900;

    @Value("${CRUCIBLE_GRACE_PERIOD_TRUSTED_SECONDS:30}")
    private int trustedGracePeriodSeconds = 30;

    @Value("${CRUCIBLE_GRACE_PERIOD_STANDARD_SECONDS:5}")
    private int standardGracePeriodSeconds = 5;

    @Value("${CRUCIBLE_GRACE_PERIOD_UNTRUSTED_SECONDS:1}")
    private int untrustedGracePeriodSeconds = 1;

    @Getter
    @Value("${CRUCIBLE_EXIT_CODE_JOIN_MILLIS:2000}")
    private long exitCodeJoinMillis = 2000;

    @Getter
    @Value("${CRUCIBLE_WATCH_MAX_ATTEMPTS:5}")
    private int watchMaxAttempts = 5;

    @Getter
    @Value("${CRUCIBLE_WATCH_BACKOFF_MILLIS:1000}")
    private long watchBackoffMillis = 1000;

    @Getter
    @Value("${CRUCIBLE_RETRY_BASE_DELAY_MILLIS:2000}")
    private long retryBaseDelayMillis = 2000;

    @Getter
    @Value("${CRUCIBLE_RETRY_MAX_DELAY_MILLIS:300000}")
    private long retryMaxDelayMillis = 300_000;

    @Getter
    @Value("${CRUCIBLE_ROUTER_WORKERS:4}")
    private int routerWorkers = 4;

    @Getter
    @Value("${CRUCIBLE_STALE_SLOT_MARGIN_SECONDS:60}")
    private int staleSlotMarginSeconds = 60;

    /** How long the unit of a finished evaluation stays known for log retrieval. */
    @Getter
    @Value("${CRUCIBLE_UNIT_RETENTION_SECONDS:300}")
    private int unitRetentionSeconds = 300;

    public int getMaxConcurrentEvaluations() {
        return getIntSetting(KEY_MAX_CONCURRENT_EVALUATIONS, defaultMaxConcurrentEvaluations);
    }

    public void setMaxConcurrentEvaluations(final int maxConcurrentEvaluations) {
        setSetting(KEY_MAX_CONCURRENT_EVALUATIONS, String.valueOf(maxConcurrentEvaluations));
    }

    public int getDefaultTimeoutSeconds() {
        return getIntSetting(KEY_DEFAULT_TIMEOUT_SECONDS, defaultTimeoutSeconds);
    }

    public int getMaxTimeoutSeconds() {
        return getIntSetting(KEY_MAX_TIMEOUT_SECONDS, defaultMaxTimeoutSeconds);
    }

    public String getDefaultMemory() {
        return getSetting(KEY_DEFAULT_MEMORY).orElse(defaultMemory);
    }

    public String getMaxMemory() {
        return getSetting(KEY_MAX_MEMORY).orElse(defaultMaxMemory);
    }

    public String getDefaultCpu() {
        return getSetting(KEY_DEFAULT_CPU).orElse(defaultCpu);
    }

    public String getMaxCpu() {
        return getSetting(KEY_MAX_CPU).orElse(defaultMaxCpu);
    }

    public int getMaxCodeSizeBytes() {
        return getIntSetting(KEY_MAX_CODE_SIZE_BYTES, defaultMaxCodeSizeBytes);
    }

    public int getQueueSlaSeconds() {
        return getIntSetting(KEY_QUEUE_SLA_SECONDS, defaultQueueSlaSeconds);
    }

    public Duration getGracePeriod(final RiskLevel riskLevel) {
        final int fallback = switch (riskLevel) {
            case TRUSTED -> trustedGracePeriodSeconds;
            case STANDARD -> standardGracePeriodSeconds;
            case UNTRUSTED -> untrustedGracePeriodSeconds;
        };
        return Duration.ofSeconds(getIntSetting(KEY_GRACE_PERIOD_PREFIX + riskLevel.name(), fallback));
    }

    public Optional<String> getSetting(final String key) {
        return Optional.ofNullable(settingsRepository.findBySettingsKey(key)).map(SettingsEntity::getSettingsValue);
    }

    public void setSetting(final String key, final String value) {
        SettingsEntity settingsEntity = settingsRepository.findBySettingsKey(key);
        if (settingsEntity == null) {
            settingsEntity = new SettingsEntity();
            settingsEntity.setSettingsKey(key);
        }
        settingsEntity.setSettingsValue(value);
        settingsRepository.save(settingsEntity);
    }

    private int getIntSetting(final String key, final int fallback) {
        final Optional<String> value = getSetting(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.get().trim());
        } catch (NumberFormatException e) {
            log.error("Failed to parse setting {}='{}'. Using default value {}.", key, value.get(), fallback, e);
            return fallback;
        }
    }

}
