package com.github.crucibleplatform.orchestrator.config;

import com.github.crucibleplatform.orchestrator.mapper.EvaluationApiMapper;
import com.github.crucibleplatform.orchestrator.mapper.EvaluationApiMapperImpl;
import com.github.crucibleplatform.orchestrator.mapper.EvaluationResultMapper;
import com.github.crucibleplatform.orchestrator.mapper.EvaluationResultMapperImpl;
import com.github.crucibleplatform.orchestrator.mapper.LifecycleEventMapper;
import com.github.crucibleplatform.orchestrator.mapper.LifecycleEventMapperImpl;
import com.github.crucibleplatform.orchestrator.service.CapacityManager;
import com.github.crucibleplatform.orchestrator.service.SandboxProviderException;
import com.github.crucibleplatform.orchestrator.service.SettingsService;
import com.github.crucibleplatform.orchestrator.util.ExponentialBackoff;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * @author crucible-platform
 */
@Configuration
@EnableScheduling
@EnableRetry
@EnableConfigurationProperties(SandboxProperties.class)
public class ApplicationConfig {

    @Bean
    CapacityManager capacityManager(final SettingsService settingsService) {
        return new CapacityManager(settingsService.getMaxConcurrentEvaluations(),
                settingsService.getCapacityMemoryMb(), settingsService.getCapacityCpuMillicores());
    }

    @Bean(name = "routerTaskExecutor")
    ThreadPoolTaskExecutor routerTaskExecutor(final SettingsService settingsService) {
        final int workers = Math.max(1, settingsService.getRouterWorkers());
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("RouterWorker-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "eventDeliveryExecutor")
    ThreadPoolTaskExecutor eventDeliveryExecutor() {
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("EventDelivery-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "supervisionScheduler", destroyMethod = "shutdownNow")
    ScheduledExecutorService supervisionScheduler() {
        return Executors.newScheduledThreadPool(4);
    }

    @Bean(name = "watchExecutor", destroyMethod = "shutdownNow")
    ExecutorService watchExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "watchRetryTemplate")
    RetryTemplate watchRetryTemplate(final SettingsService settingsService) {
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, settingsService.getWatchMaxAttempts()))
                .exponentialBackoff(settingsService.getWatchBackoffMillis(), 2.0,
                        settingsService.getWatchBackoffMillis() * 16)
                .retryOn(SandboxProviderException.class)
                .build();
    }

    @Bean(name = "dispatchBackoff")
    ExponentialBackoff dispatchBackoff(final SettingsService settingsService) {
        return new ExponentialBackoff(Duration.ofMillis(settingsService.getRetryBaseDelayMillis()), 2.0,
                Duration.ofMillis(settingsService.getRetryMaxDelayMillis()));
    }

    @Bean
    LifecycleEventMapper lifecycleEventMapper() {
        return new LifecycleEventMapperImpl();
    }

    @Bean
    EvaluationResultMapper evaluationResultMapper() {
        return new EvaluationResultMapperImpl();
    }

    @Bean
    EvaluationApiMapper evaluationApiMapper() {
        return new EvaluationApiMapperImpl();
    }

}
