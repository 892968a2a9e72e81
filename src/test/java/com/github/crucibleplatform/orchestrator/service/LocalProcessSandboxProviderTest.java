package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.config.SandboxProperties;
import com.github.crucibleplatform.orchestrator.domain.ResourceRequirements;
import com.github.crucibleplatform.orchestrator.domain.UnitHandle;
import com.github.crucibleplatform.orchestrator.domain.UnitSignal;
import com.github.crucibleplatform.orchestrator.domain.UnitSignalType;
import com.github.crucibleplatform.orchestrator.domain.UnitSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Uses {@code sh} as interpreter, which accepts the same {@code -u -c} arguments as python.
 *
 * @author crucible-platform
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class LocalProcessSandboxProviderTest {

    ExecutorService watchExecutorService;

    LocalProcessSandboxProvider provider;

    @BeforeEach
    void setUp() {
        final SandboxProperties sandboxProperties = new SandboxProperties();
        sandboxProperties.setLocalInterpreter("sh");
        watchExecutorService = Executors.newCachedThreadPool();
        provider = new LocalProcessSandboxProvider(sandboxProperties, watchExecutorService);
    }

    @AfterEach
    void tearDown() {
        provider.destroyAll();
        watchExecutorService.shutdownNow();
    }

    @Test
    void finishedProcess_reportsExitCodeAndOutput() throws SandboxProviderException {
        // given
        final UnitHandle handle = provider.createUnit(unitSpec("echo \"hello $EVAL_ID\"; exit 3"));
        final List<UnitSignal> signals = new CopyOnWriteArrayList<>();

        // when
        provider.watch(handle, (unitHandle, signal) -> signals.add(signal));

        // then
        await().atMost(Duration.ofSeconds(10)).until(() -> signals.stream()
                .anyMatch(signal -> signal.type() == UnitSignalType.FAILED));
        assertThat(signals).contains(UnitSignal.exitCode(3));
        assertThat(provider.fetchLogs(handle)).contains("hello eval-1\n");
        assertThat(handle.reference()).startsWith("local://proc-");
    }

    @Test
    void successfulProcess_reportsSuccess() throws SandboxProviderException {
        // given
        final UnitHandle handle = provider.createUnit(unitSpec("true"));
        final List<UnitSignal> signals = new CopyOnWriteArrayList<>();

        // when
        provider.watch(handle, (unitHandle, signal) -> signals.add(signal));

        // then
        await().atMost(Duration.ofSeconds(10)).until(() -> signals.stream()
                .anyMatch(signal -> signal.type() == UnitSignalType.SUCCEEDED));
        assertThat(signals).contains(UnitSignal.exitCode(0));
    }

    @Test
    void terminate_killsRunningProcess() throws SandboxProviderException {
        // given
        final UnitHandle handle = provider.createUnit(unitSpec("sleep 30"));
        final List<UnitSignal> signals = new CopyOnWriteArrayList<>();
        provider.watch(handle, (unitHandle, signal) -> signals.add(signal));

        // when
        provider.terminate(handle);

        // then
        await().atMost(Duration.ofSeconds(10)).until(() -> signals.stream()
                .anyMatch(signal -> signal.type() == UnitSignalType.EXIT_CODE));
        assertThat(provider.exists(handle)).isTrue();
    }

    @Test
    void unknownUnit_isNotFound() {
        final UnitHandle handle = new UnitHandle("eval-1", "proc-missing", LocalProcessSandboxProvider.PROVIDER_NAME);

        assertThatThrownBy(() -> provider.fetchLogs(handle)).isInstanceOf(UnitNotFoundException.class);
    }

    private UnitSpec unitSpec(final String code) {
        return new UnitSpec("eval-1", code, new ResourceRequirements(128, 100, 30), 1,
                "test-normal-priority-evaluation", "executor-base:latest");
    }

}
