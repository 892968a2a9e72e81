package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.config.SandboxProperties;
import com.github.crucibleplatform.orchestrator.domain.UnitHandle;
import com.github.crucibleplatform.orchestrator.domain.UnitSignal;
import com.github.crucibleplatform.orchestrator.domain.UnitSignalType;
import com.github.crucibleplatform.orchestrator.domain.UnitSpec;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs evaluations as child processes of the orchestrator. Meant for development; no resource limits are applied.
 *
 * @author crucible-platform
 */
@Service
@ConditionalOnProperty(name = "crucible.sandbox.provider", havingValue = "local")
@Slf4j
public class LocalProcessSandboxProvider implements SandboxProvider {

    static final String PROVIDER_NAME = "local";

    private final SandboxProperties sandboxProperties;

    private final ExecutorService watchExecutorService;

    private final Map<String, LocalUnit> units = new ConcurrentHashMap<>();

    public LocalProcessSandboxProvider(final SandboxProperties sandboxProperties,
                                       @Qualifier("watchExecutor") final ExecutorService watchExecutorService) {
        this.sandboxProperties = sandboxProperties;
        this.watchExecutorService = watchExecutorService;
    }

    @Override
    public String getName() {
        return PROVIDER_NAME;
    }

    @Override
    public UnitHandle createUnit(final UnitSpec unitSpec) throws SandboxProviderException {
        final String unitName = "proc-" + UUID.randomUUID().toString().substring(0, 8);
        final Path output;
        final Process process;
        try {
            output = Files.createTempFile(unitName, ".log");
            final ProcessBuilder processBuilder = new ProcessBuilder(
                    List.of(sandboxProperties.getLocalInterpreter(), "-u", "-c", unitSpec.code()));
            processBuilder.environment().put("EVAL_ID", unitSpec.evaluationId());
            processBuilder.environment().put("PYTHONUNBUFFERED", "1");
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(output.toFile());
            process = processBuilder.start();
        } catch (IOException e) {
            throw new SandboxProviderException("Failed to start process for evaluation " + unitSpec.evaluationId(),
                    e);
        }

        units.put(unitName, new LocalUnit(process, output));
        log.info("Started process {} (pid {}) for evaluation {}", unitName, process.pid(), unitSpec.evaluationId());
        return new UnitHandle(unitSpec.evaluationId(), unitName, PROVIDER_NAME);
    }

    @Override
    public UnitWatch watch(final UnitHandle handle, final UnitSignalListener listener) throws SandboxProviderException {
        final LocalUnit unit = getUnit(handle);
        final AtomicBoolean closed = new AtomicBoolean(false);

        watchExecutorService.execute(() -> {
            if (!closed.get() && unit.process().isAlive()) {
                listener.onSignal(handle, UnitSignal.of(UnitSignalType.STARTED));
            }
        });
        unit.process().onExit().thenAcceptAsync(exited -> {
            if (closed.get()) {
                return;
            }
            final int exitCode = exited.exitValue();
            listener.onSignal(handle, UnitSignal.exitCode(exitCode));
            listener.onSignal(handle, exitCode == 0
                    ? UnitSignal.of(UnitSignalType.SUCCEEDED, "Process succeeded")
                    : UnitSignal.of(UnitSignalType.FAILED, "Process exited with code " + exitCode));
        }, watchExecutorService);

        return () -> closed.set(true);
    }

    @Override
    public void stop(final UnitHandle handle, final Duration gracePeriod) throws SandboxProviderException {
        final LocalUnit unit = units.get(handle.unitName());
        if (unit == null) {
            return;
        }
        unit.process().destroy();
        log.info("Sent termination request to process {}", handle.unitName());
    }

    @Override
    public void terminate(final UnitHandle handle) throws SandboxProviderException {
        final LocalUnit unit = units.get(handle.unitName());
        if (unit == null) {
            return;
        }
        if (unit.process().isAlive()) {
            unit.process().destroyForcibly();
            log.info("Killed process {}", handle.unitName());
        }
    }

    @Override
    public boolean exists(final UnitHandle handle) {
        return units.containsKey(handle.unitName());
    }

    @Override
    public Optional<String> fetchLogs(final UnitHandle handle) throws SandboxProviderException {
        final LocalUnit unit = getUnit(handle);
        try {
            final String content = Files.readString(unit.output(), StandardCharsets.UTF_8);
            if (content.isEmpty() && unit.process().isAlive()) {
                return Optional.empty();
            }
            return Optional.of(content);
        } catch (IOException e) {
            throw new SandboxProviderException("Failed to read output of process " + handle.unitName(), e);
        }
    }

    @PreDestroy
    public void destroyAll() {
        units.forEach((name, unit) -> {
            unit.process().destroyForcibly();
            try {
                Files.deleteIfExists(unit.output());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete output of process " + name, e);
            }
        });
        units.clear();
    }

    private LocalUnit getUnit(final UnitHandle handle) throws UnitNotFoundException {
        final LocalUnit unit = units.get(handle.unitName());
        if (unit == null) {
            throw new UnitNotFoundException("Process " + handle.unitName() + " not found");
        }
        return unit;
    }

    private record LocalUnit(Process process, Path output) {
    }

}
