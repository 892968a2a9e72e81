package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.UnitHandle;
import com.github.crucibleplatform.orchestrator.domain.UnitSignal;
import com.github.crucibleplatform.orchestrator.domain.UnitSpec;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Scriptable in-memory sandbox. Tests drive units by emitting signals through {@link #emit(String, UnitSignal)}.
 *
 * @author crucible-platform
 */
public class FakeSandboxProvider implements SandboxProvider {

    public static final String PROVIDER_NAME = "fake";

    private final Map<String, UnitSpec> createdUnits = new ConcurrentHashMap<>();

    private final Map<String, UnitSignalListener> listeners = new ConcurrentHashMap<>();

    private final Map<String, UnitHandle> handles = new ConcurrentHashMap<>();

    private final Map<String, String> logs = new ConcurrentHashMap<>();

    private final Set<String> stoppedUnits = ConcurrentHashMap.newKeySet();

    private final List<String> terminatedUnits = new CopyOnWriteArrayList<>();

    private final Queue<SandboxProviderException> createFailures = new ArrayDeque<>();

    private final AtomicInteger createCalls = new AtomicInteger();

    private final AtomicInteger watchCalls = new AtomicInteger();

    private volatile int failingWatches;

    private volatile Consumer<UnitSpec> onCreate = unitSpec -> {
    };

    @Override
    public String getName() {
        return PROVIDER_NAME;
    }

    @Override
    public UnitHandle createUnit(final UnitSpec unitSpec) throws SandboxProviderException {
        createCalls.incrementAndGet();
        synchronized (createFailures) {
            final SandboxProviderException failure = createFailures.poll();
            if (failure != null) {
                throw failure;
            }
        }
        final UnitHandle handle = new UnitHandle(unitSpec.evaluationId(), "unit-" + unitSpec.evaluationId(),
                PROVIDER_NAME);
        createdUnits.put(unitSpec.evaluationId(), unitSpec);
        handles.put(unitSpec.evaluationId(), handle);
        onCreate.accept(unitSpec);
        return handle;
    }

    @Override
    public UnitWatch watch(final UnitHandle handle, final UnitSignalListener listener) throws SandboxProviderException {
        watchCalls.incrementAndGet();
        if (failingWatches > 0) {
            failingWatches--;
            throw new SandboxProviderException("watch refused for " + handle.unitName());
        }
        listeners.put(handle.evaluationId(), listener);
        return () -> listeners.remove(handle.evaluationId(), listener);
    }

    @Override
    public void stop(final UnitHandle handle, final Duration gracePeriod) {
        stoppedUnits.add(handle.unitName());
    }

    @Override
    public void terminate(final UnitHandle handle) {
        terminatedUnits.add(handle.unitName());
    }

    @Override
    public boolean exists(final UnitHandle handle) {
        return handles.containsKey(handle.evaluationId()) && !terminatedUnits.contains(handle.unitName());
    }

    @Override
    public Optional<String> fetchLogs(final UnitHandle handle) throws SandboxProviderException {
        if (terminatedUnits.contains(handle.unitName())) {
            throw new UnitNotFoundException("unit " + handle.unitName() + " removed");
        }
        return Optional.ofNullable(logs.get(handle.evaluationId()));
    }

    public void emit(final String evaluationId, final UnitSignal signal) {
        final UnitSignalListener listener = listeners.get(evaluationId);
        if (listener == null) {
            throw new IllegalStateException("No watch open for evaluation " + evaluationId);
        }
        listener.onSignal(handles.get(evaluationId), signal);
    }

    public void failNextCreate(final SandboxProviderException failure) {
        synchronized (createFailures) {
            createFailures.add(failure);
        }
    }

    public void onCreate(final Consumer<UnitSpec> onCreate) {
        this.onCreate = onCreate;
    }

    public void failNextWatches(final int count) {
        failingWatches = count;
    }

    public void putLogs(final String evaluationId, final String content) {
        logs.put(evaluationId, content);
    }

    public boolean isWatched(final String evaluationId) {
        return listeners.containsKey(evaluationId);
    }

    public Optional<UnitSpec> getCreatedUnit(final String evaluationId) {
        return Optional.ofNullable(createdUnits.get(evaluationId));
    }

    public boolean isStopped(final String evaluationId) {
        return stoppedUnits.contains("unit-" + evaluationId);
    }

    public long getTerminationCount(final String evaluationId) {
        return terminatedUnits.stream().filter(name -> name.equals("unit-" + evaluationId)).count();
    }

    public int getCreateCalls() {
        return createCalls.get();
    }

    public int getWatchCalls() {
        return watchCalls.get();
    }

}
