package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.CapacityStatus;
import com.github.crucibleplatform.orchestrator.domain.ClaimResult;
import com.github.crucibleplatform.orchestrator.domain.ExecutionSlot;
import com.github.crucibleplatform.orchestrator.domain.ReleaseResult;
import com.github.crucibleplatform.orchestrator.domain.ResourceRequirements;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded pool of execution slots with an optional memory and cpu budget. All admission decisions go through a
 * single compare-and-set on an immutable {@link Pool} value, so concurrent claims can never over-admit.
 *
 * @author crucible-platform
 */
@Slf4j
public class CapacityManager {

    private final AtomicReference<Pool> pool;

    private final Map<String, ExecutionSlot> activeSlots = new ConcurrentHashMap<>();

    private final AtomicLong doubleReleases = new AtomicLong();

    private final Clock clock;

    public CapacityManager(final int capacity, final long memoryBudgetMb, final long cpuBudgetMillicores) {
        this(capacity, memoryBudgetMb, cpuBudgetMillicores, Clock.systemUTC());
    }

    public CapacityManager(final int capacity, final long memoryBudgetMb, final long cpuBudgetMillicores,
                           final Clock clock) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        this.pool = new AtomicReference<>(new Pool(capacity, 0, memoryBudgetMb, 0, cpuBudgetMillicores, 0));
        this.clock = clock;
    }

    public ClaimResult tryClaim(final String evaluationId, final ResourceRequirements requirements) {
        while (true) {
            final Pool current = pool.get();
            if (!current.fits(requirements)) {
                log.debug("Capacity exceeded for evaluation {} ({} of {} slots in use)", evaluationId,
                        current.usedSlots(), current.capacity());
                return ClaimResult.capacityExceeded();
            }
            if (pool.compareAndSet(current, current.claim(requirements))) {
                break;
            }
        }

        final ExecutionSlot slot = new ExecutionSlot(evaluationId, requirements, clock.instant());
        final ExecutionSlot existing = activeSlots.putIfAbsent(evaluationId, slot);
        if (existing != null) {
            pool.updateAndGet(current -> current.release(requirements));
            log.warn("Evaluation {} already holds a slot, refusing second claim", evaluationId);
            return ClaimResult.capacityExceeded();
        }

        log.debug("Claimed slot for evaluation {}", evaluationId);
        return ClaimResult.claimed(slot);
    }

    public ReleaseResult release(final ExecutionSlot slot) {
        if (!slot.markReleased()) {
            final long count = doubleReleases.incrementAndGet();
            log.warn("Double release of slot for evaluation {} ignored (total double releases: {})",
                    slot.getEvaluationId(), count);
            return ReleaseResult.ALREADY_RELEASED;
        }

        activeSlots.remove(slot.getEvaluationId(), slot);
        pool.updateAndGet(current -> current.release(slot.getResourceRequirements()));
        log.debug("Released slot for evaluation {}", slot.getEvaluationId());
        return ReleaseResult.RELEASED;
    }

    /**
     * Changes the number of slots. Shrinking below the number of claimed slots only blocks new claims until
     * enough slots have been released.
     */
    public void resize(final int newCapacity) {
        if (newCapacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + newCapacity);
        }
        final Pool updated = pool.updateAndGet(current -> current.withCapacity(newCapacity));
        log.info("Capacity resized to {} slots ({} in use)", updated.capacity(), updated.usedSlots());
    }

    public Optional<ExecutionSlot> findSlot(final String evaluationId) {
        return Optional.ofNullable(activeSlots.get(evaluationId));
    }

    public Map<String, ExecutionSlot> getActiveSlots() {
        return Collections.unmodifiableMap(activeSlots);
    }

    public long getDoubleReleaseCount() {
        return doubleReleases.get();
    }

    public CapacityStatus snapshot() {
        final Pool current = pool.get();
        return new CapacityStatus(current.capacity(), Math.max(0, current.capacity() - current.usedSlots()),
                current.usedSlots(), current.freeMemoryMb(), current.freeCpuMillicores(), doubleReleases.get());
    }

    /**
     * Budgets of zero or less are not enforced.
     */
    private record Pool(int capacity, int usedSlots, long memoryBudgetMb, long usedMemoryMb,
                        long cpuBudgetMillicores, long usedCpuMillicores) {

        boolean fits(final ResourceRequirements requirements) {
            if (usedSlots >= capacity) {
                return false;
            }
            if (memoryBudgetMb > 0 && usedMemoryMb + requirements.memoryMb() > memoryBudgetMb) {
                return false;
            }
            return cpuBudgetMillicores <= 0 || usedCpuMillicores + requirements.cpuMillicores() <= cpuBudgetMillicores;
        }

        Pool claim(final ResourceRequirements requirements) {
            return new Pool(capacity, usedSlots + 1, memoryBudgetMb, usedMemoryMb + requirements.memoryMb(),
                    cpuBudgetMillicores, usedCpuMillicores + requirements.cpuMillicores());
        }

        Pool release(final ResourceRequirements requirements) {
            return new Pool(capacity, Math.max(0, usedSlots - 1), memoryBudgetMb,
                    Math.max(0, usedMemoryMb - requirements.memoryMb()), cpuBudgetMillicores,
                    Math.max(0, usedCpuMillicores - requirements.cpuMillicores()));
        }

        Pool withCapacity(final int newCapacity) {
            return new Pool(newCapacity, usedSlots, memoryBudgetMb, usedMemoryMb, cpuBudgetMillicores,
                    usedCpuMillicores);
        }

        long freeMemoryMb() {
            return memoryBudgetMb > 0 ? memoryBudgetMb - usedMemoryMb : -1;
        }

        long freeCpuMillicores() {
            return cpuBudgetMillicores > 0 ? cpuBudgetMillicores - usedCpuMillicores : -1;
        }

    }

}
