package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.ClaimResult;
import com.github.crucibleplatform.orchestrator.domain.ExecutionSlot;
import com.github.crucibleplatform.orchestrator.domain.ReleaseResult;
import com.github.crucibleplatform.orchestrator.domain.ResourceRequirements;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author crucible-platform
 */
class CapacityManagerTest {

    static final ResourceRequirements SMALL = new ResourceRequirements(128, 100, 30);

    @Test
    void tryClaim_concurrentClaimsNeverExceedCapacity() throws Exception {
        // given
        final int capacity = 5;
        final int claimants = 200;
        final CapacityManager capacityManager = new CapacityManager(capacity, 0, 0);
        final ExecutorService executorService = Executors.newFixedThreadPool(16);
        final CountDownLatch go = new CountDownLatch(1);
        final List<Future<ClaimResult>> claims = new ArrayList<>();

        // when
        for (int i = 0; i < claimants; i++) {
            final String evaluationId = "eval-" + i;
            claims.add(executorService.submit(() -> {
                go.await();
                return capacityManager.tryClaim(evaluationId, SMALL);
            }));
        }
        go.countDown();
        int granted = 0;
        for (final Future<ClaimResult> claim : claims) {
            if (claim.get(5, TimeUnit.SECONDS).isClaimed()) {
                granted++;
            }
        }
        executorService.shutdown();

        // then
        assertThat(granted).isEqualTo(capacity);
        assertThat(capacityManager.snapshot().freeSlots()).isZero();
        assertThat(capacityManager.getActiveSlots()).hasSize(capacity);
    }

    @Test
    void tryClaim_concurrentClaimAndReleaseKeepsAccountingConsistent() throws Exception {
        // given
        final CapacityManager capacityManager = new CapacityManager(3, 0, 0);
        final ExecutorService executorService = Executors.newFixedThreadPool(8);
        final List<Future<?>> workers = new ArrayList<>();

        // when
        for (int worker = 0; worker < 8; worker++) {
            final int workerId = worker;
            workers.add(executorService.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    final ClaimResult claim = capacityManager.tryClaim("eval-" + workerId + "-" + i, SMALL);
                    if (claim.isClaimed()) {
                        assertThat(capacityManager.snapshot().activeSlots()).isLessThanOrEqualTo(3);
                        capacityManager.release(claim.slot());
                    }
                }
            }));
        }
        for (final Future<?> worker : workers) {
            worker.get(10, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        // then
        assertThat(capacityManager.snapshot().freeSlots()).isEqualTo(3);
        assertThat(capacityManager.getActiveSlots()).isEmpty();
        assertThat(capacityManager.getDoubleReleaseCount()).isZero();
    }

    @Test
    void release_isIdempotent() {
        // given
        final CapacityManager capacityManager = new CapacityManager(1, 0, 0);
        final ExecutionSlot slot = capacityManager.tryClaim("eval-1", SMALL).slot();

        // when
        final ReleaseResult first = capacityManager.release(slot);
        final ReleaseResult second = capacityManager.release(slot);

        // then
        assertThat(first).isEqualTo(ReleaseResult.RELEASED);
        assertThat(second).isEqualTo(ReleaseResult.ALREADY_RELEASED);
        assertThat(capacityManager.snapshot().freeSlots()).isEqualTo(1);
        assertThat(capacityManager.getDoubleReleaseCount()).isEqualTo(1);
    }

    @Test
    void tryClaim_sameEvaluationCannotHoldTwoSlots() {
        // given
        final CapacityManager capacityManager = new CapacityManager(2, 0, 0);
        capacityManager.tryClaim("eval-1", SMALL);

        // when
        final ClaimResult second = capacityManager.tryClaim("eval-1", SMALL);

        // then
        assertThat(second.isClaimed()).isFalse();
        assertThat(capacityManager.snapshot().activeSlots()).isEqualTo(1);
    }

    @Test
    void tryClaim_memoryBudgetIsEnforced() {
        // given
        final CapacityManager capacityManager = new CapacityManager(10, 256, 0);
        capacityManager.tryClaim("eval-1", new ResourceRequirements(200, 100, 30));

        // when
        final ClaimResult claim = capacityManager.tryClaim("eval-2", new ResourceRequirements(100, 100, 30));

        // then
        assertThat(claim.isClaimed()).isFalse();
        assertThat(capacityManager.snapshot().freeMemoryMb()).isEqualTo(56);
    }

    @Test
    void tryClaim_cpuBudgetIsEnforced() {
        // given
        final CapacityManager capacityManager = new CapacityManager(10, 0, 500);
        capacityManager.tryClaim("eval-1", new ResourceRequirements(128, 400, 30));

        // when
        final ClaimResult claim = capacityManager.tryClaim("eval-2", new ResourceRequirements(128, 200, 30));

        // then
        assertThat(claim.isClaimed()).isFalse();
        assertThat(capacityManager.snapshot().freeMemoryMb()).isEqualTo(-1);
    }

    @Test
    void resize_shrinkingBelowUsageBlocksNewClaimsUntilReleased() {
        // given
        final CapacityManager capacityManager = new CapacityManager(2, 0, 0);
        final ExecutionSlot first = capacityManager.tryClaim("eval-1", SMALL).slot();
        capacityManager.tryClaim("eval-2", SMALL);

        // when
        capacityManager.resize(1);

        // then
        assertThat(capacityManager.tryClaim("eval-3", SMALL).isClaimed()).isFalse();
        capacityManager.release(first);
        assertThat(capacityManager.tryClaim("eval-3", SMALL).isClaimed()).isFalse();
        capacityManager.resize(3);
        assertThat(capacityManager.tryClaim("eval-3", SMALL).isClaimed()).isTrue();
    }

    @Test
    void resize_rejectsNegativeCapacity() {
        // given
        final CapacityManager capacityManager = new CapacityManager(2, 0, 0);

        // when / then
        assertThatThrownBy(() -> capacityManager.resize(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(capacityManager.snapshot().capacity()).isEqualTo(2);
    }

}
