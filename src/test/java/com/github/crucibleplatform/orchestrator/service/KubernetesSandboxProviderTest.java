package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.config.SandboxProperties;
import com.github.crucibleplatform.orchestrator.domain.ResourceRequirements;
import com.github.crucibleplatform.orchestrator.domain.UnitHandle;
import com.github.crucibleplatform.orchestrator.domain.UnitSignal;
import com.github.crucibleplatform.orchestrator.domain.UnitSignalType;
import com.github.crucibleplatform.orchestrator.domain.UnitSpec;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.BatchV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.NodeV1Api;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerState;
import io.kubernetes.client.openapi.models.V1ContainerStateRunning;
import io.kubernetes.client.openapi.models.V1ContainerStateTerminated;
import io.kubernetes.client.openapi.models.V1ContainerStateWaiting;
import io.kubernetes.client.openapi.models.V1ContainerStatus;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobCondition;
import io.kubernetes.client.openapi.models.V1JobStatus;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import io.kubernetes.client.openapi.models.V1PodStatus;
import io.kubernetes.client.util.Watch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * @author crucible-platform
 */
class KubernetesSandboxProviderTest {

    BatchV1Api batchV1Api;

    CoreV1Api coreV1Api;

    NodeV1Api nodeV1Api;

    SandboxProperties sandboxProperties;

    ExecutorService watchExecutorService;

    final UnitHandle handle = new UnitHandle("eval-1", "eval-1-abc12345", "kubernetes");

    @BeforeEach
    void setUp() {
        batchV1Api = mock(BatchV1Api.class, RETURNS_DEEP_STUBS);
        coreV1Api = mock(CoreV1Api.class, RETURNS_DEEP_STUBS);
        nodeV1Api = mock(NodeV1Api.class, RETURNS_DEEP_STUBS);
        sandboxProperties = new SandboxProperties();
        watchExecutorService = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        watchExecutorService.shutdownNow();
    }

    @Test
    void buildJob_describesIsolatedSingleAttemptJob() {
        // given
        final KubernetesSandboxProvider provider = provider(true);

        // when
        final V1Job job = provider.buildJob("eval-1-abc12345", unitSpec());

        // then
        assertThat(job.getMetadata().getName()).isEqualTo("eval-1-abc12345");
        assertThat(job.getMetadata().getLabels())
                .containsEntry("app", "evaluation")
                .containsEntry("eval-id", "eval-1")
                .containsEntry("created-by", "dispatcher");
        assertThat(job.getSpec().getBackoffLimit()).isZero();
        assertThat(job.getSpec().getActiveDeadlineSeconds()).isEqualTo(95L);
        assertThat(job.getSpec().getTtlSecondsAfterFinished()).isEqualTo(300);
        assertThat(job.getSpec().getTemplate().getSpec().getRestartPolicy()).isEqualTo("Never");
        assertThat(job.getSpec().getTemplate().getSpec().getRuntimeClassName()).isEqualTo("gvisor");
        assertThat(job.getSpec().getTemplate().getSpec().getTerminationGracePeriodSeconds()).isEqualTo(5L);
        assertThat(job.getSpec().getTemplate().getSpec().getPriorityClassName())
                .isEqualTo("test-normal-priority-evaluation");

        final V1Container container = job.getSpec().getTemplate().getSpec().getContainers().get(0);
        assertThat(container.getName()).isEqualTo(KubernetesSandboxProvider.CONTAINER_NAME);
        assertThat(container.getImage()).isEqualTo("executor-base:latest");
        assertThat(container.getCommand()).containsExactly("python", "-u", "-c", "print('hello')");
        assertThat(container.getResources().getLimits())
                .containsEntry("memory", new Quantity("256Mi"))
                .containsEntry("cpu", new Quantity("200m"));
        assertThat(container.getSecurityContext().getAllowPrivilegeEscalation()).isFalse();
        assertThat(container.getSecurityContext().getReadOnlyRootFilesystem()).isTrue();
    }

    @Test
    void buildJob_withoutRuntimeClassRunsWithDefaultRuntime() {
        // given
        final KubernetesSandboxProvider provider = provider(false);

        // when
        final V1Job job = provider.buildJob("eval-1-abc12345", unitSpec());

        // then
        assertThat(job.getSpec().getTemplate().getSpec().getRuntimeClassName()).isNull();
    }

    @Test
    void createUnit_returnsHandleForCreatedJob() throws SandboxProviderException {
        // given
        final KubernetesSandboxProvider provider = provider(true);

        // when
        final UnitHandle unitHandle = provider.createUnit(unitSpec());

        // then
        assertThat(unitHandle.evaluationId()).isEqualTo("eval-1");
        assertThat(unitHandle.reference()).matches("kubernetes://eval-1-[0-9a-f]{8}");
    }

    @Test
    void createUnit_failsWhenRequiredRuntimeClassIsMissing() {
        // given
        sandboxProperties.setRequireGvisor(true);
        final KubernetesSandboxProvider provider = provider(false);

        // when / then
        assertThatThrownBy(() -> provider.createUnit(unitSpec()))
                .isInstanceOf(SandboxProviderException.class)
                .hasMessageContaining("gvisor");
    }

    @Test
    void createUnit_quotaErrorIsReportedAsQuotaExceeded() throws ApiException {
        // given
        final KubernetesSandboxProvider provider = provider(true);
        when(batchV1Api.createNamespacedJob(eq("crucible"), any()).execute())
                .thenThrow(new ApiException(403, Map.of(), "pods \"x\" is forbidden: exceeded quota: compute"));

        // when / then
        assertThatThrownBy(() -> provider.createUnit(unitSpec()))
                .isInstanceOf(SandboxQuotaExceededException.class);
    }

    @Test
    void createUnit_otherApiErrorIsInfrastructureFailure() throws ApiException {
        // given
        final KubernetesSandboxProvider provider = provider(true);
        when(batchV1Api.createNamespacedJob(eq("crucible"), any()).execute())
                .thenThrow(new ApiException(500, "etcd timeout"));

        // when / then
        assertThatThrownBy(() -> provider.createUnit(unitSpec()))
                .isInstanceOf(SandboxProviderException.class)
                .isNotInstanceOf(SandboxQuotaExceededException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void toJobSignal_mapsJobStatus() {
        // given
        final KubernetesSandboxProvider provider = provider(true);
        final V1Job failed = new V1Job().status(new V1JobStatus().failed(1)
                .conditions(List.of(new V1JobCondition().type("Failed").status("True")
                        .reason("BackoffLimitExceeded"))));
        final V1Job deadlineExceeded = new V1Job().status(new V1JobStatus().failed(1)
                .conditions(List.of(new V1JobCondition().type("Failed").status("True").reason("DeadlineExceeded"))));

        // when / then
        assertThat(provider.toJobSignal(new Watch.Response<>("DELETED", new V1Job())))
                .map(UnitSignal::type).contains(UnitSignalType.GONE);
        assertThat(provider.toJobSignal(new Watch.Response<>("MODIFIED", failed)))
                .contains(UnitSignal.of(UnitSignalType.FAILED, "BackoffLimitExceeded"));
        assertThat(provider.toJobSignal(new Watch.Response<>("MODIFIED", deadlineExceeded)))
                .contains(UnitSignal.of(UnitSignalType.DEADLINE_EXCEEDED, "DeadlineExceeded"));
        assertThat(provider.toJobSignal(new Watch.Response<>("MODIFIED",
                new V1Job().status(new V1JobStatus().succeeded(1)))))
                .map(UnitSignal::type).contains(UnitSignalType.SUCCEEDED);
        assertThat(provider.toJobSignal(new Watch.Response<>("MODIFIED",
                new V1Job().status(new V1JobStatus().active(1)))))
                .contains(UnitSignal.of(UnitSignalType.STARTED));
        assertThat(provider.toJobSignal(new Watch.Response<>("ADDED", new V1Job()))).isEmpty();
    }

    @Test
    void toPodSignal_mapsEvaluationContainerState() {
        // given
        final KubernetesSandboxProvider provider = provider(true);

        // when / then
        assertThat(provider.toPodSignal(podEvent(new V1ContainerState()
                .terminated(new V1ContainerStateTerminated().exitCode(3)))))
                .contains(UnitSignal.exitCode(3));
        assertThat(provider.toPodSignal(podEvent(new V1ContainerState().running(new V1ContainerStateRunning()))))
                .contains(UnitSignal.of(UnitSignalType.STARTED));
        assertThat(provider.toPodSignal(podEvent(new V1ContainerState()
                .waiting(new V1ContainerStateWaiting().reason("ImagePullBackOff")))))
                .contains(UnitSignal.of(UnitSignalType.FAILED, "ImagePullBackOff"));
        assertThat(provider.toPodSignal(podEvent(new V1ContainerState()
                .waiting(new V1ContainerStateWaiting().reason("ContainerCreating"))))).isEmpty();
        assertThat(provider.toPodSignal(new Watch.Response<>("ADDED", new V1Pod()))).isEmpty();
    }

    @Test
    void stop_ignoresJobThatIsAlreadyGone() throws ApiException {
        // given
        final KubernetesSandboxProvider provider = provider(true);
        when(batchV1Api.deleteNamespacedJob("eval-1-abc12345", "crucible")
                .gracePeriodSeconds(5)
                .propagationPolicy("Foreground")
                .execute())
                .thenThrow(new ApiException(404, "not found"));

        // when / then
        assertThatCode(() -> provider.stop(handle, Duration.ofSeconds(5))).doesNotThrowAnyException();
    }

    @Test
    void exists_isFalseForMissingJob() throws Exception {
        // given
        final KubernetesSandboxProvider provider = provider(true);
        when(batchV1Api.readNamespacedJob("eval-1-abc12345", "crucible").execute())
                .thenThrow(new ApiException(404, "not found"));

        // when / then
        assertThat(provider.exists(handle)).isFalse();
    }

    @Test
    void fetchLogs_missingJobIsNotFound() throws ApiException {
        // given
        final KubernetesSandboxProvider provider = provider(true);
        when(coreV1Api.listNamespacedPod("crucible").labelSelector("job-name=eval-1-abc12345").execute())
                .thenReturn(new V1PodList().items(List.of()));
        when(batchV1Api.readNamespacedJob("eval-1-abc12345", "crucible").execute())
                .thenThrow(new ApiException(404, "not found"));

        // when / then
        assertThatThrownBy(() -> provider.fetchLogs(handle)).isInstanceOf(UnitNotFoundException.class);
    }

    @Test
    void fetchLogs_pendingPodHasNoLogsYet() throws Exception {
        // given
        final KubernetesSandboxProvider provider = provider(true);
        when(coreV1Api.listNamespacedPod("crucible").labelSelector("job-name=eval-1-abc12345").execute())
                .thenReturn(new V1PodList().items(List.of(pod("Pending"))));

        // when / then
        assertThat(provider.fetchLogs(handle)).isEmpty();
    }

    @Test
    void fetchLogs_readsEvaluationContainerLogs() throws Exception {
        // given
        final KubernetesSandboxProvider provider = provider(true);
        when(coreV1Api.listNamespacedPod("crucible").labelSelector("job-name=eval-1-abc12345").execute())
                .thenReturn(new V1PodList().items(List.of(pod("Succeeded"))));
        when(coreV1Api.readNamespacedPodLog("eval-1-abc12345-xyz", "crucible")
                .container(KubernetesSandboxProvider.CONTAINER_NAME)
                .tailLines(100)
                .execute())
                .thenReturn("hello\n");

        // when / then
        assertThat(provider.fetchLogs(handle)).contains("hello\n");
    }

    private KubernetesSandboxProvider provider(final boolean runtimeClassInstalled) {
        if (!runtimeClassInstalled) {
            try {
                when(nodeV1Api.readRuntimeClass("gvisor").execute()).thenThrow(new ApiException(404, "not found"));
            } catch (ApiException e) {
                throw new IllegalStateException(e);
            }
        }
        final KubernetesSandboxProvider provider = new KubernetesSandboxProvider(batchV1Api, coreV1Api, nodeV1Api,
                mock(ApiClient.class), sandboxProperties, watchExecutorService);
        provider.detectRuntimeClass();
        return provider;
    }

    private UnitSpec unitSpec() {
        return new UnitSpec("eval-1", "print('hello')", new ResourceRequirements(256, 200, 60), 5,
                "test-normal-priority-evaluation", "executor-base:latest");
    }

    private Watch.Response<V1Pod> podEvent(final V1ContainerState state) {
        return new Watch.Response<>("MODIFIED", new V1Pod().status(new V1PodStatus()
                .containerStatuses(List.of(new V1ContainerStatus().name("evaluation").state(state)))));
    }

    private V1Pod pod(final String phase) {
        return new V1Pod()
                .metadata(new V1ObjectMeta().name("eval-1-abc12345-xyz"))
                .status(new V1PodStatus().phase(phase));
    }

}
