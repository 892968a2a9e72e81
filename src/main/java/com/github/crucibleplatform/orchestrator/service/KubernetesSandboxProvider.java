package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.config.SandboxProperties;
import com.github.crucibleplatform.orchestrator.domain.ResourceRequirements;
import com.github.crucibleplatform.orchestrator.domain.UnitHandle;
import com.github.crucibleplatform.orchestrator.domain.UnitSignal;
import com.github.crucibleplatform.orchestrator.domain.UnitSignalType;
import com.github.crucibleplatform.orchestrator.domain.UnitSpec;
import com.github.crucibleplatform.orchestrator.util.KubernetesNameUtil;
import com.google.gson.reflect.TypeToken;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.BatchV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.NodeV1Api;
import io.kubernetes.client.openapi.models.V1Capabilities;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerState;
import io.kubernetes.client.openapi.models.V1ContainerStateTerminated;
import io.kubernetes.client.openapi.models.V1ContainerStateWaiting;
import io.kubernetes.client.openapi.models.V1ContainerStatus;
import io.kubernetes.client.openapi.models.V1EmptyDirVolumeSource;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobCondition;
import io.kubernetes.client.openapi.models.V1JobSpec;
import io.kubernetes.client.openapi.models.V1JobStatus;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSecurityContext;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodStatus;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1SeccompProfile;
import io.kubernetes.client.openapi.models.V1SecurityContext;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import io.kubernetes.client.util.Watch;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.lang.reflect.Type;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Runs every evaluation as a single-pod Kubernetes Job. The job status is the native completion channel, the
 * container's terminated state the exit code channel.
 *
 * @author crucible-platform
 */
@Service
@ConditionalOnProperty(name = "crucible.sandbox.provider", havingValue = "kubernetes", matchIfMissing = true)
@Slf4j
public class KubernetesSandboxProvider implements SandboxProvider {

    static final String PROVIDER_NAME = "kubernetes";

    static final String CONTAINER_NAME = "evaluation";

    static final String DEADLINE_EXCEEDED = "DeadlineExceeded";

    private static final Set<String> FATAL_WAITING_REASONS = Set.of("ImagePullBackOff", "ErrImagePull",
            "InvalidImageName", "CreateContainerConfigError");

    private static final Quantity DEFAULT_MEMORY_REQUEST = new Quantity("128Mi");

    private static final int DEFAULT_CPU_REQUEST_MILLICORES = 100;

    private static final int DEFAULT_MEMORY_REQUEST_MB = 128;

    private final BatchV1Api batchV1Api;

    private final CoreV1Api coreV1Api;

    private final NodeV1Api nodeV1Api;

    private final ApiClient apiClient;

    private final SandboxProperties sandboxProperties;

    private final ExecutorService watchExecutorService;

    private boolean gvisorAvailable;

    public KubernetesSandboxProvider(final BatchV1Api batchV1Api,
                                     final CoreV1Api coreV1Api,
                                     final NodeV1Api nodeV1Api,
                                     final ApiClient apiClient,
                                     final SandboxProperties sandboxProperties,
                                     @Qualifier("watchExecutor") final ExecutorService watchExecutorService) {
        this.batchV1Api = batchV1Api;
        this.coreV1Api = coreV1Api;
        this.nodeV1Api = nodeV1Api;
        this.apiClient = apiClient;
        this.sandboxProperties = sandboxProperties;
        this.watchExecutorService = watchExecutorService;
    }

    @PostConstruct
    public void detectRuntimeClass() {
        try {
            nodeV1Api.readRuntimeClass(sandboxProperties.getRuntimeClassName()).execute();
            gvisorAvailable = true;
            log.info("RuntimeClass {} found, evaluations run with enhanced isolation",
                    sandboxProperties.getRuntimeClassName());
        } catch (ApiException e) {
            gvisorAvailable = false;
            if (sandboxProperties.isRequireGvisor()) {
                log.error("RuntimeClass {} not available (HTTP {}) but required, unit creation will fail",
                        sandboxProperties.getRuntimeClassName(), e.getCode());
            } else {
                log.warn("RuntimeClass {} not available (HTTP {}), running without enhanced isolation",
                        sandboxProperties.getRuntimeClassName(), e.getCode());
            }
        }
    }

    @Override
    public String getName() {
        return PROVIDER_NAME;
    }

    @Override
    @Retryable(retryFor = SandboxProviderException.class, noRetryFor = SandboxQuotaExceededException.class,
            maxAttempts = 3, backoff = @Backoff(delay = 1000, multiplier = 2))
    public UnitHandle createUnit(final UnitSpec unitSpec) throws SandboxProviderException {
        if (sandboxProperties.isRequireGvisor() && !gvisorAvailable) {
            throw new SandboxProviderException("RuntimeClass " + sandboxProperties.getRuntimeClassName()
                    + " is required but not installed");
        }

        final String jobName = KubernetesNameUtil.jobName(unitSpec.evaluationId());
        final V1Job job = buildJob(jobName, unitSpec);
        try {
            batchV1Api.createNamespacedJob(sandboxProperties.getNamespace(), job).execute();
        } catch (ApiException e) {
            if (e.getCode() == 403 && Optional.ofNullable(e.getResponseBody()).orElse("").contains("exceeded quota")) {
                throw new SandboxQuotaExceededException("Resource quota exceeded while creating job " + jobName, e);
            }
            throw new SandboxProviderException(String.format("Failed to create job %s (HTTP %d)", jobName,
                    e.getCode()), e);
        }

        log.info("Created job {} for evaluation {} with image {}", jobName, unitSpec.evaluationId(), unitSpec.image());
        return new UnitHandle(unitSpec.evaluationId(), jobName, PROVIDER_NAME);
    }

    @Override
    public UnitWatch watch(final UnitHandle handle, final UnitSignalListener listener) throws SandboxProviderException {
        final AtomicBoolean closed = new AtomicBoolean(false);
        final Watch<V1Job> jobWatch;
        final Watch<V1Pod> podWatch;
        try {
            final Call jobCall = batchV1Api.listNamespacedJob(sandboxProperties.getNamespace())
                    .fieldSelector("metadata.name=" + handle.unitName())
                    .watch(true)
                    .buildCall(null);
            final Type jobType = new TypeToken<Watch.Response<V1Job>>() {
            }.getType();
            jobWatch = Watch.createWatch(apiClient, jobCall, jobType);

            final Call podCall = coreV1Api.listNamespacedPod(sandboxProperties.getNamespace())
                    .labelSelector("job-name=" + handle.unitName())
                    .watch(true)
                    .buildCall(null);
            final Type podType = new TypeToken<Watch.Response<V1Pod>>() {
            }.getType();
            podWatch = Watch.createWatch(apiClient, podCall, podType);
        } catch (ApiException e) {
            throw new SandboxProviderException("Failed to watch job " + handle.unitName(), e);
        }

        try {
            watchExecutorService.execute(() -> consume(handle, jobWatch, listener, closed, this::toJobSignal));
            watchExecutorService.execute(() -> consume(handle, podWatch, listener, closed, this::toPodSignal));
        } catch (RejectedExecutionException e) {
            closeQuietly(handle, jobWatch);
            closeQuietly(handle, podWatch);
            throw new SandboxProviderException("No thread available to watch job " + handle.unitName(), e);
        }

        return () -> {
            if (closed.compareAndSet(false, true)) {
                closeQuietly(handle, jobWatch);
                closeQuietly(handle, podWatch);
            }
        };
    }

    @Override
    public void stop(final UnitHandle handle, final Duration gracePeriod) throws SandboxProviderException {
        try {
            batchV1Api.deleteNamespacedJob(handle.unitName(), sandboxProperties.getNamespace())
                    .gracePeriodSeconds((int) gracePeriod.toSeconds())
                    .propagationPolicy("Foreground")
                    .execute();
            log.info("Requested stop of job {} with grace period {}", handle.unitName(), gracePeriod);
        } catch (ApiException e) {
            if (e.getCode() == 404) {
                log.debug("Job {} already gone", handle.unitName());
                return;
            }
            throw new SandboxProviderException("Failed to stop job " + handle.unitName(), e);
        }
    }

    @Override
    @Retryable(retryFor = SandboxProviderException.class, maxAttempts = 5, backoff = @Backoff(delay = 2000))
    public void terminate(final UnitHandle handle) throws SandboxProviderException {
        try {
            batchV1Api.deleteNamespacedJob(handle.unitName(), sandboxProperties.getNamespace())
                    .gracePeriodSeconds(0)
                    .propagationPolicy("Background")
                    .execute();
        } catch (ApiException e) {
            if (e.getCode() != 404) {
                throw new SandboxProviderException("Failed to delete job " + handle.unitName(), e);
            }
        }
        try {
            coreV1Api.deleteCollectionNamespacedPod(sandboxProperties.getNamespace())
                    .labelSelector("job-name=" + handle.unitName())
                    .gracePeriodSeconds(0)
                    .execute();
        } catch (ApiException e) {
            if (e.getCode() != 404) {
                throw new SandboxProviderException("Failed to delete pods of job " + handle.unitName(), e);
            }
        }
        log.info("Terminated job {}", handle.unitName());
    }

    @Override
    public boolean exists(final UnitHandle handle) throws SandboxProviderException {
        try {
            batchV1Api.readNamespacedJob(handle.unitName(), sandboxProperties.getNamespace()).execute();
            return true;
        } catch (ApiException e) {
            if (e.getCode() == 404) {
                return false;
            }
            throw new SandboxProviderException("Failed to read job " + handle.unitName(), e);
        }
    }

    @Override
    public Optional<String> fetchLogs(final UnitHandle handle) throws SandboxProviderException {
        final List<V1Pod> pods;
        try {
            pods = coreV1Api.listNamespacedPod(sandboxProperties.getNamespace())
                    .labelSelector("job-name=" + handle.unitName())
                    .execute()
                    .getItems();
        } catch (ApiException e) {
            throw new SandboxProviderException("Failed to list pods of job " + handle.unitName(), e);
        }

        if (pods.isEmpty()) {
            if (!exists(handle)) {
                throw new UnitNotFoundException("Job " + handle.unitName() + " not found");
            }
            return Optional.empty();
        }

        final V1Pod pod = pods.get(0);
        final String phase = Optional.ofNullable(pod.getStatus()).map(V1PodStatus::getPhase).orElse("Pending");
        if ("Pending".equals(phase)) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(coreV1Api.readNamespacedPodLog(pod.getMetadata().getName(),
                            sandboxProperties.getNamespace())
                    .container(CONTAINER_NAME)
                    .tailLines(sandboxProperties.getLogTailLines())
                    .execute());
        } catch (ApiException e) {
            if (e.getCode() == 400) {
                // container not started yet
                return Optional.empty();
            }
            if (e.getCode() == 404) {
                throw new UnitNotFoundException("Pod of job " + handle.unitName() + " not found", e);
            }
            throw new SandboxProviderException("Failed to read logs of job " + handle.unitName(), e);
        }
    }

    V1Job buildJob(final String jobName, final UnitSpec unitSpec) {
        final ResourceRequirements requirements = unitSpec.resourceRequirements();
        final String evaluationLabel = KubernetesNameUtil.labelValue(unitSpec.evaluationId());

        final V1Container container = new V1Container()
                .name(CONTAINER_NAME)
                .image(unitSpec.image())
                .imagePullPolicy("IfNotPresent")
                .command(List.of("python", "-u", "-c", unitSpec.code()))
                .env(List.of(
                        new V1EnvVar().name("EVAL_ID").value(unitSpec.evaluationId()),
                        new V1EnvVar().name("PYTHONUNBUFFERED").value("1")))
                .resources(new V1ResourceRequirements()
                        .limits(Map.of(
                                "memory", new Quantity(requirements.memoryQuantity()),
                                "cpu", new Quantity(requirements.cpuQuantity())))
                        .requests(Map.of(
                                "memory", requirements.memoryMb() < DEFAULT_MEMORY_REQUEST_MB
                                        ? new Quantity(requirements.memoryQuantity()) : DEFAULT_MEMORY_REQUEST,
                                "cpu", new Quantity(Math.min(requirements.cpuMillicores(),
                                        DEFAULT_CPU_REQUEST_MILLICORES) + "m"))))
                .securityContext(new V1SecurityContext()
                        .allowPrivilegeEscalation(false)
                        .readOnlyRootFilesystem(true)
                        .runAsNonRoot(true)
                        .capabilities(new V1Capabilities().drop(List.of("ALL"))))
                .volumeMounts(List.of(new V1VolumeMount().name("tmp").mountPath("/tmp")));

        final V1PodSpec podSpec = new V1PodSpec()
                .restartPolicy("Never")
                .priorityClassName(unitSpec.priorityClassName())
                .terminationGracePeriodSeconds((long) unitSpec.gracePeriodSeconds())
                .securityContext(new V1PodSecurityContext()
                        .runAsNonRoot(true)
                        .runAsUser(1000L)
                        .fsGroup(1000L)
                        .seccompProfile(new V1SeccompProfile().type("RuntimeDefault")))
                .containers(List.of(container))
                .volumes(List.of(new V1Volume()
                        .name("tmp")
                        .emptyDir(new V1EmptyDirVolumeSource().sizeLimit(new Quantity("100Mi")))));
        if (gvisorAvailable) {
            podSpec.runtimeClassName(sandboxProperties.getRuntimeClassName());
        }

        return new V1Job()
                .metadata(new V1ObjectMeta()
                        .name(jobName)
                        .labels(Map.of("app", "evaluation", "eval-id", evaluationLabel, "created-by", "dispatcher"))
                        .annotations(Map.of("eval-id", unitSpec.evaluationId(),
                                "created-at", ZonedDateTime.now().toString())))
                .spec(new V1JobSpec()
                        .ttlSecondsAfterFinished(sandboxProperties.getJobTtlSecondsAfterFinished())
                        .activeDeadlineSeconds((long) requirements.timeoutSeconds() + unitSpec.gracePeriodSeconds()
                                + sandboxProperties.getJobDeadlineMarginSeconds())
                        .backoffLimit(0)
                        .template(new V1PodTemplateSpec()
                                .metadata(new V1ObjectMeta().labels(Map.of("app", "evaluation",
                                        "eval-id", evaluationLabel)))
                                .spec(podSpec)));
    }

    Optional<UnitSignal> toJobSignal(final Watch.Response<V1Job> item) {
        if ("DELETED".equals(item.type)) {
            return Optional.of(UnitSignal.of(UnitSignalType.GONE, "job deleted"));
        }
        final V1JobStatus status = Optional.ofNullable(item.object).map(V1Job::getStatus).orElse(null);
        final int active = Optional.ofNullable(status).map(V1JobStatus::getActive).orElse(0);
        final int failed = Optional.ofNullable(status).map(V1JobStatus::getFailed).orElse(0);
        final int succeeded = Optional.ofNullable(status).map(V1JobStatus::getSucceeded).orElse(0);

        if (failed > 0) {
            final String reason = failureReason(status);
            if (DEADLINE_EXCEEDED.equals(reason)) {
                return Optional.of(UnitSignal.of(UnitSignalType.DEADLINE_EXCEEDED, reason));
            }
            return Optional.of(UnitSignal.of(UnitSignalType.FAILED, reason));
        } else if (succeeded > 0) {
            return Optional.of(UnitSignal.of(UnitSignalType.SUCCEEDED, "Job succeeded"));
        } else if (active > 0) {
            return Optional.of(UnitSignal.of(UnitSignalType.STARTED));
        }
        return Optional.empty();
    }

    Optional<UnitSignal> toPodSignal(final Watch.Response<V1Pod> item) {
        if ("DELETED".equals(item.type)) {
            return Optional.empty();
        }
        final Optional<V1ContainerState> state = Optional.ofNullable(item.object)
                .map(V1Pod::getStatus)
                .map(V1PodStatus::getContainerStatuses)
                .flatMap(statuses -> statuses.stream()
                        .filter(containerStatus -> CONTAINER_NAME.equals(containerStatus.getName()))
                        .findFirst())
                .map(V1ContainerStatus::getState);
        if (state.isEmpty()) {
            return Optional.empty();
        }

        final V1ContainerStateTerminated terminated = state.get().getTerminated();
        if (terminated != null) {
            return Optional.of(UnitSignal.exitCode(terminated.getExitCode()));
        }
        if (state.get().getRunning() != null) {
            return Optional.of(UnitSignal.of(UnitSignalType.STARTED));
        }
        final V1ContainerStateWaiting waiting = state.get().getWaiting();
        if (waiting != null && waiting.getReason() != null && FATAL_WAITING_REASONS.contains(waiting.getReason())) {
            return Optional.of(UnitSignal.of(UnitSignalType.FAILED, waiting.getReason()));
        }
        return Optional.empty();
    }

    private <T> void consume(final UnitHandle handle, final Watch<T> watch, final UnitSignalListener listener,
                             final AtomicBoolean closed, final Function<Watch.Response<T>, Optional<UnitSignal>> mapper) {
        try {
            for (final Watch.Response<T> item : watch) {
                if (closed.get()) {
                    return;
                }
                mapper.apply(item).ifPresent(signal -> listener.onSignal(handle, signal));
            }
        } catch (RuntimeException e) {
            if (closed.get()) {
                log.debug("Watch on job {} closed", handle.unitName());
                return;
            }
            log.warn("Watch on job {} interrupted", handle.unitName(), e);
        }

        // only the first of both channels to fail reports the loss
        if (closed.compareAndSet(false, true)) {
            closeQuietly(handle, watch);
            listener.onSignal(handle, UnitSignal.of(UnitSignalType.WATCH_LOST, "watch on job " + handle.unitName()
                    + " ended"));
        }
    }

    private void closeQuietly(final UnitHandle handle, final Watch<?> watch) {
        try {
            watch.close();
        } catch (IOException e) {
            log.debug("Closing watch on job {} failed: {}", handle.unitName(), e.getMessage());
        }
    }

    private String failureReason(final V1JobStatus status) {
        return Optional.ofNullable(status.getConditions())
                .flatMap(conditions -> conditions.stream()
                        .filter(condition -> "Failed".equals(condition.getType()))
                        .map(V1JobCondition::getReason)
                        .findFirst())
                .orElse("Job failed");
    }

}
