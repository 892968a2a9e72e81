package com.github.crucibleplatform.orchestrator.config;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.BatchV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.NodeV1Api;
import io.kubernetes.client.util.Config;
import okhttp3.Protocol;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * Kubernetes client setup. Watches stay open for the whole evaluation, so the read timeout is disabled.
 *
 * @author crucible-platform
 */
@Configuration
@ConditionalOnProperty(name = "crucible.sandbox.provider", havingValue = "kubernetes", matchIfMissing = true)
public class KubernetesConfig {

    @Bean
    public ApiClient kubernetesClient() throws IOException {
        final ApiClient client = Config.defaultClient();
        client.setConnectTimeout(30_000);
        client.setHttpClient(client
                .getHttpClient()
                .newBuilder()
                .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
                .readTimeout(Duration.ZERO)
                .pingInterval(1, TimeUnit.MINUTES)
                .build());
        io.kubernetes.client.openapi.Configuration.setDefaultApiClient(client);
        return client;
    }

    @Bean
    CoreV1Api coreV1Api(final ApiClient kubernetesClient) {
        return new CoreV1Api(kubernetesClient);
    }

    @Bean
    BatchV1Api batchV1Api(final ApiClient kubernetesClient) {
        return new BatchV1Api(kubernetesClient);
    }

    @Bean
    NodeV1Api nodeV1Api(final ApiClient kubernetesClient) {
        return new NodeV1Api(kubernetesClient);
    }

}
