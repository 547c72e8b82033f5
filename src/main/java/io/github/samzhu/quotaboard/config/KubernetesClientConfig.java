package io.github.samzhu.quotaboard.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.github.samzhu.quotaboard.client.ClusterContext;
import io.github.samzhu.quotaboard.client.ClusterRegistry;
import io.github.samzhu.quotaboard.client.KubernetesClusterClient;
import io.github.samzhu.quotaboard.client.PrometheusMetricsClient;
import io.github.samzhu.quotaboard.config.QuotaboardProperties.ClusterConfig;

/**
 * 叢集客戶端配置。
 *
 * <p>{@code quotaboard.clusters} 中每個叢集建立：
 * <ul>
 *   <li>fabric8 {@link KubernetesClient} - 指定 {@code kubeconfig-path} 時從該檔案建立，
 *       否則自動偵測（Pod 內的 ServiceAccount 或 {@code ~/.kube/config}）</li>
 *   <li>{@link PrometheusMetricsClient} - 叢集的 {@code prometheus-url}，未設定時使用
 *       {@code quotaboard.prometheus.url}</li>
 * </ul>
 *
 * @see <a href="https://github.com/fabric8io/kubernetes-client">Fabric8 Kubernetes Client</a>
 */
@Configuration
public class KubernetesClientConfig {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientConfig.class);

    @Bean(destroyMethod = "close")
    public ClusterRegistry clusterRegistry(QuotaboardProperties properties) {
        List<ClusterContext> contexts = new ArrayList<>();
        List<KubernetesClient> clients = new ArrayList<>();
        for (ClusterConfig cluster : properties.clusters()) {
            KubernetesClient client = kubernetesClient(cluster);
            clients.add(client);

            KubernetesClusterClient clusterClient = new KubernetesClusterClient(client, cluster);
            RestClient restClient = prometheusRestClient(
                cluster.prometheusUrlOr(properties.prometheus().url()), properties.prometheus());
            contexts.add(new ClusterContext(clusterClient, clusterClient, new PrometheusMetricsClient(restClient)));
        }
        log.info("Cluster registry initialized: clusters={}",
            contexts.stream().map(ClusterContext::name).toList());
        return new ClusterRegistry(contexts, clients);
    }

    private static KubernetesClient kubernetesClient(ClusterConfig cluster) {
        if (!cluster.hasKubeconfig()) {
            log.info("Creating Kubernetes client for cluster '{}' from auto-detected configuration", cluster.name());
            return new KubernetesClientBuilder().build();
        }

        log.info("Creating Kubernetes client for cluster '{}' from kubeconfig: {}",
            cluster.name(), cluster.kubeconfigPath());
        try {
            String kubeconfig = Files.readString(Path.of(cluster.kubeconfigPath()));
            Config config = Config.fromKubeconfig(kubeconfig);
            return new KubernetesClientBuilder().withConfig(config).build();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read kubeconfig: " + cluster.kubeconfigPath(), e);
        }
    }

    private static RestClient prometheusRestClient(String url, QuotaboardProperties.PrometheusConfig prometheus) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) prometheus.timeout().toMillis());
        requestFactory.setReadTimeout((int) prometheus.timeout().toMillis());

        return RestClient.builder()
            .baseUrl(url)
            .requestFactory(requestFactory)
            .build();
    }
}
