package io.github.samzhu.quotaboard.client;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * 所有設定叢集的 {@link ClusterContext}，依設定順序排列。
 *
 * <p>持有各叢集的 fabric8 {@link KubernetesClient}，於容器關閉時一併關閉。
 */
public class ClusterRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterRegistry.class);

    private final List<ClusterContext> clusters;
    private final List<KubernetesClient> clients;

    public ClusterRegistry(List<ClusterContext> clusters, List<KubernetesClient> clients) {
        this.clusters = List.copyOf(clusters);
        this.clients = List.copyOf(clients);
    }

    public static ClusterRegistry of(ClusterContext... clusters) {
        return new ClusterRegistry(List.of(clusters), List.of());
    }

    public List<ClusterContext> all() {
        return clusters;
    }

    @Override
    public void close() {
        for (KubernetesClient client : clients) {
            client.close();
        }
        log.debug("Closed {} Kubernetes client(s)", clients.size());
    }
}
