package io.github.samzhu.quotaboard.client;

/**
 * 單一叢集的存取入口：Kubernetes API、期望副本數與指標後端。
 *
 * @param cluster Kubernetes 叢集客戶端
 * @param replicas 期望副本數來源，通常與 {@code cluster} 為同一實例
 * @param metrics 此叢集的指標後端
 */
public record ClusterContext(
    KubernetesClusterClient cluster,
    ReplicaDirectory replicas,
    MetricsBackend metrics
) {
    public String name() {
        return cluster.getClusterName();
    }
}
