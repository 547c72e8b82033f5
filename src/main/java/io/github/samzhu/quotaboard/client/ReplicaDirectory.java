package io.github.samzhu.quotaboard.client;

import java.util.Map;

/**
 * 查詢命名空間內各 workload 的期望副本數。
 *
 * @see KubernetesClusterClient
 */
public interface ReplicaDirectory {

    /**
     * 取得命名空間內所有 workload controller 的期望副本數。
     *
     * @param namespace 命名空間
     * @return controller 名稱 → 期望副本數，未設定副本數時為 0
     * @throws io.github.samzhu.quotaboard.exception.ClusterAccessException Kubernetes API 存取失敗
     */
    Map<String, Integer> getExpectedReplicas(String namespace);
}
