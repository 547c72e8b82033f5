package io.github.samzhu.quotaboard.dto;

/**
 * 單次聚合後的命名空間用量。
 *
 * @param namespace 命名空間
 * @param cpuCores 去重後 CPU 用量（核心數）
 * @param memoryGib 去重後記憶體用量 (GiB)
 */
public record NamespaceUsage(
    String namespace,
    double cpuCores,
    double memoryGib
) {
    /**
     * 建立零用量。
     */
    public static NamespaceUsage empty(String namespace) {
        return new NamespaceUsage(namespace, 0.0, 0.0);
    }
}
