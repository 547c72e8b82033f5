package io.github.samzhu.quotaboard.dto;

/**
 * 單一 Pod 在回溯窗口（預設一天）內的資源峰值。
 *
 * <p>由 {@link io.github.samzhu.quotaboard.client.MetricsBackend} 每次聚合時即時查詢產生，不持久化。
 *
 * @param podName Pod 名稱
 * @param namespace 所屬命名空間
 * @param cpuPeakCores CPU 峰值（核心數）
 * @param memoryPeakGib 記憶體峰值 (GiB)
 */
public record PodSample(
    String podName,
    String namespace,
    double cpuPeakCores,
    double memoryPeakGib
) {}
