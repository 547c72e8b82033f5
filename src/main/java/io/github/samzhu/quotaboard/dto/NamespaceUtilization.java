package io.github.samzhu.quotaboard.dto;

/**
 * 命名空間 ResourceQuota 的使用率（used / hard）。
 *
 * @param clusterName 叢集名稱
 * @param namespace 命名空間
 * @param projectName 所屬專案
 * @param cpuRate CPU 使用率
 * @param memoryRate 記憶體使用率
 * @param podsRate Pod 數使用率
 * @param storageRate 儲存空間使用率
 */
public record NamespaceUtilization(
    String clusterName,
    String namespace,
    String projectName,
    double cpuRate,
    double memoryRate,
    double podsRate,
    double storageRate
) {}
