package io.github.samzhu.quotaboard.dto;

/**
 * 配額部分更新請求，null 欄位表示不變更。
 *
 * @param projectName 專案名稱
 * @param cpuQuota CPU 配額（核心數）
 * @param memoryQuota 記憶體配額 (GiB)
 */
public record QuotaUpdate(
    String projectName,
    Double cpuQuota,
    Double memoryQuota
) {}
