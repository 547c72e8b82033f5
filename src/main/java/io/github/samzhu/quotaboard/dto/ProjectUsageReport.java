package io.github.samzhu.quotaboard.dto;

import java.time.LocalDate;

/**
 * 專案日報表列：累計用量與對應配額的使用率。
 *
 * @param date 日期
 * @param projectName 專案名稱
 * @param cloudId 外部識別碼（優先取自配額設定）
 * @param cpuUsage CPU 用量（核心數）
 * @param memoryUsage 記憶體用量 (GiB)
 * @param cpuRate CPU 使用率，無配額時為 null
 * @param memoryRate 記憶體使用率，無配額時為 null
 */
public record ProjectUsageReport(
    LocalDate date,
    String projectName,
    String cloudId,
    double cpuUsage,
    double memoryUsage,
    Double cpuRate,
    Double memoryRate
) {}
