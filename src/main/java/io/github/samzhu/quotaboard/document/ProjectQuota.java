package io.github.samzhu.quotaboard.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 專案配額文件。
 *
 * <p>以外部識別碼 {@code cloudId} 為主鍵，報表依 {@code projectName} 對應用量。
 * 由管理員手動維護，或由 {@link io.github.samzhu.quotaboard.service.QuotaSyncService}
 * 從叢集 ResourceQuota 同步（ID 格式 {@code k8s-{namespace}}）。
 *
 * @param cloudId 外部識別碼
 * @param projectName 專案名稱
 * @param cpuQuota CPU 配額（核心數）
 * @param memoryQuota 記憶體配額 (GiB)
 * @param lastUpdatedAt 最後更新時間
 */
@Document(collection = "project_quota")
public record ProjectQuota(
    @Id String cloudId,
    @Indexed String projectName,
    double cpuQuota,
    double memoryQuota,
    Instant lastUpdatedAt
) {
    /**
     * 建立新配額，時間戳記為現在。
     */
    public static ProjectQuota of(String cloudId, String projectName, double cpuQuota, double memoryQuota) {
        return new ProjectQuota(cloudId, projectName, cpuQuota, memoryQuota, Instant.now());
    }
}
