package io.github.samzhu.quotaboard.dto;

/**
 * 單次匯入事件中，某專案的用量貢獻。
 *
 * <p>作為 {@link io.github.samzhu.quotaboard.store.UsageMergeStore#merge} 的輸入，
 * 同一天同一專案的多筆貢獻會被累加。
 *
 * @param projectName 專案名稱
 * @param cloudId 外部識別碼，可為 null（例如報表匯入時尚未對應配額）
 * @param cpuUsage CPU 用量（核心數）
 * @param memoryUsage 記憶體用量 (GiB)
 */
public record ProjectUsage(
    String projectName,
    String cloudId,
    double cpuUsage,
    double memoryUsage
) {
    /**
     * 合併兩筆同專案的貢獻，保留先出現的 cloudId。
     */
    public ProjectUsage plus(ProjectUsage other) {
        return new ProjectUsage(
            projectName,
            cloudId != null ? cloudId : other.cloudId(),
            cpuUsage + other.cpuUsage(),
            memoryUsage + other.memoryUsage());
    }
}
