package io.github.samzhu.quotaboard.document;

import java.time.Instant;
import java.time.LocalDate;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 專案日用量累計文件。
 *
 * <p>記錄單一專案在特定日期的 CPU / 記憶體用量。同一天可能有多次匯入
 * （多個報表檔、多個命名空間歸屬同一專案、指標同步），每次匯入的數值
 * 以 {@code $inc} 累加，而非覆寫。
 *
 * <p>注意：同一份來源重複匯入會重複累加，冪等性由匯入端負責。
 *
 * <p>文件 ID 格式：{@code {date}_{projectName}}，例如 {@code 2025-06-01_payments}
 *
 * @param id 複合主鍵
 * @param date 日期
 * @param projectName 專案名稱
 * @param cloudId 外部識別碼，第一次寫入時決定
 * @param cpuUsage 累計 CPU 用量（核心數）
 * @param memoryUsage 累計記憶體用量 (GiB)
 * @param contributionCount 累加次數
 * @param lastUpdatedAt 最後更新時間
 */
@Document(collection = "daily_project_usage")
public record DailyProjectUsage(
    @Id String id,
    @Indexed LocalDate date,
    String projectName,
    String cloudId,
    double cpuUsage,
    double memoryUsage,
    int contributionCount,
    Instant lastUpdatedAt
) {
    /**
     * 產生複合主鍵。
     *
     * @param date 日期
     * @param projectName 專案名稱
     * @return 複合 ID，格式為 {@code YYYY-MM-DD_projectName}
     */
    public static String createId(LocalDate date, String projectName) {
        return date.toString() + "_" + projectName;
    }

    /**
     * 累加另一筆同 key 的用量，保留既有的 cloudId。
     */
    public DailyProjectUsage plus(DailyProjectUsage other) {
        return new DailyProjectUsage(
            id,
            date,
            projectName,
            cloudId != null ? cloudId : other.cloudId(),
            cpuUsage + other.cpuUsage(),
            memoryUsage + other.memoryUsage(),
            contributionCount + other.contributionCount(),
            other.lastUpdatedAt());
    }
}
