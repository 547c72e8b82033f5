package io.github.samzhu.quotaboard.dto;

import java.util.List;

import io.github.samzhu.quotaboard.document.ProjectQuota;

/**
 * 專案配額管理指令（CloudEvents data payload）。
 *
 * <p>依 {@code action} 使用不同欄位：
 * <ul>
 *   <li>{@code ADD} - {@code quota}</li>
 *   <li>{@code UPDATE} - {@code cloudId} 與 {@code changes}</li>
 *   <li>{@code DELETE} - {@code cloudId}</li>
 *   <li>{@code IMPORT} - {@code quotas}，已存在的 cloudId 會被覆寫</li>
 * </ul>
 *
 * @param action 指令類型
 * @param cloudId 目標配額的外部識別碼
 * @param quota 新增的配額
 * @param changes 部分更新內容
 * @param quotas 批次匯入的配額
 */
public record QuotaCommand(
    Action action,
    String cloudId,
    ProjectQuota quota,
    QuotaUpdate changes,
    List<ProjectQuota> quotas
) {
    public enum Action {
        ADD,
        UPDATE,
        DELETE,
        IMPORT
    }
}
