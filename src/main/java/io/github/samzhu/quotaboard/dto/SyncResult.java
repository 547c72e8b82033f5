package io.github.samzhu.quotaboard.dto;

import java.util.List;

/**
 * 匯入或同步作業的結果摘要。
 *
 * @param success 作業是否整體完成（個別項目失敗不影響此旗標）
 * @param imported 新增筆數
 * @param updated 更新筆數
 * @param errors 個別項目的錯誤訊息
 */
public record SyncResult(
    boolean success,
    int imported,
    int updated,
    List<String> errors
) {
    public SyncResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * 建立整體失敗的結果。
     */
    public static SyncResult failed(String error) {
        return new SyncResult(false, 0, 0, List.of(error));
    }
}
