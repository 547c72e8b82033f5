package io.github.samzhu.quotaboard.store;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.github.samzhu.quotaboard.document.DailyProjectUsage;
import io.github.samzhu.quotaboard.dto.ProjectUsage;

/**
 * 專案日用量累計儲存。
 *
 * <p>以 (日期, 專案) 為 key，每次 {@link #merge} 的數值加到既有紀錄上。
 * 累加是非冪等的：同一批資料合併兩次，儲存的總量會變成兩倍。
 *
 * <p>實作由 {@code quotaboard.store.type} 選擇：
 * <ul>
 *   <li>{@code mongo}（預設）- {@link MongoUsageMergeStore}</li>
 *   <li>{@code memory} - {@link InMemoryUsageMergeStore}</li>
 * </ul>
 */
public interface UsageMergeStore {

    /**
     * 將用量累加到指定日期。同一次呼叫內同專案的多筆資料先加總。
     *
     * @param date 日期
     * @param usages 各專案的用量貢獻
     */
    void merge(LocalDate date, List<ProjectUsage> usages);

    /**
     * 查詢指定日期的累計用量。
     *
     * @param date 日期
     * @return 依專案名稱排序的用量
     */
    List<DailyProjectUsage> getUsage(LocalDate date);

    /**
     * 查詢所有有資料的日期。
     *
     * @return 由舊到新排序的日期
     */
    List<LocalDate> getDates();

    /**
     * 依專案加總，保留第一次出現的順序與 cloudId。
     */
    static Map<String, ProjectUsage> sumByProject(List<ProjectUsage> usages) {
        Map<String, ProjectUsage> byProject = new LinkedHashMap<>();
        for (ProjectUsage usage : usages) {
            byProject.merge(usage.projectName(), usage, ProjectUsage::plus);
        }
        return byProject;
    }
}
