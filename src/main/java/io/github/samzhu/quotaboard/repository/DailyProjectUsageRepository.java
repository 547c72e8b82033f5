package io.github.samzhu.quotaboard.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quotaboard.document.DailyProjectUsage;

/**
 * 專案日用量資料存取介面。
 *
 * <p>提供對 {@code daily_project_usage} 集合的查詢。寫入透過
 * {@link io.github.samzhu.quotaboard.store.MongoUsageMergeStore} 使用
 * MongoTemplate bulk upsert ({@code $inc}) 完成。
 *
 * @see io.github.samzhu.quotaboard.document.DailyProjectUsage
 */
public interface DailyProjectUsageRepository extends MongoRepository<DailyProjectUsage, String> {

    /**
     * 查詢指定日期的所有專案用量，依專案名稱排序。
     *
     * @param date 日期
     * @return 該日的專案用量列表
     */
    List<DailyProjectUsage> findByDateOrderByProjectNameAsc(LocalDate date);
}
