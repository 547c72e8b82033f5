package io.github.samzhu.quotaboard.store;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import io.github.samzhu.quotaboard.document.DailyProjectUsage;
import io.github.samzhu.quotaboard.dto.ProjectUsage;
import io.github.samzhu.quotaboard.repository.DailyProjectUsageRepository;

/**
 * MongoDB 日用量累計儲存。
 *
 * <p>每個 (日期, 專案) 一份 {@code daily_project_usage} 文件，以 bulk upsert 寫入：
 * <ul>
 *   <li>{@code $setOnInsert} - date、projectName、cloudId（第一次寫入時決定）</li>
 *   <li>{@code $inc} - cpuUsage、memoryUsage、contributionCount</li>
 *   <li>{@code $set} - lastUpdatedAt</li>
 * </ul>
 *
 * <p>單一文件的 {@code $inc} 是原子操作，多個同時進行的 merge 不會遺失更新。
 *
 * @see <a href="https://www.mongodb.com/docs/manual/reference/operator/update/inc/">MongoDB $inc</a>
 */
@Component
@ConditionalOnProperty(prefix = "quotaboard.store", name = "type", havingValue = "mongo", matchIfMissing = true)
public class MongoUsageMergeStore implements UsageMergeStore {

    private static final Logger log = LoggerFactory.getLogger(MongoUsageMergeStore.class);

    private final MongoTemplate mongoTemplate;
    private final DailyProjectUsageRepository repository;

    public MongoUsageMergeStore(MongoTemplate mongoTemplate, DailyProjectUsageRepository repository) {
        this.mongoTemplate = mongoTemplate;
        this.repository = repository;
    }

    @Override
    public void merge(LocalDate date, List<ProjectUsage> usages) {
        if (usages == null || usages.isEmpty()) {
            log.debug("No usage to merge for {}", date);
            return;
        }

        Map<String, ProjectUsage> byProject = UsageMergeStore.sumByProject(usages);
        BulkOperations bulkOps = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, DailyProjectUsage.class);

        byProject.forEach((projectName, usage) -> {
            Query query = Query.query(Criteria.where("_id").is(DailyProjectUsage.createId(date, projectName)));
            Update update = new Update()
                .setOnInsert("date", date)
                .setOnInsert("projectName", projectName)
                .setOnInsert("cloudId", usage.cloudId())
                .inc("cpuUsage", usage.cpuUsage())
                .inc("memoryUsage", usage.memoryUsage())
                .inc("contributionCount", 1)
                .set("lastUpdatedAt", Instant.now());
            bulkOps.upsert(query, update);
        });

        bulkOps.execute();
        log.debug("Merged daily project usage: date={}, projects={}", date, byProject.size());
    }

    @Override
    public List<DailyProjectUsage> getUsage(LocalDate date) {
        return repository.findByDateOrderByProjectNameAsc(date);
    }

    /**
     * distinct 直接回傳 BSON date，不經過實體轉換，於此以 UTC 還原日期。
     */
    @Override
    public List<LocalDate> getDates() {
        return mongoTemplate.findDistinct(new Query(), "date", DailyProjectUsage.class, Date.class)
            .stream()
            .map(MongoUsageMergeStore::toLocalDate)
            .distinct()
            .sorted(Comparator.naturalOrder())
            .toList();
    }

    static LocalDate toLocalDate(Date date) {
        return date.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
    }
}
