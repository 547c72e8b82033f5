package io.github.samzhu.quotaboard.store;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import io.github.samzhu.quotaboard.document.DailyProjectUsage;
import io.github.samzhu.quotaboard.dto.ProjectUsage;

/**
 * 記憶體內的日用量累計儲存，適用於本地開發與測試。
 *
 * <p>以 {@link ConcurrentHashMap#merge} 累加，單一 key 的更新是原子操作。
 * 服務重啟後資料即消失。
 */
@Component
@ConditionalOnProperty(prefix = "quotaboard.store", name = "type", havingValue = "memory")
public class InMemoryUsageMergeStore implements UsageMergeStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUsageMergeStore.class);

    private final Map<String, DailyProjectUsage> usages = new ConcurrentHashMap<>();

    public InMemoryUsageMergeStore() {
        log.info("Using in-memory usage store, data is lost on restart");
    }

    @Override
    public void merge(LocalDate date, List<ProjectUsage> contributions) {
        if (contributions == null || contributions.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        UsageMergeStore.sumByProject(contributions).forEach((projectName, usage) -> {
            String id = DailyProjectUsage.createId(date, projectName);
            DailyProjectUsage contribution = new DailyProjectUsage(
                id, date, projectName, usage.cloudId(), usage.cpuUsage(), usage.memoryUsage(), 1, now);
            usages.merge(id, contribution, DailyProjectUsage::plus);
        });
        log.debug("Merged daily project usage: date={}, contributions={}", date, contributions.size());
    }

    @Override
    public List<DailyProjectUsage> getUsage(LocalDate date) {
        return usages.values().stream()
            .filter(usage -> usage.date().equals(date))
            .sorted(Comparator.comparing(DailyProjectUsage::projectName))
            .toList();
    }

    @Override
    public List<LocalDate> getDates() {
        return usages.values().stream()
            .map(DailyProjectUsage::date)
            .distinct()
            .sorted()
            .toList();
    }
}
