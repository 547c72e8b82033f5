package io.github.samzhu.quotaboard.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotaboard.document.DailyProjectUsage;
import io.github.samzhu.quotaboard.document.NamespaceQuota;
import io.github.samzhu.quotaboard.document.ProjectQuota;
import io.github.samzhu.quotaboard.dto.NamespaceUtilization;
import io.github.samzhu.quotaboard.dto.ProjectUsageReport;
import io.github.samzhu.quotaboard.dto.UsageRate;
import io.github.samzhu.quotaboard.repository.NamespaceQuotaRepository;
import io.github.samzhu.quotaboard.store.UsageMergeStore;

/**
 * 用量報表查詢服務。
 */
@Service
public class UsageReportQueryService {

    private static final Logger log = LoggerFactory.getLogger(UsageReportQueryService.class);

    private final UsageMergeStore store;
    private final QuotaLookup quotaLookup;
    private final RateCalculator rateCalculator;
    private final NamespaceQuotaRepository namespaceQuotaRepository;

    public UsageReportQueryService(
            UsageMergeStore store,
            QuotaLookup quotaLookup,
            RateCalculator rateCalculator,
            NamespaceQuotaRepository namespaceQuotaRepository) {
        this.store = store;
        this.quotaLookup = quotaLookup;
        this.rateCalculator = rateCalculator;
        this.namespaceQuotaRepository = namespaceQuotaRepository;
    }

    /**
     * 取得指定日期的專案用量報表。
     *
     * <p>以專案名稱查詢配額並計算使用率；有配額時以配額的 cloudId 取代累計紀錄上的 cloudId。
     *
     * @param date 日期
     * @return 依專案名稱排序的報表列
     */
    public List<ProjectUsageReport> getReport(LocalDate date) {
        return store.getUsage(date).stream()
            .map(usage -> toReport(date, usage))
            .toList();
    }

    /**
     * 取得所有有資料的日期，由舊到新。
     */
    public List<LocalDate> getReportDates() {
        return store.getDates();
    }

    /**
     * 取得叢集內各命名空間 ResourceQuota 的使用率。
     *
     * @param clusterName 叢集名稱
     * @return 依命名空間排序的使用率
     */
    public List<NamespaceUtilization> getNamespaceUtilization(String clusterName) {
        return namespaceQuotaRepository.findByClusterNameOrderByNamespaceAsc(clusterName).stream()
            .map(this::toUtilization)
            .toList();
    }

    private ProjectUsageReport toReport(LocalDate date, DailyProjectUsage usage) {
        Optional<ProjectQuota> quota = quotaLookup.getQuota(usage.projectName());
        UsageRate rate = rateCalculator.computeRate(usage.cpuUsage(), usage.memoryUsage(), quota.orElse(null));
        if (!rate.isPresent()) {
            log.debug("No quota for project {} on {}, rates left empty", usage.projectName(), date);
        }
        String cloudId = quota.map(ProjectQuota::cloudId).orElse(usage.cloudId());
        return new ProjectUsageReport(
            date,
            usage.projectName(),
            cloudId,
            usage.cpuUsage(),
            usage.memoryUsage(),
            rate.cpuRate(),
            rate.memoryRate());
    }

    private NamespaceUtilization toUtilization(NamespaceQuota quota) {
        return new NamespaceUtilization(
            quota.clusterName(),
            quota.namespace(),
            quota.projectName(),
            rateCalculator.rate(quota.cpuUsed(), quota.cpuLimit()),
            rateCalculator.rate(quota.memoryUsed(), quota.memoryLimit()),
            rateCalculator.rate(quota.podsUsed(), quota.podsLimit()),
            rateCalculator.rate(quota.storageUsed(), quota.storageLimit()));
    }
}
