package io.github.samzhu.quotaboard.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotaboard.client.ClusterContext;
import io.github.samzhu.quotaboard.client.ClusterRegistry;
import io.github.samzhu.quotaboard.config.QuotaboardProperties;
import io.github.samzhu.quotaboard.document.NamespaceQuota;
import io.github.samzhu.quotaboard.dto.NamespaceUsage;
import io.github.samzhu.quotaboard.dto.PodSample;
import io.github.samzhu.quotaboard.dto.ProjectUsage;
import io.github.samzhu.quotaboard.dto.SyncResult;
import io.github.samzhu.quotaboard.exception.ClusterAccessException;
import io.github.samzhu.quotaboard.exception.MetricsBackendException;
import io.github.samzhu.quotaboard.store.UsageMergeStore;

/**
 * 指標用量同步服務。
 *
 * <p>依序處理每個設定的叢集，針對叢集中每個命名空間：
 * <ol>
 *   <li>查詢 workload 期望副本數（失敗時不截斷）</li>
 *   <li>查詢日結束時間點的 Pod 峰值（失敗時記錄錯誤並略過該命名空間）</li>
 *   <li>以 {@link ReplicaAwareAggregator} 去重聚合</li>
 *   <li>解析所屬專案，以 cloudId {@code {cluster}__{namespace}} 合併到 {@link UsageMergeStore}</li>
 * </ol>
 *
 * <p>每個叢集各自合併一次。單一命名空間或叢集失敗不影響其他命名空間或叢集。
 */
@Service
public class UsageSyncService {

    private static final Logger log = LoggerFactory.getLogger(UsageSyncService.class);

    private final ClusterRegistry clusters;
    private final ReplicaAwareAggregator aggregator;
    private final UsageMergeStore store;
    private final String lookbackWindow;

    public UsageSyncService(
            ClusterRegistry clusters,
            ReplicaAwareAggregator aggregator,
            UsageMergeStore store,
            QuotaboardProperties properties) {
        this.clusters = clusters;
        this.aggregator = aggregator;
        this.store = store;
        this.lookbackWindow = properties.aggregation().lookbackWindow();
    }

    /**
     * 同步所有叢集指定日期的指標用量。
     *
     * @param date 日期，峰值於該日 24:00 (UTC) 評估
     * @return 同步結果；所有叢集都無法列出命名空間時 {@code success} 為 false
     */
    public SyncResult syncMetricsUsage(LocalDate date) {
        long startTime = System.currentTimeMillis();
        Instant at = date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        int merged = 0;
        int reachable = 0;
        List<String> errors = new ArrayList<>();
        for (ClusterContext cluster : clusters.all()) {
            List<String> namespaces;
            try {
                namespaces = cluster.cluster().listNamespaces();
            } catch (ClusterAccessException e) {
                log.error("Metrics sync skipped cluster {}: {}", e.getClusterName(), e.getMessage(), e);
                errors.add(e.getMessage());
                continue;
            }
            reachable++;
            merged += syncCluster(cluster, namespaces, date, at, errors);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Metrics sync completed: date={}, clusters={}/{}, merged={}, errors={}, duration={}ms",
            date, reachable, clusters.all().size(), merged, errors.size(), duration);
        return new SyncResult(reachable > 0, merged, 0, errors);
    }

    private int syncCluster(ClusterContext cluster, List<String> namespaces, LocalDate date, Instant at,
            List<String> errors) {
        List<ProjectUsage> usages = new ArrayList<>();

        for (String namespace : namespaces) {
            Map<String, Integer> replicas = expectedReplicas(cluster, namespace);

            List<PodSample> samples;
            try {
                samples = cluster.metrics().getPodPeaks(namespace, lookbackWindow, at);
            } catch (MetricsBackendException e) {
                log.error("Failed to fetch pod peaks: cluster={}, namespace={}, error={}",
                    cluster.name(), namespace, e.getMessage(), e);
                log.debug("Failed query: {}", e.getQuery());
                errors.add(cluster.name() + "/" + namespace + ": " + e.getMessage());
                continue;
            }

            NamespaceUsage usage = aggregator.aggregateNamespaceUsage(namespace, samples, replicas);

            String projectName;
            try {
                projectName = cluster.cluster().getProjectName(namespace);
            } catch (ClusterAccessException e) {
                log.warn("Could not resolve project of {}/{}, using namespace name: {}",
                    e.getClusterName(), namespace, e.getMessage());
                projectName = namespace;
            }

            usages.add(new ProjectUsage(
                projectName,
                NamespaceQuota.createId(cluster.name(), namespace),
                usage.cpuCores(),
                usage.memoryGib()));
            log.debug("Namespace usage: cluster={}, namespace={}, project={}, cpu={}, memory={}",
                cluster.name(), namespace, projectName, usage.cpuCores(), usage.memoryGib());
        }

        store.merge(date, usages);
        log.debug("Cluster usage merged: cluster={}, namespaces={}, merged={}",
            cluster.name(), namespaces.size(), usages.size());
        return usages.size();
    }

    private Map<String, Integer> expectedReplicas(ClusterContext cluster, String namespace) {
        try {
            return cluster.replicas().getExpectedReplicas(namespace);
        } catch (ClusterAccessException e) {
            log.warn("Replica lookup failed for {}/{}, aggregating without truncation: {}",
                e.getClusterName(), namespace, e.getMessage());
            return Map.of();
        }
    }
}
