package io.github.samzhu.quotaboard.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotaboard.config.QuotaboardProperties;
import io.github.samzhu.quotaboard.dto.NamespaceUsage;
import io.github.samzhu.quotaboard.dto.PodSample;
import io.github.samzhu.quotaboard.util.WorkloadKeys;

/**
 * 依期望副本數去重的命名空間用量聚合。
 *
 * <p>單日峰值查詢會包含滾動更新期間並存的新舊 Pod。若直接加總，
 * 一次部署就會讓當天用量翻倍。此服務依 workload 分組後，每組最多保留
 * {@code floor(期望副本數 × toleranceFactor)} 個最高峰值：
 * <pre>
 * replicas=2, factor=1.5 → 保留 3 個
 * CPU 峰值 [1.0, 1.0, 1.0, 0.9, 0.9] → 1.0 + 1.0 + 1.0 = 3.0
 * </pre>
 *
 * <p>CPU 與記憶體各自排序、各自截斷，保留的不一定是同一批 Pod。
 * 期望副本數未知或為 0 時不截斷。
 *
 * @see WorkloadKeys
 */
@Service
public class ReplicaAwareAggregator {

    private static final Logger log = LoggerFactory.getLogger(ReplicaAwareAggregator.class);

    private final double toleranceFactor;

    public ReplicaAwareAggregator(QuotaboardProperties properties) {
        this.toleranceFactor = properties.aggregation().toleranceFactor();
    }

    /**
     * 聚合命名空間用量。
     *
     * @param namespace 命名空間
     * @param samples Pod 峰值樣本，null 視為空
     * @param expectedReplicas workload key → 期望副本數，null 視為空
     * @return 去重後的命名空間用量
     */
    public NamespaceUsage aggregateNamespaceUsage(String namespace, List<PodSample> samples,
            Map<String, Integer> expectedReplicas) {
        if (samples == null || samples.isEmpty()) {
            return NamespaceUsage.empty(namespace);
        }
        Map<String, Integer> replicas = expectedReplicas != null ? expectedReplicas : Map.of();

        Map<String, List<PodSample>> byWorkload = new LinkedHashMap<>();
        for (PodSample sample : samples) {
            byWorkload.computeIfAbsent(WorkloadKeys.of(sample.podName()), k -> new ArrayList<>()).add(sample);
        }

        double totalCpu = 0.0;
        double totalMemory = 0.0;
        for (Map.Entry<String, List<PodSample>> entry : byWorkload.entrySet()) {
            List<PodSample> pods = entry.getValue();
            Integer desired = replicas.get(entry.getKey());
            int expected = desired != null ? desired : 0;
            int allowed = allowedPods(expected, pods.size());

            if (pods.size() > allowed) {
                log.debug("Truncating workload {}/{}: observed={}, expected={}, allowed={}",
                    namespace, entry.getKey(), pods.size(), expected, allowed);
            }

            totalCpu += sumTop(pods.stream().map(PodSample::cpuPeakCores).toList(), allowed);
            totalMemory += sumTop(pods.stream().map(PodSample::memoryPeakGib).toList(), allowed);
        }

        return new NamespaceUsage(namespace, totalCpu, totalMemory);
    }

    /**
     * 計算允許保留的 Pod 數。
     */
    int allowedPods(int expected, int observed) {
        if (expected <= 0) {
            return observed;
        }
        return (int) Math.floor(expected * toleranceFactor);
    }

    private static double sumTop(List<Double> values, int limit) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Collections.reverseOrder(Comparator.<Double>naturalOrder()));
        double sum = 0.0;
        for (int i = 0; i < Math.min(limit, sorted.size()); i++) {
            sum += sorted.get(i);
        }
        return sum;
    }
}
