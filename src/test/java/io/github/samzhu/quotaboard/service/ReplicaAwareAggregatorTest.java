package io.github.samzhu.quotaboard.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.quotaboard.config.QuotaboardProperties;
import io.github.samzhu.quotaboard.config.QuotaboardProperties.AggregationConfig;
import io.github.samzhu.quotaboard.dto.NamespaceUsage;
import io.github.samzhu.quotaboard.dto.PodSample;

class ReplicaAwareAggregatorTest {

    private ReplicaAwareAggregator aggregator;

    @BeforeEach
    void setUp() {
        QuotaboardProperties properties = new QuotaboardProperties(
            AggregationConfig.defaults(), null, null, null);
        aggregator = new ReplicaAwareAggregator(properties);
    }

    @Test
    void shouldKeepTopPeaksDuringRollingUpdate() {
        // Given: 2 個期望副本，滾動更新期間觀察到 5 個 Pod
        List<PodSample> samples = List.of(
            pod("web-0", 1.0, 2.0),
            pod("web-1", 1.0, 2.0),
            pod("web-2", 1.0, 2.0),
            pod("web-3", 0.9, 1.0),
            pod("web-4", 0.9, 1.0));

        // When
        NamespaceUsage usage = aggregator.aggregateNamespaceUsage("shop", samples, Map.of("web", 2));

        // Then: floor(2 × 1.5) = 3
        assertThat(usage.cpuCores()).isCloseTo(3.0, within(1e-9));
        assertThat(usage.memoryGib()).isCloseTo(6.0, within(1e-9));
    }

    @Test
    void shouldNotTruncateWhenReplicasUnknownOrZero() {
        // Given
        List<PodSample> samples = List.of(
            pod("worker-0", 0.5, 1.0),
            pod("worker-1", 0.5, 1.0),
            pod("worker-2", 0.5, 1.0),
            pod("worker-3", 0.5, 1.0));

        // When
        NamespaceUsage zero = aggregator.aggregateNamespaceUsage("batch", samples, Map.of("worker", 0));
        NamespaceUsage unknown = aggregator.aggregateNamespaceUsage("batch", samples, Map.of());

        // Then
        assertThat(zero.cpuCores()).isCloseTo(2.0, within(1e-9));
        assertThat(unknown.cpuCores()).isCloseTo(2.0, within(1e-9));
        assertThat(unknown.memoryGib()).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void shouldTruncateCpuAndMemoryIndependently() {
        // Given: 期望 1 副本 → 保留 1 個；CPU 最高與記憶體最高來自不同 Pod
        List<PodSample> samples = List.of(
            pod("db-0", 2.0, 1.0),
            pod("db-1", 0.5, 8.0));

        // When
        NamespaceUsage usage = aggregator.aggregateNamespaceUsage("data", samples, Map.of("db", 1));

        // Then
        assertThat(usage.cpuCores()).isCloseTo(2.0, within(1e-9));
        assertThat(usage.memoryGib()).isCloseTo(8.0, within(1e-9));
    }

    @Test
    void shouldSumAcrossWorkloads() {
        // Given
        List<PodSample> samples = List.of(
            pod("web-0", 1.0, 1.0),
            pod("web-1", 1.0, 1.0),
            pod("api-0", 0.25, 0.5),
            pod("app-7f9c5d-x2j4k", 0.75, 0.5));

        // When
        NamespaceUsage usage = aggregator.aggregateNamespaceUsage("mixed", samples, Map.of("web", 2, "api", 1));

        // Then
        assertThat(usage.namespace()).isEqualTo("mixed");
        assertThat(usage.cpuCores()).isCloseTo(3.0, within(1e-9));
        assertThat(usage.memoryGib()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void shouldReturnZeroForEmptyOrNullInput() {
        assertThat(aggregator.aggregateNamespaceUsage("empty", List.of(), Map.of()))
            .isEqualTo(NamespaceUsage.empty("empty"));
        assertThat(aggregator.aggregateNamespaceUsage("empty", null, null))
            .isEqualTo(NamespaceUsage.empty("empty"));
    }

    @Test
    void shouldTreatNullReplicaMapAsUnknown() {
        // Given
        List<PodSample> samples = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            samples.add(pod("job-" + i, 1.0, 1.0));
        }

        // When
        NamespaceUsage usage = aggregator.aggregateNamespaceUsage("jobs", samples, null);

        // Then
        assertThat(usage.cpuCores()).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void shouldTreatNullReplicaCountAsUnknown() {
        // Given: controller 存在但副本數為 null
        Map<String, Integer> replicas = new HashMap<>();
        replicas.put("web", null);
        List<PodSample> samples = List.of(
            pod("web-0", 1.0, 2.0),
            pod("web-1", 0.5, 1.0));

        // When
        NamespaceUsage usage = aggregator.aggregateNamespaceUsage("shop", samples, replicas);

        // Then
        assertThat(usage.cpuCores()).isCloseTo(1.5, within(1e-9));
        assertThat(usage.memoryGib()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void shouldUseConfiguredToleranceFactor() {
        // Given
        ReplicaAwareAggregator strict = new ReplicaAwareAggregator(
            new QuotaboardProperties(new AggregationConfig(1.0, "1d"), null, null, null));
        List<PodSample> samples = List.of(
            pod("web-0", 1.0, 1.0),
            pod("web-1", 1.0, 1.0),
            pod("web-2", 1.0, 1.0));

        // When
        NamespaceUsage usage = strict.aggregateNamespaceUsage("shop", samples, Map.of("web", 2));

        // Then
        assertThat(usage.cpuCores()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void allowedPodsShouldFloorExpectedTimesFactor() {
        assertThat(aggregator.allowedPods(2, 5)).isEqualTo(3);
        assertThat(aggregator.allowedPods(3, 5)).isEqualTo(4);
        assertThat(aggregator.allowedPods(0, 5)).isEqualTo(5);
    }

    private static PodSample pod(String name, double cpu, double memory) {
        return new PodSample(name, "test", cpu, memory);
    }
}
