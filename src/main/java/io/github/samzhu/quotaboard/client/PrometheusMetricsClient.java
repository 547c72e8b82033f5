package io.github.samzhu.quotaboard.client;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.quotaboard.dto.PodSample;
import io.github.samzhu.quotaboard.exception.MetricsBackendException;
import io.github.samzhu.quotaboard.util.QuantityParser;

/**
 * Prometheus HTTP API 指標查詢客戶端。
 *
 * <p>每個命名空間執行兩個 instant query（{@code /api/v1/query}）：
 * <ul>
 *   <li>CPU：每個 Pod 在窗口內的最大 5 分鐘 irate，單位為核心數</li>
 *   <li>記憶體：每個 Pod 在窗口內的最大 {@code container_memory_usage_bytes}，單位為 bytes</li>
 * </ul>
 *
 * <p>兩組結果以 Pod 名稱聯集合併，缺少其中一個維度的 Pod 該維度為 0。
 * 數值字串經由 {@link QuantityParser} 轉換，{@code NaN} 等非數字值視為 0。
 *
 * <p>每個叢集各有一個實例，由 {@link ClusterRegistry} 依叢集的 Prometheus 位址建立。
 *
 * @see <a href="https://prometheus.io/docs/prometheus/latest/querying/api/#instant-queries">Prometheus Instant Queries</a>
 */
public class PrometheusMetricsClient implements MetricsBackend {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsClient.class);

    private static final String CPU_PEAK_QUERY = """
        max by (pod) (max_over_time((irate(container_cpu_usage_seconds_total\
        {namespace="%s", container!="", container!="POD"}[5m]))[%s:]))""";

    private static final String MEMORY_PEAK_QUERY = """
        max by (pod) (max_over_time(container_memory_usage_bytes\
        {namespace="%s", container!="", container!="POD"}[%s]))""";

    private final RestClient restClient;

    public PrometheusMetricsClient(RestClient prometheusRestClient) {
        this.restClient = prometheusRestClient;
    }

    @Override
    public List<PodSample> getPodPeaks(String namespace, String window, Instant at) {
        long startTime = System.currentTimeMillis();

        Map<String, String> cpuPeaks = queryByPod(String.format(CPU_PEAK_QUERY, namespace, window), at);
        Map<String, String> memoryPeaks = queryByPod(String.format(MEMORY_PEAK_QUERY, namespace, window), at);

        Map<String, PodSample> samples = new LinkedHashMap<>();
        cpuPeaks.forEach((pod, value) ->
            samples.put(pod, new PodSample(pod, namespace, QuantityParser.parseCpu(value), 0.0)));
        memoryPeaks.forEach((pod, value) -> {
            double memoryGib = QuantityParser.parseMemory(value);
            PodSample existing = samples.get(pod);
            double cpuCores = existing != null ? existing.cpuPeakCores() : 0.0;
            samples.put(pod, new PodSample(pod, namespace, cpuCores, memoryGib));
        });

        log.debug("Fetched pod peaks: namespace={}, pods={}, window={}, duration={}ms",
            namespace, samples.size(), window, System.currentTimeMillis() - startTime);
        return new ArrayList<>(samples.values());
    }

    /**
     * 執行 instant query，回傳 pod label → 原始數值字串。
     */
    private Map<String, String> queryByPod(String query, Instant at) {
        JsonNode root;
        try {
            root = restClient.get()
                .uri("/api/v1/query?query={query}&time={time}", query, at.getEpochSecond())
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            log.error("Prometheus request failed: query={}, error={}", query, e.getMessage(), e);
            throw new MetricsBackendException("Prometheus request failed: " + e.getMessage(), query, e);
        }

        if (root == null || !"success".equals(root.path("status").asText())) {
            String error = root == null ? "empty response" : root.path("error").asText("unknown error");
            throw new MetricsBackendException("Prometheus query failed: " + error, query);
        }

        Map<String, String> values = new LinkedHashMap<>();
        for (JsonNode item : root.path("data").path("result")) {
            String pod = item.path("metric").path("pod").asText("");
            if (pod.isEmpty()) {
                continue;
            }
            // value = [<unix time>, "<sample value>"]
            values.put(pod, item.path("value").path(1).asText(""));
        }
        return values;
    }
}
