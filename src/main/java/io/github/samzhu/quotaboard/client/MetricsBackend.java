package io.github.samzhu.quotaboard.client;

import java.time.Instant;
import java.util.List;

import io.github.samzhu.quotaboard.dto.PodSample;

/**
 * 查詢 Pod 資源峰值的指標後端。
 *
 * @see PrometheusMetricsClient
 */
public interface MetricsBackend {

    /**
     * 取得命名空間內每個 Pod 在回溯窗口內的 CPU / 記憶體峰值。
     *
     * @param namespace 命名空間
     * @param window 回溯窗口，PromQL duration 格式（例如 {@code 1d}）
     * @param at 評估時間點，窗口為 {@code (at - window, at]}
     * @return 每個 Pod 一筆樣本，缺少的維度為 0
     * @throws io.github.samzhu.quotaboard.exception.MetricsBackendException 查詢失敗
     */
    List<PodSample> getPodPeaks(String namespace, String window, Instant at);
}
