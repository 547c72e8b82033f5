package io.github.samzhu.quotaboard.service;

import org.springframework.stereotype.Service;

import io.github.samzhu.quotaboard.document.ProjectQuota;
import io.github.samzhu.quotaboard.dto.UsageRate;

/**
 * 配額使用率計算服務。
 *
 * <p>使用率公式：{@code min(usage / cap × 100, 100.0)}
 * <ul>
 *   <li>超額使用時上限為 100.0</li>
 *   <li>配額為 0 或負數時為 0.0</li>
 *   <li>無配額時為 null（{@link UsageRate#absent()}）</li>
 * </ul>
 */
@Service
public class RateCalculator {

    private static final double MAX_RATE = 100.0;

    /**
     * 計算單一維度使用率。
     *
     * @param usage 用量
     * @param cap 配額上限
     * @return 0.0 - 100.0
     */
    public double rate(double usage, double cap) {
        if (cap <= 0) {
            return 0.0;
        }
        return Math.min(usage / cap * 100, MAX_RATE);
    }

    /**
     * 計算 CPU 與記憶體使用率。
     *
     * @param cpuUsage CPU 用量（核心數）
     * @param memoryUsage 記憶體用量 (GiB)
     * @param quota 專案配額，可為 null
     * @return 使用率；quota 為 null 時兩個維度皆為 null
     */
    public UsageRate computeRate(double cpuUsage, double memoryUsage, ProjectQuota quota) {
        if (quota == null) {
            return UsageRate.absent();
        }
        return new UsageRate(
            rate(cpuUsage, quota.cpuQuota()),
            rate(memoryUsage, quota.memoryQuota()));
    }
}
