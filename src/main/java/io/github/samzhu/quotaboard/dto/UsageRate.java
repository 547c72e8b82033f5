package io.github.samzhu.quotaboard.dto;

/**
 * 用量佔配額的百分比。
 *
 * <p>{@code null} 代表「沒有配置配額」，與配額為 0（使用率 0.0）區分。
 *
 * @param cpuRate CPU 使用率 (0.0 - 100.0)，無配額時為 null
 * @param memoryRate 記憶體使用率 (0.0 - 100.0)，無配額時為 null
 */
public record UsageRate(
    Double cpuRate,
    Double memoryRate
) {
    /**
     * 建立「無配額」的使用率。
     */
    public static UsageRate absent() {
        return new UsageRate(null, null);
    }

    /**
     * 是否有對應的配額。
     */
    public boolean isPresent() {
        return cpuRate != null || memoryRate != null;
    }
}
