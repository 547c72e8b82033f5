package io.github.samzhu.quotaboard.dto;

import java.time.LocalDate;

/**
 * 指標同步觸發事件（CloudEvents data payload）。
 *
 * <p>由外部排程器（例如 Cloud Scheduler）每日發布，取代服務內部的輪詢迴圈。
 *
 * @param date 要同步的日期，null 表示昨天 (UTC)
 * @param syncQuotas 是否同時同步命名空間配額
 */
public record MetricsSyncRequest(
    LocalDate date,
    boolean syncQuotas
) {}
