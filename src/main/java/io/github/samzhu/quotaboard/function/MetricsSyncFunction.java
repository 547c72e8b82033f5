package io.github.samzhu.quotaboard.function;

import java.time.Clock;
import java.time.LocalDate;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.quotaboard.dto.MetricsSyncRequest;
import io.github.samzhu.quotaboard.dto.SyncResult;
import io.github.samzhu.quotaboard.service.QuotaSyncService;
import io.github.samzhu.quotaboard.service.UsageSyncService;

/**
 * 指標同步觸發事件消費者配置。
 *
 * <p>外部排程器每日發布 {@link MetricsSyncRequest}，取代服務內的輪詢迴圈。
 * 需要時先同步命名空間與專案配額，再同步指標用量。
 *
 * <p>Binding name: {@code metricsSyncConsumer-in-0}
 */
@Configuration
public class MetricsSyncFunction {

    private static final Logger log = LoggerFactory.getLogger(MetricsSyncFunction.class);

    private final UsageSyncService usageSyncService;
    private final QuotaSyncService quotaSyncService;
    private final Clock clock;

    public MetricsSyncFunction(UsageSyncService usageSyncService, QuotaSyncService quotaSyncService,
            ObjectProvider<Clock> clock) {
        this.usageSyncService = usageSyncService;
        this.quotaSyncService = quotaSyncService;
        this.clock = clock.getIfAvailable(Clock::systemUTC);
    }

    /**
     * 指標同步消費者 Bean。
     *
     * <p>未指定日期時同步昨天 (UTC)。錯誤處理：不重新拋出例外。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<MetricsSyncRequest>> metricsSyncConsumer() {
        return message -> {
            try {
                MetricsSyncRequest request = message.getPayload();
                LocalDate date = request.date() != null ? request.date() : LocalDate.now(clock).minusDays(1);

                log.debug("CloudEvent received: id={}, type={}, date={}, syncQuotas={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    date, request.syncQuotas());

                if (request.syncQuotas()) {
                    SyncResult namespaces = quotaSyncService.syncNamespaceQuotas();
                    SyncResult projects = quotaSyncService.syncProjectQuotas();
                    log.info("Quotas synced: namespaces={}/{}, projects={}/{}",
                        namespaces.imported(), namespaces.updated(), projects.imported(), projects.updated());
                }

                SyncResult result = usageSyncService.syncMetricsUsage(date);
                if (!result.success() || !result.errors().isEmpty()) {
                    log.warn("Metrics sync for {} finished with errors: {}", date, result.errors());
                }
            } catch (Exception e) {
                log.error("Failed to process metrics sync: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
                // 不重新拋出例外，避免訊息重複投遞
            }
        };
    }
}
