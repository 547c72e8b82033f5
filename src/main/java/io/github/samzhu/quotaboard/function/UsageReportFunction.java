package io.github.samzhu.quotaboard.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.quotaboard.dto.SyncResult;
import io.github.samzhu.quotaboard.dto.UsageReportData;
import io.github.samzhu.quotaboard.exception.InvalidReportException;
import io.github.samzhu.quotaboard.service.UsageReportService;

/**
 * 用量報表上傳事件消費者配置。
 *
 * <p>上傳端以 CloudEvents <b>Structured Mode</b> 發送報表內容，
 * Spring Cloud Stream 將 data 轉為 {@link UsageReportData}。
 *
 * <p>Binding name: {@code usageReportConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class UsageReportFunction {

    private static final Logger log = LoggerFactory.getLogger(UsageReportFunction.class);

    private final UsageReportService reportService;

    public UsageReportFunction(UsageReportService reportService) {
        this.reportService = reportService;
    }

    /**
     * 用量報表消費者 Bean。
     *
     * <p>錯誤處理：不重新拋出例外，避免訊息重複投遞造成用量重複累加。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<UsageReportData>> usageReportConsumer() {
        return message -> {
            try {
                UsageReportData data = message.getPayload();

                log.debug("CloudEvent received: id={}, type={}, source={}, file={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    CloudEventMessageUtils.getSource(message),
                    data.fileName());

                SyncResult result = reportService.ingestReport(data.fileName(), data.content());

                log.info("Usage report processed: file={}, lines={}, skipped={}",
                    data.fileName(), result.imported(), result.errors().size());
            } catch (InvalidReportException e) {
                log.warn("Usage report rejected: id={}, file={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getFileName(), e.getMessage());
            } catch (Exception e) {
                log.error("Failed to process usage report: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
                // 不重新拋出例外，避免訊息重複投遞
            }
        };
    }
}
