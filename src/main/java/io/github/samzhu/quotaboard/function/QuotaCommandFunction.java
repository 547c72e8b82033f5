package io.github.samzhu.quotaboard.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.quotaboard.dto.ImportResult;
import io.github.samzhu.quotaboard.dto.QuotaCommand;
import io.github.samzhu.quotaboard.service.ProjectQuotaService;

/**
 * 專案配額管理指令消費者配置。
 *
 * <p>管理端以 CloudEvents 發送 {@link QuotaCommand}，新增、更新、刪除或批次匯入專案配額。
 *
 * <p>Binding name: {@code quotaCommandConsumer-in-0}
 */
@Configuration
public class QuotaCommandFunction {

    private static final Logger log = LoggerFactory.getLogger(QuotaCommandFunction.class);

    private final ProjectQuotaService quotaService;

    public QuotaCommandFunction(ProjectQuotaService quotaService) {
        this.quotaService = quotaService;
    }

    /**
     * 配額指令消費者 Bean。
     *
     * <p>錯誤處理：不重新拋出例外。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<QuotaCommand>> quotaCommandConsumer() {
        return message -> {
            try {
                QuotaCommand command = message.getPayload();

                log.debug("CloudEvent received: id={}, type={}, action={}, cloudId={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    command.action(), command.cloudId());

                apply(command);
            } catch (Exception e) {
                log.error("Failed to process quota command: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
                // 不重新拋出例外，避免訊息重複投遞
            }
        };
    }

    private void apply(QuotaCommand command) {
        if (command.action() == null) {
            throw new IllegalArgumentException("Quota command without action");
        }
        switch (command.action()) {
            case ADD -> {
                require(command.quota() != null, "ADD requires quota");
                if (!quotaService.addQuota(command.quota())) {
                    log.warn("Quota not added, cloudId already exists: {}", command.quota().cloudId());
                }
            }
            case UPDATE -> {
                require(command.cloudId() != null && command.changes() != null, "UPDATE requires cloudId and changes");
                if (quotaService.updateQuota(command.cloudId(), command.changes()).isEmpty()) {
                    log.warn("Quota not updated, cloudId not found: {}", command.cloudId());
                }
            }
            case DELETE -> {
                require(command.cloudId() != null, "DELETE requires cloudId");
                if (!quotaService.deleteQuota(command.cloudId())) {
                    log.warn("Quota not deleted, cloudId not found: {}", command.cloudId());
                }
            }
            case IMPORT -> {
                require(command.quotas() != null, "IMPORT requires quotas");
                ImportResult result = quotaService.importQuotas(command.quotas());
                log.info("Quota import processed: imported={}, updated={}", result.imported(), result.updated());
            }
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
