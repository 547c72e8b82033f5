package io.github.samzhu.quotaboard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>報表上傳與同步觸發事件以 <b>Structured Mode</b>
 * ({@code application/cloudevents+json}) 發送。註冊 {@link CloudEventMessageConverter} 後，
 * Spring Cloud Stream 會將 CloudEvent attributes 轉為 Message Headers，
 * data 轉為型別化的 payload（{@code UsageReportData}、{@code MetricsSyncRequest}）。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
