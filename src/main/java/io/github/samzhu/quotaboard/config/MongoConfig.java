package io.github.samzhu.quotaboard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code daily_project_usage} - 專案日用量累計</li>
 *   <li>{@code project_quota} - 專案配額</li>
 *   <li>{@code namespace_quota} - 命名空間 ResourceQuota 快照</li>
 * </ul>
 *
 * <p>{@code java.time} 型別使用 driver 原生 codec，{@code LocalDate} 以 UTC 午夜的 BSON date 儲存。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.quotaboard.repository")
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return MongoCustomConversions.create(adapter -> adapter.useNativeDriverJavaTimeCodecs());
    }
}
