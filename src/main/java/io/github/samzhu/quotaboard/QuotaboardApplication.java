package io.github.samzhu.quotaboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Quotaboard Service - 叢集資源配額使用率服務。
 *
 * <p>此服務負責：
 * <ul>
 *   <li>接收 CloudEvents 格式的用量報表與同步觸發事件</li>
 *   <li>從 Prometheus 查詢每個 Pod 的單日峰值，依期望副本數去重</li>
 *   <li>從 Kubernetes ResourceQuota 同步命名空間與專案配額</li>
 *   <li>按 (日期, 專案) 累計用量並計算配額使用率</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Scheduler / Uploader → RabbitMQ → Quotaboard Consumer → MongoDB
 *                                        ↓        ↓
 *                                  Prometheus  Kubernetes API
 *                                        ↓
 *                               daily_project_usage (專案日用量)
 *                               project_quota       (專案配額)
 *                               namespace_quota     (命名空間配額快照)
 * </pre>
 *
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/">Spring Cloud Stream</a>
 */
@SpringBootApplication
public class QuotaboardApplication {

    private static final Logger log = LoggerFactory.getLogger(QuotaboardApplication.class);

    public static void main(String[] args) {
        log.info("Starting Quotaboard Service - Cluster Quota Utilization");
        SpringApplication.run(QuotaboardApplication.class, args);
    }
}
