package io.github.samzhu.quotaboard.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Quotaboard 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link AggregationConfig} - 副本數去重的容忍係數與峰值回溯窗口</li>
 *   <li>{@link PrometheusConfig} - 指標後端連線設定</li>
 *   <li>{@link ClusterConfig} - 每個 Kubernetes 叢集的連線、指標來源與命名空間過濾</li>
 *   <li>{@link StoreConfig} - 日用量累計儲存方式</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * quotaboard:
 *   aggregation:
 *     tolerance-factor: 1.5
 *     lookback-window: 1d
 *   prometheus:
 *     url: http://prometheus.monitoring:9090
 *     timeout: 30s
 *   clusters:
 *     - name: prod-01
 *       kubeconfig-path: /etc/quotaboard/prod-01.kubeconfig
 *       excluded-namespace-prefixes: [kube-]
 *       project-label: cpaas.io/project
 *       project-quota-source: projectquota
 *     - name: prod-02
 *       kubeconfig-path: /etc/quotaboard/prod-02.kubeconfig
 *       prometheus-url: http://prometheus.prod-02:9090
 *   store:
 *     type: mongo
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "quotaboard")
public record QuotaboardProperties(
    AggregationConfig aggregation,
    PrometheusConfig prometheus,
    List<ClusterConfig> clusters,
    StoreConfig store
) {
    public QuotaboardProperties {
        if (aggregation == null) {
            aggregation = AggregationConfig.defaults();
        }
        if (prometheus == null) {
            prometheus = PrometheusConfig.defaults();
        }
        if (clusters == null || clusters.isEmpty()) {
            clusters = List.of(ClusterConfig.defaults());
        }
        if (store == null) {
            store = StoreConfig.defaults();
        }
    }

    /**
     * 副本數去重設定。
     *
     * <p>滾動更新期間新舊 ReplicaSet 會短暫並存，單日峰值查詢可能回傳兩倍以上的 Pod。
     * 每個 workload 最多保留 {@code floor(期望副本數 × toleranceFactor)} 個最高峰值。
     *
     * @param toleranceFactor 容忍係數，預設 1.5，小於 1 時使用預設值
     * @param lookbackWindow 峰值回溯窗口（PromQL duration），預設 {@code 1d}
     */
    public record AggregationConfig(
        double toleranceFactor,
        String lookbackWindow
    ) {
        public AggregationConfig {
            if (toleranceFactor < 1.0) {
                toleranceFactor = 1.5;
            }
            if (lookbackWindow == null || lookbackWindow.isBlank()) {
                lookbackWindow = "1d";
            }
        }

        /**
         * 建立預設去重設定。
         */
        public static AggregationConfig defaults() {
            return new AggregationConfig(1.5, "1d");
        }
    }

    /**
     * Prometheus 連線設定。
     *
     * @param url Prometheus HTTP API 位址
     * @param timeout 連線與讀取逾時，預設 30 秒
     */
    public record PrometheusConfig(
        String url,
        Duration timeout
    ) {
        public PrometheusConfig {
            if (url == null || url.isBlank()) {
                url = "http://localhost:9090";
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(30);
            }
        }

        public static PrometheusConfig defaults() {
            return new PrometheusConfig("http://localhost:9090", Duration.ofSeconds(30));
        }
    }

    /**
     * Kubernetes 叢集設定。
     *
     * @param name 叢集名稱，用於組成 cloudId 與命名空間配額 ID
     * @param kubeconfigPath kubeconfig 檔案路徑，空白時使用 fabric8 自動偵測（in-cluster 或 ~/.kube/config）
     * @param prometheusUrl 此叢集的 Prometheus 位址，空白時使用 {@code quotaboard.prometheus.url}
     * @param excludedNamespacePrefixes 略過的命名空間前綴，預設 {@code kube-}
     * @param projectLabel 命名空間上標示所屬專案的 label
     * @param projectQuotaSource 專案配額來源：{@code projectquota}（預設，讀取
     *        {@code auth.alauda.io/v1} ProjectQuota）或 {@code resourcequota}（命名空間 ResourceQuota）
     */
    public record ClusterConfig(
        String name,
        String kubeconfigPath,
        String prometheusUrl,
        List<String> excludedNamespacePrefixes,
        String projectLabel,
        String projectQuotaSource
    ) {
        public static final String SOURCE_PROJECT_QUOTA = "projectquota";
        public static final String SOURCE_RESOURCE_QUOTA = "resourcequota";

        public ClusterConfig {
            if (name == null || name.isBlank()) {
                name = "default";
            }
            if (excludedNamespacePrefixes == null) {
                excludedNamespacePrefixes = List.of("kube-");
            }
            if (projectLabel == null || projectLabel.isBlank()) {
                projectLabel = "cpaas.io/project";
            }
            if (projectQuotaSource == null || projectQuotaSource.isBlank()) {
                projectQuotaSource = SOURCE_PROJECT_QUOTA;
            }
        }

        public static ClusterConfig defaults() {
            return new ClusterConfig("default", null, null, List.of("kube-"), "cpaas.io/project",
                SOURCE_PROJECT_QUOTA);
        }

        /**
         * 是否指定了 kubeconfig 檔案。
         */
        public boolean hasKubeconfig() {
            return kubeconfigPath != null && !kubeconfigPath.isBlank();
        }

        /**
         * 此叢集使用的 Prometheus 位址。
         */
        public String prometheusUrlOr(String fallback) {
            return prometheusUrl != null && !prometheusUrl.isBlank() ? prometheusUrl : fallback;
        }

        /**
         * 專案配額是否從命名空間 ResourceQuota 推導。
         */
        public boolean usesResourceQuotaForProjects() {
            return SOURCE_RESOURCE_QUOTA.equalsIgnoreCase(projectQuotaSource);
        }
    }

    /**
     * 日用量累計儲存設定。
     *
     * @param type {@code mongo}（預設）或 {@code memory}
     */
    public record StoreConfig(
        String type
    ) {
        public StoreConfig {
            if (type == null || type.isBlank()) {
                type = "mongo";
            }
        }

        public static StoreConfig defaults() {
            return new StoreConfig("mongo");
        }
    }
}
