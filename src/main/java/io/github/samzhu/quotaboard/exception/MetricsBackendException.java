package io.github.samzhu.quotaboard.exception;

/**
 * 指標後端（Prometheus）查詢失敗異常。
 *
 * <p>包含 HTTP 錯誤、連線失敗、以及回應 {@code status} 非 {@code success}。
 * 由整合層（{@link io.github.samzhu.quotaboard.service.UsageSyncService}）捕捉，
 * 記錄到同步結果後略過該命名空間，不做重試。
 */
public class MetricsBackendException extends RuntimeException {

    private final String query;

    public MetricsBackendException(String message, String query) {
        super(message);
        this.query = query;
    }

    public MetricsBackendException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
