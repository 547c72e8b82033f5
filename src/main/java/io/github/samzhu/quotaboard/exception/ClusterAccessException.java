package io.github.samzhu.quotaboard.exception;

/**
 * Kubernetes API 存取失敗異常。
 */
public class ClusterAccessException extends RuntimeException {

    private final String clusterName;

    public ClusterAccessException(String clusterName, String message, Throwable cause) {
        super(String.format("Cluster '%s': %s", clusterName, message), cause);
        this.clusterName = clusterName;
    }

    public String getClusterName() {
        return clusterName;
    }
}
