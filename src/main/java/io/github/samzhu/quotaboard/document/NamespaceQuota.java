package io.github.samzhu.quotaboard.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 命名空間 ResourceQuota 快照文件。
 *
 * <p>從叢集同步的 hard（上限）與 used（已使用）值，已正規化單位：
 * <ul>
 *   <li>CPU - 核心數</li>
 *   <li>記憶體、儲存空間 - GiB</li>
 *   <li>Pod 數 - 整數</li>
 * </ul>
 *
 * <p>文件 ID 格式：{@code {clusterName}__{namespace}}
 */
@Document(collection = "namespace_quota")
public record NamespaceQuota(
    @Id String id,
    @Indexed String clusterName,
    String namespace,
    String projectName,
    double cpuLimit,
    double memoryLimit,
    double cpuUsed,
    double memoryUsed,
    long podsLimit,
    long podsUsed,
    double storageLimit,
    double storageUsed,
    Instant lastSyncedAt
) {
    /**
     * 產生複合主鍵。
     *
     * @param clusterName 叢集名稱
     * @param namespace 命名空間
     * @return 複合 ID，格式為 {@code clusterName__namespace}
     */
    public static String createId(String clusterName, String namespace) {
        return clusterName + "__" + namespace;
    }
}
