package io.github.samzhu.quotaboard.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quotaboard.document.NamespaceQuota;

/**
 * 命名空間配額快照資料存取介面。
 */
public interface NamespaceQuotaRepository extends MongoRepository<NamespaceQuota, String> {

    /**
     * 查詢叢集內所有命名空間配額，依命名空間排序。
     *
     * @param clusterName 叢集名稱
     * @return 命名空間配額列表
     */
    List<NamespaceQuota> findByClusterNameOrderByNamespaceAsc(String clusterName);
}
