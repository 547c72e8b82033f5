package io.github.samzhu.quotaboard.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quotaboard.document.ProjectQuota;

/**
 * 專案配額資料存取介面，主鍵為 {@code cloudId}。
 */
public interface ProjectQuotaRepository extends MongoRepository<ProjectQuota, String> {

    /**
     * 依專案名稱查詢配額。若多筆配額對應同一專案，回傳第一筆。
     *
     * @param projectName 專案名稱
     * @return 配額（如存在）
     */
    Optional<ProjectQuota> findFirstByProjectName(String projectName);
}
