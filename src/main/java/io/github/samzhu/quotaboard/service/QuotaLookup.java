package io.github.samzhu.quotaboard.service;

import java.util.Optional;

import io.github.samzhu.quotaboard.document.ProjectQuota;

/**
 * 專案配額查詢。
 *
 * @see ProjectQuotaService
 */
public interface QuotaLookup {

    /**
     * 依識別碼查詢配額，先比對 cloudId，再比對專案名稱。
     *
     * @param identifier cloudId 或專案名稱
     * @return 配額（如存在）
     */
    Optional<ProjectQuota> getQuota(String identifier);
}
