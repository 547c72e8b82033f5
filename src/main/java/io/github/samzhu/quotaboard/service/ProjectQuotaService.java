package io.github.samzhu.quotaboard.service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotaboard.document.ProjectQuota;
import io.github.samzhu.quotaboard.dto.ImportResult;
import io.github.samzhu.quotaboard.dto.QuotaUpdate;
import io.github.samzhu.quotaboard.repository.ProjectQuotaRepository;

/**
 * 專案配額管理服務。
 *
 * <p>提供配額的新增、部分更新、刪除與批次匯入（由 {@code quotaCommandConsumer} 觸發），
 * 並作為報表的 {@link QuotaLookup}。
 */
@Service
public class ProjectQuotaService implements QuotaLookup {

    private static final Logger log = LoggerFactory.getLogger(ProjectQuotaService.class);

    private final ProjectQuotaRepository repository;

    public ProjectQuotaService(ProjectQuotaRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<ProjectQuota> getQuota(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        Optional<ProjectQuota> byCloudId = repository.findById(identifier);
        if (byCloudId.isPresent()) {
            return byCloudId;
        }
        return repository.findFirstByProjectName(identifier);
    }

    /**
     * 新增配額。
     *
     * @param quota 配額
     * @return cloudId 已存在時為 false，不覆寫
     */
    public boolean addQuota(ProjectQuota quota) {
        if (repository.existsById(quota.cloudId())) {
            log.warn("Quota already exists: cloudId={}", quota.cloudId());
            return false;
        }
        repository.save(withTimestamp(quota));
        log.info("Quota added: cloudId={}, project={}, cpu={}, memory={}",
            quota.cloudId(), quota.projectName(), quota.cpuQuota(), quota.memoryQuota());
        return true;
    }

    /**
     * 部分更新配額，只變更非 null 欄位。
     *
     * @param cloudId 外部識別碼
     * @param update 更新內容
     * @return 更新後的配額，不存在時為 empty
     */
    public Optional<ProjectQuota> updateQuota(String cloudId, QuotaUpdate update) {
        return repository.findById(cloudId).map(existing -> {
            ProjectQuota updated = new ProjectQuota(
                existing.cloudId(),
                update.projectName() != null ? update.projectName() : existing.projectName(),
                update.cpuQuota() != null ? update.cpuQuota() : existing.cpuQuota(),
                update.memoryQuota() != null ? update.memoryQuota() : existing.memoryQuota(),
                Instant.now());
            log.info("Quota updated: cloudId={}", cloudId);
            return repository.save(updated);
        });
    }

    /**
     * 刪除配額。
     *
     * @return 配額不存在時為 false
     */
    public boolean deleteQuota(String cloudId) {
        if (!repository.existsById(cloudId)) {
            return false;
        }
        repository.deleteById(cloudId);
        log.info("Quota deleted: cloudId={}", cloudId);
        return true;
    }

    /**
     * 批次匯入配額，已存在的 cloudId 會被覆寫。
     *
     * @param quotas 配額列表
     * @return 新增與覆寫的筆數
     */
    public ImportResult importQuotas(List<ProjectQuota> quotas) {
        int imported = 0;
        int updated = 0;
        for (ProjectQuota quota : quotas) {
            if (repository.existsById(quota.cloudId())) {
                updated++;
            } else {
                imported++;
            }
            repository.save(withTimestamp(quota));
        }
        log.info("Quotas imported: imported={}, updated={}", imported, updated);
        return new ImportResult(imported, updated);
    }

    private static ProjectQuota withTimestamp(ProjectQuota quota) {
        return new ProjectQuota(quota.cloudId(), quota.projectName(), quota.cpuQuota(), quota.memoryQuota(),
            Instant.now());
    }
}
