package io.github.samzhu.quotaboard.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotaboard.client.ClusterContext;
import io.github.samzhu.quotaboard.client.ClusterRegistry;
import io.github.samzhu.quotaboard.client.KubernetesClusterClient;
import io.github.samzhu.quotaboard.document.NamespaceQuota;
import io.github.samzhu.quotaboard.document.ProjectQuota;
import io.github.samzhu.quotaboard.dto.SyncResult;
import io.github.samzhu.quotaboard.exception.ClusterAccessException;
import io.github.samzhu.quotaboard.repository.NamespaceQuotaRepository;
import io.github.samzhu.quotaboard.repository.ProjectQuotaRepository;

/**
 * 從各叢集同步配額。
 *
 * <ul>
 *   <li>{@link #syncNamespaceQuotas()} - 每個命名空間一份 {@link NamespaceQuota} 快照</li>
 *   <li>{@link #syncProjectQuotas()} - 預設讀取 ProjectQuota 自訂資源，cloudId 為專案名稱；
 *       {@code project-quota-source: resourcequota} 的叢集改由有 CPU 與記憶體上限的命名空間
 *       轉為 {@link ProjectQuota}，cloudId 為 {@code k8s-{namespace}}</li>
 * </ul>
 *
 * <p>單一叢集失敗記錄在結果的錯誤列表，不影響其他叢集。
 */
@Service
public class QuotaSyncService {

    private static final Logger log = LoggerFactory.getLogger(QuotaSyncService.class);

    static final String PROJECT_QUOTA_PREFIX = "k8s-";

    private final ClusterRegistry clusters;
    private final NamespaceQuotaRepository namespaceQuotaRepository;
    private final ProjectQuotaRepository projectQuotaRepository;

    public QuotaSyncService(
            ClusterRegistry clusters,
            NamespaceQuotaRepository namespaceQuotaRepository,
            ProjectQuotaRepository projectQuotaRepository) {
        this.clusters = clusters;
        this.namespaceQuotaRepository = namespaceQuotaRepository;
        this.projectQuotaRepository = projectQuotaRepository;
    }

    /**
     * 同步所有叢集的命名空間配額快照。未設定 ResourceQuota 的命名空間略過。
     *
     * @return 新增與更新的快照數；所有叢集都無法存取時 {@code success} 為 false
     */
    public SyncResult syncNamespaceQuotas() {
        long startTime = System.currentTimeMillis();
        Tally tally = new Tally();

        for (ClusterContext context : clusters.all()) {
            KubernetesClusterClient cluster = context.cluster();
            List<String> namespaces;
            try {
                namespaces = cluster.listNamespaces();
            } catch (ClusterAccessException e) {
                log.error("Namespace quota sync skipped cluster {}: {}", e.getClusterName(), e.getMessage(), e);
                tally.errors.add(e.getMessage());
                continue;
            }
            tally.reachable++;

            for (String namespace : namespaces) {
                Optional<NamespaceQuota> quota = readResourceQuota(cluster, namespace, tally);
                if (quota.isEmpty()) {
                    continue;
                }
                tally.count(namespaceQuotaRepository.existsById(quota.get().id()));
                namespaceQuotaRepository.save(quota.get());
            }
        }

        log.info("Namespace quota sync completed: clusters={}/{}, imported={}, updated={}, errors={}, duration={}ms",
            tally.reachable, clusters.all().size(), tally.imported, tally.updated, tally.errors.size(),
            System.currentTimeMillis() - startTime);
        return tally.toResult();
    }

    /**
     * 同步所有叢集的專案配額。
     *
     * @return 新增與更新的配額數；所有叢集都無法存取時 {@code success} 為 false
     */
    public SyncResult syncProjectQuotas() {
        Tally tally = new Tally();

        for (ClusterContext context : clusters.all()) {
            try {
                if (context.cluster().usesResourceQuotaForProjects()) {
                    syncFromResourceQuotas(context.cluster(), tally);
                } else {
                    syncFromProjectQuotas(context.cluster(), tally);
                }
                tally.reachable++;
            } catch (ClusterAccessException e) {
                log.error("Project quota sync skipped cluster {}: {}", e.getClusterName(), e.getMessage(), e);
                tally.errors.add(e.getMessage());
            }
        }

        log.info("Project quota sync completed: clusters={}/{}, imported={}, updated={}, errors={}",
            tally.reachable, clusters.all().size(), tally.imported, tally.updated, tally.errors.size());
        return tally.toResult();
    }

    private void syncFromProjectQuotas(KubernetesClusterClient cluster, Tally tally) {
        for (ProjectQuota quota : cluster.listProjectQuotas()) {
            tally.count(projectQuotaRepository.existsById(quota.cloudId()));
            projectQuotaRepository.save(quota);
        }
    }

    private void syncFromResourceQuotas(KubernetesClusterClient cluster, Tally tally) {
        for (String namespace : cluster.listNamespaces()) {
            Optional<NamespaceQuota> quota = readResourceQuota(cluster, namespace, tally);
            if (quota.isEmpty() || quota.get().cpuLimit() <= 0 || quota.get().memoryLimit() <= 0) {
                continue;
            }

            String cloudId = PROJECT_QUOTA_PREFIX + namespace;
            tally.count(projectQuotaRepository.existsById(cloudId));
            projectQuotaRepository.save(ProjectQuota.of(
                cloudId, quota.get().projectName(), quota.get().cpuLimit(), quota.get().memoryLimit()));
        }
    }

    private Optional<NamespaceQuota> readResourceQuota(KubernetesClusterClient cluster, String namespace,
            Tally tally) {
        try {
            return cluster.getResourceQuota(namespace);
        } catch (ClusterAccessException e) {
            log.error("Failed to read resource quota: cluster={}, namespace={}, error={}",
                e.getClusterName(), namespace, e.getMessage(), e);
            tally.errors.add(namespace + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private static final class Tally {
        private int imported;
        private int updated;
        private int reachable;
        private final List<String> errors = new ArrayList<>();

        void count(boolean exists) {
            if (exists) {
                updated++;
            } else {
                imported++;
            }
        }

        SyncResult toResult() {
            return new SyncResult(reachable > 0, imported, updated, errors);
        }
    }
}
