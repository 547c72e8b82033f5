package io.github.samzhu.quotaboard.client;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceQuota;
import io.fabric8.kubernetes.api.model.ResourceQuotaStatus;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.github.samzhu.quotaboard.config.QuotaboardProperties.ClusterConfig;
import io.github.samzhu.quotaboard.document.NamespaceQuota;
import io.github.samzhu.quotaboard.document.ProjectQuota;
import io.github.samzhu.quotaboard.exception.ClusterAccessException;
import io.github.samzhu.quotaboard.util.QuantityParser;

/**
 * Kubernetes 叢集存取客戶端。
 *
 * <p>透過 fabric8 {@link KubernetesClient} 讀取：
 * <ul>
 *   <li>命名空間列表（排除設定的前綴，預設 {@code kube-}）</li>
 *   <li>命名空間所屬專案（label，預設 {@code cpaas.io/project}）</li>
 *   <li>Deployment / StatefulSet 的期望副本數</li>
 *   <li>命名空間 ResourceQuota 的 hard / used 值</li>
 *   <li>叢集層級的 {@code auth.alauda.io/v1} ProjectQuota 自訂資源</li>
 * </ul>
 *
 * <p>每個設定的叢集各有一個實例，由 {@link ClusterRegistry} 建立。
 * API 呼叫失敗一律包裝為 {@link ClusterAccessException}。
 */
public class KubernetesClusterClient implements ReplicaDirectory {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClusterClient.class);

    private static final ResourceDefinitionContext PROJECT_QUOTA_CONTEXT = new ResourceDefinitionContext.Builder()
        .withGroup("auth.alauda.io")
        .withVersion("v1")
        .withPlural("projectquotas")
        .withKind("ProjectQuota")
        .withNamespaced(false)
        .build();

    private final KubernetesClient client;
    private final ClusterConfig cluster;

    public KubernetesClusterClient(KubernetesClient client, ClusterConfig cluster) {
        this.client = client;
        this.cluster = cluster;
    }

    /**
     * 叢集名稱。
     */
    public String getClusterName() {
        return cluster.name();
    }

    /**
     * 專案配額是否由命名空間 ResourceQuota 推導，而非 ProjectQuota 自訂資源。
     */
    public boolean usesResourceQuotaForProjects() {
        return cluster.usesResourceQuotaForProjects();
    }

    /**
     * 列出所有未被排除的命名空間名稱。
     *
     * @return 命名空間名稱，依 API 回傳順序
     */
    public List<String> listNamespaces() {
        try {
            List<String> namespaces = client.namespaces().list().getItems().stream()
                .map(ns -> ns.getMetadata().getName())
                .filter(name -> name != null && !name.isEmpty())
                .filter(name -> !isExcluded(name))
                .toList();
            log.debug("Listed namespaces: cluster={}, count={}", cluster.name(), namespaces.size());
            return namespaces;
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException(cluster.name(), "Failed to list namespaces", e);
        }
    }

    /**
     * 取得命名空間所屬專案。
     *
     * @param namespace 命名空間
     * @return 專案 label 值；命名空間不存在或未設定 label 時回傳命名空間名稱
     */
    public String getProjectName(String namespace) {
        try {
            Namespace ns = client.namespaces().withName(namespace).get();
            if (ns == null || ns.getMetadata().getLabels() == null) {
                return namespace;
            }
            String project = ns.getMetadata().getLabels().get(cluster.projectLabel());
            return project == null || project.isBlank() ? namespace : project;
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException(cluster.name(), "Failed to read namespace " + namespace, e);
        }
    }

    /**
     * 取得 Deployment 與 StatefulSet 的期望副本數。
     *
     * <p>key 為 controller 名稱；同名時 StatefulSet 覆蓋 Deployment。
     */
    @Override
    public Map<String, Integer> getExpectedReplicas(String namespace) {
        Map<String, Integer> replicas = new LinkedHashMap<>();
        try {
            for (Deployment deployment : client.apps().deployments().inNamespace(namespace).list().getItems()) {
                Integer desired = deployment.getSpec() != null ? deployment.getSpec().getReplicas() : null;
                replicas.put(name(deployment), desired != null ? desired : 0);
            }
            for (StatefulSet statefulSet : client.apps().statefulSets().inNamespace(namespace).list().getItems()) {
                Integer desired = statefulSet.getSpec() != null ? statefulSet.getSpec().getReplicas() : null;
                replicas.put(name(statefulSet), desired != null ? desired : 0);
            }
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException(cluster.name(), "Failed to list workloads in " + namespace, e);
        }
        log.debug("Expected replicas: namespace={}, workloads={}", namespace, replicas.size());
        return replicas;
    }

    /**
     * 讀取命名空間的 ResourceQuota。
     *
     * <p>命名空間有多個 ResourceQuota 時只取第一個。讀取 {@code status.hard} 與
     * {@code status.used} 的 {@code limits.cpu}、{@code limits.memory}、{@code pods}、
     * {@code requests.storage}，缺少的欄位為 0。
     *
     * @param namespace 命名空間
     * @return 配額快照，命名空間未設定 ResourceQuota 時為 empty
     */
    public Optional<NamespaceQuota> getResourceQuota(String namespace) {
        List<ResourceQuota> quotas;
        try {
            quotas = client.resourceQuotas().inNamespace(namespace).list().getItems();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException(cluster.name(), "Failed to read resource quota of " + namespace, e);
        }
        if (quotas.isEmpty()) {
            return Optional.empty();
        }

        ResourceQuotaStatus status = quotas.get(0).getStatus();
        Map<String, Quantity> hard = status != null && status.getHard() != null ? status.getHard() : Map.of();
        Map<String, Quantity> used = status != null && status.getUsed() != null ? status.getUsed() : Map.of();

        return Optional.of(new NamespaceQuota(
            NamespaceQuota.createId(cluster.name(), namespace),
            cluster.name(),
            namespace,
            getProjectName(namespace),
            QuantityParser.parseCpu(token(hard, "limits.cpu")),
            QuantityParser.parseMemory(token(hard, "limits.memory")),
            QuantityParser.parseCpu(token(used, "limits.cpu")),
            QuantityParser.parseMemory(token(used, "limits.memory")),
            QuantityParser.parseCount(token(hard, "pods")),
            QuantityParser.parseCount(token(used, "pods")),
            QuantityParser.parseStorage(token(hard, "requests.storage")),
            QuantityParser.parseStorage(token(used, "requests.storage")),
            Instant.now()));
    }

    /**
     * 讀取 ProjectQuota 自訂資源並轉為專案配額。
     *
     * <p>配額取自 {@code spec.hard}：CPU 優先 {@code limits.cpu}，其次 {@code requests.cpu}；
     * 記憶體優先 {@code limits.memory}，其次 {@code requests.memory}。專案名稱取自專案 label，
     * 沒有 label 時為資源名稱，cloudId 與專案名稱相同。CPU 或記憶體配額為 0 的資源略過。
     *
     * @return 專案配額，依 API 回傳順序
     */
    public List<ProjectQuota> listProjectQuotas() {
        List<GenericKubernetesResource> resources;
        try {
            resources = client.genericKubernetesResources(PROJECT_QUOTA_CONTEXT).list().getItems();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException(cluster.name(), "Failed to list project quotas", e);
        }

        List<ProjectQuota> quotas = new ArrayList<>();
        for (GenericKubernetesResource resource : resources) {
            Map<?, ?> hard = nested(resource.getAdditionalProperties().get("spec"), "hard");
            double cpu = QuantityParser.parseCpu(firstOf(hard, "limits.cpu", "requests.cpu"));
            double memory = QuantityParser.parseMemory(firstOf(hard, "limits.memory", "requests.memory"));
            String projectName = projectOf(resource);
            if (cpu <= 0 || memory <= 0) {
                log.debug("Skipping project quota without cpu/memory: cluster={}, project={}",
                    cluster.name(), projectName);
                continue;
            }
            quotas.add(ProjectQuota.of(projectName, projectName, cpu, memory));
        }
        log.debug("Listed project quotas: cluster={}, resources={}, usable={}",
            cluster.name(), resources.size(), quotas.size());
        return quotas;
    }

    private String projectOf(GenericKubernetesResource resource) {
        Map<String, String> labels = resource.getMetadata().getLabels();
        String project = labels != null ? labels.get(cluster.projectLabel()) : null;
        return project == null || project.isBlank() ? name(resource) : project;
    }

    private static Map<?, ?> nested(Object value, String key) {
        if (value instanceof Map<?, ?> map && map.get(key) instanceof Map<?, ?> child) {
            return child;
        }
        return Map.of();
    }

    private static String firstOf(Map<?, ?> values, String key, String fallbackKey) {
        Object value = values.get(key);
        if (value == null) {
            value = values.get(fallbackKey);
        }
        return value != null ? String.valueOf(value) : "0";
    }

    private boolean isExcluded(String namespace) {
        return cluster.excludedNamespacePrefixes().stream().anyMatch(namespace::startsWith);
    }

    private static String name(HasMetadata resource) {
        return resource.getMetadata().getName();
    }

    /**
     * 還原 Quantity 的原始字串（例如 {@code 500m}、{@code 4Gi}）。
     */
    private static String token(Map<String, Quantity> values, String key) {
        Quantity quantity = values.get(key);
        if (quantity == null || quantity.getAmount() == null) {
            return "0";
        }
        String format = quantity.getFormat() != null ? quantity.getFormat() : "";
        return quantity.getAmount() + format;
    }
}
