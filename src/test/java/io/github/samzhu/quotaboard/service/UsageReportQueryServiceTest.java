package io.github.samzhu.quotaboard.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.quotaboard.document.NamespaceQuota;
import io.github.samzhu.quotaboard.document.ProjectQuota;
import io.github.samzhu.quotaboard.dto.NamespaceUtilization;
import io.github.samzhu.quotaboard.dto.ProjectUsage;
import io.github.samzhu.quotaboard.dto.ProjectUsageReport;
import io.github.samzhu.quotaboard.repository.NamespaceQuotaRepository;
import io.github.samzhu.quotaboard.store.InMemoryUsageMergeStore;

class UsageReportQueryServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 6, 1);

    private InMemoryUsageMergeStore store;
    private QuotaLookup quotaLookup;
    private NamespaceQuotaRepository namespaceQuotaRepository;
    private UsageReportQueryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryUsageMergeStore();
        quotaLookup = mock(QuotaLookup.class);
        namespaceQuotaRepository = mock(NamespaceQuotaRepository.class);
        when(quotaLookup.getQuota(anyString())).thenReturn(Optional.empty());
        service = new UsageReportQueryService(store, quotaLookup, new RateCalculator(), namespaceQuotaRepository);
    }

    @Test
    void shouldJoinUsageWithQuota() {
        // Given
        store.merge(DATE, List.of(
            new ProjectUsage("payments", "prod-01__payments", 4.0, 8.0),
            new ProjectUsage("catalog", null, 1.0, 1.0)));
        when(quotaLookup.getQuota("payments")).thenReturn(Optional.of(ProjectQuota.of("cloud-1", "payments", 8, 32)));

        // When
        List<ProjectUsageReport> report = service.getReport(DATE);

        // Then
        assertThat(report).hasSize(2);

        ProjectUsageReport catalog = report.get(0);
        assertThat(catalog.projectName()).isEqualTo("catalog");
        assertThat(catalog.cpuRate()).isNull();
        assertThat(catalog.memoryRate()).isNull();

        ProjectUsageReport payments = report.get(1);
        assertThat(payments.cloudId()).isEqualTo("cloud-1");
        assertThat(payments.cpuRate()).isEqualTo(50.0);
        assertThat(payments.memoryRate()).isEqualTo(25.0);
        assertThat(payments.date()).isEqualTo(DATE);
    }

    @Test
    void shouldKeepStoredCloudIdWithoutQuota() {
        // Given
        store.merge(DATE, List.of(new ProjectUsage("payments", "prod-01__payments", 4.0, 8.0)));

        // When & Then
        assertThat(service.getReport(DATE).get(0).cloudId()).isEqualTo("prod-01__payments");
    }

    @Test
    void shouldListReportDates() {
        // Given
        store.merge(DATE.plusDays(1), List.of(new ProjectUsage("payments", null, 1.0, 1.0)));
        store.merge(DATE, List.of(new ProjectUsage("payments", null, 1.0, 1.0)));

        // When & Then
        assertThat(service.getReportDates()).containsExactly(DATE, DATE.plusDays(1));
    }

    @Test
    void shouldComputeNamespaceUtilization() {
        // Given
        NamespaceQuota quota = new NamespaceQuota(
            "prod-01__shop", "prod-01", "shop", "retail",
            8, 16, 4, 20, 10, 5, 0, 3, Instant.now());
        when(namespaceQuotaRepository.findByClusterNameOrderByNamespaceAsc("prod-01")).thenReturn(List.of(quota));

        // When
        List<NamespaceUtilization> utilization = service.getNamespaceUtilization("prod-01");

        // Then
        assertThat(utilization).singleElement().satisfies(u -> {
            assertThat(u.namespace()).isEqualTo("shop");
            assertThat(u.projectName()).isEqualTo("retail");
            assertThat(u.cpuRate()).isEqualTo(50.0);
            assertThat(u.memoryRate()).isEqualTo(100.0);
            assertThat(u.podsRate()).isEqualTo(50.0);
            assertThat(u.storageRate()).isEqualTo(0.0);
        });
    }
}
