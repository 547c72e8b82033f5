package io.github.samzhu.quotaboard.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.quotaboard.document.DailyProjectUsage;
import io.github.samzhu.quotaboard.dto.SyncResult;
import io.github.samzhu.quotaboard.exception.InvalidReportException;
import io.github.samzhu.quotaboard.store.InMemoryUsageMergeStore;

class UsageReportServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 6, 1);

    private InMemoryUsageMergeStore store;
    private UsageReportService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryUsageMergeStore();
        service = new UsageReportService(store);
    }

    @Test
    void shouldSumNamespacesPerProject() {
        // Given
        String content = """
            payments;payments-prod;3.5;8589934592
            payments;payments-stage;500m;1073741824
            catalog;catalog-prod;1;2147483648
            """;

        // When
        SyncResult result = service.ingestReport("Day_report_2025-06-01.txt", content);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.imported()).isEqualTo(3);
        assertThat(result.errors()).isEmpty();

        List<DailyProjectUsage> usages = store.getUsage(DATE);
        assertThat(usages).extracting(DailyProjectUsage::projectName).containsExactly("catalog", "payments");
        assertThat(usages.get(1).cpuUsage()).isCloseTo(4.0, within(1e-9));
        assertThat(usages.get(1).memoryUsage()).isCloseTo(9.0, within(1e-9));
        assertThat(usages.get(0).memoryUsage()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void shouldSkipBlankAndMalformedLines() {
        // Given
        String content = "payments;payments-prod;2;1073741824\n"
            + "\n"
            + "broken;line\n"
            + "too;many;fields;here;extra\n";

        // When
        SyncResult result = service.ingestReport("report-2025-06-01.csv", content);

        // Then
        assertThat(result.imported()).isEqualTo(1);
        assertThat(result.errors()).hasSize(2);
        assertThat(result.errors().get(0)).startsWith("Line 3");
        assertThat(store.getUsage(DATE)).hasSize(1);
    }

    @Test
    void shouldTreatUnparsableNumbersAsZero() {
        // When
        service.ingestReport("2025-06-01.txt", "payments;payments-prod;n/a;1073741824");

        // Then
        DailyProjectUsage usage = store.getUsage(DATE).get(0);
        assertThat(usage.cpuUsage()).isZero();
        assertThat(usage.memoryUsage()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void ingestingSameReportTwiceDoublesUsage() {
        // Given
        String content = "payments;payments-prod;2;1073741824";

        // When
        service.ingestReport("Day_report_2025-06-01.txt", content);
        service.ingestReport("Day_report_2025-06-01.txt", content);

        // Then
        assertThat(store.getUsage(DATE).get(0).cpuUsage()).isEqualTo(4.0);
    }

    @Test
    void shouldRejectFileNameWithoutDate() {
        assertThatThrownBy(() -> service.ingestReport("report.txt", "payments;ns;1;1"))
            .isInstanceOf(InvalidReportException.class)
            .hasMessageContaining("report.txt");
        assertThatThrownBy(() -> service.ingestReport(null, ""))
            .isInstanceOf(InvalidReportException.class);
    }

    @Test
    void shouldSkipInvalidCalendarDateInFileName() {
        // Given: 2025-13-45 不是合法日期，取下一個符合的日期
        LocalDate date = UsageReportService.extractDate("export-2025-13-45-for-2025-06-02.txt");

        // Then
        assertThat(date).isEqualTo(LocalDate.of(2025, 6, 2));
    }
}
