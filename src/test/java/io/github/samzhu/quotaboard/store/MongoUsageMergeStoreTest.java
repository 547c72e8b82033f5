package io.github.samzhu.quotaboard.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import io.github.samzhu.quotaboard.document.DailyProjectUsage;
import io.github.samzhu.quotaboard.dto.ProjectUsage;
import io.github.samzhu.quotaboard.repository.DailyProjectUsageRepository;

class MongoUsageMergeStoreTest {

    private static final LocalDate DATE = LocalDate.of(2025, 6, 1);

    private MongoTemplate mongoTemplate;
    private BulkOperations bulkOps;
    private DailyProjectUsageRepository repository;
    private MongoUsageMergeStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        bulkOps = mock(BulkOperations.class);
        repository = mock(DailyProjectUsageRepository.class);
        when(mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, DailyProjectUsage.class)).thenReturn(bulkOps);
        store = new MongoUsageMergeStore(mongoTemplate, repository);
    }

    @Test
    void shouldUpsertWithIncrementPerProject() {
        // When
        store.merge(DATE, List.of(
            new ProjectUsage("payments", "cloud-1", 2.0, 4.0),
            new ProjectUsage("payments", null, 1.0, 1.0),
            new ProjectUsage("catalog", null, 0.5, 0.5)));

        // Then
        ArgumentCaptor<Query> queries = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> updates = ArgumentCaptor.forClass(Update.class);
        verify(bulkOps, times(2)).upsert(queries.capture(), updates.capture());
        verify(bulkOps).execute();

        assertThat(queries.getAllValues().get(0).getQueryObject().get("_id")).isEqualTo("2025-06-01_payments");
        assertThat(queries.getAllValues().get(1).getQueryObject().get("_id")).isEqualTo("2025-06-01_catalog");

        Document payments = updates.getAllValues().get(0).getUpdateObject();
        Document inc = payments.get("$inc", Document.class);
        assertThat(inc.get("cpuUsage")).isEqualTo(3.0);
        assertThat(inc.get("memoryUsage")).isEqualTo(5.0);
        assertThat(inc.get("contributionCount")).isEqualTo(1);

        Document setOnInsert = payments.get("$setOnInsert", Document.class);
        assertThat(setOnInsert.get("projectName")).isEqualTo("payments");
        assertThat(setOnInsert.get("cloudId")).isEqualTo("cloud-1");
        assertThat(setOnInsert.get("date")).isEqualTo(DATE);
    }

    @Test
    void shouldSkipBulkWriteForEmptyInput() {
        // When
        store.merge(DATE, List.of());

        // Then
        verify(mongoTemplate, never()).bulkOps(any(BulkOperations.BulkMode.class), eq(DailyProjectUsage.class));
    }

    @Test
    void shouldReadUsageFromRepository() {
        // Given
        DailyProjectUsage usage = new DailyProjectUsage(
            "2025-06-01_payments", DATE, "payments", null, 1.0, 1.0, 1, null);
        when(repository.findByDateOrderByProjectNameAsc(DATE)).thenReturn(List.of(usage));

        // When & Then
        assertThat(store.getUsage(DATE)).containsExactly(usage);
    }

    @Test
    void shouldReadDistinctBsonDatesAtUtcAndSort() {
        // Given: driver 回傳 UTC 午夜的 java.util.Date
        when(mongoTemplate.findDistinct(any(Query.class), eq("date"), eq(DailyProjectUsage.class), eq(Date.class)))
            .thenReturn(List.of(
                Date.from(Instant.parse("2025-06-04T00:00:00Z")),
                Date.from(Instant.parse("2025-06-01T00:00:00Z"))));

        // When
        List<LocalDate> dates = store.getDates();

        // Then
        assertThat(dates).containsExactly(DATE, DATE.plusDays(3));
    }

    @Test
    void shouldConvertBsonDateIndependentlyOfDefaultTimeZone() {
        // Given: UTC 午夜在 UTC-7 是前一天
        TimeZone original = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("America/Los_Angeles"));
        try {
            Date midnightUtc = Date.from(Instant.parse("2025-06-01T00:00:00Z"));

            // When & Then
            assertThat(MongoUsageMergeStore.toLocalDate(midnightUtc)).isEqualTo(DATE);
        } finally {
            TimeZone.setDefault(original);
        }
    }
}
