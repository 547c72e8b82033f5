package io.github.samzhu.quotaboard.service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotaboard.dto.ProjectUsage;
import io.github.samzhu.quotaboard.dto.SyncResult;
import io.github.samzhu.quotaboard.exception.InvalidReportException;
import io.github.samzhu.quotaboard.store.UsageMergeStore;
import io.github.samzhu.quotaboard.util.QuantityParser;

/**
 * 用量報表匯入服務。
 *
 * <p>報表為純文字，每行一個命名空間：
 * <pre>
 * project;namespace;cpuCores;memoryBytes
 * payments;payments-prod;3.5;8589934592
 * </pre>
 *
 * <p>日期取自檔名中第一個 {@code yyyy-MM-dd}。空行與欄位數不為 4 的行會被略過，
 * 無法解析的數值視為 0。同專案的多個命名空間加總後合併到 {@link UsageMergeStore}。
 */
@Service
public class UsageReportService {

    private static final Logger log = LoggerFactory.getLogger(UsageReportService.class);

    private static final Pattern REPORT_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final int FIELD_COUNT = 4;

    private final UsageMergeStore store;

    public UsageReportService(UsageMergeStore store) {
        this.store = store;
    }

    /**
     * 匯入一份報表。
     *
     * @param fileName 檔名，必須包含 {@code yyyy-MM-dd}
     * @param content 報表內容
     * @return 匯入結果，{@code imported} 為有效行數，{@code errors} 列出被略過的行
     * @throws InvalidReportException 檔名中找不到有效日期
     */
    public SyncResult ingestReport(String fileName, String content) {
        LocalDate date = extractDate(fileName);

        Map<String, ProjectUsage> byProject = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        int accepted = 0;

        String[] lines = content == null ? new String[0] : content.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] fields = line.split(";", -1);
            if (fields.length != FIELD_COUNT) {
                errors.add(String.format("Line %d: expected %d fields but found %d", i + 1, FIELD_COUNT, fields.length));
                continue;
            }
            String project = fields[0].trim();
            ProjectUsage usage = new ProjectUsage(
                project,
                null,
                QuantityParser.parseCpu(fields[2]),
                QuantityParser.parseMemory(fields[3]));
            byProject.merge(project, usage, ProjectUsage::plus);
            accepted++;
        }

        store.merge(date, new ArrayList<>(byProject.values()));

        log.info("Usage report ingested: file={}, date={}, lines={}, projects={}, skipped={}",
            fileName, date, accepted, byProject.size(), errors.size());
        if (!errors.isEmpty()) {
            log.warn("Skipped {} malformed lines in {}", errors.size(), fileName);
        }
        return new SyncResult(true, accepted, 0, errors);
    }

    /**
     * 從檔名擷取報表日期。
     */
    static LocalDate extractDate(String fileName) {
        if (fileName == null) {
            throw new InvalidReportException(null);
        }
        Matcher matcher = REPORT_DATE.matcher(fileName);
        while (matcher.find()) {
            try {
                return LocalDate.parse(matcher.group());
            } catch (DateTimeParseException e) {
                log.debug("Ignoring invalid date {} in {}", matcher.group(), fileName);
            }
        }
        throw new InvalidReportException(fileName);
    }
}
