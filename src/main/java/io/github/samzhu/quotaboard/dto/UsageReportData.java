package io.github.samzhu.quotaboard.dto;

/**
 * 用量報表上傳事件（CloudEvents data payload）。
 *
 * <p>報表內容為純文字，每行格式 {@code project;namespace;cpuCores;memoryBytes}，
 * 日期取自檔名中的 {@code yyyy-MM-dd}，例如 {@code Day_report_2025-06-01.txt}。
 *
 * @param fileName 原始檔名
 * @param content 報表內容
 */
public record UsageReportData(
    String fileName,
    String content
) {}
