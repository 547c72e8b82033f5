package io.github.samzhu.quotaboard.dto;

/**
 * 配額批次匯入結果。
 *
 * @param imported 新增的配額數
 * @param updated 覆寫既有的配額數
 */
public record ImportResult(
    int imported,
    int updated
) {}
