package io.github.samzhu.quotaboard.exception;

/**
 * 用量報表無法辨識異常。
 *
 * <p>報表檔名必須包含 {@code yyyy-MM-dd} 日期，否則無法決定用量歸屬的日期。
 */
public class InvalidReportException extends RuntimeException {

    private final String fileName;

    public InvalidReportException(String fileName) {
        super(String.format("Invalid report file name: '%s'. Expected a yyyy-MM-dd date in the name", fileName));
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
