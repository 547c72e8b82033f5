package io.github.samzhu.quotaboard.util;

import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Kubernetes 資源數量 (quantity) 字串解析工具類。
 *
 * <p>將帶單位後綴的字串（如 {@code 500m}、{@code 2Gi}、{@code 1k}）轉換為固定單位的數值：
 * <ul>
 *   <li>{@link ResourceDomain#CPU} - 核心數</li>
 *   <li>{@link ResourceDomain#MEMORY} / {@link ResourceDomain#STORAGE} - GiB</li>
 *   <li>{@link ResourceDomain#COUNT} - 整數（截斷小數）</li>
 * </ul>
 *
 * <p>所有方法對任意輸入皆有定義：null、空字串、非數字或未知後綴一律回傳 0，
 * 不拋出例外。
 *
 * <h3>記憶體單位表</h3>
 * <pre>
 * Ki → v / 1024 / 1024     K → v / 1000 / 1024
 * Mi → v / 1024            M → v / 1000
 * Gi → v                   G → v
 * Ti → v × 1024            (無後綴) → bytes / 2^30
 * </pre>
 *
 * <p>十進位後綴 K/M/G 沿用叢集管理平台的歷史換算方式，並非嚴格的 10^n bytes。
 *
 * @see <a href="https://kubernetes.io/docs/reference/kubernetes-api/common-definitions/quantity/">Kubernetes Quantity</a>
 */
public final class QuantityParser {

    private static final double BYTES_PER_GIB = 1024.0 * 1024.0 * 1024.0;

    /**
     * 數字部分 + 英文字母後綴。數字部分只接受十進位（可含指數），
     * 確保後續 {@link Double#parseDouble} 不會失敗。
     */
    private static final Pattern QUANTITY =
        Pattern.compile("([+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?)([A-Za-z]*)");

    private static final Map<String, DoubleUnaryOperator> CPU_UNITS = Map.of(
        "", v -> v,
        "m", v -> v / 1000);

    private static final Map<String, DoubleUnaryOperator> MEMORY_UNITS = Map.of(
        "Ki", v -> v / 1024 / 1024,
        "Mi", v -> v / 1024,
        "Gi", v -> v,
        "Ti", v -> v * 1024,
        "K", v -> v / 1000 / 1024,
        "M", v -> v / 1000,
        "G", v -> v,
        "", v -> v / BYTES_PER_GIB);

    // 與 MEMORY_UNITS 相同，各自獨立
    private static final Map<String, DoubleUnaryOperator> STORAGE_UNITS = Map.of(
        "Ki", v -> v / 1024 / 1024,
        "Mi", v -> v / 1024,
        "Gi", v -> v,
        "Ti", v -> v * 1024,
        "K", v -> v / 1000 / 1024,
        "M", v -> v / 1000,
        "G", v -> v,
        "", v -> v / BYTES_PER_GIB);

    private static final Map<String, DoubleUnaryOperator> COUNT_UNITS = Map.of(
        "k", v -> v * 1000,
        "K", v -> v * 1000,
        "M", v -> v * 1000 * 1000,
        "G", v -> v * 1000 * 1000 * 1000,
        "m", v -> v / 1000,
        "Ki", v -> v * 1024,
        "Mi", v -> v * 1024 * 1024,
        "Gi", v -> v * 1024 * 1024 * 1024,
        "Ti", v -> v * 1024 * 1024 * 1024 * 1024,
        "", v -> v);

    private QuantityParser() {
        // 工具類不允許實例化
    }

    /**
     * 依領域解析數量字串。
     *
     * @param token 數量字串，例如 {@code 1500m}、{@code 4Gi}
     * @param domain 單位領域，null 視為無法解析
     * @return 正規化後的數值；COUNT 領域回傳截斷後的整數值
     */
    public static double parse(String token, ResourceDomain domain) {
        if (domain == null) {
            return 0.0;
        }
        return switch (domain) {
            case CPU -> parseCpu(token);
            case MEMORY -> parseMemory(token);
            case STORAGE -> parseStorage(token);
            case COUNT -> parseCount(token);
        };
    }

    /**
     * 解析 CPU 數量。
     *
     * @param token 例如 {@code 2}、{@code 0.5}、{@code 1500m}
     * @return 核心數，無法解析時為 0.0
     */
    public static double parseCpu(String token) {
        return convert(token, CPU_UNITS);
    }

    /**
     * 解析記憶體數量。
     *
     * @param token 例如 {@code 512Mi}、{@code 4Gi}、{@code 1073741824}（bytes）
     * @return GiB，無法解析時為 0.0
     */
    public static double parseMemory(String token) {
        return convert(token, MEMORY_UNITS);
    }

    /**
     * 解析儲存空間數量。
     *
     * @param token 例如 {@code 100Gi}、{@code 1Ti}
     * @return GiB，無法解析時為 0.0
     */
    public static double parseStorage(String token) {
        return convert(token, STORAGE_UNITS);
    }

    /**
     * 解析一般數量（Kubernetes 通用 quantity 語法，非 byte 語法）。
     *
     * @param token 例如 {@code 10}、{@code 2k}、{@code 1Ki}
     * @return 截斷小數後的整數，無法解析時為 0
     */
    public static long parseCount(String token) {
        return (long) convert(token, COUNT_UNITS);
    }

    private static double convert(String token, Map<String, DoubleUnaryOperator> units) {
        if (token == null) {
            return 0.0;
        }
        Matcher matcher = QUANTITY.matcher(token.trim());
        if (!matcher.matches()) {
            return 0.0;
        }
        DoubleUnaryOperator unit = units.get(matcher.group(2));
        if (unit == null) {
            return 0.0;
        }
        double value = unit.applyAsDouble(Double.parseDouble(matcher.group(1)));
        return Double.isFinite(value) ? value : 0.0;
    }
}
