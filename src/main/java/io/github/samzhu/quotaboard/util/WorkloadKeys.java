package io.github.samzhu.quotaboard.util;

/**
 * 從 Pod 名稱推導 workload 識別碼。
 *
 * <p>規則：以最後一個 {@code -} 切分，若最後一段為純數字則去除該段，
 * 否則整個 Pod 名稱即為 workload key。
 * <pre>
 * web-0            → web
 * mysql-primary-12 → mysql-primary
 * app-7f9c5d-x2j4k → app-7f9c5d-x2j4k
 * </pre>
 *
 * <p>這是近似規則，不查詢 Kubernetes API。名稱本身就以數字結尾的 Pod
 * （例如 {@code report-2024}）會被誤判為序號後綴而與其他 Pod 歸為同一組；
 * Deployment 產生的雜湊後綴 Pod 則各自成為獨立的 workload。
 */
public final class WorkloadKeys {

    private WorkloadKeys() {
        // 工具類不允許實例化
    }

    /**
     * 取得 Pod 所屬的 workload key。
     *
     * @param podName Pod 名稱
     * @return workload key，podName 為 null 時回傳空字串
     */
    public static String of(String podName) {
        if (podName == null) {
            return "";
        }
        int lastDash = podName.lastIndexOf('-');
        if (lastDash < 0) {
            return podName;
        }
        String suffix = podName.substring(lastDash + 1);
        return isAsciiDigits(suffix) ? podName.substring(0, lastDash) : podName;
    }

    private static boolean isAsciiDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
