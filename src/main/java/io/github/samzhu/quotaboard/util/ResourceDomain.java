package io.github.samzhu.quotaboard.util;

/**
 * 資源數量字串所屬的單位領域。
 *
 * <p>同一組後綴在不同領域代表不同意義，例如 {@code m} 在 CPU 為毫核 (millicore)，
 * 在 COUNT 為千分之一；{@code M} 在記憶體為十進位 MB，在 COUNT 為 10^6。
 *
 * @see QuantityParser
 */
public enum ResourceDomain {

    /** CPU，正規化為核心數 (cores) */
    CPU,

    /** 記憶體，正規化為 GiB */
    MEMORY,

    /** 儲存空間，正規化為 GiB */
    STORAGE,

    /** 一般數量（例如 Pod 配額），正規化為整數 */
    COUNT
}
