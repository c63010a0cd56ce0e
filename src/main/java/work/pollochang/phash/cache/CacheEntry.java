package work.pollochang.phash.cache;

import java.util.Objects;

/**
 * 檢查點檔案中的一筆紀錄：{@code <path>\t<hash>\n}。
 *
 * @param path 圖片路徑，也是快取鍵
 * @param hash 無號 64 位元感知雜湊
 */
public record CacheEntry(String path, long hash) {

    static final char FIELD_SEPARATOR = '\t';
    static final char LINE_TERMINATOR = '\n';

    public CacheEntry {
        Objects.requireNonNull(path, "path must not be null");
    }

    /**
     * 路徑含有 tab 或換行時無法寫入，否則會破壞檔案格式。
     */
    public boolean hasWritablePath() {
        return path.indexOf(FIELD_SEPARATOR) < 0 && path.indexOf(LINE_TERMINATOR) < 0;
    }

    public String toLine() {
        return path + FIELD_SEPARATOR + Long.toUnsignedString(hash) + LINE_TERMINATOR;
    }
}
