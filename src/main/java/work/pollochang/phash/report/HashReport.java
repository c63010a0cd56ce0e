package work.pollochang.phash.report;

import work.pollochang.phash.core.HashResult;

/**
 * 單一路徑的處理結果；只有 {@link HashResult#HASHED} 時 {@code hash} 有意義。
 */
public record HashReport(String path, HashResult result, long hash) {

    public static HashReport hashed(String path, long hash) {
        return new HashReport(path, HashResult.HASHED, hash);
    }

    public static HashReport failed(String path, HashResult result) {
        return new HashReport(path, result, 0L);
    }

    public boolean isSuccess() {
        return result == HashResult.HASHED;
    }
}
