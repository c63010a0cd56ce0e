package work.pollochang.phash.report;

import work.pollochang.phash.core.HashResult;

import java.util.Map;

/**
 * 一次執行的統計結果，可由 Jackson 輸出為 JSON。
 *
 * @param input         路徑清單來源 ({@code "-"} 為標準輸入)
 * @param output        檢查點檔案
 * @param candidates    清單中的非空白行數 (含重複)
 * @param cached        已存在於檢查點、因此略過的不重複路徑數
 * @param scheduled     實際排入工作的不重複路徑數
 * @param hashed        成功寫入檢查點的筆數
 * @param rejected      因路徑含保留字元而拒絕寫入的筆數
 * @param outcomes      各結果類型的計數
 * @param elapsedMillis 執行時間 (毫秒)
 */
public record RunSummary(
        String input,
        String output,
        long candidates,
        long cached,
        long scheduled,
        long hashed,
        long rejected,
        Map<HashResult, Long> outcomes,
        long elapsedMillis
) {
    public long failed() {
        return outcomes.entrySet().stream()
                .filter(e -> e.getKey() != HashResult.HASHED && e.getKey() != HashResult.REJECTED_PATH)
                .mapToLong(Map.Entry::getValue)
                .sum();
    }
}
