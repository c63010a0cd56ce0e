package work.pollochang.phash.core;

public enum HashResult {
    HASHED("成功計算雜湊"),
    REJECTED_PATH("路徑含有保留分隔字元"),
    FAILED_READ("讀取檔案失敗"),
    FAILED_UNSUPPORTED_FORMAT("無法辨識圖片格式"),
    FAILED_DECODE("圖片解碼失敗"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    HashResult(String description) { this.description = description; }
    public String getDescription() { return description; }
}
