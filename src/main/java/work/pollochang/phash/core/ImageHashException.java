package work.pollochang.phash.core;

import java.util.Objects;

/**
 * 單一圖片處理失敗時拋出，帶有失敗類型 {@link HashResult}。
 * 屬於可恢復錯誤，只影響該路徑，不會中止整批作業。
 */
public class ImageHashException extends Exception {

    private final HashResult result;

    public ImageHashException(HashResult result, String message) {
        super(message);
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    public ImageHashException(HashResult result, String message, Throwable cause) {
        super(message, cause);
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    public HashResult getResult() {
        return result;
    }
}
