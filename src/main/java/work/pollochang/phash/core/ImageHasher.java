package work.pollochang.phash.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.phash.report.HashReport;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 單一圖片的雜湊流程：讀檔、解碼、計算 pHash。
 * 所有錯誤都在此轉為 {@link HashReport}，不會往外拋出，因此不影響其他工作執行緒。
 */
@Slf4j
public final class ImageHasher {

    private final ImageDecoder decoder;
    private final PerceptualHash perceptualHash;

    public ImageHasher(ImageDecoder decoder, PerceptualHash perceptualHash) {
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.perceptualHash = Objects.requireNonNull(perceptualHash, "perceptualHash must not be null");
    }

    /**
     * 計算指定路徑圖片的雜湊。
     *
     * @param path 輸入清單中的路徑字串，同時也是快取鍵
     * @return 處理結果
     */
    public HashReport processImage(String path) {
        try (DecodedImage decodedImage = decoder.read(Path.of(path))) {
            long hash = perceptualHash.hash(decodedImage.image());
            log.debug("{} - 雜湊完成 ({}): {}", path, decodedImage.formatName(), Long.toUnsignedString(hash));
            return HashReport.hashed(path, hash);
        } catch (ImageHashException e) {
            log.warn("{} - {}: {}", path, e.getResult().getDescription(), describe(e));
            return HashReport.failed(path, e.getResult());
        } catch (InvalidPathException e) {
            log.warn("{} - {}: {}", path, HashResult.FAILED_READ.getDescription(), e.getMessage());
            return HashReport.failed(path, HashResult.FAILED_READ);
        } catch (OutOfMemoryError e) {
            // 極端大的圖片仍可能發生
            log.error("{} - 處理檔案時發生記憶體溢位錯誤 (圖片可能過大或格式有問題)", path, e);
            return HashReport.failed(path, HashResult.FAILED_OUT_OF_MEMORY);
        } catch (Exception e) {
            log.error("{} - 處理檔案時發生未知錯誤", path, e);
            return HashReport.failed(path, HashResult.FAILED_UNKNOWN);
        }
    }

    private static String describe(ImageHashException e) {
        Throwable cause = e.getCause();
        return cause == null ? e.getMessage() : e.getMessage() + " (" + cause + ")";
    }
}
