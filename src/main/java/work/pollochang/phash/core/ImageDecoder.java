package work.pollochang.phash.core;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;

/**
 * 圖片解碼器，將原始位元組轉為 {@link BufferedImage}。
 *
 * <p>三種失敗各自對應一個 {@link HashResult}：
 * <ul>
 *   <li>{@link HashResult#FAILED_READ}：無法讀取檔案。</li>
 *   <li>{@link HashResult#FAILED_UNSUPPORTED_FORMAT}：找不到可處理該內容的讀取器。</li>
 *   <li>{@link HashResult#FAILED_DECODE}：讀取器解碼時失敗。</li>
 * </ul>
 *
 * @author PolloChang
 * @since 1.0.0
 */
@Slf4j
public final class ImageDecoder {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    /**
     * 讀取檔案內容並自動偵測格式後解碼。
     *
     * @param path 圖片路徑
     * @return 解碼結果，使用完畢需關閉
     * @throws ImageHashException 讀取、格式偵測或解碼失敗
     */
    public DecodedImage read(Path path) throws ImageHashException {
        Objects.requireNonNull(path, "path must not be null");
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ImageHashException(HashResult.FAILED_READ, "無法讀取檔案: " + path, e);
        }
        return decode(data);
    }

    /**
     * 依內容猜測格式並解碼。
     */
    public DecodedImage decode(byte[] data) throws ImageHashException {
        Objects.requireNonNull(data, "data must not be null");
        try {
            ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data));
            if (in == null) {
                throw new ImageHashException(HashResult.FAILED_UNSUPPORTED_FORMAT, "無法建立圖片輸入流");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                in.close();
                throw new ImageHashException(HashResult.FAILED_UNSUPPORTED_FORMAT, "找不到對應的圖片讀取器");
            }
            return decodeWith(readers.next(), in);
        } catch (IOException e) {
            throw new ImageHashException(HashResult.FAILED_UNSUPPORTED_FORMAT, "偵測圖片格式失敗", e);
        }
    }

    /**
     * 以明確指定的格式名稱 (例如 {@code "png"}) 解碼。
     */
    public DecodedImage decode(byte[] data, String formatName) throws ImageHashException {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(formatName, "formatName must not be null");
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(formatName);
        if (!readers.hasNext()) {
            throw new ImageHashException(HashResult.FAILED_UNSUPPORTED_FORMAT, "不支援的檔案格式: " + formatName);
        }
        try {
            ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data));
            if (in == null) {
                throw new ImageHashException(HashResult.FAILED_UNSUPPORTED_FORMAT, "無法建立圖片輸入流");
            }
            return decodeWith(readers.next(), in);
        } catch (IOException e) {
            throw new ImageHashException(HashResult.FAILED_UNSUPPORTED_FORMAT, "建立圖片輸入流失敗", e);
        }
    }

    private DecodedImage decodeWith(ImageReader reader, ImageInputStream in) throws ImageHashException {
        String formatName = formatNameOf(reader);
        // seekForwardOnly 與 ignoreMetadata 皆設為 true，只讀第一張影像
        reader.setInput(in, true, true);
        try {
            BufferedImage image = reader.read(0, reader.getDefaultReadParam());
            if (image == null) {
                throw new ImageHashException(HashResult.FAILED_DECODE, "解碼結果為空 (" + formatName + ")");
            }
            // 注意：此時 reader 不能關閉，由 DecodedImage 的 AutoCloseable 負責
            return new DecodedImage(image, reader, formatName);
        } catch (IOException | RuntimeException e) {
            reader.dispose();
            throw new ImageHashException(HashResult.FAILED_DECODE, "圖片解碼失敗 (" + formatName + ")", e);
        } catch (ImageHashException e) {
            reader.dispose();
            throw e;
        } finally {
            closeQuietly(in);
        }
    }

    private static String formatNameOf(ImageReader reader) {
        ImageReaderSpi spi = reader.getOriginatingProvider();
        if (spi == null || spi.getFormatNames().length == 0) {
            return "unknown";
        }
        return spi.getFormatNames()[0].toLowerCase(Locale.ROOT);
    }

    private static void closeQuietly(ImageInputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            // 記憶體內的輸入流，關閉失敗不影響結果
            log.debug("關閉圖片輸入流失敗", e);
        }
    }
}
