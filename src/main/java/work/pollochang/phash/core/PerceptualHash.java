package work.pollochang.phash.core;

import work.pollochang.phash.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Objects;

/**
 * 以 DCT 為基礎的感知雜湊 (pHash) 計算器。
 *
 * <p>計算流程：
 * <ol>
 *   <li>轉為單通道灰階。</li>
 *   <li>以 Lanczos3 縮放至 32×32。</li>
 *   <li>計算 {@code DCT × pixels × DCTᵗ}。</li>
 *   <li>取第 1 列、第 1 行起的 8×8 係數區塊，略過直流項與第一列/行。</li>
 *   <li>以行為主序 (先行後列) 展平為 64 個係數並求中位數。</li>
 *   <li>係數 {@code >=} 中位數時設定對應位元。</li>
 * </ol>
 *
 * <p>{@link DctMatrix} 於建構時給定並共用，本類別沒有可變狀態，可由多個工作執行緒同時使用。
 *
 * <p>使用範例：
 * <pre>{@code
 * PerceptualHash hasher = new PerceptualHash(new DctMatrix(PerceptualHash.SAMPLE_SIZE));
 * long hash = hasher.hash(ImageIO.read(file));
 * String rendered = Long.toUnsignedString(hash);
 * }</pre>
 *
 * @author PolloChang
 * @since 1.0.0
 */
public final class PerceptualHash {

    public static final int SAMPLE_SIZE = 32;
    public static final int BLOCK_SIZE = 8;

    private static final int BITS = BLOCK_SIZE * BLOCK_SIZE;

    private final DctMatrix dct;

    public PerceptualHash(DctMatrix dct) {
        this.dct = Objects.requireNonNull(dct, "dct must not be null");
        if (dct.size() != SAMPLE_SIZE) {
            throw new IllegalArgumentException("DCT matrix must be " + SAMPLE_SIZE + "x" + SAMPLE_SIZE);
        }
    }

    /**
     * 計算圖片的 64 位元感知雜湊，相同的解碼像素必定得到相同結果。
     *
     * @param image 解碼後的圖片，不能為 null
     * @return 以 {@code long} 表示的無號 64 位元雜湊
     */
    public long hash(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int[] gray = ImageTools.toGrayscale(image);
        int[] samples = ImageTools.resizeLanczos(gray, image.getWidth(), image.getHeight(), SAMPLE_SIZE, SAMPLE_SIZE);
        return hashSamples(samples);
    }

    /**
     * 對已縮放完成的 32×32 灰階取樣 (列為主序) 計算雜湊。
     */
    public long hashSamples(int[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.length != SAMPLE_SIZE * SAMPLE_SIZE) {
            throw new IllegalArgumentException("expected " + SAMPLE_SIZE * SAMPLE_SIZE + " samples but got " + samples.length);
        }

        double[][] pixels = new double[SAMPLE_SIZE][SAMPLE_SIZE];
        for (int y = 0; y < SAMPLE_SIZE; y++) {
            for (int x = 0; x < SAMPLE_SIZE; x++) {
                pixels[y][x] = samples[y * SAMPLE_SIZE + x];
            }
        }
        double[][] coefficients = dct.transform(pixels);

        // 行為主序：位元 i 對應 (row = 1 + i % 8, col = 1 + i / 8)
        double[] block = new double[BITS];
        int i = 0;
        for (int col = 1; col <= BLOCK_SIZE; col++) {
            for (int row = 1; row <= BLOCK_SIZE; row++) {
                block[i++] = coefficients[row][col];
            }
        }

        double median = median(block);
        long hash = 0L;
        for (int bit = 0; bit < BITS; bit++) {
            if (block[bit] >= median) {
                hash |= 1L << bit;
            }
        }
        return hash;
    }

    /**
     * 兩個雜湊間不同的位元數。
     */
    public static int hammingDistance(long a, long b) {
        return Long.bitCount(a ^ b);
    }

    private static double median(double[] values) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
