package work.pollochang.phash.tools;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.Raster;
import java.util.Objects;

public class ImageTools {

    private static final double LANCZOS_WINDOW = 3.0;

    /**
     * 轉為單通道 8-bit 灰階 (Rec. 709 亮度)，以列為主序回傳。
     * 原本即為單通道灰階的影像直接取樣，不經過 sRGB 轉換。
     *
     * @param image 原始圖片
     * @return 長度為 width * height 的灰階值 (0..255)
     */
    public static int[] toGrayscale(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int width = image.getWidth();
        int height = image.getHeight();
        int[] gray = new int[width * height];

        Raster raster = image.getRaster();
        ColorModel colorModel = image.getColorModel();
        if (raster.getNumBands() == 1 && colorModel.getNumComponents() == 1) {
            int shift = Math.max(0, raster.getSampleModel().getSampleSize(0) - 8);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    gray[y * width + x] = Math.min(255, raster.getSample(x, y, 0) >> shift);
                }
            }
            return gray;
        }

        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < rgb.length; i++) {
            int r = (rgb[i] >> 16) & 0xFF;
            int g = (rgb[i] >> 8) & 0xFF;
            int b = rgb[i] & 0xFF;
            gray[i] = clampToByte(0.2126 * r + 0.7152 * g + 0.0722 * b);
        }
        return gray;
    }

    /**
     * 以可分離的 Lanczos3 濾波器縮放灰階資料。縮小時濾波範圍隨比例放大。
     *
     * @param gray       列為主序的灰階值
     * @param width      原始寬度
     * @param height     原始高度
     * @param newWidth   目標寬度
     * @param newHeight  目標高度
     * @return 列為主序、長度為 newWidth * newHeight 的灰階值 (0..255)
     */
    public static int[] resizeLanczos(int[] gray, int width, int height, int newWidth, int newHeight) {
        Objects.requireNonNull(gray, "gray must not be null");
        if (width <= 0 || height <= 0 || newWidth <= 0 || newHeight <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        if (gray.length != width * height) {
            throw new IllegalArgumentException("gray length " + gray.length + " does not match " + width + "x" + height);
        }

        // 先水平再垂直，中間結果保留浮點數
        double[] horizontal = new double[newWidth * height];
        Kernel[] columns = kernels(width, newWidth);
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < newWidth; x++) {
                Kernel k = columns[x];
                double sum = 0;
                for (int i = 0; i < k.weights.length; i++) {
                    sum += gray[row + k.start + i] * k.weights[i];
                }
                horizontal[y * newWidth + x] = sum;
            }
        }

        int[] result = new int[newWidth * newHeight];
        Kernel[] rows = kernels(height, newHeight);
        for (int y = 0; y < newHeight; y++) {
            Kernel k = rows[y];
            for (int x = 0; x < newWidth; x++) {
                double sum = 0;
                for (int i = 0; i < k.weights.length; i++) {
                    sum += horizontal[(k.start + i) * newWidth + x] * k.weights[i];
                }
                result[y * newWidth + x] = clampToByte(sum);
            }
        }
        return result;
    }

    private static Kernel[] kernels(int inSize, int outSize) {
        double ratio = (double) inSize / outSize;
        double scale = Math.max(1.0, ratio);
        double support = LANCZOS_WINDOW * scale;

        Kernel[] kernels = new Kernel[outSize];
        for (int out = 0; out < outSize; out++) {
            double center = (out + 0.5) * ratio;
            int left = (int) Math.floor(center - support);
            left = Math.max(0, Math.min(left, inSize - 1));
            int right = (int) Math.ceil(center + support);
            right = Math.max(left + 1, Math.min(right, inSize));
            center -= 0.5;

            double[] weights = new double[right - left];
            double total = 0;
            for (int i = left; i < right; i++) {
                double w = lanczos((i - center) / scale);
                weights[i - left] = w;
                total += w;
            }
            if (total != 0) {
                for (int i = 0; i < weights.length; i++) {
                    weights[i] /= total;
                }
            }
            kernels[out] = new Kernel(left, weights);
        }
        return kernels;
    }

    private static double lanczos(double x) {
        if (Math.abs(x) >= LANCZOS_WINDOW) {
            return 0;
        }
        return sinc(x) * sinc(x / LANCZOS_WINDOW);
    }

    private static double sinc(double x) {
        if (x == 0) {
            return 1;
        }
        double a = Math.PI * x;
        return Math.sin(a) / a;
    }

    private static int clampToByte(double value) {
        long rounded = Math.round(value);
        if (rounded < 0) {
            return 0;
        }
        return (int) Math.min(255, rounded);
    }

    private record Kernel(int start, double[] weights) {}
}
