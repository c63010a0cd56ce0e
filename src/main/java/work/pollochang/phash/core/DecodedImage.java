package work.pollochang.phash.core;

import javax.imageio.ImageReader;
import java.awt.image.BufferedImage;

// 封裝解碼後的圖片、其讀取器與偵測到的格式名稱，方便資源管理
public record DecodedImage(BufferedImage image, ImageReader reader, String formatName) implements AutoCloseable {
    @Override
    public void close() {
        if (image != null) {
            image.flush();
        }
        if (reader != null) {
            reader.dispose();
        }
    }
}
