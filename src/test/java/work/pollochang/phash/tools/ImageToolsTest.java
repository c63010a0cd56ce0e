package work.pollochang.phash.tools;

import org.junit.jupiter.api.Test;

import java.awt.*;
import java.awt.image.BufferedImage;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ImageToolsTest {

    private BufferedImage createTestImage(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    @Test
    void testGrayscale_ShouldUseRec709Luma() {
        assertEquals(54, ImageTools.toGrayscale(createTestImage(2, 2, Color.RED))[0]);
        assertEquals(182, ImageTools.toGrayscale(createTestImage(2, 2, Color.GREEN))[0]);
        assertEquals(18, ImageTools.toGrayscale(createTestImage(2, 2, Color.BLUE))[0]);
        assertEquals(255, ImageTools.toGrayscale(createTestImage(2, 2, Color.WHITE))[3]);
    }

    @Test
    void testGrayImage_ShouldBeSampledDirectly() {
        BufferedImage image = new BufferedImage(3, 1, BufferedImage.TYPE_BYTE_GRAY);
        image.getRaster().setSample(0, 0, 0, 0);
        image.getRaster().setSample(1, 0, 0, 100);
        image.getRaster().setSample(2, 0, 0, 255);

        assertArrayEquals(new int[]{0, 100, 255}, ImageTools.toGrayscale(image));
    }

    @Test
    void testResizeConstant_ShouldStayConstant() {
        int[] gray = new int[100 * 70];
        Arrays.fill(gray, 77);

        int[] down = ImageTools.resizeLanczos(gray, 100, 70, 32, 32);
        int[] up = ImageTools.resizeLanczos(new int[]{200, 200, 200, 200}, 2, 2, 32, 32);

        assertEquals(32 * 32, down.length);
        assertTrue(Arrays.stream(down).allMatch(v -> v == 77));
        assertTrue(Arrays.stream(up).allMatch(v -> v == 200));
    }

    @Test
    void testResize_ShouldStayWithinByteRange() {
        // 黑白交錯會使 Lanczos 產生過衝，結果仍須落在 0..255
        int[] gray = new int[64 * 64];
        for (int i = 0; i < gray.length; i++) {
            gray[i] = ((i % 64) / 4 + (i / 64) / 4) % 2 == 0 ? 0 : 255;
        }

        int[] resized = ImageTools.resizeLanczos(gray, 64, 64, 32, 32);

        assertTrue(Arrays.stream(resized).allMatch(v -> v >= 0 && v <= 255));
    }

    @Test
    void testResizeInvalidArguments_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> ImageTools.resizeLanczos(new int[3], 2, 2, 32, 32));
        assertThrows(IllegalArgumentException.class, () -> ImageTools.resizeLanczos(new int[4], 2, 2, 0, 32));
        assertThrows(NullPointerException.class, () -> ImageTools.toGrayscale(null));
    }
}
