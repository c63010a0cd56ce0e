package work.pollochang.phash.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStoreTest {

    private static Path writeFile(Path dir, String content) throws IOException {
        Path file = dir.resolve("phash.tsv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * 上次執行在寫入中途中斷：最後一行沒有換行
     */
    @Test
    void testTruncatedLastLine_ShouldKeepPrefixAndOverwriteTail(@TempDir Path tempDir) throws IOException {
        Path file = writeFile(tempDir, "a.jpg\t123\nb.jpg\t4");

        try (CheckpointStore store = new CheckpointStore(file)) {
            Map<String, Long> cache = store.load();
            assertEquals(Map.of("a.jpg", 123L), cache);
            assertEquals("a.jpg\t123\n".length(), store.validLength());

            assertTrue(store.append(new CacheEntry("c.jpg", 789L)));
        }

        assertEquals("a.jpg\t123\nc.jpg\t789\n", Files.readString(file));
    }

    /**
     * 殘留資料比新寫入的資料長時，也不應留在檔案尾端
     */
    @Test
    void testLongGarbageTail_ShouldBeDiscarded(@TempDir Path tempDir) throws IOException {
        Path file = writeFile(tempDir, "a.jpg\t1\nthis/is/a/very/long/path/that/never/finished.png\t12345");

        try (CheckpointStore store = new CheckpointStore(file)) {
            assertEquals(Map.of("a.jpg", 1L), store.load());
            store.append(new CacheEntry("b.jpg", 2L));
        }

        assertEquals("a.jpg\t1\nb.jpg\t2\n", Files.readString(file));
    }

    @Test
    void testLineWithThreeFields_ShouldStopScanning(@TempDir Path tempDir) throws IOException {
        Path file = writeFile(tempDir, "a\t1\nb\t2\t3\nc\t4\n");

        try (CheckpointStore store = new CheckpointStore(file)) {
            assertEquals(Map.of("a", 1L), store.load());
        }

        // 無效行之後的資料一律不採信
        assertEquals("a\t1\n", Files.readString(file));
    }

    @Test
    void testUnparsableHash_ShouldStopScanning(@TempDir Path tempDir) throws IOException {
        Path file = writeFile(tempDir, "a\t1\nb\tnot-a-number\nc\t3\n");

        try (CheckpointStore store = new CheckpointStore(file)) {
            assertEquals(Map.of("a", 1L), store.load());
        }
    }

    @Test
    void testNegativeOrOverflowingHash_ShouldStopScanning(@TempDir Path tempDir) throws IOException {
        Path negative = tempDir.resolve("negative.tsv");
        Files.writeString(negative, "a\t1\nb\t-1\n");
        Path overflow = tempDir.resolve("overflow.tsv");
        Files.writeString(overflow, "a\t1\nb\t18446744073709551616\n");

        try (CheckpointStore store = new CheckpointStore(negative)) {
            assertEquals(Map.of("a", 1L), store.load());
        }
        try (CheckpointStore store = new CheckpointStore(overflow)) {
            assertEquals(Map.of("a", 1L), store.load());
        }
    }

    @Test
    void testEmptyLine_ShouldStopScanning(@TempDir Path tempDir) throws IOException {
        Path file = writeFile(tempDir, "a\t1\n\nb\t2\n");

        try (CheckpointStore store = new CheckpointStore(file)) {
            assertEquals(Map.of("a", 1L), store.load());
        }
    }

    @Test
    void testInvalidUtf8_ShouldStopScanning(@TempDir Path tempDir) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.writeBytes("a\t1\n".getBytes(StandardCharsets.UTF_8));
        bytes.writeBytes(new byte[]{(byte) 0xFF, (byte) 0xFE, '\t', '2', '\n'});
        Path file = tempDir.resolve("phash.tsv");
        Files.write(file, bytes.toByteArray());

        try (CheckpointStore store = new CheckpointStore(file)) {
            assertEquals(Map.of("a", 1L), store.load());
        }
        assertEquals(4L, Files.size(file));
    }

    @Test
    void testWellFormedFile_ShouldLoadEverythingAndAppendAtEnd(@TempDir Path tempDir) throws IOException {
        String content = "一/相片.jpg\t42\nb.png\t0\n";
        Path file = writeFile(tempDir, content);

        try (CheckpointStore store = new CheckpointStore(file)) {
            assertEquals(Map.of("一/相片.jpg", 42L, "b.png", 0L), store.load());
            assertEquals(content.getBytes(StandardCharsets.UTF_8).length, store.validLength());
            store.append(new CacheEntry("c.gif", 7L));
        }

        assertEquals(content + "c.gif\t7\n", Files.readString(file));
    }

    @Test
    void testMissingFile_ShouldBeCreatedWithParents(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("nested").resolve("dir").resolve("phash.tsv");

        try (CheckpointStore store = new CheckpointStore(file)) {
            assertTrue(store.load().isEmpty());
        }

        assertTrue(Files.exists(file));
        assertEquals(0L, Files.size(file));
    }

    @Test
    void testParentIsRegularFile_ShouldThrowIOException(@TempDir Path tempDir) throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThrows(IOException.class, () -> new CheckpointStore(blocker.resolve("phash.tsv")));
    }

    /**
     * 雜湊以無號十進位表示，最大值必須可完整寫入與讀回
     */
    @Test
    void testMaxUnsignedHash_ShouldRoundTrip(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("phash.tsv");

        try (CheckpointStore store = new CheckpointStore(file, false)) {
            store.load();
            store.append(new CacheEntry("max.png", -1L));
        }
        assertEquals("max.png\t18446744073709551615\n", Files.readString(file));

        try (CheckpointStore store = new CheckpointStore(file)) {
            assertEquals(Map.of("max.png", -1L), store.load());
        }
    }

    @Test
    void testPathWithDelimiter_ShouldBeRejected(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("phash.tsv");

        try (CheckpointStore store = new CheckpointStore(file)) {
            store.load();
            assertFalse(store.append(new CacheEntry("tab\there.png", 1L)));
            assertFalse(store.append(new CacheEntry("new\nline.png", 2L)));
            assertTrue(store.append(new CacheEntry("ok.png", 3L)));
        }

        assertEquals("ok.png\t3\n", Files.readString(file));
    }

    @Test
    void testNullEntry_ShouldThrowNullPointerException(@TempDir Path tempDir) throws IOException {
        try (CheckpointStore store = new CheckpointStore(tempDir.resolve("phash.tsv"))) {
            store.load();
            assertThrows(NullPointerException.class, () -> store.append(null));
        }
    }

    @Test
    void testAppendBeforeLoad_ShouldThrow(@TempDir Path tempDir) throws IOException {
        Path file = writeFile(tempDir, "a\t1\n");

        try (CheckpointStore store = new CheckpointStore(file)) {
            assertThrows(IllegalStateException.class, () -> store.append(new CacheEntry("b", 2L)));
        }
        assertEquals("a\t1\n", Files.readString(file));
    }
}
