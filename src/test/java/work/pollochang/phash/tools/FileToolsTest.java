package work.pollochang.phash.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @Test
    void testFormatFileSize_ShouldPickLargestUnit() {
        assertEquals("0 B", FileTools.formatFileSize(0));
        assertEquals("0 B", FileTools.formatFileSize(-5));
        assertEquals("1,023 B", FileTools.formatFileSize(1023));
        assertEquals("1.5 KB", FileTools.formatFileSize(1536));
        assertEquals("2 MB", FileTools.formatFileSize(2L * 1024 * 1024));
        assertEquals("2,048 TB", FileTools.formatFileSize(2048L * 1024 * 1024 * 1024 * 1024));
    }

    @Test
    void testFormatDuration_ShouldUseHoursMinutesSeconds() {
        assertEquals("0:00:00", FileTools.formatDuration(999));
        assertEquals("1:01:05", FileTools.formatDuration(3_665_000));
    }
}
