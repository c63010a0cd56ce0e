package work.pollochang.phash.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 讀取圖片路徑清單，每行一個路徑。
 * 每行去除前後空白，空白行略過。
 * 遇到第一個不是有效 UTF-8 的行即停止讀取，之前的路徑照常處理。
 */
@Slf4j
public class PathListReader {

    public static final String STDIN = "-";

    /**
     * 開啟路徑清單。使用完畢需關閉回傳的 {@link Stream}。
     *
     * @param source 清單檔案路徑，{@code "-"} 代表標準輸入
     * @return 延遲讀取的路徑串流
     * @throws IOException 無法開啟清單檔案
     */
    public static Stream<String> open(String source) throws IOException {
        if (STDIN.equals(source)) {
            return lines(System.in);
        }
        InputStream in = Files.newInputStream(Path.of(source));
        return read(in, source).onClose(() -> {
            try {
                in.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * 從任意輸入流讀取路徑清單；不會關閉該輸入流。
     */
    public static Stream<String> lines(InputStream in) {
        return read(in, "stdin");
    }

    private static Stream<String> read(InputStream in, String source) {
        Iterator<String> lines = new Utf8LineIterator(new BufferedInputStream(in), source);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(lines, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .map(String::strip)
                .filter(line -> !line.isEmpty());
    }

    /**
     * 逐行讀取位元組並以嚴格模式解碼，解碼失敗時結束迭代。
     */
    private static final class Utf8LineIterator implements Iterator<String> {
        private final InputStream in;
        private final String source;
        private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
        private long lineNumber;
        private String next;
        private boolean finished;

        private Utf8LineIterator(InputStream in, String source) {
            this.in = in;
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !finished) {
                next = readLine();
                finished = next == null;
            }
            return next != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String line = next;
            next = null;
            return line;
        }

        private String readLine() {
            buffer.reset();
            int b = -1;
            try {
                while ((b = in.read()) != -1 && b != '\n') {
                    buffer.write(b);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("讀取路徑清單失敗: " + source, e);
            }
            if (b == -1 && buffer.size() == 0) {
                return null;
            }
            lineNumber++;
            try {
                return decoder.reset().decode(ByteBuffer.wrap(buffer.toByteArray())).toString();
            } catch (CharacterCodingException e) {
                log.warn("{} - 第 {} 行不是有效的 UTF-8，停止讀取路徑清單", source, lineNumber);
                return null;
            }
        }
    }
}
