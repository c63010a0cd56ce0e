package work.pollochang.phash.cache;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.phash.tools.FileTools;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 可續跑的檢查點檔案，同時也是最終輸出。
 *
 * <p>檔案格式為 UTF-8 文字，每行 {@code <path>\t<hash>\n}。只有以換行結尾、
 * 恰好兩個欄位且第二欄可解析為無號 64 位元整數的行才視為有效。
 * {@link #load()} 由檔頭逐行驗證，遇到第一個無效行即停止，並把寫入位置移到最後一個有效行之後，
 * 上次執行中斷時留下的半行資料會被丟棄。
 *
 * <p>{@link #append(CacheEntry)} 每次寫入一行並立即同步到磁碟，當機時最多遺失正在寫入的那一筆。
 *
 * <p>本類別不是執行緒安全的：整個執行期間只能由單一寫入者使用。
 *
 * @author PolloChang
 * @since 1.0.0
 */
@Slf4j
public class CheckpointStore implements AutoCloseable {

    private static final int READ_BUFFER_SIZE = 64 * 1024;

    private final Path path;
    private final FileChannel channel;
    private final boolean sync;
    private long validLength;
    private boolean loaded;

    /**
     * 開啟 (必要時建立) 檢查點檔案，每次寫入都同步到磁碟。
     *
     * @param path 檢查點檔案路徑
     * @throws IOException 無法開啟檔案時拋出，屬於致命錯誤
     */
    public CheckpointStore(Path path) throws IOException {
        this(path, true);
    }

    /**
     * @param path 檢查點檔案路徑
     * @param sync 是否在每次寫入後呼叫 {@link FileChannel#force(boolean)}
     * @throws IOException 無法建立上層目錄或開啟檔案時拋出，屬於致命錯誤
     */
    public CheckpointStore(Path path, boolean sync) throws IOException {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.sync = sync;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
            log.info("{} - 已建立檢查點目錄", parent);
        }
        this.channel = FileChannel.open(path,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.CREATE);
    }

    /**
     * 讀取並驗證檢查點檔案，回傳有效前段中的所有紀錄。
     * 結束後寫入位置位於最後一個有效行之後，其後的殘留位元組會被截斷。
     *
     * @return 路徑對雜湊的對照表
     * @throws IOException 讀取檔案時發生 I/O 錯誤
     */
    public Map<String, Long> load() throws IOException {
        Map<String, Long> cache = new HashMap<>();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        channel.position(0);
        // 不可關閉此串流，否則會一併關閉 channel
        InputStream in = new BufferedInputStream(Channels.newInputStream(channel), READ_BUFFER_SIZE);
        ByteArrayOutputStream line = new ByteArrayOutputStream(256);

        long offset = 0;
        long valid = 0;
        while (true) {
            line.reset();
            boolean terminated = false;
            int b;
            while ((b = in.read()) != -1) {
                if (b == CacheEntry.LINE_TERMINATOR) {
                    terminated = true;
                    break;
                }
                line.write(b);
            }
            if (!terminated) {
                if (line.size() > 0) {
                    log.debug("{} - 位移 {} 處有未完成的行 ({} bytes)，將被捨棄", path, offset, line.size());
                }
                break;
            }
            offset += line.size() + 1L;

            CacheEntry entry = parseLine(line.toByteArray(), decoder);
            if (entry == null) {
                log.debug("{} - 位移 {} 之前的行格式不正確，停止讀取", path, offset);
                break;
            }
            cache.put(entry.path(), entry.hash());
            valid = offset;
        }

        long size = channel.size();
        if (size > valid) {
            log.debug("{} - 截斷 {} bytes 的殘留資料", path, size - valid);
            channel.truncate(valid);
        }
        channel.position(valid);
        validLength = valid;
        loaded = true;
        log.info("從檢查點 {} 讀取 {} 筆紀錄 (有效長度: {})", path, cache.size(), FileTools.formatFileSize(valid));
        return cache;
    }

    /**
     * 寫入一筆紀錄並立即同步。路徑含有 tab 或換行時拒絕寫入。
     *
     * @param entry 要寫入的紀錄
     * @return 成功寫入回傳 {@code true}；因路徑含保留字元而略過時回傳 {@code false}
     * @throws IOException 寫入失敗，屬於致命錯誤
     * @throws IllegalStateException 尚未呼叫 {@link #load()}
     */
    public boolean append(CacheEntry entry) throws IOException {
        Objects.requireNonNull(entry, "entry must not be null");
        if (!loaded) {
            // 未驗證前寫入位置在檔頭，會覆蓋既有紀錄
            throw new IllegalStateException("load() must be called before append()");
        }
        if (!entry.hasWritablePath()) {
            log.warn("路徑含有 tab 或換行字元，將略過: {}", entry.path());
            return false;
        }
        ByteBuffer buffer = ByteBuffer.wrap(entry.toLine().getBytes(StandardCharsets.UTF_8));
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        if (sync) {
            channel.force(false);
        }
        validLength = channel.position();
        return true;
    }

    /**
     * 目前檔案中有效資料的長度 (bytes)。
     */
    public long validLength() {
        return validLength;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    // 回傳 null 代表此行無效
    private static CacheEntry parseLine(byte[] bytes, CharsetDecoder decoder) {
        String text;
        try {
            CharBuffer chars = decoder.reset().decode(ByteBuffer.wrap(bytes));
            text = chars.toString();
        } catch (CharacterCodingException e) {
            return null;
        }

        String[] fields = text.split(String.valueOf(CacheEntry.FIELD_SEPARATOR), -1);
        if (fields.length != 2) {
            return null;
        }
        try {
            long hash = Long.parseUnsignedLong(fields[1].strip());
            return new CacheEntry(fields[0].strip(), hash);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
