package work.pollochang.phash;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.phash.cache.CacheEntry;
import work.pollochang.phash.cache.CheckpointStore;
import work.pollochang.phash.core.DctMatrix;
import work.pollochang.phash.core.HashResult;
import work.pollochang.phash.core.ImageDecoder;
import work.pollochang.phash.core.ImageHasher;
import work.pollochang.phash.core.PerceptualHash;
import work.pollochang.phash.report.HashReport;
import work.pollochang.phash.report.RunSummary;
import work.pollochang.phash.tools.FileTools;
import work.pollochang.phash.tools.PathListReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 進行批次雜湊
 *
 * <p>流程：讀取檢查點 → 由候選清單扣除已完成的路徑 → 固定大小執行緒池平行計算 →
 * 有界佇列 → 單一寫入執行緒逐筆附加到檢查點檔案。
 * 工作執行緒在佇列滿時會阻塞，藉此限制記憶體用量。
 */
@Setter
@Slf4j
public class HashBatch {

    public static final int DEFAULT_QUEUE_CAPACITY = 256;
    private static final int PROGRESS_INTERVAL = 1000;
    private static final CacheEntry POISON = new CacheEntry("", 0L);

    private String inputSource = PathListReader.STDIN;
    private Path outputPath;
    private int threadCount = Math.max(1, Runtime.getRuntime().availableProcessors());
    private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
    private boolean sync = true;
    private Path reportPath;

    /**
     * 執行一次批次作業，直到所有路徑處理完畢。
     *
     * @return 本次執行的統計結果
     * @throws IOException          無法開啟輸入清單、檢查點檔案，或寫入檢查點失敗
     * @throws InterruptedException 等待執行緒結束時被中斷
     */
    public RunSummary execute() throws IOException, InterruptedException {
        Objects.requireNonNull(outputPath, "outputPath must not be null");
        if (threadCount <= 0) {
            throw new IllegalArgumentException("threadCount must be positive: " + threadCount);
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        long startTime = System.currentTimeMillis();

        // 所有工作執行緒共用同一個唯讀的 DCT 基底
        ImageHasher hasher = new ImageHasher(new ImageDecoder(), new PerceptualHash(new DctMatrix(PerceptualHash.SAMPLE_SIZE)));

        Map<HashResult, AtomicLong> counters = new EnumMap<>(HashResult.class);
        for (HashResult result : HashResult.values()) {
            counters.put(result, new AtomicLong(0));
        }

        long candidates;
        long cached;
        Set<String> work;

        try (CheckpointStore store = openStore()) {
            Map<String, Long> cache = store.load();

            AtomicLong lineCount = new AtomicLong();
            Set<String> distinct;
            try (Stream<String> lines = PathListReader.open(inputSource)) {
                distinct = lines.peek(line -> lineCount.incrementAndGet())
                        .collect(Collectors.toCollection(LinkedHashSet::new));
            }
            candidates = lineCount.get();
            work = new LinkedHashSet<>(distinct);
            work.removeAll(cache.keySet());
            cached = distinct.size() - work.size();
            log.info("候選路徑: {} 行, 不重複: {}, 已在檢查點中: {}, 待處理: {}",
                    candidates, distinct.size(), cached, work.size());

            if (!work.isEmpty()) {
                runPipeline(store, hasher, work, counters, startTime);
            } else {
                log.info("沒有需要計算的圖片。");
            }
        }

        Map<HashResult, Long> outcomes = new EnumMap<>(HashResult.class);
        counters.forEach((result, count) -> outcomes.put(result, count.get()));
        RunSummary summary = new RunSummary(
                inputSource,
                outputPath.toString(),
                candidates,
                cached,
                work.size(),
                outcomes.get(HashResult.HASHED),
                outcomes.get(HashResult.REJECTED_PATH),
                outcomes,
                System.currentTimeMillis() - startTime
        );
        logSummary(summary);
        if (reportPath != null) {
            saveReport(reportPath, summary);
        }
        return summary;
    }

    CheckpointStore openStore() throws IOException {
        return new CheckpointStore(outputPath, sync);
    }

    private void runPipeline(CheckpointStore store,
                             ImageHasher hasher,
                             Set<String> work,
                             Map<HashResult, AtomicLong> counters,
                             long startTime) throws IOException, InterruptedException {
        BlockingQueue<CacheEntry> queue = new ArrayBlockingQueue<>(queueCapacity);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CheckpointWriter writer = new CheckpointWriter(store, queue, executor, counters, work.size(), startTime);

        // 單一寫入執行緒獨佔檢查點檔案
        Thread writerThread = new Thread(writer, "checkpoint-writer");
        writerThread.start();
        log.info("建立固定大小為 {} 的執行緒池，佇列容量 {}。", threadCount, queueCapacity);

        try {
            for (String path : work) {
                if (writer.failure() != null) {
                    break;
                }
                executor.submit(() -> hashOne(hasher, path, queue, counters));
            }
        } catch (RejectedExecutionException e) {
            // 寫入執行緒失敗時會關閉執行緒池
            log.debug("執行緒池已關閉，停止提交任務。");
        }

        log.info("所有任務已提交，等待處理完成...");
        executor.shutdown();
        while (!executor.awaitTermination(1, TimeUnit.HOURS)) {
            log.info("仍在等待工作執行緒完成...");
        }

        // 寫入執行緒若已結束，就不再等待佇列空位
        while (writerThread.isAlive() && !queue.offer(POISON, 1, TimeUnit.SECONDS)) {
            log.debug("等待寫入執行緒清空佇列...");
        }
        writerThread.join();

        IOException failure = writer.failure();
        if (failure != null) {
            throw new IOException("寫入檢查點檔案失敗: " + store.path(), failure);
        }
    }

    private static void hashOne(ImageHasher hasher,
                                String path,
                                BlockingQueue<CacheEntry> queue,
                                Map<HashResult, AtomicLong> counters) {
        HashReport report = hasher.processImage(path);
        if (!report.isSuccess()) {
            counters.get(report.result()).incrementAndGet();
            return;
        }
        try {
            // 佇列已滿時阻塞
            queue.put(new CacheEntry(path, report.hash()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} - 結果未寫入，工作執行緒已被中斷", path);
        }
    }

    private void logSummary(RunSummary summary) {
        log.info("所有圖片處理完成！");
        log.info("========================================雜湊統計報告========================================");
        log.info(" 候選路徑: {}, 已快取略過: {}, 本次處理: {}", summary.candidates(), summary.cached(), summary.scheduled());
        log.info(" 成功寫入: {}, 路徑含保留字元: {}, 失敗: {}", summary.hashed(), summary.rejected(), summary.failed());
        summary.outcomes().forEach((result, count) -> {
            if (count > 0) {
                log.info("   {}: {}", result.getDescription(), count);
            }
        });
        log.info(" 耗時: {}", FileTools.formatDuration(summary.elapsedMillis()));
        log.info("========================================雜湊統計報告========================================");
    }

    /**
     * 將統計結果儲存為 JSON，失敗時只記錄錯誤，不影響本次執行結果。
     */
    private void saveReport(Path path, RunSummary summary) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        try {
            mapper.writeValue(path.toFile(), summary);
            log.info("統計報告已儲存至 {}", path);
        } catch (IOException e) {
            log.error("儲存統計報告至檔案 {} 時發生錯誤。", path, e);
        }
    }

    /**
     * 由佇列取出結果並依到達順序寫入檢查點，直到收到結束標記。
     */
    private static final class CheckpointWriter implements Runnable {
        private final CheckpointStore store;
        private final BlockingQueue<CacheEntry> queue;
        private final ExecutorService executor;
        private final Map<HashResult, AtomicLong> counters;
        private final long total;
        private final long startTime;
        private volatile IOException failure;

        private CheckpointWriter(CheckpointStore store,
                                 BlockingQueue<CacheEntry> queue,
                                 ExecutorService executor,
                                 Map<HashResult, AtomicLong> counters,
                                 long total,
                                 long startTime) {
            this.store = store;
            this.queue = queue;
            this.executor = executor;
            this.counters = counters;
            this.total = total;
            this.startTime = startTime;
        }

        @Override
        public void run() {
            long written = 0;
            try {
                while (true) {
                    CacheEntry entry = queue.take();
                    if (entry == POISON) {
                        return;
                    }
                    if (failure != null) {
                        // 已失敗：只清空佇列，避免工作執行緒卡在 put
                        continue;
                    }
                    try {
                        if (store.append(entry)) {
                            counters.get(HashResult.HASHED).incrementAndGet();
                        } else {
                            counters.get(HashResult.REJECTED_PATH).incrementAndGet();
                        }
                    } catch (IOException e) {
                        fail(e);
                        continue;
                    } catch (RuntimeException | Error e) {
                        fail(new IOException(e));
                        continue;
                    }
                    written++;
                    if (written % PROGRESS_INTERVAL == 0) {
                        log.info("進度: {}/{} (耗時 {})", written, total,
                                FileTools.formatDuration(System.currentTimeMillis() - startTime));
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(new IOException("檢查點寫入執行緒被中斷", e));
            } catch (RuntimeException | Error e) {
                fail(new IOException(e));
            }
        }

        private void fail(IOException e) {
            log.error("寫入檢查點檔案 {} 失敗，停止所有工作", store.path(), e);
            if (failure == null) {
                failure = e;
            }
            executor.shutdownNow();
        }

        private IOException failure() {
            return failure;
        }
    }
}
