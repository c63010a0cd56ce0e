package work.pollochang.phash;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import work.pollochang.phash.report.RunSummary;
import work.pollochang.phash.tools.PathListReader;

import java.io.File;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "image-phash",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "批次計算圖片感知雜湊 (pHash)，結果寫入可續跑的檢查點檔案。")
public class Execute implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, defaultValue = PathListReader.STDIN, description = "包含圖片路徑的文字檔案，每行一個路徑；\"-\" 代表標準輸入 (預設: -)。")
    private String input;

    @Option(names = {"-o", "--output"}, required = true, description = "輸出檔案，下次執行時會重新讀取以略過已計算的圖片。")
    private File output;

    @Option(names = {"-t", "--threads"}, description = "工作執行緒數量 (預設: CPU 核心數)。")
    private Integer threads;

    @Option(names = {"--queue-capacity"}, defaultValue = "" + HashBatch.DEFAULT_QUEUE_CAPACITY, description = "工作執行緒與寫入執行緒之間的佇列容量 (預設: 256)。")
    private int queueCapacity;

    @Option(names = {"--no-fsync"}, description = "每筆寫入後不強制同步到磁碟，速度較快但當機時可能遺失較多紀錄。")
    private boolean noFsync;

    @Option(names = {"--report"}, description = "執行結束後將統計結果輸出為 JSON 檔案。")
    private File report;

    @Override
    public Integer call() throws Exception {
        int threadCount = threads != null ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());
        if (threadCount <= 0 || queueCapacity <= 0) {
            log.error("執行緒數量與佇列容量必須為正數");
            return CommandLine.ExitCode.USAGE;
        }

        log.info("========================================雜湊程式參數設定========================================");
        log.info("雜湊任務開始");
        log.info("來源列表: {}", PathListReader.STDIN.equals(input) ? "標準輸入" : new File(input).getAbsolutePath());
        log.info("輸出檔案: {}", output.getAbsolutePath());
        log.info("執行緒數量: {}", threadCount);
        log.info("佇列容量: {}", queueCapacity);
        log.info("每筆同步到磁碟: {}", !noFsync);
        log.info("========================================雜湊程式參數設定========================================");

        HashBatch hashBatch = new HashBatch();
        hashBatch.setInputSource(input);
        hashBatch.setOutputPath(output.toPath());
        hashBatch.setThreadCount(threadCount);
        hashBatch.setQueueCapacity(queueCapacity);
        hashBatch.setSync(!noFsync);
        hashBatch.setReportPath(report == null ? null : report.toPath());
        RunSummary summary = hashBatch.execute();

        log.info("所有任務執行完畢，本次寫入 {} 筆", summary.hashed());
        return CommandLine.ExitCode.OK; // 個別圖片失敗不影響結束代碼
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
