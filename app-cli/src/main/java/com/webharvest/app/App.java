package com.webharvest.app;

import com.webharvest.app.logging.LogSetup;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.CrawlSummary;
import com.webharvest.core.service.CrawlService;
import com.webharvest.core.service.export.OutputNaming;
import com.webharvest.core.util.ProgressListener;
import com.webharvest.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 커맨드라인 실행기.
 * <pre>
 *   java -jar webharvest-app-cli.jar [crawl.yml] [seeds.txt]
 * </pre>
 * 종료 코드: 0 정상, 1 설정/시드 문제.
 */
public final class App {

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG = 1;

    private App() {}

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path configPath = Path.of(args.length > 0 ? args[0] : System.getProperty("wh.config", "crawl.yml"));

        CrawlConfig cfg;
        try {
            cfg = Files.exists(configPath) ? YamlConfigLoader.load(configPath) : CrawlConfig.defaults();
        } catch (IOException | RuntimeException e) {
            err.println("Invalid configuration " + configPath + ": " + e.getMessage());
            return EXIT_CONFIG;
        }
        if (args.length > 1) cfg.setSeedsPath(Path.of(args[1]));

        OutputNaming.Layout layout = OutputNaming.layout(cfg.getOutputDir());
        LogSetup.init(layout.logsDir());
        Logger log = LoggerFactory.getLogger(App.class);
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                log.error("Uncaught exception in {}", t.getName(), e));

        if (!Files.exists(configPath)) {
            log.info("Config {} not found, using defaults", configPath.toAbsolutePath());
        }

        List<String> seeds;
        try {
            seeds = SeedFile.load(cfg.getSeedsPath());
        } catch (IOException e) {
            err.println("Seed file not found: " + cfg.getSeedsPath().toAbsolutePath());
            return EXIT_CONFIG;
        }
        if (seeds.isEmpty()) {
            err.println("No seed URLs in " + cfg.getSeedsPath().toAbsolutePath());
            return EXIT_CONFIG;
        }

        CrawlSummary summary;
        try {
            CrawlService service = new CrawlService(cfg);
            summary = service.run(seeds, consoleProgress(out));
        } catch (IOException e) {
            log.error("Crawl aborted: {}", e.getMessage(), e);
            err.println("Crawl aborted: " + e.getMessage());
            return EXIT_CONFIG;
        }

        out.println();
        out.println("Crawl finished in " + summary.elapsed().toMillis() + " ms");
        out.println("  pages saved : " + summary.pagesSaved());
        out.println("  failed      : " + summary.failed());
        out.println("  blocked     : " + summary.blocked());
        out.println("  metadata    : " + layout.indexJson().toAbsolutePath());
        out.println("  markdown    : " + layout.markdownDir().toAbsolutePath());
        return EXIT_OK;
    }

    /** 시드 시작 시 "Crawling seed i: url" 출력 */
    static ProgressListener consoleProgress(PrintStream out) {
        return (progress, phase, done, total, detail) -> {
            if ("seed".equals(phase)) {
                out.println("Crawling seed " + (done + 1) + "/" + total + ": " + detail);
            }
        };
    }
}
