package com.webharvest.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webharvest.core.model.BlockedRecord;
import com.webharvest.core.model.CrawlSummary;
import com.webharvest.core.model.FailureRecord;
import com.webharvest.core.model.PageRecord;
import com.webharvest.core.service.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 파일 기반 sink.
 * - MDs/&lt;name&gt;.md : 페이지별 Markdown ("# 제목" + 본문)
 * - success_urls.txt / failed_urls.txt / blocked_urls.txt : 이벤트마다 한 줄 append
 * - index.json : finish()에서 한 번에 기록
 */
public class FileResultSink implements ResultSink {

    private static final Logger LOG = LoggerFactory.getLogger(FileResultSink.class);
    private static final int EXCERPT_LENGTH = 200;

    private final OutputNaming.Layout layout;
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);   // ISO-8601

    private final List<IndexEntry> index = new ArrayList<>();
    private final Set<String> usedNames = new HashSet<>();

    /** 출력 디렉터리를 만들고 로그 파일 3종을 비운다 */
    public FileResultSink(Path outDir) throws IOException {
        this.layout = OutputNaming.layout(Objects.requireNonNull(outDir, "outDir"));
        Files.createDirectories(layout.markdownDir());
        for (Path p : List.of(layout.successLog(), layout.failedLog(), layout.blockedLog())) {
            Files.writeString(p, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        }
    }

    @Override
    public synchronized boolean onPage(PageRecord page) {
        Path file = layout.markdownDir().resolve(
                OutputNaming.uniqueFileName(OutputNaming.baseName(page.url()), usedNames));
        try {
            Files.writeString(file, render(page), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            LOG.warn("Failed to write markdown for {} to {}: {}", page.url(), file, e.getMessage());
            return false;
        }
        append(layout.successLog(), page.url());
        index.add(new IndexEntry(page.url(), page.title(), page.fetchedAt(), page.status(), file.toString(),
                page.depth(), page.markdown().length(), page.outboundLinkCount(), excerpt(page.markdown())));
        return true;
    }

    @Override
    public synchronized void onFailure(FailureRecord f) {
        StringBuilder line = new StringBuilder(128)
                .append(f.url()).append('|')
                .append("error:").append(f.reason().label()).append('|')
                .append(f.timestamp());
        if (!f.detail().isBlank()) line.append('|').append(oneLine(f.detail()));
        append(layout.failedLog(), line.toString());
    }

    @Override
    public synchronized void onBlocked(BlockedRecord b) {
        String reason = b.reason().label() + (b.detail() == null ? "" : ":" + oneLine(b.detail()));
        append(layout.blockedLog(), b.url() + "|" + reason);
    }

    @Override
    public synchronized void finish(CrawlSummary summary) throws IOException {
        om.writerWithDefaultPrettyPrinter().writeValue(layout.indexJson().toFile(), index);
        LOG.info("Metadata index written: {} ({} pages)", layout.indexJson(), index.size());
    }

    public synchronized List<IndexEntry> entries() { return List.copyOf(index); }

    public OutputNaming.Layout layout() { return layout; }

    static String render(PageRecord page) {
        String heading = "# " + (page.title().isBlank() ? page.url() : page.title());
        String body = page.markdown();
        // 본문이 이미 같은 제목 헤딩으로 시작하면 중복 헤딩 생략
        if (body.startsWith(heading + "\n") || body.equals(heading)) return body + "\n";
        return heading + "\n\n" + body + "\n";
    }

    private void append(Path file, String line) {
        try {
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            LOG.warn("Failed to append to {}: {}", file, e.getMessage());
        }
    }

    private static String excerpt(String md) {
        String flat = md.replaceAll("\\s+", " ").trim();
        return flat.length() <= EXCERPT_LENGTH ? flat : flat.substring(0, EXCERPT_LENGTH) + "...";
    }

    private static String oneLine(String s) {
        return s.replace('\n', ' ').replace('\r', ' ').replace('|', '/');
    }
}
