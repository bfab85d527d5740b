package com.webharvester.core.persist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webharvester.core.model.ContentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 매치 페이지 저장 + matches.jsonl 기록.
 * - 본문: outputDir/&lt;host&gt;/&lt;PageNaming 규칙&gt;
 * - 기록: outputDir/matches.jsonl, CREATE+APPEND 로만 연다(이전 기록은 절대 자르지 않음)
 * - 라인당 순수 JSON 하나, 락 안에서 쓰고 바로 flush → 실행 중에 tail 해도 안전
 * - 파일 소유(어느 URL 의 본문인가)는 실행을 넘어 유지된다: 처음 저장할 때 기존 matches.jsonl 로
 *   복원하고, 기록에 없는 기존 파일은 남의 것으로 본다
 * - IOException 은 전부 PersistenceException(치명)
 */
public final class PersistenceWriter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PersistenceWriter.class);

    public static final String RECORDS_FILE = "matches.jsonl";

    private final Path outputDir;
    private final Path recordsFile;
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);   // ISO-8601

    private final Object lock = new Object();
    private final Map<Path, URI> claimed = new HashMap<>();             // 절대 경로 → 그 파일을 가진 URL
    private boolean historyLoaded = false;
    private BufferedWriter writer;
    private boolean closed = false;

    public PersistenceWriter(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.recordsFile = outputDir.resolve(RECORDS_FILE);
    }

    public Path getOutputDir() { return outputDir; }
    public Path getRecordsFile() { return recordsFile; }

    /** HTML 본문 저장 */
    public Path save(String host, URI url, byte[] body) {
        return save(host, url, body, ContentKind.HTML);
    }

    /**
     * 본문을 결정적 경로에 쓰고 그 경로를 돌려준다.
     * 같은 파일명을 다른 URL 이 가졌으면(이번 실행이든 이전 기록이든) _&lt;hash&gt; 를 붙인다.
     * 주인을 모르는 기존 파일도 덮어쓰지 않는다.
     */
    public Path save(String host, URI url, byte[] body, ContentKind kind) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(body, "body");
        Path dir = outputDir.resolve(PageNaming.hostDir(host, url.getPort()));

        Path target;
        synchronized (lock) {
            ensureOpen();
            loadHistory();
            target = claim(dir, url, kind);
        }
        try {
            Files.createDirectories(dir);
            Files.write(target, body,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new PersistenceException("cannot write page " + url + " to " + target, e);
        }
        return target;
    }

    /** 기록 한 줄 추가 */
    public void appendRecord(MatchRecord record) {
        Objects.requireNonNull(record, "record");
        String json;
        try {
            json = om.writeValueAsString(record);
        } catch (IOException e) {
            throw new PersistenceException("cannot serialize record for " + record.url(), e);
        }
        synchronized (lock) {
            ensureOpen();
            try {
                if (writer == null) {
                    Files.createDirectories(outputDir);
                    writer = Files.newBufferedWriter(recordsFile, StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                }
                writer.write(json);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                throw new PersistenceException("cannot append record to " + recordsFile, e);
            }
        }
    }

    private Path claim(Path dir, URI url, ContentKind kind) {
        String stem = PageNaming.stem(url);
        String ext = PageNaming.ext(url, kind);

        Path candidate = dir.resolve(stem + ext);
        if (takenByOther(candidate, url)) {
            candidate = dir.resolve(stem + "_" + PageNaming.shortHash(url) + ext);
            int n = 1;
            while (takenByOther(candidate, url)) { // 해시까지 겹치는 경우
                candidate = dir.resolve(stem + "_" + PageNaming.shortHash(url) + "_" + n++ + ext);
            }
        }
        claimed.put(key(candidate), url);
        return candidate;
    }

    /** 다른 URL 이 가졌거나, 주인을 모르는 파일이 이미 디스크에 있으면 true */
    private boolean takenByOther(Path candidate, URI url) {
        URI owner = claimed.get(key(candidate));
        if (owner != null) return !owner.equals(url);
        return Files.exists(candidate);
    }

    /** 이전 실행의 기록(savedPath → url)으로 소유 정보를 복원한다. 한 번만 */
    private void loadHistory() {
        if (historyLoaded) return;
        historyLoaded = true;
        if (!Files.isRegularFile(recordsFile)) return;

        int restored = 0;
        try (BufferedReader in = Files.newBufferedReader(recordsFile, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = in.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                JsonNode n;
                try {
                    n = om.readTree(line);
                } catch (IOException e) {
                    LOG.warn("Ignoring unreadable line {} of {}: {}", lineNo, recordsFile, e.getMessage());
                    continue;
                }
                JsonNode u = n.get("url");
                JsonNode p = n.get("savedPath");
                if (u == null || p == null || !u.isTextual() || !p.isTextual()) continue;
                try {
                    claimed.put(key(Path.of(p.asText())), new URI(u.asText()));
                    restored++;
                } catch (URISyntaxException | InvalidPathException e) {
                    LOG.warn("Ignoring record at line {} of {}: {}", lineNo, recordsFile, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("cannot read previous records from " + recordsFile, e);
        }
        LOG.debug("Restored {} saved-file owners from {}", restored, recordsFile);
    }

    private static Path key(Path p) {
        return p.toAbsolutePath().normalize();
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("writer closed");
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
            if (writer != null) {
                try {
                    writer.close();
                } catch (IOException e) {
                    throw new PersistenceException("cannot close " + recordsFile, e);
                } finally {
                    writer = null;
                }
            }
        }
    }
}
