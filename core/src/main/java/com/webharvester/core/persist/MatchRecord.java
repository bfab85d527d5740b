package com.webharvester.core.persist;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

/**
 * matches.jsonl 한 줄. 쓰고 나면 바뀌지 않는다.
 * @param savedPath     저장된 본문 파일 경로(출력 디렉터리 기준 그대로)
 * @param contentLength 저장된 바이트 수
 * @param matches       URL 에서 패턴이 잡은 부분 문자열들
 */
@JsonPropertyOrder({"url", "host", "fetchedAt", "httpStatus", "contentLength", "savedPath", "matches"})
public record MatchRecord(String url,
                          String host,
                          Instant fetchedAt,
                          int httpStatus,
                          long contentLength,
                          String savedPath,
                          List<String> matches) {

    public MatchRecord {
        matches = (matches == null) ? List.of() : List.copyOf(matches);
    }
}
