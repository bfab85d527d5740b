package com.webharvester.core.crawler;

import com.webharvester.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 크롤 큐 + 방문 집합. 한 실행 범위.
 * - push 시점에 정규화 + 중복 제거(방문 집합이 권위): 한 URL 은 한 번만 큐에 들어간다
 * - pop 은 발견 순서(FIFO) → BFS, 같은 그래프/시드면 같은 순서
 * - 모든 메서드 synchronized: 방문 검사와 추가가 한 단계
 */
public final class Frontier {

    private final Deque<FrontierEntry> queue = new ArrayDeque<>();
    private final Set<URI> visited = new LinkedHashSet<>(); // 삽입 순서 유지(스냅샷 재현성)
    private long nextSequence = 0;

    /**
     * 정규화 후 미방문이면 방문 처리 + 큐 뒤에 추가.
     * @return 새로 큐에 들어갔으면 true, 이미 방문했거나 크롤 대상이 아니면 false
     */
    public synchronized boolean push(URI url) {
        URI n = UrlUtils.normalize(url);
        if (n == null) return false;
        if (!visited.add(n)) return false;
        queue.addLast(new FrontierEntry(n, nextSequence++));
        return true;
    }

    /** 가장 먼저 발견된 항목을 꺼낸다. 비었으면 empty */
    public synchronized Optional<FrontierEntry> pop() {
        return Optional.ofNullable(queue.pollFirst());
    }

    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized int visitedCount() {
        return visited.size();
    }

    public synchronized boolean isVisited(URI url) {
        URI n = UrlUtils.normalize(url);
        return n != null && visited.contains(n);
    }

    /** 방문 집합 복사본(삽입 순서) */
    public synchronized Set<URI> visitedSnapshot() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(visited));
    }

    /**
     * 큐에 넣지 않고 방문 처리만 한다(명시적 시딩: 이전 실행에서 이미 가져온 URL 등).
     * @return 새로 표시된 개수
     */
    public synchronized int seed(Collection<URI> urls) {
        int added = 0;
        for (URI u : urls) {
            URI n = UrlUtils.normalize(u);
            if (n != null && visited.add(n)) added++;
        }
        return added;
    }

    /** 남은 큐를 버린다(방문 집합은 유지). 버린 개수 반환 */
    public synchronized int drain() {
        int n = queue.size();
        queue.clear();
        return n;
    }
}
