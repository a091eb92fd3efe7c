package com.siteindexer.core.crawler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 방문 대기 FIFO 큐 + seen 집합.
 * 중복 제거는 발견 시점에 한다: enqueue 하는 순간 seen 처리되므로
 * 방문 전에 두 번 발견된 URL도 큐에는 한 번만 들어가고, 한 번 seen 되면 다시 fetch 되지 않는다.
 * 단일 스레드(크롤 루프)에서만 접근한다.
 */
public final class Frontier {

    private final Deque<String> queue = new ArrayDeque<>();
    private final Set<String> seen = new HashSet<>();

    /** @return 새로 큐에 들어갔으면 true, 이미 본 URL이면 false */
    public boolean enqueue(String url) {
        Objects.requireNonNull(url, "url");
        if (!seen.add(url)) return false;
        queue.addLast(url);
        return true;
    }

    public Optional<String> dequeue() {
        return Optional.ofNullable(queue.pollFirst());
    }

    public boolean isEmpty() { return queue.isEmpty(); }

    /** 대기 중인 URL 수 */
    public int size() { return queue.size(); }

    public int seenCount() { return seen.size(); }

    public boolean hasSeen(String url) { return seen.contains(url); }
}
