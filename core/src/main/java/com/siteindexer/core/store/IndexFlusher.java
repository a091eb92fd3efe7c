package com.siteindexer.core.store;

import com.siteindexer.core.api.IIndexSink;
import com.siteindexer.core.util.NamedThreadFactory;
import com.siteindexer.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 인덱스 스냅샷을 싱크로 내보낸다.
 * - 단일 writer 스레드: 쓰기 순서 보장, 크롤 스레드는 I/O를 기다리지 않음
 * - 아직 시작 안 된 요청이 있으면 최신 스냅샷으로 교체(합치기)
 * - 실패는 로그/카운트만 하고 크롤을 멈추지 않는다
 */
public final class IndexFlusher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(IndexFlusher.class);
    private static final StructuredLog SLOG = StructuredLog.get(IndexFlusher.class);

    private final IIndexSink sink;
    private final ExecutorService writerThread;
    private final AtomicReference<Map<String, Map<String, List<Integer>>>> pending = new AtomicReference<>();
    private final AtomicInteger flushCount = new AtomicInteger(0);
    private final AtomicInteger failureCount = new AtomicInteger(0);

    public IndexFlusher(IIndexSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.writerThread = Executors.newSingleThreadExecutor(new NamedThreadFactory("index-flusher"));
    }

    /** 비동기 flush 요청. 호출 스레드는 바로 돌아간다. */
    public void requestFlush(Map<String, Map<String, List<Integer>>> snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (pending.getAndSet(snapshot) == null) {
            writerThread.execute(() -> {
                var snap = pending.getAndSet(null);
                if (snap != null) writeOnce(snap);
            });
        }
    }

    /**
     * 동기 flush. 앞서 대기 중이던 요청은 이 스냅샷으로 대체된다.
     * @return 쓰기 성공 여부
     */
    public boolean flushNow(Map<String, Map<String, List<Integer>>> snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        pending.set(null);
        try {
            return writerThread.submit(() -> writeOnce(snapshot)).get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Flush interrupted: {}", sink.describe());
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Flush task failed: {}", cause.toString(), cause);
            return false;
        }
    }

    private boolean writeOnce(Map<String, Map<String, List<Integer>>> snapshot) {
        long t0 = System.nanoTime();
        try {
            sink.write(snapshot);
            int n = flushCount.incrementAndGet();
            long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            LOG.info("→ Flushed index ({} terms) to {}", snapshot.size(), sink.describe());
            SLOG.info("index-flushed",
                    "terms", snapshot.size(),
                    "target", sink.describe(),
                    "flushNo", n,
                    "ms", ms);
            return true;
        } catch (Exception e) {
            failureCount.incrementAndGet();
            LOG.warn("Flush failed: {} ({})", sink.describe(), e.toString());
            SLOG.error("flush-failed", e, "target", sink.describe());
            return false;
        }
    }

    public int getFlushCount() { return flushCount.get(); }

    public int getFailureCount() { return failureCount.get(); }

    @Override
    public void close() {
        writerThread.shutdown();
        try {
            if (!writerThread.awaitTermination(30, TimeUnit.SECONDS)) {
                writerThread.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            writerThread.shutdownNow();
        }
    }
}
