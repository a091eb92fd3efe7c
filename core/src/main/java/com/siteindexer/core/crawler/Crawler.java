package com.siteindexer.core.crawler;

import com.siteindexer.core.api.ICrawler;
import com.siteindexer.core.api.IIndexSink;
import com.siteindexer.core.api.IPageFetcher;
import com.siteindexer.core.http.HttpPageFetcher;
import com.siteindexer.core.index.InvertedIndex;
import com.siteindexer.core.index.Tokenizer;
import com.siteindexer.core.model.CrawlConfig;
import com.siteindexer.core.model.CrawlResult;
import com.siteindexer.core.model.CrawlState;
import com.siteindexer.core.model.FetchedPage;
import com.siteindexer.core.model.SkipReason;
import com.siteindexer.core.store.IndexFlusher;
import com.siteindexer.core.store.JsonIndexStore;
import com.siteindexer.core.store.OutputNaming;
import com.siteindexer.core.util.NamedThreadFactory;
import com.siteindexer.core.util.StructuredLog;
import com.siteindexer.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BFS 기반 크롤 + 색인 루프.
 * <ol>
 *   <li>dequeue → 범위 검사(불일치면 조용히 스킵)</li>
 *   <li>fetch(타임아웃) → 2xx 아니면 스킵</li>
 *   <li>Content-Type text/html 아니면 스킵</li>
 *   <li>본문 텍스트/링크 추출 → 예외면 문서 통째로 포기</li>
 *   <li>토큰화 후 색인, 링크는 현재 문서 URL 기준으로 해석해 범위 내면 enqueue</li>
 *   <li>flushEvery 페이지마다 스냅샷 flush, 큐 소진 시 최종 flush</li>
 * </ol>
 * 2~4단계(+토큰화/링크 해석)는 fetch 워커가, 나머지는 crawl()을 호출한 스레드가 한다.
 * 인덱스와 Frontier는 호출 스레드만 건드리므로 문서 단위 색인은 서로 끼어들지 않는다.
 * concurrency=1이면 순수 순차 BFS와 같은 순서로 처리된다. 재시도는 없다.
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final CrawlConfig config;
    private final ScopePolicy scope;
    private final IPageFetcher fetcher;
    private final LinkExtractor linkExtractor;
    private final VisibleTextExtractor textExtractor = new VisibleTextExtractor();
    private final IIndexSink sink;

    private final InvertedIndex index = new InvertedIndex();
    private final Frontier frontier = new Frontier();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile CrawlState state = CrawlState.IDLE;

    /** 기본 구현(HttpClient fetch + JSON 파일 저장) */
    public Crawler(CrawlConfig config) {
        this(config, new HttpPageFetcher(config), defaultSink(config));
    }

    public Crawler(CrawlConfig config, IPageFetcher fetcher, IIndexSink sink) {
        this(config, fetcher, new JsoupLinkExtractor(), sink);
    }

    /** DI/테스트용 */
    public Crawler(CrawlConfig config, IPageFetcher fetcher, LinkExtractor linkExtractor, IIndexSink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.scope = new ScopePolicy(CrawlScope.fromSeed(config.getSeed(), config.isPrefixMode()));
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.linkExtractor = Objects.requireNonNull(linkExtractor, "linkExtractor");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    private static IIndexSink defaultSink(CrawlConfig config) {
        config.validate();
        CrawlScope s = CrawlScope.fromSeed(config.getSeed(), config.isPrefixMode());
        return new JsonIndexStore(OutputNaming.indexPath(config, s), config.isPrettyJson());
    }

    @Override
    public CrawlResult crawl() {
        synchronized (this) {
            if (state != CrawlState.IDLE) throw new IllegalStateException("crawl already started");
            state = CrawlState.RUNNING;
        }
        final long t0 = System.nanoTime();
        final int cc = config.getConcurrency();
        final List<String> indexed = new ArrayList<>();
        final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);

        LOG.info("Crawl start: seed={}, scope={}, flushEvery={}, cc={}",
                config.getSeed(), scope.scope(), config.getFlushEvery(), cc);
        SLOG.info("crawl-start",
                "seed", config.getSeed(),
                "domain", scope.scope().domain(),
                "prefix", scope.scope().prefixDir().orElse(null),
                "flushEvery", config.getFlushEvery(),
                "cc", cc);

        frontier.enqueue(UrlUtils.stripFragment(config.getSeed()));

        boolean finalOk;
        int flushes;
        try (IndexFlusher flusher = new IndexFlusher(sink)) {
            ExecutorService pool = Executors.newFixedThreadPool(cc, new NamedThreadFactory("fetch-worker"));
            CompletionService<PageOutcome> done = new ExecutorCompletionService<>(pool);
            Map<Future<PageOutcome>, String> inFlight = new HashMap<>();
            try {
                while (true) {
                    // ---- 1) 워커가 빌 때까지 배정 ----
                    while (inFlight.size() < cc && !frontier.isEmpty() && canDispatch(indexed.size() + inFlight.size())) {
                        String url = frontier.dequeue().orElseThrow();
                        if (!scope.isEligible(url)) {
                            skipped.merge(SkipReason.OUT_OF_SCOPE, 1, Integer::sum);
                            LOG.debug("→ Skipping out-of-scope URL: {}", url);
                            continue;
                        }
                        inFlight.put(done.submit(() -> process(url)), url);
                    }
                    if (inFlight.isEmpty()) break;

                    // ---- 2) 완료된 페이지 하나 반영 ----
                    Future<PageOutcome> f = done.take();
                    String url = inFlight.remove(f);
                    apply(outcomeOf(f, url), indexed, skipped, flusher);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOG.warn("Crawl interrupted; draining with {} page(s) indexed", indexed.size());
            } finally {
                pool.shutdownNow();
            }

            // ---- 3) 마무리 flush ----
            state = CrawlState.DRAINING;
            LOG.info("Done! Total pages indexed{}: {}",
                    scope.scope().prefixDir().map(p -> " under " + p).orElse(""), indexed.size());
            finalOk = flusher.flushNow(index.snapshot());
            flushes = flusher.getFlushCount();
        } finally {
            state = CrawlState.DONE;
            finished.countDown();
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        SLOG.info("crawl-done",
                "pages", indexed.size(),
                "terms", index.termCount(),
                "flushes", flushes,
                "finalFlushOk", finalOk,
                "ms", elapsedMs);
        return new CrawlResult(indexed, skipped, index.termCount(), flushes, finalOk, sink.location(), elapsedMs);
    }

    /** process()를 빠져나온 Error 등은 그 페이지만 포기한다 */
    private static PageOutcome outcomeOf(Future<PageOutcome> f, String url) throws InterruptedException {
        try {
            return f.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Page task failed: {} ({})", url, cause.toString(), cause);
            SLOG.error("task-failed", cause, "url", url);
            return PageOutcome.skipped(url, SkipReason.PARSE_FAILED, cause.toString());
        }
    }

    private boolean canDispatch(int pagesClaimed) {
        if (stopRequested.get() || Thread.currentThread().isInterrupted()) return false;
        int max = config.getMaxPages();
        return max <= 0 || pagesClaimed < max;
    }

    /** 워커 스레드: fetch → 검사 → 추출/토큰화/링크 해석. 공유 상태는 건드리지 않는다. */
    PageOutcome process(String url) {
        FetchedPage page;
        try {
            page = fetcher.fetch(url);
        } catch (RuntimeException e) {
            return PageOutcome.skipped(url, SkipReason.FETCH_FAILED, e.toString());
        }
        if (page == null) {
            return PageOutcome.skipped(url, SkipReason.FETCH_FAILED, "no response");
        }
        if (!page.isSuccess()) {
            String why = page.getError() != null ? page.getError() : "HTTP " + page.getStatusCode();
            return PageOutcome.skipped(url, SkipReason.FETCH_FAILED, why);
        }
        if (!page.isHtml()) {
            return PageOutcome.skipped(url, SkipReason.NOT_HTML, String.valueOf(page.getContentType()));
        }

        // 여기서부터 best-effort: 어떤 예외든 문서 전체를 포기(색인도, 링크도 없음)
        try {
            Document doc = HtmlStreamParser.parse(page.getBody(), url);
            String text = textExtractor.extract(doc);
            List<String> hrefs = linkExtractor.extract(doc);

            List<String> tokens = Tokenizer.tokenize(text);
            List<String> links = new ArrayList<>(hrefs.size());
            for (String href : hrefs) {
                String abs = UrlUtils.resolve(url, href); // base는 seed가 아니라 현재 문서
                if (abs != null) links.add(abs);
            }
            return PageOutcome.indexed(url, tokens, links);
        } catch (Exception e) {
            return PageOutcome.skipped(url, SkipReason.PARSE_FAILED, e.toString());
        }
    }

    /** 호출 스레드: 색인/Frontier 갱신/주기 flush */
    private void apply(PageOutcome out, List<String> indexed, Map<SkipReason, Integer> skipped, IndexFlusher flusher) {
        if (!out.isIndexed()) {
            skipped.merge(out.skip(), 1, Integer::sum);
            switch (out.skip()) {
                case FETCH_FAILED -> LOG.warn("✗ Failed to fetch: {}  ({})", out.url(), out.detail());
                case NOT_HTML -> LOG.info("→ Skipping non-HTML content: {} [{}]", out.url(), out.detail());
                case PARSE_FAILED -> LOG.warn("Error parsing/indexing {}: {}", out.url(), out.detail());
                default -> LOG.debug("→ Skipping {}: {}", out.url(), out.detail());
            }
            SLOG.info("page-skipped",
                    "url", out.url(),
                    "reason", out.skip().name(),
                    "detail", out.detail());
            return;
        }

        int tokens = index.indexDocument(out.url(), out.tokens());

        int newLinks = 0;
        for (String link : out.links()) {
            if (scope.isEligible(link) && frontier.enqueue(link)) newLinks++;
        }

        indexed.add(out.url());
        int n = indexed.size();
        LOG.debug("Indexed {} (page #{}) tokens={}, newLinks={}", out.url(), n, tokens, newLinks);
        SLOG.info("page-indexed",
                "url", out.url(),
                "pageNo", n,
                "tokens", tokens,
                "newLinks", newLinks,
                "queue", frontier.size());

        if (n % config.getFlushEvery() == 0) {
            LOG.info("Indexed {} pages (queue: {}, terms: {})", n, frontier.size(), index.termCount());
            flusher.requestFlush(index.snapshot());
        }
    }

    /**
     * 새 fetch 배정을 멈추고 진행 중인 페이지만 반영한 뒤 최종 flush 하도록 요청.
     * 다른 스레드(셧다운 훅 등)에서 호출 가능.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            LOG.info("Stop requested; draining in-flight pages");
        }
    }

    /** crawl() 종료(최종 flush 포함)까지 대기. 시작 전이면 바로 false. */
    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        if (state == CrawlState.IDLE) return false;
        return finished.await(timeout, unit);
    }

    public CrawlState state() { return state; }

    /** 크롤 종료 후 조회용. 실행 중에는 크롤 스레드 외에서 읽지 말 것. */
    public InvertedIndex index() { return index; }

    public ScopePolicy scopePolicy() { return scope; }

    @Override
    public void close() throws Exception {
        fetcher.close();
    }
}
