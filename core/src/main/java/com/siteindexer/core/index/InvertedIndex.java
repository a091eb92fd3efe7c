package com.siteindexer.core.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 위치 포함 역색인: term → url → positions.
 *
 * <p>불변식
 * <ul>
 *   <li>term은 최소 1개 문서에 1회 이상 등장할 때만 존재</li>
 *   <li>한 posting 안의 position은 엄격히 증가(추가 전용)</li>
 *   <li>같은 url 재색인 시 기존 posting은 교체(누적 아님)</li>
 * </ul>
 * 스레드 세이프하지 않다. 쓰기는 크롤 루프의 단일 인덱싱 스레드만 한다.
 * 삽입 순서를 유지해 flush 결과가 처리 순서를 따른다.
 */
public final class InvertedIndex {

    private final Map<String, Map<String, List<Integer>>> terms = new LinkedHashMap<>();
    private final Map<String, Integer> docLengths = new LinkedHashMap<>();

    /**
     * (term, url) posting에 position 추가. 필요한 중간 맵은 생성.
     * @throws IllegalArgumentException position이 음수이거나 직전 값 이하일 때
     */
    public void addOccurrence(String term, String url, int position) {
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(url, "url");
        if (position < 0) throw new IllegalArgumentException("position must be >= 0: " + position);

        List<Integer> positions = terms
                .computeIfAbsent(term, t -> new LinkedHashMap<>())
                .computeIfAbsent(url, u -> new ArrayList<>());
        if (!positions.isEmpty() && positions.get(positions.size() - 1) >= position) {
            throw new IllegalArgumentException(
                    "positions must increase: term=" + term + ", url=" + url + ", position=" + position);
        }
        positions.add(position);
        docLengths.merge(url, 1, Integer::sum);
    }

    /**
     * 문서 하나를 색인. 토큰 순서대로 0부터 position 부여.
     * 이미 색인된 url이면 기존 posting을 먼저 제거한다.
     * @return 색인한 토큰 수
     */
    public int indexDocument(String url, Iterable<String> tokens) {
        Objects.requireNonNull(url, "url");
        removeDocument(url);
        int pos = 0;
        for (String term : tokens) {
            addOccurrence(term, url, pos++);
        }
        return pos;
    }

    /** url의 모든 posting 제거. 문서가 더 없는 term은 함께 제거. */
    public boolean removeDocument(String url) {
        if (docLengths.remove(url) == null) return false;
        Iterator<Map.Entry<String, Map<String, List<Integer>>>> it = terms.entrySet().iterator();
        while (it.hasNext()) {
            Map<String, List<Integer>> postings = it.next().getValue();
            postings.remove(url);
            if (postings.isEmpty()) it.remove();
        }
        return true;
    }

    public boolean contains(String term) { return terms.containsKey(term); }

    /** term의 url → positions (읽기 전용). 없으면 빈 맵. */
    public Map<String, List<Integer>> postings(String term) {
        Map<String, List<Integer>> p = terms.get(term);
        return p == null ? Map.of() : Collections.unmodifiableMap(p);
    }

    /** (term, url) positions (읽기 전용). 없으면 빈 리스트. */
    public List<Integer> positions(String term, String url) {
        List<Integer> p = postings(term).get(url);
        return p == null ? List.of() : Collections.unmodifiableList(p);
    }

    /** 고유 term 수(로그/flush 보고용) */
    public int termCount() { return terms.size(); }

    /** 토큰이 1개 이상인 색인 문서 수 */
    public int documentCount() { return docLengths.size(); }

    /**
     * 직렬화용 깊은 복사본. 이후 색인이 계속돼도 스냅샷은 바뀌지 않는다.
     */
    public Map<String, Map<String, List<Integer>>> snapshot() {
        Map<String, Map<String, List<Integer>>> copy = new LinkedHashMap<>(terms.size() * 2);
        for (var e : terms.entrySet()) {
            Map<String, List<Integer>> postings = new LinkedHashMap<>(e.getValue().size() * 2);
            for (var p : e.getValue().entrySet()) {
                postings.put(p.getKey(), List.copyOf(p.getValue()));
            }
            copy.put(e.getKey(), Collections.unmodifiableMap(postings));
        }
        return Collections.unmodifiableMap(copy);
    }

    /** 저장된 구조에서 복원. position 순서 검증은 addOccurrence와 동일. */
    public static InvertedIndex fromSnapshot(Map<String, Map<String, List<Integer>>> snapshot) {
        InvertedIndex idx = new InvertedIndex();
        if (snapshot == null) return idx;
        for (var e : snapshot.entrySet()) {
            for (var p : e.getValue().entrySet()) {
                for (Integer pos : p.getValue()) {
                    idx.addOccurrence(e.getKey(), p.getKey(), pos);
                }
            }
        }
        return idx;
    }
}
