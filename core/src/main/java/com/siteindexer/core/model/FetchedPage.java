package com.siteindexer.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** fetch 결과 캡처(본문은 텍스트 기준). 인덱싱 후 보관하지 않는다. */
public final class FetchedPage {

    /** 전송 실패(타임아웃/연결 오류) 시 상태 코드 */
    public static final int TRANSPORT_FAILURE = -1;

    private final String url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;
    private final String error;

    private FetchedPage(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
        this.error = b.error;
    }

    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }
    /** 전송 실패 사유. 응답을 받았으면 null. */
    public String getError() { return error; }

    public boolean isSuccess() { return statusCode >= 200 && statusCode < 300; }

    /** Content-Type에 text/html 포함 여부(대소문자 무시) */
    public boolean isHtml() {
        String ct = contentType != null ? contentType : header("Content-Type");
        return ct != null && ct.toLowerCase(Locale.ROOT).contains("text/html");
    }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    public static FetchedPage failure(String url, String error, long elapsedMs) {
        return builder()
                .url(url)
                .statusCode(TRANSPORT_FAILURE)
                .error(error)
                .responseTimeMs(elapsedMs)
                .build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private long responseTimeMs;
        private String error;

        public Builder url(String url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public FetchedPage build() {
            Objects.requireNonNull(url, "url");
            return new FetchedPage(this);
        }
    }
}
