package com.siteindexer.core.model;

/** URL을 인덱싱하지 못한 사유. 어느 경우든 같은 실행 안에서 재시도하지 않는다. */
public enum SkipReason {
    /** 도메인/prefix/확장자 조건 불일치 */
    OUT_OF_SCOPE,
    /** 타임아웃, 연결 오류, 2xx 이외 상태 */
    FETCH_FAILED,
    /** Content-Type이 text/html 아님 */
    NOT_HTML,
    /** 파싱/추출 중 예외 */
    PARSE_FAILED
}
