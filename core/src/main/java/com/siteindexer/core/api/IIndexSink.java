// IIndexSink.java
package com.siteindexer.core.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** 인덱스 스냅샷(term → url → positions)을 영속 저장소에 기록하는 책임. */
public interface IIndexSink {

    void write(Map<String, Map<String, List<Integer>>> snapshot) throws IOException;

    /** 로그용 대상 표기. 파일 싱크면 경로. */
    default String describe() { return getClass().getSimpleName(); }

    /** 파일 기반 싱크면 그 경로, 아니면 null */
    default Path location() { return null; }
}
