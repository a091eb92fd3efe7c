package com.siteindexer.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.siteindexer.core.api.IIndexSink;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 인덱스를 JSON 문서로 저장: {"term": {"url": [pos, ...]}}. 스키마 버전 없음.
 * 임시 파일에 쓴 뒤 대상 파일로 교체하므로 쓰는 도중 중단돼도 직전 flush 결과는 남는다.
 */
public final class JsonIndexStore implements IIndexSink {

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, List<Integer>>>> INDEX_TYPE =
            new TypeReference<>() {};

    private static final ObjectMapper OM = new ObjectMapper();

    private final Path target;
    private final ObjectWriter writer;

    public JsonIndexStore(Path target, boolean pretty) {
        this.target = Objects.requireNonNull(target, "target");
        this.writer = pretty ? OM.writerWithDefaultPrettyPrinter() : OM.writer();
    }

    @Override
    public void write(Map<String, Map<String, List<Integer>>> snapshot) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);

        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            writer.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /** 저장된 인덱스 로드(입력 순서 유지) */
    public static Map<String, Map<String, List<Integer>>> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Map<String, ? extends Map<String, List<Integer>>> raw = OM.readValue(file.toFile(), INDEX_TYPE);
        return new LinkedHashMap<>(raw);
    }

    @Override public String describe() { return target.toString(); }

    @Override public Path location() { return target; }
}
