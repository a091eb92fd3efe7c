package com.siteindexer.core.index;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 단어 토크나이저: 비단어 문자(\W, 유니코드 기준) 연속 구간으로 분리 후 소문자화.
 * 빈 토큰은 버린다. 스테밍/불용어 제거 없음.
 */
public final class Tokenizer {
    private Tokenizer() {}

    private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

    /** 지연 스트림. 같은 text로 다시 호출하면 같은 순서로 다시 만들어진다. */
    public static Stream<String> stream(String text) {
        if (text == null || text.isEmpty()) return Stream.empty();
        return NON_WORD.splitAsStream(text)
                .filter(t -> !t.isEmpty())
                .map(t -> t.toLowerCase(Locale.ROOT));
    }

    public static List<String> tokenize(String text) {
        return stream(text).collect(Collectors.toList());
    }
}
