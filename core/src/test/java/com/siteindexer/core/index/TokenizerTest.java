package com.siteindexer.core.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {

    @Test
    @DisplayName("비단어 문자로 분리, 소문자화, 빈 토큰 제거")
    void splitsAndLowercases() {
        assertThat(Tokenizer.tokenize("  Hello, World!! foo_bar 42x "))
                .containsExactly("hello", "world", "foo_bar", "42x");
    }

    @Test
    @DisplayName("유니코드 문자도 단어로 취급")
    void unicodeLetters() {
        assertThat(Tokenizer.tokenize("Über café 한국어-테스트"))
                .containsExactly("über", "café", "한국어", "테스트");
    }

    @Test
    void emptyAndNull() {
        assertThat(Tokenizer.tokenize("")).isEmpty();
        assertThat(Tokenizer.tokenize(" ... ")).isEmpty();
        assertThat(Tokenizer.tokenize(null)).isEmpty();
    }

    @Test
    @DisplayName("stream과 tokenize 결과 동일")
    void streamMatchesList() {
        String text = "a b\tc\nd";
        assertThat(Tokenizer.stream(text)).containsExactlyElementsOf(Tokenizer.tokenize(text));
    }
}
