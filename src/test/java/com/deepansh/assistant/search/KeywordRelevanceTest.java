package com.deepansh.assistant.search;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KeywordRelevanceTest {

    @Test
    void score_wholeQueryAndAllTokensPresent_combinesAllTerms() {
        // 2.0 phrase + 1.5 coverage + 0.1 per token occurrence (two tokens, once each)
        assertThat(KeywordRelevance.score("spring boot", "Spring Boot makes it easy"))
                .isCloseTo(3.7, within(1e-9));
    }

    @Test
    void score_partialTokenCoverage() {
        // one of two tokens present, once
        assertThat(KeywordRelevance.score("java kotlin", "java is verbose"))
                .isCloseTo(0.75 + 0.1, within(1e-9));
    }

    @Test
    void score_occurrenceBonusIsCapped() {
        String content = "go ".repeat(20);
        assertThat(KeywordRelevance.score("go", content)).isCloseTo(2.0 + 1.5 + 0.5, within(1e-9));
    }

    @Test
    void score_noOverlapOrBlankInput_isZero() {
        assertThat(KeywordRelevance.score("rust", "java and python")).isZero();
        assertThat(KeywordRelevance.score(" ", "anything")).isZero();
        assertThat(KeywordRelevance.score("x", "")).isZero();
    }

    @Test
    void tokens_cjkRunIsSingleToken() {
        assertThat(KeywordRelevance.tokens("我喜欢 hiking, 2024")).containsExactly("我喜欢", "hiking", "2024");
    }

    @Test
    void snippet_centersAroundFirstMatch() {
        String content = "a".repeat(100) + "needle" + "b".repeat(300);

        String snippet = KeywordRelevance.snippet("needle", content, 200);

        assertThat(snippet).startsWith("...").endsWith("...").contains("needle");
        assertThat(snippet).hasSize(3 + 200 + 3);
    }

    @Test
    void snippet_noMatch_returnsHead() {
        assertThat(KeywordRelevance.snippet("zzz", "short text", 200)).isEqualTo("short text");
        assertThat(KeywordRelevance.snippet("zzz", "x".repeat(250), 200)).isEqualTo("x".repeat(200) + "...");
    }

    @Test
    void snippet_textWhoseLowerCaseChangesLength_stillSlicesOriginal() {
        String content = "İ".repeat(100) + " abc";

        String snippet = KeywordRelevance.snippet("abc", content, 200);

        assertThat(snippet).contains("abc");
    }
}
