package org.mediacatalog.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenSplitterTest {

    @Test
    void trimsTokensAndPreservesCase() {
        assertThat(TokenSplitter.split("A, b ,C")).containsExactly("A", "b", "C");
    }

    @Test
    void dropsEmptyTokens() {
        assertThat(TokenSplitter.split(" ,Dramas,, ,Comedies,")).containsExactly("Dramas", "Comedies");
    }

    @Test
    void nullAndBlankGiveNoTokens() {
        assertThat(TokenSplitter.split(null)).isEmpty();
        assertThat(TokenSplitter.split("   ")).isEmpty();
    }
}
