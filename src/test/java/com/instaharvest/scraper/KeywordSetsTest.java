package com.instaharvest.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordSetsTest {

    @Test
    void testSubstringLoginMatchIsCaseInsensitive() {
        KeywordSets keywords = KeywordSets.defaults();
        assertThat(keywords.matchLogin("  ENTRAR ")).contains("entrar");
        assertThat(keywords.matchLogin("Log in with Facebook")).contains("log in");
        assertThat(keywords.matchLogin("Esqueceu a senha?")).isEmpty();
        assertThat(keywords.matchLogin("")).isEmpty();
        assertThat(keywords.matchLogin(null)).isEmpty();
    }

    @Test
    void testExactLoginMatch() {
        KeywordSets keywords = new KeywordSets(List.of("Log in"), KeywordSets.MatchMode.EXACT, null, null);
        assertThat(keywords.matchLogin("log in")).contains("log in");
        assertThat(keywords.matchLogin("Log in with Facebook")).isEmpty();
    }

    @Test
    void testDismissAndInterstitialMatch() {
        KeywordSets keywords = KeywordSets.defaults();
        assertThat(keywords.matchDismiss("Agora não")).contains("agora não");
        assertThat(keywords.matchInterstitial("<div>O Meta Verified está disponível para o Facebook e o Instagram</div>"))
            .isPresent();
        assertThat(keywords.matchInterstitial("<div>feed</div>")).isEmpty();
    }

    @Test
    void testEmptyInterstitialListDisablesCheck() {
        KeywordSets keywords = new KeywordSets(null, null, null, List.of());
        assertThat(keywords.interstitial()).isEmpty();
        assertThat(keywords.matchInterstitial("meta verified")).isEmpty();
    }
}
