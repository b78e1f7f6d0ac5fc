package com.instaharvest.scraper;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Multi-locale keyword lists used to recognise UI controls by their visible text.
 *
 * @param login        texts that identify a login/submit button
 * @param loginMatch   how a candidate's text is compared against {@code login}
 * @param dismiss      texts that identify the "not now" button of the save-login prompt
 * @param interstitial page-source signatures of a blocking account-verification interstitial
 */
public record KeywordSets(List<String> login, MatchMode loginMatch, List<String> dismiss, List<String> interstitial) {

    public static final List<String> DEFAULT_LOGIN = List.of("entrar", "log in", "login", "iniciar sesión", "connexion", "anmelden");
    public static final List<String> DEFAULT_DISMISS = List.of("not now", "agora não", "salvar", "save", "skip");
    public static final List<String> DEFAULT_INTERSTITIAL = List.of(
        "o meta verified está disponível para o facebook e o instagram",
        "meta verified");

    public enum MatchMode {
        /** Candidate text contains the keyword. */
        SUBSTRING,
        /** Candidate text equals the keyword. */
        EXACT
    }

    public KeywordSets {
        login = normalizeAll(login == null || login.isEmpty() ? DEFAULT_LOGIN : login);
        loginMatch = loginMatch == null ? MatchMode.SUBSTRING : loginMatch;
        dismiss = normalizeAll(dismiss == null || dismiss.isEmpty() ? DEFAULT_DISMISS : dismiss);
        interstitial = normalizeAll(interstitial == null ? DEFAULT_INTERSTITIAL : interstitial);
    }

    public static KeywordSets defaults() {
        return new KeywordSets(null, null, null, null);
    }

    /**
     * Case-folds and trims UI text for keyword comparison.
     */
    public static String normalize(String text) {
        return text == null ? "" : text.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the first login keyword matching a candidate's visible text.
     */
    public Optional<String> matchLogin(String candidateText) {
        return match(login, loginMatch, candidateText);
    }

    /**
     * Returns the first dismiss keyword contained in a candidate's visible text.
     */
    public Optional<String> matchDismiss(String candidateText) {
        return match(dismiss, MatchMode.SUBSTRING, candidateText);
    }

    /**
     * Returns the first interstitial signature contained in a page source.
     */
    public Optional<String> matchInterstitial(String pageSource) {
        return match(interstitial, MatchMode.SUBSTRING, pageSource);
    }

    private static Optional<String> match(List<String> keywords, MatchMode mode, String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return Optional.empty();
        for (String keyword : keywords) {
            boolean hit = mode == MatchMode.EXACT ? normalized.equals(keyword) : normalized.contains(keyword);
            if (hit) return Optional.of(keyword);
        }
        return Optional.empty();
    }

    private static List<String> normalizeAll(List<String> keywords) {
        return keywords.stream().map(KeywordSets::normalize).filter(k -> !k.isEmpty()).collect(Collectors.toUnmodifiableList());
    }
}
