package com.behandlingflow.core.generator.style;

import java.util.List;

/**
 * Keyword sets and label rules used to style activity nodes.
 *
 * <p>Keywords are matched as case-sensitive substrings of the activity name.
 *
 * @param highlightSupertypes supertype markers that highlight an activity class
 * @param waitingKeywords name fragments of waiting activities
 * @param manualKeywords name fragments of manual-intervention activities
 * @param abortKeywords name fragments of abort or rejection activities
 * @param decisionKeywords name fragments of decision or execution activities
 * @param stripTokens fragments removed from display labels
 * @param conditionPrefixes receiver prefixes removed from condition labels
 */
public record NodeStyleSettings(
    List<String> highlightSupertypes,
    List<String> waitingKeywords,
    List<String> manualKeywords,
    List<String> abortKeywords,
    List<String> decisionKeywords,
    List<String> stripTokens,
    List<String> conditionPrefixes
) {
    static final List<String> DEFAULT_HIGHLIGHT_SUPERTYPES = List.of("AldeAktivitet");
    static final List<String> DEFAULT_WAITING_KEYWORDS = List.of("Vent", "Wait");
    static final List<String> DEFAULT_MANUAL_KEYWORDS = List.of("Manuell", "Oppgave");
    static final List<String> DEFAULT_ABORT_KEYWORDS = List.of("Avbryt", "Avslag");
    static final List<String> DEFAULT_DECISION_KEYWORDS = List.of("Iverksett", "Vedtak");
    static final List<String> DEFAULT_STRIP_TOKENS = List.of("FleksibelApSak", "Aktivitet");
    static final List<String> DEFAULT_CONDITION_PREFIXES = List.of("behandling.", "krav.");

    /**
     * Compact constructor; a missing list falls back to its default.
     */
    public NodeStyleSettings {
        highlightSupertypes = orDefault(highlightSupertypes, DEFAULT_HIGHLIGHT_SUPERTYPES);
        waitingKeywords = orDefault(waitingKeywords, DEFAULT_WAITING_KEYWORDS);
        manualKeywords = orDefault(manualKeywords, DEFAULT_MANUAL_KEYWORDS);
        abortKeywords = orDefault(abortKeywords, DEFAULT_ABORT_KEYWORDS);
        decisionKeywords = orDefault(decisionKeywords, DEFAULT_DECISION_KEYWORDS);
        stripTokens = orDefault(stripTokens, DEFAULT_STRIP_TOKENS);
        conditionPrefixes = orDefault(conditionPrefixes, DEFAULT_CONDITION_PREFIXES);
    }

    public static NodeStyleSettings defaults() {
        return new NodeStyleSettings(null, null, null, null, null, null, null);
    }

    private static List<String> orDefault(List<String> values, List<String> defaults) {
        return values == null ? defaults : List.copyOf(values);
    }
}
