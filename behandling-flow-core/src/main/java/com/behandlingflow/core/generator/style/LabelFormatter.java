package com.behandlingflow.core.generator.style;

import java.util.Objects;

/**
 * Shortens activity names and condition text for display.
 */
public class LabelFormatter {

    private static final int CONDITION_MAX_LENGTH = 80;
    private static final int CONDITION_KEEP_LENGTH = 77;
    private static final String ELLIPSIS = "...";

    // Feature toggle markers
    static final String FEATURE_MARKER = "🚩 ";
    static final String FEATURE_PREFIX = FEATURE_MARKER + "FEATURE: ";
    private static final String TOGGLE_CALL = "isEnabled(";

    private final NodeStyleSettings settings;

    public LabelFormatter(NodeStyleSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Shortens an activity name: strip tokens are removed and a leading step number is put on
     * its own line ({@code 01VurderAktivitet} becomes {@code "01\nVurder"}).
     *
     * @param activity activity name
     * @return display name, never empty
     */
    public String displayName(String activity) {
        String shortened = activity;
        for (String token : settings.stripTokens()) {
            if (!token.isEmpty()) {
                shortened = shortened.replace(token, "");
            }
        }
        if (shortened.isBlank()) {
            return activity;
        }

        int firstLetter = indexOfFirstLetter(shortened);
        if (firstLetter > 0) {
            return shortened.substring(0, firstLetter) + "\n" + shortened.substring(firstLetter);
        }
        return shortened;
    }

    /**
     * Simplifies a condition: receiver prefixes are removed, a feature toggle call is rewritten
     * as a flag marker, and long text is truncated.
     *
     * @param condition raw condition text
     * @return display text
     */
    public String formatCondition(String condition) {
        if (condition == null || condition.isEmpty()) {
            return "";
        }
        int toggle = condition.indexOf(TOGGLE_CALL);
        if (toggle >= 0) {
            return formatToggleCondition(condition, toggle + TOGGLE_CALL.length());
        }
        return truncate(stripPrefixes(condition));
    }

    /**
     * Combines a feature flag with an already formatted condition.
     *
     * @param flag feature flag name
     * @param condition formatted condition, may be empty
     * @param showConditions whether conditions are displayed
     * @return flag label
     */
    public String featureLabel(String flag, String condition, boolean showConditions) {
        if (!showConditions) {
            return FEATURE_MARKER + flag;
        }
        if (condition.isEmpty() || condition.startsWith(FEATURE_MARKER)) {
            return condition.isEmpty() ? FEATURE_PREFIX + flag : condition;
        }
        return FEATURE_PREFIX + flag + " && " + condition;
    }

    /**
     * Puts the feature flag shared by all edges of a summary in front of its label.
     *
     * @param flag common feature flag, or null
     * @param summary summary label such as {@code "2 paths: harSak()"}
     * @return display label
     */
    public String summaryLabel(String flag, String summary) {
        if (flag == null) {
            return summary;
        }
        return FEATURE_MARKER + flag + ", " + summary;
    }

    private String formatToggleCondition(String condition, int argumentStart) {
        String afterCall = condition.substring(argumentStart);
        int comma = afterCall.indexOf(',');
        int close = afterCall.indexOf(')');
        int end = comma >= 0 && (close < 0 || comma < close) ? comma : close;
        String argument = (end >= 0 ? afterCall.substring(0, end) : afterCall).replace("\"", "").trim();
        String flag = argument.substring(argument.lastIndexOf('.') + 1);

        String rest = "";
        if (close >= 0) {
            String afterClose = afterCall.substring(close + 1).trim();
            if (afterClose.startsWith("&&")) {
                String extra = stripPrefixes(afterClose.substring(2).trim());
                if (!extra.isEmpty()) {
                    rest = " && " + extra;
                }
            }
        }
        return truncate(FEATURE_PREFIX + flag + rest);
    }

    private String stripPrefixes(String text) {
        String result = text;
        for (String prefix : settings.conditionPrefixes()) {
            if (!prefix.isEmpty()) {
                result = result.replace(prefix, "");
            }
        }
        return result;
    }

    private String truncate(String text) {
        // Counted in code points so a flag marker or other emoji is never split.
        if (text.codePointCount(0, text.length()) <= CONDITION_MAX_LENGTH) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, CONDITION_KEEP_LENGTH)) + ELLIPSIS;
    }

    private int indexOfFirstLetter(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
