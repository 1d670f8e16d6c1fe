package com.zzf.simon.tool.server;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Markers of secrets and identity numbers that must not be stored or echoed back.
 */
public final class SensitiveContent {
    static final List<String> KEYWORDS = List.of(
            "password", "api_key", "api key", "credit card", "credit_card",
            "ssn", "social security", "secret", "token", "private key");
    private static final Pattern CARD_NUMBER = Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b");
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-?\\d{2}-?\\d{4}\\b");

    private SensitiveContent() {
    }

    /**
     * @return a short description of the first match, empty when the text is clean
     */
    public static Optional<String> findIn(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (lower.contains(keyword)) {
                return Optional.of("sensitive pattern '" + keyword + "'");
            }
        }
        if (CARD_NUMBER.matcher(text).find()) {
            return Optional.of("credit card number");
        }
        if (SSN.matcher(text).find()) {
            return Optional.of("SSN");
        }
        return Optional.empty();
    }
}
