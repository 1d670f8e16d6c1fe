package com.zzf.simon.pipeline;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Post-reply checks. A hit produces a {@code safety_boundary} notice; the reply itself is already delivered.
 */
@Component
public class SafetyFilter {
    private static final List<Pattern> SENSITIVE = List.of(
            Pattern.compile("(?i)password[:\\s]+\\S+"),
            Pattern.compile("(?i)api[_\\s]?key[:\\s]+\\S+"),
            Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b"),
            Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"),
            Pattern.compile("(?i)secret[:\\s]+\\S+"),
            Pattern.compile("(?i)token[:\\s]+\\S+"));
    private static final List<String> MEDICAL = List.of(
            "diagnose", "diagnosis", "prescribe", "prescription", "medication", "medical condition", "doctor should");
    private static final List<String> LEGAL = List.of(
            "legal advice", "lawsuit", "attorney", "lawyer", "legal rights", "contract law");

    public Optional<String> check(String reply, CoachBlueprint blueprint) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        String lower = reply.toLowerCase(Locale.ROOT);
        if (blueprint.getRefusals().isMedical() && MEDICAL.stream().anyMatch(lower::contains)) {
            return Optional.of("I can't provide medical advice. Please consult a healthcare professional.");
        }
        if (blueprint.getRefusals().isLegal() && LEGAL.stream().anyMatch(lower::contains)) {
            return Optional.of("I can't provide legal advice. Please consult a lawyer.");
        }
        for (Pattern pattern : SENSITIVE) {
            if (pattern.matcher(reply).find()) {
                return Optional.of("This reply mentions sensitive data. Don't share secrets or account numbers here.");
            }
        }
        return Optional.empty();
    }
}
