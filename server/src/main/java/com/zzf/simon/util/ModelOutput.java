package com.zzf.simon.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for pulling structured data out of free-form model replies.
 */
public final class ModelOutput {
    private static final Pattern FENCED_JSON = Pattern.compile("(?s)```(?:json|JSON)?\\s*(\\{.*?\\})\\s*```");

    private ModelOutput() {
    }

    /**
     * Returns the first balanced {@code {...}} in the reply, preferring a fenced json block.
     *
     * @throws IllegalArgumentException when the reply holds no complete object
     */
    public static String firstJsonObject(String reply) {
        if (reply == null) {
            throw new IllegalArgumentException("reply is null");
        }
        Matcher fenced = FENCED_JSON.matcher(reply);
        if (fenced.find()) {
            return fenced.group(1).trim();
        }
        int start = reply.indexOf('{');
        if (start < 0) {
            throw new IllegalArgumentException("no json object in reply");
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < reply.length(); i++) {
            char ch = reply.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
            } else if (ch == '"') {
                inString = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}' && --depth == 0) {
                return reply.substring(start, i + 1);
            }
        }
        throw new IllegalArgumentException("unterminated json object in reply");
    }

    public static String truncate(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        return s.length() <= maxChars ? s : s.substring(0, maxChars);
    }
}
