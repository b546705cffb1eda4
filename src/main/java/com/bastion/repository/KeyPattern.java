package com.bastion.repository;

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Cache key patterns: {@code *} matches any run of characters, and a pattern without a
 * wildcard matches every key it prefixes.
 */
public final class KeyPattern {

    private KeyPattern() {
    }

    public static Predicate<String> compile(String pattern) {
        if (!pattern.contains("*")) {
            return key -> key.startsWith(pattern);
        }
        StringBuilder regex = new StringBuilder();
        String[] parts = pattern.split("\\*", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            if (!parts[i].isEmpty()) {
                regex.append(Pattern.quote(parts[i]));
            }
        }
        Pattern compiled = Pattern.compile(regex.toString(), Pattern.DOTALL);
        return key -> compiled.matcher(key).matches();
    }
}
