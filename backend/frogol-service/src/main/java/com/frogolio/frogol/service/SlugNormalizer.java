package com.frogolio.frogol.service;

import com.frogolio.frogol.exception.InvalidInputException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns free-form user input (a name, a domain, a pasted URL) into a frogol slug.
 *
 * <p>The result is lowercase, matches {@code [a-z0-9-]+}, has no leading, trailing
 * or doubled dashes and is not one of the paths the web front end reserves.
 * Normalizing an already normalized slug returns it unchanged.
 */
public final class SlugNormalizer {

    public static final Set<String> RESERVED = Set.of(
            "login", "logout", "register", "dashboard", "api", "static", "favicon.ico");

    // any Unicode white space, including no-break and ideographic spaces
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private SlugNormalizer() {
    }

    public static String normalize(String raw) {
        String s = raw == null ? "" : EDGE_WHITESPACE.matcher(raw).replaceAll("").toLowerCase(Locale.ROOT);

        if (s.startsWith("https://")) {
            s = s.substring("https://".length());
        } else if (s.startsWith("http://")) {
            s = s.substring("http://".length());
        }
        if (s.startsWith("www.")) {
            s = s.substring("www.".length());
        }

        int slash = s.indexOf('/');
        if (slash >= 0) {
            s = s.substring(0, slash);
        }

        s = s.replace('.', '-');
        s = joinWords(s);

        StringBuilder cleaned = new StringBuilder(s.length());
        boolean prevDash = false;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            char c;
            if ((ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9') || ch == '-') {
                c = ch;
            } else if (ch == '_') {
                c = '-';
            } else {
                continue;
            }
            boolean dash = c == '-';
            if (dash && prevDash) {
                continue;
            }
            cleaned.append(c);
            prevDash = dash;
        }

        String slug = trimDashes(cleaned.toString());
        if (slug.isEmpty()) {
            throw new InvalidInputException("Invalid slug");
        }
        if (RESERVED.contains(slug)) {
            throw new InvalidInputException("Slug is reserved");
        }
        return slug;
    }

    private static String joinWords(String s) {
        return Arrays.stream(WHITESPACE.split(s))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.joining("-"));
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}
