package com.deepansh.assistant.search;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword relevance used by memory recall and local document search.
 *
 * score = 2.0 if the whole query occurs in the content
 *       + 1.5 * (query tokens present in the content / query tokens)
 *       + sum over query tokens of min(0.1 * occurrences, 0.5)
 *
 * Matching is case-insensitive. A token is a maximal run of Unicode word
 * characters, so an unbroken CJK phrase is a single token.
 */
public final class KeywordRelevance {

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private KeywordRelevance() {
    }

    public static double score(String query, String content) {
        if (query == null || query.isBlank() || content == null || content.isEmpty()) {
            return 0.0;
        }
        String q = query.toLowerCase(Locale.ROOT);
        String c = content.toLowerCase(Locale.ROOT);

        double score = 0.0;
        if (c.contains(q.trim())) {
            score += 2.0;
        }

        List<String> queryTokens = tokens(q);
        if (queryTokens.isEmpty()) {
            return score;
        }
        Set<String> contentTokens = new HashSet<>(tokens(c));

        long matched = queryTokens.stream().filter(contentTokens::contains).count();
        score += ((double) matched / queryTokens.size()) * 1.5;

        for (String token : queryTokens) {
            score += Math.min(occurrences(c, token) * 0.1, 0.5);
        }
        return score;
    }

    public static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    /**
     * Window of roughly {@code maxLength} characters around the first match of
     * the query (or of its first matching word), with ellipses where cut.
     */
    public static String snippet(String query, String content, int maxLength) {
        String q = query == null ? "" : lowerCharwise(query);
        String c = lowerCharwise(content);

        int pos = q.isBlank() ? -1 : c.indexOf(q);
        if (pos < 0) {
            for (String word : q.split("\\s+")) {
                if (word.isEmpty()) continue;
                pos = c.indexOf(word);
                if (pos >= 0) break;
            }
        }
        if (pos < 0) {
            return content.length() > maxLength ? content.substring(0, maxLength) + "..." : content;
        }

        int start = Math.max(0, pos - 50);
        int end = Math.min(content.length(), pos + maxLength - 50);
        StringBuilder sb = new StringBuilder();
        if (start > 0) sb.append("...");
        sb.append(content, start, end);
        if (end < content.length()) sb.append("...");
        return sb.toString();
    }

    /** Lower-cases char by char so every index stays valid in the original text. */
    private static String lowerCharwise(String text) {
        char[] chars = text.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }

    private static int occurrences(String text, String token) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(token, from)) >= 0) {
            count++;
            from += token.length();
        }
        return count;
    }
}
