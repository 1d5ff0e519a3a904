package com.storewatch.tracker.crawl.diff;

import org.jsoup.Jsoup;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Turns the store's supported-languages markup into a sorted, duplicate-free list of
 * lower-case language tokens.
 */
public final class LanguageListNormalizer {
    private static final Pattern BREAK_TAG = Pattern.compile("(?i)<br\\s*/?>");
    private static final Pattern SEPARATORS = Pattern.compile("[,\\n/;]+");
    private static final Pattern BOILERPLATE = Pattern.compile(
        "languages with full audio support|full audio|subtitles|interface|[*()\\[\\]]"
    );
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Map<String, String> ALIASES = Map.of(
        "japanes", "japanese",
        "simplified chinese", "schinese",
        "traditional chinese", "tchinese",
        "spanish - spain", "spanish",
        "spanish - latin america", "latam_spanish",
        "portuguese - brazil", "brazilian"
    );

    private LanguageListNormalizer() {
    }

    public static List<String> normalize(String markup) {
        if (markup == null || markup.isBlank()) {
            return List.of();
        }
        String withBreaks = BREAK_TAG.matcher(markup).replaceAll("\n");
        String text = Jsoup.parse(withBreaks).wholeText();
        TreeSet<String> languages = new TreeSet<>();
        for (String part : SEPARATORS.split(text)) {
            String token = part.toLowerCase(Locale.ROOT);
            token = BOILERPLATE.matcher(token).replaceAll(" ");
            token = WHITESPACE.matcher(token).replaceAll(" ").trim();
            if (token.isEmpty()) {
                continue;
            }
            languages.add(ALIASES.getOrDefault(token, token));
        }
        return List.copyOf(languages);
    }
}
