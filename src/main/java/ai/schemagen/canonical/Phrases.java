package ai.schemagen.canonical;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Text helpers for turning identifiers into phrases.
 */
public final class Phrases {

    private static final Map<String, String> IRREGULAR_PLURALS = Map.of(
            "person", "people",
            "child", "children",
            "man", "men",
            "woman", "women",
            "foot", "feet",
            "tooth", "teeth",
            "mouse", "mice",
            "alumnus", "alumni"
    );

    private static final Set<String> UNCOUNTABLE = Set.of(
            "information", "equipment", "news", "series", "species", "data", "media",
            "software", "hardware", "feedback", "advice", "furniture", "luggage", "baggage"
    );

    private Phrases() {
    }

    /**
     * Splits an identifier on underscores and lower-to-upper case boundaries, then lower-cases it:
     * {@code worksFor -> "works for"}, {@code contentURL -> "content url"}, {@code _sort -> "sort"}.
     */
    public static String clean(String identifier) {
        final String raw = identifier.replace('_', ' ');
        final StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (i > 0 && Character.isUpperCase(c)) {
                final char prev = raw.charAt(i - 1);
                if (!Character.isUpperCase(prev) && prev != ' ') {
                    sb.append(' ');
                }
            }
            sb.append(c);
        }
        return sb.toString().toLowerCase(Locale.ROOT).trim().replaceAll(" +", " ");
    }

    /**
     * Pluralizes the last word of a phrase.
     */
    public static String pluralize(String phrase) {
        final int space = phrase.lastIndexOf(' ');
        final String head = space >= 0 ? phrase.substring(0, space + 1) : "";
        final String last = space >= 0 ? phrase.substring(space + 1) : phrase;
        return head + pluralizeWord(last);
    }

    static String pluralizeWord(String word) {
        if (word.isEmpty() || UNCOUNTABLE.contains(word)) {
            return word;
        }
        final String irregular = IRREGULAR_PLURALS.get(word);
        if (irregular != null) {
            return irregular;
        }
        if (IRREGULAR_PLURALS.containsValue(word)) {
            return word;
        }
        if (word.endsWith("ss") || word.endsWith("sh") || word.endsWith("ch")
                || word.endsWith("x") || word.endsWith("z")) {
            return word + "es";
        }
        // already plural
        if (word.endsWith("s")) {
            return word;
        }
        if (word.length() > 1 && word.endsWith("y") && !isVowel(word.charAt(word.length() - 2))) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        return word + "s";
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
