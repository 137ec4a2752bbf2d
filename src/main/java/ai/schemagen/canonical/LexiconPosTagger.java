package ai.schemagen.canonical;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Dictionary and suffix-pattern tagger, followed by a small context smoothing pass.
 * <p>
 * Known words take their lexicon tag; unknown words are tagged from their shape
 * (-ing VBG, -ed VBN, -ly RB, adjective suffixes JJ, plural -s NNS, digits CD, otherwise NN).
 */
public final class LexiconPosTagger implements PosTagger {

    public static final String DEFAULT_LEXICON = "/ai/schemagen/canonical/lexicon.tsv";

    private static final String[] ADJECTIVE_SUFFIXES = {"able", "ible", "ous", "ful", "less", "ish"};

    private final Map<String, String> lexicon;

    public LexiconPosTagger(Map<String, String> lexicon) {
        this.lexicon = Map.copyOf(Objects.requireNonNull(lexicon, "lexicon"));
    }

    /**
     * Tagger backed by the lexicon bundled with this library.
     */
    public static LexiconPosTagger withDefaultLexicon() {
        try (InputStream in = LexiconPosTagger.class.getResourceAsStream(DEFAULT_LEXICON)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_LEXICON);
            }
            return new LexiconPosTagger(readLexicon(in));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_LEXICON, ex);
        }
    }

    static Map<String, String> readLexicon(InputStream in) throws IOException {
        final Map<String, String> out = new HashMap<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                final String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                final int tab = trimmed.indexOf('\t');
                if (tab <= 0) {
                    throw new IOException("Malformed lexicon line: " + trimmed);
                }
                out.putIfAbsent(trimmed.substring(0, tab).trim(), trimmed.substring(tab + 1).trim());
            }
        }
        return out;
    }

    @Override
    public List<String> tag(List<String> tokens) {
        final List<String> tags = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            tags.add(initialTag(token.toLowerCase(Locale.ROOT)));
        }
        smooth(tokens, tags);
        return tags;
    }

    private String initialTag(String word) {
        final String known = lexicon.get(word);
        if (known != null) {
            return known;
        }
        if (!word.isEmpty() && word.chars().allMatch(Character::isDigit)) {
            return "CD";
        }
        if (word.length() > 4 && word.endsWith("ing")) {
            return "VBG";
        }
        if (word.length() > 3 && word.endsWith("ed")) {
            return "VBN";
        }
        if (word.length() > 3 && word.endsWith("ly")) {
            return "RB";
        }
        for (String suffix : ADJECTIVE_SUFFIXES) {
            if (word.length() > suffix.length() + 1 && word.endsWith(suffix)) {
                return "JJ";
            }
        }
        if (word.length() > 2 && word.endsWith("s") && !word.endsWith("ss")) {
            return "NNS";
        }
        return "NN";
    }

    private static void smooth(List<String> tokens, List<String> tags) {
        for (int i = 1; i < tags.size(); i++) {
            final String prev = tags.get(i - 1);
            final String cur = tags.get(i);

            // "the works", "their uses": a determiner is followed by a noun, not a finite verb
            if (("DT".equals(prev) || "PRP$".equals(prev))
                    && ("VBZ".equals(cur) || "VBP".equals(cur) || "VB".equals(cur))) {
                tags.set(i, "VBZ".equals(cur) ? "NNS" : "NN");
                continue;
            }
            // "to serve": infinitive
            if ("TO".equals(prev) && ("NN".equals(cur) || "VBP".equals(cur))) {
                tags.set(i, "VB");
                continue;
            }
            // "has won": participle after an auxiliary
            if ("VBD".equals(cur) && isAuxiliary(tokens.get(i - 1))) {
                tags.set(i, "VBN");
            }
        }
    }

    private static boolean isAuxiliary(String token) {
        return switch (token.toLowerCase(Locale.ROOT)) {
            case "is", "are", "was", "were", "be", "been", "has", "have", "had" -> true;
            default -> false;
        };
    }
}
