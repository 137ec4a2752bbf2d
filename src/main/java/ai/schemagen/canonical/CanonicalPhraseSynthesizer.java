package ai.schemagen.canonical;

import static ai.schemagen.model.CanonicalRole.BASE;
import static ai.schemagen.model.CanonicalRole.PASSIVE_VERB;
import static ai.schemagen.model.CanonicalRole.REVERSE_PROPERTY;
import static ai.schemagen.model.CanonicalRole.VERB;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import ai.schemagen.config.ResolverConfig;
import ai.schemagen.model.CanonicalRecord;
import ai.schemagen.model.SemanticType;

/**
 * Derives the canonical phrases of a property from its identifier or from external labels.
 * <p>
 * Override tables win outright. Otherwise each candidate phrase is classified, in order:
 * <ol>
 *   <li>"X content" with a measure type: base "X content", "X", "X amount" and verb "contains #"</li>
 *   <li>"has X": base "X"</li>
 *   <li>"is X": reverse property when X ends in a noun or " of", passive verb when X starts
 *       with a participle or adjective</li>
 *   <li>finite verb first: verb ("serves cuisine" becomes "serves # cuisine" plus base "cuisine");
 *       "X of": reverse property; participle/adjective first and no final noun: passive verb;
 *       anything else: base</li>
 * </ol>
 */
public final class CanonicalPhraseSynthesizer {

    private static final Pattern LETTERS_AND_SPACES = Pattern.compile("^[a-z ]+$");

    private final ResolverConfig config;
    private final PosTagger tagger;
    private final Map<String, List<String>> labels;

    public CanonicalPhraseSynthesizer(ResolverConfig config, PosTagger tagger) {
        this(config, tagger, Map.of());
    }

    /**
     * @param labels external label candidates per property name (may be empty)
     */
    public CanonicalPhraseSynthesizer(ResolverConfig config, PosTagger tagger, Map<String, List<String>> labels) {
        this.config = Objects.requireNonNull(config, "config");
        this.tagger = Objects.requireNonNull(tagger, "tagger");
        this.labels = Map.copyOf(Objects.requireNonNull(labels, "labels"));
    }

    public CanonicalRecord synthesize(String propertyName, SemanticType type) {
        return synthesize(propertyName, type, labels.get(propertyName));
    }

    /**
     * @param labelCandidates external label candidates, or null to derive one from the identifier;
     *                        an empty list yields no candidates
     */
    public CanonicalRecord synthesize(String propertyName, SemanticType type, List<String> labelCandidates) {
        Objects.requireNonNull(propertyName, "propertyName");
        Objects.requireNonNull(type, "type");

        final CanonicalRecord override = config.canonicalOverrides().get(propertyName);
        if (override != null) {
            return override;
        }
        if (config.manual()) {
            final CanonicalRecord manual = config.manualCanonicalOverrides().get(propertyName);
            if (manual != null) {
                return manual;
            }
        }

        final Collection<String> candidates = labelCandidates != null
                ? new LinkedHashSet<>(labelCandidates)
                : List.of(cleanName(propertyName));

        final CanonicalRecord.Builder canonical = CanonicalRecord.builder();
        for (String candidate : candidates) {
            if (candidate != null) {
                addCandidate(canonical, candidate, type);
            }
        }
        if (canonical.isEmpty() && config.alwaysBaseCanonical()) {
            canonical.add(BASE, propertyName);
        }
        return canonical.build();
    }

    static String cleanName(String propertyName) {
        final String name = Phrases.clean(propertyName);
        if (name.endsWith(" value")) {
            return name.substring(0, name.length() - " value".length());
        }
        return name;
    }

    private void addCandidate(CanonicalRecord.Builder canonical, String candidate, SemanticType type) {
        String name = candidate.toLowerCase(Locale.ROOT).trim();
        // only letters and spaces
        if (!LETTERS_AND_SPACES.matcher(name).matches()) {
            return;
        }
        name = name.replaceAll(" +", " ");
        if (type.isArray()) {
            name = Phrases.pluralize(name);
        }

        if (name.endsWith(" content") && type.isMeasure()) {
            final String stem = name.substring(0, name.length() - " content".length());
            canonical.add(VERB, "contains " + CanonicalRecord.PLACEHOLDER);
            canonical.addAll(BASE, stem + " content", stem, stem + " amount");
        } else if (name.startsWith("has ")) {
            canonical.add(BASE, name.substring("has ".length()));
        } else if (name.startsWith("is ")) {
            final String rest = name.substring("is ".length());
            final List<String> tags = tag(rest);
            if (PennTags.isNoun(tags.get(tags.size() - 1)) || rest.endsWith(" of")) {
                canonical.add(REVERSE_PROPERTY, rest);
            } else if (PennTags.PASSIVE.contains(tags.get(0))) {
                canonical.add(PASSIVE_VERB, rest);
            }
        } else {
            final List<String> words = words(name);
            final List<String> tags = tag(name);
            final String first = tags.get(0);
            final String last = tags.get(tags.size() - 1);
            if (PennTags.FINITE_VERB.contains(first)) {
                if (words.size() == 2 && PennTags.isNoun(tags.get(1))) {
                    canonical.add(VERB, words.get(0) + " " + CanonicalRecord.PLACEHOLDER + " " + words.get(1));
                    canonical.add(BASE, words.get(1));
                } else {
                    canonical.add(VERB, name);
                }
            } else if (name.endsWith(" of")) {
                canonical.add(REVERSE_PROPERTY, name);
            } else if (PennTags.PARTICIPLE_OR_ADJECTIVE.contains(first) && !PennTags.isNoun(last)) {
                // loose: unknown words ending in a suffix (e.g. -able) tag as adjectives too
                canonical.add(PASSIVE_VERB, name);
            } else {
                canonical.add(BASE, name);
            }
        }
    }

    private List<String> tag(String phrase) {
        final List<String> words = words(phrase);
        final List<String> tags = tagger.tag(words);
        if (tags.size() != words.size()) {
            throw new IllegalStateException("Tagger returned " + tags.size() + " tags for " + words.size()
                    + " tokens of '" + phrase + "'");
        }
        return tags;
    }

    private static List<String> words(String phrase) {
        return Arrays.asList(phrase.trim().split(" "));
    }
}
