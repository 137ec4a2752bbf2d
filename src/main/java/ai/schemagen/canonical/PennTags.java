package ai.schemagen.canonical;

import java.util.Set;

/**
 * Penn Treebank tag groups used by the phrase rules.
 */
public final class PennTags {

    public static final Set<String> NOUN = Set.of("NN", "NNS", "NNP", "NNPS");

    /** finite verb forms: present (VBP, VBZ) and past (VBD) */
    public static final Set<String> FINITE_VERB = Set.of("VBP", "VBZ", "VBD");

    public static final Set<String> PARTICIPLE_OR_ADJECTIVE = Set.of("VBN", "VBG", "JJ", "JJR");

    /** what may follow "is" in a passive or predicative phrase */
    public static final Set<String> PASSIVE = Set.of("VBN", "JJ", "JJR");

    private PennTags() {
    }

    public static boolean isNoun(String tag) {
        return NOUN.contains(tag);
    }
}
