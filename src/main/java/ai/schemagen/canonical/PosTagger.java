package ai.schemagen.canonical;

import java.util.List;

/**
 * Part-of-speech tagger using the Penn Treebank tag set (see {@link PennTags}).
 * Implementations must return exactly one tag per token.
 */
@FunctionalInterface
public interface PosTagger {

    List<String> tag(List<String> tokens);
}
