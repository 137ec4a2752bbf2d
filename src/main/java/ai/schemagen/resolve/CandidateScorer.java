package ai.schemagen.resolve;

import java.util.Objects;

import ai.schemagen.config.ResolverConfig;
import ai.schemagen.graph.TypeGraph;
import ai.schemagen.model.PropertyDef;
import ai.schemagen.model.TypeNode;

/**
 * Ranks the candidate value types of a property.
 * <p>
 * Preference: enumeration, then builtin scalar, then struct, then explicit text,
 * then any other known class (entity reference). Unknown types are never chosen.
 */
public final class CandidateScorer {

    public static final int ENUM = 5;
    public static final int BUILTIN = 4;
    public static final int STRUCT = 3;
    public static final int TEXT = 2;
    public static final int ENTITY = 1;
    public static final int UNKNOWN = -1;

    private final ResolverConfig config;

    public CandidateScorer(ResolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public int score(String typeName, TypeGraph graph) {
        final TypeNode node = graph.get(typeName);
        if (node != null && node.isEnum()) {
            return ENUM;
        }
        if (config.textType().equals(typeName)) {
            return TEXT;
        }
        if (config.isBuiltin(typeName)) {
            return BUILTIN;
        }
        if (node == null) {
            return UNKNOWN;
        }
        if (node.representAsStruct()) {
            return STRUCT;
        }
        return ENTITY;
    }

    /**
     * Highest-scoring candidate (first one on ties), or null when no candidate scores at least zero.
     */
    public String best(PropertyDef def, TypeGraph graph) {
        String best = null;
        int bestScore = Integer.MIN_VALUE;
        for (String type : def.candidateTypes()) {
            final int s = score(type, graph);
            if (s > bestScore) {
                best = type;
                bestScore = s;
            }
        }
        return bestScore < 0 ? null : best;
    }
}
