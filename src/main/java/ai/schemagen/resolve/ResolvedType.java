package ai.schemagen.resolve;

import ai.schemagen.model.SemanticType;

/**
 * Outcome of property type resolution: the chosen candidate (kept for provenance) and the
 * semantic type. Both are null when the property is dropped.
 */
public record ResolvedType(String sourceType, SemanticType type) {

    public static final ResolvedType NONE = new ResolvedType(null, null);

    public boolean isNone() {
        return type == null;
    }
}
