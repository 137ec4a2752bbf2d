package ai.schemagen.model;

import java.util.Objects;

/**
 * One field of an emitted definition or of a compound type.
 * <p>
 * sourceType is the vocabulary type the semantic type was derived from ("Text" for synthetic name fields).
 * stringValues names the string dataset used for this field, or null.
 */
public record ResolvedField(
        String name,
        SemanticType type,
        CanonicalRecord canonical,
        boolean filterable,
        String sourceType,
        boolean unique,
        boolean drop,
        String stringValues
) {
    public ResolvedField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(canonical, "canonical");
    }

    public static ResolvedField of(String name, SemanticType type, CanonicalRecord canonical, String sourceType) {
        return new ResolvedField(name, type, canonical, true, sourceType, false, false, null);
    }

    public ResolvedField withType(SemanticType newType) {
        return new ResolvedField(name, newType, canonical, filterable, sourceType, unique, drop, stringValues);
    }

    public ResolvedField withFilterable(boolean newFilterable) {
        return new ResolvedField(name, type, canonical, newFilterable, sourceType, unique, drop, stringValues);
    }

    public ResolvedField withDrop(boolean newDrop) {
        return new ResolvedField(name, type, canonical, filterable, sourceType, unique, newDrop, stringValues);
    }

    public ResolvedField withStringValues(String newStringValues) {
        return new ResolvedField(name, type, canonical, filterable, sourceType, unique, drop, newStringValues);
    }
}
