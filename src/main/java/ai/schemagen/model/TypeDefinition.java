package ai.schemagen.model;

import java.util.List;

/**
 * Emitted definition of a referenced-entity type, ready for a downstream serializer.
 */
public record TypeDefinition(
        String name,
        List<String> parents,
        List<ResolvedField> fields,
        String canonical,
        String confirmation
) {
    public TypeDefinition {
        parents = List.copyOf(parents);
        fields = List.copyOf(fields);
    }

    public ResolvedField field(String fieldName) {
        for (ResolvedField f : fields) {
            if (f.name().equals(fieldName)) {
                return f;
            }
        }
        return null;
    }
}
