package ai.schemagen.model;

import java.util.List;

/**
 * Declared property of a class: candidate value types (ranges) in declaration order plus its comment.
 */
public record PropertyDef(List<String> candidateTypes, String comment) {
    public PropertyDef {
        candidateTypes = List.copyOf(candidateTypes);
        comment = comment == null ? "" : comment;
    }
}
