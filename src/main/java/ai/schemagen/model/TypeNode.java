package ai.schemagen.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Class of the vocabulary graph. Immutable; classification returns updated copies.
 */
public record TypeNode(
        String name,
        List<String> parents,
        Map<String, PropertyDef> properties,
        String comment,
        List<String> enumValues,
        TypeFlags flags
) {
    public TypeNode {
        Objects.requireNonNull(name, "name");
        parents = List.copyOf(parents);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        comment = comment == null ? "" : comment;
        enumValues = List.copyOf(enumValues);
        flags = flags == null ? TypeFlags.NONE : flags;
    }

    public TypeNode withFlags(TypeFlags newFlags) {
        return new TypeNode(name, parents, properties, comment, enumValues, newFlags);
    }

    public boolean isAction() {
        return flags.isAction();
    }

    public boolean isEnum() {
        return flags.isEnum();
    }

    public boolean isListWrapper() {
        return flags.isListWrapper();
    }

    public boolean isStructLineage() {
        return flags.isStructLineage();
    }

    public boolean representAsStruct() {
        return flags.representAsStruct();
    }

    public Representation representation() {
        if (flags.isListWrapper()) {
            return new Representation.ListOf(flags.elementType());
        }
        if (flags.isEnum()) {
            // an enum inheriting all its members is referenced, never inlined
            return enumValues.isEmpty()
                    ? new Representation.EntityReference(name)
                    : new Representation.Enumeration(enumValues);
        }
        if (flags.representAsStruct()) {
            return new Representation.Struct(name);
        }
        return new Representation.EntityReference(name);
    }
}
