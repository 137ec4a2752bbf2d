package ai.schemagen.model;

import java.util.List;

/**
 * How values of a class are represented wherever the class is used as a property type.
 */
public sealed interface Representation
        permits Representation.Enumeration, Representation.ListOf,
        Representation.Struct, Representation.EntityReference {

    record Enumeration(List<String> values) implements Representation {
        public Enumeration {
            values = List.copyOf(values);
        }
    }

    record ListOf(String elementType) implements Representation {
    }

    record Struct(String typeName) implements Representation {
    }

    record EntityReference(String typeName) implements Representation {
    }
}
