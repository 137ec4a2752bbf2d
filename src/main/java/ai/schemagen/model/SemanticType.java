package ai.schemagen.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Value type of a resolved property.
 * <p>
 * Text form (used by config files and output): {@code String}, {@code Number},
 * {@code Measure(ms)}, {@code Entity(tt:picture)}, {@code Enum(a,b)},
 * {@code Compound(Rating)}, {@code Array(Entity(org.schema:Person))}.
 */
public sealed interface SemanticType
        permits SemanticType.Primitive, SemanticType.Measure, SemanticType.Entity,
        SemanticType.EnumOf, SemanticType.Compound, SemanticType.ArrayOf {

    Primitive STRING = new Primitive(Kind.STRING);
    Primitive NUMBER = new Primitive(Kind.NUMBER);
    Primitive BOOLEAN = new Primitive(Kind.BOOLEAN);
    Primitive DATE = new Primitive(Kind.DATE);
    Primitive TIME = new Primitive(Kind.TIME);
    Primitive LOCATION = new Primitive(Kind.LOCATION);
    Primitive CURRENCY = new Primitive(Kind.CURRENCY);
    Primitive ANY = new Primitive(Kind.ANY);

    String describe();

    default boolean isArray() {
        return this instanceof ArrayOf;
    }

    default boolean isMeasure() {
        return this instanceof Measure;
    }

    default boolean isBoolean() {
        return this instanceof Primitive p && p.kind() == Kind.BOOLEAN;
    }

    default boolean isEnum() {
        return this instanceof EnumOf;
    }

    /**
     * Strips any number of array layers.
     */
    default SemanticType elementType() {
        SemanticType t = this;
        while (t instanceof ArrayOf a) {
            t = a.elem();
        }
        return t;
    }

    enum Kind {
        STRING("String"),
        NUMBER("Number"),
        BOOLEAN("Boolean"),
        DATE("Date"),
        TIME("Time"),
        LOCATION("Location"),
        CURRENCY("Currency"),
        ANY("Any");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    record Primitive(Kind kind) implements SemanticType {
        public Primitive {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public String describe() {
            return kind.label();
        }
    }

    record Measure(String unit) implements SemanticType {
        public Measure {
            Objects.requireNonNull(unit, "unit");
        }

        @Override
        public String describe() {
            return "Measure(" + unit + ")";
        }
    }

    record Entity(String type) implements SemanticType {
        public Entity {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String describe() {
            return "Entity(" + type + ")";
        }
    }

    record EnumOf(List<String> values) implements SemanticType {
        public EnumOf {
            values = List.copyOf(values);
        }

        @Override
        public String describe() {
            return "Enum(" + String.join(",", values) + ")";
        }
    }

    record Compound(String name, List<ResolvedField> fields) implements SemanticType {
        public Compound {
            Objects.requireNonNull(name, "name");
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

        @Override
        public String describe() {
            return "Compound(" + name + ")";
        }

        @Override
        public String toString() {
            return "Compound(" + name + ", "
                    + fields.stream().map(ResolvedField::name).collect(Collectors.joining(",")) + ")";
        }
    }

    record ArrayOf(SemanticType elem) implements SemanticType {
        public ArrayOf {
            Objects.requireNonNull(elem, "elem");
        }

        @Override
        public String describe() {
            return "Array(" + elem.describe() + ")";
        }
    }
}
