package ai.schemagen.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the text form produced by {@link SemanticType#describe()}.
 * Compound types cannot be parsed (their fields are only known after resolution).
 */
public final class SemanticTypes {

    private SemanticTypes() {
    }

    public static SemanticType parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Semantic type must not be blank");
        }
        final String raw = text.trim();
        final int open = raw.indexOf('(');
        if (open < 0) {
            return primitive(raw);
        }
        if (!raw.endsWith(")")) {
            throw new IllegalArgumentException("Unbalanced semantic type: " + raw);
        }
        final String head = raw.substring(0, open).trim();
        final String arg = raw.substring(open + 1, raw.length() - 1).trim();
        return switch (head) {
            case "Array" -> new SemanticType.ArrayOf(parse(arg));
            case "Measure" -> new SemanticType.Measure(arg);
            case "Entity" -> new SemanticType.Entity(arg);
            case "Enum" -> new SemanticType.EnumOf(splitValues(arg));
            default -> throw new IllegalArgumentException("Unknown semantic type: " + raw);
        };
    }

    private static SemanticType primitive(String name) {
        for (SemanticType.Kind kind : SemanticType.Kind.values()) {
            if (kind.label().equals(name)) {
                return new SemanticType.Primitive(kind);
            }
        }
        throw new IllegalArgumentException("Unknown semantic type: " + name);
    }

    private static List<String> splitValues(String arg) {
        final List<String> out = new ArrayList<>();
        for (String v : arg.split(",")) {
            final String t = v.trim();
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return out;
    }
}
