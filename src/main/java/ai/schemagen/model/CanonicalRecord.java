package ai.schemagen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Phrase templates of a property, grouped by {@link CanonicalRole}.
 * A template may contain one {@value #PLACEHOLDER} standing for the property value.
 */
public record CanonicalRecord(Map<CanonicalRole, List<String>> phrases) {

    public static final String PLACEHOLDER = "#";

    private static final CanonicalRecord EMPTY = new CanonicalRecord(Map.of());

    public CanonicalRecord {
        final Map<CanonicalRole, List<String>> copy = new EnumMap<>(CanonicalRole.class);
        for (var e : phrases.entrySet()) {
            if (!e.getValue().isEmpty()) {
                copy.put(e.getKey(), List.copyOf(e.getValue()));
            }
        }
        phrases = Collections.unmodifiableMap(copy);
    }

    public static CanonicalRecord empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> get(CanonicalRole role) {
        return phrases.getOrDefault(role, List.of());
    }

    public boolean has(CanonicalRole role) {
        return phrases.containsKey(role);
    }

    public boolean isEmpty() {
        return phrases.isEmpty();
    }

    /**
     * Accumulates phrases per role, keeping first-insertion order and skipping duplicates.
     */
    public static final class Builder {
        private final Map<CanonicalRole, List<String>> phrases = new EnumMap<>(CanonicalRole.class);

        private Builder() {
        }

        public Builder add(CanonicalRole role, String phrase) {
            final List<String> list = phrases.computeIfAbsent(role, k -> new ArrayList<>());
            if (!list.contains(phrase)) {
                list.add(phrase);
            }
            return this;
        }

        public Builder addAll(CanonicalRole role, List<String> phrases) {
            for (String p : phrases) {
                add(role, p);
            }
            return this;
        }

        public Builder addAll(CanonicalRole role, String... phrases) {
            return addAll(role, List.of(phrases));
        }

        public boolean has(CanonicalRole role) {
            return phrases.containsKey(role);
        }

        public boolean isEmpty() {
            return phrases.isEmpty();
        }

        public CanonicalRecord build() {
            return new CanonicalRecord(phrases);
        }
    }
}
