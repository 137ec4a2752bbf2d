package ai.schemagen.model;

/**
 * Grammatical role a canonical phrase is used in.
 */
public enum CanonicalRole {
    BASE("base"),
    VERB("verb"),
    PASSIVE_VERB("passive_verb"),
    ADJECTIVE("adjective"),
    PROPERTY("property"),
    REVERSE_PROPERTY("reverse_property");

    private final String key;

    CanonicalRole(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static CanonicalRole fromKey(String key) {
        for (CanonicalRole role : values()) {
            if (role.key.equals(key)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown canonical role: " + key);
    }
}
