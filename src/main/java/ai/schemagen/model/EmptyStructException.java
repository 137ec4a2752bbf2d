package ai.schemagen.model;

/**
 * Thrown when a struct-represented type has no field left after property resolution.
 */
public class EmptyStructException extends SchemaResolutionException {
    private final String typeName;

    public EmptyStructException(String typeName) {
        super("Struct type " + typeName + " has no fields");
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
