package ai.schemagen.model;

/**
 * Thrown when a statement has an unknown kind or is missing a required field.
 */
public class MalformedStatementException extends SchemaResolutionException {
    public MalformedStatementException(String message) {
        super(message);
    }
}
