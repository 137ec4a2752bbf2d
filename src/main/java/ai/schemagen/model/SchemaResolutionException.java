package ai.schemagen.model;

/**
 * Base of all failures raised while building or resolving the vocabulary graph.
 */
public class SchemaResolutionException extends RuntimeException {
    public SchemaResolutionException(String message) {
        super(message);
    }

    public SchemaResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
