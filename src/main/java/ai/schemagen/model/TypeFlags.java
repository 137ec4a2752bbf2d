package ai.schemagen.model;

/**
 * Classification flags of a {@link TypeNode}. elementType is set only for list wrappers.
 */
public record TypeFlags(
        boolean isAction,
        boolean isEnum,
        boolean isListWrapper,
        String elementType,
        boolean isStructLineage,
        boolean representAsStruct
) {
    public static final TypeFlags NONE = new TypeFlags(false, false, false, null, false, false);

    public TypeFlags withRepresentAsStruct(boolean value) {
        return new TypeFlags(isAction, isEnum, isListWrapper, elementType, isStructLineage, value);
    }
}
