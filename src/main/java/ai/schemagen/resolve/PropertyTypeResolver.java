package ai.schemagen.resolve;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import ai.schemagen.Diagnostics;
import ai.schemagen.canonical.CanonicalPhraseSynthesizer;
import ai.schemagen.config.ResolverConfig;
import ai.schemagen.graph.TypeGraph;
import ai.schemagen.model.PropertyDef;
import ai.schemagen.model.Representation;
import ai.schemagen.model.SemanticType;
import ai.schemagen.model.TypeNode;

/**
 * Chooses the value type of a property and maps it to a {@link SemanticType}.
 * <p>
 * Struct-represented value types are expanded through {@link CompoundTypeBuilder}; the graph
 * must have been classified first so that struct types cannot contain themselves.
 */
public final class PropertyTypeResolver {

    // "A list of ..." / "An offer ..." suggests a repeated value, "The ..." a single one
    private static final Pattern INDEFINITE_ARTICLE = Pattern.compile("^an? ", Pattern.CASE_INSENSITIVE);

    private final ResolverConfig config;
    private final CandidateScorer scorer;
    private final CompoundTypeBuilder compounds;
    private final Diagnostics diagnostics;

    public PropertyTypeResolver(ResolverConfig config,
                                CanonicalPhraseSynthesizer synthesizer,
                                Diagnostics diagnostics) {
        this.config = Objects.requireNonNull(config, "config");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.scorer = new CandidateScorer(config);
        this.compounds = new CompoundTypeBuilder(config, this, synthesizer);
    }

    public CompoundTypeBuilder compounds() {
        return compounds;
    }

    public ResolvedType resolveType(String propertyName, PropertyDef def, TypeGraph graph) {
        return resolveType(propertyName, def, graph, new ArrayDeque<>());
    }

    ResolvedType resolveType(String propertyName, PropertyDef def, TypeGraph graph, Deque<String> building) {
        Objects.requireNonNull(propertyName, "propertyName");
        Objects.requireNonNull(def, "def");
        Objects.requireNonNull(graph, "graph");

        if (config.blockedProperties().contains(propertyName)) {
            return ResolvedType.NONE;
        }

        boolean isArray = false;
        for (String candidate : def.candidateTypes()) {
            final TypeNode node = graph.get(candidate);
            if (node != null && node.isListWrapper()) {
                isArray = true;
                break;
            }
        }
        if (INDEFINITE_ARTICLE.matcher(def.comment()).find()) {
            isArray = true;
        }
        if (config.forceArrayProperties().contains(propertyName)) {
            isArray = true;
        }
        if (config.forceNotArrayProperties().contains(propertyName)) {
            isArray = false;
        }

        final String best = scorer.best(def, graph);
        if (best == null) {
            return ResolvedType.NONE;
        }

        final SemanticType override = config.propertyTypeOverrides().get(propertyName);
        if (override != null) {
            return new ResolvedType(best, override);
        }

        // a list wrapper already maps to an array
        final TypeNode bestNode = graph.get(best);
        if (bestNode != null && bestNode.isListWrapper()) {
            isArray = false;
        }

        if (best.equals(config.ambiguousNumericType())) {
            return new ResolvedType(best, guessNumericType(propertyName));
        }

        SemanticType type = toSemanticType(best, graph, building);
        if (config.forceNotArrayProperties().contains(propertyName) && type instanceof SemanticType.ArrayOf list) {
            type = list.elem();
        }

        // an array of booleans or enums does not make much sense
        if (type.isBoolean() || type.isEnum()) {
            isArray = false;
        }
        if (isArray) {
            type = new SemanticType.ArrayOf(type);
        }
        return new ResolvedType(best, type);
    }

    private SemanticType guessNumericType(String propertyName) {
        final String lower = propertyName.toLowerCase(Locale.ROOT);
        if (lower.contains("number") || lower.contains("level") || lower.contains("quantity")) {
            return SemanticType.NUMBER;
        }
        if (lower.contains("duration")) {
            return new SemanticType.Measure("ms");
        }
        diagnostics.warn("Cannot guess the correct type of " + propertyName + " of type "
                + config.ambiguousNumericType() + ", assuming Number");
        return SemanticType.NUMBER;
    }

    SemanticType toSemanticType(String typeName, TypeGraph graph, Deque<String> building) {
        final SemanticType builtin = config.builtinTypes().get(typeName);
        if (builtin != null) {
            return builtin;
        }
        final TypeNode node = graph.get(typeName);
        if (node == null) {
            return new SemanticType.Entity(config.classPrefix() + typeName);
        }

        final Representation repr = node.representation();
        if (repr instanceof Representation.ListOf list) {
            if (list.elementType().equals(typeName)) {
                return new SemanticType.ArrayOf(new SemanticType.Entity(config.classPrefix() + typeName));
            }
            return new SemanticType.ArrayOf(toSemanticType(list.elementType(), graph, building));
        }
        if (repr instanceof Representation.Enumeration en) {
            return new SemanticType.EnumOf(en.values());
        }
        if (repr instanceof Representation.Struct struct) {
            return compounds.buildCompound(struct.typeName(), graph, building);
        }
        return new SemanticType.Entity(config.classPrefix() + typeName);
    }
}
