package ai.schemagen.resolve;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.schemagen.canonical.CanonicalPhraseSynthesizer;
import ai.schemagen.config.ResolverConfig;
import ai.schemagen.graph.InheritedProperties;
import ai.schemagen.graph.TypeGraph;
import ai.schemagen.model.CanonicalRecord;
import ai.schemagen.model.EmptyStructException;
import ai.schemagen.model.PropertyDef;
import ai.schemagen.model.ResolvedField;
import ai.schemagen.model.SemanticType;
import ai.schemagen.model.TypeNode;

/**
 * Builds the inlined {@link SemanticType.Compound} of a struct-represented type from its own and
 * inherited properties (see {@link InheritedProperties} for the walk boundaries).
 */
public final class CompoundTypeBuilder {

    private final ResolverConfig config;
    private final PropertyTypeResolver resolver;
    private final CanonicalPhraseSynthesizer synthesizer;

    CompoundTypeBuilder(ResolverConfig config,
                        PropertyTypeResolver resolver,
                        CanonicalPhraseSynthesizer synthesizer) {
        this.config = Objects.requireNonNull(config, "config");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
    }

    /**
     * @throws EmptyStructException when none of the collected properties resolves to a type
     */
    public SemanticType.Compound buildCompound(String typeName, TypeGraph graph) {
        return buildCompound(typeName, graph, new ArrayDeque<>());
    }

    SemanticType.Compound buildCompound(String typeName, TypeGraph graph, Deque<String> building) {
        final TypeNode node = graph.require(typeName);
        if (!node.representAsStruct() || node.isEnum()) {
            throw new IllegalArgumentException(typeName + " is not represented as a struct");
        }
        if (building.contains(typeName)) {
            throw new IllegalStateException("Struct type " + typeName + " contains itself via "
                    + String.join(" -> ", building) + "; classify the graph first");
        }

        building.push(typeName);
        try {
            final Map<String, PropertyDef> properties = InheritedProperties.collect(graph, typeName, config);

            final List<ResolvedField> fields = new ArrayList<>(properties.size());
            for (var e : properties.entrySet()) {
                final String propertyName = e.getKey();
                final ResolvedType resolved = resolver.resolveType(propertyName, e.getValue(), graph, building);
                if (resolved.isNone()) {
                    continue;
                }
                final CanonicalRecord canonical = synthesizer.synthesize(propertyName, resolved.type());
                ResolvedField field = ResolvedField.of(propertyName, resolved.type(), canonical, resolved.sourceType());
                if (config.noFilterProperties().contains(propertyName)) {
                    field = field.withFilterable(false);
                }
                fields.add(field);
            }
            if (fields.isEmpty()) {
                throw new EmptyStructException(typeName);
            }
            return new SemanticType.Compound(typeName, fields);
        } finally {
            building.pop();
        }
    }
}
