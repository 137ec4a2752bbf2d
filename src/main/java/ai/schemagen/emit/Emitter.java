package ai.schemagen.emit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ai.schemagen.canonical.CanonicalPhraseSynthesizer;
import ai.schemagen.canonical.Phrases;
import ai.schemagen.config.ResolverConfig;
import ai.schemagen.graph.TypeGraph;
import ai.schemagen.model.CanonicalRecord;
import ai.schemagen.model.ResolvedField;
import ai.schemagen.model.SemanticType;
import ai.schemagen.model.TypeDefinition;
import ai.schemagen.model.TypeNode;
import ai.schemagen.resolve.PropertyTypeResolver;
import ai.schemagen.resolve.ResolvedType;

/**
 * Produces the ordered definitions of all entity types of a classified graph.
 * <p>
 * Actions, enumerations and struct types are never emitted on their own (the latter two only
 * appear as field types), nor are list wrappers and the collection root. Parents come before
 * their subtypes; otherwise declaration order is kept.
 */
public final class Emitter {

    private static final String GEO_PROPERTY = "geo";

    private final ResolverConfig config;
    private final PropertyTypeResolver resolver;
    private final CanonicalPhraseSynthesizer synthesizer;

    public Emitter(ResolverConfig config, PropertyTypeResolver resolver, CanonicalPhraseSynthesizer synthesizer) {
        this.config = Objects.requireNonNull(config, "config");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
    }

    public List<TypeDefinition> emit(TypeGraph graph) {
        Objects.requireNonNull(graph, "graph");

        final List<TypeDefinition> out = new ArrayList<>();
        for (String typeName : topologicalOrder(graph)) {
            final TypeNode node = graph.get(typeName);
            if (typeName.equals(config.collectionRoot()) || node.isListWrapper()) {
                continue;
            }
            out.add(define(graph, node));
        }
        return out;
    }

    /**
     * Depth-first order over emittable types, parents first, ties broken by declaration order.
     */
    public List<String> topologicalOrder(TypeGraph graph) {
        final Set<String> order = new LinkedHashSet<>();
        final Set<String> visiting = new HashSet<>();
        for (String typeName : graph.names()) {
            visit(graph, typeName, order, visiting);
        }
        return new ArrayList<>(order);
    }

    private static void visit(TypeGraph graph, String typeName, Set<String> order, Set<String> visiting) {
        final TypeNode node = graph.get(typeName);
        if (node == null || node.isAction() || node.isEnum() || node.representAsStruct()) {
            return;
        }
        if (order.contains(typeName) || !visiting.add(typeName)) {
            return;
        }
        for (String parent : node.parents()) {
            visit(graph, parent, order, visiting);
        }
        order.add(typeName);
    }

    private TypeDefinition define(TypeGraph graph, TypeNode node) {
        final String typeName = node.name();
        final String prefix = config.classPrefix();
        final String nameFileId = prefix + typeName + "_name";
        final List<ResolvedField> fields = new ArrayList<>();

        final ResolvedField id = new ResolvedField("id", new SemanticType.Entity(prefix + typeName),
                CanonicalRecord.empty(), false, typeName, true, false, null);
        fields.add(annotate(id, nameFileId, false));

        // every table gets its own name so it can carry its own string dataset
        if (!typeName.equals(config.rootType())) {
            final ResolvedField name = new ResolvedField("name", SemanticType.STRING,
                    CanonicalRecord.empty(), false, config.textType(), false, false, null);
            fields.add(annotate(name, nameFileId, false));
        }

        final boolean hasGeo = node.properties().containsKey(GEO_PROPERTY);
        for (var e : node.properties().entrySet()) {
            final String propertyName = e.getKey();
            final ResolvedType resolved = resolver.resolveType(propertyName, e.getValue(), graph);
            if (resolved.isNone()) {
                continue;
            }
            final String fieldName = escape(propertyName);
            ResolvedField field = new ResolvedField(fieldName, resolved.type(),
                    synthesizer.synthesize(propertyName, resolved.type()),
                    !config.noFilterProperties().contains(propertyName),
                    resolved.sourceType(), false, false, null);
            field = annotate(field, prefix + typeName + "_" + fieldName, hasGeo);
            fields.add(field);
        }

        final String cleaned = Phrases.clean(typeName);
        return new TypeDefinition(escape(typeName), node.parents(), fields, cleaned, cleaned);
    }

    private String escape(String name) {
        return config.reservedWords().contains(name) ? "_" + name : name;
    }

    /**
     * Attaches string datasets and, inside compounds of a type with a location, the
     * drop-with-geo markers. Compound fields are rebuilt recursively.
     */
    private ResolvedField annotate(ResolvedField field, String fileId, boolean hasGeo) {
        final SemanticType elem = field.type().elementType();

        if (elem instanceof SemanticType.Entity) {
            final String dataset = config.stringValueOverrides().get(fileId);
            return dataset != null ? field.withStringValues(dataset) : field;
        }
        if (SemanticType.STRING.equals(elem)) {
            return field.withStringValues(config.stringValueOverrides().getOrDefault(fileId, fileId));
        }
        if (elem instanceof SemanticType.Compound compound) {
            final List<ResolvedField> inner = new ArrayList<>(compound.fields().size());
            for (ResolvedField f : compound.fields()) {
                ResolvedField g = f;
                if (hasGeo && config.dropWithGeoProperties().contains(f.name())) {
                    g = g.withFilterable(false).withDrop(true);
                }
                inner.add(annotate(g, fileId + "_" + f.name(), hasGeo));
            }
            return field.withType(replaceElement(field.type(), new SemanticType.Compound(compound.name(), inner)));
        }
        return field;
    }

    private static SemanticType replaceElement(SemanticType type, SemanticType newElement) {
        if (type instanceof SemanticType.ArrayOf array) {
            return new SemanticType.ArrayOf(replaceElement(array.elem(), newElement));
        }
        return newElement;
    }
}
