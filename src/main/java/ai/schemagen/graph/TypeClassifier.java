package ai.schemagen.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.schemagen.Diagnostics;
import ai.schemagen.config.ResolverConfig;
import ai.schemagen.model.PropertyDef;
import ai.schemagen.model.TypeFlags;
import ai.schemagen.model.TypeNode;
import ai.schemagen.resolve.CandidateScorer;

/**
 * Decides the representation of every class.
 * <p>
 * Three passes over the graph, in declaration order:
 * 1) flags from the class hierarchy (action, enum, list wrapper, struct lineage, forced non-struct)
 * 2) cycle breaking: a struct type that can reach itself through struct-typed fields is demoted
 * 3) ancestor propagation: every parent of a non-struct type becomes non-struct as well
 * <p>
 * Propagation goes to parents, not children. A struct type's inherited field set is collected
 * from its ancestors, so an ancestor must never be struct while a descendant is not.
 */
public final class TypeClassifier {

    private final ResolverConfig config;
    private final CandidateScorer scorer;
    private final Diagnostics diagnostics;

    public TypeClassifier(ResolverConfig config, Diagnostics diagnostics) {
        this.config = Objects.requireNonNull(config, "config");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.scorer = new CandidateScorer(config);
    }

    public TypeGraph classify(TypeGraph graph) {
        Objects.requireNonNull(graph, "graph");

        final Map<String, TypeNode> nodes = graph.toMap();
        final List<String> names = graph.names();

        // Step 1: hierarchy flags
        for (String name : names) {
            nodes.put(name, nodes.get(name).withFlags(hierarchyFlags(graph, graph.get(name))));
        }

        // Step 2: break representation cycles; each search sees earlier demotions
        TypeGraph current = new TypeGraph(nodes);
        for (String name : names) {
            final TypeNode node = nodes.get(name);
            if (node.isEnum() || !node.representAsStruct()) {
                continue;
            }
            final List<String> path = new ArrayList<>();
            if (findCycle(current, name, name, new HashSet<>(), path)) {
                diagnostics.warn("Found cycle for " + name + " via " + String.join(" -> ", path)
                        + ", representing it as an entity");
                nodes.put(name, node.withFlags(node.flags().withRepresentAsStruct(false)));
                current = new TypeGraph(nodes);
            }
        }

        // Step 3: all parents of non-struct types are non-struct, recursively
        for (String name : names) {
            final TypeNode node = nodes.get(name);
            if (node.isEnum() || node.representAsStruct()) {
                continue;
            }
            makeNonStruct(nodes, name, new HashSet<>());
        }

        return new TypeGraph(nodes);
    }

    private TypeFlags hierarchyFlags(TypeGraph graph, TypeNode node) {
        final String name = node.name();

        final boolean isAction = graph.isSubClass(name, config.actionRoot());
        final boolean isEnum = !node.enumValues().isEmpty() || graph.isSubClass(name, config.enumerationRoot());
        final boolean isListWrapper = graph.isSubClass(name, config.collectionRoot());
        final String elementType = isListWrapper ? elementType(graph, name) : null;

        boolean lineage = config.isStructRoot(name);
        if (!lineage) {
            for (String root : config.structRoots()) {
                if (graph.isSubClass(name, root)) {
                    lineage = true;
                    break;
                }
            }
        }
        if (config.nonStructTypes().contains(name)) {
            lineage = false;
        }

        return new TypeFlags(isAction, isEnum, isListWrapper, elementType, lineage, lineage);
    }

    /**
     * Element type of a list wrapper, by naming convention (RatingList -> Rating).
     */
    private String elementType(TypeGraph graph, String typeName) {
        for (String suffix : config.collectionSuffixes()) {
            if (typeName.endsWith(suffix) && typeName.length() > suffix.length()) {
                final String item = typeName.substring(0, typeName.length() - suffix.length());
                if (graph.contains(item)) {
                    return item;
                }
                diagnostics.warn("List type " + typeName + " names unknown element type " + item
                        + ", using " + config.rootType());
                return config.rootType();
            }
        }
        diagnostics.warn("List type " + typeName + " does not have a recognized suffix, using "
                + config.rootType());
        return config.rootType();
    }

    private boolean findCycle(TypeGraph graph,
                              String typeName,
                              String lookFor,
                              Set<String> visited,
                              List<String> path) {
        if (!visited.add(typeName)) {
            return typeName.equals(lookFor);
        }

        for (var e : InheritedProperties.collect(graph, typeName, config).entrySet()) {
            final String target = structTarget(graph, e.getKey(), e.getValue());
            if (target == null) {
                continue;
            }
            path.add(typeName + "." + e.getKey());
            if (findCycle(graph, target, lookFor, visited, path)) {
                return true;
            }
            path.remove(path.size() - 1);
        }
        return false;
    }

    /**
     * Struct type that would be inlined as the value of this property, or null.
     * List wrappers are followed to their element type since they inline it as an array.
     */
    private String structTarget(TypeGraph graph, String propertyName, PropertyDef def) {
        if (config.blockedProperties().contains(propertyName)
                || config.propertyTypeOverrides().containsKey(propertyName)) {
            return null;
        }
        String target = scorer.best(def, graph);
        final Set<String> seen = new HashSet<>();
        while (target != null && seen.add(target)) {
            final TypeNode node = graph.get(target);
            if (node == null) {
                return null;
            }
            if (!node.isListWrapper()) {
                return node.representAsStruct() && !node.isEnum() ? target : null;
            }
            target = node.flags().elementType();
        }
        return null;
    }

    private static void makeNonStruct(Map<String, TypeNode> nodes, String typeName, Set<String> visited) {
        final TypeNode node = nodes.get(typeName);
        if (node == null || !visited.add(typeName)) {
            return;
        }
        if (node.representAsStruct()) {
            nodes.put(typeName, node.withFlags(node.flags().withRepresentAsStruct(false)));
        }
        for (String parent : node.parents()) {
            makeNonStruct(nodes, parent, visited);
        }
    }
}
