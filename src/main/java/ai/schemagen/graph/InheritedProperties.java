package ai.schemagen.graph;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import ai.schemagen.config.ResolverConfig;
import ai.schemagen.model.PropertyDef;
import ai.schemagen.model.TypeNode;

/**
 * Collects the property set of a struct type, own properties first, then inherited ones.
 * <p>
 * A property already seen on a more specific type is never replaced. The walk skips
 * ancestors outside the struct lineage and stops at struct roots, so root (Thing) properties
 * are left out unless the starting type is listed in structIncludeRootProperties.
 */
public final class InheritedProperties {

    private InheritedProperties() {
    }

    public static Map<String, PropertyDef> collect(TypeGraph graph, String typeName, ResolverConfig config) {
        final Map<String, PropertyDef> out = new LinkedHashMap<>();
        final boolean includeRoot = config.structIncludeRootProperties().contains(typeName);
        collect(graph, typeName, config, includeRoot, out, new HashSet<>());
        return out;
    }

    private static void collect(TypeGraph graph,
                                String typeName,
                                ResolverConfig config,
                                boolean includeRoot,
                                Map<String, PropertyDef> out,
                                Set<String> visited) {
        final TypeNode node = graph.get(typeName);
        if (node == null || !visited.add(typeName)) {
            return;
        }
        // a type deriving from both a struct and a non-struct only takes the struct side
        if (!includeRoot && !node.isStructLineage()) {
            return;
        }
        for (var e : node.properties().entrySet()) {
            out.putIfAbsent(e.getKey(), e.getValue());
        }
        if (!includeRoot && config.isStructRoot(typeName)) {
            return;
        }
        for (String parent : node.parents()) {
            collect(graph, parent, config, includeRoot, out, visited);
        }
    }
}
