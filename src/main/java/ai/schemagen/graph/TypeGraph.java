package ai.schemagen.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.schemagen.model.TypeNode;

/**
 * Vocabulary graph: an ordered arena of {@link TypeNode}s keyed by class name.
 * Iteration order is first-declaration order. Instances are immutable.
 */
public final class TypeGraph {

    private final Map<String, TypeNode> nodes;

    public TypeGraph(Map<String, TypeNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public TypeNode get(String name) {
        return nodes.get(name);
    }

    public TypeNode require(String name) {
        final TypeNode node = nodes.get(name);
        if (node == null) {
            throw new IllegalArgumentException("Unknown type: " + name);
        }
        return node;
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public List<String> names() {
        return new ArrayList<>(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Copy of the arena, for phases that derive an updated graph.
     */
    public Map<String, TypeNode> toMap() {
        return new LinkedHashMap<>(nodes);
    }

    /**
     * True iff {@code ancestor} is reachable from {@code typeName} through parent links
     * (a type is not its own subclass). Unknown parents end a branch; parent cycles are tolerated.
     */
    public boolean isSubClass(String typeName, String ancestor) {
        return isSubClass(typeName, ancestor, new HashSet<>());
    }

    private boolean isSubClass(String typeName, String ancestor, Set<String> visited) {
        final TypeNode node = nodes.get(typeName);
        if (node == null || !visited.add(typeName)) {
            return false;
        }
        for (String parent : node.parents()) {
            if (parent.equals(ancestor)) {
                return true;
            }
            if (isSubClass(parent, ancestor, visited)) {
                return true;
            }
        }
        return false;
    }
}
