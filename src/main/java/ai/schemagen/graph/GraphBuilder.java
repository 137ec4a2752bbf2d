package ai.schemagen.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.schemagen.config.ResolverConfig;
import ai.schemagen.model.MalformedStatementException;
import ai.schemagen.model.PropertyDef;
import ai.schemagen.model.Statement;
import ai.schemagen.model.TypeFlags;
import ai.schemagen.model.TypeNode;

/**
 * Builds the unclassified {@link TypeGraph} from raw statements.
 * <p>
 * Builtin scalar types never become nodes, block-listed classes and properties are dropped,
 * deprecated (superseded) properties are ignored and duplicate class declarations are merged.
 */
public final class GraphBuilder {

    private final ResolverConfig config;

    public GraphBuilder(ResolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public TypeGraph build(List<? extends Statement> statements) {
        Objects.requireNonNull(statements, "statements");

        final Map<String, NodeAccumulator> types = new LinkedHashMap<>();
        final Map<String, List<String>> enums = new LinkedHashMap<>();

        for (Statement st : statements) {
            if (st == null) {
                throw new MalformedStatementException("Null statement");
            }
            requireName(st);
            if (config.isBuiltin(st.name()) || config.blockedClasses().contains(st.name())) {
                continue;
            }

            if (st instanceof Statement.InstanceStatement inst) {
                if (inst.type() == null || inst.type().isBlank()) {
                    throw new MalformedStatementException("Instance " + inst.name() + " has no type");
                }
                enums.computeIfAbsent(inst.type(), k -> new ArrayList<>()).add(inst.name());
            } else if (st instanceof Statement.PropertyStatement prop) {
                addProperty(prop, types);
            } else if (st instanceof Statement.ClassStatement cls) {
                addClass(cls, types);
            } else {
                throw new MalformedStatementException("Unsupported statement: " + st.getClass().getSimpleName());
            }
        }

        final Map<String, TypeNode> nodes = new LinkedHashMap<>();
        for (var e : types.entrySet()) {
            final String name = e.getKey();
            final NodeAccumulator acc = e.getValue();
            final List<String> parents = new ArrayList<>(acc.parents);
            if (parents.isEmpty() && !name.equals(config.rootType())) {
                parents.add(config.rootType());
            }
            nodes.put(name, new TypeNode(
                    name,
                    parents,
                    acc.properties,
                    acc.comment,
                    enums.getOrDefault(name, List.of()),
                    TypeFlags.NONE
            ));
        }

        return new TypeGraph(nodes);
    }

    private void addProperty(Statement.PropertyStatement prop, Map<String, NodeAccumulator> types) {
        if (prop.supersededBy() != null && !prop.supersededBy().isBlank()) {
            return;
        }
        if (config.blockedProperties().contains(prop.name())) {
            return;
        }
        final PropertyDef def = new PropertyDef(prop.ranges(), prop.comment());
        for (String domain : prop.domains()) {
            if (config.isBuiltin(domain) || config.blockedClasses().contains(domain)) {
                continue;
            }
            types.computeIfAbsent(domain, k -> new NodeAccumulator()).properties.put(prop.name(), def);
        }
    }

    private void addClass(Statement.ClassStatement cls, Map<String, NodeAccumulator> types) {
        final NodeAccumulator acc = types.computeIfAbsent(cls.name(), k -> new NodeAccumulator());
        for (String parent : cls.parents()) {
            if (!config.blockedClasses().contains(parent)) {
                acc.parents.add(parent);
            }
        }
        if (cls.comment() != null && !cls.comment().isBlank()) {
            acc.comment = cls.comment();
        }
    }

    private static void requireName(Statement st) {
        if (st.name() == null || st.name().isBlank()) {
            throw new MalformedStatementException(
                    st.getClass().getSimpleName() + " without a name");
        }
    }

    private static final class NodeAccumulator {
        final Set<String> parents = new LinkedHashSet<>();
        final Map<String, PropertyDef> properties = new LinkedHashMap<>();
        String comment = "";
    }
}
