package ai.schemagen;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.schemagen.canonical.CanonicalPhraseSynthesizer;
import ai.schemagen.canonical.PosTagger;
import ai.schemagen.config.ResolverConfig;
import ai.schemagen.emit.Emitter;
import ai.schemagen.graph.GraphBuilder;
import ai.schemagen.graph.TypeClassifier;
import ai.schemagen.graph.TypeGraph;
import ai.schemagen.model.Statement;
import ai.schemagen.model.TypeDefinition;
import ai.schemagen.resolve.PropertyTypeResolver;

/**
 * Runs the whole resolution: build the graph, classify it, emit definitions.
 */
public final class SchemaPipeline {

    private final ResolverConfig config;
    private final PosTagger tagger;
    private final Map<String, List<String>> labels;
    private final Diagnostics diagnostics;

    public SchemaPipeline(ResolverConfig config,
                          PosTagger tagger,
                          Map<String, List<String>> labels,
                          Diagnostics diagnostics) {
        this.config = Objects.requireNonNull(config, "config");
        this.tagger = Objects.requireNonNull(tagger, "tagger");
        this.labels = Objects.requireNonNull(labels, "labels");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public Result run(List<? extends Statement> statements) {
        final TypeGraph raw = new GraphBuilder(config).build(statements);
        final TypeGraph classified = new TypeClassifier(config, diagnostics).classify(raw);

        final var synthesizer = new CanonicalPhraseSynthesizer(config, tagger, labels);
        final var resolver = new PropertyTypeResolver(config, synthesizer, diagnostics);
        final List<TypeDefinition> definitions = new Emitter(config, resolver, synthesizer).emit(classified);

        return new Result(classified, definitions);
    }

    public record Result(
            TypeGraph graph,
            List<TypeDefinition> definitions
    ) {
        public Result {
            definitions = List.copyOf(definitions);
        }
    }
}
