package ai.schemagen;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import ai.schemagen.canonical.PosTagger;
import ai.schemagen.config.ResolverConfig;
import ai.schemagen.graph.GraphBuilder;
import ai.schemagen.graph.TypeClassifier;
import ai.schemagen.graph.TypeGraph;
import ai.schemagen.io.StatementReader;
import ai.schemagen.model.Statement;

/**
 * Statement and graph fixtures shared by the tests.
 */
public final class Vocab {

    public static final String RESTAURANTS = "/vocab/restaurants.json";

    private Vocab() {
    }

    public static List<Statement> restaurants() {
        try (InputStream in = Vocab.class.getResourceAsStream(RESTAURANTS)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + RESTAURANTS);
            }
            return new StatementReader().read(in);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static Statement.ClassStatement cls(String name, String... parents) {
        return new Statement.ClassStatement(name, Arrays.asList(parents), null);
    }

    public static Statement.PropertyStatement prop(String name, String domain, String... ranges) {
        return new Statement.PropertyStatement(name, List.of(domain), Arrays.asList(ranges), null, null);
    }

    public static Statement.PropertyStatement described(String name, String domain, String range, String comment) {
        return new Statement.PropertyStatement(name, List.of(domain), List.of(range), comment, null);
    }

    public static TypeGraph classified(ResolverConfig config, List<? extends Statement> statements) {
        return classified(config, statements, Diagnostics.silent());
    }

    public static TypeGraph classified(ResolverConfig config,
                                       List<? extends Statement> statements,
                                       Diagnostics diagnostics) {
        final TypeGraph raw = new GraphBuilder(config).build(statements);
        return new TypeClassifier(config, diagnostics).classify(raw);
    }

    /**
     * Tagger answering from a fixed word table, NN for anything else.
     */
    public static PosTagger stubTagger(Map<String, String> tags) {
        return tokens -> tokens.stream()
                .map(t -> tags.getOrDefault(t, "NN"))
                .collect(Collectors.toList());
    }
}
