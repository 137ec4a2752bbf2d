package ai.schemagen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import ai.schemagen.canonical.LexiconPosTagger;
import ai.schemagen.config.ConfigLoader;
import ai.schemagen.config.ResolverConfig;
import ai.schemagen.io.DefinitionWriter;
import ai.schemagen.io.LabelSourceReader;
import ai.schemagen.io.StatementReader;
import ai.schemagen.model.Statement;

public final class Main {

    private static final String DEFAULT_CLASS_NAME = "org.schema";

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path statementFile = null;
        Path outDir = null;
        Path configFile = null;
        Path labelFile = null;
        Boolean manual = null;
        Boolean alwaysBaseCanonical = null;
        String className = null;
        List<String> whitelist = List.of();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--config=")) {
                    configFile = Paths.get(arg.substring("--config=".length()));
                    continue;
                }
                if (arg.startsWith("--labels=")) {
                    labelFile = Paths.get(arg.substring("--labels=".length()));
                    continue;
                }
                if ("--manual".equals(arg)) {
                    manual = true;
                    continue;
                }
                if ("--no-always-base-canonical".equals(arg)) {
                    alwaysBaseCanonical = false;
                    continue;
                }
                if (arg.startsWith("--class-name=")) {
                    className = arg.substring("--class-name=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--white-list=")) {
                    whitelist = Arrays.stream(arg.substring("--white-list=".length()).split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .collect(Collectors.toList());
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (statementFile == null) {
                    statementFile = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (statementFile == null) {
                System.err.println("ERROR: missing statement file");
                printUsage();
                return 2;
            }
            statementFile = statementFile.toAbsolutePath().normalize();
            if (outDir == null) {
                outDir = statementFile.getParent().resolve("schema-out");
            }
            Files.createDirectories(outDir);

            ResolverConfig config = ResolverConfig.defaults();
            if (configFile != null) {
                config = new ConfigLoader().load(configFile, config);
            }
            final ResolverConfig.Builder b = config.toBuilder();
            if (manual != null) {
                b.manual(manual);
            }
            if (alwaysBaseCanonical != null) {
                b.alwaysBaseCanonical(alwaysBaseCanonical);
            }
            if (className != null && !className.isEmpty()) {
                b.classPrefix(className + ":");
            } else {
                className = prefixToClassName(config.classPrefix());
            }
            config = b.build();

            final Map<String, List<String>> labels = labelFile != null
                    ? new LabelSourceReader().read(labelFile)
                    : Map.of();
            final List<Statement> statements = new StatementReader().read(statementFile);

            final Diagnostics diagnostics = new Diagnostics();
            final var pipeline = new SchemaPipeline(config, LexiconPosTagger.withDefaultLexicon(), labels, diagnostics);
            final SchemaPipeline.Result result = pipeline.run(statements);

            final DefinitionWriter writer = new DefinitionWriter(outDir);
            writer.writeAll(result.definitions(),
                    new DefinitionWriter.RunInfo(className, whitelist, result.graph().size(), diagnostics.warnings()),
                    Instant.now().toString());

            System.out.println("Definitions written to: " + outDir);
            System.out.println("Schema: " + DefinitionWriter.SCHEMA_VERSION);
            System.out.println("Types: " + result.graph().size()
                    + ", definitions: " + result.definitions().size());
            if (diagnostics.warningCount() > 0) {
                System.err.println("WARN: warnings: " + diagnostics.warningCount());
            }
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to resolve schema: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static String prefixToClassName(String prefix) {
        if (prefix.endsWith(":")) {
            return prefix.substring(0, prefix.length() - 1);
        }
        return prefix.isEmpty() ? DEFAULT_CLASS_NAME : prefix;
    }

    private static void printUsage() {
        System.out.println("Usage: ai-schemagen <statements.json> [options]");
        System.out.println("Options:");
        System.out.println("  --outDir=<path>               Output directory (default: <statements dir>/schema-out)");
        System.out.println("  --config=<path>               JSON config merged over the built-in tables");
        System.out.println("  --labels=<path>               JSON label source (property -> candidate phrases)");
        System.out.println("  --manual                      Apply the manual canonical overrides");
        System.out.println("  --no-always-base-canonical    Do not fall back to the identifier as base phrase");
        System.out.println("  --class-name=<name>           Class name, also the entity prefix (default: org.schema)");
        System.out.println("  --white-list=<t1,t2>          Types recorded as the class whitelist");
        System.out.println("  --help, -h                    Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
