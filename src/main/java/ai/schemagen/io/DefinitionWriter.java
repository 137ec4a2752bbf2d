package ai.schemagen.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.schemagen.model.CanonicalRecord;
import ai.schemagen.model.ResolvedField;
import ai.schemagen.model.SemanticType;
import ai.schemagen.model.TypeDefinition;

/**
 * Writes the emitted definitions ({@value #DEFINITIONS_FILE}, one definition per line) and a
 * master {@value #INDEX_FILE} describing the run.
 */
public final class DefinitionWriter {

    public static final String SCHEMA_VERSION = "schema-definitions/v1";
    public static final String DEFINITIONS_FILE = "definitions.jsonl";
    public static final String INDEX_FILE = "index.json";

    private final Path outDir;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper jsonlMapper;

    public DefinitionWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonlMapper = new ObjectMapper();
    }

    public void writeAll(List<TypeDefinition> definitions,
                         RunInfo run,
                         String generatedAt) throws IOException {
        Objects.requireNonNull(definitions, "definitions");
        Objects.requireNonNull(run, "run");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);

        int totalFields = 0;
        try (BufferedWriter bw = Files.newBufferedWriter(outDir.resolve(DEFINITIONS_FILE), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (TypeDefinition def : definitions) {
                bw.write(jsonlMapper.writeValueAsString(toJson(def)));
                bw.newLine();
                totalFields += def.fields().size();
            }
        }

        final Summary summary = new Summary(
                run.typeCount(),
                definitions.size(),
                totalFields,
                run.warnings().size(),
                run.warnings()
        );
        final MasterIndex idx = new MasterIndex(
                SCHEMA_VERSION,
                generatedAt,
                run.className(),
                run.whitelist(),
                DEFINITIONS_FILE,
                summary
        );
        jsonMapper.writeValue(outDir.resolve(INDEX_FILE).toFile(), idx);
    }

    ObjectNode toJson(TypeDefinition def) {
        final ObjectNode node = jsonlMapper.createObjectNode();
        node.put("name", def.name());
        final ArrayNode parents = node.putArray("parents");
        def.parents().forEach(parents::add);
        node.put("canonical", def.canonical());
        node.put("confirmation", def.confirmation());
        final ArrayNode fields = node.putArray("fields");
        for (ResolvedField f : def.fields()) {
            fields.add(toJson(f));
        }
        return node;
    }

    private ObjectNode toJson(ResolvedField field) {
        final ObjectNode node = jsonlMapper.createObjectNode();
        node.put("name", field.name());
        node.put("type", field.type().describe());
        if (field.sourceType() != null) {
            node.put("sourceType", field.sourceType());
        }
        node.put("filterable", field.filterable());
        if (field.unique()) {
            node.put("unique", true);
        }
        if (field.drop()) {
            node.put("drop", true);
        }
        if (field.stringValues() != null) {
            node.put("stringValues", field.stringValues());
        }
        node.set("canonical", toJson(field.canonical()));

        if (field.type().elementType() instanceof SemanticType.Compound compound) {
            final ArrayNode inner = node.putArray("fields");
            for (ResolvedField f : compound.fields()) {
                inner.add(toJson(f));
            }
        }
        return node;
    }

    private ObjectNode toJson(CanonicalRecord canonical) {
        final ObjectNode node = jsonlMapper.createObjectNode();
        for (var e : canonical.phrases().entrySet()) {
            final ArrayNode phrases = node.putArray(e.getKey().key());
            e.getValue().forEach(phrases::add);
        }
        return node;
    }

    /**
     * Run facts recorded in the index besides the definitions themselves.
     */
    public record RunInfo(
            String className,
            List<String> whitelist,
            int typeCount,
            List<String> warnings
    ) {
        public RunInfo {
            whitelist = List.copyOf(whitelist);
            warnings = List.copyOf(warnings);
        }
    }

    // --- index records (written as JSON, not JSONL) ---

    public record MasterIndex(
            String schema,
            String generatedAt,
            String className,
            List<String> whitelist,
            String definitions,
            Summary summary
    ) {
    }

    public record Summary(
            int totalTypes,
            int totalDefinitions,
            int totalFields,
            int warnings,
            List<String> warningMessages
    ) {
    }
}
