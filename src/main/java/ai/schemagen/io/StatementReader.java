package ai.schemagen.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.schemagen.model.MalformedStatementException;
import ai.schemagen.model.Statement;

/**
 * Reads the neutral statement document:
 * <pre>
 * {"statements": [
 *   {"kind": "class", "name": "Restaurant", "parents": ["FoodEstablishment"], "comment": "..."},
 *   {"kind": "property", "name": "servesCuisine", "domains": ["Restaurant"], "ranges": ["Text"]},
 *   {"kind": "instance", "name": "Monday", "type": "DayOfWeek"}
 * ]}
 * </pre>
 * Statements with an unknown kind or without a required field fail the whole read.
 */
public final class StatementReader {

    private final ObjectMapper mapper = new ObjectMapper();

    public List<Statement> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Statement file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public List<Statement> read(InputStream in) throws IOException {
        final JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new MalformedStatementException("Statement document must be a JSON object");
        }
        final JsonNode array = root.get("statements");
        if (array == null || !array.isArray()) {
            throw new MalformedStatementException("Statement document needs a \"statements\" array");
        }

        final List<Statement> out = new ArrayList<>(array.size());
        int index = 0;
        for (JsonNode node : array) {
            out.add(toStatement(node, index++));
        }
        return out;
    }

    private static Statement toStatement(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new MalformedStatementException("Statement #" + index + " is not an object");
        }
        final String kind = text(node, "kind", index, true);
        final String name = text(node, "name", index, true);
        return switch (kind) {
            case "class" -> new Statement.ClassStatement(
                    name,
                    strings(node, "parents", index, false),
                    text(node, "comment", index, false));
            case "property" -> new Statement.PropertyStatement(
                    name,
                    strings(node, "domains", index, true),
                    strings(node, "ranges", index, true),
                    text(node, "comment", index, false),
                    text(node, "supersededBy", index, false));
            case "instance" -> new Statement.InstanceStatement(name, text(node, "type", index, true));
            default -> throw new MalformedStatementException(
                    "Statement #" + index + " (" + name + ") has unknown kind: " + kind);
        };
    }

    private static String text(JsonNode node, String field, int index, boolean required) {
        final JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            if (required) {
                throw new MalformedStatementException("Statement #" + index + " is missing \"" + field + "\"");
            }
            return null;
        }
        if (!v.isTextual()) {
            throw new MalformedStatementException("Statement #" + index + ": \"" + field + "\" must be a string");
        }
        return v.asText();
    }

    private static List<String> strings(JsonNode node, String field, int index, boolean required) {
        final JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            if (required) {
                throw new MalformedStatementException("Statement #" + index + " is missing \"" + field + "\"");
            }
            return List.of();
        }
        if (!v.isArray()) {
            throw new MalformedStatementException("Statement #" + index + ": \"" + field + "\" must be an array");
        }
        final List<String> out = new ArrayList<>(v.size());
        for (JsonNode item : v) {
            if (!item.isTextual()) {
                throw new MalformedStatementException(
                        "Statement #" + index + ": \"" + field + "\" must contain only strings");
            }
            out.add(item.asText());
        }
        return out;
    }
}
