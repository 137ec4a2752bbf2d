package ai.schemagen.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.schemagen.model.CanonicalRecord;
import ai.schemagen.model.CanonicalRole;
import ai.schemagen.model.SemanticType;
import ai.schemagen.model.SemanticTypes;

/**
 * Merges a JSON configuration file over a base {@link ResolverConfig}.
 * <p>
 * List-valued keys replace the base table; object-valued keys (propertyTypes, canonical,
 * manualCanonical, stringValues, builtinTypes) add to or replace individual entries.
 */
public final class ConfigLoader {

    private final ObjectMapper mapper = new ObjectMapper();

    public ResolverConfig load(Path file, ResolverConfig base) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(base, "base");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Config file not found: " + file);
        }
        final JsonNode root = mapper.readTree(file.toFile());
        return merge(root, base);
    }

    public ResolverConfig merge(JsonNode root, ResolverConfig base) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Config root must be a JSON object");
        }
        final ResolverConfig.Builder b = base.toBuilder();

        final Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            final var e = it.next();
            final String key = e.getKey();
            final JsonNode value = e.getValue();
            switch (key) {
                case "blockedClasses" -> b.blockedClasses(stringSet(key, value));
                case "blockedProperties" -> b.blockedProperties(stringSet(key, value));
                case "structRoots" -> b.structRoots(stringList(key, value));
                case "nonStructTypes" -> b.nonStructTypes(stringSet(key, value));
                case "forceArray" -> b.forceArrayProperties(stringSet(key, value));
                case "forceNotArray" -> b.forceNotArrayProperties(stringSet(key, value));
                case "noFilter" -> b.noFilterProperties(stringSet(key, value));
                case "dropWithGeo" -> b.dropWithGeoProperties(stringSet(key, value));
                case "structIncludeRootProperties" -> b.structIncludeRootProperties(stringSet(key, value));
                case "reservedWords" -> b.reservedWords(stringSet(key, value));
                case "collectionSuffixes" -> b.collectionSuffixes(stringList(key, value));
                case "propertyTypes" -> forEachField(key, value, (name, v) ->
                        b.propertyTypeOverride(name, parseType(key, name, v)));
                case "builtinTypes" -> forEachField(key, value, (name, v) ->
                        b.builtinType(name, parseType(key, name, v)));
                case "canonical" -> forEachField(key, value, (name, v) ->
                        b.canonicalOverride(name, parseCanonical(key, name, v)));
                case "manualCanonical" -> forEachField(key, value, (name, v) ->
                        b.manualCanonicalOverride(name, parseCanonical(key, name, v)));
                case "stringValues" -> forEachField(key, value, (name, v) ->
                        b.stringValueOverride(name, requireText(key + "." + name, v)));
                case "classPrefix" -> b.classPrefix(requireText(key, value));
                case "manual" -> b.manual(requireBoolean(key, value));
                case "alwaysBaseCanonical" -> b.alwaysBaseCanonical(requireBoolean(key, value));
                default -> throw new IOException("Unknown config key: " + key);
            }
        }
        return b.build();
    }

    private static Set<String> stringSet(String key, JsonNode value) throws IOException {
        return new LinkedHashSet<>(stringList(key, value));
    }

    private static List<String> stringList(String key, JsonNode value) throws IOException {
        if (!value.isArray()) {
            throw new IOException("Config key " + key + " must be an array of strings");
        }
        final List<String> out = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            out.add(requireText(key, item));
        }
        return out;
    }

    private static String requireText(String key, JsonNode value) throws IOException {
        if (value == null || !value.isTextual()) {
            throw new IOException("Config key " + key + " must be a string");
        }
        return value.asText();
    }

    private static boolean requireBoolean(String key, JsonNode value) throws IOException {
        if (!value.isBoolean()) {
            throw new IOException("Config key " + key + " must be a boolean");
        }
        return value.asBoolean();
    }

    private static SemanticType parseType(String key, String name, JsonNode value)
            throws IOException {
        try {
            return SemanticTypes.parse(requireText(key + "." + name, value));
        } catch (IllegalArgumentException ex) {
            throw new IOException("Config key " + key + "." + name + ": " + ex.getMessage(), ex);
        }
    }

    private static CanonicalRecord parseCanonical(String key, String name, JsonNode value) throws IOException {
        if (!value.isObject()) {
            throw new IOException("Config key " + key + "." + name + " must be an object of role -> phrases");
        }
        final CanonicalRecord.Builder b = CanonicalRecord.builder();
        final Iterator<Map.Entry<String, JsonNode>> it = value.fields();
        while (it.hasNext()) {
            final var e = it.next();
            final CanonicalRole role;
            try {
                role = CanonicalRole.fromKey(e.getKey());
            } catch (IllegalArgumentException ex) {
                throw new IOException("Config key " + key + "." + name + ": " + ex.getMessage(), ex);
            }
            b.addAll(role, stringList(key + "." + name + "." + e.getKey(), e.getValue()));
        }
        return b.build();
    }

    private static void forEachField(String key, JsonNode value, FieldConsumer consumer) throws IOException {
        if (!value.isObject()) {
            throw new IOException("Config key " + key + " must be an object");
        }
        final Iterator<Map.Entry<String, JsonNode>> it = value.fields();
        while (it.hasNext()) {
            final var e = it.next();
            consumer.accept(e.getKey(), e.getValue());
        }
    }

    @FunctionalInterface
    private interface FieldConsumer {
        void accept(String name, JsonNode value) throws IOException;
    }
}
