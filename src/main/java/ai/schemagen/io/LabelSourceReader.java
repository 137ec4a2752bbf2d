package ai.schemagen.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads external label candidates per property. Both shapes are accepted:
 * {@code {"servesCuisine": {"labels": ["serves cuisine"]}}} and
 * {@code {"servesCuisine": ["serves cuisine"]}}.
 */
public final class LabelSourceReader {

    private final ObjectMapper mapper = new ObjectMapper();

    public Map<String, List<String>> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Label file not found: " + file);
        }
        final JsonNode root = mapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Label file root must be a JSON object: " + file);
        }

        final Map<String, List<String>> out = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            final var e = it.next();
            JsonNode labels = e.getValue();
            if (labels.isObject()) {
                labels = labels.get("labels");
            }
            if (labels == null || !labels.isArray()) {
                throw new IOException("Labels of " + e.getKey() + " must be an array");
            }
            final List<String> list = new ArrayList<>(labels.size());
            for (JsonNode label : labels) {
                if (label.isTextual()) {
                    list.add(label.asText());
                }
            }
            out.put(e.getKey(), list);
        }
        return out;
    }
}
