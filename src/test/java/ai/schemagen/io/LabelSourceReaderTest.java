package ai.schemagen.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LabelSourceReaderTest {

    private final LabelSourceReader reader = new LabelSourceReader();

    @Test
    void acceptsBothShapes(@TempDir Path dir) throws IOException {
        final Path file = dir.resolve("labels.json");
        Files.writeString(file, "{"
                + "\"servesCuisine\": {\"labels\": [\"cuisine\", \"food type\"]},"
                + "\"worksFor\": [\"employer\"]"
                + "}", StandardCharsets.UTF_8);

        final Map<String, List<String>> labels = reader.read(file);

        assertEquals(List.of("cuisine", "food type"), labels.get("servesCuisine"));
        assertEquals(List.of("employer"), labels.get("worksFor"));
        assertEquals(List.of("servesCuisine", "worksFor"), List.copyOf(labels.keySet()));
    }

    @Test
    void rejectsEntriesWithoutLabelArray(@TempDir Path dir) throws IOException {
        final Path file = dir.resolve("labels.json");
        Files.writeString(file, "{\"servesCuisine\": {\"label\": \"cuisine\"}}", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> reader.read(file));
        assertThrows(IOException.class, () -> reader.read(dir.resolve("missing.json")));
    }
}
