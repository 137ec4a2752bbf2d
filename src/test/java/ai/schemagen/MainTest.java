package ai.schemagen;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.schemagen.io.DefinitionWriter;

public class MainTest {

    private static Path copyFixture(Path dir) throws IOException {
        final Path file = dir.resolve("statements.json");
        try (InputStream in = MainTest.class.getResourceAsStream(Vocab.RESTAURANTS)) {
            assertNotNull(in);
            Files.copy(in, file);
        }
        return file;
    }

    @Test
    void writesDefinitionsAndIndex(@TempDir Path dir) throws IOException {
        final Path statements = copyFixture(dir);
        final Path out = dir.resolve("out");

        final int code = Main.run(new String[]{
                statements.toString(), "--outDir=" + out, "--white-list=Restaurant, Person", "--manual"});

        assertEquals(0, code);
        assertTrue(Files.isRegularFile(out.resolve(DefinitionWriter.DEFINITIONS_FILE)));
        final JsonNode index = new ObjectMapper().readTree(out.resolve(DefinitionWriter.INDEX_FILE).toFile());
        assertEquals("org.schema", index.get("className").asText());
        assertEquals("Person", index.get("whitelist").get(1).asText());
        assertEquals(12, index.get("summary").get("totalDefinitions").asInt());
    }

    @Test
    void classNameChangesEntityPrefix(@TempDir Path dir) throws IOException {
        final Path statements = copyFixture(dir);
        final Path out = dir.resolve("out");

        assertEquals(0, Main.run(new String[]{statements.toString(), "--outDir=" + out, "--class-name=com.example"}));

        final String first = Files.readAllLines(out.resolve(DefinitionWriter.DEFINITIONS_FILE),
                StandardCharsets.UTF_8).get(0);
        assertTrue(first.contains("Entity(com.example:Thing)"), first);
    }

    @Test
    void appliesConfigFile(@TempDir Path dir) throws IOException {
        final Path statements = copyFixture(dir);
        final Path config = dir.resolve("config.json");
        Files.writeString(config, "{\"blockedClasses\": [\"Person\"]}", StandardCharsets.UTF_8);
        final Path out = dir.resolve("out");

        assertEquals(0, Main.run(new String[]{statements.toString(), "--outDir=" + out, "--config=" + config}));

        final JsonNode index = new ObjectMapper().readTree(out.resolve(DefinitionWriter.INDEX_FILE).toFile());
        assertEquals(11, index.get("summary").get("totalDefinitions").asInt());
    }

    @Test
    void badArgumentsAndMissingFiles(@TempDir Path dir) {
        assertEquals(2, Main.run(new String[]{"--bogus"}));
        assertEquals(2, Main.run(new String[]{}));
        assertEquals(2, Main.run(new String[]{"a.json", "b.json"}));
        assertEquals(2, Main.run(new String[]{dir.resolve("missing.json").toString(), "--outDir=" + dir}));
        assertEquals(0, Main.run(new String[]{"--help"}));
    }

    @Test
    void malformedStatementsFailTheRun(@TempDir Path dir) throws IOException {
        final Path statements = dir.resolve("bad.json");
        Files.writeString(statements, "{\"statements\": [{\"kind\": \"rule\", \"name\": \"x\"}]}",
                StandardCharsets.UTF_8);

        assertEquals(1, Main.run(new String[]{statements.toString(), "--outDir=" + dir.resolve("out")}));
    }
}
