package ai.schemagen.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import ai.schemagen.model.CanonicalRole;
import ai.schemagen.model.SemanticType;

public class ConfigLoaderTest {

    private final ConfigLoader loader = new ConfigLoader();
    private final ObjectMapper mapper = new ObjectMapper();

    private ResolverConfig merge(String json) throws IOException {
        return loader.merge(mapper.readTree(json), ResolverConfig.defaults());
    }

    @Test
    void listsReplaceDefaults() throws IOException {
        final ResolverConfig config = merge("{\"blockedProperties\": [\"telephone\"], \"structRoots\": [\"Offer\"]}");

        assertEquals(Set.of("telephone"), config.blockedProperties());
        assertEquals(List.of("Offer"), config.structRoots());
        // untouched tables keep their defaults
        assertTrue(config.forceArrayProperties().contains("worksFor"));
    }

    @Test
    void mapsMergeIntoDefaults() throws IOException {
        final ResolverConfig config = merge("{"
                + "\"propertyTypes\": {\"starRating\": \"Array(Entity(tt:star))\", \"duration\": \"Measure(ms)\"},"
                + "\"canonical\": {\"starRating\": {\"base\": [\"stars\"], \"passive_verb\": [\"rated #\"]}},"
                + "\"stringValues\": {\"org.schema:Hotel_starRating\": \"tt:stars\"}"
                + "}");

        assertEquals(new SemanticType.ArrayOf(new SemanticType.Entity("tt:star")),
                config.propertyTypeOverrides().get("starRating"));
        assertEquals(new SemanticType.Measure("ms"), config.propertyTypeOverrides().get("duration"));
        assertEquals(new SemanticType.Entity("tt:phone_number"), config.propertyTypeOverrides().get("telephone"));

        assertEquals(List.of("stars"), config.canonicalOverrides().get("starRating").get(CanonicalRole.BASE));
        assertEquals(List.of("rated #"), config.canonicalOverrides().get("starRating").get(CanonicalRole.PASSIVE_VERB));
        assertTrue(config.canonicalOverrides().containsKey("url"));

        assertEquals("tt:stars", config.stringValueOverrides().get("org.schema:Hotel_starRating"));
    }

    @Test
    void scalarSwitches() throws IOException {
        final ResolverConfig config = merge(
                "{\"manual\": true, \"alwaysBaseCanonical\": false, \"classPrefix\": \"com.example:\"}");

        assertTrue(config.manual());
        assertFalse(config.alwaysBaseCanonical());
        assertEquals("com.example:", config.classPrefix());
    }

    @Test
    void rejectsUnknownKeysAndBadValues() {
        assertThrows(IOException.class, () -> merge("{\"blockedClass\": []}"));
        assertThrows(IOException.class, () -> merge("{\"blockedClasses\": \"Person\"}"));
        assertThrows(IOException.class, () -> merge("{\"propertyTypes\": {\"x\": \"Vector(3)\"}}"));
        assertThrows(IOException.class, () -> merge("{\"canonical\": {\"x\": {\"noun\": [\"x\"]}}}"));
        assertThrows(IOException.class, () -> merge("{\"manual\": \"yes\"}"));
        assertThrows(IOException.class, () -> merge("[]"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        final Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"noFilter\": [\"name\", \"gtin14\"]}", StandardCharsets.UTF_8);

        final ResolverConfig config = loader.load(file, ResolverConfig.defaults());

        assertEquals(Set.of("name", "gtin14"), config.noFilterProperties());
        assertThrows(IOException.class, () -> loader.load(dir.resolve("missing.json"), ResolverConfig.defaults()));
    }
}
