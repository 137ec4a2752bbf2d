package ai.schemagen.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.schemagen.Vocab;
import ai.schemagen.model.MalformedStatementException;
import ai.schemagen.model.Statement;

public class StatementReaderTest {

    private final StatementReader reader = new StatementReader();

    private List<Statement> read(String json) throws IOException {
        return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void readsAllStatementKinds() throws IOException {
        final List<Statement> statements = read("{\"statements\": ["
                + "{\"kind\": \"class\", \"name\": \"Hotel\", \"parents\": [\"LodgingBusiness\"], \"comment\": \"A hotel.\"},"
                + "{\"kind\": \"property\", \"name\": \"starRating\", \"domains\": [\"Hotel\"], \"ranges\": [\"Rating\"],"
                + " \"supersededBy\": \"rating\"},"
                + "{\"kind\": \"instance\", \"name\": \"Monday\", \"type\": \"DayOfWeek\"}"
                + "]}");

        assertEquals(3, statements.size());
        assertEquals(new Statement.ClassStatement("Hotel", List.of("LodgingBusiness"), "A hotel."), statements.get(0));
        assertEquals(new Statement.PropertyStatement("starRating", List.of("Hotel"), List.of("Rating"), null, "rating"),
                statements.get(1));
        assertEquals(new Statement.InstanceStatement("Monday", "DayOfWeek"), statements.get(2));
    }

    @Test
    void classParentsAreOptional() throws IOException {
        final List<Statement> statements = read("{\"statements\": [{\"kind\": \"class\", \"name\": \"Thing\"}]}");

        assertEquals(List.of(), ((Statement.ClassStatement) statements.get(0)).parents());
    }

    @Test
    void readsFixtureFile() {
        final List<Statement> statements = Vocab.restaurants();

        assertTrue(statements.size() > 40);
        assertInstanceOf(Statement.ClassStatement.class, statements.get(0));
    }

    @Test
    void rejectsMalformedStatements() {
        assertThrows(MalformedStatementException.class,
                () -> read("{\"statements\": [{\"kind\": \"rule\", \"name\": \"x\"}]}"));
        assertThrows(MalformedStatementException.class,
                () -> read("{\"statements\": [{\"kind\": \"class\"}]}"));
        assertThrows(MalformedStatementException.class,
                () -> read("{\"statements\": [{\"kind\": \"property\", \"name\": \"p\", \"domains\": [\"A\"]}]}"));
        assertThrows(MalformedStatementException.class,
                () -> read("{\"statements\": [{\"kind\": \"instance\", \"name\": \"Monday\"}]}"));
        assertThrows(MalformedStatementException.class,
                () -> read("{\"statements\": [{\"kind\": \"class\", \"name\": \"A\", \"parents\": [1]}]}"));
        assertThrows(MalformedStatementException.class, () -> read("{\"classes\": []}"));
    }

    @Test
    void missingFileIsAnIoError(@TempDir Path dir) {
        assertThrows(IOException.class, () -> reader.read(dir.resolve("none.json")));
    }
}
