package ai.schemagen;

import static ai.schemagen.Vocab.cls;
import static ai.schemagen.Vocab.prop;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ai.schemagen.canonical.LexiconPosTagger;
import ai.schemagen.config.ResolverConfig;
import ai.schemagen.model.CanonicalRole;
import ai.schemagen.model.ResolvedField;
import ai.schemagen.model.SemanticType;
import ai.schemagen.model.TypeDefinition;

public class SchemaPipelineTest {

    private static SchemaPipeline pipeline(Diagnostics diagnostics) {
        return new SchemaPipeline(ResolverConfig.defaults(), LexiconPosTagger.withDefaultLexicon(), Map.of(),
                diagnostics);
    }

    @Test
    void identicalInputGivesIdenticalOutput() {
        final SchemaPipeline.Result first = pipeline(Diagnostics.silent()).run(Vocab.restaurants());
        final SchemaPipeline.Result second = pipeline(Diagnostics.silent()).run(Vocab.restaurants());

        assertEquals(first.definitions(), second.definitions());
        assertEquals(first.graph().names(), second.graph().names());
        assertEquals(12, first.definitions().size());
    }

    @Test
    void cyclicStructsEndUpAsEntityReference() {
        final Diagnostics diagnostics = Diagnostics.silent();
        final SchemaPipeline.Result result = pipeline(diagnostics).run(List.of(
                cls("Thing"),
                cls("StructuredValue", "Thing"),
                cls("A", "StructuredValue"),
                cls("B", "StructuredValue"),
                prop("b", "A", "B"),
                prop("a", "B", "A"),
                cls("Holder", "Thing"),
                prop("holds", "Holder", "B")));

        final TypeDefinition holder = result.definitions().stream()
                .filter(d -> d.name().equals("Holder"))
                .findFirst()
                .orElseThrow();
        final SemanticType.Compound b = assertInstanceOf(SemanticType.Compound.class, holder.field("holds").type());
        final ResolvedField a = b.field("a");
        assertEquals(new SemanticType.Entity("org.schema:A"), a.type());

        // A and its now non-struct ancestor are emitted as entity types, B only appears inline
        final List<String> emitted = result.definitions().stream().map(TypeDefinition::name).toList();
        assertTrue(emitted.contains("A"));
        assertTrue(emitted.contains("StructuredValue"));
        assertFalse(emitted.contains("B"));
        assertEquals(1, diagnostics.warningCount());
    }

    @Test
    void externalLabelsFlowIntoDefinitions() {
        final SchemaPipeline labelled = new SchemaPipeline(ResolverConfig.defaults(),
                LexiconPosTagger.withDefaultLexicon(),
                Map.of("servesCuisine", List.of("cuisine type")),
                Diagnostics.silent());

        final TypeDefinition food = labelled.run(Vocab.restaurants()).definitions().stream()
                .filter(d -> d.name().equals("FoodEstablishment"))
                .findFirst()
                .orElseThrow();

        assertEquals(List.of("cuisine type"), food.field("servesCuisine").canonical().get(CanonicalRole.BASE));
        assertFalse(food.field("servesCuisine").canonical().has(CanonicalRole.VERB));
    }

    @Test
    void inheritedEnumInStructLineageIsReferenced() {
        final SchemaPipeline.Result result = pipeline(Diagnostics.silent()).run(List.of(
                cls("Thing"),
                cls("Enumeration", "Thing"),
                cls("StructuredValue", "Thing"),
                cls("Grade", "Enumeration", "StructuredValue"),
                cls("Holder", "Thing"),
                prop("grade", "Holder", "Grade")));

        final TypeDefinition holder = result.definitions().stream()
                .filter(d -> d.name().equals("Holder"))
                .findFirst()
                .orElseThrow();
        assertEquals(new SemanticType.Entity("org.schema:Grade"), holder.field("grade").type());
        assertFalse(result.definitions().stream().anyMatch(d -> d.name().equals("Grade")));
    }
}
