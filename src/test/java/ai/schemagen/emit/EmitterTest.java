package ai.schemagen.emit;

import static ai.schemagen.Vocab.cls;
import static ai.schemagen.Vocab.prop;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import ai.schemagen.Diagnostics;
import ai.schemagen.Vocab;
import ai.schemagen.canonical.CanonicalPhraseSynthesizer;
import ai.schemagen.canonical.LexiconPosTagger;
import ai.schemagen.config.ResolverConfig;
import ai.schemagen.graph.TypeGraph;
import ai.schemagen.model.CanonicalRole;
import ai.schemagen.model.ResolvedField;
import ai.schemagen.model.SemanticType;
import ai.schemagen.model.Statement;
import ai.schemagen.model.TypeDefinition;
import ai.schemagen.resolve.PropertyTypeResolver;

public class EmitterTest {

    private static final LexiconPosTagger TAGGER = LexiconPosTagger.withDefaultLexicon();

    private static List<TypeDefinition> restaurants;

    @BeforeAll
    static void emitRestaurants() {
        restaurants = emit(ResolverConfig.defaults(), Vocab.restaurants());
    }

    private static List<TypeDefinition> emit(ResolverConfig config, List<? extends Statement> statements) {
        final TypeGraph graph = Vocab.classified(config, statements);
        final var synthesizer = new CanonicalPhraseSynthesizer(config, TAGGER, Map.of());
        final var resolver = new PropertyTypeResolver(config, synthesizer, Diagnostics.silent());
        return new Emitter(config, resolver, synthesizer).emit(graph);
    }

    private static TypeDefinition definition(String name) {
        for (TypeDefinition def : restaurants) {
            if (def.name().equals(name)) {
                return def;
            }
        }
        return fail("No definition for " + name);
    }

    private static List<String> fieldNames(TypeDefinition def) {
        return def.fields().stream().map(ResolvedField::name).toList();
    }

    @Test
    void emitsEntityTypesParentsFirst() {
        assertEquals(List.of(
                        "Thing", "Intangible", "Enumeration", "Place", "Organization", "LocalBusiness",
                        "FoodEstablishment", "Restaurant", "Person", "CreativeWork", "Review", "Action"),
                restaurants.stream().map(TypeDefinition::name).toList());
    }

    @Test
    void parentsPrecedeSubtypesRegardlessOfDeclarationOrder() {
        final List<TypeDefinition> defs = emit(ResolverConfig.defaults(), List.of(
                cls("Restaurant", "FoodEstablishment"),
                cls("Thing"),
                cls("FoodEstablishment", "Thing")));

        assertEquals(List.of("Thing", "FoodEstablishment", "Restaurant"),
                defs.stream().map(TypeDefinition::name).toList());
        assertEquals(List.of("FoodEstablishment"), defs.get(2).parents());
    }

    @Test
    void everyDefinitionStartsWithUniqueId() {
        for (TypeDefinition def : restaurants) {
            final ResolvedField id = def.fields().get(0);
            assertEquals("id", id.name(), def.name());
            assertEquals(new SemanticType.Entity("org.schema:" + def.name()), id.type());
            assertTrue(id.unique());
            assertFalse(id.filterable());
            assertTrue(id.canonical().isEmpty());
        }
    }

    @Test
    void everyTypeButRootGetsItsOwnName() {
        final TypeDefinition thing = definition("Thing");
        assertEquals(List.of("id", "name", "description", "url"), fieldNames(thing));
        assertEquals(List.of("called"), thing.field("name").canonical().get(CanonicalRole.PASSIVE_VERB));

        final TypeDefinition restaurant = definition("Restaurant");
        assertEquals(List.of("id", "name"), fieldNames(restaurant));
        final ResolvedField name = restaurant.field("name");
        assertEquals(SemanticType.STRING, name.type());
        assertEquals("Text", name.sourceType());
        assertFalse(name.filterable());
        assertTrue(name.canonical().isEmpty());
    }

    @Test
    void ownPropertiesFollowInDeclarationOrder() {
        assertEquals(List.of("id", "name", "address", "geo", "aggregateRating", "openingHoursSpecification", "review"),
                fieldNames(definition("Place")));
        assertEquals(List.of("id", "name", "servesCuisine", "acceptsReservations"),
                fieldNames(definition("FoodEstablishment")));
    }

    @Test
    void fieldTypesAndCanonicals() {
        final TypeDefinition place = definition("Place");
        assertEquals(SemanticType.LOCATION, place.field("geo").type());
        assertEquals(new SemanticType.ArrayOf(new SemanticType.Entity("org.schema:Review")),
                place.field("review").type());

        final SemanticType.Compound hours = assertInstanceOf(SemanticType.Compound.class,
                place.field("openingHoursSpecification").type());
        assertEquals(new SemanticType.EnumOf(List.of("Monday", "Tuesday")), hours.field("dayOfWeek").type());

        final ResolvedField cuisine = definition("FoodEstablishment").field("servesCuisine");
        assertEquals(List.of("serves # cuisine"), cuisine.canonical().get(CanonicalRole.VERB));
        assertEquals(SemanticType.BOOLEAN, definition("FoodEstablishment").field("acceptsReservations").type());

        final ResolvedField worksFor = definition("Person").field("worksFor");
        assertEquals(new SemanticType.ArrayOf(new SemanticType.Entity("org.schema:Organization")), worksFor.type());
        assertTrue(worksFor.filterable());
    }

    @Test
    void definitionCanonicalIsCleanedTypeName() {
        final TypeDefinition food = definition("FoodEstablishment");

        assertEquals("food establishment", food.canonical());
        assertEquals("food establishment", food.confirmation());
        assertEquals(List.of("LocalBusiness"), food.parents());
    }

    @Test
    void stringValueDatasets() {
        final TypeDefinition restaurant = definition("Restaurant");
        assertEquals("com.yelp:restaurant_names", restaurant.field("id").stringValues());
        assertEquals("com.yelp:restaurant_names", restaurant.field("name").stringValues());

        final TypeDefinition person = definition("Person");
        assertEquals("tt:person_full_name", person.field("name").stringValues());
        assertEquals("tt:company_name", person.field("worksFor").stringValues());

        final TypeDefinition thing = definition("Thing");
        assertNull(thing.field("id").stringValues());
        assertEquals("org.schema:Thing_name", thing.field("name").stringValues());
        assertNull(thing.field("url").stringValues());

        final ResolvedField cuisine = definition("FoodEstablishment").field("servesCuisine");
        assertEquals("org.schema:FoodEstablishment_servesCuisine", cuisine.stringValues());

        final SemanticType.Compound address = (SemanticType.Compound) definition("Place").field("address").type();
        assertEquals("org.schema:Place_address_postalCode", address.field("postalCode").stringValues());
        assertNull(definition("Place").field("review").stringValues());
    }

    @Test
    void addressPartsAreDroppedNextToGeo() {
        final SemanticType.Compound placeAddress =
                (SemanticType.Compound) definition("Place").field("address").type();
        assertTrue(placeAddress.field("streetAddress").drop());
        assertFalse(placeAddress.field("streetAddress").filterable());
        assertTrue(placeAddress.field("addressLocality").drop());
        assertFalse(placeAddress.field("postalCode").drop());
        assertTrue(placeAddress.field("postalCode").filterable());

        // Organization has no geo property
        final SemanticType.Compound orgAddress =
                (SemanticType.Compound) definition("Organization").field("address").type();
        assertFalse(orgAddress.field("streetAddress").drop());
        assertTrue(orgAddress.field("streetAddress").filterable());
    }

    @Test
    void reservedNamesArePrefixed() {
        final ResolverConfig config = ResolverConfig.defaults().toBuilder()
                .reservedWords(Set.of("sort", "Event"))
                .build();

        final List<TypeDefinition> defs = emit(config, List.of(
                cls("Thing"),
                prop("sort", "Thing", "Text"),
                cls("Event", "Thing")));

        final TypeDefinition thing = defs.get(0);
        final ResolvedField sort = thing.field("_sort");
        assertNotNull(sort);
        assertNull(thing.field("sort"));
        assertEquals("org.schema:Thing__sort", sort.stringValues());
        assertFalse(sort.canonical().isEmpty());

        final TypeDefinition event = defs.get(1);
        assertEquals("_Event", event.name());
        assertEquals("event", event.canonical());
    }
}
