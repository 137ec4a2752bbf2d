package ai.schemagen.canonical;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class PhrasesTest {

    @Test
    void cleanSplitsIdentifiers() {
        assertEquals("works for", Phrases.clean("worksFor"));
        assertEquals("food establishment", Phrases.clean("FoodEstablishment"));
        assertEquals("content url", Phrases.clean("contentURL"));
        assertEquals("sort", Phrases.clean("_sort"));
        assertEquals("opening hours specification", Phrases.clean("opening_hoursSpecification"));
        assertEquals("gtin13", Phrases.clean("gtin13"));
    }

    @Test
    void pluralizeLastWord() {
        assertEquals("reviews", Phrases.pluralize("review"));
        assertEquals("opening hours", Phrases.pluralize("opening hours"));
        assertEquals("addresses", Phrases.pluralize("address"));
        assertEquals("categories", Phrases.pluralize("category"));
        assertEquals("days", Phrases.pluralize("day"));
        assertEquals("boxes", Phrases.pluralize("box"));
        assertEquals("sales people", Phrases.pluralize("sales person"));
        assertEquals("news", Phrases.pluralize("news"));
    }
}
