package dev.ebullient.detective;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.ebullient.detective.model.Category;
import dev.ebullient.detective.model.Subject;

class CandidateStoreTest {

    @Test
    void bundledDataset_loads() {
        CandidateStore store = Fixtures.bundledStore();
        assertEquals(72, store.size());
        assertEquals(45, store.all().stream().filter(Subject::fictional).count());
    }

    @Test
    void byName_matchesAliasesIgnoringCase() {
        CandidateStore store = Fixtures.bundledStore();
        assertEquals("Spider-Man", store.byName("peter parker").name());
        assertEquals("Spider-Man", store.byName("SPIDER-MAN").name());
        assertNull(store.byName("Nobody In Particular"));
    }

    @Test
    void missingAttributes_areDerivedFromFacts() {
        CandidateStore store = Fixtures.bundledStore();

        Subject wonderWoman = store.byName("Wonder Woman");
        assertEquals("female", wonderWoman.attribute("gender"));

        Subject hulk = store.byName("Hulk");
        assertEquals("true", hulk.attribute("has_powers"));

        Subject hanks = store.byName("Tom Hanks");
        assertEquals("male", hanks.attribute("gender"));
        assertEquals("human", hanks.attribute("species"));
        assertEquals("false", hanks.attribute("has_powers"));
        assertEquals("true", hanks.attribute("alive"));
        assertEquals("false", hanks.attribute("fictional"));
        assertEquals("actors", hanks.attribute("category"));

        Subject einstein = store.byName("Albert Einstein");
        assertEquals("false", einstein.attribute("alive"));
    }

    @Test
    void datasetAttributes_winOverDerivation() {
        CandidateStore store = Fixtures.store(
                Fixtures.entry("Quiet Villain", "superheroes", true, Map.of("alignment", "Hero"),
                        "A notorious villain of the city."));

        Subject subject = store.byName("Quiet Villain");
        assertEquals("hero", subject.attribute("alignment"));
        assertEquals("comic_book", subject.attribute("origin_medium"));
        assertEquals(Category.SUPERHEROES, subject.category());
    }

    @Test
    void invalidNames_areSkipped() {
        CandidateStore store = Fixtures.store(
                Fixtures.entry("Mercury (disambiguation)", "other", false, Map.of()),
                Fixtures.entry("1999", "other", false, Map.of()),
                Fixtures.entry("Freddie Mercury", "musicians", false, Map.of()));

        assertEquals(1, store.size());
        assertFalse(CandidateStore.isValidName("List of superheroes"));
        assertFalse(CandidateStore.isValidName("Al"));
        assertTrue(CandidateStore.isValidName("Link"));
    }

    @Test
    void missingFictionalFlag_followsTheCategory() {
        CandidateStore store = Fixtures.store(
                new CandidateStore.Entry("Pixel Knight", "video-games", null, List.of(), Map.of(), List.of()),
                new CandidateStore.Entry("Serena Swift", "athletes", null, List.of(), Map.of(), List.of()));

        assertTrue(store.byName("Pixel Knight").fictional());
        assertEquals("false", store.byName("Serena Swift").attribute("fictional"));
    }

    @Test
    void untaggedSuperhero_hasPowersByCategory() {
        CandidateStore store = Fixtures.store(
                Fixtures.entry("Lasso Lady", "superheroes", true, Map.of(),
                        "She is an amazon princess and a founding member of the league."),
                Fixtures.entry("Armored Genius", "superheroes", true, Map.of("has_powers", "false"),
                        "He builds suits of armor."),
                Fixtures.entry("Quiet Detective", "tv-characters", true, Map.of(),
                        "He solves crimes in London."));

        assertEquals("true", store.byName("Lasso Lady").attribute("has_powers"));
        assertEquals("false", store.byName("Armored Genius").attribute("has_powers"));
        assertEquals("false", store.byName("Quiet Detective").attribute("has_powers"));

        CandidateStore bundled = Fixtures.bundledStore();
        assertEquals("true", bundled.byName("Wonder Woman").attribute("has_powers"));
        assertEquals("false", bundled.byName("Iron Man").attribute("has_powers"));
    }
}
