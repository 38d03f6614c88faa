package dev.ebullient.detective;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.detective.model.Trait;

class TopicTrackerTest {

    TopicTracker topics;

    @BeforeEach
    void setUp() {
        topics = Fixtures.topics(Fixtures.bundledStore());
    }

    @Test
    void contentWords_foldSynonymsAndDropStopWords() {
        assertEquals(Set.of("hero"), topics.contentWords("Is your character a superhero?"));
        assertEquals(Set.of("powers"), topics.contentWords("Does your character have superpowers?"));
    }

    @Test
    void redundant_lexicalOverlap() {
        assertTrue(topics.isRedundant("Does your character have superpowers?",
                List.of("Does your character have special powers?"), Set.of()));
        assertTrue(topics.isRedundant("Is your character a male superhero?",
                List.of("Is your character a male hero in comics?"), Set.of()));
        assertFalse(topics.isRedundant("Is your character a villain?",
                List.of("Is your character male?"), Set.of()));
    }

    @Test
    void redundant_confirmedKeyVocabulary() {
        assertTrue(topics.isRedundant("Is your character a woman?", List.of(), Set.of("gender")));
        assertFalse(topics.isRedundant("Is your character a woman?", List.of(), Set.of()));
    }

    @Test
    void redundant_realmNeedsMoreSpecificQuestion() {
        List<String> asked = List.of("Does your character have distinctive hair?");
        assertFalse(topics.isRedundant("Does your character have long hair?", asked, Set.of()));
        assertTrue(topics.isRedundant("Does your character have a hairstyle?", asked, Set.of()));

        List<String> deeper = List.of("Does your character have distinctive hair?",
                "Does your character have long hair?");
        assertFalse(topics.isRedundant("Does your character have blonde hair?", deeper, Set.of()));
    }

    @Test
    void forbiddenPhrasing() {
        assertTrue(topics.isForbiddenPhrasing("Does your character have a background in science?"));
        assertTrue(topics.isForbiddenPhrasing("Did your character work as a teacher?"));
        assertTrue(topics.isRedundant("Did your character work as a teacher?", List.of(), Set.of()));
        assertFalse(topics.isForbiddenPhrasing("Is your character a teacher?"));
    }

    @Test
    void conflicts_withLedger() {
        List<Trait> real = List.of(new Trait("fictional", "false", 0.9, 1));
        assertTrue(topics.conflictsWithTraits("Does your character use magic?", real, 5, 20));

        List<Trait> human = List.of(new Trait("species", "human", 0.9, 1));
        assertTrue(topics.conflictsWithTraits("Does your character have wings?", human, 5, 20));

        List<Trait> alive = List.of(new Trait("alive", "true", 0.9, 1));
        assertTrue(topics.conflictsWithTraits("Has your character died?", alive, 5, 20));

        List<Trait> notMarvel = List.of(Trait.negated("publisher", "marvel", 0.9, 1));
        assertTrue(topics.conflictsWithTraits("Is your character published by Marvel?", notMarvel, 5, 20));

        List<Trait> american = List.of(new Trait("nationality", "american", 0.9, 1));
        assertTrue(topics.conflictsWithTraits("Is your character British?", american, 5, 20));

        assertFalse(topics.conflictsWithTraits("Is your character British?", List.of(), 5, 20));
    }

    @Test
    void conflicts_obscureAwardsWaitForLateGame() {
        assertTrue(topics.conflictsWithTraits("Has your character won a Grammy?", List.of(), 3, 40));
        assertFalse(topics.conflictsWithTraits("Has your character won a Grammy?", List.of(), 15, 40));
        assertFalse(topics.conflictsWithTraits("Has your character won a Grammy?", List.of(), 3, 8));
    }

    @Test
    void normalize_spotsRephrasedDuplicates() {
        assertEquals(topics.normalize("Has your character won an Academy Award?"),
                topics.normalize("Has your character won an Oscar?"));
        assertTrue(topics.isDuplicate("has your character won an oscar",
                List.of("Has your character won an Academy Award?")));
        assertFalse(topics.isDuplicate("Is your character male?", List.of("Is your character female?")));
    }

    @Test
    void extractName_distinguishesNamesFromTraits() {
        assertEquals("Spider-Man", topics.extractName("Is your character Spider-Man?"));
        assertEquals("Spider-Man", topics.extractName("Is your character Peter Parker?"));
        assertEquals("Sherlock Holmes", topics.extractName("Is your character Sherlock Holmes?"));
        assertNull(topics.extractName("Is your character American?"));
        assertNull(topics.extractName("Is your character Canadian?"));
        assertNull(topics.extractName("Is your character French?"));
        assertNull(topics.extractName("Is your character German?"));
        assertNull(topics.extractName("Is your character Australian?"));
        assertNull(topics.extractName("Is your character Argentinian?"));
        assertFalse(topics.isNameQuestion("Is your character Canadian?"));
        assertNull(topics.extractName("Is your character a superhero?"));
        assertNull(topics.extractName("Is your character an animal?"));
        assertNull(topics.extractName("Does your character wear a cape?"));
    }
}
