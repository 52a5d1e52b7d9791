package com.roboticsradar.pipeline.service.extract;

import com.roboticsradar.pipeline.TestFixtures;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.RejectionReason;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RelevanceGateTest {
    private final KeywordExtractor extractor = new KeywordExtractor(TestFixtures.properties());
    private final RelevanceGate gate = new RelevanceGate(TestFixtures.properties());

    private RelevanceVerdict evaluate(Item item) {
        return gate.evaluate(item, extractor.extract(item.getText()));
    }

    @Test
    public void inclusionKeywordMakesItemRelevant() {
        Item item = TestFixtures.item("1", "Warehouse robot fleet doubles", "Operators added another 500 units.", "https://example.com/1");
        RelevanceVerdict v = evaluate(item);
        assertTrue(v.isRelevant());
        assertEquals("robot", v.getMatchedTerm());
    }

    @Test
    public void exclusionWinsOverInclusion() {
        Item item = TestFixtures.item("2", "Humanoid robot startup is hiring engineers", "Apply now for the role.", "https://example.com/2");
        RelevanceVerdict v = evaluate(item);
        assertFalse(v.isRelevant());
        assertEquals(RejectionReason.EXCLUDED, v.getReason());
        assertEquals("hiring", v.getMatchedTerm());
    }

    @Test
    public void unrelatedContentIsNotRelevant() {
        Item item = TestFixtures.item("3", "Best pasta recipes of the week", "Quick dinners for busy people.", "https://example.com/3");
        assertEquals(RejectionReason.NOT_RELEVANT, evaluate(item).getReason());
    }

    @Test
    public void topicMatchAloneIsEnough() {
        Item item = TestFixtures.item("4", "New bipedal walking demo from the lab", "Watch it climb stairs.", "https://example.com/4");
        RelevanceVerdict v = evaluate(item);
        assertTrue(v.isRelevant());
        assertEquals("humanoids", v.getMatchedTerm());
    }

    @Test
    public void keywordsInsideOtherWordsDoNotCount() {
        Item item = TestFixtures.item("5", "Robotaxi prices rise", "Rides across town cost more now.", "https://example.com/5");
        assertEquals(RejectionReason.NOT_RELEVANT, evaluate(item).getReason());
    }

    @Test
    public void declaredLanguageMustBeSupported() {
        Item german = TestFixtures.item("6", "Neuer Roboter robot im Labor", "Ein Bericht.", "https://example.com/6");
        german.setLanguage("de");
        assertEquals(RejectionReason.UNSUPPORTED_LANGUAGE, evaluate(german).getReason());

        Item british = TestFixtures.item("7", "Warehouse robot fleet doubles", "Operators added more units.", "https://example.com/7");
        british.setLanguage("en-GB");
        assertTrue(evaluate(british).isRelevant());
    }
}
