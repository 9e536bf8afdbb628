package com.skypulse.engine.service.matching;

import com.skypulse.engine.config.EngineProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test
 *
 * Destination/origin matching rules of the scorer
 * RequirementCategorized: Core Requirements (Match Scorer) and location aliases
 */
@ExtendWith(MockitoExtension.class)
class LocationMatcherTest {

    /**
     * -[@Spy]: Real EngineProperties with the default alias groups.
     */
    @Spy
    private EngineProperties properties = new EngineProperties();

    @InjectMocks
    private LocationMatcher locationMatcher;

    /**
     * Input: "Paris" vs "paris"
     * ExpectedOut: Match (case-insensitive)
     */
    @Test
    void testMatches_CaseInsensitive() {
        assertTrue(locationMatcher.matches("Paris", "paris"));
        assertTrue(locationMatcher.matches("PARIS", " Paris "));
    }

    /**
     * Input: Deal city "Paris CDG" vs wanted "Paris", and the reverse
     * ExpectedOut: Match both ways (whole-word containment)
     */
    @Test
    void testMatches_Containment() {
        assertTrue(locationMatcher.matches("Paris CDG", "Paris"));
        assertTrue(locationMatcher.matches("Paris", "Paris-Orly"));
    }

    /**
     * Input: Deal city "Milan" vs wanted "LA"
     * ExpectedOut: No match (substring inside a word does not count)
     */
    @Test
    void testMatches_NoPartialWordMatch() {
        assertFalse(locationMatcher.matches("Milan", "LA"));
        assertFalse(locationMatcher.matches("Parish", "Paris"));
    }

    /**
     * Input: "New York" vs "NYC", "JFK New York City" vs "nyc", "LHR" vs "London"
     * ExpectedOut: Match through the alias groups
     */
    @Test
    void testMatches_Aliases() {
        assertTrue(locationMatcher.matches("New York", "NYC"));
        assertTrue(locationMatcher.matches("NYC", "new york"));
        assertTrue(locationMatcher.matches("JFK New York City", "nyc"));
        assertTrue(locationMatcher.matches("LHR", "London"));
        assertTrue(locationMatcher.matches("Los Angeles", "LA"));
    }

    /**
     * Input: "Berlin" vs "Paris"; null or blank names
     * ExpectedOut: No match
     */
    @Test
    void testMatches_Mismatch() {
        assertFalse(locationMatcher.matches("Berlin", "Paris"));
        assertFalse(locationMatcher.matches(null, "Paris"));
        assertFalse(locationMatcher.matches("Paris", " "));
    }
}
