package com.skypulse.engine.service.matching;

import com.skypulse.engine.config.EngineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Case-insensitive location matching between a deal's city and a
 * subscription's wanted location.
 *
 * A match is an equal name, a name containing the other as whole words
 * ("Paris" vs "Paris CDG", but not "LA" vs "Milan"), or a name from the same
 * configured alias group ("NYC" vs "New York").
 */
@Component
public class LocationMatcher {

    @Autowired
    private EngineProperties properties;

    public boolean matches(String dealCity, String wanted) {
        if (isBlank(dealCity) || isBlank(wanted)) {
            return false;
        }
        String city = normalize(dealCity);
        for (String term : expand(normalize(wanted))) {
            if (city.equals(term) || containsWords(city, term) || containsWords(term, city)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The wanted name plus every member of the alias group it belongs to.
     */
    private Set<String> expand(String wanted) {
        Set<String> terms = new LinkedHashSet<>();
        terms.add(wanted);
        for (Map.Entry<String, List<String>> group : properties.getMatch().getLocationAliases().entrySet()) {
            String key = normalize(group.getKey());
            boolean member = key.equals(wanted)
                    || group.getValue().stream().map(LocationMatcher::normalize).anyMatch(wanted::equals);
            if (member) {
                terms.add(key);
                group.getValue().forEach(alias -> terms.add(normalize(alias)));
            }
        }
        return terms;
    }

    private static boolean containsWords(String text, String words) {
        return (" " + text + " ").contains(" " + words + " ");
    }

    // Lowercase, punctuation folded to single spaces ("Paris-CDG" -> "paris cdg")
    private static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ").trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
