package com.ragdocs.gateway.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntUnaryOperator;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * User-facing text for gated results: an apology message and a few reworded queries to try instead.
 */
@Component
public class FallbackResponder {
    private static final int MAX_SUGGESTIONS = 5;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> TEMPLATES = List.of(
        "I couldn't find specific information about \"%s\" in the documentation. Please try rephrasing your question or check if the information exists in the documentation.",
        "The query \"%s\" didn't return any relevant results. Consider trying alternative terms or checking the documentation directly.",
        "No relevant documentation was found for your query: \"%s\". Try breaking down your question into simpler terms."
    );

    private final IntUnaryOperator indexSource;

    public FallbackResponder() {
        this(bound -> ThreadLocalRandom.current().nextInt(bound));
    }

    /**
     * @param indexSource maps a bound {@code n} to an index in {@code [0, n)}
     */
    public FallbackResponder(IntUnaryOperator indexSource) {
        this.indexSource = indexSource;
    }

    public String message(String query) {
        int index = Math.floorMod(indexSource.applyAsInt(TEMPLATES.size()), TEMPLATES.size());
        return String.format(TEMPLATES.get(index), query);
    }

    public List<String> suggestions(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String lower = query.toLowerCase(Locale.ROOT);
        String[] terms = WHITESPACE.split(lower.trim());
        Set<String> suggestions = new LinkedHashSet<>();

        for (int skip = 0; skip < terms.length; skip++) {
            List<String> kept = new ArrayList<>(terms.length);
            for (int i = 0; i < terms.length; i++) {
                if (i != skip) {
                    kept.add(terms[i]);
                }
            }
            String suggestion = String.join(" ", kept);
            if (!suggestion.isEmpty() && !suggestion.equals(lower)) {
                suggestions.add(suggestion);
            }
        }
        suggestions.add("how to " + query);
        suggestions.add("what is " + query);
        suggestions.add("configure " + query);

        List<String> limited = new ArrayList<>(suggestions);
        return limited.subList(0, Math.min(MAX_SUGGESTIONS, limited.size()));
    }
}
