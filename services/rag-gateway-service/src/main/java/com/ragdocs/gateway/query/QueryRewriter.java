package com.ragdocs.gateway.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Expands a raw query with domain synonyms for technical documentation and measures how complex it is.
 */
@Component
public class QueryRewriter {
    private static final Logger log = LoggerFactory.getLogger(QueryRewriter.class);
    private static final int TOP_K_BUFFER = 2;
    private static final int MAX_TOP_K = 20;
    private static final int COMPLEX_TERM_COUNT = 3;
    private static final int LONG_TERM_LENGTH = 15;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, List<String>> EXPANSIONS = buildExpansions();

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
        "how", "do", "does", "i", "is", "are"
    );

    private static final List<Pattern> TECHNICAL_PATTERNS = List.of(
        Pattern.compile("^[a-z]+[A-Z][a-zA-Z]*$"),
        Pattern.compile("^[A-Z_]+$"),
        Pattern.compile("[0-9]{2,}"),
        Pattern.compile("\\.(com|org|net|io|js|py|java|html|css|sql)$"),
        Pattern.compile("^(api|sdk|cli|gui|ui|ux|http|https|url|uri|json|xml|yaml|toml|env|cfg)$")
    );

    public ProcessedQuery rewrite(String query) {
        String original = query == null ? "" : query.trim();
        String working = original.toLowerCase(Locale.ROOT);

        List<String> expansions = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : EXPANSIONS.entrySet()) {
            if (working.contains(entry.getKey())) {
                expansions.addAll(entry.getValue());
            }
        }

        Set<String> terms = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(working)) {
            if (!token.isEmpty() && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        terms.addAll(expansions);

        String expanded = String.join(" ", terms);
        log.debug("query_rewritten original=\"{}\" expanded=\"{}\"", original, expanded);

        return new ProcessedQuery(
            original,
            expanded,
            Collections.unmodifiableSet(terms),
            Collections.unmodifiableList(expansions),
            analyzeComplexity(terms)
        );
    }

    public SearchPreparation prepareSearch(String query, int topK) {
        ProcessedQuery processed = rewrite(query);
        return new SearchPreparation(
            processed.getOriginal(),
            processed.getExpanded(),
            Math.min(topK + TOP_K_BUFFER, MAX_TOP_K),
            processed.getExpansions(),
            processed.getComplexity()
        );
    }

    QueryComplexity analyzeComplexity(Set<String> terms) {
        int count = terms.size();
        double averageLength = 0.0d;
        boolean technical = false;
        boolean longTerm = false;
        if (count > 0) {
            int totalLength = 0;
            for (String term : terms) {
                totalLength += term.length();
                technical = technical || isTechnicalTerm(term);
                longTerm = longTerm || term.length() > LONG_TERM_LENGTH;
            }
            averageLength = (double) totalLength / count;
        }
        return new QueryComplexity(count, averageLength, technical, count > COMPLEX_TERM_COUNT || longTerm);
    }

    boolean isTechnicalTerm(String term) {
        for (Pattern pattern : TECHNICAL_PATTERNS) {
            if (pattern.matcher(term).find()) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, List<String>> buildExpansions() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("install", List.of("setup", "configuration", "getting started"));
        map.put("error", List.of("issue", "problem", "troubleshoot", "fix"));
        map.put("config", List.of("configuration", "settings", "preferences", "options"));
        map.put("api", List.of("interface", "endpoint", "call", "integration"));
        map.put("auth", List.of("authentication", "authorization", "login", "security"));
        map.put("performance", List.of("speed", "optimization", "efficiency", "benchmark"));
        map.put("deploy", List.of("deployment", "release", "publish", "ship"));
        map.put("upgrade", List.of("update", "migration", "version", "change"));
        map.put("monitor", List.of("track", "observe", "watch", "metrics", "logging"));
        map.put("backup", List.of("restore", "recovery", "archive", "save"));
        return Collections.unmodifiableMap(map);
    }
}
