package com.ragdocs.gateway.service.curation;

import com.ragdocs.gateway.api.dto.CuratedResult;
import com.ragdocs.gateway.retrieval.dto.RawResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns the backend's candidate chunks into a ranked, cited result list: near-duplicates are dropped, each
 * document contributes a bounded number of chunks, and every survivor gets excerpts matching the query.
 */
@Service
public class ResultCurator {
    private static final Logger log = LoggerFactory.getLogger(ResultCurator.class);
    private static final Pattern WORD = Pattern.compile("\\w+");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_QUERY_TERM_LENGTH = 3;
    private static final Comparator<Candidate> BY_SCORE_DESC =
        Comparator.comparingDouble((Candidate candidate) -> candidate.result().getSimilarityScore()).reversed();

    private final CurationProperties properties;

    public ResultCurator(CurationProperties properties) {
        this.properties = properties;
    }

    public List<CuratedResult> curate(List<RawResult> rawResults, String originalQuery) {
        if (rawResults == null || rawResults.isEmpty()) {
            return List.of();
        }

        List<Candidate> sorted = new ArrayList<>();
        for (RawResult result : rawResults) {
            if (result != null) {
                sorted.add(new Candidate(result, ResolvedSource.of(result), wordSet(result.getContent())));
            }
        }
        sorted.sort(BY_SCORE_DESC);

        List<Candidate> unique = deduplicate(sorted);
        List<Candidate> capped = capPerDocument(unique);

        List<String> queryTerms = queryTerms(originalQuery);
        List<CuratedResult> curated = new ArrayList<>(capped.size());
        for (int i = 0; i < capped.size(); i++) {
            curated.add(annotate(capped.get(i), i + 1, queryTerms));
        }
        return curated;
    }

    List<Candidate> deduplicate(List<Candidate> sorted) {
        List<Candidate> kept = new ArrayList<>();
        for (Candidate candidate : sorted) {
            boolean duplicate = false;
            for (Candidate existing : kept) {
                if (jaccard(candidate.words(), existing.words()) > properties.getDuplicateThreshold()) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                kept.add(candidate);
            }
        }
        if (kept.size() != sorted.size()) {
            log.debug("dedup_applied before={} after={}", sorted.size(), kept.size());
        }
        return kept;
    }

    // input is score-sorted, so each group's head holds its best chunks
    List<Candidate> capPerDocument(List<Candidate> unique) {
        Map<String, List<Candidate>> groups = new LinkedHashMap<>();
        for (Candidate candidate : unique) {
            groups.computeIfAbsent(candidate.source().groupKey(), key -> new ArrayList<>()).add(candidate);
        }
        int cap = Math.max(1, properties.getMaxChunksPerDocument());
        List<Candidate> limited = new ArrayList<>();
        for (List<Candidate> group : groups.values()) {
            limited.addAll(group.subList(0, Math.min(cap, group.size())));
        }
        limited.sort(BY_SCORE_DESC);
        return limited;
    }

    List<String> extractRelevantSentences(String content, List<String> queryTerms) {
        List<String> relevant = new ArrayList<>();
        if (content == null || queryTerms.isEmpty()) {
            return relevant;
        }
        int limit = Math.max(0, properties.getMaxExtracts());
        for (String raw : SENTENCE_BREAK.split(content)) {
            if (relevant.size() >= limit) {
                break;
            }
            String sentence = raw.trim();
            if (sentence.isEmpty()) {
                continue;
            }
            String lower = sentence.toLowerCase(Locale.ROOT);
            for (String term : queryTerms) {
                if (lower.contains(term)) {
                    relevant.add(sentence);
                    break;
                }
            }
        }
        return relevant;
    }

    static double jaccard(Set<String> left, Set<String> right) {
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        if (union.isEmpty()) {
            return 0.0d;
        }
        int intersection = 0;
        for (String word : left) {
            if (right.contains(word)) {
                intersection++;
            }
        }
        return (double) intersection / union.size();
    }

    static Set<String> wordSet(String content) {
        Set<String> words = new HashSet<>();
        if (content == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(content.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    static List<String> queryTerms(String query) {
        List<String> terms = new ArrayList<>();
        if (query == null) {
            return terms;
        }
        for (String token : WHITESPACE.split(query.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_QUERY_TERM_LENGTH) {
                terms.add(token);
            }
        }
        return terms;
    }

    private CuratedResult annotate(Candidate candidate, int rank, List<String> queryTerms) {
        RawResult result = candidate.result();
        ResolvedSource resolved = candidate.source();

        CuratedResult.Source source = new CuratedResult.Source();
        source.setDocumentId(resolved.documentId());
        source.setSourceFile(resolved.sourceFile());
        source.setPage(resolved.page());
        source.setSection(resolved.section());
        source.setChunkOrder(resolved.chunkOrder());

        CuratedResult curated = new CuratedResult();
        curated.setId(result.getChunkId());
        curated.setRank(rank);
        curated.setScore(result.getSimilarityScore());
        curated.setContent(result.getContent());
        curated.setRelevantExtracts(extractRelevantSentences(result.getContent(), queryTerms));
        curated.setSource(source);
        curated.setCitation("[" + rank + "] Source: " + resolved.citationName());
        curated.setMetadata(resolved.metadata());
        return curated;
    }

    record Candidate(RawResult result, ResolvedSource source, Set<String> words) {}
}
