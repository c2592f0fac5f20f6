package com.ragdocs.gateway.service;

import com.ragdocs.gateway.api.dto.CuratedResult;
import com.ragdocs.gateway.api.dto.LlmQueryResponse;
import com.ragdocs.gateway.api.dto.SearchResponse;
import com.ragdocs.gateway.cache.CacheKeyUtil;
import com.ragdocs.gateway.cache.RagCacheService;
import com.ragdocs.gateway.query.QueryRewriter;
import com.ragdocs.gateway.query.SearchPreparation;
import com.ragdocs.gateway.retrieval.RetrievalBackendGateway;
import com.ragdocs.gateway.retrieval.dto.BackendGenerateResponse;
import com.ragdocs.gateway.retrieval.dto.BackendSearchResponse;
import com.ragdocs.gateway.service.curation.ResultCurator;
import com.ragdocs.gateway.service.quality.QualityGate;
import com.ragdocs.gateway.service.quality.QualityVerdict;
import com.ragdocs.gateway.service.usage.QueryUsageEvent;
import com.ragdocs.gateway.service.usage.QueryUsageEvent.QueryKind;
import com.ragdocs.gateway.service.usage.QueryUsageRecorder;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Request pipeline around the retrieval backend: cache lookup, query expansion, backend call, curation,
 * quality gating and write-through of passing responses.
 */
@Service
public class RagQueryService {
    private static final Logger log = LoggerFactory.getLogger(RagQueryService.class);
    static final String GATED_ANSWER =
        "Unable to generate answer due to low-quality retrieval results. The retrieved documents do not meet the minimum quality thresholds.";
    static final String NO_RANGE = "N/A";

    private final RagCacheService cacheService;
    private final QueryRewriter queryRewriter;
    private final RetrievalBackendGateway retrievalGateway;
    private final ResultCurator resultCurator;
    private final QualityGate qualityGate;
    private final CacheTtlPolicy ttlPolicy;
    private final FallbackResponder fallbackResponder;
    private final QueryUsageRecorder usageRecorder;

    public RagQueryService(
        RagCacheService cacheService,
        QueryRewriter queryRewriter,
        RetrievalBackendGateway retrievalGateway,
        ResultCurator resultCurator,
        QualityGate qualityGate,
        CacheTtlPolicy ttlPolicy,
        FallbackResponder fallbackResponder,
        QueryUsageRecorder usageRecorder
    ) {
        this.cacheService = cacheService;
        this.queryRewriter = queryRewriter;
        this.retrievalGateway = retrievalGateway;
        this.resultCurator = resultCurator;
        this.qualityGate = qualityGate;
        this.ttlPolicy = ttlPolicy;
        this.fallbackResponder = fallbackResponder;
        this.usageRecorder = usageRecorder;
    }

    public SearchResponse processSearch(String query, String userId, int topK) {
        long started = System.nanoTime();
        String cacheKey = CacheKeyUtil.searchKey(query, topK);
        Optional<SearchResponse> cached = cacheService.getCachedResult(cacheKey, SearchResponse.class);
        if (cached.isPresent()) {
            return serveCached(cached.get().copy(), query, userId, QueryKind.SEARCH);
        }

        SearchPreparation preparation = queryRewriter.prepareSearch(query, topK);
        BackendSearchResponse backend = retrievalGateway.search(preparation.searchQuery(), userId, preparation.effectiveTopK());
        List<CuratedResult> curated = limit(resultCurator.curate(backend.getResults(), query), topK);
        QualityVerdict verdict = qualityGate.evaluate(curated);

        SearchResponse response = new SearchResponse();
        fill(response, query, curated, verdict);
        response.setProcessingTimeMs(elapsedMs(started));

        complete(cacheKey, response, query, userId, QueryKind.SEARCH, curated, verdict);
        return response;
    }

    public LlmQueryResponse processLlmQuery(String query, String userId, int topK) {
        long started = System.nanoTime();
        String cacheKey = CacheKeyUtil.llmKey(query, topK);
        Optional<LlmQueryResponse> cached = cacheService.getCachedResult(cacheKey, LlmQueryResponse.class);
        if (cached.isPresent()) {
            return (LlmQueryResponse) serveCached(cached.get().copy(), query, userId, QueryKind.LLM);
        }

        SearchPreparation preparation = queryRewriter.prepareSearch(query, topK);
        BackendGenerateResponse backend = retrievalGateway.generate(preparation.originalQuery(), userId, preparation.effectiveTopK());
        List<CuratedResult> curated = limit(resultCurator.curate(backend.getSources(), query), topK);
        QualityVerdict verdict = qualityGate.evaluate(curated);

        LlmQueryResponse response = new LlmQueryResponse();
        fill(response, query, curated, verdict);
        response.setAnswer(verdict.isValid() ? backend.getAnswer() : GATED_ANSWER);
        response.setProcessingTimeMs(elapsedMs(started));

        complete(cacheKey, response, query, userId, QueryKind.LLM, curated, verdict);
        return response;
    }

    /**
     * Evicts every cached response that cites the document, so the next request sees its new chunks.
     *
     * @return number of cached responses removed
     */
    public int invalidateDocument(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            return 0;
        }
        return cacheService.invalidateMatching("document:" + documentId, value -> citesDocument(value, documentId));
    }

    private SearchResponse serveCached(SearchResponse response, String query, String userId, QueryKind kind) {
        log.info("cache_hit kind={} query=\"{}\"", kind.tag(), abbreviate(query));
        response.setCached(true);
        record(new QueryUsageEvent(
            query,
            userId,
            kind,
            true,
            0L,
            response.getTotalResults(),
            maxScore(response.getResults()),
            response.isRetrievalGated()
        ));
        return response;
    }

    private void fill(SearchResponse response, String query, List<CuratedResult> curated, QualityVerdict verdict) {
        response.setQuery(query);
        response.setRetrievalQuality(verdict);
        response.setRetrievalGated(!verdict.isValid());
        if (verdict.isValid()) {
            response.setResults(curated);
            response.setTotalResults(curated.size());
            response.setSimilarityScoreRange(similarityRange(curated));
            return;
        }
        response.setResults(List.of());
        response.setTotalResults(0);
        response.setGatingReason(verdict.getReason());
        response.setSimilarityScoreRange(NO_RANGE);
        response.setFallbackMessage(fallbackResponder.message(query));
        response.setSuggestions(fallbackResponder.suggestions(query));
    }

    private void complete(
        String cacheKey,
        SearchResponse response,
        String query,
        String userId,
        QueryKind kind,
        List<CuratedResult> curated,
        QualityVerdict verdict
    ) {
        if (verdict.isValid()) {
            cacheService.cacheResult(cacheKey, response.copy(), ttlPolicy.ttlSeconds(query));
        } else {
            log.info("retrieval_gated kind={} reason=\"{}\" details=\"{}\"", kind.tag(), verdict.getReason(), verdict.getDetails());
        }
        record(new QueryUsageEvent(
            query,
            userId,
            kind,
            false,
            response.getProcessingTimeMs(),
            response.getTotalResults(),
            verdict.isValid() ? maxScore(curated) : 0.0d,
            !verdict.isValid()
        ));
    }

    private void record(QueryUsageEvent event) {
        try {
            usageRecorder.record(event);
        } catch (RuntimeException ex) {
            log.warn("query_usage_record_failed kind={}", event.kind().tag(), ex);
        }
    }

    static boolean citesDocument(Object cached, String documentId) {
        if (!(cached instanceof SearchResponse)) {
            return false;
        }
        List<CuratedResult> results = ((SearchResponse) cached).getResults();
        if (results == null) {
            return false;
        }
        for (CuratedResult result : results) {
            if (result != null && result.getSource() != null && documentId.equals(result.getSource().getDocumentId())) {
                return true;
            }
        }
        return false;
    }

    static String similarityRange(List<CuratedResult> results) {
        if (results == null || results.isEmpty()) {
            return NO_RANGE;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (CuratedResult result : results) {
            min = Math.min(min, result.getScore());
            max = Math.max(max, result.getScore());
        }
        return String.format(Locale.ROOT, "%.3f - %.3f", min, max);
    }

    private static double maxScore(List<CuratedResult> results) {
        if (results == null || results.isEmpty()) {
            return 0.0d;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (CuratedResult result : results) {
            max = Math.max(max, result.getScore());
        }
        return max;
    }

    private static List<CuratedResult> limit(List<CuratedResult> curated, int topK) {
        if (topK <= 0 || curated.size() <= topK) {
            return curated;
        }
        return List.copyOf(curated.subList(0, topK));
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private static String abbreviate(String query) {
        if (query == null) {
            return "";
        }
        return query.length() <= 50 ? query : query.substring(0, 50) + "...";
    }
}
