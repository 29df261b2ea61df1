package de.mirkosertic.vectorsync.search;

import de.mirkosertic.vectorsync.config.ApplicationConfig;
import de.mirkosertic.vectorsync.embedding.EmbeddingProvider;
import de.mirkosertic.vectorsync.rerank.RerankedText;
import de.mirkosertic.vectorsync.rerank.RerankingProvider;
import de.mirkosertic.vectorsync.store.ScoredPoint;
import de.mirkosertic.vectorsync.store.VectorStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Query side of a folder's collection: embed the query, take the nearest fragments above
 * the similarity threshold, and optionally let the reranker reorder and cut them.
 */
public class SemanticSearchService {

    private static final Logger logger = LoggerFactory.getLogger(SemanticSearchService.class);

    // Candidates fetched per requested hit when a reranker narrows them down
    static final int RERANK_CANDIDATE_FACTOR = 3;

    private final VectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final @Nullable RerankingProvider rerankingProvider;
    private final double scoreThreshold;
    private final double rerankScoreThreshold;

    public SemanticSearchService(final VectorStore vectorStore, final EmbeddingProvider embeddingProvider,
                                 final @Nullable RerankingProvider rerankingProvider, final ApplicationConfig config) {
        this(vectorStore, embeddingProvider, rerankingProvider,
                config.getSearchScoreThreshold(), config.getRerankScoreThreshold());
    }

    public SemanticSearchService(final VectorStore vectorStore, final EmbeddingProvider embeddingProvider,
                                 final @Nullable RerankingProvider rerankingProvider,
                                 final double scoreThreshold, final double rerankScoreThreshold) {
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.rerankingProvider = rerankingProvider;
        this.scoreThreshold = scoreThreshold;
        this.rerankScoreThreshold = rerankScoreThreshold;
    }

    public List<SearchHit> search(final String collection, final String query, final int limit) throws IOException {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }

        final float[] vector = embeddingProvider.embedQuery(query);
        final int candidates = rerankingProvider != null ? limit * RERANK_CANDIDATE_FACTOR : limit;
        final List<SearchHit> hits = new ArrayList<>();
        for (final ScoredPoint point : vectorStore.search(collection, vector, candidates)) {
            if (point.score() < scoreThreshold) {
                continue;
            }
            hits.add(new SearchHit(
                    point.id(),
                    String.valueOf(point.metadata().get("path")),
                    point.metadata().get("chunk_index") instanceof Number n ? n.intValue() : -1,
                    String.valueOf(point.metadata().getOrDefault("text", "")),
                    point.score(),
                    null));
        }
        logger.debug("Query '{}' on {}: {} candidate(s) above {}", query, collection, hits.size(), scoreThreshold);

        if (rerankingProvider == null || hits.isEmpty()) {
            return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
        }

        final List<String> texts = hits.stream().map(SearchHit::text).toList();
        final List<SearchHit> reranked = new ArrayList<>();
        for (final RerankedText rerankedText : rerankingProvider.rerank(query, texts, limit)) {
            if (rerankedText.score() < rerankScoreThreshold) {
                continue;
            }
            final SearchHit hit = hits.get(rerankedText.index());
            reranked.add(new SearchHit(hit.fragmentId(), hit.path(), hit.chunkIndex(), hit.text(),
                    hit.score(), rerankedText.score()));
        }
        return reranked;
    }
}
