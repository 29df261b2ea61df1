package de.mirkosertic.vectorsync.search;

import de.mirkosertic.vectorsync.embedding.EmbeddingProvider;
import de.mirkosertic.vectorsync.rerank.RerankedText;
import de.mirkosertic.vectorsync.rerank.RerankingProvider;
import de.mirkosertic.vectorsync.store.ScoredPoint;
import de.mirkosertic.vectorsync.store.VectorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SemanticSearchService Tests")
class SemanticSearchServiceTest {

    private static final float[] QUERY_VECTOR = {1f, 0f};

    @Mock
    private VectorStore vectorStore;

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private RerankingProvider rerankingProvider;

    private static ScoredPoint hit(final String id, final double score, final String text) {
        return new ScoredPoint(id, score, Map.of("path", "/docs/" + id + ".txt", "chunk_index", 0, "text", text));
    }

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(embeddingProvider.embedQuery("query")).thenReturn(QUERY_VECTOR);
    }

    @Test
    @DisplayName("Should drop hits below the similarity threshold")
    void threshold() throws Exception {
        when(vectorStore.search("docs", QUERY_VECTOR, 5)).thenReturn(List.of(
                hit("a", 0.8, "alpha"), hit("b", 0.2, "beta"), hit("c", 0.1, "gamma")));
        final SemanticSearchService service = new SemanticSearchService(vectorStore, embeddingProvider, null, 0.15, 0.35);

        final List<SearchHit> hits = service.search("docs", "query", 5);

        assertThat(hits).extracting(SearchHit::fragmentId).containsExactly("a", "b");
        assertThat(hits.get(0).path()).isEqualTo("/docs/a.txt");
        assertThat(hits.get(0).text()).isEqualTo("alpha");
        assertThat(hits.get(0).rerankScore()).isNull();
    }

    @Test
    @DisplayName("Should fetch more candidates and let the reranker order them")
    void rerank() throws Exception {
        when(vectorStore.search("docs", QUERY_VECTOR, 6)).thenReturn(List.of(
                hit("a", 0.8, "alpha"), hit("b", 0.7, "beta"), hit("c", 0.6, "gamma")));
        when(rerankingProvider.rerank(eq("query"), eq(List.of("alpha", "beta", "gamma")), eq(2))).thenReturn(List.of(
                new RerankedText(2, "gamma", 0.95), new RerankedText(0, "alpha", 0.2)));
        final SemanticSearchService service = new SemanticSearchService(
                vectorStore, embeddingProvider, rerankingProvider, 0.15, 0.35);

        final List<SearchHit> hits = service.search("docs", "query", 2);

        assertThat(hits).singleElement().satisfies(h -> {
            assertThat(h.fragmentId()).isEqualTo("c");
            assertThat(h.score()).isEqualTo(0.6);
            assertThat(h.rerankScore()).isEqualTo(0.95);
        });
    }

    @Test
    @DisplayName("Should skip the reranker when nothing passed the threshold")
    void noCandidates() throws Exception {
        when(vectorStore.search("docs", QUERY_VECTOR, 3)).thenReturn(List.of(hit("a", 0.05, "alpha")));
        final SemanticSearchService service = new SemanticSearchService(
                vectorStore, embeddingProvider, rerankingProvider, 0.15, 0.35);

        assertThat(service.search("docs", "query", 1)).isEmpty();
        verify(rerankingProvider, never()).rerank(anyString(), any(), anyInt());
    }

    @Test
    @DisplayName("Should return nothing for blank queries")
    void blankQuery() throws Exception {
        final SemanticSearchService service = new SemanticSearchService(vectorStore, embeddingProvider, null, 0.15, 0.35);

        assertThat(service.search("docs", "  ", 5)).isEmpty();
        verifyNoInteractions(vectorStore);
    }
}
