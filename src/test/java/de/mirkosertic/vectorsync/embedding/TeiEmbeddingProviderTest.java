package de.mirkosertic.vectorsync.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TeiEmbeddingProvider Tests")
class TeiEmbeddingProviderTest {

    private MockWebServer server;
    private TeiEmbeddingProvider provider;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        provider = new TeiEmbeddingProvider(new OkHttpClient(), server.url("/").toString(), 3,
                "search_document: ", "search_query: ");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    @DisplayName("Should post prefixed passages and parse one vector per input")
    void embedPassages() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("[[0.1, 0.2, 0.3], [0.4, 0.5, 0.6]]"));

        final List<float[]> vectors = provider.embedPassages(List.of("first", "second"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(1)).containsExactly(0.4f, 0.5f, 0.6f);

        final RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/embed");
        assertThat(request.getHeader("User-Agent")).startsWith("vector-sync/");
        final JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("inputs").get(0).asText()).isEqualTo("search_document: first");
        assertThat(body.get("normalize").asBoolean()).isTrue();
        assertThat(body.get("truncate").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("Should use the query prefix for queries")
    void embedQuery() throws Exception {
        server.enqueue(new MockResponse().setBody("[[1.0, 0.0, 0.0]]"));

        assertThat(provider.embedQuery("what is hnsw")).containsExactly(1.0f, 0.0f, 0.0f);
        final JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.get("inputs").get(0).asText()).isEqualTo("search_query: what is hnsw");
    }

    @Test
    @DisplayName("Should not call the service for an empty batch")
    void emptyBatch() throws Exception {
        assertThat(provider.embedPassages(List.of())).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("Should fail on HTTP errors")
    void httpError() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));

        assertThatThrownBy(() -> provider.embedQuery("x"))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessageContaining("503");
    }

    @Test
    @DisplayName("Should fail when the vector dimension does not match")
    void wrongDimension() {
        server.enqueue(new MockResponse().setBody("[[0.1, 0.2]]"));

        assertThatThrownBy(() -> provider.embedQuery("x"))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessageContaining("dimension 3");
    }

    @Test
    @DisplayName("Should fail when the number of vectors does not match")
    void wrongCount() {
        server.enqueue(new MockResponse().setBody("[[0.1, 0.2, 0.3]]"));

        assertThatThrownBy(() -> provider.embedPassages(List.of("a", "b")))
                .isInstanceOf(EmbeddingProviderException.class);
    }

    @Test
    @DisplayName("Should wrap malformed responses")
    void malformedResponse() {
        server.enqueue(new MockResponse().setBody("{not json"));

        assertThatThrownBy(() -> provider.embedQuery("x"))
                .isInstanceOf(EmbeddingProviderException.class);
    }
}
