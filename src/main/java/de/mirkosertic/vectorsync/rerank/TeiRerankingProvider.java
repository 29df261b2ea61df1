package de.mirkosertic.vectorsync.rerank;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.vectorsync.config.BuildInfo;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Client for a Text Embeddings Inference style {@code POST /rerank} endpoint.
 */
public class TeiRerankingProvider implements RerankingProvider {

    private static final Logger logger = LoggerFactory.getLogger(TeiRerankingProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final HttpUrl endpoint;

    public TeiRerankingProvider(final String baseUrl, final long timeoutMs) {
        this(new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(timeoutMs))
                .readTimeout(Duration.ofMillis(timeoutMs))
                .build(), baseUrl);
    }

    public TeiRerankingProvider(final OkHttpClient httpClient, final String baseUrl) {
        final HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalArgumentException("Invalid rerank base URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.endpoint = base.newBuilder().addPathSegment("rerank").build();
        logger.info("Reranker client initialized: endpoint={}", endpoint);
    }

    @Override
    public List<RerankedText> rerank(final String query, final List<String> texts, final int topK) throws IOException {
        if (texts.isEmpty() || topK <= 0) {
            return List.of();
        }

        final String payload = mapper.writeValueAsString(new RerankRequest(query, texts, false, true));
        final Request request = new Request.Builder()
                .url(endpoint)
                .header("User-Agent", BuildInfo.current().userAgent())
                .post(RequestBody.create(payload, JSON))
                .build();

        final RerankResult[] results;
        try (Response response = httpClient.newCall(request).execute()) {
            final ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Rerank request failed with HTTP " + response.code());
            }
            results = mapper.readValue(body.string(), RerankResult[].class);
        }

        final List<RerankedText> ranked = new ArrayList<>(results.length);
        Arrays.stream(results)
                .filter(r -> r.index() >= 0 && r.index() < texts.size())
                .sorted(Comparator.comparingDouble(RerankResult::score).reversed())
                .limit(topK)
                .forEach(r -> ranked.add(new RerankedText(r.index(), texts.get(r.index()), r.score())));
        return ranked;
    }

    record RerankRequest(String query, List<String> texts, boolean raw_scores, boolean truncate) {
    }

    record RerankResult(int index, double score) {
    }
}
