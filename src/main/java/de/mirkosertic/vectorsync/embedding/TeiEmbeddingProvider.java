package de.mirkosertic.vectorsync.embedding;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.List;
import java.util.Map;

/**
 * Client for a Text Embeddings Inference style {@code POST /embed} endpoint.
 * <p>
 * Request: {@code {"inputs": [...], "normalize": true, "truncate": true}};
 * response: one JSON array of floats per input. Passages and queries are sent with
 * their respective prompt prefixes.
 */
public class TeiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger logger = LoggerFactory.getLogger(TeiEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl endpoint;
    private final int dimension;
    private final String passagePrefix;
    private final String queryPrefix;

    public TeiEmbeddingProvider(final String baseUrl, final int dimension, final String passagePrefix,
                                final String queryPrefix, final long timeoutMs) {
        this(new OkHttpClient.Builder()
                        .callTimeout(Duration.ofMillis(timeoutMs))
                        .readTimeout(Duration.ofMillis(timeoutMs))
                        .build(),
                baseUrl, dimension, passagePrefix, queryPrefix);
    }

    public TeiEmbeddingProvider(final OkHttpClient httpClient, final String baseUrl, final int dimension,
                                final String passagePrefix, final String queryPrefix) {
        final HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalArgumentException("Invalid embedding base URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.endpoint = base.newBuilder().addPathSegment("embed").build();
        this.dimension = dimension;
        this.passagePrefix = passagePrefix;
        this.queryPrefix = queryPrefix;
        logger.info("Embedding client initialized: endpoint={}, dimension={}", endpoint, dimension);
    }

    @Override
    public List<float[]> embedPassages(final List<String> texts) throws EmbeddingProviderException {
        if (texts.isEmpty()) {
            return List.of();
        }
        final List<String> inputs = new ArrayList<>(texts.size());
        for (final String text : texts) {
            inputs.add(passagePrefix + text);
        }
        return call(inputs);
    }

    @Override
    public float[] embedQuery(final String text) throws EmbeddingProviderException {
        return call(List.of(queryPrefix + text)).get(0);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private List<float[]> call(final List<String> inputs) throws EmbeddingProviderException {
        final String payload;
        try {
            payload = mapper.writeValueAsString(Map.of("inputs", inputs, "normalize", true, "truncate", true));
        } catch (final IOException e) {
            throw new EmbeddingProviderException("Cannot serialize embedding request", e);
        }

        final Request request = new Request.Builder()
                .url(endpoint)
                .header("User-Agent", BuildInfo.current().userAgent())
                .post(RequestBody.create(payload, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            final ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new EmbeddingProviderException("Embedding request failed with HTTP " + response.code());
            }
            final JsonNode root = mapper.readTree(body.string());
            if (!root.isArray() || root.size() != inputs.size()) {
                throw new EmbeddingProviderException("Expected " + inputs.size() + " embeddings, got "
                        + (root.isArray() ? root.size() : "a non-array response"));
            }
            final List<float[]> result = new ArrayList<>(root.size());
            for (final JsonNode vectorNode : root) {
                result.add(toVector(vectorNode));
            }
            return result;
        } catch (final EmbeddingProviderException e) {
            throw e;
        } catch (final IOException e) {
            throw new EmbeddingProviderException("Embedding request to " + endpoint + " failed", e);
        }
    }

    private float[] toVector(final JsonNode vectorNode) throws EmbeddingProviderException {
        if (!vectorNode.isArray() || vectorNode.size() != dimension) {
            throw new EmbeddingProviderException("Expected vector of dimension " + dimension
                    + ", got " + vectorNode.size());
        }
        final float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }
}
