package in.realmwatch.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * POST {base}/participants/names with {"ids": [...]}, answered by
 * {"names": {"id": "name", ...}}.
 */
public final class HttpDisplayNameSource implements DisplayNameSource {
    private static final Logger log = LoggerFactory.getLogger(HttpDisplayNameSource.class);

    private final URI endpoint;
    private final String apiToken;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpDisplayNameSource(String baseUrl, String apiToken) {
        this(baseUrl, apiToken,
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
            new ObjectMapper());
    }

    public HttpDisplayNameSource(String baseUrl, String apiToken, HttpClient httpClient, ObjectMapper objectMapper) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.endpoint = URI.create(base + "/participants/names");
        this.apiToken = apiToken;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, String> fetch(Collection<String> participantIds) {
        if (participantIds.isEmpty()) {
            return Map.of();
        }

        try {
            ObjectNode payload = objectMapper.createObjectNode();
            ArrayNode ids = payload.putArray("ids");
            participantIds.forEach(ids::add);

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)));
            if (apiToken != null) {
                builder.header("Authorization", "Bearer " + apiToken);
            }

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("[NAMES] Lookup HTTP {} for {} ids", response.statusCode(), participantIds.size());
                throw new IllegalStateException("Display name lookup HTTP " + response.statusCode());
            }

            Map<String, String> names = new HashMap<>();
            JsonNode namesNode = objectMapper.readTree(response.body()).path("names");
            Iterator<Map.Entry<String, JsonNode>> fields = namesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                names.put(entry.getKey(), entry.getValue().asText());
            }
            return names;

        } catch (IOException e) {
            throw new IllegalStateException("Display name lookup failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Display name lookup interrupted", e);
        }
    }
}
