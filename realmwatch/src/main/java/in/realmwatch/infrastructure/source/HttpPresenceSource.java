package in.realmwatch.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.realmwatch.application.port.output.PresenceSource;
import in.realmwatch.application.port.output.PresenceSourceException;
import in.realmwatch.domain.presence.PollResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Presence source backed by the realm presence HTTP API.
 *
 * GET {base}/realms/{id}/presence answers either {"online": [...]} or
 * {"status": "unreachable", "reason": "..."}; a 404 also means the realm
 * cannot be reached. Anything else is a transient failure.
 */
public final class HttpPresenceSource implements PresenceSource {
    private static final Logger log = LoggerFactory.getLogger(HttpPresenceSource.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final String baseUrl;
    private final String apiToken;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpPresenceSource(String baseUrl, String apiToken) {
        this(baseUrl, apiToken,
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
            new ObjectMapper());
    }

    public HttpPresenceSource(String baseUrl, String apiToken, HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiToken = apiToken;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public PollResult poll(String realmId) {
        HttpRequest request = authorized(realmUri(realmId, "/presence"))
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response = send(realmId, request);
        int status = response.statusCode();

        if (status == 404) {
            return PollResult.unreachable("realm not found at source");
        }
        if (status != 200) {
            throw new PresenceSourceException(realmId, "presence HTTP " + status);
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new PresenceSourceException(realmId, "malformed presence payload", e);
        }

        if ("unreachable".equals(body.path("status").asText())) {
            return PollResult.unreachable(body.path("reason").asText("unreachable"));
        }

        JsonNode online = body.get("online");
        if (online == null || !online.isArray()) {
            throw new PresenceSourceException(realmId, "presence payload has no online list");
        }

        Set<String> participants = new HashSet<>();
        for (JsonNode participant : online) {
            participants.add(participant.asText());
        }
        return PollResult.snapshot(participants);
    }

    @Override
    public boolean unsubscribe(String realmId) {
        HttpRequest request = authorized(realmUri(realmId, "/leave"))
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();

        HttpResponse<String> response = send(realmId, request);
        int status = response.statusCode();

        if (status == 404) {
            return false;
        }
        if (status / 100 != 2) {
            throw new PresenceSourceException(realmId, "leave HTTP " + status);
        }
        log.info("[SOURCE] Left realm {}", realmId);
        return true;
    }

    private HttpResponse<String> send(String realmId, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PresenceSourceException(realmId, "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PresenceSourceException(realmId, "interrupted", e);
        }
    }

    private HttpRequest.Builder authorized(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(REQUEST_TIMEOUT);
        if (apiToken != null) {
            builder.header("Authorization", "Bearer " + apiToken);
        }
        return builder;
    }

    private URI realmUri(String realmId, String suffix) {
        return URI.create(baseUrl + "/realms/" + URLEncoder.encode(realmId, StandardCharsets.UTF_8) + suffix);
    }
}
