package com.elssolution.unlockwatch.integration.status;

import com.elssolution.unlockwatch.store.StoreState.EndpointConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the account status endpoint: one POST per account.
 * All failures come back inside {@link ProbeResult}; nothing is thrown.
 * No retries here, the next sweep is the retry.
 */
@Slf4j
@Service
public class StatusProbeClient {

    private static final String CONTENT_TYPE_JSON = "application/json";
    private static final int ERROR_TEXT_LIMIT = 240;

    private final HttpClient httpClient;
    /** Strict: a JSON value followed by anything else is not JSON. */
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private final Duration requestTimeout;

    public StatusProbeClient(@Value("${watch.probe.timeoutMs:20000}") long requestTimeoutMs) {
        this.requestTimeout = Duration.ofMillis(Math.max(1000, requestTimeoutMs));
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
    }

    public ProbeResult probe(EndpointConfig endpoint, String account) {
        if (endpoint == null || !endpoint.isConfigured()) {
            return ProbeResult.notConfigured();
        }
        try {
            String bodyJson = MAPPER.writeValueAsString(Map.of("account", account));
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint.getUrl().trim()))
                    .header("Accept", CONTENT_TYPE_JSON)
                    .header("Content-Type", CONTENT_TYPE_JSON)
                    .header("Authorization", "Bearer " + endpoint.getToken().trim())
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(bodyJson))
                    .build();

            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            String text = resp.body() == null ? "" : resp.body();
            boolean unlocked = extractUnlocked(parseQuietly(text));

            if (log.isDebugEnabled()) {
                log.debug("Probe {} -> HTTP {} unlocked={} body={}",
                        account, resp.statusCode(), unlocked, truncate(text, ERROR_TEXT_LIMIT));
            }
            return ProbeResult.http(resp.statusCode(), unlocked, text);

        } catch (HttpTimeoutException e) {
            return ProbeResult.error("HTTP timeout: " + e.getMessage());
        } catch (IOException e) {
            return ProbeResult.error("I/O error: " + e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ProbeResult.error("interrupted");
        } catch (RuntimeException e) {
            // bad URL, unsupported scheme etc.
            return ProbeResult.error(e.toString());
        }
    }

    /**
     * Reads the unlock signal. Order matters:
     * 1) top-level "unlocked";
     * 2) "data.unlocked" when "status" is "ok" or "success";
     * 3) false.
     */
    static boolean extractUnlocked(JsonNode root) {
        if (root == null || !root.isObject()) return false;
        if (root.has("unlocked")) return truthy(root.get("unlocked"));

        JsonNode status = root.get("status");
        boolean okStatus = status != null && status.isTextual()
                && ("ok".equals(status.asText()) || "success".equals(status.asText()));
        if (!okStatus) return false;

        JsonNode data = root.get("data");
        if (data != null && data.isObject() && data.has("unlocked")) {
            return truthy(data.get("unlocked"));
        }
        return false;
    }

    /** Loose truthiness: non-zero numbers, non-empty strings and containers count as true. */
    static boolean truthy(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return false;
        if (n.isBoolean()) return n.booleanValue();
        if (n.isNumber()) return n.doubleValue() != 0.0;
        if (n.isTextual()) return !n.textValue().isEmpty();
        if (n.isContainerNode()) return n.size() > 0;
        return false;
    }

    static JsonNode parseQuietly(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            return null; // plain-text body, kept as raw
        }
    }

    private static String truncate(String s, int limit) {
        if (s == null) return "";
        return s.length() <= limit ? s : s.substring(0, Math.max(0, limit)) + "…";
    }
}
