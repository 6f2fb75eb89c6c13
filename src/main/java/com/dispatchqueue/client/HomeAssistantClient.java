package com.dispatchqueue.client;

import org.json.JSONObject;

import java.io.IOException;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link AutomationClient} for the Home Assistant REST API.
 *
 * <p>Every request carries the long-lived access token as a bearer token and is bounded by
 * the configured timeout.</p>
 */
public class HomeAssistantClient implements AutomationClient {
    private static final Logger logger = Logger.getLogger(HomeAssistantClient.class.getName());

    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;

    private final String baseUrl;
    private final String accessToken;
    private final int timeoutMillis;

    public HomeAssistantClient(String baseUrl, String accessToken, int timeoutMillis) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Home Assistant URL is required");
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Home Assistant access token is required");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.accessToken = accessToken;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public void triggerAutomation(String automationId) throws IOException {
        JSONObject body = new JSONObject();
        body.put("entity_id", automationId);

        HttpResponse response = HttpResponse.postJson(
                baseUrl + "/api/services/automation/trigger", authHeaders(), body, timeoutMillis);
        if (!response.isSuccess()) {
            throw new IOException("Failed to trigger automation " + automationId + ": " + response.errorMessage());
        }
        logger.info("Triggered automation " + automationId);
    }

    /**
     * Check that the API is reachable and the token is accepted.
     *
     * @return true if {@code /api/} answers "API running."
     */
    public boolean validateConnection() {
        try {
            HttpResponse response = HttpResponse.get(baseUrl + "/api/", authHeaders(), timeoutMillis);
            JSONObject json = response.json();
            return response.isSuccess() && json != null && "API running.".equals(json.optString("message"));
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to reach Home Assistant at " + baseUrl, e);
            return false;
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private Map<String, String> authHeaders() {
        return Map.of("Authorization", "Bearer " + accessToken);
    }
}
