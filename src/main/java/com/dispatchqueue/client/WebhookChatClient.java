package com.dispatchqueue.client;

import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.util.Map;
import java.util.logging.Logger;

/**
 * {@link ChatClient} over a chat platform's incoming webhook.
 *
 * <p>Posts {@code {"embeds":[...]}} to the webhook URL with {@code wait=true} so the platform
 * answers with the created message, whose {@code id} becomes the delivery receipt. The
 * webhook is bound to one channel, so the {@code channelId} argument is only logged.</p>
 */
public class WebhookChatClient implements ChatClient {
    private static final Logger logger = Logger.getLogger(WebhookChatClient.class.getName());

    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;

    private final String webhookUrl;
    private final int timeoutMillis;

    public WebhookChatClient(String webhookUrl) {
        this(webhookUrl, DEFAULT_TIMEOUT_MILLIS);
    }

    public WebhookChatClient(String webhookUrl, int timeoutMillis) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            throw new IllegalArgumentException("Webhook URL is required");
        }
        this.webhookUrl = webhookUrl;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public String send(String channelId, JSONObject embed) throws IOException {
        JSONObject body = new JSONObject();
        body.put("embeds", new JSONArray().put(embed));

        String separator = webhookUrl.contains("?") ? "&" : "?";
        HttpResponse response = HttpResponse.postJson(webhookUrl + separator + "wait=true", Map.of(), body, timeoutMillis);
        if (!response.isSuccess()) {
            throw new IOException("Chat webhook rejected message (HTTP " + response.getStatus() + "): "
                    + response.errorMessage());
        }

        JSONObject created = response.json();
        String messageId = created != null ? created.optString("id", null) : null;
        logger.fine("Posted embed to channel " + channelId + " as message " + messageId);
        return messageId;
    }
}
