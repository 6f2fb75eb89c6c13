package com.dispatchqueue.jobs;

import com.dispatchqueue.client.ChatClient;
import com.dispatchqueue.core.DeliveryPayload;
import com.dispatchqueue.core.JobRecord;
import com.dispatchqueue.engine.JobExecutor;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;

// Delivers a queued notification to the chat channel as an embed
public class MessageDeliveryExecutor implements JobExecutor<DeliveryPayload> {
    private static final int MAX_DESCRIPTION_LENGTH = 4096;
    private static final int MAX_FIELD_LENGTH = 1024;

    private final ChatClient chatClient;
    private final String channelId;

    public MessageDeliveryExecutor(ChatClient chatClient, String channelId) {
        this.chatClient = chatClient;
        this.channelId = channelId;
    }

    @Override
    public String execute(JobRecord<DeliveryPayload> job) throws Exception {
        return chatClient.send(channelId, buildEmbed(job));
    }

    /**
     * Build the embed for one delivery attempt: colour by severity, the title (or source when
     * untitled), the message, the source as footer, metadata as inline fields and, on
     * retries, the attempt counter.
     */
    JSONObject buildEmbed(JobRecord<DeliveryPayload> job) {
        DeliveryPayload payload = job.getPayload();
        String title = payload.getTitle() != null && !payload.getTitle().isBlank()
                ? payload.getTitle()
                : payload.getSource();

        JSONObject embed = new JSONObject();
        embed.put("color", payload.getSeverity().getColor());
        embed.put("title", title);
        embed.put("description", truncate(payload.getMessage(), MAX_DESCRIPTION_LENGTH));
        embed.put("footer", new JSONObject().put("text", payload.getSource()));
        if (job.getCreatedAt() != null) {
            embed.put("timestamp", job.getCreatedAt().toString());
        }

        JSONArray fields = new JSONArray();
        for (Map.Entry<String, Object> entry : payload.getMetadata().entrySet()) {
            fields.put(field(entry.getKey(), String.valueOf(entry.getValue())));
        }
        if (job.getRetryCount() > 0) {
            fields.put(field("Retry Info", "Attempt " + (job.getRetryCount() + 1) + "/" + (job.getMaxRetries() + 1)));
        }
        if (!fields.isEmpty()) {
            embed.put("fields", fields);
        }
        return embed;
    }

    private static JSONObject field(String name, String value) {
        return new JSONObject()
                .put("name", name)
                .put("value", truncate(value, MAX_FIELD_LENGTH))
                .put("inline", true);
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }
}
