package com.dispatchqueue.jobs;

import com.dispatchqueue.core.DeliveryPayload;
import com.dispatchqueue.core.JobRecord;
import com.dispatchqueue.core.JobStatus;
import com.dispatchqueue.core.Severity;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MessageDeliveryExecutorTest {

    private final List<String> channels = new ArrayList<>();
    private final List<JSONObject> sent = new ArrayList<>();

    private final MessageDeliveryExecutor executor = new MessageDeliveryExecutor((channelId, embed) -> {
        channels.add(channelId);
        sent.add(embed);
        return "msg-" + sent.size();
    }, "alerts");

    private static JobRecord<DeliveryPayload> job(DeliveryPayload payload) {
        JobRecord<DeliveryPayload> job = new JobRecord<>();
        job.setId(12);
        job.setStatus(JobStatus.PROCESSING);
        job.setCreatedAt(Instant.parse("2026-03-10T12:00:00Z"));
        job.setScheduledFor(job.getCreatedAt());
        job.setMaxRetries(3);
        job.setPayload(payload);
        return job;
    }

    @Test
    public void testExecuteSendsEmbedToChannel() throws Exception {
        DeliveryPayload payload = new DeliveryPayload("backup", "Nightly backup finished");
        payload.setTitle("Backup");

        String receipt = executor.execute(job(payload));

        assertEquals("msg-1", receipt);
        assertEquals(List.of("alerts"), channels);
        JSONObject embed = sent.get(0);
        assertEquals("Backup", embed.getString("title"));
        assertEquals("Nightly backup finished", embed.getString("description"));
        assertEquals(Severity.INFO.getColor(), embed.getInt("color"));
        assertEquals("backup", embed.getJSONObject("footer").getString("text"));
        assertEquals("2026-03-10T12:00:00Z", embed.getString("timestamp"));
        assertFalse(embed.has("fields"));
    }

    @Test
    public void testTitleFallsBackToSourceAndSeveritySetsColour() {
        DeliveryPayload payload = new DeliveryPayload("monitor", "Disk almost full");
        payload.setSeverity(Severity.ERROR);

        JSONObject embed = executor.buildEmbed(job(payload));

        assertEquals("monitor", embed.getString("title"));
        assertEquals(0xe74c3c, embed.getInt("color"));
    }

    @Test
    public void testMetadataAndRetryInfoBecomeFields() {
        DeliveryPayload payload = new DeliveryPayload("ci", "Build failed");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("branch", "main");
        metadata.put("attempt", 2);
        payload.setMetadata(metadata);
        JobRecord<DeliveryPayload> job = job(payload);
        job.setRetryCount(1);

        JSONArray fields = executor.buildEmbed(job).getJSONArray("fields");

        assertEquals(3, fields.length());
        assertEquals("branch", fields.getJSONObject(0).getString("name"));
        assertEquals("main", fields.getJSONObject(0).getString("value"));
        assertTrue(fields.getJSONObject(0).getBoolean("inline"));
        assertEquals("2", fields.getJSONObject(1).getString("value"));
        assertEquals("Retry Info", fields.getJSONObject(2).getString("name"));
        assertEquals("Attempt 2/4", fields.getJSONObject(2).getString("value"));
    }

    @Test
    public void testLongMessageIsTruncated() {
        DeliveryPayload payload = new DeliveryPayload("logs", "x".repeat(5000));
        String description = executor.buildEmbed(job(payload)).getString("description");
        assertEquals(4096, description.length());
        assertTrue(description.endsWith("..."));
    }

    @Test
    public void testClientFailurePropagates() {
        MessageDeliveryExecutor failing = new MessageDeliveryExecutor((channelId, embed) -> {
            throw new IOException("Chat webhook rejected message (HTTP 429): rate limited");
        }, "alerts");

        IOException error = assertThrows(IOException.class,
                () -> failing.execute(job(new DeliveryPayload("ci", "hello"))));
        assertTrue(error.getMessage().contains("429"));
    }
}
