package com.dispatchqueue.app;

import com.dispatchqueue.core.DeliveryPayload;
import com.dispatchqueue.core.JobInput;
import com.dispatchqueue.core.JobStatus;
import com.dispatchqueue.core.TriggerPayload;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private HttpServer fakeServices;
    private String servicesUrl;
    private final List<JSONObject> chatMessages = new CopyOnWriteArrayList<>();
    private final List<String> triggered = new CopyOnWriteArrayList<>();

    @BeforeEach
    public void setUp() throws IOException {
        fakeServices = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        fakeServices.createContext("/webhook", exchange -> {
            JSONObject body = new JSONObject(readBody(exchange));
            chatMessages.add(body.getJSONArray("embeds").getJSONObject(0));
            respond(exchange, 200, new JSONObject().put("id", "m" + chatMessages.size()).toString());
        });
        fakeServices.createContext("/api/", exchange -> {
            readBody(exchange);
            respond(exchange, 200, "{\"message\":\"API running.\"}");
        });
        fakeServices.createContext("/api/services/automation/trigger", exchange -> {
            triggered.add(new JSONObject(readBody(exchange)).getString("entity_id"));
            respond(exchange, 200, "[]");
        });
        fakeServices.start();
        servicesUrl = "http://127.0.0.1:" + fakeServices.getAddress().getPort();
    }

    @AfterEach
    public void tearDown() {
        Main.shutdown();
        fakeServices.stop(0);
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private Properties baseProperties() {
        Properties properties = new Properties();
        properties.setProperty("db.url", "jdbc:h2:mem:main-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        properties.setProperty("db.poolSize", "4");
        properties.setProperty("queue.schedulerIntervalSeconds", "3600");
        properties.setProperty("queue.shutdownTimeoutSeconds", "5");
        properties.setProperty("stats.port", "0");
        properties.setProperty("chat.webhookUrl", servicesUrl + "/webhook");
        properties.setProperty("chat.channelId", "alerts");
        return properties;
    }

    private static boolean waitForStatus(Check check) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            if (check.done()) {
                return true;
            }
            Thread.sleep(50);
        }
        return check.done();
    }

    private interface Check {
        boolean done() throws SQLException;
    }

    @Test
    public void testNotificationFlowWithoutAutomation() throws Exception {
        Main.start(DispatchConfig.fromProperties(baseProperties(), name -> null), Clock.systemUTC());

        assertNull(Main.getAutomationQueue(), "automation queue needs HA settings");
        assertTrue(Main.getScheduler().isActive());
        assertTrue(Main.getStatsServer().getPort() > 0);

        DeliveryPayload payload = new DeliveryPayload("deploy-bot", "Release 1.4 is live");
        long id = Main.getNotificationQueue().enqueue(JobInput.of(payload));

        assertTrue(waitForStatus(() -> Main.getNotificationQueue().get(id).getStatus() == JobStatus.DONE));
        assertEquals("m1", Main.getNotificationQueue().get(id).getReceipt());
        assertEquals("Release 1.4 is live", chatMessages.get(0).getString("description"));
    }

    @Test
    public void testAutomationFlowPostsCompletionMessage() throws Exception {
        Properties properties = baseProperties();
        properties.setProperty("ha.url", servicesUrl);
        properties.setProperty("ha.accessToken", "token");
        properties.setProperty("stats.port", "-1");
        Main.start(DispatchConfig.fromProperties(properties, name -> null), Clock.systemUTC());

        assertNull(Main.getStatsServer());
        TriggerPayload payload = new TriggerPayload("automation.porch_lights", "user-7");
        payload.setNotifyOnComplete(true);
        long id = Main.getAutomationQueue().enqueue(JobInput.of(payload));

        assertTrue(waitForStatus(() -> !chatMessages.isEmpty()));
        assertEquals(JobStatus.DONE, Main.getAutomationQueue().get(id).getStatus());
        assertEquals(List.of("automation.porch_lights"), triggered);
        assertEquals(Main.AUTOMATION_SUCCESS_TITLE, chatMessages.get(0).getString("title"));
    }

    @Test
    public void testStartupRequiresChatWebhook() {
        Properties properties = baseProperties();
        properties.remove("chat.webhookUrl");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> Main.start(DispatchConfig.fromProperties(properties, name -> null), Clock.systemUTC()));
        assertTrue(error.getMessage().contains("CHAT_WEBHOOK_URL"));
    }
}
