package com.dispatchqueue.client;

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
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class HomeAssistantClientTest {

    private static final String TOKEN = "long-lived-token";

    private HttpServer server;
    private String baseUrl;

    private final AtomicInteger triggerStatus = new AtomicInteger(200);
    private final List<String> triggered = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();

    @BeforeEach
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/services/automation/trigger", this::handleTrigger);
        server.createContext("/api/", this::handleStatus);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    public void tearDown() {
        server.stop(0);
    }

    private void handleTrigger(HttpExchange exchange) throws IOException {
        authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
        JSONObject body = new JSONObject(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        if (triggerStatus.get() == 200) {
            triggered.add(body.getString("entity_id"));
            respond(exchange, 200, "[]");
        } else {
            respond(exchange, triggerStatus.get(), "{\"message\":\"Service not found.\"}");
        }
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        String auth = exchange.getRequestHeaders().getFirst("Authorization");
        if (("Bearer " + TOKEN).equals(auth)) {
            respond(exchange, 200, "{\"message\":\"API running.\"}");
        } else {
            respond(exchange, 401, "401: Unauthorized");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    public void testTriggerAutomationPostsEntityId() throws Exception {
        HomeAssistantClient client = new HomeAssistantClient(baseUrl + "/", TOKEN, 2000);
        assertEquals(baseUrl, client.getBaseUrl());

        client.triggerAutomation("automation.porch_lights");

        assertEquals(List.of("automation.porch_lights"), triggered);
        assertEquals(List.of("Bearer " + TOKEN), authHeaders);
    }

    @Test
    public void testTriggerFailureCarriesApiMessage() {
        triggerStatus.set(400);
        HomeAssistantClient client = new HomeAssistantClient(baseUrl, TOKEN, 2000);

        IOException error = assertThrows(IOException.class, () -> client.triggerAutomation("automation.missing"));
        assertEquals("Failed to trigger automation automation.missing: Service not found.", error.getMessage());
    }

    @Test
    public void testValidateConnection() {
        assertTrue(new HomeAssistantClient(baseUrl, TOKEN, 2000).validateConnection());
        assertFalse(new HomeAssistantClient(baseUrl, "wrong", 2000).validateConnection());
    }

    @Test
    public void testValidateConnectionWhenUnreachable() {
        server.stop(0);
        assertFalse(new HomeAssistantClient(baseUrl, TOKEN, 500).validateConnection());
    }

    @Test
    public void testSettingsAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> new HomeAssistantClient("", TOKEN, 1000));
        assertThrows(IllegalArgumentException.class, () -> new HomeAssistantClient(baseUrl, null, 1000));
    }
}
