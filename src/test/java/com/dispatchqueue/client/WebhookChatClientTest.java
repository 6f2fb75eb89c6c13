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
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class WebhookChatClientTest {

    private HttpServer server;
    private String baseUrl;

    private final AtomicInteger responseStatus = new AtomicInteger(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>("{\"id\":\"1122334455\"}");
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<JSONObject> lastBody = new AtomicReference<>();

    @BeforeEach
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/webhooks/123/token", this::handle);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/webhooks/123/token";
    }

    @AfterEach
    public void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastQuery.set(exchange.getRequestURI().getQuery());
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        lastBody.set(new JSONObject(body));

        byte[] response = responseBody.get().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(responseStatus.get(), response.length == 0 ? -1 : response.length);
        if (response.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        }
        exchange.close();
    }

    @Test
    public void testSendPostsEmbedAndReturnsMessageId() throws Exception {
        WebhookChatClient client = new WebhookChatClient(baseUrl);
        JSONObject embed = new JSONObject().put("title", "Deploy").put("description", "done");

        String receipt = client.send("chan-1", embed);

        assertEquals("1122334455", receipt);
        assertEquals("wait=true", lastQuery.get());
        JSONObject sent = lastBody.get();
        assertEquals(1, sent.getJSONArray("embeds").length());
        assertEquals("Deploy", sent.getJSONArray("embeds").getJSONObject(0).getString("title"));
    }

    @Test
    public void testExistingQueryStringIsKept() throws Exception {
        WebhookChatClient client = new WebhookChatClient(baseUrl + "?thread_id=9");
        client.send(null, new JSONObject().put("description", "x"));
        assertEquals("thread_id=9&wait=true", lastQuery.get());
    }

    @Test
    public void testRejectedMessageRaisesIOException() {
        responseStatus.set(400);
        responseBody.set("{\"message\":\"Invalid Form Body\",\"code\":50035}");
        WebhookChatClient client = new WebhookChatClient(baseUrl);

        IOException error = assertThrows(IOException.class,
                () -> client.send("chan-1", new JSONObject().put("description", "x")));
        assertEquals("Chat webhook rejected message (HTTP 400): Invalid Form Body", error.getMessage());
    }

    @Test
    public void testNoContentResponseHasNoReceipt() throws Exception {
        responseStatus.set(204);
        responseBody.set("");
        WebhookChatClient client = new WebhookChatClient(baseUrl);
        assertNull(client.send("chan-1", new JSONObject().put("description", "x")));
    }

    @Test
    public void testUnreachableWebhookRaisesIOException() {
        server.stop(0);
        WebhookChatClient client = new WebhookChatClient(baseUrl, 500);
        assertThrows(IOException.class, () -> client.send("chan-1", new JSONObject().put("description", "x")));
    }

    @Test
    public void testWebhookUrlIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new WebhookChatClient(" "));
        assertThrows(IllegalArgumentException.class, () -> new WebhookChatClient(null));
    }
}
