package com.dispatchqueue.app;

import com.dispatchqueue.core.QueueStats;
import com.dispatchqueue.engine.JobQueue;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

// HTTP server exposing per-queue stats as JSON on GET /stats
public class StatsServer {
    private static final Logger logger = Logger.getLogger(StatsServer.class.getName());

    private final List<JobQueue<?>> queues;
    private final int port;
    private final long startTime;
    private HttpServer server;
    private ExecutorService executor;

    // Port 0 binds an ephemeral port, see getPort()
    public StatsServer(List<JobQueue<?>> queues, int port) {
        this.queues = List.copyOf(queues);
        this.port = port;
        this.startTime = System.currentTimeMillis();
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/stats", new StatsHandler());
        executor = Executors.newFixedThreadPool(2);
        server.setExecutor(executor);
        server.start();

        logger.info("Stats endpoint: http://localhost:" + getPort() + "/stats");
    }

    public void stop() {
        if (server != null) {
            server.stop(1);
            executor.shutdown();
            server = null;
            logger.info("Stats server stopped");
        }
    }

    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    JSONObject buildStats() throws SQLException {
        JSONObject queuesJson = new JSONObject();
        for (JobQueue<?> queue : queues) {
            QueueStats stats = queue.stats();
            JSONObject queueJson = new JSONObject(stats.toMap());
            queueJson.put("queue_size", queue.getQueueSize());
            queuesJson.put(queue.getName(), queueJson);
        }
        return new JSONObject()
                .put("queues", queuesJson)
                .put("uptime_seconds", (System.currentTimeMillis() - startTime) / 1000);
    }

    private class StatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                send(exchange, 405, error("Method Not Allowed"));
                return;
            }

            try {
                send(exchange, 200, buildStats());
                logger.fine("Served stats request");
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Failed to fetch queue stats", e);
                send(exchange, 500, error("Internal Server Error: " + e.getMessage()));
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error handling stats request", e);
                send(exchange, 500, error("Internal Server Error"));
            }
        }

        private JSONObject error(String message) {
            return new JSONObject().put("error", message);
        }

        private void send(HttpExchange exchange, int statusCode, JSONObject body) throws IOException {
            byte[] response = body.toString().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(statusCode, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        }
    }
}
