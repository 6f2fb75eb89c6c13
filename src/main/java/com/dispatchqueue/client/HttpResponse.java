package com.dispatchqueue.client;

import org.json.JSONException;
import org.json.JSONObject;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Status and body of one JSON request made with {@link HttpURLConnection}.
 */
final class HttpResponse {
    private final int status;
    private final String body;

    private HttpResponse(int status, String body) {
        this.status = status;
        this.body = body;
    }

    static HttpResponse postJson(String url, Map<String, String> headers, JSONObject payload, int timeoutMillis)
            throws IOException {
        HttpURLConnection conn = (HttpURLConnection) new URL(url).openConnection();
        try {
            conn.setRequestMethod("POST");
            conn.setConnectTimeout(timeoutMillis);
            conn.setReadTimeout(timeoutMillis);
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json");
            for (Map.Entry<String, String> header : headers.entrySet()) {
                conn.setRequestProperty(header.getKey(), header.getValue());
            }

            byte[] bytes = payload.toString().getBytes(StandardCharsets.UTF_8);
            try (OutputStream out = conn.getOutputStream()) {
                out.write(bytes);
            }

            int status = conn.getResponseCode();
            InputStream stream = status >= 400 ? conn.getErrorStream() : conn.getInputStream();
            return new HttpResponse(status, readBody(stream));
        } catch (SocketTimeoutException e) {
            throw new IOException("Request to " + url + " timed out after " + timeoutMillis + "ms", e);
        } finally {
            conn.disconnect();
        }
    }

    static HttpResponse get(String url, Map<String, String> headers, int timeoutMillis) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) new URL(url).openConnection();
        try {
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(timeoutMillis);
            conn.setReadTimeout(timeoutMillis);
            for (Map.Entry<String, String> header : headers.entrySet()) {
                conn.setRequestProperty(header.getKey(), header.getValue());
            }
            int status = conn.getResponseCode();
            InputStream stream = status >= 400 ? conn.getErrorStream() : conn.getInputStream();
            return new HttpResponse(status, readBody(stream));
        } catch (SocketTimeoutException e) {
            throw new IOException("Request to " + url + " timed out after " + timeoutMillis + "ms", e);
        } finally {
            conn.disconnect();
        }
    }

    private static String readBody(InputStream stream) throws IOException {
        if (stream == null) {
            return "";
        }
        try (InputStream in = stream; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            in.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        }
    }

    int getStatus() {
        return status;
    }

    String getBody() {
        return body;
    }

    boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    // Body as JSON, or null when it is empty or not an object
    JSONObject json() {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            return null;
        }
    }

    /**
     * Best error text for a failed response: the JSON {@code message} field, else the raw body,
     * else the status code.
     */
    String errorMessage() {
        JSONObject json = json();
        if (json != null && json.optString("message", null) != null) {
            return json.getString("message");
        }
        if (body != null && !body.isBlank()) {
            return body.length() > 200 ? body.substring(0, 200) : body;
        }
        return "HTTP " + status;
    }
}
