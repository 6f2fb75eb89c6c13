package com.dispatchqueue.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of a chat notification delivery job.
 *
 * <p>{@code source} and {@code message} are required; everything else is optional.</p>
 */
public class DeliveryPayload implements JobPayload {
    private String source;
    private String title;
    private String message;
    private Severity severity = Severity.INFO;
    private Map<String, Object> metadata;

    public DeliveryPayload() {
    }

    public DeliveryPayload(String source, String message) {
        this.source = source;
        this.message = message;
    }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public Severity getSeverity() { return severity; }
    public void setSeverity(Severity severity) { this.severity = severity == null ? Severity.INFO : severity; }

    public Map<String, Object> getMetadata() {
        return metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(metadata);
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
    }

    @Override
    public String describe() {
        return "notification from \"" + source + "\"";
    }

    @Override
    public String toString() {
        return "DeliveryPayload{source='" + source + "', severity=" + severity + "}";
    }
}
