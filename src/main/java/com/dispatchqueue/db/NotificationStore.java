package com.dispatchqueue.db;

import com.dispatchqueue.core.DeliveryPayload;
import com.dispatchqueue.core.Severity;
import com.dispatchqueue.time.TimeResolver;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Store for chat notification deliveries ({@code notifications} table).
 * Metadata is kept as a JSON object in a text column.
 */
public class NotificationStore extends JdbcJobStore<DeliveryPayload> {
    private static final Logger logger = Logger.getLogger(NotificationStore.class.getName());

    // Shared Gson instance for metadata serialization - thread-safe
    private static final Gson gson = new Gson();
    private static final Type METADATA_TYPE = new TypeToken<Map<String, Object>>() { }.getType();

    private static final List<String> COLUMNS = List.of("source", "title", "message", "severity", "metadata");

    public NotificationStore(Database database, TimeResolver timeResolver, int defaultMaxRetries) {
        super(database, timeResolver, defaultMaxRetries);
    }

    @Override
    public String getName() {
        return "notification";
    }

    @Override
    protected String tableName() {
        return "notifications";
    }

    @Override
    protected List<String> payloadColumns() {
        return COLUMNS;
    }

    @Override
    protected void validate(DeliveryPayload payload) {
        requireText(payload.getSource(), "source");
        requireText(payload.getMessage(), "message");
    }

    @Override
    protected void bindPayload(PreparedStatement stmt, int startIndex, DeliveryPayload payload) throws SQLException {
        int index = startIndex;
        stmt.setString(index++, payload.getSource());
        stmt.setString(index++, payload.getTitle());
        stmt.setString(index++, payload.getMessage());
        stmt.setString(index++, payload.getSeverity().name());
        Map<String, Object> metadata = payload.getMetadata();
        stmt.setString(index, metadata.isEmpty() ? null : gson.toJson(metadata));
    }

    @Override
    protected DeliveryPayload mapPayload(ResultSet rs) throws SQLException {
        DeliveryPayload payload = new DeliveryPayload(rs.getString("source"), rs.getString("message"));
        payload.setTitle(rs.getString("title"));
        payload.setSeverity(Severity.fromString(rs.getString("severity")));
        payload.setMetadata(parseMetadata(rs.getLong("id"), rs.getString("metadata")));
        return payload;
    }

    private Map<String, Object> parseMetadata(long id, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return gson.fromJson(json, METADATA_TYPE);
        } catch (JsonParseException e) {
            // A corrupt metadata column must not make the job unreadable
            logger.log(Level.WARNING, "Unreadable metadata on notification " + id + ", ignoring it", e);
            return null;
        }
    }
}
