package com.dispatchqueue.db;

import com.dispatchqueue.core.TriggerPayload;
import com.dispatchqueue.time.TimeResolver;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

// Store for remote automation triggers (automation_triggers table)
public class AutomationTriggerStore extends JdbcJobStore<TriggerPayload> {

    private static final List<String> COLUMNS =
            List.of("automation_id", "automation_name", "requested_by", "notify_on_complete");

    public AutomationTriggerStore(Database database, TimeResolver timeResolver, int defaultMaxRetries) {
        super(database, timeResolver, defaultMaxRetries);
    }

    @Override
    public String getName() {
        return "automation";
    }

    @Override
    protected String tableName() {
        return "automation_triggers";
    }

    @Override
    protected List<String> payloadColumns() {
        return COLUMNS;
    }

    @Override
    protected void validate(TriggerPayload payload) {
        requireText(payload.getAutomationId(), "automationId");
        requireText(payload.getRequestedBy(), "requestedBy");
    }

    @Override
    protected void bindPayload(PreparedStatement stmt, int startIndex, TriggerPayload payload) throws SQLException {
        stmt.setString(startIndex, payload.getAutomationId());
        stmt.setString(startIndex + 1, payload.getAutomationName());
        stmt.setString(startIndex + 2, payload.getRequestedBy());
        stmt.setBoolean(startIndex + 3, payload.isNotifyOnComplete());
    }

    @Override
    protected TriggerPayload mapPayload(ResultSet rs) throws SQLException {
        TriggerPayload payload = new TriggerPayload(rs.getString("automation_id"), rs.getString("requested_by"));
        payload.setAutomationName(rs.getString("automation_name"));
        payload.setNotifyOnComplete(rs.getBoolean("notify_on_complete"));
        return payload;
    }
}
