package com.dispatchqueue.core;

/**
 * Payload of a remote automation trigger job.
 *
 * <p>{@code automationId} and {@code requestedBy} are required. When
 * {@code notifyOnComplete} is set the queue posts a success or failure message once the
 * trigger settles.</p>
 */
public class TriggerPayload implements JobPayload {
    private String automationId;
    private String automationName;
    private String requestedBy;
    private boolean notifyOnComplete;

    public TriggerPayload() {
    }

    public TriggerPayload(String automationId, String requestedBy) {
        this.automationId = automationId;
        this.requestedBy = requestedBy;
    }

    public String getAutomationId() { return automationId; }
    public void setAutomationId(String automationId) { this.automationId = automationId; }

    public String getAutomationName() { return automationName; }
    public void setAutomationName(String automationName) { this.automationName = automationName; }

    public String getRequestedBy() { return requestedBy; }
    public void setRequestedBy(String requestedBy) { this.requestedBy = requestedBy; }

    @Override
    public boolean isNotifyOnComplete() { return notifyOnComplete; }
    public void setNotifyOnComplete(boolean notifyOnComplete) { this.notifyOnComplete = notifyOnComplete; }

    /**
     * Display label: the friendly name followed by the entity id, or just the id.
     *
     * @return label for messages
     */
    public String getDisplayName() {
        if (automationName == null || automationName.isBlank()) {
            return automationId;
        }
        return automationName + " (" + automationId + ")";
    }

    @Override
    public String describe() {
        return "automation " + getDisplayName() + " requested by " + requestedBy;
    }

    @Override
    public String toString() {
        return "TriggerPayload{automationId='" + automationId + "', requestedBy='" + requestedBy
                + "', notifyOnComplete=" + notifyOnComplete + "}";
    }
}
