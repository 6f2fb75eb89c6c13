package com.dispatchqueue.jobs;

import com.dispatchqueue.client.AutomationClient;
import com.dispatchqueue.core.JobRecord;
import com.dispatchqueue.core.TriggerPayload;
import com.dispatchqueue.engine.JobExecutor;

import java.util.logging.Logger;

/**
 * Fires the requested automation. There is no receipt; success is the API accepting the call.
 */
public class AutomationTriggerExecutor implements JobExecutor<TriggerPayload> {
    private static final Logger logger = Logger.getLogger(AutomationTriggerExecutor.class.getName());

    private final AutomationClient automationClient;

    public AutomationTriggerExecutor(AutomationClient automationClient) {
        this.automationClient = automationClient;
    }

    @Override
    public String execute(JobRecord<TriggerPayload> job) throws Exception {
        TriggerPayload payload = job.getPayload();
        logger.info("Triggering automation " + payload.getDisplayName() + " for " + payload.getRequestedBy()
                + " (trigger #" + job.getId() + ")");
        automationClient.triggerAutomation(payload.getAutomationId());
        return null;
    }
}
